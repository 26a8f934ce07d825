package org.broadinstitute.methseg.utils.distributions;

import org.apache.commons.math3.distribution.BetaDistribution;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.apache.commons.math3.special.Gamma;
import org.broadinstitute.methseg.testutils.BaseTest;
import org.broadinstitute.methseg.utils.hmm.PairedCount;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Random;

public final class BetaBinomialEmissionUnitTest extends BaseTest {

    @DataProvider(name = "alphaBeta")
    public Object[][] alphaBeta() {
        return new Object[][] {{1, 1}, {2, 5}, {13.4, 6.6}, {0.5, 0.3}};
    }

    @Test(dataProvider = "alphaBeta")
    public void testLikelihoodIsNormalized(final double alpha, final double beta) {
        final BetaBinomialEmission emission = new BetaBinomialEmission(alpha, beta);
        for (final int total : new int[] {0, 1, 7, 30}) {
            double sum = 0;
            for (int k = 0; k <= total; k++) {
                sum += Math.exp(emission.logLikelihood(new PairedCount(k, total - k)));
            }
            Assert.assertEquals(sum, 1.0, 1e-10, "total " + total);
        }
    }

    @Test
    public void testUniformPrior() {
        // with alpha = beta = 1 every count out of n is equally likely
        final BetaBinomialEmission emission = new BetaBinomialEmission(1, 1);
        Assert.assertEquals(emission.logLikelihood(new PairedCount(3, 6)), -Math.log(10), 1e-12);
    }

    @Test(dataProvider = "alphaBeta")
    public void testInverseDigamma(final double alpha, final double beta) {
        for (final double x : new double[] {alpha, beta, alpha + beta}) {
            Assert.assertEquals(BetaBinomialEmission.inverseDigamma(Gamma.digamma(x)), x, 1e-8 * x);
        }
    }

    @Test
    public void testFitRecoversBetaParameters() {
        final RandomGenerator rng = RandomGeneratorFactory.createRandomGenerator(new Random(13));
        final BetaDistribution beta = new BetaDistribution(rng, 3, 7);
        final int n = 20000;
        final double[] logSuccess = new double[n];
        final double[] logFailure = new double[n];
        final double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            final double fraction = beta.sample();
            logSuccess[i] = Math.log(fraction);
            logFailure[i] = Math.log1p(-fraction);
            weights[i] = 1;
        }

        final BetaBinomialEmission emission = new BetaBinomialEmission(1, 1);
        emission.fit(logSuccess, logFailure, weights);
        Assert.assertEquals(emission.getAlpha(), 3, 0.3);
        Assert.assertEquals(emission.getBeta(), 7, 0.7);
    }

    @Test
    public void testZeroWeightsKeepParameters() {
        final BetaBinomialEmission emission = new BetaBinomialEmission(2, 5);
        emission.fit(new double[] {Math.log(0.5)}, new double[] {Math.log(0.5)}, new double[] {0});
        Assert.assertEquals(emission.getParameters(), new double[] {2, 5});
    }

    @Test
    public void testCopyIsIndependent() {
        final BetaBinomialEmission emission = new BetaBinomialEmission(2, 5);
        final BetaBinomialEmission copy = emission.copy();
        emission.fit(new double[] {Math.log(0.2), Math.log(0.3)}, new double[] {Math.log(0.8), Math.log(0.7)}, new double[] {1, 1});
        Assert.assertEquals(copy.getParameters(), new double[] {2, 5});
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMismatchedArrays() {
        new BetaBinomialEmission(2, 5).fit(new double[2], new double[2], new double[3]);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonPositiveAlpha() {
        new BetaBinomialEmission(0, 5);
    }
}
