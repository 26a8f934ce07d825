package org.broadinstitute.methseg.utils.hmm;

import org.broadinstitute.methseg.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class HiddenSemiMarkovModelUnitTest extends BaseTest {

    @DataProvider(name = "badResetPoints")
    public Object[][] badResetPoints() {
        return new Object[][] {
                {new int[] {0}},
                {new int[] {1, 4}},
                {new int[] {0, 3}},
                {new int[] {0, 5}},
                {new int[] {0, 2, 2, 4}},
                {new int[] {0, 3, 2, 4}}
        };
    }

    @Test(dataProvider = "badResetPoints", expectedExceptions = IllegalArgumentException.class)
    public void testBadResetPoints(final int[] resetPoints) {
        new HiddenSemiMarkovModel(SemiMarkovTestUtils.counts(1, 1, 2, 2, 3, 3, 4, 4), resetPoints,
                SemiMarkovTestUtils.parameters(3));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNoObservations() {
        new HiddenSemiMarkovModel(SemiMarkovTestUtils.counts(), new int[] {0, 0}, SemiMarkovTestUtils.parameters(3));
    }

    @Test
    public void testLogLikelihoodIsSumOverSubsequences() {
        final List<PairedCount> observations = SemiMarkovTestUtils.counts(5, 1, 1, 6, 0, 4, 3, 3, 6, 0, 2, 5);
        final SemiMarkovModelParameters parameters = SemiMarkovTestUtils.parameters(3);
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations, new int[] {0, 2, 6}, parameters);

        final SegmentalForwardBackwardAlgorithm algorithm = new SegmentalForwardBackwardAlgorithm(observations.size());
        final double expected = algorithm.forward(model.getCache(), parameters, 0, 2)
                + algorithm.forward(model.getCache(), parameters, 2, 6);
        Assert.assertEquals(model.expectationStep(), expected, 1e-10);
        for (int i = 0; i < observations.size(); i++) {
            Assert.assertEquals(model.getForegroundPosterior(i) + model.getBackgroundPosterior(i), 1.0, 1e-6);
        }
    }

    @Test
    public void testUncoveredPositionsAreAccepted() {
        final List<PairedCount> observations = SemiMarkovTestUtils.counts(5, 1, 0, 0, 1, 6);
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations, new int[] {0, 3},
                SemiMarkovTestUtils.parameters(3));
        Assert.assertTrue(Double.isFinite(model.expectationStep()));
        model.maximizationStep();
        for (final double value : model.getParameters().getForegroundEmission().getParameters()) {
            Assert.assertTrue(Double.isFinite(value) && value > 0);
        }
    }

    @Test
    public void testHighRunIsOneForegroundDomain() {
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(SemiMarkovTestUtils.counts(9, 1, 9, 1, 9, 1),
                new int[] {0, 3}, SemiMarkovTestUtils.highForegroundParameters(10));
        final PosteriorDecoding decoding = model.decode();
        Assert.assertEquals(decoding.size(), 3);
        for (int i = 0; i < 3; i++) {
            Assert.assertTrue(decoding.isForeground(i));
            Assert.assertTrue(decoding.getForegroundPosterior(i) > 0.99);
        }
    }

    @Test
    public void testLowRunIsBackground() {
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(SemiMarkovTestUtils.counts(1, 9, 1, 9, 1, 9, 1, 9),
                new int[] {0, 4}, SemiMarkovTestUtils.highForegroundParameters(10));
        final PosteriorDecoding decoding = model.decode();
        for (int i = 0; i < 4; i++) {
            Assert.assertFalse(decoding.isForeground(i));
        }
    }

    @Test
    public void testDecodingOtherObservationsLeavesModelUntouched() {
        final List<PairedCount> observations = SemiMarkovTestUtils.counts(9, 1, 9, 1, 9, 1, 1, 9);
        final SemiMarkovModelParameters parameters = SemiMarkovTestUtils.highForegroundParameters(10);
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations, new int[] {0, 4}, parameters);
        final double logLikelihood = model.expectationStep();
        final double posterior = model.getForegroundPosterior(0);

        final PosteriorDecoding other = model.decode(SemiMarkovTestUtils.counts(1, 9, 1, 9, 1, 9, 1, 9));

        Assert.assertFalse(other.isForeground(0));
        Assert.assertSame(model.getParameters(), parameters);
        Assert.assertEquals(model.getForegroundPosterior(0), posterior);
        Assert.assertEquals(model.expectationStep(), logLikelihood, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testDecodingObservationsOfAnotherLength() {
        new HiddenSemiMarkovModel(SemiMarkovTestUtils.counts(9, 1, 9, 1), new int[] {0, 2},
                SemiMarkovTestUtils.highForegroundParameters(10)).decode(SemiMarkovTestUtils.counts(9, 1));
    }

    @Test
    public void testSetParametersRebuildsLikelihoods() {
        final List<PairedCount> observations = SemiMarkovTestUtils.counts(9, 1, 9, 1, 1, 9);
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations, new int[] {0, 3},
                SemiMarkovTestUtils.parameters(3));
        final double before = model.expectationStep();
        final SemiMarkovModelParameters replacement = SemiMarkovTestUtils.highForegroundParameters(3);
        model.setParameters(replacement);

        final HiddenSemiMarkovModel expected = new HiddenSemiMarkovModel(observations, new int[] {0, 3}, replacement.copy());
        final double after = model.expectationStep();
        Assert.assertNotEquals(after, before);
        Assert.assertEquals(after, expected.expectationStep(), 1e-12);
    }

    @Test
    public void testMaximizationStepRebuildsLikelihoods() {
        final List<PairedCount> observations = SemiMarkovTestUtils.alternatingBlocks(2);
        final int[] resetPoints = {0, observations.size()};
        final SemiMarkovModelParameters initial = SemiMarkovTestUtils.startingParameters(100);
        final double[] initialForegroundEmission = initial.getForegroundEmission().getParameters().clone();
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations, resetPoints, initial);

        model.expectationStep();
        model.maximizationStep();
        Assert.assertFalse(Arrays.equals(model.getParameters().getForegroundEmission().getParameters(), initialForegroundEmission));

        final HiddenSemiMarkovModel refitted = new HiddenSemiMarkovModel(observations, resetPoints, model.getParameters().copy());
        Assert.assertEquals(model.expectationStep(), refitted.expectationStep(), 1e-9);
    }
}
