package org.broadinstitute.methseg.utils.distributions;

import org.apache.commons.math3.special.Beta;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.CombinatoricsUtils;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.hmm.EmissionModel;
import org.broadinstitute.methseg.utils.hmm.PairedCount;
import org.broadinstitute.methseg.utils.param.ParamUtils;

/**
 * Beta-binomial distribution of the successes among the total count of a {@link PairedCount}.
 *
 * <p>The weighted fit is the maximum-likelihood estimate of a Beta distribution over the per-position success
 * fractions, found with Minka's fixed-point iteration
 * {@code alpha = digamma^-1(digamma(alpha + beta) + E[log p])} and likewise for {@code beta}.</p>
 */
public final class BetaBinomialEmission implements EmissionModel {

    private static final Logger logger = LogManager.getLogger(BetaBinomialEmission.class);

    public static final String FAMILY_NAME = "BetaBinomial";
    public static final String ALPHA_NAME = "alpha";
    public static final String BETA_NAME = "beta";

    static final int MAX_FIXED_POINT_ITERATIONS = 1000;
    static final double FIXED_POINT_RELATIVE_TOLERANCE = 1e-8;
    private static final int INVERSE_DIGAMMA_NEWTON_STEPS = 5;
    private static final double EULER_MASCHERONI = 0.5772156649015329;

    private double alpha;
    private double beta;

    public BetaBinomialEmission(final double alpha, final double beta) {
        this.alpha = ParamUtils.isPositive(alpha, "alpha must be positive");
        this.beta = ParamUtils.isPositive(beta, "beta must be positive");
    }

    @Override
    public double logLikelihood(final PairedCount observation) {
        Utils.nonNull(observation);
        final int successes = observation.getSuccesses();
        final int failures = observation.getFailures();
        return CombinatoricsUtils.binomialCoefficientLog(successes + failures, successes)
                + Beta.logBeta(alpha + successes, beta + failures)
                - Beta.logBeta(alpha, beta);
    }

    @Override
    public void fit(final double[] logSuccessProbabilities, final double[] logFailureProbabilities, final double[] weights) {
        Utils.nonNull(logSuccessProbabilities);
        Utils.nonNull(logFailureProbabilities);
        Utils.nonNull(weights);
        Utils.validateArg(logSuccessProbabilities.length == weights.length && logFailureProbabilities.length == weights.length,
                "the log-probability and weight arrays must have the same length");

        double totalWeight = 0;
        double weightedLogSuccess = 0;
        double weightedLogFailure = 0;
        for (int i = 0; i < weights.length; i++) {
            totalWeight += weights[i];
            weightedLogSuccess += weights[i] * logSuccessProbabilities[i];
            weightedLogFailure += weights[i] * logFailureProbabilities[i];
        }
        if (!(totalWeight > 0)) {
            return;
        }
        final double meanLogSuccess = weightedLogSuccess / totalWeight;
        final double meanLogFailure = weightedLogFailure / totalWeight;

        double newAlpha = alpha;
        double newBeta = beta;
        for (int iteration = 0; iteration < MAX_FIXED_POINT_ITERATIONS; iteration++) {
            final double digammaSum = Gamma.digamma(newAlpha + newBeta);
            final double nextAlpha = inverseDigamma(digammaSum + meanLogSuccess);
            final double nextBeta = inverseDigamma(digammaSum + meanLogFailure);
            final boolean converged = FastMath.abs(nextAlpha - newAlpha) <= FIXED_POINT_RELATIVE_TOLERANCE * newAlpha
                    && FastMath.abs(nextBeta - newBeta) <= FIXED_POINT_RELATIVE_TOLERANCE * newBeta;
            newAlpha = nextAlpha;
            newBeta = nextBeta;
            if (converged) {
                break;
            }
        }
        if (Double.isFinite(newAlpha) && Double.isFinite(newBeta) && newAlpha > 0 && newBeta > 0) {
            alpha = newAlpha;
            beta = newBeta;
        } else {
            logger.warn(String.format("Beta-binomial fit produced unusable parameters (%s, %s); keeping (%s, %s)",
                    newAlpha, newBeta, alpha, beta));
        }
    }

    /**
     * Solves {@code digamma(x) = y} with Newton steps from Minka's initial guess.
     */
    static double inverseDigamma(final double y) {
        double x = y >= -2.22 ? FastMath.exp(y) + 0.5 : -1 / (y + EULER_MASCHERONI);
        for (int i = 0; i < INVERSE_DIGAMMA_NEWTON_STEPS; i++) {
            x -= (Gamma.digamma(x) - y) / Gamma.trigamma(x);
        }
        return x;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getBeta() {
        return beta;
    }

    @Override
    public double[] getParameters() {
        return new double[] {alpha, beta};
    }

    @Override
    public String[] getParameterNames() {
        return new String[] {ALPHA_NAME, BETA_NAME};
    }

    @Override
    public String getFamilyName() {
        return FAMILY_NAME;
    }

    @Override
    public BetaBinomialEmission copy() {
        return new BetaBinomialEmission(alpha, beta);
    }

    @Override
    public String toString() {
        return String.format("%s(%s=%.4g, %s=%.4g)", FAMILY_NAME, ALPHA_NAME, alpha, BETA_NAME, beta);
    }
}
