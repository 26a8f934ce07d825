package org.broadinstitute.methseg.tools.methylation;

import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.methseg.utils.distributions.BetaBinomialEmission;
import org.broadinstitute.methseg.utils.distributions.GeometricDuration;
import org.broadinstitute.methseg.utils.distributions.NegativeBinomialDuration;
import org.broadinstitute.methseg.utils.hmm.SemiMarkovModelParameters;
import org.broadinstitute.methseg.utils.param.ParamUtils;

/**
 * Starting point of training when no parameter file is given.
 *
 * <p>Foreground sites are hypomethylated: about a third of their reads are methylated, against two thirds in the
 * background. The beta-binomial pseudo-counts add up to the mean coverage. Foreground runs last about 50 sites and
 * background runs about 500.</p>
 */
public final class InitialModelParameters {

    static final double FOREGROUND_METHYLATED_FRACTION = 0.33;
    static final double BACKGROUND_METHYLATED_FRACTION = 0.67;
    static final double FOREGROUND_DURATION_R = 1;
    static final double FOREGROUND_DURATION_P = 0.02;
    static final double BACKGROUND_SWITCH_PROBABILITY = 0.002;
    static final double START_PROBABILITY = 0.5;

    private InitialModelParameters() {}

    /**
     * @param meanCoverage average read coverage of the sites; raised to 1 when lower.
     */
    public static SemiMarkovModelParameters create(final double meanCoverage, final int maxSegmentLength,
                                                   final double minProbability) {
        ParamUtils.isPositiveOrZero(meanCoverage, "the mean coverage cannot be negative");
        final double n = FastMath.max(meanCoverage, 1);
        return new SemiMarkovModelParameters(
                new BetaBinomialEmission(FOREGROUND_METHYLATED_FRACTION * n, (1 - FOREGROUND_METHYLATED_FRACTION) * n),
                new BetaBinomialEmission(BACKGROUND_METHYLATED_FRACTION * n, (1 - BACKGROUND_METHYLATED_FRACTION) * n),
                new NegativeBinomialDuration(FOREGROUND_DURATION_R, FOREGROUND_DURATION_P),
                new GeometricDuration(BACKGROUND_SWITCH_PROBABILITY),
                START_PROBABILITY, START_PROBABILITY,
                minProbability, minProbability,
                maxSegmentLength, minProbability);
    }
}
