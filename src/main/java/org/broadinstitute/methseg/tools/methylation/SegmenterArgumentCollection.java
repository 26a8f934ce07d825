package org.broadinstitute.methseg.tools.methylation;

import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.methseg.utils.Utils;

import java.io.Serializable;

/**
 * Training, decoding and significance settings of {@link FindHypomethylatedRegions}.
 */
public final class SegmenterArgumentCollection implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final String MAX_ITERATIONS_LONG_NAME = "max-iterations";
    public static final String CONVERGENCE_TOLERANCE_LONG_NAME = "convergence-tolerance";
    public static final String MIN_PROBABILITY_LONG_NAME = "min-probability";
    public static final String MAX_SEGMENT_LENGTH_LONG_NAME = "max-segment-length";
    public static final String DESERT_SIZE_LONG_NAME = "desert-size";
    public static final String FDR_LONG_NAME = "fdr";
    public static final String DISABLE_FDR_FILTER_LONG_NAME = "disable-fdr-filter";
    public static final String RANDOM_SEED_LONG_NAME = "random-seed";

    public static final int DEFAULT_MAX_ITERATIONS = 10;
    public static final double DEFAULT_CONVERGENCE_TOLERANCE = 1e-10;
    public static final double DEFAULT_MIN_PROBABILITY = 1e-10;
    public static final int DEFAULT_MAX_SEGMENT_LENGTH = 300;
    public static final double DEFAULT_FDR = 0.01;

    @Argument(
            doc = "Maximum number of EM iterations.",
            fullName = MAX_ITERATIONS_LONG_NAME,
            minValue = 1,
            optional = true
    )
    public int maxIterations = DEFAULT_MAX_ITERATIONS;

    @Argument(
            doc = "Training stops when the relative increase of the log-likelihood falls below this value.",
            fullName = CONVERGENCE_TOLERANCE_LONG_NAME,
            optional = true
    )
    public double convergenceTolerance = DEFAULT_CONVERGENCE_TOLERANCE;

    @Argument(
            doc = "Probability floor of the background switch probability, also used as the termination probability.",
            fullName = MIN_PROBABILITY_LONG_NAME,
            optional = true
    )
    public double minProbability = DEFAULT_MIN_PROBABILITY;

    @Argument(
            doc = "Maximum number of sites scored as a single hypomethylated segment.",
            fullName = MAX_SEGMENT_LENGTH_LONG_NAME,
            minValue = 1,
            optional = true
    )
    public int maxSegmentLength = DEFAULT_MAX_SEGMENT_LENGTH;

    @Argument(
            doc = "Consecutive sites farther apart than this many bases are segmented independently.",
            fullName = DESERT_SIZE_LONG_NAME,
            minValue = 0,
            optional = true
    )
    public int desertSize = MethylationSiteCollection.DEFAULT_DESERT_SIZE;

    @Argument(
            doc = "False discovery rate of the reported domains.",
            fullName = FDR_LONG_NAME,
            optional = true
    )
    public double fdr = DEFAULT_FDR;

    @Argument(
            doc = "Report every domain regardless of its p-value.",
            fullName = DISABLE_FDR_FILTER_LONG_NAME,
            optional = true
    )
    public boolean disableFdrFilter = false;

    @Argument(
            doc = "Seed of the permutation used to assess significance. When absent the seed comes from the clock and the process id.",
            fullName = RANDOM_SEED_LONG_NAME,
            optional = true
    )
    public Long randomSeed = null;

    /**
     * @throws IllegalArgumentException if any setting is out of range.
     */
    public void validate() {
        Utils.validateArg(maxIterations > 0, () -> MAX_ITERATIONS_LONG_NAME + " must be positive: " + maxIterations);
        Utils.validateArg(Double.isFinite(convergenceTolerance) && convergenceTolerance >= 0,
                () -> CONVERGENCE_TOLERANCE_LONG_NAME + " must be a non-negative number: " + convergenceTolerance);
        Utils.validateArg(minProbability > 0 && minProbability < 0.5,
                () -> MIN_PROBABILITY_LONG_NAME + " must be in (0, 0.5): " + minProbability);
        Utils.validateArg(maxSegmentLength > 0, () -> MAX_SEGMENT_LENGTH_LONG_NAME + " must be positive: " + maxSegmentLength);
        Utils.validateArg(desertSize >= 0, () -> DESERT_SIZE_LONG_NAME + " cannot be negative: " + desertSize);
        Utils.validateArg(!Double.isNaN(fdr), FDR_LONG_NAME + " must be a number");
    }
}
