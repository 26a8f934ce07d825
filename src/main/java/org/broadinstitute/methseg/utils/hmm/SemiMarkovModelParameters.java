package org.broadinstitute.methseg.utils.hmm;

import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.param.ParamUtils;

/**
 * Parameters of the two-state hidden semi-Markov model.
 *
 * <p>The foreground state has an explicit {@link DurationModel}; a foreground run is always followed by background.
 * The background state leaves itself with the probability given by the first parameter of its duration model, which
 * is clamped to {@code [minProbability, 1 - minProbability]} before taking logs.</p>
 *
 * <p>Start and termination probabilities are fixed; only emissions and durations are re-estimated.</p>
 */
public final class SemiMarkovModelParameters {

    private final EmissionModel foregroundEmission;
    private final EmissionModel backgroundEmission;
    private final DurationModel foregroundDuration;
    private final DurationModel backgroundDuration;

    private final double[] startAndTerminationProbabilities;

    private final double logStartForeground;
    private final double logStartBackground;
    private final double logTerminateForeground;
    private final double logTerminateBackground;

    private final int maxSegmentLength;
    private final double minProbability;

    /**
     * @param startForeground probability that a subsequence starts in foreground.
     * @param startBackground probability that a subsequence starts in background.
     * @param terminateForeground probability of ending a subsequence from foreground.
     * @param terminateBackground probability of ending a subsequence from background.
     * @param maxSegmentLength the longest foreground segment scored as a single segment.
     * @param minProbability floor applied to the background switch probability.
     */
    public SemiMarkovModelParameters(final EmissionModel foregroundEmission,
                                     final EmissionModel backgroundEmission,
                                     final DurationModel foregroundDuration,
                                     final DurationModel backgroundDuration,
                                     final double startForeground,
                                     final double startBackground,
                                     final double terminateForeground,
                                     final double terminateBackground,
                                     final int maxSegmentLength,
                                     final double minProbability) {
        this.foregroundEmission = Utils.nonNull(foregroundEmission, "the foreground emission cannot be null");
        this.backgroundEmission = Utils.nonNull(backgroundEmission, "the background emission cannot be null");
        this.foregroundDuration = Utils.nonNull(foregroundDuration, "the foreground duration cannot be null");
        this.backgroundDuration = Utils.nonNull(backgroundDuration, "the background duration cannot be null");
        this.startAndTerminationProbabilities = new double[] {startForeground, startBackground, terminateForeground, terminateBackground};
        this.logStartForeground = FastMath.log(ParamUtils.inRange(startForeground, 0, 1, "the start-in-foreground probability must be in [0, 1]"));
        this.logStartBackground = FastMath.log(ParamUtils.inRange(startBackground, 0, 1, "the start-in-background probability must be in [0, 1]"));
        this.logTerminateForeground = FastMath.log(ParamUtils.inRange(terminateForeground, 0, 1, "the foreground termination probability must be in [0, 1]"));
        this.logTerminateBackground = FastMath.log(ParamUtils.inRange(terminateBackground, 0, 1, "the background termination probability must be in [0, 1]"));
        this.maxSegmentLength = ParamUtils.isPositive(maxSegmentLength, "the maximum segment length must be positive");
        this.minProbability = ParamUtils.inRange(minProbability, 0, 0.5, "the minimum probability must be in [0, 0.5]");
    }

    /**
     * @return a deep copy: emission and duration models are copied too.
     */
    public SemiMarkovModelParameters copy() {
        return new SemiMarkovModelParameters(foregroundEmission.copy(), backgroundEmission.copy(),
                foregroundDuration.copy(), backgroundDuration.copy(),
                startAndTerminationProbabilities[0], startAndTerminationProbabilities[1],
                startAndTerminationProbabilities[2], startAndTerminationProbabilities[3],
                maxSegmentLength, minProbability);
    }

    public EmissionModel getForegroundEmission() {
        return foregroundEmission;
    }

    public EmissionModel getBackgroundEmission() {
        return backgroundEmission;
    }

    public DurationModel getForegroundDuration() {
        return foregroundDuration;
    }

    public DurationModel getBackgroundDuration() {
        return backgroundDuration;
    }

    public double getLogStartForeground() {
        return logStartForeground;
    }

    public double getLogStartBackground() {
        return logStartBackground;
    }

    public double getLogTerminateForeground() {
        return logTerminateForeground;
    }

    public double getLogTerminateBackground() {
        return logTerminateBackground;
    }

    public double getStartForeground() {
        return startAndTerminationProbabilities[0];
    }

    public double getStartBackground() {
        return startAndTerminationProbabilities[1];
    }

    public double getTerminateForeground() {
        return startAndTerminationProbabilities[2];
    }

    public double getTerminateBackground() {
        return startAndTerminationProbabilities[3];
    }

    public int getMaxSegmentLength() {
        return maxSegmentLength;
    }

    public double getMinProbability() {
        return minProbability;
    }

    /**
     * @return log-probability of entering foreground from a background position.
     */
    public double getLogSwitchToForeground() {
        return FastMath.log(switchProbability());
    }

    /**
     * @return log-probability of staying in background.
     */
    public double getLogBackgroundSelfTransition() {
        return FastMath.log1p(-switchProbability());
    }

    private double switchProbability() {
        final double p = backgroundDuration.getParameters()[0];
        return FastMath.min(FastMath.max(p, minProbability), 1 - minProbability);
    }
}
