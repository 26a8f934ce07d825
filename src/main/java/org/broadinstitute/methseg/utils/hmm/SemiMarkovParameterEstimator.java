package org.broadinstitute.methseg.utils.hmm;

import org.broadinstitute.methseg.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Maximization step of the hidden semi-Markov model.
 */
final class SemiMarkovParameterEstimator {

    private SemiMarkovParameterEstimator() {}

    /**
     * Refits both emission models with the state posteriors as weights.
     */
    static void refitEmissions(final SemiMarkovModelParameters parameters,
                               final double[] logSuccessFractions, final double[] logFailureFractions,
                               final double[] foregroundPosteriors, final double[] backgroundPosteriors) {
        parameters.getForegroundEmission().fit(logSuccessFractions, logFailureFractions, foregroundPosteriors);
        parameters.getBackgroundEmission().fit(logSuccessFractions, logFailureFractions, backgroundPosteriors);
    }

    /**
     * Refits both duration models on the run lengths of the hard labels {@code foreground > background}.
     * Models with no run to learn from are left unchanged.
     */
    static void refitDurations(final SemiMarkovModelParameters parameters, final int[] resetPoints,
                               final double[] foregroundPosteriors, final double[] backgroundPosteriors) {
        final List<Integer> foregroundLengths = new ArrayList<>();
        final List<Integer> backgroundLengths = new ArrayList<>();
        collectRunLengths(resetPoints, foregroundPosteriors, backgroundPosteriors, foregroundLengths, backgroundLengths);
        if (!foregroundLengths.isEmpty()) {
            parameters.getForegroundDuration().estimateML(foregroundLengths);
        }
        if (!backgroundLengths.isEmpty()) {
            parameters.getBackgroundDuration().estimateML(backgroundLengths);
        }
    }

    /**
     * Collects the lengths of the runs of equal hard labels within each subsequence.
     *
     * <p>A run is recorded when the label changes; the run still open when a subsequence ends is not recorded.</p>
     */
    static void collectRunLengths(final int[] resetPoints,
                                  final double[] foregroundPosteriors, final double[] backgroundPosteriors,
                                  final List<Integer> foregroundLengths, final List<Integer> backgroundLengths) {
        Utils.nonNull(resetPoints);
        for (int r = 1; r < resetPoints.length; r++) {
            final int start = resetPoints[r - 1];
            final int end = resetPoints[r];
            boolean inForeground = foregroundPosteriors[start] > backgroundPosteriors[start];
            int runLength = 1;
            for (int i = start + 1; i < end; i++) {
                final boolean foreground = foregroundPosteriors[i] > backgroundPosteriors[i];
                if (foreground == inForeground) {
                    runLength++;
                } else {
                    (inForeground ? foregroundLengths : backgroundLengths).add(runLength);
                    inForeground = foreground;
                    runLength = 1;
                }
            }
        }
    }
}
