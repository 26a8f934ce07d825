package org.broadinstitute.methseg.utils.hmm;

import org.broadinstitute.methseg.utils.Utils;

/**
 * Result of posterior decoding: per-position label and foreground posterior, and the subsequence boundaries
 * they were computed over.
 */
public final class PosteriorDecoding {

    private final boolean[] foreground;
    private final double[] foregroundPosteriors;
    private final int[] resetPoints;

    public PosteriorDecoding(final boolean[] foreground, final double[] foregroundPosteriors, final int[] resetPoints) {
        Utils.nonNull(foreground);
        Utils.nonNull(foregroundPosteriors);
        Utils.nonNull(resetPoints);
        Utils.validateArg(foreground.length == foregroundPosteriors.length, "labels and posteriors must have the same length");
        this.foreground = foreground;
        this.foregroundPosteriors = foregroundPosteriors;
        this.resetPoints = resetPoints;
    }

    public int size() {
        return foreground.length;
    }

    public boolean isForeground(final int position) {
        return foreground[position];
    }

    public double getForegroundPosterior(final int position) {
        return foregroundPosteriors[position];
    }

    public int getNumberOfSubsequences() {
        return resetPoints.length - 1;
    }

    /**
     * First position of the {@code index}-th subsequence.
     */
    public int getSubsequenceStart(final int index) {
        return resetPoints[index];
    }

    /**
     * Position after the last one of the {@code index}-th subsequence.
     */
    public int getSubsequenceEnd(final int index) {
        return resetPoints[index + 1];
    }
}
