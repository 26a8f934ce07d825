package org.broadinstitute.methseg.utils.hmm;

import org.broadinstitute.methseg.utils.Utils;

import java.util.List;

/**
 * Constant-time access to the emission log-likelihood of any span of observations, for either state, and to the
 * foreground duration log-likelihood of any length up to the maximum segment length.
 *
 * <p>Holds prefix sums of the per-position emission log-likelihoods: the span {@code [start, end)} is
 * {@code prefix[end - 1] - prefix[start - 1]}. Everything here depends on the model parameters so it must be
 * {@link #rebuild rebuilt} whenever these change.</p>
 */
public final class SegmentLikelihoodCache {

    private final double[] foregroundPrefixSums;
    private final double[] backgroundPrefixSums;

    /**
     * Indexed by segment length; element 0 is unused.
     */
    private double[] foregroundDurationLogLikelihoods = new double[0];

    private boolean built = false;

    /**
     * Allocates a cache for a fixed number of observations.
     *
     * @param size number of observations.
     */
    public SegmentLikelihoodCache(final int size) {
        Utils.validateArg(size >= 0, "the size cannot be negative");
        foregroundPrefixSums = new double[size];
        backgroundPrefixSums = new double[size];
    }

    /**
     * Recomputes all cached values for the given observations and parameters.
     *
     * @throws IllegalArgumentException if the number of observations does not match the cache size.
     */
    public void rebuild(final List<PairedCount> observations, final SemiMarkovModelParameters parameters) {
        Utils.nonNull(observations, "the observations cannot be null");
        Utils.nonNull(parameters, "the parameters cannot be null");
        Utils.validateArg(observations.size() == foregroundPrefixSums.length,
                () -> String.format("expected %d observations but got %d", foregroundPrefixSums.length, observations.size()));

        final EmissionModel foreground = parameters.getForegroundEmission();
        final EmissionModel background = parameters.getBackgroundEmission();
        double foregroundSum = 0;
        double backgroundSum = 0;
        for (int i = 0; i < foregroundPrefixSums.length; i++) {
            final PairedCount observation = observations.get(i);
            foregroundSum += foreground.logLikelihood(observation);
            backgroundSum += background.logLikelihood(observation);
            foregroundPrefixSums[i] = foregroundSum;
            backgroundPrefixSums[i] = backgroundSum;
        }

        final int maxLength = parameters.getMaxSegmentLength();
        final DurationModel duration = parameters.getForegroundDuration();
        foregroundDurationLogLikelihoods = new double[maxLength + 1];
        foregroundDurationLogLikelihoods[0] = Double.NEGATIVE_INFINITY;
        for (int length = 1; length <= maxLength; length++) {
            foregroundDurationLogLikelihoods[length] = duration.logLikelihood(length);
        }
        built = true;
    }

    public int size() {
        return foregroundPrefixSums.length;
    }

    /**
     * Foreground emission log-likelihood of the observations in {@code [start, end)}.
     */
    public double foregroundLogLikelihood(final int start, final int end) {
        return spanSum(foregroundPrefixSums, start, end);
    }

    /**
     * Background emission log-likelihood of the observations in {@code [start, end)}.
     */
    public double backgroundLogLikelihood(final int start, final int end) {
        return spanSum(backgroundPrefixSums, start, end);
    }

    /**
     * Background emission log-likelihood of a single observation.
     */
    public double backgroundLogLikelihood(final int position) {
        return spanSum(backgroundPrefixSums, position, position + 1);
    }

    /**
     * Foreground duration log-likelihood.
     *
     * @param length between 1 and the maximum segment length.
     */
    public double foregroundDurationLogLikelihood(final int length) {
        return foregroundDurationLogLikelihoods[length];
    }

    private double spanSum(final double[] prefixSums, final int start, final int end) {
        Utils.validate(built, "the cache has not been built");
        return start == 0 ? prefixSums[end - 1] : prefixSums[end - 1] - prefixSums[start - 1];
    }
}
