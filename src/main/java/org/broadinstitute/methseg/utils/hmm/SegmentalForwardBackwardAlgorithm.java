package org.broadinstitute.methseg.utils.hmm;

import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.methseg.exceptions.MethSegException;
import org.broadinstitute.methseg.utils.NaturalLogUtils;
import org.broadinstitute.methseg.utils.Utils;

import java.util.Arrays;

/**
 * Performs the segmental (explicit-duration) forward-backward algorithm of the two-state
 * hidden semi-Markov model on independent subsequences of the observations.
 *
 * <p>The forward table holds, for each position {@code i}, the log-likelihood of the data up to {@code i}
 * jointly with a foreground segment ending exactly at {@code i} ({@code forwardForeground}) or with being in
 * background at {@code i} ({@code forwardBackground}). The backward table holds the log-likelihood of the data
 * after {@code i} given that a foreground segment ends at {@code i} or that {@code i} is background.</p>
 *
 * <p>No foreground segment longer than {@link SemiMarkovModelParameters#getMaxSegmentLength()} is scored.</p>
 *
 * <p>The tables are allocated once for the whole observation array and owned by this instance; each call resets
 * the slice {@code [start, end)} it works on before using it. Instances are not thread-safe.</p>
 */
public final class SegmentalForwardBackwardAlgorithm {

    /**
     * Relative tolerance of the agreement between the forward and backward totals.
     */
    public static final double LIKELIHOOD_AGREEMENT_TOLERANCE = 1e-10;

    /**
     * Maximum difference between one and the sum of the two state posteriors at a position.
     */
    public static final double POSTERIOR_SUM_TOLERANCE = 1e-6;

    private final double[] forwardForeground;
    private final double[] forwardBackground;
    private final double[] backwardForeground;
    private final double[] backwardBackground;
    private final double[] foregroundEvidence;

    /**
     * @param capacity the number of observations of the longest sequence this instance will process.
     */
    public SegmentalForwardBackwardAlgorithm(final int capacity) {
        Utils.validateArg(capacity >= 0, "the capacity cannot be negative");
        forwardForeground = new double[capacity];
        forwardBackground = new double[capacity];
        backwardForeground = new double[capacity];
        backwardBackground = new double[capacity];
        foregroundEvidence = new double[capacity];
    }

    /**
     * Runs forward, backward and posterior passes on one subsequence.
     *
     * @param foregroundPosteriors destination of the foreground posterior of each position in {@code [start, end)}.
     * @param backgroundPosteriors destination of the background posterior of each position in {@code [start, end)}.
     * @return the log-likelihood of the subsequence.
     * @throws MethSegException.NumericDivergence if the forward and backward totals disagree or any value is not finite.
     */
    public double apply(final SegmentLikelihoodCache cache, final SemiMarkovModelParameters parameters,
                        final int start, final int end,
                        final double[] foregroundPosteriors, final double[] backgroundPosteriors) {
        final double forwardTotal = forward(cache, parameters, start, end);
        final double backwardTotal = backward(cache, parameters, start, end);
        checkAgreement(start, end, forwardTotal, backwardTotal);
        posteriors(cache, parameters, start, end, foregroundPosteriors, backgroundPosteriors);
        return forwardTotal;
    }

    /**
     * Forward pass over {@code [start, end)}.
     *
     * @return the log-likelihood of the subsequence, including the termination probabilities.
     */
    public double forward(final SegmentLikelihoodCache cache, final SemiMarkovModelParameters parameters,
                          final int start, final int end) {
        checkSubsequence(cache, start, end);
        final int maxLength = parameters.getMaxSegmentLength();
        final double logStartForeground = parameters.getLogStartForeground();
        final double logSwitch = parameters.getLogSwitchToForeground();
        final double logSelf = parameters.getLogBackgroundSelfTransition();

        Arrays.fill(forwardForeground, start, end, Double.NEGATIVE_INFINITY);
        Arrays.fill(forwardBackground, start, end, Double.NEGATIVE_INFINITY);

        forwardForeground[start] = logStartForeground
                + cache.foregroundLogLikelihood(start, start + 1)
                + cache.foregroundDurationLogLikelihood(1);
        forwardBackground[start] = parameters.getLogStartBackground() + cache.backgroundLogLikelihood(start);

        for (int i = start + 1; i < end; i++) {
            forwardBackground[i] = NaturalLogUtils.logSumLog(forwardForeground[i - 1], forwardBackground[i - 1] + logSelf)
                    + cache.backgroundLogLikelihood(i);

            double segmentEnds = Double.NEGATIVE_INFINITY;
            final int longest = FastMath.min(i - start + 1, maxLength);
            for (int length = 1; length <= longest; length++) {
                final int segmentStart = i - length + 1;
                final double entry = segmentStart == start ? logStartForeground : forwardBackground[segmentStart - 1] + logSwitch;
                segmentEnds = NaturalLogUtils.logSumLog(segmentEnds, entry
                        + cache.foregroundLogLikelihood(segmentStart, i + 1)
                        + cache.foregroundDurationLogLikelihood(length));
            }
            forwardForeground[i] = segmentEnds;
        }

        return NaturalLogUtils.logSumLog(forwardForeground[end - 1] + parameters.getLogTerminateForeground(),
                forwardBackground[end - 1] + parameters.getLogTerminateBackground());
    }

    /**
     * Backward pass over {@code [start, end)}.
     *
     * @return the log-likelihood of the subsequence computed from the backward table.
     */
    public double backward(final SegmentLikelihoodCache cache, final SemiMarkovModelParameters parameters,
                           final int start, final int end) {
        checkSubsequence(cache, start, end);
        final int maxLength = parameters.getMaxSegmentLength();
        final double logStartForeground = parameters.getLogStartForeground();
        final double logSwitch = parameters.getLogSwitchToForeground();
        final double logSelf = parameters.getLogBackgroundSelfTransition();

        Arrays.fill(backwardForeground, start, end, Double.NEGATIVE_INFINITY);
        Arrays.fill(backwardBackground, start, end, Double.NEGATIVE_INFINITY);

        backwardForeground[end - 1] = parameters.getLogTerminateForeground();
        backwardBackground[end - 1] = parameters.getLogTerminateBackground();

        for (int i = end - 2; i >= start; i--) {
            final double nextBackground = cache.backgroundLogLikelihood(i + 1) + backwardBackground[i + 1];
            // a foreground segment is always followed by background
            backwardForeground[i] = nextBackground;

            double fromBackground = logSelf + nextBackground;
            final int longest = FastMath.min(end - i - 1, maxLength);
            for (int length = 1; length <= longest; length++) {
                fromBackground = NaturalLogUtils.logSumLog(fromBackground, logSwitch
                        + cache.foregroundLogLikelihood(i + 1, i + length + 1)
                        + cache.foregroundDurationLogLikelihood(length)
                        + backwardForeground[i + length]);
            }
            backwardBackground[i] = fromBackground;
        }

        double total = parameters.getLogStartBackground() + cache.backgroundLogLikelihood(start) + backwardBackground[start];
        final int longest = FastMath.min(end - start, maxLength);
        for (int length = 1; length <= longest; length++) {
            total = NaturalLogUtils.logSumLog(total, logStartForeground
                    + cache.foregroundLogLikelihood(start, start + length)
                    + cache.foregroundDurationLogLikelihood(length)
                    + backwardForeground[start + length - 1]);
        }
        return total;
    }

    /**
     * Computes the state posteriors of {@code [start, end)} from the forward and backward tables of the
     * last {@link #forward} and {@link #backward} calls on the same subsequence.
     *
     * @throws MethSegException.NumericDivergence if the posteriors of a position cannot be normalized.
     */
    public void posteriors(final SegmentLikelihoodCache cache, final SemiMarkovModelParameters parameters,
                           final int start, final int end,
                           final double[] foregroundPosteriors, final double[] backgroundPosteriors) {
        checkSubsequence(cache, start, end);
        Utils.validateArg(foregroundPosteriors.length >= end && backgroundPosteriors.length >= end,
                "the posterior arrays are too short");
        final int maxLength = parameters.getMaxSegmentLength();
        final double logSwitch = parameters.getLogSwitchToForeground();

        Arrays.fill(foregroundEvidence, start, end, Double.NEGATIVE_INFINITY);

        for (int segmentStart = start; segmentStart < end; segmentStart++) {
            final double entry = segmentStart == start ? parameters.getLogStartForeground()
                    : forwardBackground[segmentStart - 1] + logSwitch;
            // evidence of all segments that start here and reach at least segmentEnd
            double reaching = Double.NEGATIVE_INFINITY;
            for (int segmentEnd = FastMath.min(segmentStart + maxLength, end); segmentEnd > segmentStart; segmentEnd--) {
                reaching = NaturalLogUtils.logSumLog(reaching, entry
                        + cache.foregroundDurationLogLikelihood(segmentEnd - segmentStart)
                        + cache.foregroundLogLikelihood(segmentStart, segmentEnd)
                        + backwardForeground[segmentEnd - 1]);
                foregroundEvidence[segmentEnd - 1] = NaturalLogUtils.logSumLog(foregroundEvidence[segmentEnd - 1], reaching);
            }
        }

        for (int i = start; i < end; i++) {
            final double backgroundEvidence = forwardBackground[i] + backwardBackground[i];
            final double[] normalized = NaturalLogUtils.normalizePairFromLogToLinearSpace(foregroundEvidence[i], backgroundEvidence);
            if (normalized == null) {
                throw new MethSegException.NumericDivergence(String.format(
                        "the posteriors at position %d cannot be normalized (foreground evidence %s, background evidence %s)",
                        i, foregroundEvidence[i], backgroundEvidence));
            }
            foregroundPosteriors[i] = normalized[0];
            backgroundPosteriors[i] = normalized[1];
            if (FastMath.abs(normalized[0] + normalized[1] - 1.0) >= POSTERIOR_SUM_TOLERANCE) {
                throw new MethSegException.NumericDivergence(String.format(
                        "the posteriors at position %d do not add up to one: %s + %s", i, normalized[0], normalized[1]));
            }
        }
    }

    /**
     * Forward log-likelihood of a foreground segment ending at {@code position}; valid after {@link #forward}.
     */
    public double logForwardForeground(final int position) {
        return forwardForeground[position];
    }

    public double logForwardBackground(final int position) {
        return forwardBackground[position];
    }

    public double logBackwardForeground(final int position) {
        return backwardForeground[position];
    }

    public double logBackwardBackground(final int position) {
        return backwardBackground[position];
    }

    private static void checkAgreement(final int start, final int end, final double forwardTotal, final double backwardTotal) {
        if (!Double.isFinite(forwardTotal) || !Double.isFinite(backwardTotal)) {
            throw new MethSegException.NumericDivergence(start, end, forwardTotal, backwardTotal);
        }
        final double relativeDifference = FastMath.abs((forwardTotal - backwardTotal) / FastMath.max(FastMath.abs(forwardTotal), FastMath.abs(backwardTotal)));
        if (relativeDifference >= LIKELIHOOD_AGREEMENT_TOLERANCE) {
            throw new MethSegException.NumericDivergence(start, end, forwardTotal, backwardTotal);
        }
    }

    private void checkSubsequence(final SegmentLikelihoodCache cache, final int start, final int end) {
        Utils.nonNull(cache, "the likelihood cache cannot be null");
        Utils.validateArg(start >= 0 && start < end && end <= forwardForeground.length && end <= cache.size(),
                () -> String.format("invalid subsequence [%d, %d) for %d positions", start, end, forwardForeground.length));
    }
}
