package org.broadinstitute.methseg.utils;

import org.apache.commons.math3.util.FastMath;

/**
 * Natural-log-space arithmetic. Negative infinity stands for probability zero and is the identity of
 * {@link #logSumLog(double, double)}.
 */
public final class NaturalLogUtils {

    private NaturalLogUtils() { }

    /**
     * Log-sum-exp of two terms, used in the inner loops of the segmental recursions.
     * @return {@code log(exp(a) + exp(b))}, which is {@code b} when {@code a} is negative infinity and vice versa.
     */
    public static double logSumLog(final double a, final double b) {
        if (a == Double.NEGATIVE_INFINITY) {
            return b;
        } else if (b == Double.NEGATIVE_INFINITY) {
            return a;
        }
        return a > b ? a + FastMath.log1p(FastMath.exp(b - a)) : b + FastMath.log1p(FastMath.exp(a - b));
    }

    /**
     * Turns a pair of unnormalized log-probabilities into linear-space probabilities that sum to one.
     *
     * @return a new two-element array, or {@code null} if the pair cannot be normalized (zero or non-finite total).
     */
    public static double[] normalizePairFromLogToLinearSpace(final double first, final double second) {
        final double logTotal = logSumLog(first, second);
        if (!Double.isFinite(logTotal)) {
            return null;
        }
        return new double[] {FastMath.exp(first - logTotal), FastMath.exp(second - logTotal)};
    }
}
