package org.broadinstitute.methseg.utils.hmm;

import java.util.List;

/**
 * Distribution over the length (in positions, at least 1) of a run of a hidden state.
 *
 * <p>When used for the background state of {@link HiddenSemiMarkovModel} the first parameter is read as the
 * per-position probability of leaving the background; its complement is the background self-transition
 * probability.</p>
 */
public interface DurationModel {

    /**
     * Log-probability of a run of exactly {@code length} positions.
     *
     * @param length the run length.
     * @throws IllegalArgumentException if {@code length} is less than 1.
     */
    double logLikelihood(final int length);

    /**
     * Maximum-likelihood estimate of the parameters from a sample of run lengths.
     *
     * <p>An empty sample leaves the parameters unchanged.</p>
     *
     * @param lengths the run lengths, each at least 1.
     * @throws IllegalArgumentException if {@code lengths} is {@code null} or contains a length less than 1.
     */
    void estimateML(final List<Integer> lengths);

    /**
     * @return a copy of the current parameter values, in the order of {@link #getParameterNames()}.
     */
    double[] getParameters();

    String[] getParameterNames();

    String getFamilyName();

    DurationModel copy();
}
