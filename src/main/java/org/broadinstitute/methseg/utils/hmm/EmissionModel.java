package org.broadinstitute.methseg.utils.hmm;

/**
 * Emission distribution of one hidden state over {@link PairedCount} observations.
 *
 * <p>Implementations are mutable: {@link #fit} replaces the parameters in place. Use {@link #copy} to take a
 * snapshot before refitting.</p>
 */
public interface EmissionModel {

    /**
     * Log-likelihood of one observation under the current parameters.
     *
     * @param observation the observation, never {@code null}.
     * @return a value in log scale (from -Inf to 0 for discrete families).
     */
    double logLikelihood(final PairedCount observation);

    /**
     * Weighted maximum-likelihood fit.
     *
     * <p>The three arrays are parallel and indexed by position. The success and failure log-probabilities
     * are per-position point estimates of the success fraction and its complement; weights are typically the
     * state posterior probabilities. When the weights add up to zero the parameters are left unchanged.</p>
     *
     * @param logSuccessProbabilities log of the per-position success fraction.
     * @param logFailureProbabilities log of the per-position failure fraction.
     * @param weights non-negative per-position weights.
     * @throws IllegalArgumentException if the arrays are {@code null} or differ in length.
     */
    void fit(final double[] logSuccessProbabilities, final double[] logFailureProbabilities, final double[] weights);

    /**
     * @return a copy of the current parameter values, in the order of {@link #getParameterNames()}.
     */
    double[] getParameters();

    /**
     * @return names of the parameters, used to persist them.
     */
    String[] getParameterNames();

    /**
     * @return a short name of the distribution family.
     */
    String getFamilyName();

    /**
     * @return an independent copy of this model.
     */
    EmissionModel copy();
}
