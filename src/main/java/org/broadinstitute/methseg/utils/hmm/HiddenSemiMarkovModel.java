package org.broadinstitute.methseg.utils.hmm;

import com.google.common.annotations.VisibleForTesting;
import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.methseg.utils.Utils;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Two-state hidden semi-Markov model bound to a fixed sequence of {@link PairedCount} observations.
 *
 * <p>The observations are split into independent subsequences by the reset points: no segment, recursion or
 * run length ever crosses one. Reset points are strictly increasing, the first is 0 and the last is the number of
 * observations.</p>
 *
 * <p>This class owns the likelihood cache, the recursion buffers and the posterior arrays; they are allocated once
 * and reused by every expectation step.</p>
 */
public final class HiddenSemiMarkovModel {

    /**
     * Bounds of the per-position success fraction used to refit the emissions.
     */
    public static final double MIN_FRACTION = 0.01;
    public static final double MAX_FRACTION = 0.99;

    private final List<PairedCount> observations;
    private final int[] resetPoints;

    private SemiMarkovModelParameters parameters;

    private final SegmentLikelihoodCache cache;
    private final SegmentalForwardBackwardAlgorithm algorithm;

    private final double[] foregroundPosteriors;
    private final double[] backgroundPosteriors;

    private final double[] logSuccessFractions;
    private final double[] logFailureFractions;

    /**
     * @param observations at least one observation.
     * @param resetPoints subsequence boundaries.
     * @param parameters initial parameters; the model keeps and updates this very instance.
     * @throws IllegalArgumentException if the reset points are not strictly increasing from 0 to the number of observations.
     */
    public HiddenSemiMarkovModel(final List<PairedCount> observations, final int[] resetPoints,
                                 final SemiMarkovModelParameters parameters) {
        Utils.nonEmpty(observations, "there must be at least one observation");
        Utils.containsNoNull(observations, "the observations cannot contain null elements");
        Utils.nonNull(resetPoints, "the reset points cannot be null");
        validateResetPoints(resetPoints, observations.size());
        this.observations = Collections.unmodifiableList(new ArrayList<>(observations));
        this.resetPoints = resetPoints.clone();
        this.parameters = Utils.nonNull(parameters, "the parameters cannot be null");

        final int size = observations.size();
        cache = new SegmentLikelihoodCache(size);
        algorithm = new SegmentalForwardBackwardAlgorithm(size);
        foregroundPosteriors = new double[size];
        backgroundPosteriors = new double[size];
        logSuccessFractions = new double[size];
        logFailureFractions = new double[size];
        for (int i = 0; i < size; i++) {
            final PairedCount observation = this.observations.get(i);
            // uncovered positions carry no information on the fraction
            final double fraction = observation.getTotal() == 0 ? 0.5
                    : FastMath.min(FastMath.max(observation.getSuccessFraction(), MIN_FRACTION), MAX_FRACTION);
            logSuccessFractions[i] = FastMath.log(fraction);
            logFailureFractions[i] = FastMath.log(1 - fraction);
        }
        cache.rebuild(this.observations, parameters);
    }

    private static void validateResetPoints(final int[] resetPoints, final int size) {
        Utils.validateArg(resetPoints.length >= 2, "there must be at least two reset points");
        Utils.validateArg(resetPoints[0] == 0, () -> "the first reset point must be 0 but is " + resetPoints[0]);
        Utils.validateArg(resetPoints[resetPoints.length - 1] == size,
                () -> String.format("the last reset point must be %d but is %d", size, resetPoints[resetPoints.length - 1]));
        for (int i = 1; i < resetPoints.length; i++) {
            final int index = i;
            Utils.validateArg(resetPoints[i] > resetPoints[i - 1],
                    () -> "the reset points must be strictly increasing: " + Arrays.toString(resetPoints) + " at " + index);
        }
    }

    /**
     * Runs forward, backward and posterior passes over every subsequence with the current parameters.
     *
     * @return the log-likelihood of all observations, the sum of the subsequence forward totals.
     */
    public double expectationStep() {
        double total = 0;
        for (int i = 1; i < resetPoints.length; i++) {
            total += algorithm.apply(cache, parameters, resetPoints[i - 1], resetPoints[i],
                    foregroundPosteriors, backgroundPosteriors);
        }
        return total;
    }

    /**
     * Refits the parameters from the posteriors of the last {@link #expectationStep()} and rebuilds the cache.
     *
     * <p>Emissions get a soft fit weighted by the posteriors. Durations get a hard fit on the run lengths of the
     * most probable state at each position.</p>
     */
    public void maximizationStep() {
        SemiMarkovParameterEstimator.refitEmissions(parameters, logSuccessFractions, logFailureFractions,
                foregroundPosteriors, backgroundPosteriors);
        SemiMarkovParameterEstimator.refitDurations(parameters, resetPoints, foregroundPosteriors, backgroundPosteriors);
        cache.rebuild(observations, parameters);
    }

    /**
     * Labels every position with its most probable state under the current parameters.
     */
    public PosteriorDecoding decode() {
        expectationStep();
        final boolean[] foreground = new boolean[observations.size()];
        for (int i = 0; i < foreground.length; i++) {
            foreground[i] = foregroundPosteriors[i] > backgroundPosteriors[i];
        }
        return new PosteriorDecoding(foreground, foregroundPosteriors.clone(), resetPoints.clone());
    }

    /**
     * Decodes a different observation sequence of the same length with a copy of the current parameters.
     * This model is left untouched.
     */
    public PosteriorDecoding decode(final List<PairedCount> otherObservations) {
        Utils.validateArg(otherObservations.size() == observations.size(),
                () -> String.format("expected %d observations but got %d", observations.size(), otherObservations.size()));
        return new HiddenSemiMarkovModel(otherObservations, resetPoints, parameters.copy()).decode();
    }

    public SemiMarkovModelParameters getParameters() {
        return parameters;
    }

    /**
     * Replaces the parameters and rebuilds the likelihood cache.
     */
    public void setParameters(final SemiMarkovModelParameters parameters) {
        this.parameters = Utils.nonNull(parameters, "the parameters cannot be null");
        cache.rebuild(observations, parameters);
    }

    public List<PairedCount> getObservations() {
        return observations;
    }

    public int[] getResetPoints() {
        return resetPoints.clone();
    }

    /**
     * Foreground posterior of a position after the last expectation step.
     */
    public double getForegroundPosterior(final int position) {
        return foregroundPosteriors[position];
    }

    public double getBackgroundPosterior(final int position) {
        return backgroundPosteriors[position];
    }

    @VisibleForTesting
    SegmentLikelihoodCache getCache() {
        return cache;
    }

    @VisibleForTesting
    SegmentalForwardBackwardAlgorithm getAlgorithm() {
        return algorithm;
    }
}
