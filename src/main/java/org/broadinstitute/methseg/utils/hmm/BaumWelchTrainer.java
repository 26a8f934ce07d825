package org.broadinstitute.methseg.utils.hmm;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.param.ParamUtils;

import java.util.Arrays;

/**
 * Expectation-maximization driver of a {@link HiddenSemiMarkovModel}.
 *
 * <p>Each iteration snapshots the parameters, runs the expectation step over all subsequences and then the
 * maximization step. Training stops when the relative increase of the log-likelihood falls below the tolerance,
 * in which case the parameters are rolled back to the snapshot taken at the start of that iteration, or when the
 * maximum number of iterations is reached.</p>
 */
public final class BaumWelchTrainer {

    private static final Logger logger = LogManager.getLogger(BaumWelchTrainer.class);

    private final int maxIterations;
    private final double convergenceTolerance;

    private EMAlgorithmStatus status = EMAlgorithmStatus.RUNNING;

    public BaumWelchTrainer(final int maxIterations, final double convergenceTolerance) {
        this.maxIterations = ParamUtils.isPositive(maxIterations, "the maximum number of iterations must be positive");
        this.convergenceTolerance = ParamUtils.isFinite(convergenceTolerance, "the convergence tolerance must be finite");
    }

    /**
     * Trains the model in place.
     *
     * @return the terminal status, the number of iterations run and the best log-likelihood reached.
     */
    public TrainingResult train(final HiddenSemiMarkovModel model) {
        Utils.nonNull(model, "the model cannot be null");
        status = EMAlgorithmStatus.RUNNING;
        showIterationHeader();

        double previousLogLikelihood = -Double.MAX_VALUE;
        int iteration = 0;
        while (status == EMAlgorithmStatus.RUNNING) {
            if (iteration == maxIterations) {
                status = EMAlgorithmStatus.MAX_ITERATIONS_REACHED;
                break;
            }
            iteration++;
            final SemiMarkovModelParameters snapshot = model.getParameters().copy();
            final double logLikelihood = model.expectationStep();
            model.maximizationStep();

            final double delta = (logLikelihood - previousLogLikelihood) / FastMath.abs(logLikelihood);
            showIterationInfo(iteration, snapshot, logLikelihood, delta);
            if (delta < convergenceTolerance) {
                model.setParameters(snapshot);
                status = EMAlgorithmStatus.CONVERGED;
            } else {
                previousLogLikelihood = logLikelihood;
            }
        }
        logger.info(String.format("EM algorithm status after %d iterations: %s", iteration, status.getMessage()));
        return new TrainingResult(status, iteration, previousLogLikelihood);
    }

    public EMAlgorithmStatus getStatus() {
        return status;
    }

    private void showIterationHeader() {
        final String header = String.format("%-6s%-36s%-36s%-36s%-36s%-20s%-20s",
                "ITR", "FG Emission", "FG Duration", "BG Emission", "BG Duration", "Likelihood", "DELTA");
        logger.debug(header);
        logger.debug(StringUtils.repeat("=", header.length()));
    }

    private static void showIterationInfo(final int iteration, final SemiMarkovModelParameters parameters,
                                          final double logLikelihood, final double delta) {
        if (!logger.isDebugEnabled()) {
            return;
        }
        logger.debug(String.format("%-6d%-36s%-36s%-36s%-36s%-20.10e%-20.6e", iteration,
                summarize(parameters.getForegroundEmission().getFamilyName(), parameters.getForegroundEmission().getParameters()),
                summarize(parameters.getForegroundDuration().getFamilyName(), parameters.getForegroundDuration().getParameters()),
                summarize(parameters.getBackgroundEmission().getFamilyName(), parameters.getBackgroundEmission().getParameters()),
                summarize(parameters.getBackgroundDuration().getFamilyName(), parameters.getBackgroundDuration().getParameters()),
                logLikelihood, delta));
    }

    private static String summarize(final String family, final double[] values) {
        final String[] formatted = Arrays.stream(values).mapToObj(v -> String.format("%.4g", v)).toArray(String[]::new);
        return family + "(" + String.join(", ", formatted) + ")";
    }

    /**
     * Terminal state of a training run.
     */
    public enum EMAlgorithmStatus {
        RUNNING(false, "Status is not determined yet."),
        CONVERGED(true, "Success -- converged in log-likelihood change tolerance."),
        MAX_ITERATIONS_REACHED(false, "Maximum iterations reached.");

        private final boolean success;
        private final String message;

        EMAlgorithmStatus(final boolean success, final String message) {
            this.success = success;
            this.message = message;
        }

        public String getMessage() {
            return message;
        }

        public boolean isSuccessful() {
            return success;
        }
    }

    /**
     * Outcome of {@link #train}.
     */
    public static final class TrainingResult {
        private final EMAlgorithmStatus status;
        private final int iterations;
        private final double logLikelihood;

        TrainingResult(final EMAlgorithmStatus status, final int iterations, final double logLikelihood) {
            this.status = status;
            this.iterations = iterations;
            this.logLikelihood = logLikelihood;
        }

        public EMAlgorithmStatus getStatus() {
            return status;
        }

        public int getIterations() {
            return iterations;
        }

        /**
         * @return the log-likelihood of the last iteration that was kept, {@code -Double.MAX_VALUE} if none was.
         */
        public double getLogLikelihood() {
            return logLikelihood;
        }
    }
}
