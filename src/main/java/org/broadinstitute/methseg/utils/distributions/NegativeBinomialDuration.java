package org.broadinstitute.methseg.utils.distributions;

import org.apache.commons.math3.analysis.UnivariateFunction;
import org.apache.commons.math3.analysis.solvers.BrentSolver;
import org.apache.commons.math3.exception.NoBracketingException;
import org.apache.commons.math3.exception.TooManyEvaluationsException;
import org.apache.commons.math3.special.Gamma;
import org.apache.commons.math3.util.FastMath;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.hmm.DurationModel;
import org.broadinstitute.methseg.utils.param.ParamUtils;

import java.util.List;

/**
 * Negative binomial run-length distribution shifted to start at 1: the number of extra positions
 * {@code k = l - 1} beyond the first one follows
 * {@code P(k) = Gamma(k + r) / (k! Gamma(r)) p^r (1 - p)^k}.
 *
 * <p>The maximum-likelihood fit solves the score equation of {@code r} with Brent's method, then sets
 * {@code p = r / (r + mean(k))}.</p>
 */
public final class NegativeBinomialDuration implements DurationModel {

    private static final Logger logger = LogManager.getLogger(NegativeBinomialDuration.class);

    public static final String FAMILY_NAME = "NegativeBinomial";
    public static final String R_NAME = "r";
    public static final String P_NAME = "p";

    static final double MIN_R = 1e-4;
    static final double MAX_R = 1e4;
    static final double MIN_P = 1e-10;
    private static final int MAX_SOLVER_EVALUATIONS = 1000;
    private static final double SOLVER_ABSOLUTE_ACCURACY = 1e-8;

    private double r;
    private double p;

    public NegativeBinomialDuration(final double r, final double p) {
        this.r = ParamUtils.isPositive(r, "the negative binomial r must be positive");
        Utils.validateArg(p > 0 && p <= 1, () -> "the negative binomial p must be in (0, 1] but is " + p);
        this.p = p;
    }

    @Override
    public double logLikelihood(final int length) {
        Utils.validateArg(length >= 1, () -> "run lengths must be at least 1: " + length);
        return logLikelihood(length - 1, r, p);
    }

    private static double logLikelihood(final int extra, final double r, final double p) {
        final double tail = extra == 0 ? 0 : extra * FastMath.log1p(-p);
        return Gamma.logGamma(extra + r) - Gamma.logGamma(extra + 1) - Gamma.logGamma(r) + r * FastMath.log(p) + tail;
    }

    @Override
    public void estimateML(final List<Integer> lengths) {
        Utils.nonNull(lengths, "the lengths cannot be null");
        if (lengths.isEmpty()) {
            return;
        }
        final int[] extras = lengths.stream()
                .mapToInt(l -> ParamUtils.isPositive(l, "run lengths must be at least 1") - 1)
                .toArray();
        final int n = extras.length;
        double sum = 0;
        for (final int k : extras) {
            sum += k;
        }
        final double mean = sum / n;
        if (mean == 0) {
            // every run has length one
            p = 1 - MIN_P;
            return;
        }

        final UnivariateFunction score = x -> {
            double value = n * (FastMath.log(x / (x + mean)) - Gamma.digamma(x));
            for (final int k : extras) {
                value += Gamma.digamma(k + x);
            }
            return value;
        };

        double newR;
        try {
            newR = new BrentSolver(SOLVER_ABSOLUTE_ACCURACY).solve(MAX_SOLVER_EVALUATIONS, score, MIN_R, MAX_R);
        } catch (final NoBracketingException e) {
            // the likelihood is monotone in r over the search range
            newR = totalLogLikelihood(extras, MIN_R, mean) >= totalLogLikelihood(extras, MAX_R, mean) ? MIN_R : MAX_R;
        } catch (final TooManyEvaluationsException e) {
            logger.warn("Too many evaluations fitting the negative binomial r; keeping r = " + r);
            newR = r;
        }
        r = newR;
        p = FastMath.min(FastMath.max(r / (r + mean), MIN_P), 1 - MIN_P);
    }

    private static double totalLogLikelihood(final int[] extras, final double r, final double mean) {
        final double p = r / (r + mean);
        double total = 0;
        for (final int k : extras) {
            total += logLikelihood(k, r, p);
        }
        return total;
    }

    public double getR() {
        return r;
    }

    public double getP() {
        return p;
    }

    @Override
    public double[] getParameters() {
        return new double[] {r, p};
    }

    @Override
    public String[] getParameterNames() {
        return new String[] {R_NAME, P_NAME};
    }

    @Override
    public String getFamilyName() {
        return FAMILY_NAME;
    }

    @Override
    public NegativeBinomialDuration copy() {
        return new NegativeBinomialDuration(r, p);
    }

    @Override
    public String toString() {
        return String.format("%s(%s=%.4g, %s=%.4g)", FAMILY_NAME, R_NAME, r, P_NAME, p);
    }
}
