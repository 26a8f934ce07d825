package org.broadinstitute.methseg.utils.distributions;

import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.hmm.DurationModel;
import org.broadinstitute.methseg.utils.param.ParamUtils;

import java.util.List;

/**
 * Geometric run-length distribution {@code P(l) = p (1 - p)^(l - 1)} for {@code l >= 1}.
 */
public final class GeometricDuration implements DurationModel {

    public static final String FAMILY_NAME = "Geometric";
    public static final String P_NAME = "p";

    private double p;

    public GeometricDuration(final double p) {
        Utils.validateArg(p > 0 && p <= 1, () -> "the geometric p must be in (0, 1] but is " + p);
        this.p = p;
    }

    @Override
    public double logLikelihood(final int length) {
        Utils.validateArg(length >= 1, () -> "run lengths must be at least 1: " + length);
        return length == 1 ? FastMath.log(p) : FastMath.log(p) + (length - 1) * FastMath.log1p(-p);
    }

    @Override
    public void estimateML(final List<Integer> lengths) {
        Utils.nonNull(lengths, "the lengths cannot be null");
        if (lengths.isEmpty()) {
            return;
        }
        long total = 0;
        for (final int length : lengths) {
            ParamUtils.isPositive(length, "run lengths must be at least 1");
            total += length;
        }
        p = lengths.size() / (double) total;
    }

    public double getP() {
        return p;
    }

    @Override
    public double[] getParameters() {
        return new double[] {p};
    }

    @Override
    public String[] getParameterNames() {
        return new String[] {P_NAME};
    }

    @Override
    public String getFamilyName() {
        return FAMILY_NAME;
    }

    @Override
    public GeometricDuration copy() {
        return new GeometricDuration(p);
    }

    @Override
    public String toString() {
        return String.format("%s(%s=%.4g)", FAMILY_NAME, P_NAME, p);
    }
}
