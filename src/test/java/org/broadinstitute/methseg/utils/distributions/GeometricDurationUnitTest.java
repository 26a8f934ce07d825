package org.broadinstitute.methseg.utils.distributions;

import org.broadinstitute.methseg.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public final class GeometricDurationUnitTest extends BaseTest {

    @Test
    public void testLogLikelihood() {
        final GeometricDuration duration = new GeometricDuration(0.25);
        Assert.assertEquals(duration.logLikelihood(1), Math.log(0.25), 1e-12);
        Assert.assertEquals(duration.logLikelihood(4), Math.log(0.25) + 3 * Math.log(0.75), 1e-12);

        double sum = 0;
        for (int length = 1; length < 200; length++) {
            sum += Math.exp(duration.logLikelihood(length));
        }
        Assert.assertEquals(sum, 1.0, 1e-10);
    }

    @Test
    public void testCertainSwitch() {
        final GeometricDuration duration = new GeometricDuration(1);
        Assert.assertEquals(duration.logLikelihood(1), 0.0);
        Assert.assertEquals(duration.logLikelihood(2), Double.NEGATIVE_INFINITY);
    }

    @Test
    public void testEstimate() {
        final GeometricDuration duration = new GeometricDuration(0.5);
        duration.estimateML(Arrays.asList(2, 4, 6, 8));
        Assert.assertEquals(duration.getP(), 0.2, 1e-12);
    }

    @Test
    public void testEmptyEstimateKeepsParameter() {
        final GeometricDuration duration = new GeometricDuration(0.3);
        duration.estimateML(Collections.emptyList());
        Assert.assertEquals(duration.getParameters(), new double[] {0.3});
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testZeroLength() {
        new GeometricDuration(0.3).logLikelihood(0);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testZeroLengthInSample() {
        new GeometricDuration(0.3).estimateML(Arrays.asList(3, 0));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testZeroProbability() {
        new GeometricDuration(0);
    }
}
