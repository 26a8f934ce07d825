package org.broadinstitute.methseg.tools.methylation;

import org.broadinstitute.methseg.testutils.BaseTest;
import org.broadinstitute.methseg.utils.hmm.SemiMarkovModelParameters;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class InitialModelParametersUnitTest extends BaseTest {

    @Test
    public void testPseudoCountsFollowCoverage() {
        final SemiMarkovModelParameters parameters = InitialModelParameters.create(20, 300, 1e-10);
        Assert.assertEquals(parameters.getForegroundEmission().getParameters(), new double[] {6.6, 13.4}, 1e-12);
        Assert.assertEquals(parameters.getBackgroundEmission().getParameters(), new double[] {13.4, 6.6}, 1e-12);
        Assert.assertEquals(parameters.getForegroundDuration().getParameters(), new double[] {1, 0.02});
        Assert.assertEquals(parameters.getBackgroundDuration().getParameters(), new double[] {0.002});
        Assert.assertEquals(parameters.getStartForeground(), 0.5);
        Assert.assertEquals(parameters.getTerminateForeground(), 1e-10);
        Assert.assertEquals(parameters.getMaxSegmentLength(), 300);
    }

    @Test
    public void testLowCoverageIsRaisedToOne() {
        final SemiMarkovModelParameters parameters = InitialModelParameters.create(0.2, 10, 1e-10);
        Assert.assertEquals(parameters.getForegroundEmission().getParameters(), new double[] {0.33, 0.67}, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeCoverage() {
        InitialModelParameters.create(-1, 10, 1e-10);
    }
}
