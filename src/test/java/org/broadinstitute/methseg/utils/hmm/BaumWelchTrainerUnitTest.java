package org.broadinstitute.methseg.utils.hmm;

import org.broadinstitute.methseg.testutils.BaseTest;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;

public final class BaumWelchTrainerUnitTest extends BaseTest {

    private static final int MAX_SEGMENT_LENGTH = 100;

    @Test
    public void testTrainedModelRecoversBlocks() {
        final List<PairedCount> observations = SemiMarkovTestUtils.alternatingBlocks(4);
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations,
                new int[] {0, observations.size()}, SemiMarkovTestUtils.startingParameters(MAX_SEGMENT_LENGTH));

        final BaumWelchTrainer.TrainingResult result = new BaumWelchTrainer(10, 1e-10).train(model);
        Assert.assertTrue(result.getIterations() >= 1 && result.getIterations() <= 10);
        Assert.assertTrue(Double.isFinite(result.getLogLikelihood()));

        final PosteriorDecoding decoding = model.decode();
        for (int i = 0; i < observations.size(); i++) {
            final int offset = i % 50;
            if (offset == 0 || offset == 49) {
                continue;
            }
            Assert.assertEquals(decoding.isForeground(i), (i / 50) % 2 == 1, "position " + i);
        }
    }

    @Test
    public void testConvergenceRollsParametersBack() {
        final List<PairedCount> observations = SemiMarkovTestUtils.alternatingBlocks(2);
        final SemiMarkovModelParameters initial = SemiMarkovTestUtils.startingParameters(MAX_SEGMENT_LENGTH);
        final SemiMarkovModelParameters expected = initial.copy();
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations,
                new int[] {0, observations.size()}, initial);

        // any improvement is below this tolerance
        final BaumWelchTrainer trainer = new BaumWelchTrainer(10, Double.MAX_VALUE);
        final BaumWelchTrainer.TrainingResult result = trainer.train(model);

        Assert.assertEquals(result.getStatus(), BaumWelchTrainer.EMAlgorithmStatus.CONVERGED);
        Assert.assertTrue(result.getStatus().isSuccessful());
        Assert.assertEquals(trainer.getStatus(), BaumWelchTrainer.EMAlgorithmStatus.CONVERGED);
        Assert.assertEquals(result.getIterations(), 1);
        Assert.assertEquals(result.getLogLikelihood(), -Double.MAX_VALUE);
        assertSameValues(model.getParameters(), expected);
    }

    @Test
    public void testLateConvergenceRestoresPreviousIterationParameters() {
        final List<PairedCount> observations = SemiMarkovTestUtils.alternatingBlocks(4);
        final int[] resetPoints = {0, observations.size()};
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations, resetPoints,
                SemiMarkovTestUtils.startingParameters(MAX_SEGMENT_LENGTH));

        final BaumWelchTrainer.TrainingResult result = new BaumWelchTrainer(50, 1e-3).train(model);
        Assert.assertEquals(result.getStatus(), BaumWelchTrainer.EMAlgorithmStatus.CONVERGED);
        Assert.assertTrue(result.getIterations() >= 2, "converged at iteration " + result.getIterations());

        // the parameters in use when the last iteration started
        final HiddenSemiMarkovModel replay = new HiddenSemiMarkovModel(observations, resetPoints,
                SemiMarkovTestUtils.startingParameters(MAX_SEGMENT_LENGTH));
        double lastLogLikelihood = -Double.MAX_VALUE;
        for (int i = 1; i < result.getIterations(); i++) {
            lastLogLikelihood = replay.expectationStep();
            replay.maximizationStep();
        }

        assertSameValues(model.getParameters(), replay.getParameters());
        Assert.assertEquals(result.getLogLikelihood(), lastLogLikelihood);
        Assert.assertFalse(Arrays.equals(model.getParameters().getForegroundEmission().getParameters(),
                SemiMarkovTestUtils.startingParameters(MAX_SEGMENT_LENGTH).getForegroundEmission().getParameters()));
    }

    @Test
    public void testIterationCap() {
        final List<PairedCount> observations = SemiMarkovTestUtils.alternatingBlocks(2);
        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(observations,
                new int[] {0, observations.size()}, SemiMarkovTestUtils.startingParameters(MAX_SEGMENT_LENGTH));

        // no change ever counts as converged
        final BaumWelchTrainer trainer = new BaumWelchTrainer(3, -Double.MAX_VALUE);
        final BaumWelchTrainer.TrainingResult result = trainer.train(model);

        Assert.assertEquals(result.getStatus(), BaumWelchTrainer.EMAlgorithmStatus.MAX_ITERATIONS_REACHED);
        Assert.assertFalse(result.getStatus().isSuccessful());
        Assert.assertEquals(result.getIterations(), 3);
        Assert.assertTrue(result.getLogLikelihood() > -Double.MAX_VALUE);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonPositiveIterations() {
        new BaumWelchTrainer(0, 1e-10);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNonFiniteTolerance() {
        new BaumWelchTrainer(10, Double.NaN);
    }

    private static void assertSameValues(final SemiMarkovModelParameters actual, final SemiMarkovModelParameters expected) {
        Assert.assertEquals(actual.getForegroundEmission().getParameters(), expected.getForegroundEmission().getParameters());
        Assert.assertEquals(actual.getBackgroundEmission().getParameters(), expected.getBackgroundEmission().getParameters());
        Assert.assertEquals(actual.getForegroundDuration().getParameters(), expected.getForegroundDuration().getParameters());
        Assert.assertEquals(actual.getBackgroundDuration().getParameters(), expected.getBackgroundDuration().getParameters());
    }
}
