package org.broadinstitute.methseg.utils.hmm;

import org.broadinstitute.methseg.utils.distributions.BetaBinomialEmission;
import org.broadinstitute.methseg.utils.distributions.GeometricDuration;
import org.broadinstitute.methseg.utils.distributions.NegativeBinomialDuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Observations and parameters shared by the hidden semi-Markov model tests.
 */
final class SemiMarkovTestUtils {

    private SemiMarkovTestUtils() {}

    static List<PairedCount> counts(final int... successesAndFailures) {
        final List<PairedCount> result = new ArrayList<>();
        for (int i = 0; i < successesAndFailures.length; i += 2) {
            result.add(new PairedCount(successesAndFailures[i], successesAndFailures[i + 1]));
        }
        return result;
    }

    /**
     * Foreground favours low success fractions, background high ones.
     */
    static SemiMarkovModelParameters parameters(final int maxSegmentLength) {
        return new SemiMarkovModelParameters(
                new BetaBinomialEmission(2, 5), new BetaBinomialEmission(5, 2),
                new NegativeBinomialDuration(2, 0.4), new GeometricDuration(0.3),
                0.4, 0.6, 0.1, 0.2, maxSegmentLength, 1e-10);
    }

    /**
     * Foreground favours high success fractions, background low ones; long runs of both are likely.
     */
    static SemiMarkovModelParameters highForegroundParameters(final int maxSegmentLength) {
        return new SemiMarkovModelParameters(
                new BetaBinomialEmission(9, 1), new BetaBinomialEmission(1, 9),
                new NegativeBinomialDuration(1, 0.2), new GeometricDuration(0.1),
                0.5, 0.5, 1e-10, 1e-10, maxSegmentLength, 1e-10);
    }

    /**
     * Untrained starting point: foreground about a third successes, background about two thirds.
     */
    static SemiMarkovModelParameters startingParameters(final int maxSegmentLength) {
        return new SemiMarkovModelParameters(
                new BetaBinomialEmission(6.6, 13.4), new BetaBinomialEmission(13.4, 6.6),
                new NegativeBinomialDuration(1, 0.02), new GeometricDuration(0.002),
                0.5, 0.5, 1e-10, 1e-10, maxSegmentLength, 1e-10);
    }

    /**
     * Alternating blocks of 50 positions with coverage 20, starting with a high-fraction block.
     */
    static List<PairedCount> alternatingBlocks(final int numberOfBlocks) {
        final List<PairedCount> result = new ArrayList<>();
        for (int b = 0; b < numberOfBlocks; b++) {
            for (int i = 0; i < 50; i++) {
                final int successes = b % 2 == 0 ? 17 + i % 4 : i % 4;
                result.add(new PairedCount(successes, 20 - successes));
            }
        }
        return result;
    }
}
