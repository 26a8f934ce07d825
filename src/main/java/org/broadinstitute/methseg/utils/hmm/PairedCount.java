package org.broadinstitute.methseg.utils.hmm;

import org.broadinstitute.methseg.utils.Utils;

/**
 * Observation made of two non-negative counts, e.g. the methylated and unmethylated reads covering a CpG.
 */
public final class PairedCount {

    private final int successes;
    private final int failures;

    public PairedCount(final int successes, final int failures) {
        Utils.validateArg(successes >= 0, () -> "the number of successes must be non-negative: " + successes);
        Utils.validateArg(failures >= 0, () -> "the number of failures must be non-negative: " + failures);
        this.successes = successes;
        this.failures = failures;
    }

    public int getSuccesses() {
        return successes;
    }

    public int getFailures() {
        return failures;
    }

    public int getTotal() {
        return successes + failures;
    }

    /**
     * @return the fraction of successes, {@link Double#NaN} when both counts are zero.
     */
    public double getSuccessFraction() {
        return successes / (double) (successes + failures);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        final PairedCount that = (PairedCount) o;
        return successes == that.successes && failures == that.failures;
    }

    @Override
    public int hashCode() {
        return 31 * successes + failures;
    }

    @Override
    public String toString() {
        return "(" + successes + ", " + failures + ")";
    }
}
