package org.broadinstitute.methseg.tools.methylation;

import htsjdk.samtools.util.Locatable;
import org.broadinstitute.methseg.utils.SimpleInterval;
import org.broadinstitute.methseg.utils.Utils;

/**
 * Maximal run of consecutive foreground sites of one block.
 *
 * <p>The score is the sum over its sites of one minus the methylation fraction. The p-value is
 * {@link Double#NaN} until the domain has been tested.</p>
 */
public final class MethylationDomain implements Locatable {

    public static final String NAME_PREFIX = "HYPO";

    private final SimpleInterval interval;
    private final String name;
    private final double score;
    private final int numSites;
    private final double pValue;

    public MethylationDomain(final SimpleInterval interval, final String name, final double score, final int numSites,
                             final double pValue) {
        this.interval = Utils.nonNull(interval, "the interval cannot be null");
        this.name = Utils.nonNull(name, "the name cannot be null");
        Utils.validateArg(numSites > 0, () -> "a domain must contain at least one site: " + numSites);
        this.score = score;
        this.numSites = numSites;
        this.pValue = pValue;
    }

    public MethylationDomain(final SimpleInterval interval, final String name, final double score, final int numSites) {
        this(interval, name, score, numSites, Double.NaN);
    }

    public static String nameOf(final int index) {
        return NAME_PREFIX + index;
    }

    public MethylationDomain withName(final String newName) {
        return new MethylationDomain(interval, newName, score, numSites, pValue);
    }

    public MethylationDomain withPValue(final double newPValue) {
        return new MethylationDomain(interval, name, score, numSites, newPValue);
    }

    public SimpleInterval getInterval() {
        return interval;
    }

    @Override
    public String getContig() {
        return interval.getContig();
    }

    @Override
    public int getStart() {
        return interval.getStart();
    }

    @Override
    public int getEnd() {
        return interval.getEnd();
    }

    public String getName() {
        return name;
    }

    public double getScore() {
        return score;
    }

    public int getNumSites() {
        return numSites;
    }

    public double getPValue() {
        return pValue;
    }

    @Override
    public String toString() {
        return String.format("%s[%s, score=%s, sites=%d, p=%s]", name, interval, score, numSites, pValue);
    }
}
