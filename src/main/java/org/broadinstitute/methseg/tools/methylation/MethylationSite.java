package org.broadinstitute.methseg.tools.methylation;

import htsjdk.samtools.util.Locatable;
import org.apache.commons.math3.util.FastMath;
import org.broadinstitute.methseg.utils.SimpleInterval;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.hmm.PairedCount;
import org.broadinstitute.methseg.utils.param.ParamUtils;

/**
 * Methylation level and read coverage of a single cytosine.
 *
 * <p>Positions are 0-based as in the input file; {@link #getStart()} and {@link #getEnd()} follow the
 * 1-based closed convention of {@link Locatable}.</p>
 */
public final class MethylationSite implements Locatable {

    private final SimpleInterval interval;
    private final String strand;
    private final String context;
    private final double level;
    private final int coverage;

    /**
     * @param position 0-based position.
     * @param level fraction of methylated reads, in [0, 1].
     * @param coverage number of reads, non-negative.
     */
    public MethylationSite(final String contig, final int position, final String strand, final String context,
                           final double level, final int coverage) {
        Utils.validateArg(position >= 0, () -> "the position cannot be negative: " + position);
        this.interval = new SimpleInterval(Utils.nonNull(contig, "the contig cannot be null"), position + 1, position + 1);
        this.strand = Utils.nonNull(strand, "the strand cannot be null");
        this.context = Utils.nonNull(context, "the context cannot be null");
        this.level = ParamUtils.inRange(level, 0, 1, "the methylation level must be in [0, 1]");
        this.coverage = ParamUtils.inRange(coverage, 0, Integer.MAX_VALUE, "the coverage cannot be negative");
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

    /**
     * @return the 0-based position.
     */
    public int getPosition() {
        return interval.getStart() - 1;
    }

    public String getStrand() {
        return strand;
    }

    public String getContext() {
        return context;
    }

    public double getLevel() {
        return level;
    }

    public int getCoverage() {
        return coverage;
    }

    public int getMethylatedReads() {
        return (int) FastMath.round(level * coverage);
    }

    public int getUnmethylatedReads() {
        return coverage - getMethylatedReads();
    }

    /**
     * @return methylated reads as successes, unmethylated reads as failures.
     */
    public PairedCount toPairedCount() {
        return new PairedCount(getMethylatedReads(), getUnmethylatedReads());
    }

    @Override
    public String toString() {
        return String.format("%s\t%d\t%s\t%s\t%s\t%d", getContig(), getPosition(), strand, context, level, coverage);
    }
}
