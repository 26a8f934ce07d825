package org.broadinstitute.methseg.tools.methylation;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.hmm.PairedCount;
import org.broadinstitute.methseg.utils.param.ParamUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Sorted sites with read coverage, their observations and the reset points that split them into
 * independent blocks.
 *
 * <p>A block ends at every contig change and wherever two consecutive sites of a contig are farther apart than the
 * desert size.</p>
 */
public final class MethylationSiteCollection {

    private static final Logger logger = LogManager.getLogger(MethylationSiteCollection.class);

    public static final int DEFAULT_DESERT_SIZE = 1000;

    private final List<MethylationSite> sites;
    private final List<PairedCount> observations;
    private final int[] resetPoints;

    /**
     * @param sites sorted sites; those without coverage are dropped.
     * @param desertSize largest gap in bases allowed between consecutive sites of one block.
     */
    public MethylationSiteCollection(final List<MethylationSite> sites, final int desertSize) {
        Utils.nonNull(sites, "the sites cannot be null");
        ParamUtils.inRange(desertSize, 0, Integer.MAX_VALUE, "the desert size cannot be negative");
        final List<MethylationSite> covered = sites.stream().filter(s -> s.getCoverage() > 0).collect(Collectors.toList());
        final int dropped = sites.size() - covered.size();
        if (dropped > 0) {
            logger.info(String.format("Dropped %d of %d sites with no read coverage.", dropped, sites.size()));
        }
        this.sites = Collections.unmodifiableList(covered);
        this.observations = Collections.unmodifiableList(
                covered.stream().map(MethylationSite::toPairedCount).collect(Collectors.toList()));
        this.resetPoints = computeResetPoints(covered, desertSize);
    }

    static int[] computeResetPoints(final List<MethylationSite> sites, final int desertSize) {
        final List<Integer> points = new ArrayList<>();
        points.add(0);
        for (int i = 1; i < sites.size(); i++) {
            final MethylationSite previous = sites.get(i - 1);
            final MethylationSite current = sites.get(i);
            if (!current.getContig().equals(previous.getContig())
                    || current.getPosition() - previous.getPosition() > desertSize) {
                points.add(i);
            }
        }
        if (!sites.isEmpty()) {
            points.add(sites.size());
        }
        return points.stream().mapToInt(Integer::intValue).toArray();
    }

    public List<MethylationSite> getSites() {
        return sites;
    }

    public List<PairedCount> getObservations() {
        return observations;
    }

    /**
     * @return strictly increasing reset points from 0 to the number of sites; just {@code [0]} when there are none.
     */
    public int[] getResetPoints() {
        return resetPoints.clone();
    }

    public int size() {
        return sites.size();
    }

    public boolean isEmpty() {
        return sites.isEmpty();
    }

    /**
     * @return average coverage of the sites, 0 when there are none.
     */
    public double getMeanCoverage() {
        return sites.stream().mapToInt(MethylationSite::getCoverage).average().orElse(0);
    }
}
