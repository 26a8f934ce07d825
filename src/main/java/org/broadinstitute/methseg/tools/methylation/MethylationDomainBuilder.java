package org.broadinstitute.methseg.tools.methylation;

import org.broadinstitute.methseg.utils.SimpleInterval;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.hmm.PairedCount;
import org.broadinstitute.methseg.utils.hmm.PosteriorDecoding;

import java.util.ArrayList;
import java.util.List;

/**
 * Collapses runs of foreground labels into {@link MethylationDomain}s.
 */
public final class MethylationDomainBuilder {

    private MethylationDomainBuilder() {}

    /**
     * Builds the domains of a decoding, numbered in order of discovery.
     *
     * @param sites genomic location of every position.
     * @param observations counts used to score the domains; may differ from those of the sites.
     */
    public static List<MethylationDomain> buildDomains(final List<MethylationSite> sites,
                                                       final List<PairedCount> observations,
                                                       final PosteriorDecoding decoding) {
        Utils.nonNull(sites);
        Utils.nonNull(observations);
        Utils.nonNull(decoding);
        Utils.validateArg(sites.size() == decoding.size() && observations.size() == decoding.size(),
                "sites, observations and decoding must have the same length");

        final List<MethylationDomain> domains = new ArrayList<>();
        for (int b = 0; b < decoding.getNumberOfSubsequences(); b++) {
            final int end = decoding.getSubsequenceEnd(b);
            int domainStart = -1;
            double score = 0;
            for (int i = decoding.getSubsequenceStart(b); i < end; i++) {
                if (decoding.isForeground(i)) {
                    if (domainStart < 0) {
                        domainStart = i;
                        score = 0;
                    }
                    score += 1 - observations.get(i).getSuccessFraction();
                } else if (domainStart >= 0) {
                    domains.add(makeDomain(sites, domainStart, i - 1, score, domains.size()));
                    domainStart = -1;
                }
            }
            if (domainStart >= 0) {
                domains.add(makeDomain(sites, domainStart, end - 1, score, domains.size()));
            }
        }
        return domains;
    }

    private static MethylationDomain makeDomain(final List<MethylationSite> sites, final int first, final int last,
                                                final double score, final int index) {
        final MethylationSite firstSite = sites.get(first);
        final SimpleInterval interval = new SimpleInterval(firstSite.getContig(), firstSite.getStart(), sites.get(last).getEnd());
        return new MethylationDomain(interval, MethylationDomain.nameOf(index), score, last - first + 1);
    }
}
