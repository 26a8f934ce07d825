package org.broadinstitute.methseg.tools.methylation;

import org.broadinstitute.methseg.testutils.BaseTest;
import org.broadinstitute.methseg.utils.SimpleInterval;
import org.broadinstitute.methseg.utils.hmm.PairedCount;
import org.broadinstitute.methseg.utils.hmm.PosteriorDecoding;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public final class MethylationDomainBuilderUnitTest extends BaseTest {

    private static PosteriorDecoding decoding(final int[] resetPoints, final boolean... foreground) {
        final double[] posteriors = new double[foreground.length];
        for (int i = 0; i < foreground.length; i++) {
            posteriors[i] = foreground[i] ? 0.9 : 0.1;
        }
        return new PosteriorDecoding(foreground, posteriors, resetPoints);
    }

    @Test
    public void testDomainsEndAtBackgroundAndAtBlockEnds() {
        final List<MethylationSite> sites = MethylationTestUtils.sites("chr1", 100, 10, 10, 1, 2, 9, 0, 3, 4, 5);
        final List<PairedCount> observations = sites.stream().map(MethylationSite::toPairedCount).collect(Collectors.toList());
        // the last foreground run of the first block touches the first run of the second one
        final PosteriorDecoding decoding = decoding(new int[] {0, 4, 7}, true, true, false, true, true, true, false);

        final List<MethylationDomain> domains = MethylationDomainBuilder.buildDomains(sites, observations, decoding);

        Assert.assertEquals(domains.size(), 3);
        Assert.assertEquals(domains.get(0).getInterval(), new SimpleInterval("chr1", 101, 111));
        Assert.assertEquals(domains.get(0).getNumSites(), 2);
        Assert.assertEquals(domains.get(0).getScore(), 0.9 + 0.8, 1e-12);
        Assert.assertEquals(domains.get(1).getInterval(), new SimpleInterval("chr1", 131, 131));
        Assert.assertEquals(domains.get(1).getScore(), 1.0, 1e-12);
        Assert.assertEquals(domains.get(2).getInterval(), new SimpleInterval("chr1", 141, 151));
        Assert.assertEquals(domains.get(2).getNumSites(), 2);
        Assert.assertEquals(domains.get(2).getScore(), 0.7 + 0.6, 1e-12);
        for (int i = 0; i < domains.size(); i++) {
            Assert.assertEquals(domains.get(i).getName(), "HYPO" + i);
            Assert.assertTrue(Double.isNaN(domains.get(i).getPValue()));
        }
    }

    @Test
    public void testNoForeground() {
        final List<MethylationSite> sites = MethylationTestUtils.sites("chr1", 0, 1, 4, 4, 4, 4);
        final List<PairedCount> observations = sites.stream().map(MethylationSite::toPairedCount).collect(Collectors.toList());
        Assert.assertTrue(MethylationDomainBuilder.buildDomains(sites, observations,
                decoding(new int[] {0, 3}, false, false, false)).isEmpty());
    }

    @Test
    public void testScoresUseGivenObservations() {
        final List<MethylationSite> sites = MethylationTestUtils.sites("chr1", 0, 1, 4, 4, 4);
        final List<PairedCount> observations = Arrays.asList(new PairedCount(0, 4), new PairedCount(1, 3));
        final List<MethylationDomain> domains = MethylationDomainBuilder.buildDomains(sites, observations,
                decoding(new int[] {0, 2}, true, true));
        Assert.assertEquals(domains.size(), 1);
        Assert.assertEquals(domains.get(0).getScore(), 1.75, 1e-12);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLengthMismatch() {
        final List<MethylationSite> sites = MethylationTestUtils.sites("chr1", 0, 1, 4, 4, 4);
        final List<PairedCount> observations = sites.stream().map(MethylationSite::toPairedCount).collect(Collectors.toList());
        MethylationDomainBuilder.buildDomains(sites, observations, decoding(new int[] {0, 3}, true, true, true));
    }
}
