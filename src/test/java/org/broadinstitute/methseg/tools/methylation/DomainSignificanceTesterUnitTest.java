package org.broadinstitute.methseg.tools.methylation;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.broadinstitute.methseg.testutils.BaseTest;
import org.broadinstitute.methseg.utils.SimpleInterval;
import org.broadinstitute.methseg.utils.hmm.HiddenSemiMarkovModel;
import org.broadinstitute.methseg.utils.hmm.PosteriorDecoding;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import java.util.stream.Collectors;

public final class DomainSignificanceTesterUnitTest extends BaseTest {

    private static RandomGenerator rng(final long seed) {
        return RandomGeneratorFactory.createRandomGenerator(new Random(seed));
    }

    private static HiddenSemiMarkovModel model(final List<MethylationSite> sites) {
        final MethylationSiteCollection collection = new MethylationSiteCollection(sites, 1000);
        return new HiddenSemiMarkovModel(collection.getObservations(), collection.getResetPoints(),
                MethylationTestUtils.hypomethylatedParameters(50));
    }

    @DataProvider(name = "pValues")
    public Object[][] pValues() {
        final double[] nullScores = {1, 2, 2, 3};
        return new Object[][] {
                {nullScores, 0.5, 1.0},
                {nullScores, 1.0, 0.75},
                {nullScores, 2.0, 0.25},
                {nullScores, 2.5, 0.25},
                {nullScores, 3.0, 0.0},
                {nullScores, 10.0, 0.0},
                {new double[0], 1.0, 0.0}
        };
    }

    @Test(dataProvider = "pValues")
    public void testPValue(final double[] sortedNullScores, final double score, final double expected) {
        Assert.assertEquals(DomainSignificanceTester.pValue(sortedNullScores, score), expected);
    }

    @Test
    public void testFdrCutoffBounds() {
        final double[] pValues = {0.01, 0.2};
        Assert.assertEquals(DomainSignificanceTester.fdrCutoff(pValues, 0), Double.MAX_VALUE);
        Assert.assertEquals(DomainSignificanceTester.fdrCutoff(pValues, -0.5), Double.MAX_VALUE);
        Assert.assertEquals(DomainSignificanceTester.fdrCutoff(pValues, 1.5), -Double.MAX_VALUE);
        Assert.assertEquals(DomainSignificanceTester.fdrCutoff(new double[0], 0.05), Double.MAX_VALUE);
    }

    @Test
    public void testFdrCutoff() {
        final double[] pValues = {0.5, 0.003, 0.001, 0.002};
        Assert.assertEquals(DomainSignificanceTester.fdrCutoff(pValues, 0.1), 0.003);
        Assert.assertEquals(DomainSignificanceTester.fdrCutoff(pValues, 0.001), 0.001);
        Assert.assertEquals(DomainSignificanceTester.fdrCutoff(pValues, 1.0), 0.5);
        // the input is left unsorted
        Assert.assertEquals(pValues, new double[] {0.5, 0.003, 0.001, 0.002});
    }

    @Test
    public void testFdrCutoffGrowsWithRate() {
        final Random random = new Random(3);
        final double[] pValues = new double[100];
        for (int i = 0; i < pValues.length; i++) {
            pValues[i] = random.nextDouble() * random.nextDouble();
        }
        double previous = -Double.MAX_VALUE;
        for (double fdr = 0.01; fdr <= 1.0; fdr += 0.01) {
            final double cutoff = DomainSignificanceTester.fdrCutoff(pValues, fdr);
            Assert.assertTrue(cutoff >= previous, "fdr " + fdr);
            previous = cutoff;
        }
    }

    @Test
    public void testSelectAndRename() {
        final List<MethylationDomain> domains = new ArrayList<>();
        final double[] pValues = {0.001, 0.2, 0.0005, 0.003};
        for (int i = 0; i < pValues.length; i++) {
            domains.add(new MethylationDomain(new SimpleInterval("chr1", 10 * i + 1, 10 * i + 5), MethylationDomain.nameOf(i),
                    2.0, 3, pValues[i]));
        }

        final List<MethylationDomain> kept = DomainSignificanceTester.selectAndRename(domains, 0.003, true);
        Assert.assertEquals(kept.stream().map(MethylationDomain::getStart).collect(Collectors.toList()), Arrays.asList(1, 21));
        Assert.assertEquals(kept.stream().map(MethylationDomain::getName).collect(Collectors.toList()), Arrays.asList("HYPO0", "HYPO1"));

        final List<MethylationDomain> all = DomainSignificanceTester.selectAndRename(domains, 0.003, false);
        Assert.assertEquals(all.size(), 4);
        Assert.assertEquals(all.get(3).getName(), "HYPO3");
        Assert.assertEquals(all.get(3).getPValue(), 0.003);
    }

    @Test
    public void testZeroPValuesAreFilteredOut() {
        final List<MethylationDomain> domains = Arrays.asList(
                new MethylationDomain(new SimpleInterval("chr1", 1, 5), "HYPO0", 2.0, 3, 0.0),
                new MethylationDomain(new SimpleInterval("chr1", 11, 15), "HYPO1", 2.0, 3, 0.0));
        final double cutoff = DomainSignificanceTester.fdrCutoff(new double[] {0.0, 0.0}, 0.01);
        Assert.assertEquals(cutoff, 0.0);
        Assert.assertTrue(DomainSignificanceTester.selectAndRename(domains, cutoff, true).isEmpty());
    }

    @Test
    public void testSingleHypomethylatedRun() {
        final List<MethylationSite> sites = MethylationTestUtils.sites("chr1", 100, 10, 10, 1, 1, 1);
        final HiddenSemiMarkovModel model = model(sites);
        final PosteriorDecoding decoding = model.decode();
        final List<MethylationDomain> domains = MethylationDomainBuilder.buildDomains(sites, model.getObservations(), decoding);
        Assert.assertEquals(domains.size(), 1);
        Assert.assertEquals(domains.get(0).getNumSites(), 3);

        final DomainSignificanceTester tester = new DomainSignificanceTester(model, rng(11));
        // every permutation of identical sites finds the same domain, and no null score exceeds it
        final List<MethylationDomain> tested = tester.test(sites, domains, 0.01, false);
        Assert.assertEquals(tested.size(), 1);
        Assert.assertEquals(tested.get(0).getPValue(), 0.0);
        Assert.assertTrue(new DomainSignificanceTester(model, rng(11)).test(sites, domains, 0.01, true).isEmpty());
    }

    @Test
    public void testMethylatedRunHasNoDomain() {
        final List<MethylationSite> sites = MethylationTestUtils.sites("chr1", 100, 10, 10, 9, 9, 9, 9);
        final HiddenSemiMarkovModel model = model(sites);
        final List<MethylationDomain> domains = MethylationDomainBuilder.buildDomains(sites, model.getObservations(), model.decode());
        Assert.assertTrue(domains.isEmpty());
        Assert.assertTrue(new DomainSignificanceTester(model, rng(11)).test(sites, domains, 0.01, true).isEmpty());
    }

    @Test
    public void testSameSeedSameNull() {
        final List<MethylationSite> sites = new ArrayList<>();
        final int[] methylated = new int[200];
        for (int i = 0; i < methylated.length; i++) {
            methylated[i] = (i / 20) % 3 == 0 ? i % 3 : 7 + i % 4;
        }
        sites.addAll(MethylationTestUtils.sites("chr1", 100, 10, 10, methylated));
        final HiddenSemiMarkovModel model = model(sites);

        final double[] first = new DomainSignificanceTester(model, rng(42)).sampleNullScores(sites);
        final double[] second = new DomainSignificanceTester(model, rng(42)).sampleNullScores(sites);
        Assert.assertEquals(first, second);
        for (int i = 1; i < first.length; i++) {
            Assert.assertTrue(first[i - 1] <= first[i]);
        }
    }

    @Test
    public void testNullDoesNotChangeModel() {
        final List<MethylationSite> sites = MethylationTestUtils.sites("chr1", 100, 10, 10, 1, 1, 9, 9, 1, 9, 9, 9);
        final HiddenSemiMarkovModel model = model(sites);
        final double[] before = model.getParameters().getForegroundEmission().getParameters();
        final double logLikelihood = model.expectationStep();

        new DomainSignificanceTester(model, rng(5)).sampleNullScores(sites);

        Assert.assertEquals(model.getParameters().getForegroundEmission().getParameters(), before);
        Assert.assertEquals(model.expectationStep(), logLikelihood, 1e-12);
    }
}
