package org.broadinstitute.methseg.tools.methylation;

import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.util.MathArrays;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.hmm.HiddenSemiMarkovModel;
import org.broadinstitute.methseg.utils.hmm.PairedCount;
import org.broadinstitute.methseg.utils.hmm.PosteriorDecoding;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Assigns empirical p-values to domains against the scores of domains found in a random permutation of the
 * observations, and keeps those that pass a Benjamini-Hochberg cutoff.
 *
 * <p>The permuted observations are decoded with a copy of the trained parameters over the same blocks; the
 * trained model itself is not modified.</p>
 */
public final class DomainSignificanceTester {

    private static final Logger logger = LogManager.getLogger(DomainSignificanceTester.class);

    private final HiddenSemiMarkovModel model;
    private final RandomGenerator rng;

    public DomainSignificanceTester(final HiddenSemiMarkovModel model, final RandomGenerator rng) {
        this.model = Utils.nonNull(model, "the model cannot be null");
        this.rng = Utils.nonNull(rng, "the random generator cannot be null");
    }

    /**
     * Decodes one random permutation of the observations.
     *
     * @return the sorted scores of the domains found in the permuted data.
     */
    public double[] sampleNullScores(final List<MethylationSite> sites) {
        final List<PairedCount> observations = model.getObservations();
        Utils.validateArg(sites.size() == observations.size(), "there must be one site per observation");
        final int[] order = new int[observations.size()];
        for (int i = 0; i < order.length; i++) {
            order[i] = i;
        }
        MathArrays.shuffle(order, rng);
        final List<PairedCount> permuted = new ArrayList<>(order.length);
        for (final int index : order) {
            permuted.add(observations.get(index));
        }

        final PosteriorDecoding decoding = model.decode(permuted);
        final double[] scores = MethylationDomainBuilder.buildDomains(sites, permuted, decoding).stream()
                .mapToDouble(MethylationDomain::getScore)
                .toArray();
        Arrays.sort(scores);
        logger.info(String.format("Found %d domains in permuted data.", scores.length));
        return scores;
    }

    /**
     * Fraction of null scores strictly greater than {@code score}.
     *
     * @param sortedNullScores null scores in ascending order.
     */
    public static double pValue(final double[] sortedNullScores, final double score) {
        Utils.nonNull(sortedNullScores);
        final int notGreater = upperBound(sortedNullScores, score);
        return (sortedNullScores.length - notGreater) / (double) Math.max(1, sortedNullScores.length);
    }

    /**
     * @return the index of the first element greater than {@code value}.
     */
    private static int upperBound(final double[] sorted, final double value) {
        int low = 0;
        int high = sorted.length;
        while (low < high) {
            final int middle = (low + high) >>> 1;
            if (sorted[middle] <= value) {
                low = middle + 1;
            } else {
                high = middle;
            }
        }
        return low;
    }

    /**
     * Benjamini-Hochberg style p-value cutoff.
     *
     * <p>With the p-values sorted ascending, walks up from the smallest one while the next p-value is below
     * {@code fdr * rank / n}, and returns the p-value reached. Returns {@link Double#MAX_VALUE} when {@code fdr <= 0}
     * or there are no p-values, and {@code -Double.MAX_VALUE} when {@code fdr > 1}.</p>
     */
    public static double fdrCutoff(final double[] pValues, final double fdr) {
        Utils.nonNull(pValues);
        if (fdr <= 0) {
            return Double.MAX_VALUE;
        }
        if (fdr > 1) {
            return -Double.MAX_VALUE;
        }
        if (pValues.length == 0) {
            return Double.MAX_VALUE;
        }
        final double[] sorted = pValues.clone();
        Arrays.sort(sorted);
        final int n = sorted.length;
        int i = 0;
        while (i < n - 1 && sorted[i + 1] < fdr * (i + 1) / n) {
            i++;
        }
        return sorted[i];
    }

    /**
     * Scores the domains against one permutation and keeps the significant ones, renamed in order.
     *
     * @param domains domains of the observed data.
     * @param fdr false discovery rate.
     * @param filter whether to drop the domains that fail the cutoff.
     * @return every kept domain with its p-value.
     */
    public List<MethylationDomain> test(final List<MethylationSite> sites, final List<MethylationDomain> domains,
                                        final double fdr, final boolean filter) {
        Utils.nonNull(domains);
        final double[] nullScores = sampleNullScores(sites);
        final List<MethylationDomain> withPValues = new ArrayList<>(domains.size());
        for (final MethylationDomain domain : domains) {
            withPValues.add(domain.withPValue(pValue(nullScores, domain.getScore())));
        }
        final double cutoff = fdrCutoff(withPValues.stream().mapToDouble(MethylationDomain::getPValue).toArray(), fdr);
        return selectAndRename(withPValues, cutoff, filter);
    }

    /**
     * Keeps the domains with a p-value below the cutoff, or all of them when {@code filter} is false,
     * and renames them {@code HYPO0, HYPO1, ...}.
     */
    public static List<MethylationDomain> selectAndRename(final List<MethylationDomain> domains, final double cutoff,
                                                          final boolean filter) {
        final List<MethylationDomain> kept = new ArrayList<>();
        for (final MethylationDomain domain : domains) {
            if (!filter || domain.getPValue() < cutoff) {
                kept.add(domain.withName(MethylationDomain.nameOf(kept.size())));
            }
        }
        logger.info(String.format("Kept %d of %d domains with p-value cutoff %s.", kept.size(), domains.size(), cutoff));
        return kept;
    }
}
