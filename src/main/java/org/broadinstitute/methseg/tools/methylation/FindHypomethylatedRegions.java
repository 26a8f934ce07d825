package org.broadinstitute.methseg.tools.methylation;

import org.apache.commons.lang3.tuple.Pair;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.random.RandomGeneratorFactory;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.methseg.cmdline.CommandLineProgram;
import org.broadinstitute.methseg.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.methseg.cmdline.programgroups.MethylationProgramGroup;
import org.broadinstitute.methseg.exceptions.UserException;
import org.broadinstitute.methseg.utils.hmm.BaumWelchTrainer;
import org.broadinstitute.methseg.utils.hmm.HiddenSemiMarkovModel;
import org.broadinstitute.methseg.utils.hmm.PosteriorDecoding;
import org.broadinstitute.methseg.utils.hmm.SemiMarkovModelParameters;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Finds hypomethylated regions in per-cytosine methylation levels of a bisulfite sequencing sample.
 *
 * <p>Sites are segmented with a two-state hidden semi-Markov model whose hypomethylated state has an explicit
 * negative binomial duration. The model is trained by expectation-maximization unless parameters are given,
 * every site is labelled by posterior decoding, and runs of hypomethylated sites are reported as domains whose
 * significance is assessed against a random permutation of the sites.</p>
 *
 * <h3>Examples</h3>
 *
 * <pre>
 * java -jar methseg.jar FindHypomethylatedRegions \
 *   -I sample.meth \
 *   -O sample.hmr.tsv
 * </pre>
 *
 * <pre>
 * java -jar methseg.jar FindHypomethylatedRegions \
 *   -I sample.meth.gz \
 *   --input-parameters trained.params.tsv \
 *   --posterior-scores sample.posteriors.tsv \
 *   -O sample.hmr.tsv
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Segments per-cytosine methylation levels into hypomethylated domains and background " +
                "with a duration-aware hidden semi-Markov model, and reports the domains that pass a permutation-based " +
                "false discovery rate cutoff.",
        oneLineSummary = "Find hypomethylated regions in bisulfite sequencing methylation levels.",
        programGroup = MethylationProgramGroup.class
)
public final class FindHypomethylatedRegions extends CommandLineProgram {

    public static final String POSTERIOR_SCORES_LONG_NAME = "posterior-scores";
    public static final String INPUT_PARAMETERS_LONG_NAME = "input-parameters";
    public static final String OUTPUT_PARAMETERS_LONG_NAME = "output-parameters";

    @Argument(
            doc = "Methylation levels: contig, position, strand, context, level and coverage of each cytosine, sorted.",
            fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME
    )
    protected File inputFile;

    @Argument(
            doc = "Output table of hypomethylated domains.",
            fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
            shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME
    )
    protected File outputFile;

    @Argument(
            doc = "Output table of the posterior probability of each site being hypomethylated.",
            fullName = POSTERIOR_SCORES_LONG_NAME,
            optional = true
    )
    protected File posteriorScoresFile = null;

    @Argument(
            doc = "Model parameters to use instead of training.",
            fullName = INPUT_PARAMETERS_LONG_NAME,
            optional = true
    )
    protected File inputParametersFile = null;

    @Argument(
            doc = "Where to save the model parameters used to decode.",
            fullName = OUTPUT_PARAMETERS_LONG_NAME,
            optional = true
    )
    protected File outputParametersFile = null;

    @ArgumentCollection
    protected SegmenterArgumentCollection segmenterArguments = new SegmenterArgumentCollection();

    @Override
    protected String[] customCommandLineValidation() {
        try {
            segmenterArguments.validate();
        } catch (final IllegalArgumentException e) {
            return new String[] {e.getMessage()};
        }
        return null;
    }

    @Override
    protected Object doWork() {
        final MethylationSiteCollection sites = new MethylationSiteCollection(readSites(), segmenterArguments.desertSize);
        logger.info(String.format("Read %d covered sites in %d blocks from %s.",
                sites.size(), Math.max(0, sites.getResetPoints().length - 1), inputFile));

        if (sites.isEmpty()) {
            logger.warn("There are no covered sites; no domain will be reported.");
            writeDomains(Collections.emptyList());
            if (posteriorScoresFile != null) {
                writePosteriorScores(sites, null);
            }
            return "SUCCESS";
        }

        final HiddenSemiMarkovModel model = new HiddenSemiMarkovModel(sites.getObservations(), sites.getResetPoints(),
                loadOrCreateParameters(sites));
        if (inputParametersFile == null) {
            final BaumWelchTrainer.TrainingResult result =
                    new BaumWelchTrainer(segmenterArguments.maxIterations, segmenterArguments.convergenceTolerance).train(model);
            logger.info(String.format("Training finished after %d iterations (%s) with log-likelihood %s.",
                    result.getIterations(), result.getStatus(), result.getLogLikelihood()));
        }
        if (outputParametersFile != null) {
            writeParameters(model.getParameters());
        }

        final PosteriorDecoding decoding = model.decode();
        final List<MethylationDomain> domains =
                MethylationDomainBuilder.buildDomains(sites.getSites(), sites.getObservations(), decoding);
        logger.info(String.format("Found %d candidate domains.", domains.size()));

        final DomainSignificanceTester tester = new DomainSignificanceTester(model, createRandomGenerator());
        final List<MethylationDomain> reported = tester.test(sites.getSites(), domains,
                segmenterArguments.fdr, !segmenterArguments.disableFdrFilter);
        writeDomains(reported);
        if (posteriorScoresFile != null) {
            writePosteriorScores(sites, decoding);
        }
        return "SUCCESS";
    }

    private List<MethylationSite> readSites() {
        try (final MethylationSiteReader reader = new MethylationSiteReader(inputFile)) {
            return reader.readAll();
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(inputFile, e.getMessage(), e);
        }
    }

    private SemiMarkovModelParameters loadOrCreateParameters(final MethylationSiteCollection sites) {
        if (inputParametersFile == null) {
            return InitialModelParameters.create(sites.getMeanCoverage(), segmenterArguments.maxSegmentLength,
                    segmenterArguments.minProbability);
        }
        try {
            final SemiMarkovModelParameters parameters = ModelParametersFile.read(inputParametersFile, segmenterArguments.minProbability);
            logger.info(String.format("Loaded model parameters from %s; training is skipped.", inputParametersFile));
            return parameters;
        } catch (final IOException e) {
            throw new UserException.CouldNotReadInputFile(inputParametersFile, e.getMessage(), e);
        }
    }

    private RandomGenerator createRandomGenerator() {
        final long seed = segmenterArguments.randomSeed != null ? segmenterArguments.randomSeed
                : System.currentTimeMillis() ^ (ProcessHandle.current().pid() << 32);
        logger.debug("Permutation seed: " + seed);
        return RandomGeneratorFactory.createRandomGenerator(new Random(seed));
    }

    private void writeParameters(final SemiMarkovModelParameters parameters) {
        try {
            ModelParametersFile.write(outputParametersFile, parameters);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputParametersFile, e);
        }
    }

    private void writeDomains(final List<MethylationDomain> domains) {
        try (final MethylationDomainWriter writer = new MethylationDomainWriter(outputFile)) {
            writer.writeAllRecords(domains);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(outputFile, e);
        }
    }

    private void writePosteriorScores(final MethylationSiteCollection sites, final PosteriorDecoding decoding) {
        final List<Pair<MethylationSite, Double>> records = new ArrayList<>(sites.size());
        for (int i = 0; i < sites.size(); i++) {
            records.add(Pair.of(sites.getSites().get(i), decoding.getForegroundPosterior(i)));
        }
        try (final PosteriorScoreWriter writer = new PosteriorScoreWriter(posteriorScoresFile)) {
            writer.writeAllRecords(records);
        } catch (final IOException e) {
            throw new UserException.CouldNotCreateOutputFile(posteriorScoresFile, e);
        }
    }
}
