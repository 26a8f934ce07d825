package org.broadinstitute.methseg.tools.methylation;

import org.apache.commons.lang3.tuple.Pair;
import org.broadinstitute.methseg.exceptions.UserException;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.distributions.BetaBinomialEmission;
import org.broadinstitute.methseg.utils.distributions.GeometricDuration;
import org.broadinstitute.methseg.utils.distributions.NegativeBinomialDuration;
import org.broadinstitute.methseg.utils.hmm.DurationModel;
import org.broadinstitute.methseg.utils.hmm.EmissionModel;
import org.broadinstitute.methseg.utils.hmm.SemiMarkovModelParameters;
import org.broadinstitute.methseg.utils.tsv.DataLine;
import org.broadinstitute.methseg.utils.tsv.TableColumnCollection;
import org.broadinstitute.methseg.utils.tsv.TableReader;
import org.broadinstitute.methseg.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Two-column table of named model parameters, used to save a trained model and to reload it instead of training.
 *
 * <pre>
 *     PARAMETER                  VALUE
 *     FOREGROUND_EMISSION_alpha  3.1
 *     ...
 *     FOREGROUND_DURATION        NegativeBinomial
 *     FOREGROUND_DURATION_r      1.2
 * </pre>
 */
public final class ModelParametersFile {

    static final String FOREGROUND_EMISSION = "FOREGROUND_EMISSION";
    static final String BACKGROUND_EMISSION = "BACKGROUND_EMISSION";
    static final String FOREGROUND_DURATION = "FOREGROUND_DURATION";
    static final String BACKGROUND_DURATION = "BACKGROUND_DURATION";
    static final String START_FOREGROUND = "START_FOREGROUND";
    static final String START_BACKGROUND = "START_BACKGROUND";
    static final String TERMINATE_FOREGROUND = "TERMINATE_FOREGROUND";
    static final String TERMINATE_BACKGROUND = "TERMINATE_BACKGROUND";
    static final String MAX_SEGMENT_LENGTH = "MAX_SEGMENT_LENGTH";

    private ModelParametersFile() {}

    public static void write(final File file, final SemiMarkovModelParameters parameters) throws IOException {
        try (final ParameterWriter writer = new ParameterWriter(file)) {
            writer.writeAllRecords(toRecords(parameters));
        }
    }

    public static void write(final Writer output, final SemiMarkovModelParameters parameters) throws IOException {
        try (final ParameterWriter writer = new ParameterWriter(output)) {
            writer.writeAllRecords(toRecords(parameters));
        }
    }

    /**
     * @param minProbability floor of the background switch probability; it is not stored in the file.
     * @throws UserException.BadModelParameters if a parameter is missing or unusable.
     */
    public static SemiMarkovModelParameters read(final File file, final double minProbability) throws IOException {
        try (final ParameterReader reader = new ParameterReader(file)) {
            return fromRecords(reader.getSource(), reader.toList(), minProbability);
        }
    }

    public static SemiMarkovModelParameters read(final String source, final Reader input, final double minProbability) throws IOException {
        try (final ParameterReader reader = new ParameterReader(source, input)) {
            return fromRecords(source, reader.toList(), minProbability);
        }
    }

    private static List<Pair<String, String>> toRecords(final SemiMarkovModelParameters parameters) {
        Utils.nonNull(parameters, "the parameters cannot be null");
        final List<Pair<String, String>> records = new ArrayList<>();
        addEmission(records, FOREGROUND_EMISSION, parameters.getForegroundEmission());
        addEmission(records, BACKGROUND_EMISSION, parameters.getBackgroundEmission());
        addDuration(records, FOREGROUND_DURATION, parameters.getForegroundDuration());
        addDuration(records, BACKGROUND_DURATION, parameters.getBackgroundDuration());
        records.add(Pair.of(START_FOREGROUND, Double.toString(parameters.getStartForeground())));
        records.add(Pair.of(START_BACKGROUND, Double.toString(parameters.getStartBackground())));
        records.add(Pair.of(TERMINATE_FOREGROUND, Double.toString(parameters.getTerminateForeground())));
        records.add(Pair.of(TERMINATE_BACKGROUND, Double.toString(parameters.getTerminateBackground())));
        records.add(Pair.of(MAX_SEGMENT_LENGTH, Integer.toString(parameters.getMaxSegmentLength())));
        return records;
    }

    private static void addEmission(final List<Pair<String, String>> records, final String role, final EmissionModel model) {
        Utils.validateArg(model instanceof BetaBinomialEmission, () -> "only beta-binomial emissions can be saved: " + model.getFamilyName());
        addParameters(records, role, model.getParameterNames(), model.getParameters());
    }

    private static void addDuration(final List<Pair<String, String>> records, final String role, final DurationModel model) {
        records.add(Pair.of(role, model.getFamilyName()));
        addParameters(records, role, model.getParameterNames(), model.getParameters());
    }

    private static void addParameters(final List<Pair<String, String>> records, final String role,
                                      final String[] names, final double[] values) {
        for (int i = 0; i < names.length; i++) {
            records.add(Pair.of(role + "_" + names[i], Double.toString(values[i])));
        }
    }

    private static SemiMarkovModelParameters fromRecords(final String source, final List<Pair<String, String>> records,
                                                         final double minProbability) {
        final Map<String, String> values = new LinkedHashMap<>();
        for (final Pair<String, String> record : records) {
            if (values.put(record.getKey(), record.getValue()) != null) {
                throw new UserException.BadModelParameters(source, "repeated parameter " + record.getKey());
            }
        }
        final ParameterLookup lookup = new ParameterLookup(source, values);
        try {
            return new SemiMarkovModelParameters(
                    readEmission(lookup, FOREGROUND_EMISSION),
                    readEmission(lookup, BACKGROUND_EMISSION),
                    readDuration(lookup, FOREGROUND_DURATION),
                    readDuration(lookup, BACKGROUND_DURATION),
                    lookup.getDouble(START_FOREGROUND),
                    lookup.getDouble(START_BACKGROUND),
                    lookup.getDouble(TERMINATE_FOREGROUND),
                    lookup.getDouble(TERMINATE_BACKGROUND),
                    lookup.getInt(MAX_SEGMENT_LENGTH),
                    minProbability);
        } catch (final IllegalArgumentException e) {
            throw new UserException.BadModelParameters(source, e.getMessage(), e);
        }
    }

    private static EmissionModel readEmission(final ParameterLookup lookup, final String role) {
        return new BetaBinomialEmission(lookup.getDouble(role + "_" + BetaBinomialEmission.ALPHA_NAME),
                lookup.getDouble(role + "_" + BetaBinomialEmission.BETA_NAME));
    }

    private static DurationModel readDuration(final ParameterLookup lookup, final String role) {
        final String family = lookup.get(role);
        switch (family) {
            case GeometricDuration.FAMILY_NAME:
                return new GeometricDuration(lookup.getDouble(role + "_" + GeometricDuration.P_NAME));
            case NegativeBinomialDuration.FAMILY_NAME:
                return new NegativeBinomialDuration(lookup.getDouble(role + "_" + NegativeBinomialDuration.R_NAME),
                        lookup.getDouble(role + "_" + NegativeBinomialDuration.P_NAME));
            default:
                throw new UserException.BadModelParameters(lookup.source, String.format("unknown duration family '%s' for %s", family, role));
        }
    }

    private static final class ParameterLookup {
        private final String source;
        private final Map<String, String> values;

        private ParameterLookup(final String source, final Map<String, String> values) {
            this.source = source;
            this.values = values;
        }

        private String get(final String name) {
            final String value = values.get(name);
            if (value == null) {
                throw new UserException.BadModelParameters(source, "missing parameter " + name);
            }
            return value;
        }

        private double getDouble(final String name) {
            final String value = get(name);
            try {
                return Double.parseDouble(value);
            } catch (final NumberFormatException e) {
                throw new UserException.BadModelParameters(source, String.format("the value '%s' of %s is not a number", value, name), e);
            }
        }

        private int getInt(final String name) {
            final String value = get(name);
            try {
                return Integer.parseInt(value);
            } catch (final NumberFormatException e) {
                throw new UserException.BadModelParameters(source, String.format("the value '%s' of %s is not an integer", value, name), e);
            }
        }
    }

    private static final class ParameterWriter extends TableWriter<Pair<String, String>> {

        private ParameterWriter(final File file) throws IOException {
            super(file, MethylationTableColumn.PARAMETER_COLUMNS);
        }

        private ParameterWriter(final Writer writer) {
            super(writer, MethylationTableColumn.PARAMETER_COLUMNS);
        }

        @Override
        protected void composeLine(final Pair<String, String> record, final DataLine dataLine) {
            dataLine.append(record.getKey()).append(record.getValue());
        }
    }

    private static final class ParameterReader extends TableReader<Pair<String, String>> {

        private ParameterReader(final File file) throws IOException {
            super(file);
        }

        private ParameterReader(final String source, final Reader reader) throws IOException {
            super(source, reader);
        }

        @Override
        protected void processColumns(final TableColumnCollection tableColumns) {
            if (!tableColumns.matchesExactly(MethylationTableColumn.PARAMETER.toString(), MethylationTableColumn.VALUE.toString())) {
                throw formatException("expected the columns " + MethylationTableColumn.PARAMETER_COLUMNS.names()
                        + " but found " + tableColumns.names());
            }
        }

        @Override
        protected Pair<String, String> createRecord(final DataLine dataLine) {
            return Pair.of(dataLine.get(0), dataLine.get(1));
        }
    }
}
