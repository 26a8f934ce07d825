package org.broadinstitute.methseg.utils.tsv;

import com.opencsv.CSVReader;
import org.broadinstitute.methseg.exceptions.UserException;
import org.broadinstitute.methseg.utils.Utils;
import org.broadinstitute.methseg.utils.io.IOUtils;

import java.io.Closeable;
import java.io.File;
import java.io.IOException;
import java.io.LineNumberReader;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Reader of tab separated value files written by {@link TableWriter}.
 * <p>
 * Lines starting with the {@link TableConstants#COMMENT_PREFIX comment prefix} are skipped. The first
 * non-comment line is the header; the following lines are data-lines with exactly one value per column.
 * </p>
 * <p>
 * Extending classes must implement {@link #createRecord(DataLine)} to translate each data-line
 * into a record, and may override {@link #processColumns(TableColumnCollection)} to verify the header.
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableReader<R> implements Closeable {

    /**
     * Name of the source, for error messages.
     */
    private final String source;

    private final LineNumberReader reader;

    private final CSVReader csvReader;

    private final TableColumnCollection columns;

    /**
     * Opens a table file, which may be gzipped, for reading.
     *
     * @param file the input file.
     * @throws IOException if it was raised when opening the file or reading its header.
     * @throws UserException.BadInput if the header line is missing or invalid.
     */
    public TableReader(final File file) throws IOException {
        this(Utils.nonNull(file, "the input file cannot be null").getPath(), IOUtils.makeReaderMaybeGzipped(file));
    }

    /**
     * Creates a table reader from any character source.
     *
     * @param sourceName name used in error messages, may be {@code null}.
     * @param sourceReader the reader to read from.
     * @throws IOException if it was raised when reading the header.
     */
    protected TableReader(final String sourceName, final Reader sourceReader) throws IOException {
        Utils.nonNull(sourceReader, "the reader cannot be null");
        this.source = sourceName;
        this.reader = sourceReader instanceof LineNumberReader ? (LineNumberReader) sourceReader : new LineNumberReader(sourceReader);
        this.csvReader = new CSVReader(this.reader, TableConstants.COLUMN_SEPARATOR, TableConstants.QUOTE_CHARACTER, TableConstants.ESCAPE_CHARACTER);
        final String[] header = skipCommentLines();
        TableColumnCollection.checkNames(header, this::formatException);
        columns = new TableColumnCollection(header);
        processColumns(columns);
    }

    private String[] skipCommentLines() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (!isCommentLine(line)) {
                return line;
            }
        }
        throw formatException("premature end of table: header line not found");
    }

    private boolean isCommentLine(final String[] line) {
        return line.length > 0 && line[0].startsWith(TableConstants.COMMENT_PREFIX);
    }

    /**
     * Composes the exception to throw when the input has a formatting issue, including the source and the line.
     */
    protected final UserException.BadInput formatException(final String message) {
        final String explanation = message == null ? "" : ": " + message;
        if (source == null) {
            return new UserException.BadInput(String.format("format error at line %d" + explanation, reader.getLineNumber()));
        } else {
            return new UserException.BadInput(String.format("format error in '%s' at line %d" + explanation, source, reader.getLineNumber()));
        }
    }

    /**
     * Checks the column names of the table. The default implementation accepts any columns.
     *
     * @param tableColumns the header columns.
     */
    protected void processColumns(@SuppressWarnings("unused") final TableColumnCollection tableColumns) {
        // nothing by default.
    }

    public TableColumnCollection columns() {
        return columns;
    }

    /**
     * Reads the next record.
     *
     * @return {@code null} if there are no more records.
     * @throws IOException if one was raised when reading.
     * @throws UserException.BadInput if a data-line does not have as many values as columns.
     */
    public final R readRecord() throws IOException {
        String[] line;
        while ((line = csvReader.readNext()) != null) {
            if (isCommentLine(line) || (line.length == 1 && line[0].isEmpty())) {
                continue;
            }
            if (line.length != columns.columnCount()) {
                throw formatException(String.format("mismatch between number of values in line (%d) and number of columns (%d)", line.length, columns.columnCount()));
            }
            final R result = createRecord(new DataLine(line, columns, this::formatException));
            if (result != null) {
                return result;
            }
        }
        return null;
    }

    /**
     * Reads all remaining records.
     */
    public List<R> toList() throws IOException {
        final List<R> result = new ArrayList<>();
        R record;
        while ((record = readRecord()) != null) {
            result.add(record);
        }
        return result;
    }

    /**
     * Transforms a data-line into a record, or returns {@code null} to skip it.
     *
     * @param dataLine the source data-line, never {@code null}.
     */
    protected abstract R createRecord(final DataLine dataLine);

    public String getSource() {
        return source;
    }

    @Override
    public void close() throws IOException {
        csvReader.close();
    }
}
