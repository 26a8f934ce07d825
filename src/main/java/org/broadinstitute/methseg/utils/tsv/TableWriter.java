package org.broadinstitute.methseg.utils.tsv;

import com.opencsv.CSVWriter;
import org.broadinstitute.methseg.utils.Utils;

import java.io.Closeable;
import java.io.File;
import java.io.FileWriter;
import java.io.IOException;
import java.io.Writer;

/**
 * Class to write tab separated value files.
 * <p>
 * The column (and they names) are passed in the constructor parameter along the output {@link File file}
 * or {@link Writer writer}.
 * </p>
 * <p>
 * Extending classes must indicate how we can transcribe row record or type {@link R} to the corresponding
 * record data-line in the output by overriding {@link #composeLine(R,DataLine)}:
 * <pre>
 *         &#64;Override
 *          protected void composeLine(final MethylationDomain domain, final DataLine dataLine) {
 *              dataLine
 *                  .append(domain.getContig())
 *                  .append(domain.getStart())
 *                  .append(domain.getEnd());
 *          }
 *     </pre>
 * </p>
 * <p>
 * You must use the {@link DataLine} instance passed and no other.
 * </p>
 *
 * @param <R> the row record type.
 */
public abstract class TableWriter<R> implements Closeable {

    /**
     * Csv writer use to do the actual writing.
     */
    private final CSVWriter writer;

    /**
     * The table column names.
     */
    private final TableColumnCollection columns;

    /**
     * Whether the header column name line has been written or not.
     */
    private boolean headerWritten = false;

    /**
     * Creates a new table writer given the file and column names.
     *
     * @param file         the destination file.
     * @param tableColumns the table column names.
     * @throws IllegalArgumentException if either {@code file} or {@code tableColumns} are {@code null}.
     * @throws IOException              if one was raised when opening the the destination file for writing.
     */
    public TableWriter(final File file, final TableColumnCollection tableColumns) throws IOException {
        this(new FileWriter(Utils.nonNull(file, "The file cannot be null.")), tableColumns);
    }

    /**
     * Creates a new table writer given the destination writer and column names.
     *
     * @param writer  the destination writer.
     * @param columns the table column names.
     * @throws IllegalArgumentException if either {@code writer} or {@code columns} are {@code null}.
     */
    public TableWriter(final Writer writer, final TableColumnCollection columns) {
        this.columns = Utils.nonNull(columns, "The columns cannot be null.");
        this.writer = new CSVWriter(Utils.nonNull(writer, "the input writer cannot be null"),
                TableConstants.COLUMN_SEPARATOR, CSVWriter.NO_QUOTE_CHARACTER, TableConstants.ESCAPE_CHARACTER);
    }

    /**
     * Writes a comment into the output.
     * <p>
     * This can be invoked at any time; comment lines can be present anywhere in the file.
     * </p>
     *
     * @param comment the comment to write out.
     * @throws IllegalArgumentException if {@code comment} is {@code null}.
     * @throws IOException              if any was raised by this operation.
     */
    public final void writeComment(final String comment) throws IOException {
        Utils.nonNull(comment, "The comment cannot be null.");
        writer.writeNext(new String[]{TableConstants.COMMENT_PREFIX + comment}, false);
    }

    /**
     * Writes a new record.
     *
     * @param record the record to write.
     * @throws IOException              if it was raised when writing the record.
     * @throws IllegalArgumentException if {@code record} is {@code null} or it is not a valid record
     *                                  as per the implementation of this writer (see {@link #composeLine}).
     */
    public void writeRecord(final R record) throws IOException {
        Utils.nonNull(record, "The record cannot be null.");
        writeHeaderIfApplies();
        final DataLine dataLine = new DataLine(columns, IllegalArgumentException::new);
        composeLine(record, dataLine);
        writer.writeNext(dataLine.unpack(), false);
    }

    /**
     * Write all the records in a {@link Iterable}, in the order they appear.
     *
     * @param records to write.
     * @throws IOException              if any raised when writing any of the records.
     */
    public final void writeAllRecords(final Iterable<R> records) throws IOException {
        Utils.nonNull(records, "The record iterable cannot be null.");
        for (final R record : records) {
            writeRecord(record);
        }
    }

    @Override
    public final void close() throws IOException {
        writeHeaderIfApplies();
        writer.close();
    }

    /**
     * Writes the header if it has not been written already.
     * <p>
     * The header is written automatically before the first record is written or when the writer is closed
     * and no record was written.
     * </p>
     *
     * @throws IOException if any raised when writing into the destination writer.
     */
    public void writeHeaderIfApplies() throws IOException {
        if (!headerWritten) {
            writer.writeNext(columns.names().toArray(new String[columns.columnCount()]), false);
        }
        headerWritten = true;
    }

    /**
     * Composes the data-line to write into the output to represent a given record
     * <p>
     * Both inputs, {@code record} and {@code dataLine} are guaranteed not to be {@code null}s.
     * </p>
     *
     * @param record the record to write into the data-line.
     * @param dataLine the destination data-line object.
     * @throws IllegalArgumentException if there is some conversion issue that does
     *                                  not allow the current write to generate a valid string array to encode the record.
     */
    protected abstract void composeLine(final R record, final DataLine dataLine);
}
