package org.broadinstitute.methseg.utils.tsv;

import org.broadinstitute.methseg.utils.Utils;

import java.util.function.Function;

/**
 * Table data-line string array wrapper.
 * <p>
 * This wrapper includes convenience methods to {@link #get get} and {@link #set set} values on <i>data-line</i> string array from within
 * record type conversion methods:
 * {@link TableReader#createRecord(DataLine) TableReader.createRecord} and {@link TableWriter#composeLine TableWriter.composeLine}.
 * </p>
 * <p>
 * Apart for {@link #set set} operations, it includes convenience methods to set column values in order
 * of appearance when this is known using {@link #append append}.
 * </p>
 */
public final class DataLine {

    /**
     * Holds the values for the data line in construction.
     */
    private final String[] values;

    /**
     * Next appending index used by {@link #append append} methods.
     */
    private int nextIndex = 0;

    /**
     * Reference to the enclosing table's columns.
     */
    private final TableColumnCollection columns;

    /**
     * Reference to the format error exception factory.
     */
    private final Function<String, RuntimeException> formatErrorFactory;

    /**
     * Creates a new data-line instance.
     * <p>
     * The value array passed is not copied and will be used directly to store the data-line values.
     * </p>
     *
     * @param values             the value array.
     * @param columns            the columns of the table that will enclose this data-line instance.
     * @param formatErrorFactory to be used when there is a column formatting error based on the requested data-type.
     * @throws IllegalArgumentException if {@code columns} or {@code formatErrorFactory} are {@code null}.
     */
    DataLine(final String[] values, final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this.values = Utils.nonNull(values, "the value array cannot be null");
        this.columns = Utils.nonNull(columns, "the columns cannot be null");
        this.formatErrorFactory = Utils.nonNull(formatErrorFactory, "the format error factory cannot be null");
        if (values.length != columns.columnCount()) {
            throw new IllegalArgumentException("mismatching value length and column count");
        }
    }

    /**
     * Creates a new empty data-line instance.
     *
     * @param columns            the columns of the table that will enclose this data-line instance.
     * @param formatErrorFactory to be used when there is a column formatting error based on the requested data-type.
     */
    public DataLine(final TableColumnCollection columns, final Function<String, RuntimeException> formatErrorFactory) {
        this(new String[Utils.nonNull(columns, "the columns cannot be null").columnCount()], columns, formatErrorFactory);
    }

    public TableColumnCollection columns() {
        return columns;
    }

    /**
     * Returns a reference to the data-line values after making sure that they are all defined.
     *
     * @return never {@code null} and with no {@code null} elements.
     */
    String[] unpack() {
        for (int i = 0; i < values.length; i++) {
            if (values[i] == null) {
                throw new IllegalStateException(String.format("some data line value remains undefined: e.g. column '%s' index %d", columns.nameAt(i), i));
            }
        }
        return values;
    }

    /**
     * Sets the string value of a column given its index.
     *
     * @param index the target column index.
     * @param value the new value for that column.
     * @return reference to this data-line.
     * @throws IllegalArgumentException if {@code index} is not a valid column index.
     */
    public DataLine set(final int index, final String value) {
        Utils.validateArg(index >= 0 && index < values.length, () -> "invalid column index: " + index);
        if (index == 0 && value != null && value.startsWith(TableConstants.COMMENT_PREFIX)) {
            throw new IllegalArgumentException("the value of the first column cannot start with the comment prefix: " + TableConstants.COMMENT_PREFIX);
        }
        values[index] = value;
        return this;
    }

    /**
     * Returns the string value in a column by its index.
     *
     * @param index target column index.
     * @return never {@code null}.
     * @throws IllegalStateException    if the value for that column is undefined ({@code null}).
     */
    public String get(final int index) {
        Utils.validateArg(index >= 0 && index < values.length, () -> "invalid column index: " + index);
        if (values[index] == null) {
            throw new IllegalStateException("requested column value at " + index + " has not been initialized yet");
        }
        return values[index];
    }

    public String get(final String columnName) {
        return get(columnIndex(columnName));
    }

    /**
     * Returns the int value in a column by its index.
     *
     * @throws RuntimeException if the value at that target column cannot be transform into an integer.
     *                          The exact class of the exception will depend on the exception factory provided when creating this
     *                          {@link DataLine}.
     */
    public int getInt(final int index) {
        try {
            return Integer.parseInt(get(index));
        } catch (final NumberFormatException ex) {
            throw formatErrorFactory.apply(String.format("expected int value for column %s but found %s", columns.nameAt(index), get(index)));
        }
    }

    public int getInt(final String columnName) {
        return getInt(columnIndex(columnName));
    }

    private int columnIndex(final String columnName) {
        final int index = columns.indexOf(Utils.nonNull(columnName, "the column name cannot be null"));
        if (index < 0) {
            throw new IllegalArgumentException("there is no such a column: " + columnName);
        }
        return index;
    }

    /**
     * Sets the next string value in the data-line that correspond to a column.
     * <p>
     * The next column index advances so that the following {@link #append append} will change the value of
     * the following column and so forth.
     * </p>
     *
     * @throws IllegalStateException if the next column to set is beyond the last column.
     */
    public DataLine append(final String value) {
        if (nextIndex == values.length) {
            throw new IllegalStateException("gone beyond of the end of the data-line");
        }
        return set(nextIndex++, value);
    }

    public DataLine append(final int value) {
        return append(Integer.toString(value));
    }

    public DataLine append(final double value) {
        return append(Double.toString(value));
    }
}
