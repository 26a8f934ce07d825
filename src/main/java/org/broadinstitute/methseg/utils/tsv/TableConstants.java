package org.broadinstitute.methseg.utils.tsv;

/**
 * Common constants for table readers and writers.
 */
public final class TableConstants {

    /**
     * Column separator {@value #COLUMN_SEPARATOR_STRING}.
     */
    public static final char COLUMN_SEPARATOR = '\t';

    /**
     * Column separator as an string.
     */
    public static final String COLUMN_SEPARATOR_STRING = "" + COLUMN_SEPARATOR;

    /**
     * Comment line prefix string {@value}.
     * <p>
     * Lines that start with this prefix (spaces are not ignored), will be considered comment
     * lines (neither a header line nor data line).
     * </p>
     */
    public static final String COMMENT_PREFIX = "#";

    /**
     * Quote character used to quote table values that contain special characters.
     */
    public static final char QUOTE_CHARACTER = '\"';

    /**
     * Escape character to prepend to quotes and to itself within quoted values.
     */
    public static final char ESCAPE_CHARACTER = '\\';

    /**
     * Declared to make instantiation impossible.
     */
    private TableConstants() {
        throw new UnsupportedOperationException();
    }
}
