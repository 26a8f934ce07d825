package org.broadinstitute.methseg.utils.tsv;

import org.broadinstitute.methseg.utils.Utils;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Represents a list of table columns.
 */
public final class TableColumnCollection {

    /**
     * List of column names sorted by their index.
     */
    private final List<String> names;

    /**
     * Map from column name to its index, the first column has index 0, the second 1 and so forth.
     */
    private final Map<String, Integer> indexByName;

    /**
     * Creates a new table-column names collection.
     * <p>
     * The new instance will have its own copy of the input name array.
     * </p>
     *
     * @param names the column names.
     * @throws IllegalArgumentException if {@code names} is not a valid column name array
     *                                  of names as determined by {@link #checkNames checkNames}.
     */
    public TableColumnCollection(final String... names) {
        this.names = Collections.unmodifiableList(Arrays.asList(checkNames(Utils.nonNull(names, "the names cannot be null").clone(), IllegalArgumentException::new)));
        this.indexByName = IntStream.range(0, names.length).boxed()
                .collect(Collectors.toMap(this.names::get, Function.identity()));
    }

    /**
     * Creates a new table-column collection from the string representation of the given objects,
     * typically the constants of a column enum.
     *
     * @param columnValues objects whose {@link Object#toString()} are the column names.
     */
    public TableColumnCollection(final Object... columnValues) {
        this(Arrays.stream(Utils.nonNull(columnValues, "the column values cannot be null"))
                .map(v -> Utils.nonNull(v, "no column value can be null").toString())
                .toArray(String[]::new));
    }

    /**
     * Returns the column names ordered by column index.
     *
     * @return never {@code null}, a unmodifiable view to this collection column names.
     */
    public List<String> names() {
        return names;
    }

    /**
     * Returns the name of a column by its index.
     *
     * @param index the target column index.
     * @return never {@code null}.
     * @throws IllegalArgumentException if {@code index} is not valid.
     */
    public String nameAt(final int index) {
        Utils.validateArg(index >= 0 && index < names.size(), () -> "invalid column index: " + index);
        return names.get(index);
    }

    /**
     * Returns the index of a column given its name, or -1 if there is no such column.
     */
    public int indexOf(final String name) {
        return indexByName.getOrDefault(Utils.nonNull(name, "the column name cannot be null"), -1);
    }

    public boolean contains(final String name) {
        return indexByName.containsKey(Utils.nonNull(name, "the column name cannot be null"));
    }

    /**
     * Checks whether the column names are exactly the ones given, in the same order.
     */
    public boolean matchesExactly(final String... names) {
        Utils.nonNull(names, "the names cannot be null");
        return this.names.equals(Arrays.asList(names));
    }

    public int columnCount() {
        return names.size();
    }

    /**
     * Checks that a column name array is valid.
     *
     * <p>
     * Assuming that it is null-value free, a column name array is invalid if it is empty, if the first name starts
     * with the comment prefix or if it contains repeats.
     * </p>
     *
     * @throws IllegalArgumentException if {@code columnNames} is {@code null} or it contains any {@code null}.
     * @throws RuntimeException         if {@code columnNames} does not contain a valid list of column names. The exact type will depend on the
     *                                  input {@code exceptionFactory}.
     * @return never {@code null}, the same reference as the input column name array {@code columnNames}.
     */
    public static String[] checkNames(final String[] columnNames,
                                      final Function<String, RuntimeException> exceptionFactory) {
        Utils.nonNull(columnNames, "column names cannot be null");
        Utils.nonNull(exceptionFactory, "exception factory cannot be null");

        if (columnNames.length == 0) {
            throw exceptionFactory.apply("there must be at least one column");
        }
        final Set<String> columnNameSet = new HashSet<>(columnNames.length);
        for (int i = 0; i < columnNames.length; i++) {
            final String columnName = Utils.nonNull(columnNames[i], "no column name can be null: e.g. " + i + " element");
            if (!columnNameSet.add(columnName)) {
                throw exceptionFactory.apply("more than one column have the same name: " + columnNames[i]);
            }
        }
        if (columnNames[0].startsWith(TableConstants.COMMENT_PREFIX)) {
            throw exceptionFactory.apply("the first column name cannot start with the comment prefix");
        }
        return columnNames;
    }
}
