package org.broadinstitute.methseg.tools.methylation;

import org.broadinstitute.methseg.utils.tsv.TableColumnCollection;

/**
 * Column names of the tables written by {@link FindHypomethylatedRegions}.
 */
public enum MethylationTableColumn {
    CONTIG("CONTIG"), START("START"), END("END"), NAME("NAME"), SCORE("SCORE"), NUM_SITES("NUM_SITES"),
    P_VALUE("P_VALUE"),
    FOREGROUND_POSTERIOR("FOREGROUND_POSTERIOR"),
    PARAMETER("PARAMETER"), VALUE("VALUE");

    private final String columnName;

    MethylationTableColumn(final String columnName) {  this.columnName = columnName; }

    @Override
    public String toString() {
        return columnName;
    }

    public static final TableColumnCollection DOMAIN_COLUMNS =
            new TableColumnCollection(CONTIG, START, END, NAME, SCORE, NUM_SITES, P_VALUE);

    public static final TableColumnCollection POSTERIOR_COLUMNS =
            new TableColumnCollection(CONTIG, START, END, FOREGROUND_POSTERIOR);

    public static final TableColumnCollection PARAMETER_COLUMNS =
            new TableColumnCollection(PARAMETER, VALUE);
}
