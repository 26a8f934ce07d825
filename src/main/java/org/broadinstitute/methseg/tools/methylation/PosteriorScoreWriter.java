package org.broadinstitute.methseg.tools.methylation;

import org.apache.commons.lang3.tuple.Pair;
import org.broadinstitute.methseg.utils.tsv.DataLine;
import org.broadinstitute.methseg.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes the foreground posterior of every site.
 */
public final class PosteriorScoreWriter extends TableWriter<Pair<MethylationSite, Double>> {

    public PosteriorScoreWriter(final File file) throws IOException {
        super(file, MethylationTableColumn.POSTERIOR_COLUMNS);
    }

    public PosteriorScoreWriter(final Writer writer) {
        super(writer, MethylationTableColumn.POSTERIOR_COLUMNS);
    }

    @Override
    protected void composeLine(final Pair<MethylationSite, Double> record, final DataLine dataLine) {
        final MethylationSite site = record.getLeft();
        dataLine.append(site.getContig())
                .append(site.getPosition())
                .append(site.getPosition() + 1)
                .append(record.getRight());
    }
}
