package org.broadinstitute.methseg.tools.methylation;

import org.broadinstitute.methseg.utils.tsv.DataLine;
import org.broadinstitute.methseg.utils.tsv.TableWriter;

import java.io.File;
import java.io.IOException;
import java.io.Writer;

/**
 * Writes domains as a tab separated table with 0-based half-open coordinates.
 */
public final class MethylationDomainWriter extends TableWriter<MethylationDomain> {

    public MethylationDomainWriter(final File file) throws IOException {
        super(file, MethylationTableColumn.DOMAIN_COLUMNS);
    }

    public MethylationDomainWriter(final Writer writer) {
        super(writer, MethylationTableColumn.DOMAIN_COLUMNS);
    }

    @Override
    protected void composeLine(final MethylationDomain domain, final DataLine dataLine) {
        dataLine.append(domain.getContig())
                .append(domain.getStart() - 1)
                .append(domain.getEnd())
                .append(domain.getName())
                .append(domain.getScore())
                .append(domain.getNumSites())
                .append(domain.getPValue());
    }
}
