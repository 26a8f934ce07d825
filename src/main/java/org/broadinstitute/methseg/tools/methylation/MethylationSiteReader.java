package org.broadinstitute.methseg.tools.methylation;

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
import java.util.regex.Pattern;

/**
 * Reads the per-cytosine methylation file, possibly gzipped, one site per line:
 * <pre>
 *     contig  position  strand  context  level  coverage
 * </pre>
 * Columns are separated by any whitespace. Blank lines and lines starting with {@code #} are skipped.
 *
 * <p>Sites must be sorted by contig name and then by position; a malformed line or a site out of order
 * fails the whole read.</p>
 */
public final class MethylationSiteReader implements Closeable {

    public static final String COMMENT_PREFIX = "#";
    public static final int NUMBER_OF_COLUMNS = 6;

    private static final Pattern COLUMN_SEPARATOR = Pattern.compile("\\s+");

    private final String source;
    private final LineNumberReader reader;

    private MethylationSite previous = null;

    public MethylationSiteReader(final File file) throws IOException {
        this(Utils.nonNull(file, "the input file cannot be null").getPath(), IOUtils.makeReaderMaybeGzipped(file));
    }

    public MethylationSiteReader(final String source, final Reader reader) {
        this.source = Utils.nonNull(source, "the source name cannot be null");
        this.reader = new LineNumberReader(Utils.nonNull(reader, "the reader cannot be null"));
    }

    /**
     * Reads the next site.
     *
     * @return {@code null} when there are no more sites.
     * @throws UserException.MalformedMethylationRecord if the line does not describe a site.
     * @throws UserException.UnsortedMethylationSites if the site precedes the previous one.
     */
    public MethylationSite readSite() throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            final String trimmed = line.trim();
            if (trimmed.isEmpty() || trimmed.startsWith(COMMENT_PREFIX)) {
                continue;
            }
            final MethylationSite site = parse(trimmed);
            checkOrder(site);
            previous = site;
            return site;
        }
        return null;
    }

    /**
     * Reads all remaining sites.
     */
    public List<MethylationSite> readAll() throws IOException {
        final List<MethylationSite> result = new ArrayList<>();
        MethylationSite site;
        while ((site = readSite()) != null) {
            result.add(site);
        }
        return result;
    }

    private MethylationSite parse(final String line) {
        final String[] values = COLUMN_SEPARATOR.split(line);
        if (values.length != NUMBER_OF_COLUMNS) {
            throw malformed(String.format("expected %d columns but found %d", NUMBER_OF_COLUMNS, values.length));
        }
        final int position = parseInt(values[1], "position");
        final double level = parseDouble(values[4], "level");
        final int coverage = parseInt(values[5], "coverage");
        if (position < 0) {
            throw malformed("negative position " + position);
        }
        if (!(level >= 0 && level <= 1)) {
            throw malformed("the methylation level must be in [0, 1] but is " + values[4]);
        }
        if (coverage < 0) {
            throw malformed("negative coverage " + coverage);
        }
        return new MethylationSite(values[0], position, values[2], values[3], level, coverage);
    }

    private int parseInt(final String value, final String column) {
        try {
            return Integer.parseInt(value);
        } catch (final NumberFormatException e) {
            throw malformed(String.format("the %s '%s' is not an integer", column, value));
        }
    }

    private double parseDouble(final String value, final String column) {
        try {
            return Double.parseDouble(value);
        } catch (final NumberFormatException e) {
            throw malformed(String.format("the %s '%s' is not a number", column, value));
        }
    }

    private void checkOrder(final MethylationSite site) {
        if (previous == null) {
            return;
        }
        final int contigOrder = site.getContig().compareTo(previous.getContig());
        if (contigOrder < 0 || (contigOrder == 0 && site.getPosition() < previous.getPosition())) {
            throw new UserException.UnsortedMethylationSites(source, reader.getLineNumber(),
                    previous.getContig() + ":" + previous.getPosition(), site.getContig() + ":" + site.getPosition());
        }
    }

    private UserException.MalformedMethylationRecord malformed(final String message) {
        return new UserException.MalformedMethylationRecord(source, reader.getLineNumber(), message);
    }

    public String getSource() {
        return source;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
