package org.broadinstitute.methseg.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import org.broadinstitute.methseg.exceptions.MethSegException;
import org.broadinstitute.methseg.utils.Utils;

import java.io.BufferedInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.zip.GZIPInputStream;

public final class IOUtils {

    private IOUtils(){}

    /**
     * makes a reader for a file, unzipping if the file's name ends with '.gz'
     * @param file the file to read
     */
    public static Reader makeReaderMaybeGzipped(final File file) throws IOException {
        Utils.nonNull(file, "the file cannot be null");
        final InputStream in = new BufferedInputStream(Files.newInputStream(file.toPath()));
        return makeReaderMaybeGzipped(in, file.getName().endsWith(".gz"));
    }

    /**
     * makes a reader for an inputStream wrapping it in an appropriate unzipper if necessary
     * @param zipped is this stream zipped
     */
    public static Reader makeReaderMaybeGzipped(final InputStream in, final boolean zipped) throws IOException {
        if (zipped) {
            return new InputStreamReader(makeZippedInputStream(in), StandardCharsets.UTF_8);
        } else {
            return new InputStreamReader(in, StandardCharsets.UTF_8);
        }
    }

    /**
     * creates an input stream from a zipped stream
     * @return tries to create a block gzipped input stream and if it's not block gzipped it produces to a gzipped stream instead
     */
    private static InputStream makeZippedInputStream(final InputStream in) throws IOException {
        Utils.nonNull(in);
        if (BlockCompressedInputStream.isValidFile(in)) {
            return new BlockCompressedInputStream(in);
        } else {
            return new GZIPInputStream(in);
        }
    }

    /**
     * Creates a temp file that will be deleted on exit
     *
     * @param name Prefix of the file.
     * @param extension Extension to concat to the end of the file name.
     * @return A file in the temporary directory starting with name, ending with extension, which will be deleted after the program exits.
     */
    public static File createTempFile(final String name, final String extension) {
        try {
            final File file = File.createTempFile(name, extension.startsWith(".") ? extension : "." + extension);
            file.deleteOnExit();
            return file;
        } catch (final IOException ex) {
            throw new MethSegException("Cannot create temp file: " + ex.getMessage(), ex);
        }
    }
}
