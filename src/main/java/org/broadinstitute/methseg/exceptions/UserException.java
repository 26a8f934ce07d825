package org.broadinstitute.methseg.exceptions;

import java.io.File;
import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException() {
        super();
    }

    public UserException(final String msg) {
        super(msg);
    }

    public UserException(final String message, final Throwable throwable) {
        super(message, throwable);
    }

    protected static String getMessage(final Throwable t) {
        final String message = t.getMessage();
        return message != null ? message : t.getClass().getName();
    }

    /**
     * Subtypes of UserException for common kinds of errors
     */

    /**
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(final File file, final String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), message));
        }

        public CouldNotReadInputFile(final File file, final String message, final Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.getAbsolutePath(), message), cause);
        }

        public CouldNotReadInputFile(final Path file, final Exception e) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), getMessage(e)), e);
        }
    }

    /**
     * <p/>
     * Class UserException.CouldNotCreateOutputFile
     * <p/>
     * For generic errors writing to output files
     */
    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile(final File file, final String message) {
            super(String.format("Couldn't write file %s because %s", file.getAbsolutePath(), message));
        }

        public CouldNotCreateOutputFile(final File file, final Exception e) {
            super(String.format("Couldn't write file %s because exception %s", file.getAbsolutePath(), getMessage(e)), e);
        }

        public CouldNotCreateOutputFile(final String filename, final String message, final Exception e) {
            super(String.format("Couldn't write file %s because %s with exception %s", filename, message, getMessage(e)), e);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput(String message, Throwable cause){
            super(String.format("Bad input: %s", message), cause);
        }

        public BadInput(String message) {
            super(String.format("Bad input: %s", message));
        }
    }

    /**
     * A methylation record that does not have the expected columns or values.
     */
    public static class MalformedMethylationRecord extends BadInput {
        private static final long serialVersionUID = 0L;

        public MalformedMethylationRecord(final String source, final long lineNumber, final String message) {
            super(String.format("invalid methylation record at %s line %d: %s", source, lineNumber, message));
        }
    }

    /**
     * Methylation sites that are not sorted by contig name and then by position.
     */
    public static class UnsortedMethylationSites extends BadInput {
        private static final long serialVersionUID = 0L;

        public UnsortedMethylationSites(final String source, final long lineNumber, final String previous, final String current) {
            super(String.format("methylation sites are not sorted at %s line %d: %s follows %s", source, lineNumber, current, previous));
        }
    }

    /**
     * A model parameter file that lacks a required parameter or holds one that cannot be used.
     */
    public static class BadModelParameters extends BadInput {
        private static final long serialVersionUID = 0L;

        public BadModelParameters(final String source, final String message) {
            super(String.format("unusable model parameters in %s: %s", source, message));
        }

        public BadModelParameters(final String source, final String message, final Throwable cause) {
            super(String.format("unusable model parameters in %s: %s", source, message), cause);
        }
    }
}
