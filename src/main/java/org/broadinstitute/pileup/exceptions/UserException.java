package org.broadinstitute.pileup.exceptions;

import java.nio.file.Path;

/**
 * <p/>
 * Class UserException.
 * <p/>
 * This exception is for errors that are due to user mistakes, such as non-existent or malformed files
 * and unparsable interval strings.
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
     * <p/>
     * Class UserException.CouldNotReadInputFile
     * <p/>
     * For generic errors opening/reading from input files
     */
    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotReadInputFile(Path file, String message) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message));
        }

        public CouldNotReadInputFile(Path file, String message, Throwable cause) {
            super(String.format("Couldn't read file %s. Error was: %s", file.toAbsolutePath().toUri(), message), cause);
        }

        public CouldNotReadInputFile(Path path, Exception e) {
            this(path, getMessage(e), e);
        }
    }

    public static class MissingIndex extends UserException {
        private static final long serialVersionUID = 0L;

        public MissingIndex(String file, String message) {
            super(String.format("An index is required but was not found for file %s. %s", file, message));
        }
    }

    public static class MalformedInterval extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedInterval(final String interval, final String message) {
            super(String.format("Problem parsing interval string '%s': %s", interval, message));
        }

        public MalformedInterval(final String interval, final String message, final Throwable cause) {
            super(String.format("Problem parsing interval string '%s': %s", interval, message), cause);
        }
    }
}
