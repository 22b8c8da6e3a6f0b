package org.broadinstitute.pileup.exceptions;

import org.broadinstitute.pileup.utils.ContigInterval;

/**
 * <p/>
 * Class PileupException.
 * <p/>
 * This exception is for errors that are beyond the user's control, such as failed fetches, inconsistent records
 * delivered by a data source, internal pre/post condition failures and "this should never happen" kinds of scenarios.
 */
public class PileupException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public PileupException( String msg ) {
        super(msg);
    }

    public PileupException( String message, Throwable throwable ) {
        super(message, throwable);
    }

    /*
      Subtypes of PileupException for common kinds of errors
     */

    /**
     * A network or I/O failure while fetching data for an interval. Sources complete their futures
     * exceptionally with this type; caches treat it as retryable.
     */
    public static class FetchError extends PileupException {
        private static final long serialVersionUID = 0L;

        private final ContigInterval interval;

        public FetchError( final ContigInterval interval, final String message ) {
            super(String.format("Failed to fetch %s: %s", interval, message));
            this.interval = interval;
        }

        public FetchError( final ContigInterval interval, final String message, final Throwable cause ) {
            super(String.format("Failed to fetch %s: %s", interval, message), cause);
            this.interval = interval;
        }

        public ContigInterval getInterval() {
            return interval;
        }
    }

    /**
     * An alignment whose CIGAR is internally inconsistent with its read bases (or otherwise unusable).
     * Only the offending record is rejected.
     */
    public static class MalformedRecord extends PileupException {
        private static final long serialVersionUID = 0L;

        private final String recordId;

        public MalformedRecord( final String recordId, final String message ) {
            super(String.format("Malformed alignment record %s: %s", recordId, message));
            this.recordId = recordId;
        }

        public String getRecordId() {
            return recordId;
        }
    }
}
