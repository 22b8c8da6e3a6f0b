package org.broadinstitute.pileup.engine.cache;

/**
 * How much of an interval a cache can currently answer for.
 */
public enum CoverageState {

    /**
     * Nothing intersecting the interval was ever requested.
     */
    UNREQUESTED,

    /**
     * A request intersecting the interval is outstanding, or failed and is awaiting a retry.
     */
    PENDING,

    /**
     * Arrived data covers part of the interval.
     */
    PARTIAL,

    /**
     * Arrived data covers the whole interval.
     */
    COMPLETE;

    /**
     * @return true if at least some data is available
     */
    public boolean hasData() {
        return this == PARTIAL || this == COMPLETE;
    }
}
