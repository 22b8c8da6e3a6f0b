package org.broadinstitute.pileup.engine.cache;

import org.broadinstitute.pileup.utils.ContigInterval;

/**
 * Policy implemented by {@link DataCache} strategy objects: how to map a requested interval to the (usually larger)
 * interval actually fetched from the source.
 *
 * Implementations must return an interval on the same contig that contains the requested one.
 */
@FunctionalInterface
public interface FetchIntervalStrategy {

    /**
     * Given a requested interval, return the interval to fetch.
     * @param requestedInterval the interval being requested
     * @return the interval to fetch, containing {@code requestedInterval}
     */
    ContigInterval getFetchIntervalFromRequestInterval(final ContigInterval requestedInterval);
}
