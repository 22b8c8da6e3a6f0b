package org.broadinstitute.pileup.engine.cache;

import org.broadinstitute.pileup.utils.ContigInterval;

/**
 * Callback registered on a {@link DataCache}, invoked when newly arrived data changed what the cache holds for an
 * interval that was requested from it.
 */
@FunctionalInterface
public interface CacheListener {

    /**
     * @param cache the cache whose content changed
     * @param arrivedInterval the interval the new data covers
     */
    void onDataArrived(final DataCache<?> cache, final ContigInterval arrivedInterval);
}
