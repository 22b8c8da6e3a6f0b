package org.broadinstitute.pileup.engine.cache;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.MoreExecutors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.logging.OneShotLogger;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Request/arrival bookkeeping shared by the reference and alignment caches.
 *
 * Usage:
 * -Call {@link #request(ContigInterval)} for every interval that must be displayed. The request is mapped to a
 *  fetch interval by the {@link FetchIntervalStrategy}, and a fetch is started unless the data is already there or
 *  an outstanding fetch will deliver it. The call never blocks.
 *
 * -When a fetch completes, or when a source streams data in through {@link #onDataArrived}, the data is stored and
 *  every registered {@link CacheListener} is told, provided the arrival changed the cache and intersects a
 *  requested interval.
 *
 * -Query stored data with the subclass's {@code dataFor} and coverage with {@link #coverageOf(ContigInterval)}.
 *
 * A failed fetch is logged and forgotten, leaving its interval {@link CoverageState#PENDING}; requesting it again
 * starts a new fetch. Fetch completions are handed to the callback executor, which is the completing thread by
 * default. Hosts that drive everything from one event thread pass an executor that posts onto it.
 *
 * Not thread-safe: all calls, including completions, must happen on one thread at a time.
 *
 * @param <T> type of the data delivered by one fetch
 */
public abstract class DataCache<T> {
    private static final Logger logger = LogManager.getLogger(DataCache.class);

    /**
     * Display name for this cache
     */
    private final String sourceDisplayName;

    private final FetchIntervalStrategy fetchStrategy;

    private final Executor callbackExecutor;

    private final CoverageTracker coverage = new CoverageTracker();

    /**
     * Fetch intervals whose futures have not completed yet
     */
    private final List<ContigInterval> inFlight = new ArrayList<>();

    private final List<CacheListener> listeners = new ArrayList<>();

    private final OneShotLogger rangeMismatchLogger = new OneShotLogger(logger);

    /**
     * Incremented by {@link #clear()} so that completions of fetches started before it are dropped
     */
    private int generation = 0;

    /**
     * Incremented every time an arrival adds new content
     */
    private int contentVersion = 0;

    private int numRequests = 0;
    private int numFetches = 0;
    private int numArrivals = 0;
    private int numFailures = 0;
    private int numRangeMismatches = 0;

    /**
     * @param sourceName display name for this cache
     * @param fetchStrategy maps requested intervals to fetched intervals
     * @param callbackExecutor executor on which fetch completions are processed
     */
    protected DataCache(final String sourceName, final FetchIntervalStrategy fetchStrategy, final Executor callbackExecutor) {
        this.sourceDisplayName = Utils.nonNull(sourceName);
        this.fetchStrategy = Utils.nonNull(fetchStrategy);
        this.callbackExecutor = Utils.nonNull(callbackExecutor);
    }

    protected DataCache(final String sourceName, final FetchIntervalStrategy fetchStrategy) {
        this(sourceName, fetchStrategy, MoreExecutors.directExecutor());
    }

    /**
     * Start fetching {@code interval} unless it is already covered or being fetched. Returns immediately.
     */
    public final void request(final ContigInterval interval) {
        Utils.nonNull(interval);
        numRequests++;
        coverage.markRequested(interval);

        if ( coverage.isCovered(interval) ) {
            logger.debug("{}: {} already covered", sourceDisplayName, interval);
            return;
        }
        for ( final ContigInterval outstanding : inFlight ) {
            if ( outstanding.contains(interval) ) {
                logger.debug("{}: {} will be delivered by outstanding fetch of {}", sourceDisplayName, interval, outstanding);
                return;
            }
        }

        final ContigInterval fetchInterval = fetchStrategy.getFetchIntervalFromRequestInterval(interval);
        Utils.validate(fetchInterval.contains(interval),
                () -> fetchStrategy + " mapped " + interval + " to " + fetchInterval + ", which does not contain it");
        logger.debug("{}: fetching {} for request {}", sourceDisplayName, fetchInterval, interval);

        inFlight.add(fetchInterval);
        numFetches++;
        final int fetchGeneration = generation;

        final CompletableFuture<T> future;
        try {
            future = Utils.nonNull(fetch(fetchInterval), "source returned no future");
        } catch ( final RuntimeException e ) {
            inFlight.remove(fetchInterval);
            onFetchFailed(fetchInterval, e);
            return;
        }

        future.whenCompleteAsync((data, error) -> {
            if ( fetchGeneration != generation ) {
                logger.debug("{}: dropping completion of {} fetched before the cache was cleared", sourceDisplayName, fetchInterval);
                return;
            }
            inFlight.remove(fetchInterval);
            try {
                if ( error != null ) {
                    onFetchFailed(fetchInterval, error);
                } else {
                    onDataArrived(arrivedIntervalFor(fetchInterval, data), data);
                }
            } catch ( final RuntimeException e ) {
                logger.error(sourceDisplayName + ": failed to process data for " + fetchInterval, e);
            }
        }, callbackExecutor);
    }

    /**
     * Store newly arrived data and notify listeners if it changed the cache.
     *
     * Sources that deliver an interval in several pieces may call this directly, once per piece. Data arriving for an
     * interval that intersects no requested interval is stored and its coverage recorded, but listeners are not told.
     *
     * @param interval the interval the data covers
     * @param data the data
     */
    public final void onDataArrived(final ContigInterval interval, final T data) {
        Utils.nonNull(interval);
        Utils.nonNull(data);
        numArrivals++;

        final boolean contentChanged = store(interval, data);
        final boolean coverageChanged = coverage.markArrived(interval);
        if ( contentChanged ) {
            contentVersion++;
        }

        if ( !coverage.intersectsRequested(interval) ) {
            numRangeMismatches++;
            rangeMismatchLogger.warn(String.format("%s: data arrived for %s, which intersects no requested interval. " +
                    "It was stored, but nothing will be redrawn for it.", sourceDisplayName, interval));
            return;
        }
        if ( !contentChanged && !coverageChanged ) {
            logger.debug("{}: arrival for {} changed nothing", sourceDisplayName, interval);
            return;
        }

        // listeners may unregister themselves while being notified
        for ( final CacheListener listener : new ArrayList<>(listeners) ) {
            listener.onDataArrived(this, interval);
        }
    }

    private void onFetchFailed(final ContigInterval fetchInterval, final Throwable error) {
        numFailures++;
        final Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        logger.warn(String.format("%s: fetch of %s failed, it will be retried on the next request", sourceDisplayName, fetchInterval), cause);
    }

    /**
     * Start fetching {@code fetchInterval} from the source.
     */
    protected abstract CompletableFuture<T> fetch(final ContigInterval fetchInterval);

    /**
     * @return the interval that {@code data}, delivered for a fetch of {@code fetchInterval}, actually covers
     */
    protected abstract ContigInterval arrivedIntervalFor(final ContigInterval fetchInterval, final T data);

    /**
     * Add arrived data to the stored content.
     *
     * @return true if anything new was stored
     */
    protected abstract boolean store(final ContigInterval interval, final T data);

    /**
     * Drop all stored content.
     */
    protected abstract void clearStorage();

    /**
     * @return short description of the stored content, for statistics
     */
    protected abstract String describeStorage();

    public CoverageState coverageOf(final ContigInterval interval) {
        return coverage.coverageOf(interval);
    }

    public void addListener(final CacheListener listener) {
        Utils.nonNull(listener);
        if ( !listeners.contains(listener) ) {
            listeners.add(listener);
        }
    }

    public void removeListener(final CacheListener listener) {
        listeners.remove(listener);
    }

    /**
     * Release all stored data, coverage and listeners. Completions of fetches started earlier are ignored.
     */
    public void clear() {
        generation++;
        contentVersion++;
        clearStorage();
        coverage.clear();
        inFlight.clear();
        listeners.clear();
    }

    /**
     * @return a counter that changes whenever stored content changes, whether or not listeners were told
     */
    public int getContentVersion() {
        return contentVersion;
    }

    public String getSourceDisplayName() {
        return sourceDisplayName;
    }

    @VisibleForTesting
    int getNumPendingFetches() {
        return inFlight.size();
    }

    @VisibleForTesting
    int getNumListeners() {
        return listeners.size();
    }

    public int getNumFetches() {
        return numFetches;
    }

    public int getNumFailures() {
        return numFailures;
    }

    public int getNumRangeMismatches() {
        return numRangeMismatches;
    }

    public String getCacheStatistics() {
        return String.format("Cache statistics for %s: %d requests, %d fetches, %d arrivals, %d failed fetches, " +
                        "%d out-of-range arrivals, %d covered ranges, %s",
                sourceDisplayName, numRequests, numFetches, numArrivals, numFailures, numRangeMismatches,
                coverage.numCoveredRanges(), describeStorage());
    }

    /**
     * Print statistics about the effectiveness of this cache
     */
    public void printCacheStatistics() {
        logger.debug(getCacheStatistics());
    }
}
