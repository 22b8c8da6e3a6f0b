package org.broadinstitute.pileup.engine.cache;

import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;

/**
 * A {@code FetchIntervalStrategy} that fetches a number of extra bases AFTER each requested interval.
 *
 * This optimizes for requests with gradually increasing start positions (scrolling to the right), since a
 * subsequent request will often be wholly contained in data already fetched. With no lookahead the requested
 * interval is fetched as is.
 */
public final class LookaheadFetchStrategy implements FetchIntervalStrategy {

    /**
     * Number of additional bases beyond the requested interval to fetch.
     */
    private final int lookaheadBases;

    public LookaheadFetchStrategy(final int lookaheadBases) {
        Utils.validateArg(lookaheadBases >= 0, () -> "lookahead must be non-negative but was " + lookaheadBases);
        this.lookaheadBases = lookaheadBases;
    }

    public int getLookaheadBases() {
        return lookaheadBases;
    }

    @Override
    public ContigInterval getFetchIntervalFromRequestInterval(final ContigInterval requestedInterval) {
        Utils.nonNull(requestedInterval);
        final long stop = (long) requestedInterval.getStop() + lookaheadBases;
        return new ContigInterval(requestedInterval.getContig(), requestedInterval.getStart(), (int) Math.min(stop, Integer.MAX_VALUE));
    }

    @Override
    public String toString() {
        return "LookaheadFetchStrategy{lookaheadBases=" + lookaheadBases + '}';
    }
}
