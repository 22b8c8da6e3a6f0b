package org.broadinstitute.pileup.engine.cache;

import com.google.common.collect.Range;
import com.google.common.collect.RangeSet;
import com.google.common.collect.TreeRangeSet;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;

import java.util.HashMap;
import java.util.Map;

/**
 * Per-contig bookkeeping of which positions were requested from a cache and which positions data has arrived for.
 *
 * Positions are kept as closed-open {@link Range}s, matching the half-open {@link ContigInterval} convention.
 * Requested territory is never forgotten until {@link #clear()}: a request whose fetch failed still counts as
 * requested, so its coverage reads as {@link CoverageState#PENDING} until a retry delivers data.
 */
public final class CoverageTracker {

    private final Map<String, RangeSet<Integer>> requested = new HashMap<>();
    private final Map<String, RangeSet<Integer>> arrived = new HashMap<>();

    private static Range<Integer> toRange(final ContigInterval interval) {
        return Range.closedOpen(interval.getStart(), interval.getStop());
    }

    private static RangeSet<Integer> rangesFor(final Map<String, RangeSet<Integer>> ranges, final String contig) {
        return ranges.computeIfAbsent(contig, c -> TreeRangeSet.create());
    }

    /**
     * Record that {@code interval} was requested.
     */
    public void markRequested(final ContigInterval interval) {
        Utils.nonNull(interval);
        if ( !interval.isEmpty() ) {
            rangesFor(requested, interval.getContig()).add(toRange(interval));
        }
    }

    /**
     * Record that data arrived for {@code interval}.
     *
     * @return true if the interval extended the covered territory
     */
    public boolean markArrived(final ContigInterval interval) {
        Utils.nonNull(interval);
        if ( interval.isEmpty() ) {
            return false;
        }
        final RangeSet<Integer> covered = rangesFor(arrived, interval.getContig());
        final Range<Integer> range = toRange(interval);
        if ( covered.encloses(range) ) {
            return false;
        }
        covered.add(range);
        return true;
    }

    /**
     * @return true if any requested position lies inside {@code interval}
     */
    public boolean intersectsRequested(final ContigInterval interval) {
        Utils.nonNull(interval);
        final RangeSet<Integer> ranges = requested.get(interval.getContig());
        return ranges != null && !interval.isEmpty() && ranges.intersects(toRange(interval));
    }

    /**
     * @return true if data arrived for every position of {@code interval}
     */
    public boolean isCovered(final ContigInterval interval) {
        Utils.nonNull(interval);
        if ( interval.isEmpty() ) {
            return true;
        }
        final RangeSet<Integer> ranges = arrived.get(interval.getContig());
        return ranges != null && ranges.encloses(toRange(interval));
    }

    public CoverageState coverageOf(final ContigInterval interval) {
        Utils.nonNull(interval);
        if ( isCovered(interval) ) {
            return CoverageState.COMPLETE;
        }
        final RangeSet<Integer> arrivedRanges = arrived.get(interval.getContig());
        if ( arrivedRanges != null && arrivedRanges.intersects(toRange(interval)) ) {
            return CoverageState.PARTIAL;
        }
        return intersectsRequested(interval) ? CoverageState.PENDING : CoverageState.UNREQUESTED;
    }

    /**
     * @return the number of disjoint covered ranges across all contigs
     */
    public int numCoveredRanges() {
        return arrived.values().stream().mapToInt(r -> r.asRanges().size()).sum();
    }

    public void clear() {
        requested.clear();
        arrived.clear();
    }
}
