package org.broadinstitute.pileup.engine.cache;

import org.broadinstitute.pileup.engine.datasources.ReferenceSource;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Cache of reference bases fetched from a {@link ReferenceSource}.
 *
 * Arrived bases are merged per contig into disjoint, non-adjacent segments. Where new bases overlap stored ones the
 * stored bases are kept, so re-delivering a region never alters what was already drawn.
 */
public final class ReferenceCache extends DataCache<ReferenceBases> {

    private final ReferenceSource source;

    // contig -> segment start -> segment
    private final Map<String, TreeMap<Integer, ReferenceBases>> segments = new HashMap<>();

    public ReferenceCache(final ReferenceSource source, final FetchIntervalStrategy fetchStrategy, final Executor callbackExecutor) {
        super("reference", fetchStrategy, callbackExecutor);
        this.source = Utils.nonNull(source);
    }

    public ReferenceCache(final ReferenceSource source, final FetchIntervalStrategy fetchStrategy) {
        super("reference", fetchStrategy);
        this.source = Utils.nonNull(source);
    }

    public ReferenceCache(final ReferenceSource source) {
        this(source, new BlockAlignedFetchStrategy());
    }

    /**
     * Deliver bases streamed in by a source, covering exactly their own interval.
     */
    public void onDataArrived(final ReferenceBases bases) {
        Utils.nonNull(bases);
        onDataArrived(bases.getInterval(), bases);
    }

    @Override
    protected CompletableFuture<ReferenceBases> fetch(final ContigInterval fetchInterval) {
        return source.fetch(fetchInterval);
    }

    @Override
    protected ContigInterval arrivedIntervalFor(final ContigInterval fetchInterval, final ReferenceBases data) {
        Utils.nonNull(data, () -> "reference source returned no bases for " + fetchInterval);
        return data.getInterval();
    }

    @Override
    protected boolean store(final ContigInterval interval, final ReferenceBases data) {
        Utils.validateArg(interval.equals(data.getInterval()),
                () -> "reference bases span " + data.getInterval() + " but were delivered for " + interval);
        if ( interval.isEmpty() ) {
            return false;
        }

        final TreeMap<Integer, ReferenceBases> contigSegments = segments.computeIfAbsent(interval.getContig(), c -> new TreeMap<>());

        // every stored segment that overlaps or touches the new one is merged with it
        final List<ReferenceBases> neighbours = new ArrayList<>();
        final Map.Entry<Integer, ReferenceBases> before = contigSegments.floorEntry(interval.getStart());
        if ( before != null && before.getValue().getInterval().getStop() >= interval.getStart() ) {
            neighbours.add(before.getValue());
        }
        for ( final ReferenceBases segment : contigSegments.subMap(interval.getStart(), false, interval.getStop(), true).values() ) {
            neighbours.add(segment);
        }

        int mergedStart = interval.getStart();
        int mergedStop = interval.getStop();
        int alreadyStored = 0;
        for ( final ReferenceBases segment : neighbours ) {
            final ContigInterval segmentInterval = segment.getInterval();
            mergedStart = Math.min(mergedStart, segmentInterval.getStart());
            mergedStop = Math.max(mergedStop, segmentInterval.getStop());
            alreadyStored += segmentInterval.intersect(interval).map(ContigInterval::size).orElse(0);
        }
        if ( alreadyStored == interval.size() ) {
            return false;
        }

        final byte[] merged = new byte[mergedStop - mergedStart];
        System.arraycopy(data.getBases(), 0, merged, interval.getStart() - mergedStart, interval.size());
        // stored bases win over new ones
        for ( final ReferenceBases segment : neighbours ) {
            final byte[] stored = segment.getBases();
            System.arraycopy(stored, 0, merged, segment.getInterval().getStart() - mergedStart, stored.length);
            contigSegments.remove(segment.getInterval().getStart());
        }
        contigSegments.put(mergedStart, new ReferenceBases(merged, new ContigInterval(interval.getContig(), mergedStart, mergedStop)));
        return true;
    }

    /**
     * @return the stored bases overlapping {@code query}, clipped to it, in ascending order
     */
    public List<ReferenceBases> dataFor(final ContigInterval query) {
        Utils.nonNull(query);
        final TreeMap<Integer, ReferenceBases> contigSegments = segments.get(query.getContig());
        if ( contigSegments == null || query.isEmpty() ) {
            return Collections.emptyList();
        }

        final Integer first = contigSegments.floorKey(query.getStart());
        final NavigableMap<Integer, ReferenceBases> candidates =
                contigSegments.subMap(first == null ? query.getStart() : first, true, query.getStop(), false);

        final List<ReferenceBases> result = new ArrayList<>(candidates.size());
        for ( final ReferenceBases segment : candidates.values() ) {
            segment.getInterval().intersect(query).ifPresent(overlap -> result.add(segment.getSubset(overlap)));
        }
        return result;
    }

    @Override
    protected void clearStorage() {
        segments.clear();
    }

    @Override
    protected String describeStorage() {
        final long bases = segments.values().stream()
                .flatMap(s -> s.values().stream())
                .mapToLong(s -> s.getInterval().size())
                .sum();
        return bases + " bases stored";
    }
}
