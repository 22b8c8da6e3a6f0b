package org.broadinstitute.pileup.engine;

import com.google.common.collect.ImmutableList;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pileup.engine.cache.AlignmentCache;
import org.broadinstitute.pileup.engine.cache.CacheListener;
import org.broadinstitute.pileup.engine.cache.CoverageState;
import org.broadinstitute.pileup.engine.cache.DataCache;
import org.broadinstitute.pileup.engine.cache.ReferenceCache;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.pileup.AlignmentMismatches;
import org.broadinstitute.pileup.utils.pileup.Mismatch;
import org.broadinstitute.pileup.utils.pileup.MismatchDetector;
import org.broadinstitute.pileup.utils.pileup.PileupLayoutEngine;
import org.broadinstitute.pileup.utils.read.Alignment;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;

/**
 * Reconciles the reference and alignment feeds of one visible range into drawable records.
 *
 * The track listens to its two caches. Every time either one reports new data, the drawable records are rebuilt from
 * the current cache contents and handed to the {@link PileupRenderer}, unless they are identical to the records
 * emitted last. The records are a function of what the caches hold (plus the row layout, which only depends on the
 * order in which alignments arrived), so whatever the interleaving of the two feeds, the same final data produces the
 * same final records.
 *
 * Mismatches are computed only once reference bases are available, and only for positions whose reference base was
 * delivered. A result is reused until the reference cache content changes while it still has uncovered positions.
 * Alignments that stick out of the visible range also need reference outside of it, so the track requests the
 * overhanging parts from the reference cache; their arrival is then reported like any other.
 *
 * A failed fetch leaves its interval pending. {@link #retry()} requests everything that is still incomplete.
 *
 * Once {@link #dispose()} is called, every notification, including late completions of fetches started before, is
 * ignored. Not thread-safe: drive it from the thread the caches deliver on.
 */
public final class PileupTrack implements CacheListener {
    private static final Logger logger = LogManager.getLogger(PileupTrack.class);

    private static final Comparator<RenderRecord.PileupRecord> PILEUP_RECORD_ORDER =
            Comparator.comparingInt(RenderRecord.PileupRecord::getRow)
                    .thenComparingInt(r -> r.getSpan().getStart())
                    .thenComparing(RenderRecord.PileupRecord::getAlignmentId);

    private final ContigInterval visibleRange;
    private final ReferenceCache referenceCache;
    private final AlignmentCache alignmentCache;
    private final PileupRenderer renderer;
    private final Level emissionLogLevel;

    private final PileupLayoutEngine layout = new PileupLayoutEngine();

    private final Map<String, CachedMismatches> mismatchesById = new HashMap<>();

    // reference requested outside the visible range, for alignments that stick out of it
    private final Set<ContigInterval> referenceOverhangs = new LinkedHashSet<>();
    private final Set<String> overhangsRequestedFor = new HashSet<>();

    private TrackState state = TrackState.WAITING_BOTH;
    private List<RenderRecord> lastEmitted = Collections.emptyList();
    private int numEmissions = 0;
    private boolean started = false;
    private boolean disposed = false;

    private static final class CachedMismatches {
        final AlignmentMismatches result;
        final int referenceContentVersion;

        CachedMismatches(final AlignmentMismatches result, final int referenceContentVersion) {
            this.result = result;
            this.referenceContentVersion = referenceContentVersion;
        }
    }

    /**
     * @param visibleRange the range to display
     * @param referenceCache reference cache owned by this track from now on
     * @param alignmentCache alignment cache owned by this track from now on
     * @param renderer receives the records
     * @param logEmissions if true, every emission is logged at INFO rather than DEBUG
     */
    public PileupTrack(final ContigInterval visibleRange, final ReferenceCache referenceCache, final AlignmentCache alignmentCache,
                       final PileupRenderer renderer, final boolean logEmissions) {
        this.visibleRange = Utils.nonNull(visibleRange);
        this.referenceCache = Utils.nonNull(referenceCache);
        this.alignmentCache = Utils.nonNull(alignmentCache);
        this.renderer = Utils.nonNull(renderer);
        this.emissionLogLevel = logEmissions ? Level.INFO : Level.DEBUG;
    }

    public PileupTrack(final ContigInterval visibleRange, final ReferenceCache referenceCache, final AlignmentCache alignmentCache,
                       final PileupRenderer renderer) {
        this(visibleRange, referenceCache, alignmentCache, renderer, false);
    }

    /**
     * Register with both caches and request the visible range from them.
     */
    public void start() {
        Utils.validate(!disposed, "cannot start a disposed track");
        Utils.validate(!started, "track already started");
        started = true;
        logger.debug("Starting pileup track for {}", visibleRange);

        referenceCache.addListener(this);
        alignmentCache.addListener(this);
        referenceCache.request(visibleRange);
        // a completion delivered synchronously above may already have disposed this track
        if ( !disposed ) {
            alignmentCache.request(visibleRange);
        }
        if ( !disposed ) {
            refresh();
        }
    }

    @Override
    public void onDataArrived(final DataCache<?> cache, final ContigInterval arrivedInterval) {
        if ( disposed ) {
            logger.debug("Ignoring arrival of {} for disposed track {}", arrivedInterval, visibleRange);
            return;
        }
        if ( cache != referenceCache && cache != alignmentCache ) {
            logger.debug("Ignoring arrival of {} from a cache not owned by track {}", arrivedInterval, visibleRange);
            return;
        }
        refresh();
    }

    /**
     * Request again whatever this track needs and does not fully have yet, typically after a failed fetch.
     * Intervals whose fetch is still outstanding are not fetched twice.
     */
    public void retry() {
        Utils.validate(started, "cannot retry a track that was not started");
        Utils.validate(!disposed, "cannot retry a disposed track");

        final List<ContigInterval> incompleteReference = new ArrayList<>();
        if ( referenceCache.coverageOf(visibleRange) != CoverageState.COMPLETE ) {
            incompleteReference.add(visibleRange);
        }
        for ( final ContigInterval overhang : referenceOverhangs ) {
            if ( referenceCache.coverageOf(overhang) != CoverageState.COMPLETE ) {
                incompleteReference.add(overhang);
            }
        }
        final boolean alignmentsIncomplete = alignmentCache.coverageOf(visibleRange) != CoverageState.COMPLETE;
        logger.debug("Retrying track {}: {} reference intervals, alignments {}", visibleRange, incompleteReference.size(),
                alignmentsIncomplete ? "incomplete" : "complete");

        requestReference(incompleteReference);
        if ( alignmentsIncomplete && !disposed ) {
            alignmentCache.request(visibleRange);
        }
    }

    /**
     * Forget the row assignment and lay out every alignment from scratch.
     */
    public void relayout() {
        Utils.validate(!disposed, "cannot relayout a disposed track");
        layout.reset();
        refresh();
    }

    /**
     * Unregister from and release both caches. Later notifications are no-ops.
     */
    public void dispose() {
        if ( disposed ) {
            return;
        }
        disposed = true;
        referenceCache.removeListener(this);
        alignmentCache.removeListener(this);
        referenceCache.printCacheStatistics();
        alignmentCache.printCacheStatistics();
        referenceCache.clear();
        alignmentCache.clear();
        mismatchesById.clear();
        referenceOverhangs.clear();
        overhangsRequestedFor.clear();
        layout.reset();
        logger.debug("Disposed pileup track for {} after {} emissions", visibleRange, numEmissions);
    }

    private void refresh() {
        final CoverageState referenceCoverage = referenceCache.coverageOf(visibleRange);
        final CoverageState alignmentCoverage = alignmentCache.coverageOf(visibleRange);
        final TrackState newState = TrackState.fromAvailability(referenceCoverage.hasData(), alignmentCoverage.hasData());
        if ( newState != state ) {
            logger.debug("Track {} moved from {} to {} (reference {}, alignments {})",
                    visibleRange, state, newState, referenceCoverage, alignmentCoverage);
            state = newState;
        }

        final List<ContigInterval> newOverhangs = new ArrayList<>();
        final List<RenderRecord> records = buildRecords(state.hasReference(), newOverhangs);
        if ( records.equals(lastEmitted) ) {
            logger.debug("Track {}: nothing changed, no emission", visibleRange);
        } else {
            lastEmitted = records;
            numEmissions++;
            logger.log(emissionLogLevel, "Track {} emitting {} records in state {}", visibleRange, records.size(), state);
            renderer.render(visibleRange, records);
        }
        // after the emission: a request may complete synchronously and refresh again
        requestReference(newOverhangs);
    }

    private void requestReference(final List<ContigInterval> intervals) {
        for ( final ContigInterval interval : intervals ) {
            if ( disposed ) {
                return;
            }
            referenceCache.request(interval);
        }
    }

    private List<RenderRecord> buildRecords(final boolean haveReference, final List<ContigInterval> newOverhangs) {
        final ImmutableList.Builder<RenderRecord> records = ImmutableList.builder();

        for ( final ReferenceBases segment : referenceCache.dataFor(visibleRange) ) {
            final int start = segment.getInterval().getStart();
            final byte[] bases = segment.getBases();
            for ( int i = 0; i < bases.length; i++ ) {
                records.add(new RenderRecord.ReferenceRecord(start + i, bases[i]));
            }
        }

        final List<Alignment> alignments = alignmentCache.dataFor(visibleRange);
        layout.assign(alignments);

        final List<RenderRecord.PileupRecord> pileup = new ArrayList<>(alignments.size());
        for ( final Alignment alignment : alignments ) {
            if ( overhangsRequestedFor.add(alignment.getId()) ) {
                collectOverhangs(alignment.getSpan(), newOverhangs);
            }
            final List<Mismatch> mismatches = haveReference ? mismatchesFor(alignment).getMismatches() : Collections.emptyList();
            pileup.add(new RenderRecord.PileupRecord(alignment.getId(), layout.rowOf(alignment.getId()), alignment.getSpan(), mismatches));
        }
        pileup.sort(PILEUP_RECORD_ORDER);
        records.addAll(pileup);
        return records.build();
    }

    private void collectOverhangs(final ContigInterval span, final List<ContigInterval> newOverhangs) {
        if ( span.isEmpty() || visibleRange.contains(span) ) {
            return;
        }
        if ( span.getStart() < visibleRange.getStart() ) {
            addOverhang(new ContigInterval(span.getContig(), span.getStart(), Math.min(span.getStop(), visibleRange.getStart())), newOverhangs);
        }
        if ( span.getStop() > visibleRange.getStop() ) {
            addOverhang(new ContigInterval(span.getContig(), Math.max(span.getStart(), visibleRange.getStop()), span.getStop()), newOverhangs);
        }
    }

    private void addOverhang(final ContigInterval overhang, final List<ContigInterval> newOverhangs) {
        if ( referenceOverhangs.add(overhang) ) {
            newOverhangs.add(overhang);
        }
    }

    private AlignmentMismatches mismatchesFor(final Alignment alignment) {
        final int contentVersion = referenceCache.getContentVersion();
        final CachedMismatches cached = mismatchesById.get(alignment.getId());
        if ( cached != null && (cached.result.isComplete() || cached.referenceContentVersion == contentVersion) ) {
            return cached.result;
        }
        final AlignmentMismatches result = MismatchDetector.detect(alignment, referenceCache.dataFor(alignment.getSpan()));
        mismatchesById.put(alignment.getId(), new CachedMismatches(result, contentVersion));
        return result;
    }

    /**
     * @return the intervals outside the visible range requested from the reference cache for overhanging alignments
     */
    public Set<ContigInterval> getReferenceOverhangs() {
        return Collections.unmodifiableSet(referenceOverhangs);
    }

    public ContigInterval getVisibleRange() {
        return visibleRange;
    }

    public TrackState getState() {
        return state;
    }

    /**
     * @return the records handed to the renderer last, empty if nothing was emitted yet
     */
    public List<RenderRecord> getLastEmitted() {
        return lastEmitted;
    }

    public int getNumEmissions() {
        return numEmissions;
    }

    /**
     * @return the current row of every laid out alignment, ordered by alignment id
     */
    public SortedMap<String, Integer> getRowAssignments() {
        return layout.getAssignments();
    }

    public boolean isDisposed() {
        return disposed;
    }

    public ReferenceCache getReferenceCache() {
        return referenceCache;
    }

    public AlignmentCache getAlignmentCache() {
        return alignmentCache;
    }
}
