package org.broadinstitute.pileup.engine.cache;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pileup.engine.datasources.AlignmentSource;
import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.read.Alignment;
import org.broadinstitute.pileup.utils.read.AlignmentCoordinateComparator;
import org.broadinstitute.pileup.utils.read.AlignmentUtils;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

/**
 * Cache of alignments fetched from an {@link AlignmentSource}, keyed by alignment id.
 *
 * The first arrival of an id is kept and later copies are ignored. Each arriving record is validated; malformed
 * records are logged and dropped while the rest of their batch is kept.
 */
public final class AlignmentCache extends DataCache<List<Alignment>> {
    private static final Logger logger = LogManager.getLogger(AlignmentCache.class);

    private final AlignmentSource source;

    /**
     * Passed to the source with every fetch
     */
    private final boolean containedOnly;

    private final Map<String, Alignment> alignmentsById = new LinkedHashMap<>();

    private int numMalformed = 0;

    public AlignmentCache(final AlignmentSource source, final FetchIntervalStrategy fetchStrategy, final boolean containedOnly, final Executor callbackExecutor) {
        super("alignments", fetchStrategy, callbackExecutor);
        this.source = Utils.nonNull(source);
        this.containedOnly = containedOnly;
    }

    public AlignmentCache(final AlignmentSource source, final FetchIntervalStrategy fetchStrategy, final boolean containedOnly) {
        super("alignments", fetchStrategy);
        this.source = Utils.nonNull(source);
        this.containedOnly = containedOnly;
    }

    public AlignmentCache(final AlignmentSource source) {
        this(source, new LookaheadFetchStrategy(0), false);
    }

    @Override
    protected CompletableFuture<List<Alignment>> fetch(final ContigInterval fetchInterval) {
        return source.fetch(fetchInterval, containedOnly);
    }

    @Override
    protected ContigInterval arrivedIntervalFor(final ContigInterval fetchInterval, final List<Alignment> data) {
        return fetchInterval;
    }

    @Override
    protected boolean store(final ContigInterval interval, final List<Alignment> data) {
        boolean changed = false;
        for ( final Alignment alignment : data ) {
            if ( alignment == null ) {
                continue;
            }
            try {
                AlignmentUtils.validate(alignment);
            } catch ( final PileupException.MalformedRecord e ) {
                numMalformed++;
                logger.warn("Skipping malformed alignment delivered for {}: {}", interval, e.getMessage());
                continue;
            }
            if ( alignmentsById.putIfAbsent(alignment.getId(), alignment) == null ) {
                changed = true;
            }
        }
        return changed;
    }

    /**
     * @return mapped alignments whose span overlaps {@code query} (or, for alignments with an empty span, that start
     * inside it), ordered by start then id
     */
    public List<Alignment> dataFor(final ContigInterval query) {
        Utils.nonNull(query);
        return alignmentsById.values().stream()
                .filter(a -> overlaps(a, query))
                .sorted(AlignmentCoordinateComparator.INSTANCE)
                .collect(Collectors.toList());
    }

    private static boolean overlaps(final Alignment alignment, final ContigInterval query) {
        if ( !alignment.isMapped() || !alignment.getContig().equals(query.getContig()) ) {
            return false;
        }
        final int start = alignment.getStart();
        final int end = Math.max(alignment.getEnd(), start + 1);
        return start < query.getStop() && end > query.getStart();
    }

    public boolean isContainedOnly() {
        return containedOnly;
    }

    public int getNumMalformed() {
        return numMalformed;
    }

    public int size() {
        return alignmentsById.size();
    }

    @Override
    protected void clearStorage() {
        alignmentsById.clear();
    }

    @Override
    protected String describeStorage() {
        return alignmentsById.size() + " alignments stored, " + numMalformed + " malformed records skipped";
    }
}
