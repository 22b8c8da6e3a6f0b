package org.broadinstitute.pileup.engine;

import com.google.common.util.concurrent.MoreExecutors;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pileup.engine.cache.AlignmentCache;
import org.broadinstitute.pileup.engine.cache.BlockAlignedFetchStrategy;
import org.broadinstitute.pileup.engine.cache.LookaheadFetchStrategy;
import org.broadinstitute.pileup.engine.cache.ReferenceCache;
import org.broadinstitute.pileup.engine.datasources.AlignmentSource;
import org.broadinstitute.pileup.engine.datasources.ReferenceSource;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.config.ConfigFactory;
import org.broadinstitute.pileup.utils.config.PileupConfig;

import java.util.concurrent.Executor;

/**
 * Owns the {@link PileupTrack} for whatever range is currently displayed.
 *
 * Moving to a different range disposes the current track and starts a new one on fresh caches, so nothing fetched
 * for the old range leaks into the new one, and fetches still outstanding for the old range complete into a disposed
 * track where they are ignored.
 */
public final class PileupView implements AutoCloseable {
    private static final Logger logger = LogManager.getLogger(PileupView.class);

    private final ReferenceSource referenceSource;
    private final AlignmentSource alignmentSource;
    private final PileupRenderer renderer;
    private final PileupConfig config;
    private final Executor callbackExecutor;

    private PileupTrack currentTrack = null;

    /**
     * @param callbackExecutor executor on which fetch completions are processed, see
     *                         {@link org.broadinstitute.pileup.engine.cache.DataCache}
     */
    public PileupView(final ReferenceSource referenceSource, final AlignmentSource alignmentSource, final PileupRenderer renderer,
                      final PileupConfig config, final Executor callbackExecutor) {
        this.referenceSource = Utils.nonNull(referenceSource);
        this.alignmentSource = Utils.nonNull(alignmentSource);
        this.renderer = Utils.nonNull(renderer);
        this.config = Utils.nonNull(config);
        this.callbackExecutor = Utils.nonNull(callbackExecutor);
        ConfigFactory.logConfigFields(config);
    }

    public PileupView(final ReferenceSource referenceSource, final AlignmentSource alignmentSource, final PileupRenderer renderer) {
        this(referenceSource, alignmentSource, renderer, ConfigFactory.getInstance().createPileupConfig(), MoreExecutors.directExecutor());
    }

    /**
     * Display {@code range}. If it is already displayed, the current track is kept and anything it still misses,
     * for instance after a failed fetch, is requested again.
     *
     * @return the track now displaying {@code range}
     */
    public PileupTrack setRange(final ContigInterval range) {
        Utils.nonNull(range);
        if ( currentTrack != null && currentTrack.getVisibleRange().equals(range) ) {
            currentTrack.retry();
            return currentTrack;
        }
        if ( currentTrack != null ) {
            logger.debug("Range changed from {} to {}", currentTrack.getVisibleRange(), range);
            currentTrack.dispose();
        }

        final ReferenceCache referenceCache = new ReferenceCache(referenceSource,
                new BlockAlignedFetchStrategy(config.referenceFetchBlockSize()), callbackExecutor);
        final AlignmentCache alignmentCache = new AlignmentCache(alignmentSource,
                new LookaheadFetchStrategy(config.alignmentFetchLookaheadBases()), config.alignmentFetchContainedOnly(), callbackExecutor);
        currentTrack = new PileupTrack(range, referenceCache, alignmentCache, renderer, config.logEmissions());
        currentTrack.start();
        return currentTrack;
    }

    /**
     * @param range range in the 1-based human-readable form, such as {@code chr17:7,500,734-7,500,795}
     * @throws org.broadinstitute.pileup.exceptions.UserException.MalformedInterval if {@code range} cannot be parsed
     */
    public PileupTrack setRange(final String range) {
        return setRange(ContigInterval.parse(range));
    }

    /**
     * @return the live track, or null before the first {@link #setRange} and after {@link #close()}
     */
    public PileupTrack getCurrentTrack() {
        return currentTrack;
    }

    @Override
    public void close() {
        if ( currentTrack != null ) {
            currentTrack.dispose();
            currentTrack = null;
        }
    }
}
