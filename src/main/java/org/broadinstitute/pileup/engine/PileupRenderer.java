package org.broadinstitute.pileup.engine;

import org.broadinstitute.pileup.utils.ContigInterval;

import java.util.List;

/**
 * Receives the drawable records of a {@link PileupTrack} each time they change.
 */
@FunctionalInterface
public interface PileupRenderer {

    /**
     * @param visibleRange the range the records were computed for
     * @param records reference records in ascending position, followed by pileup records ordered by row, start and id.
     *                The list is immutable.
     */
    void render(final ContigInterval visibleRange, final List<RenderRecord> records);
}
