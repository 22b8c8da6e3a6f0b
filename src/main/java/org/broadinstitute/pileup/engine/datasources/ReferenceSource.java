package org.broadinstitute.pileup.engine.datasources;

import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;

import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous provider of reference bases.
 *
 * {@link #fetch} must not block: the returned future completes later, on any thread. It may complete with bases
 * spanning only a prefix of the requested interval (for instance when the interval runs past the end of the contig),
 * and completes exceptionally, preferably with a
 * {@link org.broadinstitute.pileup.exceptions.PileupException.FetchError}, when the bases cannot be retrieved.
 */
@FunctionalInterface
public interface ReferenceSource {

    /**
     * @param interval 0-based half-open interval to fetch
     * @return future reference bases, whose interval is contained in {@code interval}
     */
    CompletableFuture<ReferenceBases> fetch(final ContigInterval interval);
}
