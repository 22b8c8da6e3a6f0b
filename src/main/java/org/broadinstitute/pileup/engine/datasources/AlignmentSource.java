package org.broadinstitute.pileup.engine.datasources;

import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.read.Alignment;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Asynchronous provider of alignments.
 *
 * {@link #fetch} must not block. The returned future completes with every alignment overlapping the interval (or
 * only those contained in it when {@code containedOnly} is set), or exceptionally when the query fails.
 */
@FunctionalInterface
public interface AlignmentSource {

    /**
     * @param interval 0-based half-open interval to query
     * @param containedOnly if true, only alignments wholly contained in {@code interval} are returned
     * @return future list of alignments, in no particular order
     */
    CompletableFuture<List<Alignment>> fetch(final ContigInterval interval, final boolean containedOnly);
}
