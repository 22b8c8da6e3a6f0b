package org.broadinstitute.pileup.testutils;

import org.broadinstitute.pileup.utils.ContigInterval;

import java.util.concurrent.CompletableFuture;

/**
 * A fetch handed out by one of the controlled test sources and not completed yet.
 */
final class PendingFetch<T> {
    final ContigInterval interval;
    final CompletableFuture<T> future;

    PendingFetch(final ContigInterval interval, final CompletableFuture<T> future) {
        this.interval = interval;
        this.future = future;
    }
}
