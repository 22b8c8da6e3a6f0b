package org.broadinstitute.pileup.testutils;

import org.broadinstitute.pileup.engine.datasources.AlignmentSource;
import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.read.Alignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Collectors;

/**
 * An {@link AlignmentSource} over a fixed list of alignments whose fetches stay pending until the test releases or
 * fails them.
 */
public final class ControlledAlignmentSource implements AlignmentSource {

    private final List<Alignment> alignments;
    private final List<ContigInterval> requests = new ArrayList<>();
    private final List<Boolean> containedOnlyFlags = new ArrayList<>();
    private final List<PendingFetch<List<Alignment>>> pending = new ArrayList<>();
    private final List<Boolean> pendingContainedOnly = new ArrayList<>();

    public ControlledAlignmentSource(final List<Alignment> alignments) {
        this.alignments = new ArrayList<>(alignments);
    }

    @Override
    public CompletableFuture<List<Alignment>> fetch(final ContigInterval interval, final boolean containedOnly) {
        requests.add(interval);
        containedOnlyFlags.add(containedOnly);
        final CompletableFuture<List<Alignment>> future = new CompletableFuture<>();
        pending.add(new PendingFetch<>(interval, future));
        pendingContainedOnly.add(containedOnly);
        return future;
    }

    /**
     * Complete every pending fetch with the alignments it asked for, in the order the fetches were made.
     */
    public void releaseAll() {
        final List<PendingFetch<List<Alignment>>> fetches = new ArrayList<>(pending);
        final List<Boolean> flags = new ArrayList<>(pendingContainedOnly);
        pending.clear();
        pendingContainedOnly.clear();
        for ( int i = 0; i < fetches.size(); i++ ) {
            final PendingFetch<List<Alignment>> fetch = fetches.get(i);
            fetch.future.complete(select(fetch.interval, flags.get(i)));
        }
    }

    /**
     * Fail every pending fetch with a {@link PileupException.FetchError}.
     */
    public void failAll(final String message) {
        final List<PendingFetch<List<Alignment>>> fetches = new ArrayList<>(pending);
        pending.clear();
        pendingContainedOnly.clear();
        for ( final PendingFetch<List<Alignment>> fetch : fetches ) {
            fetch.future.completeExceptionally(new PileupException.FetchError(fetch.interval, message));
        }
    }

    private List<Alignment> select(final ContigInterval interval, final boolean containedOnly) {
        return alignments.stream()
                .filter(a -> a.isMapped() && a.getContig().equals(interval.getContig()))
                .filter(a -> containedOnly
                        ? a.getStart() >= interval.getStart() && a.getEnd() <= interval.getStop()
                        : a.getStart() < interval.getStop() && Math.max(a.getEnd(), a.getStart() + 1) > interval.getStart())
                .collect(Collectors.toList());
    }

    public List<ContigInterval> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    public List<Boolean> getContainedOnlyFlags() {
        return Collections.unmodifiableList(containedOnlyFlags);
    }

    public int getNumPending() {
        return pending.size();
    }
}
