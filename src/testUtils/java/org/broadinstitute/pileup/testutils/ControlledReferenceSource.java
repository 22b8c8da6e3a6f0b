package org.broadinstitute.pileup.testutils;

import org.broadinstitute.pileup.engine.datasources.ReferenceSource;
import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * A {@link ReferenceSource} whose fetches stay pending until the test releases or fails them, so tests decide
 * exactly when and in which order data arrives.
 */
public final class ControlledReferenceSource implements ReferenceSource {

    private final Function<ContigInterval, ReferenceBases> provider;
    private final List<ContigInterval> requests = new ArrayList<>();
    private final List<PendingFetch<ReferenceBases>> pending = new ArrayList<>();

    /**
     * @param provider produces the bases a released fetch completes with
     */
    public ControlledReferenceSource(final Function<ContigInterval, ReferenceBases> provider) {
        this.provider = provider;
    }

    /**
     * A source serving {@link FakeReferenceSource} bases.
     */
    public ControlledReferenceSource() {
        this(FakeReferenceSource::bases);
    }

    /**
     * A source serving the part of {@code genome} that overlaps each fetch.
     */
    public static ControlledReferenceSource serving(final ReferenceBases genome) {
        return new ControlledReferenceSource(interval -> {
            final ContigInterval overlap = genome.getInterval().intersect(interval)
                    .orElseThrow(() -> new PileupException.FetchError(interval, "outside the test genome"));
            return genome.getSubset(overlap);
        });
    }

    @Override
    public CompletableFuture<ReferenceBases> fetch(final ContigInterval interval) {
        requests.add(interval);
        final CompletableFuture<ReferenceBases> future = new CompletableFuture<>();
        pending.add(new PendingFetch<>(interval, future));
        return future;
    }

    /**
     * Complete every pending fetch with its data, in the order the fetches were made.
     */
    public void releaseAll() {
        for ( final PendingFetch<ReferenceBases> fetch : drain() ) {
            fetch.future.complete(provider.apply(fetch.interval));
        }
    }

    /**
     * Fail every pending fetch with a {@link PileupException.FetchError}.
     */
    public void failAll(final String message) {
        for ( final PendingFetch<ReferenceBases> fetch : drain() ) {
            fetch.future.completeExceptionally(new PileupException.FetchError(fetch.interval, message));
        }
    }

    private List<PendingFetch<ReferenceBases>> drain() {
        final List<PendingFetch<ReferenceBases>> fetches = new ArrayList<>(pending);
        pending.clear();
        return fetches;
    }

    public List<ContigInterval> getRequests() {
        return Collections.unmodifiableList(requests);
    }

    public int getNumPending() {
        return pending.size();
    }
}
