package org.broadinstitute.pileup.engine;

import org.broadinstitute.pileup.engine.cache.AlignmentCache;
import org.broadinstitute.pileup.engine.cache.ReferenceCache;
import org.broadinstitute.pileup.testutils.ArtificialAlignmentUtils;
import org.broadinstitute.pileup.testutils.BaseTest;
import org.broadinstitute.pileup.testutils.ControlledAlignmentSource;
import org.broadinstitute.pileup.testutils.ControlledReferenceSource;
import org.broadinstitute.pileup.testutils.FakeReferenceSource;
import org.broadinstitute.pileup.testutils.RecordingRenderer;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.pileup.Mismatch;
import org.broadinstitute.pileup.utils.read.Alignment;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

public final class PileupTrackUnitTest extends BaseTest {

    private static final ContigInterval VISIBLE = ContigInterval.parse("chr17:7,500,734-7,500,795");

    // the reference carries C here and 22 of the reads carry T
    private static final int SNP_POSITION = 7500764;
    private static final int NUM_SNP_READS = 22;

    private static final ReferenceBases GENOME = createGenome();
    private static final List<Alignment> READS = createReads();

    private static ReferenceBases createGenome() {
        final ReferenceBases fake = FakeReferenceSource.bases(new ContigInterval("chr17", 7500000, 7501000));
        final byte[] bases = Arrays.copyOf(fake.getBases(), fake.getBases().length);
        bases[SNP_POSITION - 7500000] = 'C';
        return new ReferenceBases(bases, fake.getInterval());
    }

    private static List<Alignment> createReads() {
        final List<Alignment> reads = new ArrayList<>();
        for ( int i = 0; i < NUM_SNP_READS; i++ ) {
            final int start = 7500720 + i;
            reads.add(i < 3
                    ? ArtificialAlignmentUtils.createAlignmentWithSubstitutions("snp" + i, GENOME, start, 50, SNP_POSITION, 'T', 7500740, 'A')
                    : ArtificialAlignmentUtils.createAlignmentWithSubstitutions("snp" + i, GENOME, start, 50, SNP_POSITION, 'T'));
        }
        for ( int i = 0; i < 10; i++ ) {
            reads.add(ArtificialAlignmentUtils.createMatchingAlignment("ref" + i, GENOME, 7500700 + 7 * i, 60));
        }
        reads.add(ArtificialAlignmentUtils.createAlignmentWithSubstitutions("unknownBase", GENOME, 7500740, 40, SNP_POSITION - 1, 'N'));
        return reads;
    }

    private static final class Fixture {
        final ControlledReferenceSource referenceSource;
        final ControlledAlignmentSource alignmentSource;
        final RecordingRenderer renderer = new RecordingRenderer();
        final PileupTrack track;

        Fixture(final ReferenceBases genome, final ContigInterval visible, final List<Alignment> reads) {
            referenceSource = ControlledReferenceSource.serving(genome);
            alignmentSource = new ControlledAlignmentSource(reads);
            track = new PileupTrack(visible, new ReferenceCache(referenceSource), new AlignmentCache(alignmentSource), renderer);
        }

        Fixture(final ContigInterval visible, final List<Alignment> reads) {
            this(GENOME, visible, reads);
        }

        Fixture() {
            this(VISIBLE, READS);
        }
    }

    private static List<RenderRecord> runToCompletion(final boolean referenceFirst) {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        if ( referenceFirst ) {
            fixture.referenceSource.releaseAll();
            fixture.alignmentSource.releaseAll();
        } else {
            fixture.alignmentSource.releaseAll();
            fixture.referenceSource.releaseAll();
        }
        Assert.assertEquals(fixture.track.getState(), TrackState.READY);
        Assert.assertEquals(fixture.renderer.getLast(), fixture.track.getLastEmitted());
        return fixture.renderer.getLast();
    }

    private static long countMismatches(final List<RenderRecord> records, final int position) {
        return RecordingRenderer.mismatches(records).stream().filter(m -> m.getPosition() == position).count();
    }

    @Test
    public void testMismatchesAtKnownVariant() {
        final List<RenderRecord> records = runToCompletion(true);

        final List<Mismatch> atSnp = RecordingRenderer.mismatches(records).stream()
                .filter(m -> m.getPosition() == SNP_POSITION)
                .collect(Collectors.toList());
        Assert.assertEquals(atSnp.size(), NUM_SNP_READS);
        for ( final Mismatch mismatch : atSnp ) {
            Assert.assertEquals(mismatch.getBasePair(), (byte) 'T');
            Assert.assertEquals(mismatch.getReferenceBase(), (byte) 'C');
        }
        Assert.assertEquals(countMismatches(records, SNP_POSITION - 1), 0, "N in the read is never a mismatch");
        Assert.assertEquals(countMismatches(records, 7500740), 3);
        Assert.assertEquals(RecordingRenderer.mismatches(records).size(), NUM_SNP_READS + 3);
        Assert.assertTrue(RecordingRenderer.mismatches(records).size() < 60);
    }

    @Test
    public void testRecordContents() {
        final List<RenderRecord> records = runToCompletion(true);

        final List<RenderRecord.ReferenceRecord> reference = RecordingRenderer.referenceRecords(records);
        Assert.assertEquals(reference.size(), VISIBLE.size());
        for ( int i = 0; i < reference.size(); i++ ) {
            final int position = VISIBLE.getStart() + i;
            Assert.assertEquals(reference.get(i).getPosition(), position);
            Assert.assertEquals(reference.get(i).getBasePair(), GENOME.getBase(position));
        }
        Assert.assertEquals(records.get(0).getKind(), RenderRecord.Kind.REFERENCE, "reference records come first");

        final List<RenderRecord.PileupRecord> pileup = RecordingRenderer.pileupRecords(records);
        Assert.assertEquals(pileup.size(), READS.size());
        for ( int i = 1; i < pileup.size(); i++ ) {
            final RenderRecord.PileupRecord previous = pileup.get(i - 1);
            final RenderRecord.PileupRecord current = pileup.get(i);
            Assert.assertTrue(previous.getRow() < current.getRow()
                    || previous.getRow() == current.getRow() && previous.getSpan().getStop() <= current.getSpan().getStart(),
                    previous + " before " + current);
        }
    }

    @Test
    public void testFinalRecordsDoNotDependOnArrivalOrder() {
        Assert.assertEquals(runToCompletion(false), runToCompletion(true));
    }

    @Test
    public void testReferenceFirst() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        Assert.assertEquals(fixture.track.getState(), TrackState.WAITING_BOTH);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), 0, "nothing to draw yet");

        fixture.referenceSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.HAVE_REFERENCE_ONLY);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), 1);
        Assert.assertEquals(RecordingRenderer.referenceRecords(fixture.renderer.getLast()).size(), VISIBLE.size());
        Assert.assertTrue(RecordingRenderer.pileupRecords(fixture.renderer.getLast()).isEmpty());

        fixture.alignmentSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.READY);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), 2);
        Assert.assertEquals(fixture.track.getNumEmissions(), 2);
    }

    @Test
    public void testAlignmentsFirst() {
        final Fixture fixture = new Fixture();
        fixture.track.start();

        fixture.alignmentSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.HAVE_ALIGNMENTS_ONLY);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), 1);
        final List<RenderRecord> withoutReference = fixture.renderer.getLast();
        Assert.assertTrue(RecordingRenderer.referenceRecords(withoutReference).isEmpty());
        Assert.assertEquals(RecordingRenderer.pileupRecords(withoutReference).size(), READS.size());
        Assert.assertTrue(RecordingRenderer.mismatches(withoutReference).isEmpty(), "no mismatches without reference");

        fixture.referenceSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.READY);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), 2);
        Assert.assertEquals(countMismatches(fixture.renderer.getLast(), SNP_POSITION), NUM_SNP_READS);
    }

    @Test
    public void testReferenceArrivingInPieces() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        fixture.alignmentSource.releaseAll();
        final ReferenceCache referenceCache = fixture.track.getReferenceCache();

        referenceCache.onDataArrived(GENOME.getSubset(new ContigInterval("chr17", VISIBLE.getStart(), SNP_POSITION)));
        Assert.assertEquals(fixture.track.getState(), TrackState.READY);
        Assert.assertEquals(countMismatches(fixture.renderer.getLast(), SNP_POSITION), 0, "reference not delivered there yet");
        Assert.assertEquals(countMismatches(fixture.renderer.getLast(), 7500740), 3);
        Assert.assertEquals(RecordingRenderer.referenceRecords(fixture.renderer.getLast()).size(), SNP_POSITION - VISIBLE.getStart());

        referenceCache.onDataArrived(GENOME.getSubset(new ContigInterval("chr17", SNP_POSITION, VISIBLE.getStop())));
        Assert.assertEquals(countMismatches(fixture.renderer.getLast(), SNP_POSITION), NUM_SNP_READS);

        fixture.referenceSource.releaseAll();
        Assert.assertEquals(fixture.renderer.getLast(), runToCompletion(true));
    }

    @Test
    public void testUnchangedRecordsAreNotEmittedAgain() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        fixture.referenceSource.releaseAll();
        fixture.alignmentSource.releaseAll();
        final int emissions = fixture.renderer.getNumEmissions();

        // a new alignment that only touches the requested range beyond what is drawn
        final Alignment outside = ArtificialAlignmentUtils.createMatchingAlignment("outside", GENOME, VISIBLE.getStop(), 20);
        fixture.track.getAlignmentCache().onDataArrived(new ContigInterval("chr17", VISIBLE.getStop() - 5, VISIBLE.getStop() + 20),
                Collections.singletonList(outside));
        Assert.assertEquals(fixture.track.getAlignmentCache().size(), READS.size() + 1);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), emissions);

        fixture.track.onDataArrived(fixture.track.getReferenceCache(), VISIBLE);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), emissions);
    }

    @Test
    public void testRangeWithoutAlignments() {
        final Fixture fixture = new Fixture(VISIBLE, Collections.emptyList());
        fixture.track.start();
        fixture.alignmentSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.HAVE_ALIGNMENTS_ONLY);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), 0, "an empty pileup is what was drawn already");

        fixture.referenceSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.READY);
        Assert.assertEquals(fixture.renderer.getLast().size(), VISIBLE.size());
    }

    @Test
    public void testFailedFetchLeavesTrackWaiting() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        fixture.referenceSource.failAll("server unavailable");
        fixture.alignmentSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.HAVE_ALIGNMENTS_ONLY);
        Assert.assertEquals(fixture.track.getReferenceCache().getNumFailures(), 1);

        fixture.track.getReferenceCache().request(VISIBLE);
        fixture.referenceSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.READY);
        Assert.assertEquals(fixture.renderer.getLast(), runToCompletion(true));
    }

    @Test
    public void testRetryAfterFailedFetches() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        fixture.referenceSource.failAll("server unavailable");
        fixture.alignmentSource.failAll("server unavailable");
        Assert.assertEquals(fixture.track.getState(), TrackState.WAITING_BOTH);
        Assert.assertEquals(fixture.referenceSource.getRequests().size(), 1);
        Assert.assertEquals(fixture.alignmentSource.getRequests().size(), 1);

        fixture.track.retry();
        Assert.assertEquals(fixture.referenceSource.getRequests().size(), 2);
        Assert.assertEquals(fixture.alignmentSource.getRequests().size(), 2);

        // the new fetches are outstanding, so retrying again does not duplicate them
        fixture.track.retry();
        Assert.assertEquals(fixture.referenceSource.getRequests().size(), 2);
        Assert.assertEquals(fixture.alignmentSource.getRequests().size(), 2);

        fixture.referenceSource.releaseAll();
        fixture.alignmentSource.releaseAll();
        Assert.assertEquals(fixture.track.getState(), TrackState.READY);
        Assert.assertEquals(fixture.renderer.getLast(), runToCompletion(true));

        fixture.track.retry();
        Assert.assertEquals(fixture.referenceSource.getRequests().size(), 2, "nothing left to fetch");
        Assert.assertEquals(fixture.alignmentSource.getRequests().size(), 2);
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testCannotRetryBeforeStart() {
        new Fixture().track.retry();
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testCannotRetryDisposedTrack() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        fixture.track.dispose();
        fixture.track.retry();
    }

    private static List<RenderRecord> streamReferenceAroundOverhangingAlignment(final boolean lowerHalfFirst) {
        final ReferenceBases genome = FakeReferenceSource.bases(new ContigInterval("1", 0, 1000));
        final ContigInterval visible = new ContigInterval("1", 100, 200);
        // the fake reference has T at both 160 and 220
        final Alignment overhanging = ArtificialAlignmentUtils.createAlignmentWithSubstitutions("overhanging", genome, 150, 100, 160, 'A', 220, 'A');
        final Fixture fixture = new Fixture(genome, visible, Collections.singletonList(overhanging));
        fixture.track.start();
        fixture.alignmentSource.releaseAll();
        Assert.assertEquals(fixture.track.getReferenceOverhangs(), Collections.singleton(new ContigInterval("1", 200, 250)));

        final ReferenceBases lower = genome.getSubset(new ContigInterval("1", 0, 200));
        final ReferenceBases upper = genome.getSubset(new ContigInterval("1", 200, 1000));
        final ReferenceCache referenceCache = fixture.track.getReferenceCache();
        referenceCache.onDataArrived(lowerHalfFirst ? lower : upper);
        referenceCache.onDataArrived(lowerHalfFirst ? upper : lower);
        Assert.assertEquals(fixture.track.getState(), TrackState.READY);
        return fixture.renderer.getLast();
    }

    @Test
    public void testReferenceBeyondVisibleRangeCompletesMismatches() {
        for ( final boolean lowerHalfFirst : new boolean[]{true, false} ) {
            final List<Integer> positions = RecordingRenderer.mismatches(streamReferenceAroundOverhangingAlignment(lowerHalfFirst)).stream()
                    .map(Mismatch::getPosition)
                    .collect(Collectors.toList());
            Assert.assertEquals(positions, Arrays.asList(160, 220), "lower half first: " + lowerHalfFirst);
        }
        Assert.assertEquals(streamReferenceAroundOverhangingAlignment(true), streamReferenceAroundOverhangingAlignment(false));
    }

    @Test
    public void testStaleMismatchesAreRecomputedWithoutNotification() {
        final ReferenceBases genome = FakeReferenceSource.bases(new ContigInterval("1", 0, 1000));
        final ContigInterval visible = new ContigInterval("1", 100, 200);
        final Alignment overhanging = ArtificialAlignmentUtils.createAlignmentWithSubstitutions("overhanging", genome, 150, 100, 160, 'A', 220, 'A');
        final Fixture fixture = new Fixture(genome, visible, Collections.singletonList(overhanging));
        fixture.track.start();
        fixture.alignmentSource.releaseAll();
        final ReferenceCache referenceCache = fixture.track.getReferenceCache();
        referenceCache.onDataArrived(genome.getSubset(new ContigInterval("1", 0, 200)));
        Assert.assertEquals(RecordingRenderer.mismatches(fixture.renderer.getLast()).size(), 1);

        // stored without telling the track, e.g. while it was not listening
        referenceCache.removeListener(fixture.track);
        referenceCache.onDataArrived(genome.getSubset(new ContigInterval("1", 200, 1000)));
        referenceCache.addListener(fixture.track);
        Assert.assertEquals(RecordingRenderer.mismatches(fixture.renderer.getLast()).size(), 1);

        fixture.track.onDataArrived(fixture.track.getAlignmentCache(), visible);
        Assert.assertEquals(RecordingRenderer.mismatches(fixture.renderer.getLast()).size(), 2);
    }

    @Test
    public void testDisposedTrackIgnoresLateData() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        final ReferenceCache referenceCache = fixture.track.getReferenceCache();

        fixture.track.dispose();
        Assert.assertTrue(fixture.track.isDisposed());
        fixture.referenceSource.releaseAll();
        fixture.alignmentSource.releaseAll();
        fixture.track.onDataArrived(referenceCache, VISIBLE);

        Assert.assertEquals(fixture.renderer.getNumEmissions(), 0);
        Assert.assertTrue(referenceCache.dataFor(VISIBLE).isEmpty());
        Assert.assertEquals(fixture.track.getAlignmentCache().size(), 0);
        Assert.assertTrue(fixture.track.getRowAssignments().isEmpty());

        // disposing twice is harmless
        fixture.track.dispose();
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testCannotStartDisposedTrack() {
        final Fixture fixture = new Fixture();
        fixture.track.dispose();
        fixture.track.start();
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testCannotStartTwice() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        fixture.track.start();
    }

    @Test
    public void testArrivalsFromOtherCachesAreIgnored() {
        final Fixture fixture = new Fixture();
        fixture.track.start();
        fixture.alignmentSource.releaseAll();
        final int emissions = fixture.renderer.getNumEmissions();

        final ControlledReferenceSource foreignSource = ControlledReferenceSource.serving(GENOME);
        final ReferenceCache foreign = new ReferenceCache(foreignSource);
        foreign.addListener(fixture.track);
        foreign.request(VISIBLE);
        foreignSource.releaseAll();
        Assert.assertEquals(foreign.dataFor(VISIBLE).size(), 1);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), emissions);
        Assert.assertEquals(fixture.track.getState(), TrackState.HAVE_ALIGNMENTS_ONLY);
    }

    @Test
    public void testRelayout() {
        final ContigInterval visible = new ContigInterval("1", 0, 100);
        final ReferenceBases reference = FakeReferenceSource.bases(visible);
        final Fixture fixture = new Fixture(visible, Collections.emptyList());
        fixture.track.start();
        fixture.alignmentSource.releaseAll();
        final AlignmentCache alignmentCache = fixture.track.getAlignmentCache();

        alignmentCache.onDataArrived(visible, Collections.singletonList(ArtificialAlignmentUtils.createMatchingAlignment("b", reference, 10, 10)));
        alignmentCache.onDataArrived(visible, Arrays.asList(
                ArtificialAlignmentUtils.createMatchingAlignment("a", reference, 0, 5),
                ArtificialAlignmentUtils.createMatchingAlignment("c", reference, 5, 10),
                ArtificialAlignmentUtils.createMatchingAlignment("d", reference, 15, 10)));
        Assert.assertEquals(fixture.track.getRowAssignments().get("b").intValue(), 0, "b arrived first");
        Assert.assertEquals(fixture.track.getRowAssignments().get("a").intValue(), 0);
        Assert.assertEquals(fixture.track.getRowAssignments().get("c").intValue(), 1);
        Assert.assertEquals(fixture.track.getRowAssignments().get("d").intValue(), 1);
        final int emissions = fixture.renderer.getNumEmissions();

        fixture.track.relayout();
        Assert.assertEquals(fixture.track.getRowAssignments().get("a").intValue(), 0);
        Assert.assertEquals(fixture.track.getRowAssignments().get("c").intValue(), 0);
        Assert.assertEquals(fixture.track.getRowAssignments().get("b").intValue(), 1);
        Assert.assertEquals(fixture.track.getRowAssignments().get("d").intValue(), 0);
        Assert.assertEquals(fixture.renderer.getNumEmissions(), emissions + 1);
        Assert.assertEquals(RecordingRenderer.pileupRecords(fixture.renderer.getLast()).stream()
                .map(RenderRecord.PileupRecord::getAlignmentId)
                .collect(Collectors.toList()), Arrays.asList("a", "c", "d", "b"));
    }
}
