package org.broadinstitute.pileup.engine;

import com.google.common.util.concurrent.MoreExecutors;
import org.broadinstitute.pileup.exceptions.UserException;
import org.broadinstitute.pileup.testutils.ArtificialAlignmentUtils;
import org.broadinstitute.pileup.testutils.BaseTest;
import org.broadinstitute.pileup.testutils.ControlledAlignmentSource;
import org.broadinstitute.pileup.testutils.ControlledReferenceSource;
import org.broadinstitute.pileup.testutils.FakeReferenceSource;
import org.broadinstitute.pileup.testutils.RecordingRenderer;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.config.ConfigFactory;
import org.broadinstitute.pileup.utils.config.PileupConfig;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;

public final class PileupViewUnitTest extends BaseTest {

    private static final ReferenceBases REFERENCE = FakeReferenceSource.bases(new ContigInterval("1", 0, 10000));

    private static ControlledAlignmentSource createAlignmentSource() {
        return new ControlledAlignmentSource(Arrays.asList(
                ArtificialAlignmentUtils.createMatchingAlignment("early", REFERENCE, 100, 50),
                ArtificialAlignmentUtils.createMatchingAlignment("late", REFERENCE, 5000, 50)));
    }

    @Test
    public void testSetRange() {
        final ControlledReferenceSource referenceSource = new ControlledReferenceSource();
        final ControlledAlignmentSource alignmentSource = createAlignmentSource();
        final RecordingRenderer renderer = new RecordingRenderer();
        try ( final PileupView view = new PileupView(referenceSource, alignmentSource, renderer) ) {
            Assert.assertNull(view.getCurrentTrack());

            final PileupTrack track = view.setRange("1:101-200");
            Assert.assertEquals(track.getVisibleRange(), new ContigInterval("1", 100, 200));
            Assert.assertSame(view.getCurrentTrack(), track);
            Assert.assertEquals(referenceSource.getRequests(), Collections.singletonList(new ContigInterval("1", 0, 1000)));
            Assert.assertEquals(alignmentSource.getRequests(), Collections.singletonList(new ContigInterval("1", 100, 200)));

            Assert.assertSame(view.setRange(new ContigInterval("1", 100, 200)), track, "same range keeps the track");
            Assert.assertEquals(referenceSource.getRequests().size(), 1);

            referenceSource.releaseAll();
            alignmentSource.releaseAll();
            Assert.assertEquals(track.getState(), TrackState.READY);
            Assert.assertEquals(RecordingRenderer.pileupRecords(renderer.getLast()).get(0).getAlignmentId(), "early");
        }
    }

    @Test
    public void testSameRangeRetriesFailedFetches() {
        final ControlledReferenceSource referenceSource = new ControlledReferenceSource();
        final ControlledAlignmentSource alignmentSource = createAlignmentSource();
        final RecordingRenderer renderer = new RecordingRenderer();
        try ( final PileupView view = new PileupView(referenceSource, alignmentSource, renderer) ) {
            final PileupTrack track = view.setRange("1:101-200");
            referenceSource.failAll("down");
            alignmentSource.releaseAll();
            Assert.assertEquals(track.getState(), TrackState.HAVE_ALIGNMENTS_ONLY);

            Assert.assertSame(view.setRange("1:101-200"), track);
            Assert.assertEquals(referenceSource.getRequests().size(), 2);
            Assert.assertEquals(referenceSource.getNumPending(), 1);
            Assert.assertEquals(alignmentSource.getRequests().size(), 1, "alignments arrived already");

            referenceSource.releaseAll();
            Assert.assertEquals(track.getState(), TrackState.READY);
            Assert.assertEquals(RecordingRenderer.referenceRecords(renderer.getLast()).size(), 100);
        }
    }

    @Test
    public void testChangingRangeDisposesOldTrack() {
        final ControlledReferenceSource referenceSource = new ControlledReferenceSource();
        final ControlledAlignmentSource alignmentSource = createAlignmentSource();
        final RecordingRenderer renderer = new RecordingRenderer();
        final PileupView view = new PileupView(referenceSource, alignmentSource, renderer);
        final PileupTrack first = view.setRange("1:101-200");
        final PileupTrack second = view.setRange("1:5,001-5,100");

        Assert.assertTrue(first.isDisposed());
        Assert.assertFalse(second.isDisposed());
        Assert.assertNotSame(second.getReferenceCache(), first.getReferenceCache());

        // the fetches made for the first range complete now and must not reach the renderer
        referenceSource.releaseAll();
        alignmentSource.releaseAll();
        Assert.assertEquals(first.getNumEmissions(), 0);
        Assert.assertEquals(second.getNumEmissions(), 2);
        Assert.assertEquals(renderer.getNumEmissions(), 2);
        for ( final RenderRecord.ReferenceRecord record : RecordingRenderer.referenceRecords(renderer.getLast()) ) {
            Assert.assertTrue(second.getVisibleRange().containsPosition("1", record.getPosition()));
        }
        Assert.assertEquals(RecordingRenderer.pileupRecords(renderer.getLast()).get(0).getAlignmentId(), "late");

        view.close();
        Assert.assertTrue(second.isDisposed());
        Assert.assertNull(view.getCurrentTrack());
    }

    @Test
    public void testConfigurationIsApplied() {
        final ControlledReferenceSource referenceSource = new ControlledReferenceSource();
        final ControlledAlignmentSource alignmentSource = createAlignmentSource();
        final PileupConfig config = ConfigFactory.getInstance().create(PileupConfig.class);
        config.setProperty("reference.fetch.block.size", "100");
        config.setProperty("alignment.fetch.lookahead.bases", "25");
        config.setProperty("alignment.fetch.contained.only", "true");

        try ( final PileupView view = new PileupView(referenceSource, alignmentSource, new RecordingRenderer(), config,
                MoreExecutors.directExecutor()) ) {
            final PileupTrack track = view.setRange(new ContigInterval("1", 150, 260));
            Assert.assertEquals(referenceSource.getRequests(), Collections.singletonList(new ContigInterval("1", 100, 300)));
            Assert.assertEquals(alignmentSource.getRequests(), Collections.singletonList(new ContigInterval("1", 150, 285)));
            Assert.assertEquals(alignmentSource.getContainedOnlyFlags(), Collections.singletonList(true));
            Assert.assertTrue(track.getAlignmentCache().isContainedOnly());
        }
    }

    @Test(expectedExceptions = UserException.MalformedInterval.class)
    public void testUnparsableRange() {
        new PileupView(new ControlledReferenceSource(), createAlignmentSource(), new RecordingRenderer()).setRange("1:abc-200");
    }
}
