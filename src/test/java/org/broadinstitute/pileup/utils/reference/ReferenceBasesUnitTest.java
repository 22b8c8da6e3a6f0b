package org.broadinstitute.pileup.utils.reference;

import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.testutils.BaseTest;
import org.broadinstitute.pileup.testutils.FakeReferenceSource;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.testng.Assert;
import org.testng.annotations.Test;

public final class ReferenceBasesUnitTest extends BaseTest {

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testLengthMustMatchInterval() {
        new ReferenceBases(new byte[]{'A', 'C'}, new ContigInterval("1", 0, 3));
    }

    @Test
    public void testGetBase() {
        final ReferenceBases bases = ReferenceBases.of("1", 100, "ACGTN");
        Assert.assertEquals(bases.getInterval(), new ContigInterval("1", 100, 105));
        Assert.assertEquals(bases.getBase(100), (byte) 'A');
        Assert.assertEquals(bases.getBase(104), (byte) 'N');
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testGetBaseOutsideInterval() {
        ReferenceBases.of("1", 100, "ACGTN").getBase(105);
    }

    @Test
    public void testGetSubset() {
        final ReferenceBases bases = ReferenceBases.of("1", 100, "ACGTNACGTN");
        final ReferenceBases subset = bases.getSubset(new ContigInterval("1", 102, 106));
        Assert.assertEquals(new String(subset.getBases()), "GTNA");
        Assert.assertEquals(subset.getInterval(), new ContigInterval("1", 102, 106));
        Assert.assertSame(bases.getSubset(bases.getInterval()), bases);
    }

    @Test(expectedExceptions = PileupException.class)
    public void testGetSubsetOutsideInterval() {
        ReferenceBases.of("1", 100, "ACGT").getSubset(new ContigInterval("1", 98, 102));
    }

    @Test
    public void testFakeBasesAreConsistentAcrossIntervals() {
        final ReferenceBases wide = FakeReferenceSource.bases(new ContigInterval("1", 0, 20));
        final ReferenceBases narrow = FakeReferenceSource.bases(new ContigInterval("1", 2, 8));
        Assert.assertEquals(new String(narrow.getBases()), "GCTAGC");
        Assert.assertEquals(wide.getSubset(narrow.getInterval()), narrow);
    }
}
