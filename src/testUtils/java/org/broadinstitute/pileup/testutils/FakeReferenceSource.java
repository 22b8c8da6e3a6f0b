package org.broadinstitute.pileup.testutils;

import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;

import java.nio.charset.StandardCharsets;

public final class FakeReferenceSource {

    private static final String PATTERN = "TAGC";

    private FakeReferenceSource() {}

    /**
     * bases returns some made up bases for an interval. The pattern is
     * TAGCTAGCTAGC...
     * To make the fake bases consistent, the pattern is anchored at position 0 of every contig. For example,
     * the half-open interval [2,8) is
     * GCTAGC
     * @param interval the interval on the fake contig
     * @return the fake bases.
     */
    public static ReferenceBases bases(final ContigInterval interval) {
        final int start = interval.getStart();
        final int chunkStart = start - start % PATTERN.length();
        final int repeats = (interval.getStop() - chunkStart) / PATTERN.length() + 1;
        final String full = StringUtils.repeat(PATTERN, repeats);
        final String substring = full.substring(start - chunkStart, start - chunkStart + interval.size());
        return new ReferenceBases(substring.getBytes(StandardCharsets.US_ASCII), interval);
    }
}
