package org.broadinstitute.pileup.utils.pileup;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;

import java.util.List;

/**
 * Result of comparing one alignment against the reference bases delivered so far.
 *
 * {@link #getUncoveredRanges()} lists the aligned reference positions for which no reference base was available;
 * no mismatch is ever reported inside them. The result is complete once that list is empty.
 */
public final class AlignmentMismatches {

    private final String alignmentId;
    private final List<Mismatch> mismatches;
    private final List<ContigInterval> uncoveredRanges;

    public AlignmentMismatches(final String alignmentId, final List<Mismatch> mismatches, final List<ContigInterval> uncoveredRanges) {
        this.alignmentId = Utils.nonNull(alignmentId);
        this.mismatches = ImmutableList.copyOf(mismatches);
        this.uncoveredRanges = ImmutableList.copyOf(uncoveredRanges);
    }

    public String getAlignmentId() {
        return alignmentId;
    }

    /**
     * @return mismatches in ascending reference position
     */
    public List<Mismatch> getMismatches() {
        return mismatches;
    }

    public List<ContigInterval> getUncoveredRanges() {
        return uncoveredRanges;
    }

    public boolean isComplete() {
        return uncoveredRanges.isEmpty();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final AlignmentMismatches that = (AlignmentMismatches) o;

        if (!alignmentId.equals(that.alignmentId)) return false;
        if (!mismatches.equals(that.mismatches)) return false;
        return uncoveredRanges.equals(that.uncoveredRanges);
    }

    @Override
    public int hashCode() {
        int result = alignmentId.hashCode();
        result = 31 * result + mismatches.hashCode();
        result = 31 * result + uncoveredRanges.hashCode();
        return result;
    }

    @Override
    public String toString() {
        return "AlignmentMismatches{" + alignmentId + ", mismatches=" + mismatches + ", uncovered=" + uncoveredRanges + '}';
    }
}
