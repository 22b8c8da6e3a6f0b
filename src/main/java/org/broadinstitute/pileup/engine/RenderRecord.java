package org.broadinstitute.pileup.engine;

import com.google.common.collect.ImmutableList;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.pileup.Mismatch;

import java.util.List;

/**
 * One drawable item emitted by a {@link PileupTrack}: either a reference base or a stacked alignment.
 */
public abstract class RenderRecord {

    public enum Kind {
        REFERENCE,
        PILEUP
    }

    private RenderRecord() {}

    public abstract Kind getKind();

    /**
     * A delivered reference base.
     */
    public static final class ReferenceRecord extends RenderRecord {
        private final int position;
        private final byte basePair;

        public ReferenceRecord(final int position, final byte basePair) {
            Utils.validateArg(position >= 0, "position must be non-negative");
            this.position = position;
            this.basePair = basePair;
        }

        @Override
        public Kind getKind() {
            return Kind.REFERENCE;
        }

        public int getPosition() {
            return position;
        }

        public byte getBasePair() {
            return basePair;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;
            final ReferenceRecord that = (ReferenceRecord) o;
            return position == that.position && basePair == that.basePair;
        }

        @Override
        public int hashCode() {
            return 31 * position + basePair;
        }

        @Override
        public String toString() {
            return "reference{" + position + ':' + (char) basePair + '}';
        }
    }

    /**
     * An alignment placed on a row, with the mismatches found so far.
     */
    public static final class PileupRecord extends RenderRecord {
        private final String alignmentId;
        private final int row;
        private final ContigInterval span;
        private final List<Mismatch> mismatches;

        public PileupRecord(final String alignmentId, final int row, final ContigInterval span, final List<Mismatch> mismatches) {
            Utils.validateArg(row >= 0, () -> "row must be non-negative for " + alignmentId);
            this.alignmentId = Utils.nonNull(alignmentId);
            this.row = row;
            this.span = Utils.nonNull(span);
            this.mismatches = ImmutableList.copyOf(mismatches);
        }

        @Override
        public Kind getKind() {
            return Kind.PILEUP;
        }

        public String getAlignmentId() {
            return alignmentId;
        }

        public int getRow() {
            return row;
        }

        public ContigInterval getSpan() {
            return span;
        }

        public List<Mismatch> getMismatches() {
            return mismatches;
        }

        @Override
        public boolean equals(final Object o) {
            if (this == o) return true;
            if (o == null || getClass() != o.getClass()) return false;

            final PileupRecord that = (PileupRecord) o;

            if (row != that.row) return false;
            if (!alignmentId.equals(that.alignmentId)) return false;
            if (!span.equals(that.span)) return false;
            return mismatches.equals(that.mismatches);
        }

        @Override
        public int hashCode() {
            int result = alignmentId.hashCode();
            result = 31 * result + row;
            result = 31 * result + span.hashCode();
            result = 31 * result + mismatches.hashCode();
            return result;
        }

        @Override
        public String toString() {
            return "pileup{" + alignmentId + ", row=" + row + ", span=" + span + ", mismatches=" + mismatches.size() + '}';
        }
    }
}
