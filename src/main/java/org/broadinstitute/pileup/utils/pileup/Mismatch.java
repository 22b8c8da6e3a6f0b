package org.broadinstitute.pileup.utils.pileup;

import org.broadinstitute.pileup.utils.Utils;

/**
 * A single read base that disagrees with the reference base at the position it is aligned to.
 */
public final class Mismatch {

    private final String alignmentId;
    private final int position;
    private final byte basePair;
    private final byte referenceBase;

    /**
     * @param alignmentId id of the alignment carrying the base
     * @param position absolute 0-based reference coordinate
     * @param basePair the base from the read
     * @param referenceBase the reference base at {@code position}
     */
    public Mismatch(final String alignmentId, final int position, final byte basePair, final byte referenceBase) {
        this.alignmentId = Utils.nonNull(alignmentId);
        this.position = position;
        this.basePair = basePair;
        this.referenceBase = referenceBase;
    }

    public String getAlignmentId() {
        return alignmentId;
    }

    public int getPosition() {
        return position;
    }

    public byte getBasePair() {
        return basePair;
    }

    public byte getReferenceBase() {
        return referenceBase;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Mismatch that = (Mismatch) o;

        if (position != that.position) return false;
        if (basePair != that.basePair) return false;
        if (referenceBase != that.referenceBase) return false;
        return alignmentId.equals(that.alignmentId);
    }

    @Override
    public int hashCode() {
        int result = alignmentId.hashCode();
        result = 31 * result + position;
        result = 31 * result + basePair;
        result = 31 * result + referenceBase;
        return result;
    }

    @Override
    public String toString() {
        return String.format("%s@%d:%c>%c", alignmentId, position, (char) referenceBase, (char) basePair);
    }
}
