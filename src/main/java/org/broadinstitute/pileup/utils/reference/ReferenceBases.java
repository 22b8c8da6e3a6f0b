package org.broadinstitute.pileup.utils.reference;

import htsjdk.samtools.util.StringUtil;
import org.apache.commons.lang3.ArrayUtils;
import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;

import java.io.Serializable;
import java.util.Arrays;

/**
 * ReferenceBases stores the bases of the reference genome for a particular half-open interval.
 * This class requires the bases to be encoded at 8 bits per base, one base per position of the interval.
 */
public final class ReferenceBases implements Serializable {
    private static final long serialVersionUID = 1L;

    private final byte[] bases;
    private final ContigInterval interval;

    public ReferenceBases( final byte[] bases, final ContigInterval interval ) {
        Utils.nonNull(bases);
        Utils.nonNull(interval);
        if (interval.size() != bases.length) {
            throw new IllegalArgumentException(
                    "interval must have same length as bases, " + interval + " " + interval.size() + "," + bases.length);
        }
        this.bases = bases;
        this.interval = interval;
    }

    /**
     * Convenience factory for bases given as text starting at the 0-based position {@code start}.
     */
    public static ReferenceBases of(final String contig, final int start, final String bases) {
        Utils.nonNull(bases);
        return new ReferenceBases(StringUtil.stringToBytes(bases), new ContigInterval(contig, start, start + bases.length()));
    }

    @Override
    public String toString() {
        return "ReferenceBases{" +
                "bases=" + StringUtil.bytesToString(bases) +
                ", interval=" + interval +
                '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        ReferenceBases that = (ReferenceBases) o;

        if (!Arrays.equals(getBases(), that.getBases())) return false;
        return getInterval().equals(that.getInterval());
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(getBases());
        result = 31 * result + getInterval().hashCode();
        return result;
    }

    /**
     * Returns the bases.
     * @return never {@code null}, this is a direct reference to this object bases, so the caller must refrain from modifying them
     *  as it will alter the state of this object.
     */
    public byte[] getBases() {
        return bases;
    }

    public ContigInterval getInterval() {
        return interval;
    }

    /**
     * @param position absolute 0-based position, which must lie inside this object's interval
     * @return the base at {@code position}
     */
    public byte getBase(final int position) {
        Utils.validateArg(interval.containsPosition(interval.getContig(), position),
                () -> "position " + position + " is outside of " + interval);
        return bases[position - interval.getStart()];
    }

    /**
     * getSubset returns only the bases of the interval passed in.
     * @param subsetInterval, the subset to be returned
     * @return the subset of ReferenceBases
     */
    public ReferenceBases getSubset(final ContigInterval subsetInterval) {
        if (!this.interval.contains(subsetInterval)) {
            throw new PileupException("Reference doesn't match input interval (asked for " + subsetInterval + " but we have " + this.interval + ")");
        }
        if (subsetInterval.equals(interval)) {
            return this;
        }
        final int start = subsetInterval.getStart() - this.interval.getStart();
        final int stop = subsetInterval.getStop() - this.interval.getStart();
        return new ReferenceBases(ArrayUtils.subarray(this.bases, start, stop), subsetInterval);
    }
}
