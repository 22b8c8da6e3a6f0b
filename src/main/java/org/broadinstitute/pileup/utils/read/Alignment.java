package org.broadinstitute.pileup.utils.read;

import htsjdk.samtools.Cigar;
import htsjdk.samtools.TextCigarCodec;
import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;

import java.io.Serializable;
import java.util.Arrays;

/**
 * An aligned sequencing read as delivered by an alignment source.
 *
 * Positions are 0-based. The reference span is {@code [getStart(), getEnd())}, where the end is derived from the
 * reference-consuming operators of the CIGAR. Instances are immutable; consistency between the CIGAR and the read
 * bases is not enforced here (see {@link AlignmentUtils#validate(Alignment)}) so that sources can hand over
 * malformed records and have them rejected individually.
 */
public final class Alignment implements Serializable {
    private static final long serialVersionUID = 1L;

    private final String id;
    private final String contig;
    private final int start;
    private final Cigar cigar;
    private final byte[] bases;
    private final boolean mapped;

    /**
     * @param id unique identifier, stable across repeated fetches of the same record
     * @param contig contig the read is aligned to, may be null only for unmapped reads
     * @param start 0-based alignment start on the reference
     * @param cigar alignment operations
     * @param bases read bases, one byte per read-consuming CIGAR position
     * @param mapped whether the read is aligned at all
     */
    public Alignment(final String id, final String contig, final int start, final Cigar cigar, final byte[] bases, final boolean mapped) {
        this.id = Utils.nonEmpty(id, "alignment id");
        Utils.validateArg(!mapped || contig != null, () -> "mapped alignment " + id + " must have a contig");
        this.contig = contig;
        this.start = start;
        this.cigar = Utils.nonNull(cigar, "cigar");
        this.bases = Utils.nonNull(bases, "bases").clone();
        this.mapped = mapped;
    }

    /**
     * Convenience constructor for a mapped alignment described with a CIGAR string and text bases.
     */
    public Alignment(final String id, final String contig, final int start, final String cigarString, final String bases) {
        this(id, contig, start, TextCigarCodec.decode(cigarString), StringUtil.stringToBytes(bases), true);
    }

    public String getId() {
        return id;
    }

    public String getContig() {
        return contig;
    }

    /**
     * @return 0-based start of the reference span
     */
    public int getStart() {
        return start;
    }

    /**
     * @return 0-based exclusive end of the reference span
     */
    public int getEnd() {
        return start + cigar.getReferenceLength();
    }

    /**
     * @return the reference span of this alignment; empty when the CIGAR consumes no reference bases
     */
    public ContigInterval getSpan() {
        Utils.validate(mapped, () -> "unmapped alignment " + id + " has no reference span");
        return new ContigInterval(contig, start, getEnd());
    }

    public Cigar getCigar() {
        return cigar;
    }

    /**
     * @return a copy of the read bases
     */
    public byte[] getBases() {
        return bases.clone();
    }

    /**
     * @param readOffset 0-based offset along the read axis
     * @return the read base at {@code readOffset}
     */
    public byte getBase(final int readOffset) {
        return bases[readOffset];
    }

    /**
     * @return number of read bases carried by this record
     */
    public int getLength() {
        return bases.length;
    }

    public boolean isMapped() {
        return mapped;
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final Alignment that = (Alignment) o;

        if (start != that.start) return false;
        if (mapped != that.mapped) return false;
        if (!id.equals(that.id)) return false;
        if (contig != null ? !contig.equals(that.contig) : that.contig != null) return false;
        if (!cigar.equals(that.cigar)) return false;
        return Arrays.equals(bases, that.bases);
    }

    @Override
    public int hashCode() {
        int result = id.hashCode();
        result = 31 * result + (contig != null ? contig.hashCode() : 0);
        result = 31 * result + start;
        result = 31 * result + cigar.hashCode();
        result = 31 * result + Arrays.hashCode(bases);
        result = 31 * result + (mapped ? 1 : 0);
        return result;
    }

    @Override
    public String toString() {
        if (!mapped) {
            return id + " (unmapped)";
        }
        return String.format("%s %s:%d %s", id, contig, start + 1, cigar);
    }
}
