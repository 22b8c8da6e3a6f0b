package org.broadinstitute.pileup.testutils;

import htsjdk.samtools.SAMFileHeader;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMSequenceDictionary;
import htsjdk.samtools.SAMSequenceRecord;
import htsjdk.samtools.TextCigarCodec;
import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.pileup.utils.read.Alignment;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;

import java.util.Arrays;

public final class ArtificialAlignmentUtils {

    private ArtificialAlignmentUtils() {}

    /**
     * Creates an artificial sam header with one sequence record per contig name, each of the given size
     */
    public static SAMFileHeader createArtificialSamHeader(final int contigSize, final String... contigs) {
        final SAMFileHeader header = new SAMFileHeader();
        header.setSortOrder(SAMFileHeader.SortOrder.coordinate);
        final SAMSequenceDictionary dict = new SAMSequenceDictionary();
        for ( final String contig : contigs ) {
            dict.addSequence(new SAMSequenceRecord(contig, contigSize));
        }
        header.setSequenceDictionary(dict);
        return header;
    }

    /**
     * Create an artificial SAMRecord. {@code alignmentStart} is 1-based, as in SAM.
     */
    public static SAMRecord createArtificialSAMRecord(final SAMFileHeader header, final String name, final String contig,
                                                      final int alignmentStart, final String bases, final String cigar) {
        final SAMRecord record = new SAMRecord(header);
        record.setReadName(name);
        record.setReferenceName(contig);
        record.setAlignmentStart(alignmentStart);
        record.setCigarString(cigar);
        record.setReadBases(StringUtil.stringToBytes(bases));
        final byte[] quals = new byte[bases.length()];
        Arrays.fill(quals, (byte) 30);
        record.setBaseQualities(quals);
        return record;
    }

    /**
     * Create a mapped alignment. {@code start} is 0-based.
     */
    public static Alignment createAlignment(final String id, final String contig, final int start, final String cigar, final String bases) {
        return new Alignment(id, contig, start, cigar, bases);
    }

    /**
     * Create a {@code length}M alignment whose bases match {@code reference} exactly.
     */
    public static Alignment createMatchingAlignment(final String id, final ReferenceBases reference, final int start, final int length) {
        final byte[] bases = Arrays.copyOfRange(reference.getBases(),
                start - reference.getInterval().getStart(), start - reference.getInterval().getStart() + length);
        return new Alignment(id, reference.getInterval().getContig(), start, TextCigarCodec.decode(length + "M"), bases, true);
    }

    /**
     * Create a {@code length}M alignment matching {@code reference} except for the given substitutions.
     *
     * @param substitutions pairs of (absolute position, base) to put into the read
     */
    public static Alignment createAlignmentWithSubstitutions(final String id, final ReferenceBases reference, final int start,
                                                             final int length, final Object... substitutions) {
        final byte[] bases = createMatchingAlignment(id, reference, start, length).getBases();
        for ( int i = 0; i < substitutions.length; i += 2 ) {
            final int position = (Integer) substitutions[i];
            final char base = (Character) substitutions[i + 1];
            bases[position - start] = (byte) base;
        }
        return new Alignment(id, reference.getInterval().getContig(), start, TextCigarCodec.decode(length + "M"), bases, true);
    }

    /**
     * Create an unmapped alignment.
     */
    public static Alignment createUnmappedAlignment(final String id, final String bases) {
        return new Alignment(id, null, 0, TextCigarCodec.decode("*"), StringUtil.stringToBytes(bases), false);
    }
}
