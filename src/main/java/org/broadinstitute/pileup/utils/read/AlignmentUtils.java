package org.broadinstitute.pileup.utils.read;

import htsjdk.samtools.Cigar;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMValidationError;
import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.utils.Utils;

import java.util.List;
import java.util.stream.Collectors;

public final class AlignmentUtils {

    /**
     * Separator between a read name and the pair suffix in alignment ids.
     */
    public static final char PAIR_SEPARATOR = '/';

    /**
     * Separator between the base id and the locus suffix of secondary/supplementary alignments.
     */
    public static final char LOCUS_SEPARATOR = '@';

    private AlignmentUtils() {}

    /**
     * Check that an alignment is usable for layout and mismatch computation.
     *
     * A mapped alignment must have a non-negative start, a non-empty structurally valid CIGAR, and exactly as many
     * read bases as its CIGAR consumes on the read axis. Unmapped alignments are never drawn and are only checked
     * for a non-negative start.
     *
     * @param alignment the record to check
     * @throws PileupException.MalformedRecord describing the first problem found
     */
    public static void validate(final Alignment alignment) {
        Utils.nonNull(alignment);
        final String id = alignment.getId();

        if ( alignment.getStart() < 0 ) {
            throw new PileupException.MalformedRecord(id, "negative alignment start " + alignment.getStart());
        }
        if ( !alignment.isMapped() ) {
            return;
        }

        final Cigar cigar = alignment.getCigar();
        if ( cigar.isEmpty() ) {
            throw new PileupException.MalformedRecord(id, "mapped alignment without CIGAR operations");
        }

        final List<SAMValidationError> cigarErrors = cigar.isValid(id, -1);
        if ( cigarErrors != null && !cigarErrors.isEmpty() ) {
            throw new PileupException.MalformedRecord(id, cigarErrors.stream()
                    .map(SAMValidationError::getMessage)
                    .collect(Collectors.joining("; ")));
        }

        if ( cigar.getReadLength() != alignment.getLength() ) {
            throw new PileupException.MalformedRecord(id, String.format(
                    "CIGAR %s consumes %d read bases but the record carries %d", cigar, cigar.getReadLength(), alignment.getLength()));
        }
    }

    /**
     * @return true if {@link #validate(Alignment)} accepts the alignment
     */
    public static boolean isValid(final Alignment alignment) {
        try {
            validate(alignment);
            return true;
        } catch (final PileupException.MalformedRecord e) {
            return false;
        }
    }

    /**
     * Builds the stable identity of a SAM record.
     *
     * The read name alone is shared by both mates of a pair and by secondary/supplementary alignments, so the id is
     * suffixed with {@code /1} or {@code /2} for paired reads, and with {@code @contig:start} for non-primary records.
     */
    public static String alignmentIdFor(final SAMRecord record) {
        Utils.nonNull(record);
        final StringBuilder id = new StringBuilder(record.getReadName());
        if ( record.getReadPairedFlag() ) {
            id.append(PAIR_SEPARATOR).append(record.getFirstOfPairFlag() ? '1' : '2');
        }
        if ( record.isSecondaryOrSupplementary() ) {
            id.append(LOCUS_SEPARATOR).append(record.getReferenceName()).append(':').append(record.getAlignmentStart());
        }
        return id.toString();
    }

    /**
     * Convert an htsjdk record into an {@link Alignment}. No validation is performed.
     */
    public static Alignment fromSAMRecord(final SAMRecord record) {
        Utils.nonNull(record);
        final boolean mapped = !record.getReadUnmappedFlag();
        final String contig = SAMRecord.NO_ALIGNMENT_REFERENCE_NAME.equals(record.getReferenceName()) ? null : record.getReferenceName();
        // SAM starts are 1-based, and unplaced records report 0
        final int start = Math.max(record.getAlignmentStart() - 1, 0);
        return new Alignment(alignmentIdFor(record), mapped ? contig : null, start, record.getCigar(), record.getReadBases(), mapped && contig != null);
    }
}
