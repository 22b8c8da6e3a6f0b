package org.broadinstitute.pileup.utils.pileup;

import htsjdk.samtools.CigarElement;
import htsjdk.samtools.CigarOperator;
import org.broadinstitute.pileup.utils.BaseUtils;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.read.Alignment;
import org.broadinstitute.pileup.utils.read.AlignmentUtils;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Finds the read bases of an alignment that disagree with the reference.
 *
 * The CIGAR is walked with a read cursor and a reference cursor:
 * <ul>
 *     <li>M, = and X consume both axes, and every position is compared;</li>
 *     <li>I and S consume the read only;</li>
 *     <li>D and N consume the reference only;</li>
 *     <li>H and P consume neither.</li>
 * </ul>
 * Indels are never reported as mismatches, and neither is a position where the read or the reference base is unknown.
 * Reference bases may be supplied as several disjoint segments; aligned positions not covered by any segment are
 * reported as uncovered instead of being compared.
 */
public final class MismatchDetector {

    private static final int NO_BASE = -1;

    private MismatchDetector() {}

    /**
     * @see #detect(Alignment, List)
     */
    public static AlignmentMismatches detect(final Alignment alignment, final ReferenceBases reference) {
        return detect(alignment, Collections.singletonList(Utils.nonNull(reference)));
    }

    /**
     * Compare an alignment against the reference bases available for its contig.
     *
     * @param alignment a mapped, well-formed alignment
     * @param referenceSegments reference bases in ascending, non-overlapping order; segments on other contigs are ignored
     * @return mismatches in ascending position plus the aligned ranges that could not be compared
     * @throws org.broadinstitute.pileup.exceptions.PileupException.MalformedRecord if the alignment is inconsistent
     */
    public static AlignmentMismatches detect(final Alignment alignment, final List<ReferenceBases> referenceSegments) {
        Utils.nonNull(alignment);
        Utils.containsNoNull(referenceSegments, "reference segments must be non-null");
        Utils.validateArg(alignment.isMapped(), () -> "cannot compute mismatches for unmapped alignment " + alignment.getId());
        AlignmentUtils.validate(alignment);

        final SegmentCursor reference = new SegmentCursor(alignment.getContig(), referenceSegments);
        final List<Mismatch> mismatches = new ArrayList<>();
        final UncoveredRangeBuilder uncovered = new UncoveredRangeBuilder(alignment.getContig());

        int readIdx = 0;
        int refPos = alignment.getStart();
        for ( final CigarElement ce : alignment.getCigar().getCigarElements() ) {
            final CigarOperator operator = ce.getOperator();
            final int elementLength = ce.getLength();

            if ( operator.consumesReadBases() && operator.consumesReferenceBases() ) {
                for ( int j = 0; j < elementLength; j++, readIdx++, refPos++ ) {
                    final int refBase = reference.baseAt(refPos);
                    if ( refBase == NO_BASE ) {
                        uncovered.add(refPos);
                        continue;
                    }
                    final byte readBase = alignment.getBase(readIdx);
                    if ( BaseUtils.isMismatch(readBase, (byte) refBase) ) {
                        mismatches.add(new Mismatch(alignment.getId(), refPos, readBase, (byte) refBase));
                    }
                }
            } else if ( operator.consumesReadBases() ) {
                readIdx += elementLength;
            } else if ( operator.consumesReferenceBases() ) {
                refPos += elementLength;
            }
        }

        return new AlignmentMismatches(alignment.getId(), mismatches, uncovered.build());
    }

    /**
     * Looks up reference bases for monotonically increasing positions.
     */
    private static final class SegmentCursor {
        private final List<ReferenceBases> segments = new ArrayList<>();
        private int index = 0;

        SegmentCursor(final String contig, final List<ReferenceBases> referenceSegments) {
            int previousStop = -1;
            for ( final ReferenceBases segment : referenceSegments ) {
                final ContigInterval interval = segment.getInterval();
                if ( !interval.getContig().equals(contig) || interval.isEmpty() ) {
                    continue;
                }
                Utils.validateArg(interval.getStart() >= previousStop,
                        () -> "reference segments must be sorted and non-overlapping, found " + interval);
                previousStop = interval.getStop();
                segments.add(segment);
            }
        }

        int baseAt(final int position) {
            while ( index < segments.size() && segments.get(index).getInterval().getStop() <= position ) {
                index++;
            }
            if ( index == segments.size() || segments.get(index).getInterval().getStart() > position ) {
                return NO_BASE;
            }
            return segments.get(index).getBase(position) & 0xFF;
        }
    }

    /**
     * Collapses consecutive uncovered positions into intervals.
     */
    private static final class UncoveredRangeBuilder {
        private final String contig;
        private final List<ContigInterval> ranges = new ArrayList<>();
        private int rangeStart = NO_BASE;
        private int rangeStop = NO_BASE;

        UncoveredRangeBuilder(final String contig) {
            this.contig = contig;
        }

        void add(final int position) {
            if ( rangeStart != NO_BASE && position == rangeStop ) {
                rangeStop++;
                return;
            }
            flush();
            rangeStart = position;
            rangeStop = position + 1;
        }

        private void flush() {
            if ( rangeStart != NO_BASE ) {
                ranges.add(new ContigInterval(contig, rangeStart, rangeStop));
            }
        }

        List<ContigInterval> build() {
            flush();
            rangeStart = NO_BASE;
            return ranges;
        }
    }
}
