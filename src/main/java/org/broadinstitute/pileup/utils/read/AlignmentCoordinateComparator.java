package org.broadinstitute.pileup.utils.read;

import java.io.Serializable;
import java.util.Comparator;

/**
 * Comparator for sorting alignments by coordinate: contig name, then start, then id.
 *
 * The id tie-break makes the order total, so any algorithm that walks alignments in this order is deterministic
 * regardless of the order in which the alignments were delivered. Unmapped alignments sort after mapped ones.
 */
public final class AlignmentCoordinateComparator implements Comparator<Alignment>, Serializable {
    private static final long serialVersionUID = 1L;

    public static final AlignmentCoordinateComparator INSTANCE = new AlignmentCoordinateComparator();

    @Override
    public int compare( final Alignment first, final Alignment second ) {
        if ( first.isMapped() != second.isMapped() ) {
            return first.isMapped() ? -1 : 1;
        }
        if ( first.isMapped() ) {
            int result = first.getContig().compareTo(second.getContig());
            if ( result != 0 ) {
                return result;
            }
            result = Integer.compare(first.getStart(), second.getStart());
            if ( result != 0 ) {
                return result;
            }
        }
        return first.getId().compareTo(second.getId());
    }
}
