package org.broadinstitute.pileup.utils.pileup;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.read.Alignment;
import org.broadinstitute.pileup.utils.read.AlignmentCoordinateComparator;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Stacks alignments into rows so that no two alignments sharing a row overlap on the reference.
 *
 * Alignments not yet placed are visited in (start, id) order and each one goes to the lowest row with room for it,
 * opening a new row when none has. On a fresh engine this is the earliest-fit greedy coloring of the interval graph,
 * which uses the minimal number of rows. Later calls to {@link #assign} only place the alignments they have not
 * seen before: an alignment keeps its row until {@link #reset()} is called.
 *
 * Spans are half-open, so an alignment ending at position p and one starting at p may share a row. An alignment
 * with an empty reference span (for instance an all-insertion CIGAR) occupies the single position at its start.
 *
 * Not thread-safe.
 */
public final class PileupLayoutEngine {
    private static final Logger logger = LogManager.getLogger(PileupLayoutEngine.class);

    public static final int NO_ROW = -1;

    private final TreeMap<String, Integer> rowsById = new TreeMap<>();

    // per row: occupied span start -> span end, spans within a row never overlap
    private final List<TreeMap<Integer, Integer>> occupancy = new ArrayList<>();

    private String contig = null;

    /**
     * Place every alignment in {@code alignments} that does not have a row yet.
     *
     * @param alignments mapped alignments, all on the same contig as those already placed
     * @return the number of alignments newly placed
     */
    public int assign(final Collection<Alignment> alignments) {
        Utils.containsNoNull(alignments, "alignments must not contain null");

        final List<Alignment> unplaced = alignments.stream()
                .filter(a -> !rowsById.containsKey(a.getId()))
                .sorted(AlignmentCoordinateComparator.INSTANCE)
                .collect(Collectors.toList());

        int placed = 0;
        for ( final Alignment alignment : unplaced ) {
            Utils.validateArg(alignment.isMapped(), () -> "cannot lay out unmapped alignment " + alignment.getId());
            if ( contig == null ) {
                contig = alignment.getContig();
            }
            Utils.validateArg(contig.equals(alignment.getContig()),
                    () -> "alignment " + alignment.getId() + " is on " + alignment.getContig() + " but the layout holds " + contig);
            if ( rowsById.containsKey(alignment.getId()) ) {
                // same id twice in one batch
                continue;
            }
            rowsById.put(alignment.getId(), place(alignment));
            placed++;
        }

        if ( placed > 0 ) {
            logger.debug("Placed {} alignments, layout now has {} rows for {} alignments", placed, rowCount(), rowsById.size());
        }
        return placed;
    }

    private int place(final Alignment alignment) {
        final int start = alignment.getStart();
        final int end = Math.max(alignment.getEnd(), start + 1);

        for ( int row = 0; row < occupancy.size(); row++ ) {
            final TreeMap<Integer, Integer> spans = occupancy.get(row);
            final Map.Entry<Integer, Integer> previous = spans.lowerEntry(end);
            if ( previous == null || previous.getValue() <= start ) {
                spans.put(start, end);
                return row;
            }
        }

        final TreeMap<Integer, Integer> newRow = new TreeMap<>();
        newRow.put(start, end);
        occupancy.add(newRow);
        return occupancy.size() - 1;
    }

    /**
     * @return the row of the alignment with the given id, or {@link #NO_ROW} if it has not been placed
     */
    public int rowOf(final String alignmentId) {
        Utils.nonNull(alignmentId);
        return rowsById.getOrDefault(alignmentId, NO_ROW);
    }

    public boolean isAssigned(final String alignmentId) {
        return rowsById.containsKey(Utils.nonNull(alignmentId));
    }

    public int rowCount() {
        return occupancy.size();
    }

    /**
     * @return an unmodifiable view of the current assignment, ordered by alignment id
     */
    public SortedMap<String, Integer> getAssignments() {
        return Collections.unmodifiableSortedMap(rowsById);
    }

    /**
     * Forget every assignment. The next {@link #assign} call lays out its input from scratch.
     */
    public void reset() {
        rowsById.clear();
        occupancy.clear();
        contig = null;
    }
}
