package org.broadinstitute.pileup.engine;

/**
 * Which of the two data feeds of a {@link PileupTrack} have delivered anything for its visible range.
 *
 * {@link #READY} is not terminal: it is re-entered on every further arrival.
 */
public enum TrackState {
    WAITING_BOTH,
    HAVE_REFERENCE_ONLY,
    HAVE_ALIGNMENTS_ONLY,
    READY;

    public static TrackState fromAvailability(final boolean haveReference, final boolean haveAlignments) {
        if ( haveReference && haveAlignments ) {
            return READY;
        }
        if ( haveReference ) {
            return HAVE_REFERENCE_ONLY;
        }
        return haveAlignments ? HAVE_ALIGNMENTS_ONLY : WAITING_BOTH;
    }

    public boolean hasReference() {
        return this == HAVE_REFERENCE_ONLY || this == READY;
    }
}
