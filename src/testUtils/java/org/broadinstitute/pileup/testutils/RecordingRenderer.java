package org.broadinstitute.pileup.testutils;

import org.broadinstitute.pileup.engine.PileupRenderer;
import org.broadinstitute.pileup.engine.RenderRecord;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.pileup.Mismatch;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A {@link PileupRenderer} that keeps every emission for later inspection.
 */
public final class RecordingRenderer implements PileupRenderer {

    private final List<List<RenderRecord>> emissions = new ArrayList<>();

    @Override
    public void render(final ContigInterval visibleRange, final List<RenderRecord> records) {
        emissions.add(records);
    }

    public int getNumEmissions() {
        return emissions.size();
    }

    public List<List<RenderRecord>> getEmissions() {
        return Collections.unmodifiableList(emissions);
    }

    /**
     * @return the records of the latest emission, empty if there was none
     */
    public List<RenderRecord> getLast() {
        return emissions.isEmpty() ? Collections.emptyList() : emissions.get(emissions.size() - 1);
    }

    public static List<RenderRecord.ReferenceRecord> referenceRecords(final List<RenderRecord> records) {
        return records.stream()
                .filter(r -> r.getKind() == RenderRecord.Kind.REFERENCE)
                .map(r -> (RenderRecord.ReferenceRecord) r)
                .collect(Collectors.toList());
    }

    public static List<RenderRecord.PileupRecord> pileupRecords(final List<RenderRecord> records) {
        return records.stream()
                .filter(r -> r.getKind() == RenderRecord.Kind.PILEUP)
                .map(r -> (RenderRecord.PileupRecord) r)
                .collect(Collectors.toList());
    }

    public static List<Mismatch> mismatches(final List<RenderRecord> records) {
        return pileupRecords(records).stream()
                .flatMap(r -> r.getMismatches().stream())
                .collect(Collectors.toList());
    }
}
