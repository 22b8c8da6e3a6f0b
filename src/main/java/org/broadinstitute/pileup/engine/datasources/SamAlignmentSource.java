package org.broadinstitute.pileup.engine.datasources;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.SAMRecord;
import htsjdk.samtools.SAMRecordIterator;
import htsjdk.samtools.SamReader;
import htsjdk.samtools.SamReaderFactory;
import htsjdk.samtools.ValidationStringency;
import htsjdk.samtools.util.RuntimeIOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.exceptions.UserException;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.read.Alignment;
import org.broadinstitute.pileup.utils.read.AlignmentUtils;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * An {@link AlignmentSource} reading a SAM, BAM or CRAM file through htsjdk.
 *
 * Indexed files are queried by interval; files without an index are scanned from the start and filtered, which is
 * only practical for small inputs. Queries run one at a time on a private background thread.
 *
 * Records are converted with {@link AlignmentUtils#fromSAMRecord} and are not validated here: the consuming cache
 * rejects malformed ones individually.
 */
public final class SamAlignmentSource implements AlignmentSource, Closeable {
    private static final Logger logger = LogManager.getLogger(SamAlignmentSource.class);

    private final Path samPath;
    private final SamReader reader;
    private final ExecutorService executorService;

    /**
     * @param samPath alignment file
     * @throws UserException.CouldNotReadInputFile if the file cannot be opened
     */
    public SamAlignmentSource(final Path samPath) {
        this.samPath = Utils.nonNull(samPath);
        if ( !Files.isReadable(samPath) ) {
            throw new UserException.CouldNotReadInputFile(samPath, "file does not exist or is not readable");
        }
        try {
            this.reader = SamReaderFactory.makeDefault()
                    .validationStringency(ValidationStringency.SILENT)
                    .open(samPath);
        } catch ( final RuntimeIOException e ) {
            throw new UserException.CouldNotReadInputFile(samPath, e);
        } catch ( final SAMException e ) {
            throw new UserException.CouldNotReadInputFile(samPath, e);
        }
        if ( !reader.hasIndex() ) {
            logger.info("No index found for {}, every query will scan the whole file", samPath);
        }
        this.executorService = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("sam-alignment-thread-%d")
                .setDaemon(true)
                .build());
    }

    public boolean hasIndex() {
        return reader.hasIndex();
    }

    @Override
    public CompletableFuture<List<Alignment>> fetch(final ContigInterval interval, final boolean containedOnly) {
        Utils.nonNull(interval);
        try {
            return CompletableFuture.supplyAsync(() -> query(interval, containedOnly), executorService);
        } catch ( final RejectedExecutionException e ) {
            final CompletableFuture<List<Alignment>> failed = new CompletableFuture<>();
            failed.completeExceptionally(new PileupException.FetchError(interval, "alignment source is closed", e));
            return failed;
        }
    }

    private List<Alignment> query(final ContigInterval interval, final boolean containedOnly) {
        if ( interval.isEmpty() ) {
            return Collections.emptyList();
        }
        if ( reader.getFileHeader().getSequence(interval.getContig()) == null ) {
            throw new PileupException.FetchError(interval, "contig " + interval.getContig() + " is not in the header of " + samPath);
        }

        final List<Alignment> alignments = new ArrayList<>();
        // an indexed query takes 1-based closed coordinates
        try ( final SAMRecordIterator records = reader.hasIndex()
                ? reader.query(interval.getContig(), interval.getStart() + 1, interval.getStop(), containedOnly)
                : reader.iterator() ) {
            while ( records.hasNext() ) {
                final SAMRecord record = records.next();
                final Alignment alignment = AlignmentUtils.fromSAMRecord(record);
                if ( matches(alignment, interval, containedOnly) ) {
                    alignments.add(alignment);
                }
            }
        } catch ( final RuntimeIOException e ) {
            throw new PileupException.FetchError(interval, "could not read " + samPath, e);
        } catch ( final SAMException e ) {
            throw new PileupException.FetchError(interval, "could not read " + samPath, e);
        }
        logger.debug("Query of {} for {} returned {} alignments", samPath, interval, alignments.size());
        return alignments;
    }

    private static boolean matches(final Alignment alignment, final ContigInterval interval, final boolean containedOnly) {
        if ( !alignment.isMapped() || !alignment.getContig().equals(interval.getContig()) ) {
            return false;
        }
        final int start = alignment.getStart();
        final int end = alignment.getEnd();
        if ( containedOnly ) {
            return start >= interval.getStart() && end <= interval.getStop();
        }
        return start < interval.getStop() && Math.max(end, start + 1) > interval.getStart();
    }

    /**
     * Permanently close this data source. Pending fetches are abandoned.
     */
    @Override
    public void close() {
        executorService.shutdownNow();
        try {
            reader.close();
        } catch ( final IOException e ) {
            throw new PileupException("Error closing alignment file " + samPath, e);
        }
    }
}
