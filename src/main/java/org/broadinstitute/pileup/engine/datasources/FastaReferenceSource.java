package org.broadinstitute.pileup.engine.datasources;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import htsjdk.samtools.SAMException;
import htsjdk.samtools.reference.FastaSequenceIndex;
import htsjdk.samtools.reference.FastaSequenceIndexEntry;
import htsjdk.samtools.reference.IndexedFastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import htsjdk.samtools.util.RuntimeIOException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pileup.exceptions.PileupException;
import org.broadinstitute.pileup.exceptions.UserException;
import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;
import org.broadinstitute.pileup.utils.reference.ReferenceBases;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * A {@link ReferenceSource} reading an indexed fasta file.
 *
 * The fasta must have a companion .fai index. Queries run one at a time on a private background thread, since the
 * underlying htsjdk reader is not thread-safe. An interval running past the end of its contig is clipped, so the
 * returned bases may span less than was asked for.
 */
public final class FastaReferenceSource implements ReferenceSource, Closeable {
    private static final Logger logger = LogManager.getLogger(FastaReferenceSource.class);

    private final Path fastaPath;
    private final IndexedFastaSequenceFile reference;
    private final FastaSequenceIndex index;
    private final ExecutorService executorService;

    /**
     * @param fastaPath reference fasta file, with a companion .fai
     * @throws UserException.CouldNotReadInputFile if the fasta cannot be read
     * @throws UserException.MissingIndex if the .fai is missing
     */
    public FastaReferenceSource(final Path fastaPath) {
        this.fastaPath = Utils.nonNull(fastaPath);
        if ( !Files.isReadable(fastaPath) ) {
            throw new UserException.CouldNotReadInputFile(fastaPath, "file does not exist or is not readable");
        }
        final Path indexPath = fastaPath.resolveSibling(fastaPath.getFileName() + ".fai");
        if ( !Files.exists(indexPath) ) {
            throw new UserException.MissingIndex(fastaPath.toString(), "Create one with 'samtools faidx'.");
        }
        try {
            this.index = new FastaSequenceIndex(indexPath);
            this.reference = new IndexedFastaSequenceFile(fastaPath, index);
        } catch ( final RuntimeIOException e ) {
            throw new UserException.CouldNotReadInputFile(fastaPath, e);
        } catch ( final SAMException e ) {
            throw new UserException.CouldNotReadInputFile(fastaPath, e);
        }
        this.executorService = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("fasta-reference-thread-%d")
                .setDaemon(true)
                .build());
    }

    @Override
    public CompletableFuture<ReferenceBases> fetch(final ContigInterval interval) {
        Utils.nonNull(interval);
        try {
            return CompletableFuture.supplyAsync(() -> query(interval), executorService);
        } catch ( final RejectedExecutionException e ) {
            final CompletableFuture<ReferenceBases> failed = new CompletableFuture<>();
            failed.completeExceptionally(new PileupException.FetchError(interval, "reference source is closed", e));
            return failed;
        }
    }

    private ReferenceBases query(final ContigInterval interval) {
        if ( !index.hasIndexEntry(interval.getContig()) ) {
            throw new PileupException.FetchError(interval, "contig " + interval.getContig() + " is not in " + fastaPath);
        }
        final FastaSequenceIndexEntry entry = index.getIndexEntry(interval.getContig());
        final int contigLength = (int) Math.min(entry.getSize(), Integer.MAX_VALUE);
        final int start = Math.min(interval.getStart(), contigLength);
        final int stop = Math.min(interval.getStop(), contigLength);
        final ContigInterval clipped = new ContigInterval(interval.getContig(), start, stop);
        if ( clipped.isEmpty() ) {
            return new ReferenceBases(new byte[0], clipped);
        }
        if ( stop < interval.getStop() ) {
            logger.debug("Clipped reference query {} to contig end {}", interval, clipped);
        }

        try {
            // htsjdk uses 1-based closed coordinates
            final ReferenceSequence sequence = reference.getSubsequenceAt(interval.getContig(), start + 1L, stop);
            return new ReferenceBases(sequence.getBases(), clipped);
        } catch ( final RuntimeIOException e ) {
            throw new PileupException.FetchError(interval, "could not read " + fastaPath, e);
        } catch ( final SAMException e ) {
            throw new PileupException.FetchError(interval, "could not read " + fastaPath, e);
        }
    }

    /**
     * @return the length of {@code contig}, or -1 if the fasta does not contain it
     */
    public long getContigLength(final String contig) {
        Utils.nonNull(contig);
        return index.hasIndexEntry(contig) ? index.getIndexEntry(contig).getSize() : -1;
    }

    /**
     * Permanently close this data source. Pending fetches are abandoned.
     */
    @Override
    public void close() {
        executorService.shutdownNow();
        try {
            reference.close();
        } catch ( final IOException e ) {
            throw new PileupException("Error closing reference file " + fastaPath, e);
        }
    }
}
