package org.broadinstitute.pileup.engine.cache;

import org.broadinstitute.pileup.utils.ContigInterval;
import org.broadinstitute.pileup.utils.Utils;

/**
 * A {@code FetchIntervalStrategy} that rounds every request out to whole blocks of a fixed size.
 *
 * Start is rounded down and stop rounded up to a multiple of the block size. With a block size of 1000, a request
 * for {@code [7500733, 7500795)} fetches {@code [7500000, 7501000)}.
 */
public final class BlockAlignedFetchStrategy implements FetchIntervalStrategy {

    public static final int DEFAULT_BLOCK_SIZE = 1000;

    private final int blockSize;

    public BlockAlignedFetchStrategy() {
        this(DEFAULT_BLOCK_SIZE);
    }

    /**
     * @param blockSize size of the blocks requests are rounded to, must be positive
     */
    public BlockAlignedFetchStrategy(final int blockSize) {
        Utils.validateArg(blockSize > 0, () -> "block size must be positive but was " + blockSize);
        this.blockSize = blockSize;
    }

    public int getBlockSize() {
        return blockSize;
    }

    @Override
    public ContigInterval getFetchIntervalFromRequestInterval(final ContigInterval requestedInterval) {
        Utils.nonNull(requestedInterval);
        final int start = requestedInterval.getStart() - requestedInterval.getStart() % blockSize;
        final int stop = roundUp(requestedInterval.getStop());
        return new ContigInterval(requestedInterval.getContig(), start, Math.max(stop, start));
    }

    private int roundUp(final int position) {
        final int remainder = position % blockSize;
        if ( remainder == 0 ) {
            return position;
        }
        // whole-contig requests end at Integer.MAX_VALUE and cannot be rounded further
        if ( position > Integer.MAX_VALUE - (blockSize - remainder) ) {
            return position;
        }
        return position + (blockSize - remainder);
    }

    @Override
    public String toString() {
        return "BlockAlignedFetchStrategy{blockSize=" + blockSize + '}';
    }
}
