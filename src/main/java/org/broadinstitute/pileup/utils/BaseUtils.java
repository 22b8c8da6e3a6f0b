package org.broadinstitute.pileup.utils;

import htsjdk.samtools.util.SequenceUtil;

/**
 * BaseUtils contains some basic utilities for comparing nucleotides.
 */
public final class BaseUtils {

    /**
     * Symbol used for reference (and read) positions whose base is not known.
     */
    public static final byte UNKNOWN_BASE = 'N';

    private BaseUtils(){}

    public static boolean isNBase(final byte base) {
        return base == 'N' || base == 'n';
    }

    /**
     * @return true if {@code base} carries no base call (N or the '.' no-call symbol)
     */
    public static boolean isUnknown(final byte base) {
        return isNBase(base) || base == '.';
    }

    /**
     * Decide whether a read base disagrees with the reference base it is aligned to.
     * Unknown bases on either side never count as a mismatch, and case is ignored.
     *
     * @param readBase base from the read
     * @param referenceBase base from the reference at the aligned position
     * @return true if both bases are known and differ
     */
    public static boolean isMismatch(final byte readBase, final byte referenceBase) {
        if (isUnknown(readBase) || isUnknown(referenceBase)) {
            return false;
        }
        return !SequenceUtil.basesEqual(readBase, referenceBase);
    }
}
