package org.broadinstitute.pileup.utils;

import htsjdk.samtools.util.Interval;
import htsjdk.samtools.util.Locatable;
import org.apache.commons.lang3.StringUtils;
import org.broadinstitute.pileup.exceptions.UserException;

import java.io.Serializable;
import java.util.Comparator;
import java.util.Optional;

/**
 * Minimal immutable class representing a 0-based, half-open genomic interval {@code [start, stop)} on a named contig.
 * ContigInterval does not allow null contig names. Zero-length intervals ({@code start == stop}) are allowed; they
 * overlap nothing.
 *
 * htsjdk works in 1-based closed coordinates; use {@link #toLocatable()} and {@link #fromLocatable(Locatable)}
 * to convert at that boundary.
 */
public final class ContigInterval implements Comparable<ContigInterval>, Serializable {
    private static final long serialVersionUID = 1L;
    public static final char CONTIG_SEPARATOR = ':';
    public static final char START_END_SEPARATOR = '-';

    private static final Comparator<ContigInterval> ORDER = Comparator.comparing(ContigInterval::getContig)
            .thenComparingInt(ContigInterval::getStart)
            .thenComparingInt(ContigInterval::getStop);

    private final String contig;
    private final int start;
    private final int stop;

    /**
     * Create a new immutable interval of the form [start, stop)
     * @param contig the name of the contig, must not be null
     * @param start  0-based inclusive start position
     * @param stop  0-based exclusive stop position
     */
    public ContigInterval(final String contig, final int start, final int stop) {
        validatePositions(contig, start, stop);
        this.contig = contig;
        this.start = start;
        this.stop = stop;
    }

    /**
     * Test that these are valid values for constructing a ContigInterval:
     *    contig cannot be null
     *    start must be >= 0
     *    stop must be >= start
     * @throws IllegalArgumentException if it is invalid
     */
    static void validatePositions(final String contig, final int start, final int stop) {
        Utils.validateArg(isValid(contig, start, stop), () -> "Invalid interval. Contig:" + contig + " start:" + start + " stop:" + stop);
    }

    public static boolean isValid(final String contig, final int start, final int stop) {
        return contig != null && start >= 0 && stop >= start;
    }

    /**
     * Convert a 1-based closed htsjdk {@link Locatable} into the equivalent half-open interval.
     * @throws IllegalArgumentException if locatable is null or violates the ContigInterval constraints
     */
    public static ContigInterval fromLocatable(final Locatable locatable) {
        Utils.nonNull(locatable);
        return new ContigInterval(locatable.getContig(), locatable.getStart() - 1, locatable.getEnd());
    }

    /**
     * Makes an interval by parsing the string.
     *
     * The string uses the human (1-based, closed) convention. The format is one of:
     *
     * contig           (the whole contig, up to {@link Integer#MAX_VALUE})
     *
     * contig:start     (the single base at start)
     *
     * contig:start-end (the range start-end on the given contig)
     *
     * All commas in numbers are ignored, so 'chr17:7,500,735-7,500,795' is the 61 bases [7500734, 7500795).
     *
     * @param str non-empty string to be parsed
     * @throws UserException.MalformedInterval if the positions cannot be parsed or describe an invalid interval
     */
    public static ContigInterval parse(final String str) {
        Utils.nonNull(str);
        Utils.validateArg(!StringUtils.isBlank(str), "str should not be blank");

        final String trimmed = str.trim();
        final int colonIndex = trimmed.lastIndexOf(CONTIG_SEPARATOR);
        if (colonIndex == -1) {
            return new ContigInterval(trimmed, 0, Integer.MAX_VALUE);
        }

        final String contig = trimmed.substring(0, colonIndex);
        final int dashIndex = trimmed.indexOf(START_END_SEPARATOR, colonIndex);
        final int oneBasedStart;
        final int oneBasedEnd;
        if (dashIndex == -1) {
            oneBasedStart = parsePosition(str, trimmed.substring(colonIndex + 1));
            oneBasedEnd = oneBasedStart;
        } else {
            oneBasedStart = parsePosition(str, trimmed.substring(colonIndex + 1, dashIndex));
            oneBasedEnd = parsePosition(str, trimmed.substring(dashIndex + 1));
        }

        if (contig.isEmpty() || !isValid(contig, oneBasedStart - 1, oneBasedEnd)) {
            throw new UserException.MalformedInterval(str, "start must be >= 1 and end must be >= start - 1");
        }
        return new ContigInterval(contig, oneBasedStart - 1, oneBasedEnd);
    }

    /**
     * Parses a number like 100000 or 1,000,000 into an int.
     */
    private static int parsePosition(final String original, final String pos) {
        try {
            return Integer.parseInt(StringUtils.remove(pos, ',').trim());
        } catch (final NumberFormatException e) {
            throw new UserException.MalformedInterval(original, "could not parse position " + pos, e);
        }
    }

    /**
     * @return name of the contig this is mapped to
     */
    public String getContig() {
        return contig;
    }

    /** Gets the 0-based inclusive start position of the interval on the contig. */
    public int getStart() {
        return start;
    }

    /** Gets the 0-based exclusive stop position of the interval on the contig. */
    public int getStop() {
        return stop;
    }

    /**
     * @return number of bases covered by this interval (may be 0)
     */
    public int size() {
        return stop - start;
    }

    public boolean isEmpty() {
        return start == stop;
    }

    /**
     * Determines whether this interval shares at least one base with the other interval.
     * Intervals on different contigs never overlap, and empty intervals overlap nothing.
     *
     * @param other interval to check
     * @return true if this interval overlaps other, otherwise false
     */
    public boolean overlaps(final ContigInterval other) {
        if (other == null || isEmpty() || other.isEmpty()) {
            return false;
        }
        return contig.equals(other.contig) && start < other.stop && other.start < stop;
    }

    /**
     * Determines whether this interval contains the entire region represented by other
     * (in other words, whether it covers it).
     *
     * @param other interval to check
     * @return true if this interval contains all of the bases spanned by other, otherwise false
     */
    public boolean contains(final ContigInterval other) {
        if (other == null) {
            return false;
        }
        return contig.equals(other.contig) && start <= other.start && other.stop <= stop;
    }

    /**
     * @return true if the 0-based position {@code pos} on {@code contig} lies inside this interval
     */
    public boolean containsPosition(final String contig, final int pos) {
        return this.contig.equals(contig) && start <= pos && pos < stop;
    }

    /**
     * Returns the intersection of the two intervals, or empty if they do not overlap
     * (including when they lie on different contigs).
     */
    public Optional<ContigInterval> intersect(final ContigInterval that) {
        if (!overlaps(that)) {
            return Optional.empty();
        }
        return Optional.of(new ContigInterval(contig, Math.max(start, that.start), Math.min(stop, that.stop)));
    }

    /**
     * Returns a new ContigInterval that represents the region between the endpoints of this and other.
     *
     * @param other the other interval with which to calculate the span
     * @return a new ContigInterval that represents the region between the endpoints of this and other.
     */
    public ContigInterval spanWith(final ContigInterval other) {
        Utils.nonNull(other);
        Utils.validateArg(contig.equals(other.contig), "Cannot get span for intervals on different contigs");
        return new ContigInterval(contig, Math.min(start, other.start), Math.max(stop, other.stop));
    }

    /**
     * @return the equivalent 1-based closed htsjdk interval
     */
    public Interval toLocatable() {
        return new Interval(contig, start + 1, stop);
    }

    @Override
    public int compareTo(final ContigInterval other) {
        return ORDER.compare(this, other);
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;

        final ContigInterval that = (ContigInterval) o;

        if (stop != that.stop) return false;
        if (start != that.start) return false;
        return contig.equals(that.contig);
    }

    @Override
    public int hashCode() {
        int result = start;
        result = 31 * result + stop;
        result = 31 * result + contig.hashCode();
        return result;
    }

    /**
     * @return the human readable, 1-based closed form accepted by {@link #parse(String)}
     */
    @Override
    public String toString() {
        return String.format("%s%c%d%c%d", contig, CONTIG_SEPARATOR, start + 1, START_END_SEPARATOR, stop);
    }
}
