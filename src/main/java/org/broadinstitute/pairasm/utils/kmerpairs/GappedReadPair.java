package org.broadinstitute.pairasm.utils.kmerpairs;

import org.broadinstitute.pairasm.utils.Utils;

/**
 * Two k-mers of equal length drawn from the same sequence a fixed distance apart: the first starts at
 * some position i, the second at i + k + d, where d is the gap between them.
 * The gap itself is a property of the whole library, so it is not stored with each pair.
 */
public final class GappedReadPair {
    /** Separates the two k-mers in the text form of a read pair, and the two halves of a paired node label. */
    public static final char SEPARATOR = '|';

    private final String first;
    private final String second;

    private GappedReadPair( final String first, final String second ) {
        this.first = first;
        this.second = second;
    }

    /**
     * @throws IllegalArgumentException if either k-mer is empty, they differ in length, or either
     * contains {@link #SEPARATOR}
     */
    public static GappedReadPair of( final String first, final String second ) {
        Utils.nonEmpty(first, "first k-mer of read pair");
        Utils.nonEmpty(second, "second k-mer of read pair");
        Utils.validateArg(first.length() == second.length(),
                () -> "read pair k-mers differ in length: " + first + " and " + second);
        Utils.validateArg(first.indexOf(SEPARATOR) < 0 && second.indexOf(SEPARATOR) < 0,
                () -> "read pair k-mers may not contain '" + SEPARATOR + "': " + first + " and " + second);
        return new GappedReadPair(first, second);
    }

    /**
     * Parses the text form {@code first|second}.
     * @throws IllegalArgumentException if the text is not two equal-length k-mers joined by {@link #SEPARATOR}
     */
    public static GappedReadPair parse( final String text ) {
        Utils.nonNull(text, "read pair text");
        final int separatorIdx = text.indexOf(SEPARATOR);
        Utils.validateArg(separatorIdx >= 0, () -> "no '" + SEPARATOR + "' in read pair " + text);
        return of(text.substring(0, separatorIdx), text.substring(separatorIdx + 1));
    }

    public String getFirst() { return first; }
    public String getSecond() { return second; }
    public int getKmerSize() { return first.length(); }

    @Override
    public boolean equals( final Object obj ) {
        if ( this == obj ) return true;
        if ( !(obj instanceof GappedReadPair) ) return false;
        final GappedReadPair that = (GappedReadPair)obj;
        return first.equals(that.first) && second.equals(that.second);
    }

    @Override
    public int hashCode() {
        return 47 * first.hashCode() + second.hashCode();
    }

    @Override
    public String toString() {
        return first + SEPARATOR + second;
    }
}
