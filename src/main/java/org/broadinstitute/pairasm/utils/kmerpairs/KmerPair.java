package org.broadinstitute.pairasm.utils.kmerpairs;

import org.broadinstitute.pairasm.utils.Utils;

/**
 * One directed edge of a k-mer pair graph: an ordered (source, destination) pair of node labels.
 * Labels are compared by value and may differ in length. Pairs are never deduplicated, so two equal
 * KmerPairs in an input list are two parallel edges.
 */
public final class KmerPair {
    private final String source;
    private final String destination;

    private KmerPair( final String source, final String destination ) {
        this.source = source;
        this.destination = destination;
    }

    /**
     * @throws IllegalArgumentException if either label is null or empty
     */
    public static KmerPair of( final String source, final String destination ) {
        Utils.nonEmpty(source, "k-mer pair source");
        Utils.nonEmpty(destination, "k-mer pair destination");
        return new KmerPair(source, destination);
    }

    public String getSource() { return source; }
    public String getDestination() { return destination; }

    @Override
    public boolean equals( final Object obj ) {
        if ( this == obj ) return true;
        if ( !(obj instanceof KmerPair) ) return false;
        final KmerPair that = (KmerPair)obj;
        return source.equals(that.source) && destination.equals(that.destination);
    }

    @Override
    public int hashCode() {
        return 47 * source.hashCode() + destination.hashCode();
    }

    @Override
    public String toString() {
        return "(" + source + " -> " + destination + ")";
    }
}
