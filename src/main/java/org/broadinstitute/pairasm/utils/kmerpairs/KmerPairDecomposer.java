package org.broadinstitute.pairasm.utils.kmerpairs;

import org.broadinstitute.pairasm.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Breaks sequences into the inputs a reconstruction starts from, and turns gapped read pairs into the edges
 * of a paired de Bruijn graph.
 */
public final class KmerPairDecomposer {

    private KmerPairDecomposer() {}

    /**
     * Every pair of consecutive overlapping k-mers of {@code sequence}, in sequence order. A sequence of
     * length L yields L-k pairs; one no longer than k yields none.
     */
    public static List<KmerPair> toKmerPairs( final String sequence, final int kmerSize ) {
        Utils.nonNull(sequence, "sequence");
        Utils.validateArg(kmerSize >= 1, "k-mer size must be positive");
        final int nPairs = Math.max(0, sequence.length() - kmerSize);
        final List<KmerPair> pairs = new ArrayList<>(nPairs);
        for ( int start = 0; start < nPairs; ++start ) {
            pairs.add(KmerPair.of(sequence.substring(start, start + kmerSize),
                                  sequence.substring(start + 1, start + 1 + kmerSize)));
        }
        return pairs;
    }

    /**
     * Every read pair {@code (s[i, i+k), s[i+k+d, i+2k+d))} of {@code sequence}, in sequence order.
     */
    public static List<GappedReadPair> toGappedReadPairs( final String sequence, final int kmerSize, final int gap ) {
        Utils.nonNull(sequence, "sequence");
        Utils.validateArg(kmerSize >= 2, "k-mer size must be at least 2");
        Utils.validateArg(gap >= 0, "gap may not be negative");
        final int span = 2 * kmerSize + gap;
        final int nPairs = Math.max(0, sequence.length() - span + 1);
        final List<GappedReadPair> readPairs = new ArrayList<>(nPairs);
        for ( int start = 0; start < nPairs; ++start ) {
            final int secondStart = start + kmerSize + gap;
            readPairs.add(GappedReadPair.of(sequence.substring(start, start + kmerSize),
                                            sequence.substring(secondStart, secondStart + kmerSize)));
        }
        return readPairs;
    }

    /**
     * Turns each read pair {@code (a, b)} into the edge {@code a[0,k-1)|b[0,k-1) -> a[1,k)|b[1,k)}.
     *
     * @throws IllegalArgumentException if the read pairs do not all have the same k-mer size
     */
    public static List<KmerPair> toPairedDeBruijnEdges( final List<GappedReadPair> readPairs ) {
        Utils.containsNoNull(readPairs, "read pairs may not be null");
        final List<KmerPair> edges = new ArrayList<>(readPairs.size());
        if ( readPairs.isEmpty() ) {
            return edges;
        }
        final int kmerSize = readPairs.get(0).getKmerSize();
        Utils.validateArg(kmerSize >= 2, "read pair k-mers must be at least 2 long");
        for ( final GappedReadPair readPair : readPairs ) {
            Utils.validateArg(readPair.getKmerSize() == kmerSize,
                    () -> "read pair " + readPair + " does not have k-mer size " + kmerSize);
            final String first = readPair.getFirst();
            final String second = readPair.getSecond();
            edges.add(KmerPair.of(
                    first.substring(0, kmerSize - 1) + GappedReadPair.SEPARATOR + second.substring(0, kmerSize - 1),
                    first.substring(1) + GappedReadPair.SEPARATOR + second.substring(1)));
        }
        return edges;
    }
}
