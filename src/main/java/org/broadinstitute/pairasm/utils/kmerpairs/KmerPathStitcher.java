package org.broadinstitute.pairasm.utils.kmerpairs;

import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;

import java.util.ArrayList;
import java.util.List;

/**
 * Spells out the sequence along a node path. Consecutive labels overlap in all but one character, so the
 * sequence is the first label followed by the last character of each later label.
 */
public final class KmerPathStitcher {

    private KmerPathStitcher() {}

    /**
     * @return the spelled sequence; the empty string for an empty path
     * @throws IllegalArgumentException if any label is empty
     */
    public static String stitch( final List<String> path ) {
        Utils.containsNoNull(path, "path may not contain null labels");
        if ( path.isEmpty() ) {
            return "";
        }
        final String first = path.get(0);
        Utils.validateArg(!first.isEmpty(), "path labels may not be empty");
        final StringBuilder sb = new StringBuilder(first.length() + path.size() - 1);
        sb.append(first);
        for ( int idx = 1; idx < path.size(); ++idx ) {
            final String label = path.get(idx);
            Utils.validateArg(!label.isEmpty(), "path labels may not be empty");
            sb.append(label.charAt(label.length() - 1));
        }
        return sb.toString();
    }

    /**
     * Spells the sequence along a path through a paired de Bruijn graph, whose labels are
     * {@code firstPrefix|secondPrefix} with both halves of length k-1.
     *
     * The first halves spell the sequence up to k+d characters from its end, and the second halves spell it
     * from position k+d onward. Where the two spellings overlap they must agree; the result is the first
     * spelling followed by the last k+d characters of the second.
     *
     * @param kmerSize k, the length of each read of a pair
     * @param gap d, the distance between the end of the first read and the start of the second
     * @throws UserException.InconsistentReadPairs if the spellings disagree, or there are too few read pairs to bridge the gap
     */
    public static String stitchGapped( final List<String> path, final int kmerSize, final int gap ) {
        Utils.containsNoNull(path, "path may not contain null labels");
        Utils.validateArg(kmerSize >= 2, "k-mer size must be at least 2");
        Utils.validateArg(gap >= 0, "gap may not be negative");
        if ( path.isEmpty() ) {
            return "";
        }

        final List<String> firstHalves = new ArrayList<>(path.size());
        final List<String> secondHalves = new ArrayList<>(path.size());
        for ( final String label : path ) {
            final int separatorIdx = label.indexOf(GappedReadPair.SEPARATOR);
            Utils.validateArg(separatorIdx == kmerSize - 1 && label.length() == 2 * kmerSize - 1,
                    () -> "not a paired label of two " + (kmerSize - 1) + "-mers: " + label);
            firstHalves.add(label.substring(0, separatorIdx));
            secondHalves.add(label.substring(separatorIdx + 1));
        }
        final String firstSpelling = stitch(firstHalves);
        final String secondSpelling = stitch(secondHalves);

        final int offset = kmerSize + gap;
        if ( secondSpelling.length() < offset ) {
            throw new UserException.InconsistentReadPairs(String.format(
                    "%d read pairs cannot span a gap of %d between %d-mers", path.size() - 1, gap, kmerSize));
        }
        for ( int idx = offset; idx < firstSpelling.length(); ++idx ) {
            final char expected = firstSpelling.charAt(idx);
            final char found = secondSpelling.charAt(idx - offset);
            if ( expected != found ) {
                throw new UserException.InconsistentReadPairs(idx, expected, found);
            }
        }
        return firstSpelling + secondSpelling.substring(secondSpelling.length() - offset);
    }
}
