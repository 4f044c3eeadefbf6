package org.broadinstitute.pairasm.exceptions;

import org.broadinstitute.pairasm.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pairasm.engine.PairasmPath;

import java.nio.file.Path;

/**
 * An error the user can fix: a missing or malformed file, a bad option, or k-mer pairs that no single walk can use.
 * {@link org.broadinstitute.pairasm.Main} reports these without a stack trace.
 */
public class UserException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public UserException( final String msg ) {
        super(msg);
    }

    public UserException( final String msg, final Throwable cause ) {
        super(msg, cause);
    }

    private static String describe( final Throwable t ) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }

    public static class CouldNotReadInputFile extends UserException {
        private static final long serialVersionUID = 0L;

        private static final String FORMAT = "Couldn't read file %s. Error was: %s";

        public CouldNotReadInputFile( final PairasmPath file, final String message, final Throwable cause ) {
            super(String.format(FORMAT, file.getRawInputString(), message + " (" + describe(cause) + ")"), cause);
        }

        public CouldNotReadInputFile( final Path file, final String message ) {
            super(String.format(FORMAT, file.toAbsolutePath(), message));
        }

        public CouldNotReadInputFile( final Path file, final String message, final Throwable cause ) {
            super(String.format(FORMAT, file.toAbsolutePath(), message + " (" + describe(cause) + ")"), cause);
        }
    }

    public static class CouldNotCreateOutputFile extends UserException {
        private static final long serialVersionUID = 0L;

        public CouldNotCreateOutputFile( final PairasmPath file, final String message ) {
            super(String.format("Couldn't write file %s because %s", file.getRawInputString(), message));
        }

        public CouldNotCreateOutputFile( final PairasmPath file, final String message, final Throwable cause ) {
            super(String.format("Couldn't write file %s because %s (%s)", file.getRawInputString(), message, describe(cause)), cause);
        }
    }

    public static class BadInput extends UserException {
        private static final long serialVersionUID = 0L;

        public BadInput( final String message ) {
            super("Bad input: " + message);
        }
    }

    public static class BadTempDir extends UserException {
        private static final long serialVersionUID = 0L;

        public BadTempDir( final Path tmpDir, final String message ) {
            super(String.format("The temporary directory %s is unusable: %s. Choose another one with --%s.",
                    tmpDir, message, StandardArgumentDefinitions.TMP_DIR_NAME));
        }
    }

    /**
     * A line of a pair file that does not hold a well-formed k-mer pair or read pair.
     */
    public static class MalformedKmerPair extends UserException {
        private static final long serialVersionUID = 0L;

        public MalformedKmerPair( final String source, final long lineNumber, final String line, final String message ) {
            super(String.format("Malformed k-mer pair at line %d of %s (\"%s\"): %s", lineNumber, source, line, message));
        }
    }

    public static class EmptyKmerPairInput extends UserException {
        private static final long serialVersionUID = 0L;

        public EmptyKmerPairInput() {
            super("No k-mer pairs were supplied; there is nothing to reconstruct.");
        }

        public EmptyKmerPairInput( final String message ) {
            super("No k-mer pairs were supplied: " + message);
        }
    }

    /**
     * The walk ended with edges left over, so the pairs form more than one connected piece.
     */
    public static class DisconnectedKmerGraph extends UserException {
        private static final long serialVersionUID = 0L;

        private final int edgeCount;
        private final int pathLength;

        public DisconnectedKmerGraph( final int edgeCount, final int pathLength, final int unusedEdges ) {
            super(String.format("The k-mer pair graph is not connected: the traversal produced a path of %d nodes " +
                    "for %d edges (expected %d nodes), leaving %d edges unused.",
                    pathLength, edgeCount, edgeCount + 1, unusedEdges));
            this.edgeCount = edgeCount;
            this.pathLength = pathLength;
        }

        public int getEdgeCount() { return edgeCount; }
        public int getPathLength() { return pathLength; }
    }

    /**
     * The in- and out-degrees of the graph rule out a walk that uses every edge once.
     */
    public static class NoEulerianPath extends UserException {
        private static final long serialVersionUID = 0L;

        public NoEulerianPath( final String message ) {
            super("The k-mer pairs admit no Eulerian path: " + message);
        }
    }

    /**
     * The two reads of a gapped read-pair reconstruction disagree where they overlap.
     */
    public static class InconsistentReadPairs extends UserException {
        private static final long serialVersionUID = 0L;

        public InconsistentReadPairs( final int offset, final char expected, final char found ) {
            super(String.format("The read pairs are inconsistent: the first and second reads disagree at position %d " +
                    "(%c versus %c).", offset, expected, found));
        }

        public InconsistentReadPairs( final String message ) {
            super("The read pairs are inconsistent: " + message);
        }
    }

    /**
     * The reconstructed sequence holds a character that FASTA output cannot carry.
     */
    public static class NonNucleotideSequence extends UserException {
        private static final long serialVersionUID = 0L;

        private final int offset;

        public NonNucleotideSequence( final String sequenceName, final int offset, final char base ) {
            super(String.format("The reconstructed sequence %s has '%c' at position %d, which is not an IUPAC base code. " +
                    "Only nucleotide k-mers can be written as FASTA; no output was written.", sequenceName, base, offset + 1));
            this.offset = offset;
        }

        /**
         * @return the 0-based offset of the first offending character
         */
        public int getOffset() { return offset; }
    }
}
