package org.broadinstitute.pairasm.exceptions;

/**
 * An error in pairasm itself rather than in its input, such as a broken internal precondition.
 */
public class PairasmException extends RuntimeException {
    private static final long serialVersionUID = 0L;

    public PairasmException( final String msg ) {
        super(msg);
    }

    /**
     * Thrown when a k-mer pair multigraph is used again after a traversal has consumed its edges.
     */
    public static class ConsumedGraphException extends PairasmException {
        private static final long serialVersionUID = 0L;

        public ConsumedGraphException( final String operation ) {
            super(String.format("Attempted to %s a k-mer pair graph whose edges were already consumed by a traversal. " +
                    "Traverse a copy() of the graph if the structure is needed afterwards.", operation));
        }
    }
}
