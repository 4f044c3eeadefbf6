package org.broadinstitute.pairasm.utils.kmerpairs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;
import org.broadinstitute.pairasm.utils.config.ConfigFactory;
import org.broadinstitute.pairasm.utils.config.PairasmConfig;

import java.util.*;
import java.util.function.BooleanSupplier;

/**
 * Walks a {@link KmerPairMultigraph} along an Eulerian path with Hierholzer's algorithm, using an explicit
 * stack so that path length is not limited by the call stack.
 *
 * <p>Starting from the start node, the node on top of the stack either still has an unused outgoing edge,
 * in which case the oldest such edge is consumed and its destination pushed, or it has none, in which case
 * it is popped onto the output. The output, reversed, is the path. Every edge is pushed exactly once, so the
 * walk always terminates in O(E) time.</p>
 *
 * <p>Only the first dead end, the end of the path, may be at an arbitrary node. Every later dead end closes a
 * detour and so must be the node the detour left from; a walk that gets stuck anywhere else has found a branch
 * no single path can cover, and is stopped with {@link UserException.NoEulerianPath}. A graph in several pieces
 * is walked to completion but leaves edges unused; {@link EulerianPathValidator#validatePath} detects that.</p>
 *
 * <p>The traversal can be cancelled: an abort signal is polled before the walk and then every
 * {@code abortCheckInterval} consumed edges, and graphs larger than {@code maxEdges} are refused outright.
 * Either condition throws {@link TraversalAbortedException}. The signal may be flipped from another thread.</p>
 */
public final class EulerianPathFinder {
    private static final Logger logger = LogManager.getLogger(EulerianPathFinder.class);

    public static final int DEFAULT_ABORT_CHECK_INTERVAL = 4096;
    public static final int DEFAULT_PROGRESS_INTERVAL = 1000000;

    private static final BooleanSupplier NEVER_ABORT = () -> false;

    private final BooleanSupplier abortSignal;
    private final int abortCheckInterval;
    private final long maxEdges;
    private final int progressInterval;

    /** A finder that never aborts. */
    public EulerianPathFinder() {
        this(NEVER_ABORT, DEFAULT_ABORT_CHECK_INTERVAL, 0L, DEFAULT_PROGRESS_INTERVAL);
    }

    /**
     * @param abortSignal polled during traversal; the traversal aborts when it returns true
     * @param abortCheckInterval number of consumed edges between polls, at least 1
     * @param maxEdges largest graph to traverse, in edges; 0 for no limit
     * @param progressInterval number of consumed edges between DEBUG progress messages, at least 1
     */
    public EulerianPathFinder( final BooleanSupplier abortSignal,
                               final int abortCheckInterval,
                               final long maxEdges,
                               final int progressInterval ) {
        this.abortSignal = Utils.nonNull(abortSignal, "abort signal");
        Utils.validateArg(abortCheckInterval > 0, "abort check interval must be positive");
        Utils.validateArg(maxEdges >= 0, "maximum edge count may not be negative");
        Utils.validateArg(progressInterval > 0, "progress interval must be positive");
        this.abortCheckInterval = abortCheckInterval;
        this.maxEdges = maxEdges;
        this.progressInterval = progressInterval;
    }

    /**
     * A finder whose intervals and edge limit come from the {@link PairasmConfig}.
     */
    public static EulerianPathFinder fromConfig( final BooleanSupplier abortSignal ) {
        final PairasmConfig config = ConfigFactory.getInstance().getPairasmConfig();
        return new EulerianPathFinder(abortSignal,
                config.traversal_abort_check_interval(),
                config.traversal_max_edges(),
                config.traversal_progress_interval());
    }

    /**
     * Consumes every edge reachable from {@code startNode}. The graph is marked consumed even if the
     * traversal is aborted.
     *
     * @return the node labels along the walk, starting at {@code startNode}
     * @throws org.broadinstitute.pairasm.exceptions.PairasmException.ConsumedGraphException if the graph was already traversed
     * @throws TraversalAbortedException if the abort signal trips or the graph exceeds the edge limit
     * @throws UserException.NoEulerianPath if the walk gets stuck at a branch that no single path can cover
     */
    public List<String> findPath( final KmerPairMultigraph graph, final String startNode ) {
        Utils.nonNull(graph, "graph");
        Utils.nonNull(startNode, "start node");
        graph.beginTraversal();

        final int edgeCount = graph.getEdgeCount();
        if ( maxEdges > 0 && edgeCount > maxEdges ) {
            throw new TraversalAbortedException(String.format(
                    "The k-mer pair graph has %d edges, more than the limit of %d.", edgeCount, maxEdges), 0);
        }
        if ( abortSignal.getAsBoolean() ) {
            throw new TraversalAbortedException("Traversal aborted before it started.", 0);
        }

        final Deque<String> stack = new ArrayDeque<>();
        final List<String> path = new ArrayList<>(edgeCount + 1);
        long consumedEdges = 0;
        boolean justPushed = true;
        String resumeNode = null;
        stack.push(startNode);
        while ( !stack.isEmpty() ) {
            final String top = stack.peek();
            final String successor = graph.removeNextSuccessor(top);
            if ( successor == null ) {
                stack.pop();
                // a detour must close where it began; only the first dead end may be anywhere
                if ( justPushed && !path.isEmpty() && !top.equals(resumeNode) ) {
                    throw new UserException.NoEulerianPath(String.format(
                            "the walk reached a dead end at %s while edges out of %s were still being used", top, resumeNode));
                }
                path.add(top);
                justPushed = false;
                resumeNode = stack.peek();
                continue;
            }
            stack.push(successor);
            justPushed = true;
            ++consumedEdges;
            if ( consumedEdges % abortCheckInterval == 0 && abortSignal.getAsBoolean() ) {
                throw new TraversalAbortedException(String.format(
                        "Traversal aborted after consuming %d of %d edges.", consumedEdges, edgeCount), consumedEdges);
            }
            if ( consumedEdges % progressInterval == 0 ) {
                logger.debug("Consumed " + consumedEdges + " of " + edgeCount + " edges (" +
                        Utils.formattedPercent(consumedEdges, edgeCount) + "%)");
            }
        }
        Collections.reverse(path);
        return path;
    }

    /** Something to throw when a traversal is cancelled or refused. */
    public final static class TraversalAbortedException extends RuntimeException {
        static final long serialVersionUID = -1L;

        private final long edgesConsumed;

        public TraversalAbortedException( final String message, final long edgesConsumed ) {
            super(message);
            this.edgesConsumed = edgesConsumed;
        }

        public long getEdgesConsumed() { return edgesConsumed; }
    }
}
