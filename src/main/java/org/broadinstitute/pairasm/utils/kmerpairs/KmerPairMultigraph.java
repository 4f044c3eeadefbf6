package org.broadinstitute.pairasm.utils.kmerpairs;

import com.google.common.collect.ImmutableMultiset;
import com.google.common.collect.Multiset;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pairasm.exceptions.PairasmException;
import org.broadinstitute.pairasm.utils.Utils;

import java.util.*;

/**
 * A directed multigraph whose edges are k-mer pairs.
 *
 * <p>Each node that is the source of at least one pair owns a bag of destination labels, one entry per pair,
 * so parallel edges are kept. Nodes that only ever appear as destinations have no bag; every lookup treats a
 * missing bag as an empty one. The bags, and the indegree of each node, are built in a single pass over the
 * input. Both maps keep insertion order, so iteration over nodes is deterministic for a given input list.</p>
 *
 * <p>Outdegree is the live size of a node's bag. Indegree is counted once when the graph is built and is not
 * updated as edges are consumed; it is only meaningful before traversal.</p>
 *
 * <p>A traversal consumes the bags. Once {@link EulerianPathFinder} has started on a graph the graph reports
 * itself as consumed, and any further traversal, start-node selection or {@link #copy()} throws
 * {@link PairasmException.ConsumedGraphException}. Take a copy first if the structure is needed afterwards.</p>
 *
 * <p>Not thread-safe.</p>
 */
public final class KmerPairMultigraph {
    private static final Logger logger = LogManager.getLogger(KmerPairMultigraph.class);

    private final Map<String, Deque<String>> successorBags;
    private final Map<String, Integer> inDegrees;
    private final Set<String> nodes;
    private final int edgeCount;
    private int remainingEdgeCount;
    private boolean consumed;

    private KmerPairMultigraph( final Map<String, Deque<String>> successorBags,
                                final Map<String, Integer> inDegrees,
                                final Set<String> nodes,
                                final int edgeCount ) {
        this.successorBags = successorBags;
        this.inDegrees = inDegrees;
        this.nodes = nodes;
        this.edgeCount = edgeCount;
        this.remainingEdgeCount = edgeCount;
        this.consumed = false;
    }

    /**
     * Builds the graph. Each pair becomes one edge; the list is not modified.
     *
     * @param pairs k-mer pairs in input order, possibly empty, possibly with repeats
     * @throws IllegalArgumentException if the list or any of its elements is null
     */
    public static KmerPairMultigraph fromPairs( final List<KmerPair> pairs ) {
        Utils.containsNoNull(pairs, "k-mer pairs may not be null");

        final Map<String, Deque<String>> successorBags = new LinkedHashMap<>();
        final Map<String, Integer> inDegrees = new LinkedHashMap<>();
        final Set<String> nodes = new LinkedHashSet<>();
        for ( final KmerPair pair : pairs ) {
            successorBags.computeIfAbsent(pair.getSource(), k -> new ArrayDeque<>()).addLast(pair.getDestination());
            inDegrees.merge(pair.getDestination(), 1, Integer::sum);
            nodes.add(pair.getSource());
            nodes.add(pair.getDestination());
        }
        logger.debug("Built k-mer pair graph with " + nodes.size() + " nodes and " + pairs.size() + " edges");
        return new KmerPairMultigraph(successorBags, inDegrees, nodes, pairs.size());
    }

    /** @return every label seen, as a source or a destination, in first-seen order */
    public Set<String> getNodes() {
        return Collections.unmodifiableSet(nodes);
    }

    /** @return the labels that own a successor bag, in insertion order */
    public Set<String> getSourceNodes() {
        return Collections.unmodifiableSet(successorBags.keySet());
    }

    public boolean isEmpty() { return edgeCount == 0; }

    /** @return the number of pairs the graph was built from */
    public int getEdgeCount() { return edgeCount; }

    /** @return the number of edges not yet consumed by a traversal */
    public int getRemainingEdgeCount() { return remainingEdgeCount; }

    public boolean isConsumed() { return consumed; }

    /** @return the number of unconsumed edges leaving {@code node}; 0 for unknown labels */
    public int getOutDegree( final String node ) {
        return successorBag(node).size();
    }

    /** @return the number of pairs whose destination is {@code node}, as counted at build time; 0 for unknown labels */
    public int getInDegree( final String node ) {
        Utils.nonNull(node);
        return inDegrees.getOrDefault(node, 0);
    }

    /** @return a snapshot of the unconsumed successors of {@code node}, with multiplicity */
    public Multiset<String> getSuccessors( final String node ) {
        return ImmutableMultiset.copyOf(successorBag(node));
    }

    /**
     * @return an independent graph with the same nodes, bags and degrees, in the same order
     * @throws PairasmException.ConsumedGraphException if a traversal has already consumed this graph
     */
    public KmerPairMultigraph copy() {
        checkNotConsumed("copy");
        final Map<String, Deque<String>> bagsCopy = new LinkedHashMap<>(successorBags.size() * 2);
        for ( final Map.Entry<String, Deque<String>> entry : successorBags.entrySet() ) {
            bagsCopy.put(entry.getKey(), new ArrayDeque<>(entry.getValue()));
        }
        return new KmerPairMultigraph(bagsCopy, new LinkedHashMap<>(inDegrees), new LinkedHashSet<>(nodes), edgeCount);
    }

    void checkNotConsumed( final String operation ) {
        if ( consumed ) {
            throw new PairasmException.ConsumedGraphException(operation);
        }
    }

    /** Marks the graph as owned by a traversal. */
    void beginTraversal() {
        checkNotConsumed("traverse");
        consumed = true;
    }

    /**
     * Removes and returns the oldest remaining edge out of {@code node}, or null if there is none.
     */
    String removeNextSuccessor( final String node ) {
        final Deque<String> bag = successorBags.get(node);
        if ( bag == null || bag.isEmpty() ) {
            return null;
        }
        --remainingEdgeCount;
        return bag.pollFirst();
    }

    private Deque<String> successorBag( final String node ) {
        Utils.nonNull(node);
        final Deque<String> bag = successorBags.get(node);
        return bag == null ? new ArrayDeque<>(0) : bag;
    }
}
