package org.broadinstitute.pairasm.utils.kmerpairs;

import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;

import java.util.List;

/**
 * Checks the two necessary conditions for a single Eulerian path through a k-mer pair graph:
 * balanced degrees before traversal, and full edge coverage after it.
 */
public final class EulerianPathValidator {

    private EulerianPathValidator() {}

    /**
     * Rejects graphs whose degree imbalances rule out an Eulerian path: more than one node with one more
     * outgoing than incoming edge, more than one with one more incoming than outgoing, or any node that is
     * out of balance by more than one. Must be called before traversal.
     *
     * @throws UserException.NoEulerianPath if the degrees admit no Eulerian path
     */
    public static void validateDegrees( final KmerPairMultigraph graph ) {
        Utils.nonNull(graph, "graph");
        graph.checkNotConsumed("validate the degrees of");

        String startCandidate = null;
        String endCandidate = null;
        for ( final String node : graph.getNodes() ) {
            final int imbalance = graph.getOutDegree(node) - graph.getInDegree(node);
            if ( imbalance == 1 ) {
                if ( startCandidate != null ) {
                    throw new UserException.NoEulerianPath(String.format(
                            "nodes %s and %s both have one more outgoing than incoming edge", startCandidate, node));
                }
                startCandidate = node;
            } else if ( imbalance == -1 ) {
                if ( endCandidate != null ) {
                    throw new UserException.NoEulerianPath(String.format(
                            "nodes %s and %s both have one more incoming than outgoing edge", endCandidate, node));
                }
                endCandidate = node;
            } else if ( imbalance != 0 ) {
                throw new UserException.NoEulerianPath(String.format(
                        "node %s has %d outgoing and %d incoming edges",
                        node, graph.getOutDegree(node), graph.getInDegree(node)));
            }
        }
    }

    /**
     * Confirms that a finished traversal walked every edge: the path must hold exactly one node more than
     * the graph has edges, and no edge may remain unconsumed.
     *
     * @throws UserException.DisconnectedKmerGraph if the traversal left edges behind
     */
    public static void validatePath( final KmerPairMultigraph graph, final List<String> path ) {
        Utils.nonNull(graph, "graph");
        Utils.nonNull(path, "path");
        if ( path.size() != graph.getEdgeCount() + 1 || graph.getRemainingEdgeCount() != 0 ) {
            throw new UserException.DisconnectedKmerGraph(graph.getEdgeCount(), path.size(), graph.getRemainingEdgeCount());
        }
    }
}
