package org.broadinstitute.pairasm.utils.kmerpairs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;

/**
 * Chooses where an Eulerian traversal begins.
 *
 * The start is the first source node, in insertion order, whose outdegree exceeds its indegree. When there is
 * none the graph is balanced (a closed circuit, if it is connected) and the first source node is used.
 */
public final class StartNodeSelector {
    private static final Logger logger = LogManager.getLogger(StartNodeSelector.class);

    private StartNodeSelector() {}

    /**
     * @throws UserException.EmptyKmerPairInput if the graph has no edges
     */
    public static String selectStartNode( final KmerPairMultigraph graph ) {
        Utils.nonNull(graph, "graph");
        graph.checkNotConsumed("select a start node in");
        if ( graph.getSourceNodes().isEmpty() ) {
            throw new UserException.EmptyKmerPairInput("the graph has no edges");
        }

        String firstSource = null;
        for ( final String node : graph.getSourceNodes() ) {
            if ( firstSource == null ) {
                firstSource = node;
            }
            if ( graph.getOutDegree(node) > graph.getInDegree(node) ) {
                return node;
            }
        }
        logger.debug("No node has more outgoing than incoming edges; starting the circuit at " + firstSource);
        return firstSource;
    }
}
