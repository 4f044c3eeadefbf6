package org.broadinstitute.pairasm.utils.kmerpairs;

import java.util.Collections;
import java.util.List;

/** The outcome of a successful reconstruction: the node path walked and the sequence it spells. */
public final class KmerPairReconstruction {
    private final List<String> path;
    private final String startNode;
    private final int edgeCount;
    private final String sequence;

    public KmerPairReconstruction( final List<String> path, final String startNode,
                                   final int edgeCount, final String sequence ) {
        this.path = Collections.unmodifiableList(path);
        this.startNode = startNode;
        this.edgeCount = edgeCount;
        this.sequence = sequence;
    }

    public List<String> getPath() { return path; }
    public String getStartNode() { return startNode; }
    public int getEdgeCount() { return edgeCount; }
    public String getSequence() { return sequence; }

    @Override
    public String toString() {
        return "KmerPairReconstruction{start=" + startNode + ", edges=" + edgeCount +
                ", length=" + sequence.length() + "}";
    }
}
