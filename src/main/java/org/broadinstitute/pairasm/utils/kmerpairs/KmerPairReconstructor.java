package org.broadinstitute.pairasm.utils.kmerpairs;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;
import org.broadinstitute.pairasm.utils.config.ConfigFactory;

import java.util.List;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

/**
 * Reconstructs a sequence from k-mer pairs: builds the {@link KmerPairMultigraph}, picks a start with
 * {@link StartNodeSelector}, walks it with an {@link EulerianPathFinder}, checks that every edge was used and
 * spells the path with {@link KmerPathStitcher}.
 *
 * The caller gets either the complete sequence or a typed failure, never a truncated sequence:
 * <ul>
 *     <li>{@link UserException.EmptyKmerPairInput} when there are no pairs,</li>
 *     <li>{@link UserException.NoEulerianPath} when degree validation is on and the degrees rule out a path, or when
 *     the walk gets stuck at a branch no single path can cover,</li>
 *     <li>{@link UserException.DisconnectedKmerGraph} when the walk leaves edges unused,</li>
 *     <li>{@link EulerianPathFinder.TraversalAbortedException} when the walk is cancelled.</li>
 * </ul>
 */
public final class KmerPairReconstructor {
    private static final Logger logger = LogManager.getLogger(KmerPairReconstructor.class);

    private final boolean validateDegrees;
    private final EulerianPathFinder pathFinder;

    /** A reconstructor configured from the {@link org.broadinstitute.pairasm.utils.config.PairasmConfig}, never aborting. */
    public KmerPairReconstructor() {
        this(() -> false);
    }

    /** A reconstructor configured from the {@link org.broadinstitute.pairasm.utils.config.PairasmConfig}. */
    public KmerPairReconstructor( final BooleanSupplier abortSignal ) {
        this(ConfigFactory.getInstance().getPairasmConfig().validate_degrees_before_traversal(),
             EulerianPathFinder.fromConfig(abortSignal));
    }

    public KmerPairReconstructor( final boolean validateDegrees, final EulerianPathFinder pathFinder ) {
        this.validateDegrees = validateDegrees;
        this.pathFinder = Utils.nonNull(pathFinder, "path finder");
    }

    /**
     * @return the sequence spelled by the Eulerian path through {@code pairs}
     */
    public String reconstruct( final List<KmerPair> pairs ) {
        return reconstructPath(pairs).getSequence();
    }

    /**
     * @return the path walked through {@code pairs} together with the sequence it spells
     */
    public KmerPairReconstruction reconstructPath( final List<KmerPair> pairs ) {
        return traverse(pairs, KmerPathStitcher::stitch);
    }

    /**
     * Reconstructs from read pairs of k-mers separated by {@code gap} bases, through the paired de Bruijn graph
     * built by {@link KmerPairDecomposer#toPairedDeBruijnEdges}.
     *
     * @throws UserException.InconsistentReadPairs if the two reads of the pairs spell different sequences
     */
    public String reconstructFromReadPairs( final List<GappedReadPair> readPairs, final int gap ) {
        Utils.nonNull(readPairs, "read pairs");
        Utils.validateArg(gap >= 0, "gap may not be negative");
        if ( readPairs.isEmpty() ) {
            throw new UserException.EmptyKmerPairInput();
        }
        final int kmerSize = readPairs.get(0).getKmerSize();
        return traverse(KmerPairDecomposer.toPairedDeBruijnEdges(readPairs),
                        path -> KmerPathStitcher.stitchGapped(path, kmerSize, gap)).getSequence();
    }

    private KmerPairReconstruction traverse( final List<KmerPair> pairs, final Function<List<String>, String> speller ) {
        Utils.containsNoNull(pairs, "k-mer pairs may not be null");
        if ( pairs.isEmpty() ) {
            throw new UserException.EmptyKmerPairInput();
        }

        final KmerPairMultigraph graph = KmerPairMultigraph.fromPairs(pairs);
        if ( validateDegrees ) {
            EulerianPathValidator.validateDegrees(graph);
        }
        final String startNode = StartNodeSelector.selectStartNode(graph);
        logger.debug("Starting traversal of " + graph.getEdgeCount() + " edges at " + startNode);

        final List<String> path = pathFinder.findPath(graph, startNode);
        EulerianPathValidator.validatePath(graph, path);
        return new KmerPairReconstruction(path, startNode, graph.getEdgeCount(), speller.apply(path));
    }
}
