package org.broadinstitute.pairasm.tools;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.reference.FastaReferenceWriter;
import htsjdk.samtools.reference.FastaReferenceWriterBuilder;
import htsjdk.samtools.util.SequenceUtil;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.pairasm.cmdline.CommandLineProgram;
import org.broadinstitute.pairasm.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pairasm.cmdline.programgroups.AssemblyProgramGroup;
import org.broadinstitute.pairasm.engine.PairasmPath;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.config.ConfigFactory;
import org.broadinstitute.pairasm.utils.kmerpairs.*;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconstructs the sequence spelled by a set of k-mer pairs and writes it as a single-record FASTA file.
 *
 * <p>Each pair is an edge between two k-mers. The pairs form a directed multigraph and the sequence is
 * spelled by an Eulerian path through it, a walk that uses every pair exactly once. The input order of the
 * pairs does not matter.</p>
 *
 * <h3>Input</h3>
 * <p>A text file, optionally gzipped, with one pair per line as {@code source<delimiter>destination}.
 * Blank lines and lines starting with '#' are ignored. With {@code --read-pairs}, each line instead holds
 * two k-mers separated by {@code --gap} bases in the sequence, written {@code first|second}.</p>
 *
 * <h3>Output</h3>
 * <p>A FASTA file with the reconstructed sequence, plus its index and sequence dictionary.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   pairasm ReconstructSequenceFromKmerPairs \
 *     -I pairs.txt \
 *     -O reconstructed.fasta
 * </pre>
 *
 * <p>The tool fails, writing nothing, if the pairs cannot all be used by a single walk, or if the k-mers spell
 * something other than IUPAC nucleotide codes.</p>
 */
@CommandLineProgramProperties(
        summary = "Reconstructs a sequence from k-mer pairs (or gapped read pairs) by walking an Eulerian path " +
                "through the multigraph they form, and writes it as a FASTA file.",
        oneLineSummary = "Reconstruct a sequence from k-mer pairs",
        programGroup = AssemblyProgramGroup.class
)
@DocumentedFeature
public final class ReconstructSequenceFromKmerPairs extends CommandLineProgram {

    public static final String READ_PAIRS_LONG_NAME = "read-pairs";
    public static final String VALIDATE_DEGREES_LONG_NAME = "validate-degrees";
    public static final String DEFAULT_SEQUENCE_NAME = "reconstructed";
    public static final int FASTA_BASES_PER_LINE = 60;

    @Argument(shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
              fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
              doc = "File of k-mer pairs, one per line")
    public PairasmPath input;

    @Argument(shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
              fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
              doc = "FASTA file to which the reconstructed sequence is written")
    public PairasmPath output;

    @Argument(fullName = StandardArgumentDefinitions.SEQUENCE_NAME_LONG_NAME,
              doc = "Name of the reconstructed sequence in the output FASTA",
              optional = true)
    public String sequenceName = DEFAULT_SEQUENCE_NAME;

    @Argument(fullName = StandardArgumentDefinitions.DELIMITER_LONG_NAME,
              doc = "Column delimiter of the pair file; empty splits on any whitespace",
              optional = true)
    public String delimiter = ConfigFactory.getInstance().getPairasmConfig().kmer_pair_delimiter();

    @Argument(fullName = READ_PAIRS_LONG_NAME,
              doc = "Input lines are gapped read pairs written first|second rather than k-mer pairs",
              optional = true)
    public boolean readPairs = false;

    @Argument(shortName = StandardArgumentDefinitions.GAP_SHORT_NAME,
              fullName = StandardArgumentDefinitions.GAP_LONG_NAME,
              doc = "Number of bases between the two k-mers of each read pair",
              minValue = 0,
              optional = true)
    public Integer gap = null;

    @Argument(fullName = VALIDATE_DEGREES_LONG_NAME,
              doc = "Reject inputs whose node degrees rule out an Eulerian path before walking the graph",
              optional = true)
    public boolean validateDegrees = ConfigFactory.getInstance().getPairasmConfig().validate_degrees_before_traversal();

    @Override
    protected String[] customCommandLineValidation() {
        final List<String> errors = new ArrayList<>();
        if ( readPairs && gap == null ) {
            errors.add("--" + StandardArgumentDefinitions.GAP_LONG_NAME + " is required with --" + READ_PAIRS_LONG_NAME);
        }
        if ( !readPairs && gap != null ) {
            errors.add("--" + StandardArgumentDefinitions.GAP_LONG_NAME + " only applies with --" + READ_PAIRS_LONG_NAME);
        }
        if ( sequenceName == null || sequenceName.trim().isEmpty() ) {
            errors.add("--" + StandardArgumentDefinitions.SEQUENCE_NAME_LONG_NAME + " may not be blank");
        }
        return errors.isEmpty() ? null : errors.toArray(new String[0]);
    }

    @Override
    protected Object doWork() {
        final KmerPairReconstructor reconstructor = makeReconstructor();
        final KmerPairFileReader reader = new KmerPairFileReader(input, delimiter);

        final String sequence;
        if ( readPairs ) {
            final List<GappedReadPair> pairs = reader.readGappedReadPairs();
            logger.info("Reconstructing from " + pairs.size() + " read pairs with gap " + gap);
            sequence = reconstructor.reconstructFromReadPairs(pairs, gap);
        } else {
            final List<KmerPair> pairs = reader.readKmerPairs();
            logger.info("Reconstructing from " + pairs.size() + " k-mer pairs");
            final KmerPairReconstruction reconstruction = reconstructor.reconstructPath(pairs);
            logger.info("Walked " + reconstruction.getEdgeCount() + " edges starting at " + reconstruction.getStartNode());
            sequence = reconstruction.getSequence();
        }

        writeFasta(sequence);
        logger.info("Wrote " + sequence.length() + " bases to " + output.getRawInputString());
        return sequence.length();
    }

    private KmerPairReconstructor makeReconstructor() {
        if ( !validateDegrees ) {
            logger.info("Degree validation is disabled; graphs without an Eulerian path are reported after traversal");
        }
        return new KmerPairReconstructor(validateDegrees,
                EulerianPathFinder.fromConfig(() -> Thread.currentThread().isInterrupted()));
    }

    /**
     * @throws UserException.NonNucleotideSequence at the first character FASTA output would reject
     */
    @VisibleForTesting
    static void checkWritableAsFasta( final String sequenceName, final String sequence ) {
        for ( int i = 0; i < sequence.length(); i++ ) {
            final char base = sequence.charAt(i);
            if ( base > Byte.MAX_VALUE || !SequenceUtil.isIUPAC((byte) base) ) {
                throw new UserException.NonNucleotideSequence(sequenceName, i, base);
            }
        }
    }

    private void writeFasta( final String sequence ) {
        // checked up front so that a rejected sequence leaves no partial FASTA behind
        checkWritableAsFasta(sequenceName, sequence);
        try ( final FastaReferenceWriter writer = new FastaReferenceWriterBuilder()
                .setFastaFile(output.toPath())
                .setBasesPerLine(FASTA_BASES_PER_LINE)
                .build() ) {
            writer.startSequence(sequenceName);
            writer.appendBases(sequence);
        } catch ( final IOException e ) {
            throw new UserException.CouldNotCreateOutputFile(output, "Error writing the reconstructed sequence", e);
        }
    }
}
