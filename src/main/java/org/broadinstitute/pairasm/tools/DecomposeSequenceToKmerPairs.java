package org.broadinstitute.pairasm.tools;

import htsjdk.samtools.reference.FastaSequenceFile;
import htsjdk.samtools.reference.ReferenceSequence;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.barclay.help.DocumentedFeature;
import org.broadinstitute.pairasm.cmdline.CommandLineProgram;
import org.broadinstitute.pairasm.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pairasm.cmdline.programgroups.AssemblyProgramGroup;
import org.broadinstitute.pairasm.engine.PairasmPath;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;
import org.broadinstitute.pairasm.utils.config.ConfigFactory;
import org.broadinstitute.pairasm.utils.io.IOUtils;
import org.broadinstitute.pairasm.utils.kmerpairs.GappedReadPair;
import org.broadinstitute.pairasm.utils.kmerpairs.KmerPair;
import org.broadinstitute.pairasm.utils.kmerpairs.KmerPairDecomposer;
import org.broadinstitute.pairasm.utils.kmerpairs.KmerPairFileWriter;

import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Breaks a FASTA sequence into the k-mer pairs {@link ReconstructSequenceFromKmerPairs} reads.
 *
 * <p>Every pair of consecutive overlapping k-mers becomes one line of the output. With {@code --gap}, the output
 * is instead one gapped read pair per position: the k-mer starting there and the k-mer starting {@code k + gap}
 * bases later. Only the first record of the FASTA is decomposed.</p>
 *
 * <h3>Usage example</h3>
 * <pre>
 *   pairasm DecomposeSequenceToKmerPairs \
 *     -I sequence.fasta \
 *     -k 5 \
 *     --shuffle \
 *     -O pairs.txt
 * </pre>
 */
@CommandLineProgramProperties(
        summary = "Decomposes the first sequence of a FASTA file into k-mer pairs, or gapped read pairs, " +
                "written one per line.",
        oneLineSummary = "Decompose a sequence into k-mer pairs",
        programGroup = AssemblyProgramGroup.class
)
@DocumentedFeature
public final class DecomposeSequenceToKmerPairs extends CommandLineProgram {

    public static final String SHUFFLE_LONG_NAME = "shuffle";
    public static final String RANDOM_SEED_LONG_NAME = "random-seed";

    @Argument(shortName = StandardArgumentDefinitions.INPUT_SHORT_NAME,
              fullName = StandardArgumentDefinitions.INPUT_LONG_NAME,
              doc = "FASTA file holding the sequence to decompose")
    public PairasmPath input;

    @Argument(shortName = StandardArgumentDefinitions.OUTPUT_SHORT_NAME,
              fullName = StandardArgumentDefinitions.OUTPUT_LONG_NAME,
              doc = "Pair file to write, gzipped if the name ends in .gz")
    public PairasmPath output;

    @Argument(shortName = StandardArgumentDefinitions.KMER_SIZE_SHORT_NAME,
              fullName = StandardArgumentDefinitions.KMER_SIZE_LONG_NAME,
              doc = "Length of each k-mer",
              minValue = 1)
    public int kmerSize;

    @Argument(shortName = StandardArgumentDefinitions.GAP_SHORT_NAME,
              fullName = StandardArgumentDefinitions.GAP_LONG_NAME,
              doc = "Emit gapped read pairs whose k-mers are this many bases apart",
              minValue = 0,
              optional = true)
    public Integer gap = null;

    @Argument(fullName = StandardArgumentDefinitions.DELIMITER_LONG_NAME,
              doc = "Column delimiter of the pair file; empty writes tabs",
              optional = true)
    public String delimiter = ConfigFactory.getInstance().getPairasmConfig().kmer_pair_delimiter();

    @Argument(fullName = SHUFFLE_LONG_NAME,
              doc = "Write the pairs in random order",
              optional = true)
    public boolean shuffle = false;

    @Argument(fullName = RANDOM_SEED_LONG_NAME,
              doc = "Seed for --" + SHUFFLE_LONG_NAME + "; the toolkit's fixed seed is used if absent",
              optional = true)
    public Long randomSeed = null;

    @Override
    protected String[] customCommandLineValidation() {
        if ( gap != null && kmerSize < 2 ) {
            return new String[]{"--" + StandardArgumentDefinitions.KMER_SIZE_LONG_NAME + " must be at least 2 for read pairs"};
        }
        return null;
    }

    @Override
    protected Object doWork() {
        final ReferenceSequence sequence = readFirstSequence();
        final String bases = sequence.getBaseString();
        logger.info("Decomposing " + sequence.getName() + " (" + bases.length() + " bases) with k = " + kmerSize);

        final int nWritten;
        try ( final KmerPairFileWriter writer = new KmerPairFileWriter(output, delimiter) ) {
            writer.writeComment("source=" + sequence.getName() + " k=" + kmerSize + (gap == null ? "" : " gap=" + gap));
            if ( gap == null ) {
                final List<KmerPair> pairs = KmerPairDecomposer.toKmerPairs(bases, kmerSize);
                maybeShuffle(pairs);
                pairs.forEach(writer::write);
                nWritten = pairs.size();
            } else {
                final List<GappedReadPair> readPairs = KmerPairDecomposer.toGappedReadPairs(bases, kmerSize, gap);
                maybeShuffle(readPairs);
                readPairs.forEach(writer::write);
                nWritten = readPairs.size();
            }
        }

        if ( nWritten == 0 ) {
            Utils.warnUser(logger, "The sequence " + sequence.getName() + " is too short to yield any pairs with k = " + kmerSize +
                    (gap == null ? "" : " and gap = " + gap) + ". The output holds only its header comment.");
        }
        logger.info("Wrote " + nWritten + (gap == null ? " k-mer pairs" : " read pairs") + " to " + output.getRawInputString());
        return nWritten;
    }

    private ReferenceSequence readFirstSequence() {
        IOUtils.assertFileIsReadable(input.toPath());
        try ( final FastaSequenceFile fasta = new FastaSequenceFile(input.toPath(), true) ) {
            final ReferenceSequence first = fasta.nextSequence();
            if ( first == null ) {
                throw new UserException.BadInput("The FASTA file " + input.getRawInputString() + " holds no sequences");
            }
            if ( fasta.nextSequence() != null ) {
                logger.warn("Only the first sequence of " + input.getRawInputString() + ", " + first.getName() + ", is decomposed");
            }
            return first;
        }
    }

    private <T> void maybeShuffle( final List<T> items ) {
        if ( shuffle ) {
            final Random random = randomSeed == null ? Utils.getRandomGenerator() : new Random(randomSeed);
            Collections.shuffle(items, random);
        }
    }
}
