package org.broadinstitute.pairasm.utils.kmerpairs;

import org.broadinstitute.pairasm.PairasmBaseTest;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.broadinstitute.pairasm.utils.kmerpairs.KmerPairMultigraphUnitTest.pairs;

public final class KmerPairReconstructorUnitTest extends PairasmBaseTest {

    // no 5-mer occurs twice, so the 5-mer pairs admit exactly one path
    private static final String UNIQUE_PATH_SEQUENCE = "GATTACAGGCTTCAACGTAGCCTATGCAGTCAAGGTCTCCATGAACTTGGCTAGC";

    private static KmerPairReconstructor reconstructor( final boolean validateDegrees ) {
        return new KmerPairReconstructor(validateDegrees, new EulerianPathFinder());
    }

    @Test
    public void testReconstruct() {
        Assert.assertEquals(reconstructor(false).reconstruct(pairs("AC", "CT", "CT", "TG", "TG", "GA")), "ACTGA");
        Assert.assertEquals(reconstructor(true).reconstruct(pairs("AC", "CT", "CT", "TG", "TG", "GA")), "ACTGA");
    }

    @Test
    public void testReconstructIgnoresInputOrder() {
        Assert.assertEquals(reconstructor(false).reconstruct(pairs("TG", "GA", "AC", "CT", "CT", "TG")), "ACTGA");
    }

    @Test
    public void testReconstructPath() {
        final KmerPairReconstruction reconstruction = reconstructor(false).reconstructPath(pairs("AC", "CT", "CT", "TG", "TG", "GA"));
        Assert.assertEquals(reconstruction.getPath(), Arrays.asList("AC", "CT", "TG", "GA"));
        Assert.assertEquals(reconstruction.getStartNode(), "AC");
        Assert.assertEquals(reconstruction.getEdgeCount(), 3);
        Assert.assertEquals(reconstruction.getSequence(), "ACTGA");
    }

    @Test
    public void testSinglePair() {
        Assert.assertEquals(reconstructor(false).reconstruct(pairs("ACG", "CGT")), "ACGT");
    }

    @Test
    public void testCircuit() {
        Assert.assertEquals(reconstructor(true).reconstruct(pairs("AB", "BC", "BC", "CA", "CA", "AB")), "ABCAB");
    }

    @Test(expectedExceptions = UserException.EmptyKmerPairInput.class)
    public void testEmptyInput() {
        reconstructor(false).reconstruct(Collections.emptyList());
    }

    @Test(expectedExceptions = UserException.DisconnectedKmerGraph.class)
    public void testDisconnectedChains() {
        reconstructor(false).reconstruct(pairs("AA", "AB", "CC", "CD"));
    }

    @Test(expectedExceptions = UserException.DisconnectedKmerGraph.class)
    public void testDisconnectedCircuits() {
        // balanced, so even degree validation lets it through to the walk
        reconstructor(true).reconstruct(pairs("AB", "BA", "BA", "AB", "CD", "DC", "DC", "CD"));
    }

    @Test(expectedExceptions = UserException.NoEulerianPath.class)
    public void testDegreeValidation() {
        reconstructor(true).reconstruct(pairs("AA", "AB", "CC", "CD"));
    }

    @Test(expectedExceptions = UserException.NoEulerianPath.class)
    public void testBranchWithoutDegreeValidation() {
        reconstructor(false).reconstruct(pairs("AB", "BC", "AB", "BD"));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNullInput() {
        reconstructor(false).reconstruct(null);
    }

    @Test
    public void testDefaultConstructorUsesConfiguration() {
        Assert.assertEquals(new KmerPairReconstructor().reconstruct(pairs("AC", "CT", "CT", "TG", "TG", "GA")), "ACTGA");
    }

    @Test
    public void testInputIsNotModified() {
        final List<KmerPair> input = pairs("TG", "GA", "AC", "CT", "CT", "TG");
        final List<KmerPair> before = new ArrayList<>(input);
        reconstructor(false).reconstruct(input);
        Assert.assertEquals(input, before);
    }

    @DataProvider(name = "shuffleSeeds")
    public Object[][] shuffleSeeds() {
        return new Object[][] { { 1L }, { 17L }, { 4242L }, { 90210L } };
    }

    @Test(dataProvider = "shuffleSeeds")
    public void testShuffledRoundTrip( final long seed ) {
        final List<KmerPair> input = KmerPairDecomposer.toKmerPairs(UNIQUE_PATH_SEQUENCE, 5);
        Collections.shuffle(input, new Random(seed));
        final KmerPairReconstruction reconstruction = reconstructor(true).reconstructPath(input);
        Assert.assertEquals(reconstruction.getSequence(), UNIQUE_PATH_SEQUENCE);
        Assert.assertEquals(reconstruction.getPath().size(), input.size() + 1);
    }

    @Test
    public void testRandomSequenceRoundTrip() {
        final Random random = Utils.getRandomGenerator();
        final StringBuilder sb = new StringBuilder();
        for ( int idx = 0; idx < 2000; ++idx ) {
            sb.append("ACGT".charAt(random.nextInt(4)));
        }
        final String sequence = sb.toString();
        // 31-mers of a random sequence this short are all but certainly unique
        final List<KmerPair> input = KmerPairDecomposer.toKmerPairs(sequence, 31);
        Collections.shuffle(input, random);
        Assert.assertEquals(reconstructor(false).reconstruct(input), sequence);
    }

    @Test
    public void testReconstructFromReadPairs() {
        final String sequence = "TAATGCCATGGGATGTT";
        final List<GappedReadPair> readPairs = KmerPairDecomposer.toGappedReadPairs(sequence, 3, 1);
        Assert.assertEquals(reconstructor(false).reconstructFromReadPairs(readPairs, 1), sequence);

        Collections.reverse(readPairs);
        Assert.assertEquals(reconstructor(false).reconstructFromReadPairs(readPairs, 1), sequence);
    }

    @Test(expectedExceptions = UserException.EmptyKmerPairInput.class)
    public void testReconstructFromNoReadPairs() {
        reconstructor(false).reconstructFromReadPairs(Collections.emptyList(), 1);
    }

    @Test(expectedExceptions = UserException.InconsistentReadPairs.class)
    public void testReconstructFromReadPairsWithWrongGap() {
        final List<GappedReadPair> readPairs = KmerPairDecomposer.toGappedReadPairs("TAATGCCATGGGATGTT", 3, 1);
        reconstructor(false).reconstructFromReadPairs(readPairs, 0);
    }
}
