package org.broadinstitute.pairasm.utils.kmerpairs;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pairasm.engine.PairasmPath;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;
import org.broadinstitute.pairasm.utils.io.IOUtils;
import org.broadinstitute.pairasm.utils.text.XReadLines;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads k-mer pair files: plain text, optionally gzipped, one pair per line. Blank lines and lines starting with
 * {@link #COMMENT_PREFIX} are skipped.
 *
 * A line holds either a k-mer pair, {@code source<delimiter>destination}, or a gapped read pair,
 * {@code first|second}. An empty delimiter splits on any run of whitespace.
 */
public final class KmerPairFileReader {
    private static final Logger logger = LogManager.getLogger(KmerPairFileReader.class);

    public static final String COMMENT_PREFIX = "#";

    private final PairasmPath input;
    private final String delimiter;

    public KmerPairFileReader( final PairasmPath input, final String delimiter ) {
        this.input = Utils.nonNull(input, "input");
        this.delimiter = Utils.nonNull(delimiter, "delimiter");
    }

    /**
     * @return the k-mer pairs of the file, in file order
     * @throws UserException.MalformedKmerPair if a line is not two non-empty labels
     */
    public List<KmerPair> readKmerPairs() {
        final List<KmerPair> pairs = new ArrayList<>();
        try ( final XReadLines lines = openLines() ) {
            for ( final String line : lines ) {
                final List<String> columns = splitColumns(line);
                if ( columns.size() != 2 ) {
                    throw new UserException.MalformedKmerPair(input.getRawInputString(), lines.getLineNumber(), line,
                            "expected 2 columns but found " + columns.size());
                }
                try {
                    pairs.add(KmerPair.of(columns.get(0), columns.get(1)));
                } catch ( final IllegalArgumentException e ) {
                    throw new UserException.MalformedKmerPair(input.getRawInputString(), lines.getLineNumber(), line, e.getMessage());
                }
            }
        } catch ( final IOException e ) {
            throw new UserException.CouldNotReadInputFile(input, "Error reading k-mer pairs", e);
        }
        logger.debug("Read " + pairs.size() + " k-mer pairs from " + input.getRawInputString());
        return pairs;
    }

    /**
     * @return the gapped read pairs of the file, in file order
     * @throws UserException.MalformedKmerPair if a line is not two equal-length k-mers joined by {@link GappedReadPair#SEPARATOR}
     */
    public List<GappedReadPair> readGappedReadPairs() {
        final List<GappedReadPair> readPairs = new ArrayList<>();
        try ( final XReadLines lines = openLines() ) {
            for ( final String line : lines ) {
                try {
                    readPairs.add(GappedReadPair.parse(line));
                } catch ( final IllegalArgumentException e ) {
                    throw new UserException.MalformedKmerPair(input.getRawInputString(), lines.getLineNumber(), line, e.getMessage());
                }
            }
        } catch ( final IOException e ) {
            throw new UserException.CouldNotReadInputFile(input, "Error reading read pairs", e);
        }
        logger.debug("Read " + readPairs.size() + " read pairs from " + input.getRawInputString());
        return readPairs;
    }

    private XReadLines openLines() throws IOException {
        IOUtils.assertFileIsReadable(input.toPath());
        return new XReadLines(input.toPath(), true, COMMENT_PREFIX);
    }

    private List<String> splitColumns( final String line ) {
        if ( delimiter.isEmpty() ) {
            return Arrays.asList(StringUtils.split(line));
        }
        return Utils.split(line, delimiter);
    }
}
