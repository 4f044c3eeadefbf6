package org.broadinstitute.pairasm.utils.kmerpairs;

import org.broadinstitute.pairasm.engine.PairasmPath;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;
import org.broadinstitute.pairasm.utils.io.IOUtils;

import java.io.IOException;
import java.io.PrintStream;

/**
 * Writes k-mer pair files in the format {@link KmerPairFileReader} reads, gzipped if the output ends in ".gz".
 */
public final class KmerPairFileWriter implements AutoCloseable {
    public static final String DEFAULT_DELIMITER = "\t";

    private final PairasmPath output;
    private final String delimiter;
    private final PrintStream out;

    /**
     * @param delimiter column delimiter; empty selects {@link #DEFAULT_DELIMITER}
     */
    public KmerPairFileWriter( final PairasmPath output, final String delimiter ) {
        this.output = Utils.nonNull(output, "output");
        Utils.nonNull(delimiter, "delimiter");
        this.delimiter = delimiter.isEmpty() ? DEFAULT_DELIMITER : delimiter;
        try {
            this.out = IOUtils.makePrintStreamMaybeGzipped(output);
        } catch ( final IOException e ) {
            throw new UserException.CouldNotCreateOutputFile(output, "Could not open k-mer pair output", e);
        }
    }

    public void writeComment( final String comment ) {
        out.println(KmerPairFileReader.COMMENT_PREFIX + " " + comment);
    }

    public void write( final KmerPair pair ) {
        Utils.nonNull(pair, "pair");
        out.println(pair.getSource() + delimiter + pair.getDestination());
    }

    public void write( final GappedReadPair readPair ) {
        Utils.nonNull(readPair, "read pair");
        out.println(readPair.toString());
    }

    @Override
    public void close() {
        out.close();
        if ( out.checkError() ) {
            throw new UserException.CouldNotCreateOutputFile(output, "Error writing k-mer pairs");
        }
    }
}
