package org.broadinstitute.pairasm.utils.io;

import htsjdk.samtools.util.BlockCompressedInputStream;
import org.broadinstitute.pairasm.engine.PairasmPath;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * File helpers for the pair and FASTA files pairasm reads and writes. A ".gz" name means the file is compressed.
 */
public final class IOUtils {

    private IOUtils() {}

    public static final String GZIP_EXTENSION = ".gz";

    /**
     * Opens {@code path} as UTF-8 text. Files ending in ".gz" may be plain gzip or BGZF.
     */
    public static Reader makeReaderMaybeGzipped( final Path path ) throws IOException {
        // mark support is needed to sniff the BGZF header
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        if ( path.toString().endsWith(GZIP_EXTENSION) ) {
            in = BlockCompressedInputStream.isValidFile(in) ? new BlockCompressedInputStream(in) : new GZIPInputStream(in);
        }
        return new InputStreamReader(in, StandardCharsets.UTF_8);
    }

    /**
     * Opens {@code output} for writing, gzipping on the fly if its name ends in ".gz".
     */
    public static PrintStream makePrintStreamMaybeGzipped( final PairasmPath output ) throws IOException {
        return output.hasExtension(GZIP_EXTENSION)
                ? new PrintStream(new GZIPOutputStream(output.getOutputStream()), false, StandardCharsets.UTF_8.name())
                : new PrintStream(output.getOutputStream(), false, StandardCharsets.UTF_8.name());
    }

    /**
     * @throws UserException.CouldNotReadInputFile unless {@code path} is an existing, readable regular file
     */
    public static void assertFileIsReadable( final Path path ) {
        Utils.nonNull(path);
        if ( !Files.exists(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It doesn't exist.");
        }
        if ( !Files.isRegularFile(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It isn't a regular file");
        }
        if ( !Files.isReadable(path) ) {
            throw new UserException.CouldNotReadInputFile(path, "It is not readable, check the file permissions");
        }
    }
}
