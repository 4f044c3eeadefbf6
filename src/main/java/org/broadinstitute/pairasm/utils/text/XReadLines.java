package org.broadinstitute.pairasm.utils.text;

import htsjdk.samtools.util.RuntimeIOException;
import org.broadinstitute.pairasm.utils.Utils;
import org.broadinstitute.pairasm.utils.io.IOUtils;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

/**
 * Iterates over the lines of a text source, optionally trimming them and dropping blank and comment lines.
 *
 * <pre>
 * try ( XReadLines lines = new XReadLines(path, true, "#") ) {
 *     for ( String line : lines ) {
 *         parse(line, lines.getLineNumber());
 *     }
 * }
 * </pre>
 *
 * Line numbers count every physical line, dropped ones included, so they can be quoted in error messages.
 * The source is closed once the last line has been returned.
 */
public final class XReadLines implements Iterator<String>, Iterable<String>, AutoCloseable {

    private final BufferedReader reader;
    private final boolean trim;
    private final String commentPrefix;

    private long physicalLines = 0;
    private String pending;
    private long pendingLineNumber;
    private long lineNumber = 0;

    /**
     * @param path a text file, gzipped if its name ends in ".gz"
     * @param commentPrefix lines starting with this are dropped; {@code null} keeps all lines
     */
    public XReadLines( final Path path, final boolean trim, final String commentPrefix ) throws IOException {
        this(IOUtils.makeReaderMaybeGzipped(Utils.nonNull(path)), trim, commentPrefix);
    }

    public XReadLines( final Reader reader, final boolean trim, final String commentPrefix ) {
        Utils.nonNull(reader);
        this.reader = reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
        this.trim = trim;
        this.commentPrefix = commentPrefix;
        advance();
    }

    private boolean keep( final String line ) {
        if ( trim && line.isEmpty() ) {
            return false;
        }
        return commentPrefix == null || !line.startsWith(commentPrefix);
    }

    private void advance() {
        try {
            String line;
            while ( (line = reader.readLine()) != null ) {
                physicalLines++;
                if ( trim ) {
                    line = line.trim();
                }
                if ( keep(line) ) {
                    break;
                }
            }
            pending = line;
            pendingLineNumber = physicalLines;
            if ( pending == null ) {
                reader.close();
            }
        } catch ( final IOException e ) {
            throw new RuntimeIOException("Error reading line " + (physicalLines + 1), e);
        }
    }

    /**
     * Drains the remaining lines into a list.
     */
    public List<String> readLines() {
        final List<String> lines = new ArrayList<>();
        forEachRemaining(lines::add);
        return lines;
    }

    /**
     * @return the 1-based physical line number of the line last returned by {@link #next()}, or 0 before the first
     */
    public long getLineNumber() {
        return lineNumber;
    }

    @Override
    public Iterator<String> iterator() {
        return this;
    }

    @Override
    public boolean hasNext() {
        return pending != null;
    }

    @Override
    public String next() {
        if ( pending == null ) {
            throw new NoSuchElementException("no lines left");
        }
        final String line = pending;
        lineNumber = pendingLineNumber;
        advance();
        return line;
    }

    @Override
    public void remove() {
        throw new UnsupportedOperationException("lines cannot be removed");
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
