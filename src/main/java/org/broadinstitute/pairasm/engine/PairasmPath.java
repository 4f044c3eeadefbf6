package org.broadinstitute.pairasm.engine;

import htsjdk.io.HtsPath;
import htsjdk.samtools.util.RuntimeIOException;
import org.broadinstitute.pairasm.exceptions.UserException;

import java.io.InputStream;
import java.io.OutputStream;

/**
 * An input or output argument of a pairasm tool, given as a local file name or a URI.
 * Failures to open it are reported as {@link UserException}s that quote the value the user typed.
 */
public class PairasmPath extends HtsPath {
    private static final long serialVersionUID = 1L;

    public PairasmPath( final String uriString ) {
        super(uriString);
    }

    private void requirePath() {
        if ( !isPath() ) {
            throw new UserException(getToPathFailureReason());
        }
    }

    @Override
    public InputStream getInputStream() {
        requirePath();
        try {
            return super.getInputStream();
        } catch ( final RuntimeIOException e ) {
            throw new UserException.CouldNotReadInputFile(this, "Can't create input stream", e);
        }
    }

    @Override
    public OutputStream getOutputStream() {
        requirePath();
        try {
            return super.getOutputStream();
        } catch ( final RuntimeIOException e ) {
            throw new UserException.CouldNotCreateOutputFile(this, "Can't create output stream", e);
        }
    }
}
