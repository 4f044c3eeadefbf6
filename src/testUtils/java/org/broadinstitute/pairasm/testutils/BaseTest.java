package org.broadinstitute.pairasm.testutils;

import htsjdk.samtools.util.Log;
import org.apache.commons.io.FileUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pairasm.utils.LoggingUtils;
import org.testng.Assert;
import org.testng.annotations.BeforeSuite;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Consumer;

/**
 * Base class of all pairasm tests: quiet logging, per-class test data directories and temp files.
 */
public abstract class BaseTest {

    public static final Logger logger = LogManager.getLogger("org.broadinstitute.pairasm");

    @BeforeSuite
    public void setTestVerbosity() {
        LoggingUtils.setLoggingLevel(Log.LogLevel.WARNING);
    }

    /**
     * @return {@code src/test/resources/<package of the test>/<tested class name>/}
     */
    public String getToolTestDataDir() {
        return "src/test/resources/" + getClass().getPackage().getName().replace('.', '/') + "/" + getTestedClassName() + "/";
    }

    /**
     * The test class name without its "IntegrationTest", "UnitTest" or "Test" suffix.
     */
    public String getTestedClassName() {
        return getClass().getSimpleName().replaceFirst("(Integration|Unit)?Test$", "");
    }

    public File getTestFile( final String fileName ) {
        return new File(getToolTestDataDir(), fileName);
    }

    /**
     * Creates an empty file that is deleted when the JVM exits, together with the FASTA index and dictionary
     * that may be written beside it.
     */
    public static File createTempFile( final String name, final String extension ) {
        try {
            final File file = File.createTempFile(name, extension.startsWith(".") ? extension : "." + extension);
            file.deleteOnExit();
            new File(file.getPath() + ".fai").deleteOnExit();
            final String path = file.getPath();
            new File(path.substring(0, path.lastIndexOf('.')) + ".dict").deleteOnExit();
            return file;
        } catch ( final IOException e ) {
            throw new UncheckedIOException("Cannot create temp file", e);
        }
    }

    /**
     * Writes {@code lines} to a new temp file, one per line.
     */
    public static File writeTempFile( final List<String> lines, final String name, final String extension ) {
        final File file = createTempFile(name, extension);
        try {
            FileUtils.writeLines(file, StandardCharsets.UTF_8.name(), lines);
        } catch ( final IOException e ) {
            throw new UncheckedIOException("Cannot write " + file, e);
        }
        return file;
    }

    public static String captureStderr( final Runnable runnable ) {
        return capture(runnable, System.err, System::setErr);
    }

    public static String captureStdout( final Runnable runnable ) {
        return capture(runnable, System.out, System::setOut);
    }

    private static String capture( final Runnable runnable, final PrintStream original, final Consumer<PrintStream> setter ) {
        final ByteArrayOutputStream captured = new ByteArrayOutputStream();
        setter.accept(new PrintStream(captured, true));
        try {
            runnable.run();
        } finally {
            setter.accept(original);
        }
        return captured.toString();
    }

    public static void assertContains( final String actual, final String expectedSubstring ) {
        Assert.assertTrue(actual.contains(expectedSubstring), expectedSubstring + " was not found in " + actual + ".");
    }
}
