package org.broadinstitute.pairasm.cmdline;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.barclay.argparser.Argument;
import org.broadinstitute.barclay.argparser.ArgumentCollection;
import org.broadinstitute.barclay.argparser.CommandLineArgumentParser;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineParser;
import org.broadinstitute.barclay.argparser.SpecialArgumentsCollection;
import org.broadinstitute.pairasm.engine.PairasmPath;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.LoggingUtils;
import org.broadinstitute.pairasm.utils.config.ConfigFactory;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;

/**
 * Base class of the pairasm tools.
 *
 * A tool declares its options as {@link Argument}-annotated fields, may check combinations of them in
 * {@link #customCommandLineValidation()}, and does its work in {@link #doWork()}. Exceptions thrown by
 * {@code doWork()} are not caught here; {@link org.broadinstitute.pairasm.Main} maps them to exit codes.
 */
public abstract class CommandLineProgram {

    // instance field so that messages carry the concrete tool's name
    protected final Logger logger = LogManager.getLogger(this.getClass());

    @Argument(fullName = StandardArgumentDefinitions.TMP_DIR_NAME, common = true, optional = true,
              doc = "Temp directory to use.")
    public PairasmPath tmpDir;

    @ArgumentCollection(doc = "Special arguments that have meaning to the argument parsing system.")
    public SpecialArgumentsCollection specialArgumentsCollection = new SpecialArgumentsCollection();

    @Argument(fullName = StandardArgumentDefinitions.VERBOSITY_NAME, shortName = StandardArgumentDefinitions.VERBOSITY_NAME,
              doc = "Control verbosity of logging.", common = true, optional = true)
    public Log.LogLevel VERBOSITY = Log.LogLevel.INFO;

    @Argument(fullName = StandardArgumentDefinitions.QUIET_NAME, doc = "Whether to suppress the start and finish messages.",
              common = true, optional = true)
    public Boolean QUIET = false;

    // Read by Main before the tool is built, since argument defaults come from the configuration.
    // Declared here so that the parser accepts it and it shows in the usage.
    @Argument(fullName = StandardArgumentDefinitions.PAIRASM_CONFIG_FILE_OPTION,
              doc = "A properties file overriding the pairasm configuration.", common = true, optional = true)
    public String PAIRASM_CONFIG_FILE = null;

    private CommandLineParser commandLineParser;

    /**
     * @return the result of the tool, which {@link org.broadinstitute.pairasm.Main} hands back to its caller
     */
    protected abstract Object doWork();

    /**
     * Checks argument combinations the annotations cannot express. Runs after parsing.
     *
     * @return a message per problem, or {@code null} if the arguments are fine
     */
    protected String[] customCommandLineValidation() {
        return null;
    }

    /**
     * Parses {@code argv} and runs the tool.
     *
     * @return the result of {@link #doWork()}, or {@code null} if only help or version output was asked for
     */
    public Object instanceMain( final String[] argv ) {
        if ( !parseArgs(argv) ) {
            return null;
        }

        LoggingUtils.setLoggingLevel(VERBOSITY);
        useTempDirectory();
        if ( !QUIET ) {
            logger.info("Running " + getClass().getSimpleName() + " " + getVersion());
            logger.debug("Command line: " + getCommandLineParser().getCommandLine());
        }
        ConfigFactory.logConfigFields(ConfigFactory.getInstance().getPairasmConfig(), Log.LogLevel.DEBUG);

        final long start = System.nanoTime();
        try {
            return doWork();
        } finally {
            if ( !QUIET ) {
                logger.info(String.format("%s finished in %.2f seconds", getClass().getSimpleName(),
                        (System.nanoTime() - start) / 1e9));
            }
        }
    }

    private void useTempDirectory() {
        if ( tmpDir == null ) {
            tmpDir = new PairasmPath(System.getProperty("java.io.tmpdir"));
        }
        final Path dir = tmpDir.toPath();
        if ( !Files.isDirectory(dir) || !Files.isReadable(dir) || !Files.isWritable(dir) ) {
            throw new UserException.BadTempDir(dir, "it must be a directory with read and write access");
        }
        System.setProperty("java.io.tmpdir", dir.toAbsolutePath().toString());
    }

    private String getVersion() {
        final String version = getClass().getPackage().getImplementationVersion();
        return version != null ? version : "(development version)";
    }

    /**
     * @return {@code false} if the arguments only asked for help or the version, which the parser has already printed
     * @throws CommandLineException if the arguments do not parse or fail {@link #customCommandLineValidation()}
     */
    protected final boolean parseArgs( final String[] argv ) {
        if ( !getCommandLineParser().parseArguments(System.err, argv) ) {
            return false;
        }

        final String[] problems = customCommandLineValidation();
        if ( problems != null ) {
            throw new CommandLineException("Command Line Validation failed: " + String.join(", ", Arrays.asList(problems)));
        }
        return true;
    }

    public final String getUsage() {
        return getCommandLineParser().usage(true, specialArgumentsCollection.SHOW_HIDDEN);
    }

    @VisibleForTesting
    public CommandLineParser getCommandLineParser() {
        if ( commandLineParser == null ) {
            commandLineParser = new CommandLineArgumentParser(this, Collections.emptyList(), Collections.emptySet());
        }
        return commandLineParser;
    }
}
