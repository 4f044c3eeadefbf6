package org.broadinstitute.pairasm.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.LoggingUtils;
import org.broadinstitute.pairasm.utils.Utils;
import org.broadinstitute.pairasm.utils.io.IOUtils;

import java.io.IOException;
import java.io.Reader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Set;
import java.util.TreeSet;

/**
 * Owns the process-wide {@link PairasmConfig}.
 *
 * The config is built once from its {@code @Sources} through the {@link org.aeonbits.owner} cache. A file given on the
 * command line is then loaded over it, so its values win over every source.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    private static final ConfigFactory instance = new ConfigFactory();

    public static ConfigFactory getInstance() {
        return instance;
    }

    private ConfigFactory() {}

    /**
     * @return the shared {@link PairasmConfig}, created from its sources on first use
     */
    public PairasmConfig getPairasmConfig() {
        return ConfigCache.getOrCreate(PairasmConfig.class);
    }

    /**
     * Finds the value given to {@code configFileOption} in a raw argument list. Only the first occurrence counts.
     *
     * @return the file name, or {@code null} if the option is absent
     * @throws UserException.BadInput if the option is the last argument or is followed by another option
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        for ( int i = 0; i < args.length; i++ ) {
            if ( !args[i].equals(configFileOption) ) {
                continue;
            }
            if ( i + 1 == args.length || args[i + 1].startsWith("-") ) {
                throw new UserException.BadInput("No configuration file given after " + configFileOption);
            }
            return args[i + 1];
        }
        return null;
    }

    /**
     * Loads the configuration file named by {@code configFileOption}, if any, over the shared config.
     * Runs before the tool's own arguments are parsed so that config-driven argument defaults see the file.
     */
    public synchronized void initializeConfigurationsFromCommandLineArgs( final String[] args, final String configFileOption ) {
        final String configFileName = getConfigFilenameFromArgs(args, configFileOption);
        if ( configFileName != null ) {
            loadConfigFile(getPairasmConfig(), Paths.get(configFileName));
        }
    }

    @VisibleForTesting
    static void loadConfigFile( final PairasmConfig config, final Path configFile ) {
        IOUtils.assertFileIsReadable(configFile);
        try ( final Reader reader = Files.newBufferedReader(configFile) ) {
            config.load(reader);
        } catch ( final IOException e ) {
            throw new UserException.CouldNotReadInputFile(configFile, "could not load the configuration", e);
        }
        logger.info("Loaded configuration overrides from " + configFile);
    }

    /**
     * Logs every key of {@code config} with its current value, in key order.
     */
    public static void logConfigFields( final PairasmConfig config, final Log.LogLevel level ) {
        Utils.nonNull(config);
        final Set<String> keys = new TreeSet<>(config.propertyNames());
        logger.log(LoggingUtils.levelToLog4jLevel(level), "Configuration values:");
        for ( final String key : keys ) {
            logger.log(LoggingUtils.levelToLog4jLevel(level), "\t" + key + " = " + config.getProperty(key));
        }
    }
}
