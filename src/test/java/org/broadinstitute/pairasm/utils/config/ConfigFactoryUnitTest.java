package org.broadinstitute.pairasm.utils.config;

import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.broadinstitute.pairasm.PairasmBaseTest;
import org.broadinstitute.pairasm.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.io.IOException;
import java.io.InputStream;
import java.lang.reflect.Method;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Tests for {@link ConfigFactory}.
 */
public final class ConfigFactoryUnitTest extends PairasmBaseTest {

    private static final String CONFIG_OPTION = "--" + StandardArgumentDefinitions.PAIRASM_CONFIG_FILE_OPTION;
    private static final String BUNDLED_PROPERTIES = "org/broadinstitute/pairasm/utils/config/PairasmConfig.properties";

    private static PairasmConfig freshConfig() {
        return org.aeonbits.owner.ConfigFactory.create(PairasmConfig.class);
    }

    @DataProvider(name = "configFileArgs")
    public Object[][] configFileArgs() {
        return new Object[][] {
                { new String[] {}, null },
                { new String[] { "ReconstructSequenceFromKmerPairs", "-I", "pairs.txt" }, null },
                { new String[] { "ReconstructSequenceFromKmerPairs", CONFIG_OPTION, "my.properties", "-I", "pairs.txt" }, "my.properties" },
                { new String[] { CONFIG_OPTION, "first.properties", CONFIG_OPTION, "second.properties" }, "first.properties" }
        };
    }

    @Test(dataProvider = "configFileArgs")
    public void testGetConfigFilenameFromArgs( final String[] args, final String expected ) {
        Assert.assertEquals(ConfigFactory.getConfigFilenameFromArgs(args, CONFIG_OPTION), expected);
    }

    @DataProvider(name = "missingConfigFileArgs")
    public Object[][] missingConfigFileArgs() {
        return new Object[][] {
                { new String[] { "ReconstructSequenceFromKmerPairs", CONFIG_OPTION } },
                { new String[] { CONFIG_OPTION, "-I", "pairs.txt" } }
        };
    }

    @Test(dataProvider = "missingConfigFileArgs", expectedExceptions = UserException.BadInput.class)
    public void testGetConfigFilenameFromArgsWithoutValue( final String[] args ) {
        ConfigFactory.getConfigFilenameFromArgs(args, CONFIG_OPTION);
    }

    @Test
    public void testPairasmConfigDefaults() {
        final PairasmConfig config = freshConfig();
        Assert.assertFalse(config.pairasm_stacktrace_on_user_exception());
        Assert.assertFalse(config.validate_degrees_before_traversal());
        Assert.assertEquals(config.traversal_progress_interval(), 1000000);
        Assert.assertEquals(config.traversal_abort_check_interval(), 4096);
        Assert.assertEquals(config.traversal_max_edges(), 0L);
        Assert.assertEquals(config.kmer_pair_delimiter(), "");
    }

    @Test
    public void testBundledPropertiesDeclareEveryKey() throws IOException {
        final Properties bundled = new Properties();
        try ( final InputStream in = getClass().getClassLoader().getResourceAsStream(BUNDLED_PROPERTIES) ) {
            Assert.assertNotNull(in, BUNDLED_PROPERTIES + " is not on the class path");
            bundled.load(in);
        }

        final Set<String> keys = new TreeSet<>();
        for ( final Method getter : PairasmConfig.class.getDeclaredMethods() ) {
            final Config.Key key = getter.getAnnotation(Config.Key.class);
            if ( key != null ) {
                keys.add(key.value());
            }
        }
        Assert.assertTrue(keys.contains("kmer_pair_delimiter"));
        Assert.assertEquals(new TreeSet<>(bundled.stringPropertyNames()), keys);
        Assert.assertEquals(bundled.getProperty("kmer_pair_delimiter"), "");
    }

    @Test
    public void testLoadConfigFileOverridesDefaults() {
        final PairasmConfig config = freshConfig();
        ConfigFactory.loadConfigFile(config, getTestFile("traversal.properties").toPath());

        Assert.assertTrue(config.validate_degrees_before_traversal());
        Assert.assertEquals(config.traversal_abort_check_interval(), 16);
        Assert.assertEquals(config.kmer_pair_delimiter(), ",");
        // unset in the file
        Assert.assertEquals(config.traversal_max_edges(), 0L);
        Assert.assertEquals(config.traversal_progress_interval(), 1000000);
    }

    @Test(expectedExceptions = UserException.CouldNotReadInputFile.class)
    public void testLoadMissingConfigFile() {
        ConfigFactory.loadConfigFile(freshConfig(), getTestFile("absent.properties").toPath());
    }

    @Test
    public void testSharedConfigIsCached() {
        Assert.assertSame(ConfigFactory.getInstance().getPairasmConfig(), ConfigFactory.getInstance().getPairasmConfig());
    }

    @Test
    public void testLogConfigFields() {
        // every key must be readable through the Accessible view
        final PairasmConfig config = freshConfig();
        Assert.assertTrue(config.propertyNames().contains("traversal_max_edges"));
        ConfigFactory.logConfigFields(config, Log.LogLevel.DEBUG);
    }
}
