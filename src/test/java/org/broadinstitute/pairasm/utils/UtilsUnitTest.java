package org.broadinstitute.pairasm.utils;

import htsjdk.samtools.util.Log.LogLevel;
import org.apache.logging.log4j.Level;
import org.broadinstitute.pairasm.PairasmBaseTest;
import org.testng.Assert;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Testing framework for general purpose utilities class.
 *
 */
public final class UtilsUnitTest extends PairasmBaseTest {

    @Test
    public void testForceJVMLocaleToUSEnglish() {

        // Set locale to Canada
        Locale.setDefault(Locale.CANADA);

        // Force Locale to US English
        Utils.forceJVMLocaleToUSEnglish();

        Assert.assertEquals(Locale.getDefault(), Locale.US);
    }

    /**
     * Test setting the global logging level for htsjdk, Log4j and java.util.logging.
     *
     * Note that there are three very similar, but not identical, logging level enums from different namespaces
     * being used here: htsjdk's "Log.LogLevel" used by --verbosity, the parallel one used by log4j of type "Level",
     * and the one used by java.utils.logging.
     */
    @Test
    public void testSetLoggingLevel() {
        final Level initialLevel = logger.getLevel();
        final boolean goodInitialLevel =
                initialLevel == Level.DEBUG ||
                initialLevel == Level.WARN ||
                initialLevel == Level.ERROR ||
                initialLevel == Level.INFO;
        Assert.assertTrue(goodInitialLevel);

        LoggingUtils.setLoggingLevel(LogLevel.DEBUG);
        Assert.assertTrue(logger.getLevel() == Level.DEBUG);

        LoggingUtils.setLoggingLevel(LogLevel.WARNING);
        Assert.assertTrue(logger.getLevel() == Level.WARN);

        LoggingUtils.setLoggingLevel(LogLevel.ERROR);
        Assert.assertTrue(logger.getLevel() == Level.ERROR);

        LoggingUtils.setLoggingLevel(LogLevel.INFO);
        Assert.assertTrue(logger.getLevel() == Level.INFO);

        // Restore the logging level back to the original level in place at the beginning of the test
        LoggingUtils.setLoggingLevel(LoggingUtils.levelFromLog4jLevel(initialLevel));
        Assert.assertTrue(logger.getLevel() == initialLevel);
    }

    @DataProvider(name = "splitData")
    public Object[][] splitData() {
        return new Object[][] {
                { "AC\tCT", "\t", Arrays.asList("AC", "CT") },
                { "AC,,CT", ",", Arrays.asList("AC", "", "CT") },
                { "AC::CT::", "::", Arrays.asList("AC", "CT") },
                { "ACCT", "\t", Collections.singletonList("ACCT") },
                { "", ",", Collections.singletonList("") },
                { ",,", ",", Collections.emptyList() },
                { ",AC", ",", Arrays.asList("", "AC") }
        };
    }

    @Test(dataProvider = "splitData")
    public void testSplit( final String str, final String delimiter, final List<String> expected ) {
        Assert.assertEquals(Utils.split(str, delimiter), expected);
        if ( !str.isEmpty() ) {
            Assert.assertEquals(Utils.split(str, delimiter), Arrays.asList(str.split(java.util.regex.Pattern.quote(delimiter))));
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testSplitRejectsEmptyDelimiter() {
        Utils.split("AC CT", "");
    }

    @Test
    public void testNonEmpty() {
        Assert.assertEquals(Utils.nonEmpty("AC", "label"), "AC");
        try {
            Utils.nonEmpty("", "label");
            Assert.fail("empty string accepted");
        } catch ( final IllegalArgumentException e ) {
            assertContains(e.getMessage(), "label");
        }
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testContainsNoNull() {
        Utils.containsNoNull(Arrays.asList("AC", null), "nulls");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testValidateArg() {
        Utils.validateArg(false, () -> "bad argument");
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testValidate() {
        Utils.validate(false, "bad state");
    }

    @Test
    public void testFormattedPercent() {
        Utils.forceJVMLocaleToUSEnglish();
        Assert.assertEquals(Utils.formattedPercent(1, 4), "25.00");
        Assert.assertEquals(Utils.formattedPercent(1, 0), "NA");
    }

    @Test
    public void testWarnUserLinesWrapsLongLines() {
        final String words = String.join(" ", Collections.nCopies(30, "edge"));
        final List<String> lines = Utils.warnUserLines(words);
        Assert.assertEquals(lines.get(0), lines.get(lines.size() - 1));
        for ( final String line : lines ) {
            Assert.assertTrue(line.length() <= lines.get(0).length(), line);
        }
        Assert.assertEquals(String.join(" ", lines.subList(3, lines.size() - 1)).replace("* ", ""), words);
    }

    @Test
    public void testWarnUserLines() {
        final List<String> lines = Utils.warnUserLines("the degrees were not validated");
        Assert.assertTrue(lines.stream().anyMatch(line -> line.contains("the degrees were not validated")));
    }

    @Test
    public void testResetRandomGenerator() {
        Utils.resetRandomGenerator();
        final int first = Utils.getRandomGenerator().nextInt();
        Utils.resetRandomGenerator();
        Assert.assertEquals(Utils.getRandomGenerator().nextInt(), first);
    }
}
