package org.broadinstitute.pairasm;

import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.pairasm.cmdline.CommandLineProgram;
import org.broadinstitute.pairasm.cmdline.programgroups.AssemblyProgramGroup;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.tools.DecomposeSequenceToKmerPairs;
import org.broadinstitute.pairasm.tools.ReconstructSequenceFromKmerPairs;
import org.broadinstitute.pairasm.utils.help.HelpConstants;
import org.testng.Assert;
import org.testng.annotations.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

public final class MainTest extends CommandLineProgramTest {

    @Test(expectedExceptions = UserException.class)
    public void testCommandNotFoundThrows(){
        this.runCommandLine(new String[]{"Brain"});
    }

    @Test
    public void testCommandNotFoundListsTools() {
        try {
            captureStderr(() -> new Main().instanceMain(new String[]{"ReconstructSequenceFromKmerPair"}));
            Assert.fail("misspelled tool name accepted");
        } catch ( final UserException e ) {
            assertContains(e.getMessage(), "'ReconstructSequenceFromKmerPair' is not a pairasm tool");
            assertContains(e.getMessage(), ReconstructSequenceFromKmerPairs.class.getSimpleName());
            assertContains(e.getMessage(), DecomposeSequenceToKmerPairs.class.getSimpleName());
            Assert.assertFalse(e.getMessage().contains("OmitFromCommandLineCLP"), e.getMessage());
        }
    }

    @Test
    public void testNoArgumentsPrintsToolList() {
        final String usage = captureStdout(() -> Assert.assertNull(new Main().instanceMain(new String[0])));
        assertContains(usage, "USAGE: pairasm <program name> [-h]");
        assertContains(usage, HelpConstants.DOC_CAT_ASSEMBLY);
    }

    @CommandLineProgramProperties(
            programGroup = AssemblyProgramGroup.class,
            summary = "OmitFromCommandLine test",
            oneLineSummary = "OmitFromCommandLine test",
            omitFromCommandLine = true)
    public static final class OmitFromCommandLineCLP extends CommandLineProgram {

        public static final int RETURN_VALUE = 1;

        @Override
        protected Object doWork() {
            return RETURN_VALUE;
        }
    }

    private static final class OmitFromCommandLineMain extends Main {
        @Override
        protected List<Class<? extends CommandLineProgram>> getClassList() {
            return Collections.singletonList(OmitFromCommandLineCLP.class);
        }
    }

    @Test
    public void testClpOmitFromCommandLine() {
        final OmitFromCommandLineMain main = new OmitFromCommandLineMain();
        final String clpName = "OmitFromCommandLineCLP";
        // test that the tool can be run from main correctly (returns non-null)
        Assert.assertEquals(main.instanceMain(new String[]{clpName}), OmitFromCommandLineCLP.RETURN_VALUE);
        // test that the usage is not shown if help is printed
        final String usage = captureStdout(() -> main.instanceMain(new String[]{"-h"}));
        Assert.assertFalse(usage.contains(clpName));
        assertContains(usage, ReconstructSequenceFromKmerPairs.class.getSimpleName());
        assertContains(usage, DecomposeSequenceToKmerPairs.class.getSimpleName());
    }

    @Test
    public void testEveryToolHasASummary() {
        final List<Class<?>> tools = Arrays.asList(ReconstructSequenceFromKmerPairs.class, DecomposeSequenceToKmerPairs.class);
        for ( final Class<?> tool : tools ) {
            final CommandLineProgramProperties properties = Main.getProgramProperty(tool);
            Assert.assertNotNull(properties, tool.getSimpleName());
            Assert.assertFalse(properties.oneLineSummary().isEmpty(), tool.getSimpleName());
            Assert.assertEquals(properties.programGroup(), AssemblyProgramGroup.class);
        }
    }
}
