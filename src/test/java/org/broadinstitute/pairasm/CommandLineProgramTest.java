package org.broadinstitute.pairasm;

import org.broadinstitute.pairasm.testutils.CommandLineProgramTester;

/**
 * Base class of tests that run a pairasm tool through {@link Main}. The tool is named after the test class.
 */
public abstract class CommandLineProgramTest extends PairasmBaseTest implements CommandLineProgramTester {

    @Override
    public String getTestedToolName() {
        return getTestedClassName();
    }
}
