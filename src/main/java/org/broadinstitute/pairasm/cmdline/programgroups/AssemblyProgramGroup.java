package org.broadinstitute.pairasm.cmdline.programgroups;

import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.pairasm.utils.help.HelpConstants;

/**
 * Tools that reconstruct sequences from paired k-mers and the companion tools that produce them
 */
public final class AssemblyProgramGroup implements CommandLineProgramGroup {
    @Override
    public String getName() { return HelpConstants.DOC_CAT_ASSEMBLY; }
    @Override
    public String getDescription() { return HelpConstants.DOC_CAT_ASSEMBLY_SUMMARY; }
}
