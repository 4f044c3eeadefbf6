package org.broadinstitute.pairasm.testutils;

import htsjdk.samtools.util.Log;
import org.broadinstitute.pairasm.Main;
import org.broadinstitute.pairasm.cmdline.StandardArgumentDefinitions;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Runs a pairasm tool in-process through {@link Main}, as {@code <tool name> <args> --verbosity ERROR}.
 * A test picks the tool with {@link #getTestedToolName()} or names another one explicitly.
 */
public interface CommandLineProgramTester {

    String getTestedToolName();

    /**
     * Prefixes {@code args} with the tool name and quiets logging unless the arguments set a verbosity themselves.
     */
    default String[] makeCommandLineArgs( final List<String> args, final String toolName ) {
        final List<String> commandLine = new ArrayList<>();
        commandLine.add(toolName);
        commandLine.addAll(args);
        final String verbosity = "--" + StandardArgumentDefinitions.VERBOSITY_NAME;
        if ( args.stream().noneMatch(arg -> arg.equalsIgnoreCase(verbosity) || arg.equalsIgnoreCase("-" + StandardArgumentDefinitions.VERBOSITY_NAME)) ) {
            commandLine.add(verbosity);
            commandLine.add(Log.LogLevel.ERROR.name());
        }
        return commandLine.toArray(new String[0]);
    }

    default Object runCommandLine( final List<String> args, final String toolName ) {
        return new Main().instanceMain(makeCommandLineArgs(args, toolName));
    }

    default Object runCommandLine( final List<String> args ) {
        return runCommandLine(args, getTestedToolName());
    }

    default Object runCommandLine( final String[] args ) {
        return runCommandLine(Arrays.asList(args));
    }

    default Object runCommandLine( final ArgumentsBuilder args ) {
        return runCommandLine(args.getArgsList());
    }

    default Object runCommandLine( final ArgumentsBuilder args, final String toolName ) {
        return runCommandLine(args.getArgsList(), toolName);
    }
}
