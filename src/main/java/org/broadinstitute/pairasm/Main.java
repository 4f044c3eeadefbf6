package org.broadinstitute.pairasm;

import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.pairasm.cmdline.CommandLineProgram;
import org.broadinstitute.pairasm.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.pairasm.exceptions.PairasmException;
import org.broadinstitute.pairasm.exceptions.UserException;
import org.broadinstitute.pairasm.utils.Utils;
import org.broadinstitute.pairasm.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Command line entry point of pairasm: {@code pairasm <ToolName> [tool arguments]}.
 *
 * Tools are the concrete {@link CommandLineProgram}s found in {@link #getPackageList()} plus those in
 * {@link #getClassList()}, and are named by their simple class name. Subclasses may override either list.
 */
public class Main {

    static {
        Utils.forceJVMLocaleToUSEnglish();
    }

    /** A {@link CommandLineException}: the arguments did not parse or validate. */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /** A {@link UserException}: bad input that the user can correct. */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /** Anything else, which is a bug in pairasm. */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    public static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "pairasm_stacktrace_on_user_exception";
    public static final String STACK_TRACE_ON_USER_EXCEPTION_ENV = "PAIRASM_STACKTRACE_ON_USER_EXCEPTION";

    protected List<String> getPackageList() {
        return Collections.singletonList("org.broadinstitute.pairasm");
    }

    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Collections.emptyList();
    }

    protected String getCommandLineName() {
        return "pairasm";
    }

    /**
     * Loads any configuration file named in {@code args}, then builds and runs the tool named by {@code args[0]}.
     *
     * @return the tool's result, or {@code null} if only the tool list or help was printed
     */
    public Object instanceMain( final String[] args ) {
        final CommandLineProgram program = setupConfigAndExtractProgram(args);
        return program == null ? null : program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    private CommandLineProgram setupConfigAndExtractProgram( final String[] args ) {
        // argument defaults read the configuration, so it has to be complete before the tool is instantiated
        ConfigFactory.getInstance().initializeConfigurationsFromCommandLineArgs(args,
                "--" + StandardArgumentDefinitions.PAIRASM_CONFIG_FILE_OPTION);
        return extractCommandLineProgram(args);
    }

    /**
     * Runs the tool and exits with 0, or with the exit value matching the exception it failed with.
     * Only this method calls {@link System#exit}, so that tools can be run in-process by tests.
     */
    protected final void mainEntry( final String[] args ) {
        CommandLineProgram program = null;
        try {
            program = setupConfigAndExtractProgram(args);
            final Object result = program == null ? null : program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
            handleResult(result);
        } catch ( final CommandLineException e ) {
            if ( program != null ) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch ( final UserException e ) {
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch ( final Exception e ) {
            e.printStackTrace();
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    protected void handleResult( final Object result ) {
        if ( result != null ) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    protected void handleUserException( final Exception e ) {
        System.err.println("***********************************************************************");
        System.err.println();
        System.err.println("A USER ERROR has occurred: " + e.getMessage());
        System.err.println();
        System.err.println("***********************************************************************");
        if ( printStackTraceOnUserExceptions() ) {
            e.printStackTrace();
        } else {
            System.err.println(String.format("Set -D%s=true, the environment variable %s=true, or %s=true in the " +
                    "configuration to print the stack trace.", STACK_TRACE_ON_USER_EXCEPTION_PROPERTY,
                    STACK_TRACE_ON_USER_EXCEPTION_ENV, STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    private static boolean printStackTraceOnUserExceptions() {
        return "true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_ENV))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)
                || ConfigFactory.getInstance().getPairasmConfig().pairasm_stacktrace_on_user_exception();
    }

    public static void main( final String[] args ) {
        new Main().mainEntry(args);
    }

    /**
     * @return the tool named by {@code args[0]}, or {@code null} after printing the tool list for no arguments or help
     * @throws UserException if {@code args[0]} names no tool
     */
    private CommandLineProgram extractCommandLineProgram( final String[] args ) {
        final Map<String, Class<?>> tools = findTools();

        if ( args.length == 0 || args[0].equals("-h") || args[0].equals("--help") ) {
            printUsage(System.out, tools);
            return null;
        }

        final Class<?> toolClass = tools.get(args[0]);
        if ( toolClass == null ) {
            printUsage(System.err, tools);
            throw new UserException(String.format("'%s' is not a %s tool. Available tools: %s.",
                    args[0], getCommandLineName(), String.join(", ", visibleToolNames(tools))));
        }
        try {
            return (CommandLineProgram) toolClass.getDeclaredConstructor().newInstance();
        } catch ( final ReflectiveOperationException e ) {
            throw new PairasmException("Could not instantiate " + toolClass.getName() + ": " + e);
        }
    }

    /**
     * @return every runnable tool keyed by its simple name, omitted ones included
     */
    private Map<String, Class<?>> findTools() {
        final ClassFinder finder = new ClassFinder();
        for ( final String pkg : getPackageList() ) {
            finder.find(pkg, CommandLineProgram.class);
        }
        final Set<Class<?>> candidates = new LinkedHashSet<>(finder.getClasses());
        candidates.addAll(getClassList());

        final Map<String, Class<?>> tools = new TreeMap<>();
        for ( final Class<?> candidate : candidates ) {
            if ( !isRunnable(candidate) ) {
                continue;
            }
            if ( getProgramProperty(candidate) == null ) {
                throw new PairasmException(candidate.getName() + " is a tool but has no @" +
                        CommandLineProgramProperties.class.getSimpleName() + " annotation");
            }
            final Class<?> clash = tools.put(candidate.getSimpleName(), candidate);
            if ( clash != null ) {
                throw new PairasmException("Two tools are named " + candidate.getSimpleName() + ": " +
                        clash.getName() + " and " + candidate.getName());
            }
        }
        return tools;
    }

    private static boolean isRunnable( final Class<?> clazz ) {
        return !clazz.isInterface() && !Modifier.isAbstract(clazz.getModifiers())
                && !clazz.isAnonymousClass() && !clazz.isLocalClass() && !clazz.isSynthetic();
    }

    public static CommandLineProgramProperties getProgramProperty( final Class<?> clazz ) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private static List<String> visibleToolNames( final Map<String, Class<?>> tools ) {
        final List<String> names = new ArrayList<>();
        tools.forEach((name, clazz) -> {
            if ( !getProgramProperty(clazz).omitFromCommandLine() ) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * Prints the tools that are not omitted from the command line, grouped by program group.
     */
    protected void printUsage( final PrintStream out, final Map<String, Class<?>> tools ) {
        final Map<String, List<String>> byGroup = new TreeMap<>();
        final Map<String, String> groupDescriptions = new TreeMap<>();
        for ( final String name : visibleToolNames(tools) ) {
            final CommandLineProgramProperties properties = getProgramProperty(tools.get(name));
            final CommandLineProgramGroup group = instantiateGroup(properties.programGroup());
            groupDescriptions.put(group.getName(), group.getDescription());
            byGroup.computeIfAbsent(group.getName(), k -> new ArrayList<>())
                    .add(String.format("    %-40s%s", name, properties.oneLineSummary()));
        }

        final StringBuilder usage = new StringBuilder();
        usage.append(String.format("USAGE: %s <program name> [-h]%n%n", getCommandLineName()));
        usage.append(String.format("Available programs:%n"));
        byGroup.forEach((group, lines) -> {
            usage.append(String.format("%s: %s%n", group, groupDescriptions.get(group)));
            lines.forEach(line -> usage.append(line).append(System.lineSeparator()));
        });
        out.print(usage);
    }

    private static CommandLineProgramGroup instantiateGroup( final Class<? extends CommandLineProgramGroup> groupClass ) {
        try {
            return groupClass.getDeclaredConstructor().newInstance();
        } catch ( final ReflectiveOperationException e ) {
            throw new PairasmException("Could not instantiate program group " + groupClass.getName() + ": " + e);
        }
    }
}
