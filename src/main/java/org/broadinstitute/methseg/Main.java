package org.broadinstitute.methseg;

import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.ClassFinder;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.methseg.cmdline.CommandLineProgram;
import org.broadinstitute.methseg.exceptions.UserException;
import org.broadinstitute.methseg.utils.Utils;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Entry point of the toolkit: the first argument names a {@link CommandLineProgram} found under
 * {@link #PROGRAM_PACKAGE}, the remaining ones are handed to that program.
 *
 * Note: this is the only class that is allowed to call System.exit, so that tools may be run from a test harness.
 */
public class Main {

    static {
        Utils.forceJVMLocaleToUSEnglish();
    }

    public static final String PROGRAM_PACKAGE = "org.broadinstitute.methseg";

    private static final String COMMAND_LINE_NAME = "methseg";

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    private static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    private static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    /**
     * Exit value when the JVM runs out of memory while holding the observations and recursion buffers.
     */
    public static final int OUT_OF_MEMORY_EXIT_VALUE = 4;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "METHSEG_STACKTRACE_ON_USER_EXCEPTION";

    /** Largest edit distance for which an unknown program name gets a suggestion. */
    private static final int SUGGESTION_MAX_DISTANCE = 7;

    private static void printDecoratedExceptionMessage(final PrintStream ps, final Throwable e, final String prefix) {
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************");
    }

    /**
     * Runs the program named by {@code args[0]}.
     *
     * This method is not intended to be used outside of the toolkit and tests.
     *
     * @return the result of the program, or {@code null} when only the usage was requested.
     */
    public Object instanceMain(final String[] args) {
        Utils.nonNull(args, "the arguments cannot be null");
        final CommandLineProgram program = extractCommandLineProgram(args);
        if (program == null) {
            return null;
        }
        return program.instanceMain(Arrays.copyOfRange(args, 1, args.length));
    }

    /**
     * Runs {@link #instanceMain(String[])} and exits with the exit value that matches the failure, if any.
     */
    protected final void mainEntry(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = extractCommandLineProgram(args);
            if (program != null) {
                handleResult(program.instanceMain(Arrays.copyOfRange(args, 1, args.length)));
            }
        } catch (final CommandLineException e) {
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e);
            System.exit(COMMANDLINE_EXCEPTION_EXIT_VALUE);
        } catch (final UserException e) {
            handleUserException(e);
            System.exit(USER_EXCEPTION_EXIT_VALUE);
        } catch (final OutOfMemoryError e) {
            printDecoratedExceptionMessage(System.err, e, "could not allocate memory: ");
            System.exit(OUT_OF_MEMORY_EXIT_VALUE);
        } catch (final Exception e) {
            e.printStackTrace();
            System.exit(ANY_OTHER_EXCEPTION_EXIT_VALUE);
        }
    }

    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    protected void handleUserException(final Exception e) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");
        if ("true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) {
            e.printStackTrace();
        } else {
            System.err.println(String.format("Set the system property %s (-D%s=true) to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY, STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    /**
     * @return the program named by {@code args[0]}, or {@code null} if the usage was printed instead.
     * @throws UserException if no program has that name.
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args) {
        final Map<String, Class<?>> programs = findPrograms();
        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, programs);
            return null;
        }
        final Class<?> clazz = programs.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, programs);
            throw new UserException(suggestProgram(programs, args[0]));
        }
        try {
            return (CommandLineProgram) clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException("could not instantiate " + clazz.getName(), e);
        }
    }

    /**
     * @return concrete {@link CommandLineProgram} classes by simple name, sorted.
     */
    private static Map<String, Class<?>> findPrograms() {
        final ClassFinder classFinder = new ClassFinder();
        classFinder.find(PROGRAM_PACKAGE, CommandLineProgram.class);
        final Map<String, Class<?>> programs = new TreeMap<>();
        for (final Class<?> clazz : classFinder.getClasses()) {
            if (clazz.isInterface() || clazz.isSynthetic() || clazz.isLocalClass()
                    || Modifier.isAbstract(clazz.getModifiers()) || !Modifier.isPublic(clazz.getModifiers())) {
                continue;
            }
            if (clazz.getAnnotation(CommandLineProgramProperties.class) == null) {
                throw new RuntimeException("The class " + clazz.getName() + " is missing the required CommandLineProgramProperties annotation");
            }
            if (programs.put(clazz.getSimpleName(), clazz) != null) {
                throw new RuntimeException("Simple class name collision: " + clazz.getName());
            }
        }
        return programs;
    }

    private static void printUsage(final PrintStream destination, final Map<String, Class<?>> programs) {
        final StringBuilder builder = new StringBuilder();
        builder.append("USAGE: ").append(COMMAND_LINE_NAME).append(" <program name> [-h]\n\n");
        builder.append("Available Programs:\n");
        builder.append(Utils.dupChar('-', 80)).append('\n');
        for (final Map.Entry<String, Class<?>> entry : programs.entrySet()) {
            final CommandLineProgramProperties properties = entry.getValue().getAnnotation(CommandLineProgramProperties.class);
            if (!properties.omitFromCommandLine()) {
                builder.append(String.format("    %-45s%s\n", entry.getKey(), properties.oneLineSummary()));
            }
        }
        builder.append(Utils.dupChar('-', 80));
        destination.println(builder.toString());
    }

    /**
     * @return an error message naming the closest program names, using the same edit weights as git.
     */
    static String suggestProgram(final Map<String, Class<?>> programs, final String command) {
        final Map<String, Integer> distances = programs.keySet().stream()
                .collect(Collectors.toMap(name -> name, name -> StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4)));
        final int best = distances.values().stream().mapToInt(Integer::intValue).min().orElse(Integer.MAX_VALUE);
        final StringBuilder message = new StringBuilder(String.format("'%s' is not a valid command.", command));
        if (best < SUGGESTION_MAX_DISTANCE) {
            message.append(System.lineSeparator()).append("Did you mean one of these?");
            distances.entrySet().stream()
                    .filter(entry -> entry.getValue() == best)
                    .map(Map.Entry::getKey)
                    .sorted()
                    .forEach(name -> message.append(System.lineSeparator()).append("        ").append(name));
        }
        return message.toString();
    }
}
