package org.broadinstitute.pairasm.utils;

import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Argument checks and small helpers shared across pairasm.
 */
public final class Utils {

    private Utils() {}

    private static final long RANDOM_SEED = 47382911L;
    private static final Random randomGenerator = new Random(RANDOM_SEED);

    /**
     * The generator behind every shuffle that is not given its own seed. Reproducible between runs.
     */
    public static Random getRandomGenerator() {
        return randomGenerator;
    }

    public static void resetRandomGenerator() {
        randomGenerator.setSeed(RANDOM_SEED);
    }

    private static final int WARNING_WIDTH = 68;
    private static final String WARNING_MARGIN = "* ";

    public static void warnUser( final Logger logger, final String msg ) {
        warnUserLines(msg).forEach(logger::warn);
    }

    /**
     * Frames {@code msg} in a box of asterisks, wrapping it at word boundaries so that it stands out in the log.
     */
    public static List<String> warnUserLines( final String msg ) {
        final String border = StringUtils.repeat('*', WARNING_MARGIN.length() + WARNING_WIDTH);
        final List<String> lines = new ArrayList<>();
        lines.add(border);
        lines.add(WARNING_MARGIN + "WARNING:");
        lines.add(WARNING_MARGIN);
        for ( final String paragraph : msg.split("\\r?\\n") ) {
            String rest = paragraph;
            while ( rest.length() > WARNING_WIDTH ) {
                int cut = rest.lastIndexOf(' ', WARNING_WIDTH);
                if ( cut <= 0 ) {
                    cut = WARNING_WIDTH;
                }
                lines.add(WARNING_MARGIN + rest.substring(0, cut));
                rest = rest.substring(Math.min(rest.length(), cut + 1));
            }
            lines.add(WARNING_MARGIN + rest);
        }
        lines.add(border);
        return lines;
    }

    /**
     * @throws IllegalArgumentException if {@code object} is null
     */
    public static <T> T nonNull( final T object ) {
        return nonNull(object, "Null object is not allowed here.");
    }

    public static <T> T nonNull( final T object, final String message ) {
        if ( object == null ) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * @throws IllegalArgumentException if {@code string} is null or empty
     */
    public static String nonEmpty( final String string, final String message ) {
        nonNull(string, "The string is null: " + message);
        validateArg(!string.isEmpty(), () -> "The string is empty: " + message);
        return string;
    }

    /**
     * @throws IllegalArgumentException if {@code collection} is null or holds a null element
     */
    public static void containsNoNull( final Collection<?> collection, final String message ) {
        nonNull(collection, message);
        // some Set implementations throw on contains(null)
        validateArg(collection.stream().noneMatch(Objects::isNull), message);
    }

    public static void validateArg( final boolean condition, final String msg ) {
        if ( !condition ) {
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg( final boolean condition, final Supplier<String> msg ) {
        if ( !condition ) {
            throw new IllegalArgumentException(msg.get());
        }
    }

    /**
     * Checks an internal invariant.
     *
     * @throws IllegalStateException if {@code condition} is false
     */
    public static void validate( final boolean condition, final String msg ) {
        if ( !condition ) {
            throw new IllegalStateException(msg);
        }
    }

    /**
     * Numbers in messages and percentages are formatted the same way whatever the user's locale.
     */
    public static void forceJVMLocaleToUSEnglish() {
        Locale.setDefault(Locale.US);
    }

    /**
     * Splits on a literal delimiter. The result matches {@link String#split(String)} on the quoted delimiter,
     * trailing empty tokens dropped, without compiling a regex per line.
     */
    public static List<String> split( final String str, final String delimiter ) {
        nonNull(str, "the string to split cannot be null");
        nonEmpty(delimiter, "the delimiter cannot be empty");

        final List<String> tokens = new ArrayList<>();
        int start = 0;
        int end;
        while ( (end = str.indexOf(delimiter, start)) != -1 ) {
            tokens.add(str.substring(start, end));
            start = end + delimiter.length();
        }
        tokens.add(str.substring(start));

        // String.split keeps a lone empty token for the empty string
        int size = tokens.size();
        while ( size > 1 && tokens.get(size - 1).isEmpty() ) {
            tokens.remove(--size);
        }
        if ( size == 1 && tokens.get(0).isEmpty() && !str.isEmpty() ) {
            tokens.clear();
        }
        return tokens;
    }

    /**
     * @return {@code x} as a percentage of {@code total} with two decimals, or "NA" when {@code total} is 0
     */
    public static String formattedPercent( final long x, final long total ) {
        return total == 0 ? "NA" : String.format("%.2f", (100.0 * x) / total);
    }
}
