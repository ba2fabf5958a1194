package org.broadinstitute.genomics.utils;

import htsjdk.tribble.util.ParsingUtils;
import org.apache.commons.lang3.StringUtils;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.function.Supplier;

public final class Utils {

    private Utils(){}

    private static final int TEXT_WARNING_WIDTH = 68;
    private static final String TEXT_WARNING_PREFIX = "* ";
    private static final String TEXT_WARNING_BORDER = StringUtils.repeat('*', TEXT_WARNING_PREFIX.length() + TEXT_WARNING_WIDTH);

    public static void warnUser(final Logger logger, final String msg) {
        for (final String line: warnUserLines(msg)) {
            logger.warn(line);
        }
    }

    public static List<String> warnUserLines(final String msg) {
        final List<String> results = new ArrayList<>();
        results.add(TEXT_WARNING_BORDER);
        results.add(TEXT_WARNING_PREFIX + "WARNING:");
        results.add(TEXT_WARNING_PREFIX);
        for (final String line: msg.split("\\r?\\n")) {
            final StringBuilder builder = new StringBuilder(line);
            while (builder.length() > TEXT_WARNING_WIDTH) {
                int space = builder.lastIndexOf(" ", TEXT_WARNING_WIDTH);
                if (space <= 0) {
                    space = TEXT_WARNING_WIDTH;
                }
                results.add(TEXT_WARNING_PREFIX + builder.substring(0, space));
                builder.delete(0, Math.min(builder.length(), space + 1));
            }
            results.add(TEXT_WARNING_PREFIX + builder);
        }
        results.add(TEXT_WARNING_BORDER);
        return results;
    }

    /**
     * Checks that an Object {@code object} is not null and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object) {
        return Utils.nonNull(object, "Null object is not allowed here.");
    }

    /**
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final String message) {
        if (object == null) {
            throw new IllegalArgumentException(message);
        }
        return object;
    }

    /**
     * Checks that the collection does not contain a {@code null} value (throws an {@link IllegalArgumentException} if it does).
     * @param collection collection
     * @param message the text message that would be pass to the exception thrown when c contains a null.
     * @throws IllegalArgumentException if collection is null or contains any null elements
     */
    public static void containsNoNull(final Collection<?> collection, final String message) {
        Utils.nonNull(collection, message);
        //cannot use Collection.contains(null) here because this throws a NullPointerException when used with many Sets
        if (collection.stream().anyMatch(v -> v == null)){
            throw new IllegalArgumentException(message);
        }
    }

    public static void validateArg(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalArgumentException(msg);
        }
    }

    public static void validateArg(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalArgumentException(msg.get());
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.
     */
    public static void validate(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalStateException(msg);
        }
    }

    /**
     * Splits a String on a single character using htsjdk's tokenizer.  Trailing empty tokens are dropped,
     * as {@link String#split(String)} does.
     *
     * @param str       the string to split.
     * @param delimiter the delimiter used to split the string.
     * @return A {@link List} of {@link String} tokens.
     */
    public static List<String> split(final String str, final char delimiter) {
        final List<String> tokens;
        if ( str.isEmpty() ) {
            tokens = new ArrayList<>(1);
            tokens.add("");
        }
        else {
            tokens = ParsingUtils.split(str, delimiter);
            removeTrailingEmptyStringsFromEnd(tokens);
        }
        return tokens;
    }

    /**
     * Splits a String using indexOf instead of regex.  The delimiter is matched literally.
     * This method produces the same results as {@link String#split(String)} for a non-regex delimiter.
     *
     * @param str       the string to split.
     * @param delimiter the delimiter used to split the string, must not be empty.
     * @return A {@link List} of {@link String} tokens.
     */
    public static List<String> split(final String str, final String delimiter) {
        Utils.nonNull(str);
        Utils.validateArg(delimiter != null && !delimiter.isEmpty(), "the delimiter cannot be null or empty");
        if ( delimiter.length() == 1 ) {
            return split(str, delimiter.charAt(0));
        }
        final List<String> result = new ArrayList<>();
        if ( str.isEmpty() ) {
            result.add("");
            return result;
        }
        int delimiterIdx;
        int tokenStartIdx = 0;
        do {
            delimiterIdx = str.indexOf(delimiter, tokenStartIdx);
            final String token = (delimiterIdx != -1 ? str.substring(tokenStartIdx, delimiterIdx) : str.substring(tokenStartIdx));
            result.add(token);
            tokenStartIdx = delimiterIdx + delimiter.length();
        } while ( delimiterIdx != -1 );

        removeTrailingEmptyStringsFromEnd(result);
        return result;
    }

    private static void removeTrailingEmptyStringsFromEnd(final List<String> result) {
        while ( (!result.isEmpty()) && (result.get(result.size() - 1).isEmpty()) ) {
            result.remove(result.size() - 1);
        }
    }
}
