package org.broadinstitute.pileup.utils;

import java.util.Collection;
import java.util.function.Supplier;

/**
 * Argument and state validation helpers shared across the engine.
 */
public final class Utils {

    private Utils(){}

    /**
     * Checks that an {@link Object} {@code object} is not null and returns the same object or throws an {@link IllegalArgumentException}
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
     * Checks that an {@link Object} is not {@code null} and returns the same object or throws an {@link IllegalArgumentException}
     * @param object any Object
     * @param message the text message that would be passed to the exception thrown when {@code o == null}.
     * @return the same object
     * @throws IllegalArgumentException if a {@code o == null}
     */
    public static <T> T nonNull(final T object, final Supplier<String> message) {
        if (object == null) {
            throw new IllegalArgumentException(message.get());
        }
        return object;
    }

    /**
     * Checks that a {@link String} is not {@code null} and that it is not empty.
     * If it's non-null and non-empty it returns the input, otherwise it throws an {@link IllegalArgumentException}
     * @param string any String
     * @param message a message to include in the output
     * @return the original string
     * @throws IllegalArgumentException if string is null or empty
     */
    public static String nonEmpty(String string, String message){
        nonNull(string, "The string is null: " + message);
        if(string.isEmpty()){
            throw new IllegalArgumentException("The string is empty: " + message);
        } else {
            return string;
        }
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
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.  If msg is not a
     * String literal i.e. if it requires computation, use the Supplier<String> version, below.
     */
    public static void validate(final boolean condition, final String msg){
        if (!condition){
            throw new IllegalStateException(msg);
        }
    }

    /**
     * Check a condition that should always be true and throw an {@link IllegalStateException} if false.
     */
    public static void validate(final boolean condition, final Supplier<String> msg){
        if (!condition){
            throw new IllegalStateException(msg.get());
        }
    }
}
