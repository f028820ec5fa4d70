/*
 * The MIT License
 *
 * Copyright 2025 Karate Labs Inc.
 *
 * Permission is hereby granted, free of charge, to any person obtaining a copy
 * of this software and associated documentation files (the "Software"), to deal
 * in the Software without restriction, including without limitation the rights
 * to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 * copies of the Software, and to permit persons to whom the Software is
 * furnished to do so, subject to the following conditions:
 *
 * The above copyright notice and this permission notice shall be included in
 * all copies or substantial portions of the Software.
 *
 * THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 * IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 * FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 * AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 * LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 * OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN
 * THE SOFTWARE.
 */
package io.minitest.assertions;

import io.minitest.core.Executable;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Assertions for test bodies. Every method throws {@link AssertionFailure}
 * when the check does not hold. A non-null {@code message} replaces the
 * default one.
 */
public final class Assert {

    private Assert() {
    }

    private static AssertionFailure failure(String message, String defaultMessage, Object actual, Object expected) {
        return new AssertionFailure(message == null ? defaultMessage : message, actual, expected);
    }

    private static String str(Object o) {
        if (o instanceof Object[]) {
            return Arrays.deepToString((Object[]) o);
        }
        if (o != null && o.getClass().isArray()) {
            return toList(o).toString();
        }
        if (o instanceof CharSequence) {
            return "\"" + o + "\"";
        }
        return String.valueOf(o);
    }

    public static void fail(String message) {
        throw new AssertionFailure(message, null, null);
    }

    public static void equal(Object actual, Object expected) {
        equal(actual, expected, null);
    }

    public static void equal(Object actual, Object expected, String message) {
        if (!Objects.equals(actual, expected)) {
            throw failure(message, "Expected " + actual + " to equal " + expected, actual, expected);
        }
    }

    public static void notEqual(Object actual, Object expected) {
        notEqual(actual, expected, null);
    }

    public static void notEqual(Object actual, Object expected, String message) {
        if (Objects.equals(actual, expected)) {
            throw failure(message, "Expected " + actual + " to not equal " + expected, actual, expected);
        }
    }

    public static void isTrue(boolean value) {
        isTrue(value, null);
    }

    public static void isTrue(boolean value, String message) {
        if (!value) {
            throw failure(message, "Expected false to be true", false, true);
        }
    }

    public static void isFalse(boolean value) {
        isFalse(value, null);
    }

    public static void isFalse(boolean value, String message) {
        if (value) {
            throw failure(message, "Expected true to be false", true, false);
        }
    }

    /**
     * Structural equality, arrays are compared element by element.
     */
    public static void deepEqual(Object actual, Object expected) {
        deepEqual(actual, expected, null);
    }

    public static void deepEqual(Object actual, Object expected, String message) {
        if (!Objects.deepEquals(actual, expected)) {
            throw failure(message, "Expected " + str(actual) + " to deep equal " + str(expected), actual, expected);
        }
    }

    public static Throwable throwsError(Executable fn) {
        return throwsError(fn, Throwable.class, null);
    }

    public static <T extends Throwable> T throwsError(Executable fn, Class<T> expectedType) {
        return throwsError(fn, expectedType, null);
    }

    /**
     * @return the thrown error, for further checks
     */
    public static <T extends Throwable> T throwsError(Executable fn, Class<T> expectedType, String message) {
        Throwable thrown = null;
        try {
            fn.execute();
        } catch (Throwable t) {
            thrown = t;
        }
        if (thrown == null) {
            throw failure(message, "Expected function to throw an error", "no error thrown", "error thrown");
        }
        if (!expectedType.isInstance(thrown)) {
            throw failure(message, "Expected error to be instance of " + expectedType.getSimpleName()
                    + " but was " + thrown.getClass().getSimpleName(), thrown, expectedType);
        }
        return expectedType.cast(thrown);
    }

    /**
     * Works on strings (substring), collections, arrays and map keys.
     */
    public static void includes(Object container, Object item) {
        includes(container, item, null);
    }

    public static void includes(Object container, Object item, String message) {
        if (!contains(container, item)) {
            throw failure(message, "Expected " + str(container) + " to include " + str(item), container, item);
        }
    }

    public static void notIncludes(Object container, Object item) {
        notIncludes(container, item, null);
    }

    public static void notIncludes(Object container, Object item, String message) {
        if (contains(container, item)) {
            throw failure(message, "Expected " + str(container) + " to not include " + str(item), container, item);
        }
    }

    private static boolean contains(Object container, Object item) {
        if (container instanceof CharSequence) {
            return item != null && container.toString().contains(item.toString());
        }
        if (container instanceof Collection) {
            return ((Collection<?>) container).contains(item);
        }
        if (container instanceof Map) {
            return ((Map<?, ?>) container).containsKey(item);
        }
        if (container != null && container.getClass().isArray()) {
            return toList(container).contains(item);
        }
        return false;
    }

    private static List<Object> toList(Object array) {
        int length = Array.getLength(array);
        List<Object> list = new ArrayList<>(length);
        for (int i = 0; i < length; i++) {
            list.add(Array.get(array, i));
        }
        return list;
    }

    public static void isNull(Object actual) {
        isNull(actual, null);
    }

    public static void isNull(Object actual, String message) {
        if (actual != null) {
            throw failure(message, "Expected " + str(actual) + " to be null", actual, null);
        }
    }

    public static void isNotNull(Object actual) {
        isNotNull(actual, null);
    }

    public static void isNotNull(Object actual, String message) {
        if (actual == null) {
            throw failure(message, "Expected value to not be null", null, "not null");
        }
    }

    /**
     * Null counts as empty.
     */
    public static void isEmpty(Object actual) {
        isEmpty(actual, null);
    }

    public static void isEmpty(Object actual, String message) {
        if (!empty(actual)) {
            throw failure(message, "Expected " + str(actual) + " to be empty", actual, "empty");
        }
    }

    public static void isNotEmpty(Object actual) {
        isNotEmpty(actual, null);
    }

    public static void isNotEmpty(Object actual, String message) {
        if (empty(actual)) {
            throw failure(message, "Expected " + str(actual) + " to not be empty", actual, "not empty");
        }
    }

    private static boolean empty(Object actual) {
        if (actual == null) {
            return true;
        }
        Integer length = lengthOf(actual);
        return length != null && length == 0;
    }

    private static Integer lengthOf(Object actual) {
        if (actual instanceof CharSequence) {
            return ((CharSequence) actual).length();
        }
        if (actual instanceof Collection) {
            return ((Collection<?>) actual).size();
        }
        if (actual instanceof Map) {
            return ((Map<?, ?>) actual).size();
        }
        if (actual != null && actual.getClass().isArray()) {
            return Array.getLength(actual);
        }
        return null;
    }

    public static void lengthOf(Object actual, int expectedLength) {
        lengthOf(actual, expectedLength, null);
    }

    public static void lengthOf(Object actual, int expectedLength, String message) {
        Integer length = lengthOf(actual);
        if (length == null) {
            throw failure(message, "Expected " + str(actual) + " to have a length", actual, "object with length");
        }
        if (length != expectedLength) {
            throw failure(message, "Expected length " + expectedLength + ", got " + length, length, expectedLength);
        }
    }

    /**
     * Inclusive on both ends.
     */
    public static void inRange(Number actual, Number min, Number max) {
        inRange(actual, min, max, null);
    }

    public static void inRange(Number actual, Number min, Number max, String message) {
        if (actual == null || actual.doubleValue() < min.doubleValue() || actual.doubleValue() > max.doubleValue()) {
            throw failure(message, "Expected " + actual + " to be between " + min + " and " + max,
                    actual, "between " + min + " and " + max);
        }
    }

    /**
     * Passes if the pattern is found anywhere in {@code actual}.
     */
    public static void matches(String actual, String regex) {
        matches(actual, Pattern.compile(regex), null);
    }

    public static void matches(String actual, Pattern pattern) {
        matches(actual, pattern, null);
    }

    public static void matches(String actual, Pattern pattern, String message) {
        if (actual == null) {
            throw failure(message, "Expected null to be a string", null, "string");
        }
        if (!pattern.matcher(actual).find()) {
            throw failure(message, "Expected \"" + actual + "\" to match /" + pattern.pattern() + "/",
                    actual, pattern.pattern());
        }
    }

    public static void hasKey(Map<?, ?> actual, Object key) {
        hasKey(actual, key, null);
    }

    public static void hasKey(Map<?, ?> actual, Object key, String message) {
        if (actual == null || !actual.containsKey(key)) {
            throw failure(message, "Expected map to have key \"" + key + "\"",
                    actual == null ? null : actual.keySet(), key);
        }
    }

    public static void includesAllOf(Collection<?> actual, Collection<?> expected) {
        includesAllOf(actual, expected, null);
    }

    public static void includesAllOf(Collection<?> actual, Collection<?> expected, String message) {
        requireCollections(actual, expected, message);
        List<Object> missing = new ArrayList<>();
        for (Object item : expected) {
            if (!actual.contains(item)) {
                missing.add(item);
            }
        }
        if (!missing.isEmpty()) {
            throw failure(message, "Expected " + actual + " to include all of " + expected + ", missing: " + missing,
                    actual, expected);
        }
    }

    public static void includesAnyOf(Collection<?> actual, Collection<?> expected) {
        includesAnyOf(actual, expected, null);
    }

    public static void includesAnyOf(Collection<?> actual, Collection<?> expected, String message) {
        requireCollections(actual, expected, message);
        for (Object item : expected) {
            if (actual.contains(item)) {
                return;
            }
        }
        throw failure(message, "Expected " + actual + " to include any of " + expected, actual, expected);
    }

    private static void requireCollections(Collection<?> actual, Collection<?> expected, String message) {
        if (actual == null) {
            throw failure(message, "Expected null to be a collection", null, "collection");
        }
        if (expected == null) {
            throw failure(message, "Expected comparison value to be a collection", null, "collection");
        }
    }

}
