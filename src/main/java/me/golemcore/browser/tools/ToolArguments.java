/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.browser.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Typed access to the loosely typed argument map of a tool call. Every
 * accessor throws {@link IllegalArgumentException} with a caller-facing
 * message when a value has the wrong shape.
 */
final class ToolArguments {

    private ToolArguments() {
    }

    static String requireString(Map<String, Object> args, String key) {
        String value = optionalString(args, key);
        if (value == null || value.isEmpty()) {
            throw new IllegalArgumentException(key + " is required");
        }
        return value;
    }

    static String optionalString(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof String string) {
            return string;
        }
        throw new IllegalArgumentException(key + " must be a string");
    }

    /**
     * Accepts JSON booleans as well as the strings {@code "true"} and
     * {@code "false"}.
     */
    static boolean optionalBoolean(Map<String, Object> args, String key, boolean defaultValue) {
        Object value = args.get(key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String string) {
            if ("true".equalsIgnoreCase(string)) {
                return true;
            }
            if ("false".equalsIgnoreCase(string)) {
                return false;
            }
        }
        throw new IllegalArgumentException(key + " must be a boolean");
    }

    static Integer optionalInteger(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return toInt(number, key + " must be an integer");
        }
        throw new IllegalArgumentException(key + " must be a number");
    }

    static List<String> optionalStringList(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(key + " must be an array of strings");
        }
        List<String> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof String string)) {
                throw new IllegalArgumentException(key + " must be an array of strings");
            }
            result.add(string);
        }
        return result;
    }

    static List<Integer> optionalIntegerList(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (!(value instanceof List<?> list)) {
            throw new IllegalArgumentException(key + " must be an array of numbers");
        }
        List<Integer> result = new ArrayList<>(list.size());
        for (Object item : list) {
            if (!(item instanceof Number number)) {
                throw new IllegalArgumentException(key + " must be an array of numbers");
            }
            result.add(toInt(number, key + " must be an array of integers"));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    static Map<String, Object> optionalObject(Map<String, Object> args, String key) {
        Object value = args.get(key);
        if (value == null) {
            return null;
        }
        if (value instanceof Map<?, ?>) {
            return (Map<String, Object>) value;
        }
        throw new IllegalArgumentException(key + " must be an object");
    }

    /**
     * Narrow a JSON number to {@code int}, rejecting fractions and values
     * outside the {@code int} range instead of wrapping them.
     */
    private static int toInt(Number number, String message) {
        double asDouble = number.doubleValue();
        if (asDouble != Math.rint(asDouble) || asDouble < Integer.MIN_VALUE || asDouble > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(message);
        }
        return number.intValue();
    }
}
