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
package io.minitest.common;

import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import com.jayway.jsonpath.PathNotFoundException;
import net.minidev.json.JSONValue;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Thin JSON wrapper used for the worker wire format.
 * Serialization is json-smart, field access is JsonPath.
 */
public class Json {

    private final DocumentContext doc;

    private Json(DocumentContext doc) {
        this.doc = doc;
    }

    public static Json of(Object any) {
        if (any == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        if (any instanceof String) {
            String s = (String) any;
            if (s.isBlank()) {
                throw new IllegalArgumentException("input string must not be empty or blank");
            }
            return new Json(JsonPath.parse(parse(s)));
        }
        if (any instanceof List || any instanceof Map) {
            return new Json(JsonPath.parse(any));
        }
        return new Json(JsonPath.parse(JSONValue.toJSONString(any)));
    }

    /**
     * Parses a JSON object or array keeping key order.
     */
    public static Object parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("invalid json: input is null or blank");
        }
        Object result;
        try {
            result = JSONValue.parseKeepingOrder(json);
        } catch (Exception e) {
            throw new IllegalArgumentException("invalid json: " + e.getMessage(), e);
        }
        if (!(result instanceof Map || result instanceof List)) {
            throw new IllegalArgumentException("invalid json: not a JSON object or array");
        }
        return result;
    }

    public static boolean isJson(String line) {
        if (line == null) {
            return false;
        }
        String trimmed = line.trim();
        return trimmed.startsWith("{") || trimmed.startsWith("[");
    }

    public static String stringify(Object o) {
        return JSONValue.toJSONString(o);
    }

    private static String path(String path) {
        return path.charAt(0) == '$' ? path : "$." + path;
    }

    public <T> T get(String path) {
        return doc.read(path(path));
    }

    public <T> Optional<T> getOptional(String path) {
        try {
            T value = doc.read(path(path));
            return Optional.ofNullable(value);
        } catch (PathNotFoundException e) {
            return Optional.empty();
        }
    }

    public boolean pathExists(String path) {
        return getOptional(path).isPresent();
    }

    @Override
    public String toString() {
        return doc.jsonString();
    }

}
