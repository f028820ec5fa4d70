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
package io.minitest.parallel;

import io.minitest.core.RunConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One schedulable unit of work. The id is assigned by the pool on submission.
 */
public record Task(
        String id,
        String type,
        String filePath,
        RunConfig config
) {

    public static final String TEST_FILE = "test-file";

    public static Task testFile(String filePath, RunConfig config) {
        return new Task(null, TEST_FILE, filePath, config);
    }

    public Task withId(String id) {
        return new Task(id, type, filePath, config);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("id", id);
        map.put("type", type);
        map.put("filePath", filePath);
        map.put("config", config == null ? null : config.toMap());
        return map;
    }

    @SuppressWarnings("unchecked")
    public static Task fromJson(Map<String, Object> map) {
        Object config = map.get("config");
        return new Task(
                (String) map.get("id"),
                (String) map.get("type"),
                (String) map.get("filePath"),
                RunConfig.fromMap(config instanceof Map ? (Map<String, Object>) config : null));
    }

}
