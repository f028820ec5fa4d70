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
package io.minitest.core;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RunResultTest {

    private static FileResult file(String path) {
        Suite root = new Suite("root");
        root.addCase(Case.of("ok", () -> {}, 1000));
        Suite child = new Suite("child");
        child.addCase(Case.skipped("todo"));
        root.addSuite(child);
        return FileResult.of(path, root.run());
    }

    @Test
    void testJsonShape() {
        RunResult result = new RunResult(List.of(file("a.java"), FileResult.workerFailure("b.java", "worker-1", "boom")), 12);
        Map<String, Object> json = result.toJson();
        assertEquals(List.of("passed", "failed", "skipped", "durationMs", "files"), new ArrayList<>(json.keySet()));
        assertEquals(1, json.get("passed"));
        assertEquals(1, json.get("failed"));
        assertEquals(1, json.get("skipped"));
        assertEquals(12L, json.get("durationMs"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> files = (List<Map<String, Object>>) json.get("files");
        assertEquals(List.of("file", "name", "passed", "failed", "skipped", "durationMs", "tests", "suites"),
                new ArrayList<>(files.get(0).keySet()));
        Map<String, Object> failed = files.get(1);
        assertEquals("worker-1", failed.get("workerId"));
        assertEquals("boom", failed.get("error"));
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tests = (List<Map<String, Object>>) failed.get("tests");
        assertEquals("Worker: b.java", tests.get(0).get("name"));
        assertEquals("failed", tests.get(0).get("status"));
    }

    @Test
    void testFileResultFromJson() {
        FileResult original = file("a.java").withWorkerId("worker-3");
        FileResult copy = FileResult.fromJson(original.toJson());
        assertEquals("a.java", copy.getFile());
        assertEquals("worker-3", copy.getWorkerId());
        assertEquals(1, copy.getPassed());
        assertEquals(1, copy.getSkipped());
        assertEquals("todo", copy.getSuites().get(0).getTests().get(0).getName());
    }

    @Test
    void testEmptyRun() {
        RunResult result = new RunResult(List.of(), 0);
        assertEquals(0, result.getTotal());
        assertFalse(result.isFailed());
    }

}
