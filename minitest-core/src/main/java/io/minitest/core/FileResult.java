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

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of running one test file: the file's result tree plus where it ran.
 * Produced identically by the sequential and the parallel path.
 */
public class FileResult {

    private final String file;
    private final SuiteResult tree;
    private final String workerId;
    private final String error;

    public FileResult(String file, SuiteResult tree, String workerId, String error) {
        this.file = file;
        this.tree = tree;
        this.workerId = workerId;
        this.error = error;
    }

    public static FileResult of(String file, SuiteResult tree) {
        return new FileResult(file, tree, null, null);
    }

    /**
     * A file that could not be loaded in-process.
     */
    public static FileResult loadFailure(String file, String error) {
        String name = Path.of(file).getFileName().toString();
        return new FileResult(file, SuiteResult.failure(name, "Loading " + file, error), null, error);
    }

    /**
     * A file whose worker task failed, counted as a single failed test.
     */
    public static FileResult workerFailure(String file, String workerId, String error) {
        String name = Path.of(file).getFileName().toString();
        return new FileResult(file, SuiteResult.failure(name, "Worker: " + file, error), workerId, error);
    }

    public FileResult withWorkerId(String workerId) {
        return new FileResult(file, tree, workerId, error);
    }

    public String getFile() {
        return file;
    }

    public String getName() {
        return tree.getName();
    }

    public SuiteResult getTree() {
        return tree;
    }

    public String getWorkerId() {
        return workerId;
    }

    public String getError() {
        return error;
    }

    public int getPassed() {
        return tree.getPassed();
    }

    public int getFailed() {
        return tree.getFailed();
    }

    public int getSkipped() {
        return tree.getSkipped();
    }

    public long getDurationMs() {
        return tree.getDurationMs();
    }

    public List<CaseResult> getTests() {
        return tree.getTests();
    }

    public List<SuiteResult> getSuites() {
        return tree.getSuites();
    }

    public boolean isFailed() {
        return tree.isFailed();
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("file", file);
        if (workerId != null) {
            map.put("workerId", workerId);
        }
        map.put("name", tree.getName());
        tree.putTree(map);
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }

    public static FileResult fromJson(Map<String, Object> map) {
        Object workerId = map.get("workerId");
        Object error = map.get("error");
        return new FileResult(
                (String) map.get("file"),
                SuiteResult.fromJson(map),
                workerId == null ? null : workerId.toString(),
                error == null ? null : error.toString());
    }

    @Override
    public String toString() {
        return "FileResult{" + file + ", passed=" + getPassed() + ", failed=" + getFailed()
                + ", skipped=" + getSkipped() + "}";
    }

}
