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

import io.minitest.common.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result tree of one suite run. Counts include all descendant suites.
 */
public class SuiteResult {

    private final String name;
    private final List<CaseResult> tests = new ArrayList<>();
    private final List<SuiteResult> suites = new ArrayList<>();
    private int passed;
    private int failed;
    private int skipped;
    private long durationMs;

    public SuiteResult(String name) {
        this.name = name;
    }

    void addTest(CaseResult test) {
        tests.add(test);
        switch (test.getStatus()) {
            case PASSED:
                passed++;
                break;
            case FAILED:
                failed++;
                break;
            case SKIPPED:
                skipped++;
                break;
            default:
                // a case that never reached a final state is not counted
                break;
        }
    }

    void addSuite(SuiteResult child) {
        suites.add(child);
        passed += child.passed;
        failed += child.failed;
        skipped += child.skipped;
    }

    void setDurationMs(long durationMs) {
        this.durationMs = durationMs;
    }

    public String getName() {
        return name;
    }

    public int getPassed() {
        return passed;
    }

    public int getFailed() {
        return failed;
    }

    public int getSkipped() {
        return skipped;
    }

    public int getTotal() {
        return passed + failed + skipped;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public List<CaseResult> getTests() {
        return Collections.unmodifiableList(tests);
    }

    public List<SuiteResult> getSuites() {
        return Collections.unmodifiableList(suites);
    }

    public boolean isFailed() {
        return failed > 0;
    }

    /**
     * Error messages of every failed test in this tree, depth-first.
     */
    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        collectErrors(this, errors);
        return errors;
    }

    private static void collectErrors(SuiteResult sr, List<String> errors) {
        for (CaseResult test : sr.tests) {
            if (test.isFailed()) {
                errors.add(test.getName() + ": " + test.getError());
            }
        }
        for (SuiteResult child : sr.suites) {
            collectErrors(child, errors);
        }
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        putTree(map);
        return map;
    }

    /**
     * Writes every field except {@code name}, used by file results that
     * flatten the tree into their own map.
     */
    void putTree(Map<String, Object> map) {
        map.put("passed", passed);
        map.put("failed", failed);
        map.put("skipped", skipped);
        map.put("durationMs", durationMs);
        List<Map<String, Object>> testList = new ArrayList<>(tests.size());
        for (CaseResult test : tests) {
            testList.add(test.toJson());
        }
        map.put("tests", testList);
        List<Map<String, Object>> suiteList = new ArrayList<>(suites.size());
        for (SuiteResult child : suites) {
            suiteList.add(child.toJson());
        }
        map.put("suites", suiteList);
    }

    /**
     * Rebuilds a tree received over the wire. Counts are taken as sent.
     */
    @SuppressWarnings("unchecked")
    public static SuiteResult fromJson(Map<String, Object> map) {
        SuiteResult sr = new SuiteResult((String) map.get("name"));
        Object testList = map.get("tests");
        if (testList instanceof List) {
            for (Object o : (List<Object>) testList) {
                sr.tests.add(CaseResult.fromJson((Map<String, Object>) o));
            }
        }
        Object suiteList = map.get("suites");
        if (suiteList instanceof List) {
            for (Object o : (List<Object>) suiteList) {
                sr.suites.add(fromJson((Map<String, Object>) o));
            }
        }
        sr.passed = StringUtils.toInt(map.get("passed"), 0);
        sr.failed = StringUtils.toInt(map.get("failed"), 0);
        sr.skipped = StringUtils.toInt(map.get("skipped"), 0);
        sr.durationMs = StringUtils.toLong(map.get("durationMs"), 0);
        return sr;
    }

    /**
     * A tree with a single failing test, used when a file produced no tree at all.
     */
    public static SuiteResult failure(String name, String testName, String error) {
        SuiteResult sr = new SuiteResult(name);
        sr.addTest(CaseResult.failed(testName, error));
        return sr;
    }

    @Override
    public String toString() {
        return "SuiteResult{" + name + ", passed=" + passed + ", failed=" + failed + ", skipped=" + skipped + "}";
    }

}
