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

import io.minitest.assertions.Assert;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SuiteTest {

    private static Case passing(String name) {
        return Case.of(name, () -> {}, 1000);
    }

    private static Case failing(String name) {
        return Case.of(name, () -> Assert.fail(name), 1000);
    }

    @Test
    void testParentHooksRunBeforeOwn() {
        List<String> calls = new ArrayList<>();
        Suite a = new Suite("A");
        a.addHook(HookType.BEFORE_EACH, () -> calls.add("a1"));
        Suite b = new Suite("B");
        b.addHook(HookType.BEFORE_EACH, () -> calls.add("b1"));
        b.addCase(Case.of("case", () -> calls.add("case"), 1000));
        a.addSuite(b);
        SuiteResult result = a.run();
        assertEquals(List.of("a1", "b1", "case"), calls);
        assertEquals(1, result.getPassed());
    }

    @Test
    void testHooksInheritedFromImmediateParentOnly() {
        List<String> calls = new ArrayList<>();
        Suite root = new Suite("root");
        root.addHook(HookType.BEFORE_EACH, () -> calls.add("r1"));
        Suite a = new Suite("A");
        a.addHook(HookType.BEFORE_EACH, () -> calls.add("a1"));
        Suite b = new Suite("B");
        b.addHook(HookType.BEFORE_EACH, () -> calls.add("b1"));
        b.addCase(Case.of("case", () -> calls.add("case"), 1000));
        root.addSuite(a);
        a.addSuite(b);
        root.run();
        assertEquals(List.of("a1", "b1", "case"), calls);
    }

    @Test
    void testFullLifecycleOrder() {
        List<String> calls = new ArrayList<>();
        Suite s = new Suite("S");
        s.addHook(HookType.BEFORE_ALL, () -> calls.add("beforeAll"));
        s.addHook(HookType.BEFORE_EACH, () -> calls.add("beforeEach"));
        s.addHook(HookType.AFTER_EACH, () -> calls.add("afterEach"));
        s.addHook(HookType.AFTER_ALL, () -> calls.add("afterAll"));
        s.addCase(Case.of("one", () -> calls.add("one"), 1000));
        s.addCase(Case.of("two", () -> calls.add("two"), 1000));
        Suite child = new Suite("child");
        child.addCase(Case.of("three", () -> calls.add("three"), 1000));
        s.addSuite(child);
        s.run();
        assertEquals(List.of(
                "beforeAll",
                "beforeEach", "one", "afterEach",
                "beforeEach", "two", "afterEach",
                "beforeAll", "beforeEach", "three", "afterEach", "afterAll",
                "afterAll"), calls);
    }

    @Test
    void testAggregationIncludesDescendants() {
        Suite root = new Suite("root");
        root.addCase(passing("p1"));
        root.addCase(Case.skipped("s1"));
        Suite child = new Suite("child");
        child.addCase(passing("p2"));
        child.addCase(failing("f1"));
        Suite grandChild = new Suite("grandChild");
        grandChild.addCase(failing("f2"));
        grandChild.addCase(passing("p3"));
        child.addSuite(grandChild);
        root.addSuite(child);
        SuiteResult result = root.run();
        assertEquals(3, result.getPassed());
        assertEquals(2, result.getFailed());
        assertEquals(1, result.getSkipped());
        assertTotalsConsistent(result);
        SuiteResult childResult = result.getSuites().get(0);
        assertEquals(1, childResult.getPassed());
        assertEquals(2, childResult.getFailed());
        assertEquals(List.of("f1: f1", "f2: f2"), result.getErrors());
    }

    private static void assertTotalsConsistent(SuiteResult sr) {
        int expected = sr.getTests().size();
        for (SuiteResult child : sr.getSuites()) {
            assertTotalsConsistent(child);
            expected += child.getTotal();
        }
        assertEquals(expected, sr.getTotal(), "totals of " + sr.getName());
    }

    @Test
    void testBeforeAllFailureAbortsSuite() {
        List<String> calls = new ArrayList<>();
        Suite s = new Suite("db");
        s.addHook(HookType.BEFORE_ALL, () -> {
            throw new IllegalStateException("db down");
        });
        s.addHook(HookType.AFTER_ALL, () -> calls.add("afterAll"));
        s.addCase(Case.of("query", () -> calls.add("query"), 1000));
        SuiteResult result = s.run();
        assertTrue(calls.isEmpty());
        assertEquals(1, result.getFailed());
        assertEquals(0, result.getPassed());
        assertEquals(1, result.getTests().size());
        CaseResult synthetic = result.getTests().get(0);
        assertEquals("Suite: db", synthetic.getName());
        assertEquals(CaseStatus.FAILED, synthetic.getStatus());
        assertEquals("db down", synthetic.getError());
    }

    @Test
    void testAfterAllSkippedWhenEachHookFails() {
        List<String> calls = new ArrayList<>();
        Suite s = new Suite("S");
        s.addCase(passing("first"));
        s.addCase(passing("second"));
        int[] count = {0};
        s.addHook(HookType.AFTER_EACH, () -> {
            if (++count[0] == 2) {
                throw new IllegalStateException("cleanup failed");
            }
        });
        s.addHook(HookType.AFTER_ALL, () -> calls.add("afterAll"));
        SuiteResult result = s.run();
        assertTrue(calls.isEmpty());
        // first recorded, second lost with the abort
        assertEquals(1, result.getPassed());
        assertEquals(1, result.getFailed());
        assertEquals("Suite: S", result.getTests().get(1).getName());
    }

    @Test
    void testInheritedHookFailureIsReportedByChild() {
        Suite parent = new Suite("parent");
        parent.addHook(HookType.BEFORE_EACH, () -> {
            throw new IllegalStateException("no fixture");
        });
        Suite child = new Suite("child");
        child.addCase(passing("t"));
        parent.addSuite(child);
        SuiteResult result = parent.run();
        assertEquals(1, result.getFailed());
        SuiteResult childResult = result.getSuites().get(0);
        assertEquals("Suite: child", childResult.getTests().get(0).getName());
        assertEquals("no fixture", childResult.getTests().get(0).getError());
    }

    @Test
    void testHookFailureDoesNotAbortSiblingSuites() {
        Suite root = new Suite("root");
        Suite broken = new Suite("broken");
        broken.addHook(HookType.BEFORE_ALL, () -> {
            throw new IllegalStateException("nope");
        });
        broken.addCase(passing("unreached"));
        Suite healthy = new Suite("healthy");
        healthy.addCase(passing("reached"));
        root.addSuite(broken);
        root.addSuite(healthy);
        SuiteResult result = root.run();
        assertEquals(1, result.getPassed());
        assertEquals(1, result.getFailed());
    }

    @Test
    void testCaseFailureDoesNotAbortSuite() {
        List<String> calls = new ArrayList<>();
        Suite s = new Suite("S");
        s.addCase(failing("bad"));
        s.addCase(Case.of("good", () -> calls.add("good"), 1000));
        s.addHook(HookType.AFTER_ALL, () -> calls.add("afterAll"));
        SuiteResult result = s.run();
        assertEquals(List.of("good", "afterAll"), calls);
        assertEquals(1, result.getPassed());
        assertEquals(1, result.getFailed());
    }

    @Test
    void testCaseCallbackSeesEveryCase() {
        Suite s = new Suite("S");
        s.addCase(passing("one"));
        Suite child = new Suite("child");
        child.addCase(failing("two"));
        s.addSuite(child);
        List<String> seen = new ArrayList<>();
        s.run(null, cr -> seen.add(cr.getName() + ":" + cr.getStatus().key()));
        assertEquals(List.of("one:passed", "two:failed"), seen);
    }

    @Test
    void testResultJson() {
        Suite s = new Suite("S");
        s.addCase(failing("bad"));
        Map<String, Object> json = s.run().toJson();
        assertEquals(List.of("name", "passed", "failed", "skipped", "durationMs", "tests", "suites"),
                new ArrayList<>(json.keySet()));
        @SuppressWarnings("unchecked")
        Map<String, Object> test = ((List<Map<String, Object>>) json.get("tests")).get(0);
        assertEquals("bad", test.get("name"));
        assertEquals("failed", test.get("status"));
        assertEquals("bad", test.get("error"));
        SuiteResult copy = SuiteResult.fromJson(json);
        assertEquals(1, copy.getFailed());
        assertEquals("bad", copy.getTests().get(0).getName());
    }

}
