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

import io.minitest.TestUtils;
import io.minitest.loader.JavaSourceLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SequentialRunnerTest {

    @TempDir
    Path tempDir;

    @Test
    void testRunsFilesInOrder() throws Exception {
        Path first = TestUtils.writePassing(tempDir, "FirstTest", 2);
        Path second = TestUtils.writeTestFile(tempDir, "SecondTest", """
                    s.describe("math", () -> {
                        s.test("good", () -> Assert.equal(2 * 2, 4));
                        s.test("bad", () -> Assert.equal(2 + 2, 5));
                        s.skip("later", () -> {});
                    });
                """);
        RunResult result = new SequentialRunner(RunConfig.defaults()).run(List.of(first, second));
        assertEquals(3, result.getPassed());
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getSkipped());
        assertEquals(2, result.getFiles().size());
        assertEquals(first.toString(), result.getFiles().get(0).getFile());
        assertEquals(second.toString(), result.getFiles().get(1).getFile());
        assertEquals("root", result.getFiles().get(0).getName());
        assertEquals(1, result.getErrors().size());
        assertTrue(result.getErrors().get(0).contains("Expected 4 to equal 5"));
    }

    @Test
    void testLoadFailureDoesNotAbortRun() throws Exception {
        Path broken = TestUtils.writeSource(tempDir, "BrokenTest", "this does not compile");
        Path good = TestUtils.writePassing(tempDir, "GoodTest", 1);
        RunResult result = new SequentialRunner(RunConfig.defaults()).run(List.of(broken, good));
        assertEquals(1, result.getPassed());
        assertEquals(1, result.getFailed());
        FileResult failed = result.getFiles().get(0);
        assertEquals("BrokenTest.java", failed.getName());
        assertEquals("Loading " + broken, failed.getTests().get(0).getName());
        assertTrue(failed.getError().contains("failed to compile"));
    }

    @Test
    void testRegistrationErrorIsLoadFailure() throws Exception {
        Path crashing = TestUtils.writeCrashing(tempDir, "CrashTest");
        RunResult result = new SequentialRunner(RunConfig.defaults()).run(List.of(crashing));
        assertEquals(1, result.getFailed());
        assertEquals("simulated worker crash", result.getFiles().get(0).getError());
    }

    @Test
    void testTopLevelAssertionFailureIsLoadFailure() throws Exception {
        Path broken = TestUtils.writeTestFile(tempDir, "BrokenTest", """
                    s.test("ok", () -> {});
                    Assert.equal(1, 2);
                """);
        Path good = TestUtils.writePassing(tempDir, "GoodTest", 2);
        RunResult result = new SequentialRunner(RunConfig.defaults()).run(List.of(broken, good));
        assertEquals(2, result.getFiles().size());
        assertEquals(1, result.getFailed());
        assertEquals(2, result.getPassed());
        FileResult first = result.getFiles().get(0);
        assertEquals("Expected 1 to equal 2", first.getError());
        assertEquals("Loading " + broken, first.getTests().get(0).getName());
    }

    @Test
    void testStackOverflowInRegisterIsLoadFailure() throws Exception {
        Path broken = TestUtils.writeTestFile(tempDir, "DeepTest", """
                    throw new StackOverflowError("too deep");
                """);
        Path good = TestUtils.writePassing(tempDir, "AfterTest", 1);
        RunResult result = new SequentialRunner(RunConfig.defaults()).run(List.of(broken, good));
        assertEquals(1, result.getFailed());
        assertEquals(1, result.getPassed());
        assertEquals("too deep", result.getFiles().get(0).getError());
    }

    @Test
    void testDescribeErrorKeepsRegisteredTests() throws Exception {
        Path file = TestUtils.writeTestFile(tempDir, "PartialTest", """
                    s.describe("group", () -> {
                        s.test("registered", () -> {});
                        throw new IllegalStateException("bad block");
                    });
                    s.test("after group", () -> {});
                """);
        RunResult result = new SequentialRunner(RunConfig.defaults()).run(List.of(file));
        assertEquals(2, result.getPassed());
        assertEquals(0, result.getFailed());
        assertNull(result.getFiles().get(0).getError());
    }

    @Test
    void testConfiguredTimeoutApplies() throws Exception {
        Path slow = TestUtils.writeTestFile(tempDir, "SlowTest", """
                    s.test("slow", () -> Thread.sleep(2000));
                """);
        RunConfig config = RunConfig.builder().timeout(50).build();
        RunResult result = new SequentialRunner(config).run(List.of(slow));
        assertEquals(1, result.getFailed());
        assertEquals("slow timeout after 50ms", result.getFiles().get(0).getTests().get(0).getError());
    }

    @Test
    void testListenerReceivesEachFile() throws Exception {
        Path a = TestUtils.writePassing(tempDir, "ATest", 1);
        Path b = TestUtils.writePassing(tempDir, "BTest", 1);
        List<String> seen = new ArrayList<>();
        ResultListener listener = new ResultListener() {
            @Override
            public void onFileEnd(FileResult result) {
                seen.add(Path.of(result.getFile()).getFileName().toString());
            }
        };
        new SequentialRunner(RunConfig.defaults(), new JavaSourceLoader(), List.of(listener)).run(List.of(a, b));
        assertEquals(List.of("ATest.java", "BTest.java"), seen);
    }

}
