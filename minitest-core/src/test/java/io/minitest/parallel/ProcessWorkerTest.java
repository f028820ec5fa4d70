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

import io.minitest.TestUtils;
import io.minitest.core.FileResult;
import io.minitest.core.RunConfig;
import io.minitest.core.RunResult;
import io.minitest.core.WorkerIsolation;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ProcessWorkerTest {

    @TempDir
    Path tempDir;

    private static RunConfig processConfig(int maxWorkers) {
        return RunConfig.builder()
                .parallel(true)
                .maxWorkers(maxWorkers)
                .isolation(WorkerIsolation.PROCESS)
                .build();
    }

    @Test
    void testCommandLine() {
        List<String> command = ProcessWorker.command("worker-9");
        assertTrue(command.get(0).endsWith("java"));
        assertEquals(WorkerMain.class.getName(), command.get(3));
        assertEquals(List.of("--worker-id", "worker-9"), command.subList(4, 6));
    }

    @Test
    void testFilesRunInChildProcesses() throws Exception {
        Path a = TestUtils.writePassing(tempDir, "ATest", 2);
        Path b = TestUtils.writeTestFile(tempDir, "NoisyTest", """
                    s.test("prints", () -> System.out.println("{\\"type\\":\\"not-a-message\\"}"));
                    s.test("fails", () -> Assert.isTrue(false));
                """);
        RunResult result = assertTimeoutPreemptively(Duration.ofSeconds(60),
                () -> new ParallelRunner(processConfig(2)).run(List.of(a, b)));
        assertEquals(3, result.getPassed());
        assertEquals(1, result.getFailed());
        FileResult noisy = result.getFiles().get(1);
        assertEquals("Expected false to be true", noisy.getTests().get(1).getError());
    }

    @Test
    void testCrashedProcessIsReplaced() throws Exception {
        Path crash = TestUtils.writeCrashing(tempDir, "CrashTest");
        Path good = TestUtils.writePassing(tempDir, "GoodTest", 1);
        WorkerPool pool = new WorkerPool(1, WorkerFactory.of(WorkerIsolation.PROCESS));
        try {
            pool.initialize();
            String crashId = pool.addTask(Task.testFile(crash.toString(), processConfig(1)));
            String goodId = pool.addTask(Task.testFile(good.toString(), processConfig(1)));
            Map<String, TaskResult> results = pool.waitForCompletion(Duration.ofSeconds(60));
            assertEquals("simulated worker crash", results.get(crashId).error());
            assertTrue(results.get(goodId).success());
            assertEquals(2, pool.getStats().workersCreated());
        } finally {
            pool.shutdown(false);
        }
    }

}
