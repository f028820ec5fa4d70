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
import io.minitest.core.ConfigurationException;
import io.minitest.core.RunConfig;
import io.minitest.core.WorkerIsolation;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerPoolTest {

    @TempDir
    Path tempDir;

    private final RunConfig config = RunConfig.builder().parallel(true).timeout(2000).build();
    private WorkerPool pool;

    @AfterEach
    void cleanup() {
        if (pool != null) {
            pool.shutdown(true);
        }
    }

    private WorkerPool threadPool(int maxWorkers) {
        pool = new WorkerPool(maxWorkers, WorkerFactory.of(WorkerIsolation.THREAD));
        return pool;
    }

    private Task task(Path file) {
        return Task.testFile(file.toString(), config);
    }

    @Test
    void testInitializeCreatesAtMostTwoWorkers() {
        threadPool(4).initialize();
        assertEquals(2, pool.getStats().workersCreated());
        pool.shutdown(false);
        WorkerPool single = new WorkerPool(1, WorkerFactory.of(WorkerIsolation.THREAD));
        single.initialize();
        assertEquals(1, single.getStats().workersCreated());
        single.shutdown(false);
    }

    @Test
    void testMaxWorkersMustBePositive() {
        assertThrows(ConfigurationException.class, () -> new WorkerPool(0, WorkerFactory.of(WorkerIsolation.THREAD)));
    }

    @Test
    void testRunsTasksAndKeysResultsById() throws Exception {
        threadPool(2).initialize();
        String a = pool.addTask(task(TestUtils.writePassing(tempDir, "ATest", 2)));
        String b = pool.addTask(task(TestUtils.writePassing(tempDir, "BTest", 1)));
        assertEquals("task-1", a);
        assertEquals("task-2", b);
        Map<String, TaskResult> results = pool.waitForCompletion();
        assertEquals(2, results.size());
        assertTrue(results.get(a).success());
        assertEquals(2, results.get(a).toFileResult().getPassed());
        assertEquals(1, results.get(b).toFileResult().getPassed());
        PoolStats stats = pool.getStats();
        assertEquals(2, stats.tasksTotal());
        assertEquals(2, stats.tasksCompleted());
        assertEquals(0, stats.queuedTasks());
        assertEquals(0, stats.runningTasks());
    }

    @Test
    void testBackpressureWithSingleWorker() throws Exception {
        threadPool(1);
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxRunning = new AtomicInteger();
        List<Integer> statsRunning = new CopyOnWriteArrayList<>();
        pool.addListener(event -> {
            switch (event.type()) {
                case PoolEvent.TASK_STARTED:
                    maxRunning.accumulateAndGet(running.incrementAndGet(), Math::max);
                    statsRunning.add(pool.getStats().runningTasks());
                    break;
                case PoolEvent.TASK_COMPLETED:
                case PoolEvent.TASK_FAILED:
                    running.decrementAndGet();
                    break;
                default:
                    break;
            }
        });
        pool.initialize();
        for (int i = 1; i <= 5; i++) {
            Path file = TestUtils.writeTestFile(tempDir, "Slow" + i + "Test", """
                        s.test("slow", () -> Thread.sleep(20));
                    """);
            pool.addTask(task(file));
        }
        Map<String, TaskResult> results = pool.waitForCompletion();
        assertEquals(5, results.size());
        assertEquals(1, maxRunning.get());
        assertEquals(List.of(1, 1, 1, 1, 1), statsRunning);
        assertEquals(1, pool.getStats().workersCreated());
    }

    @Test
    void testCrashingWorkerDoesNotAffectOtherTasks() throws Exception {
        threadPool(1).initialize();
        String crash = pool.addTask(task(TestUtils.writeCrashing(tempDir, "CrashTest")));
        String good = pool.addTask(task(TestUtils.writePassing(tempDir, "GoodTest", 2)));
        Map<String, TaskResult> results = pool.waitForCompletion();
        TaskResult crashed = results.get(crash);
        assertFalse(crashed.success());
        assertEquals("simulated worker crash", crashed.error());
        assertEquals("worker-1", crashed.workerId());
        TaskResult passed = results.get(good);
        assertTrue(passed.success());
        assertEquals(2, passed.toFileResult().getPassed());
        assertEquals("worker-2", passed.workerId());
        PoolStats stats = pool.getStats();
        assertEquals(2, stats.workersCreated());
        assertEquals(1, stats.workersTerminated());
    }

    @Test
    void testLoadFailureIsTaskFailure() throws Exception {
        threadPool(1).initialize();
        String id = pool.addTask(task(TestUtils.writeSource(tempDir, "BrokenTest", "not java")));
        TaskResult result = pool.waitForCompletion().get(id);
        assertFalse(result.success());
        assertTrue(result.error().contains("failed to compile"));
        // the worker survives a task failure
        assertEquals(1, pool.getStats().workersCreated());
        assertEquals(0, pool.getStats().workersTerminated());
    }

    @Test
    void testEventsAndProgress() throws Exception {
        threadPool(1);
        List<PoolEvent> events = new CopyOnWriteArrayList<>();
        pool.addListener(events::add);
        pool.initialize();
        Path file = TestUtils.writeTestFile(tempDir, "EventTest", """
                    s.test("one", () -> {});
                    s.test("two", () -> Assert.fail("nope"));
                """);
        String id = pool.addTask(task(file));
        pool.waitForCompletion();
        List<String> types = new ArrayList<>();
        for (PoolEvent event : events) {
            types.add(event.type());
            assertEquals(id, event.taskId());
            assertEquals("worker-1", event.workerId());
        }
        assertEquals(List.of("task-started", "task-progress", "task-progress", "task-completed"), types);
        assertEquals("one", events.get(1).data().get("name"));
        assertEquals("passed", events.get(1).data().get("status"));
        assertEquals("failed", events.get(2).data().get("status"));
        assertEquals(Task.TEST_FILE, events.get(0).taskType());
    }

    @Test
    void testAddTaskAfterShutdown() {
        threadPool(1).initialize();
        pool.shutdown(false);
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> pool.addTask(Task.testFile("x.java", config)));
        assertEquals("Cannot add task: worker pool is shutdown", e.getMessage());
        assertTrue(pool.isShutdown());
        assertEquals(pool.getStats().workersCreated(), pool.getStats().workersTerminated());
    }

    @Test
    void testInitializeFailsWithoutWorkers() {
        pool = new WorkerPool(2, (id, listener) -> {
            throw new IllegalStateException("no resources");
        });
        assertThrows(WorkerFaultException.class, pool::initialize);
    }

    @Test
    void testWaitFailsWhenNoWorkerCanBeCreated() {
        AtomicInteger created = new AtomicInteger();
        pool = new WorkerPool(2, (id, listener) -> {
            if (created.incrementAndGet() > 2) {
                throw new IllegalStateException("no resources");
            }
            return new FakeWorker(id, 1);
        });
        pool.initialize();
        pool.addTask(Task.testFile("x.java", config));
        assertThrows(WorkerFaultException.class, pool::waitForCompletion);
    }

    @Test
    void testWorkersDyingBeforeReadyFailThePool() {
        pool = new WorkerPool(1, (id, listener) -> new FakeWorker(id, 1));
        pool.initialize();
        pool.addTask(Task.testFile("x.java", config));
        WorkerFaultException e = assertThrows(WorkerFaultException.class, pool::waitForCompletion);
        assertTrue(e.getMessage().contains("before becoming ready"));
    }

    @Test
    void testWaitWithTimeout() throws Exception {
        threadPool(1).initialize();
        Path file = TestUtils.writeTestFile(tempDir, "SleepyTest", """
                    s.test("sleepy", () -> Thread.sleep(1500));
                """);
        pool.addTask(task(file));
        assertThrows(TimeoutException.class, () -> pool.waitForCompletion(Duration.ofMillis(100)));
    }

    @Test
    void testGracefulShutdownWaitsForRunningTask() throws Exception {
        threadPool(1).initialize();
        Path file = TestUtils.writeTestFile(tempDir, "BriefTest", """
                    s.test("brief", () -> Thread.sleep(200));
                """);
        String id = pool.addTask(task(file));
        List<PoolEvent> completed = new CopyOnWriteArrayList<>();
        pool.addListener(event -> {
            if (event.type().equals(PoolEvent.TASK_COMPLETED)) {
                completed.add(event);
            }
        });
        // wait for the task to be picked up
        long deadline = System.currentTimeMillis() + 10_000;
        while (pool.getStats().runningTasks() == 0 && pool.getStats().tasksCompleted() == 0
                && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        pool.shutdown(false);
        assertEquals(1, completed.size());
        assertEquals(id, completed.get(0).taskId());
    }

    @Test
    void testGracefulShutdownTerminatesWorkerAfterGrace() {
        List<FakeWorker> created = new CopyOnWriteArrayList<>();
        pool = new WorkerPool(1, (id, listener) -> {
            FakeWorker worker = FakeWorker.unresponsive(id, listener);
            created.add(worker);
            return worker;
        });
        pool.initialize();
        long start = System.currentTimeMillis();
        pool.shutdown(false);
        long elapsed = System.currentTimeMillis() - start;
        assertTrue(elapsed >= WorkerPool.SHUTDOWN_GRACE.toMillis(), "returned after " + elapsed + "ms");
        FakeWorker worker = created.get(0);
        assertEquals(WorkerMessage.SHUTDOWN, worker.getReceived().get(0).type());
        assertTrue(worker.isTerminated());
        PoolStats stats = pool.getStats();
        assertEquals(1, stats.workersCreated());
        assertEquals(stats.workersCreated(), stats.workersTerminated());
        assertEquals(0, stats.totalWorkers());
    }

    @Test
    void testForcedShutdownFailsTaskInFlight() throws Exception {
        pool = new WorkerPool(1, FakeWorker::unresponsive);
        List<PoolEvent> failed = new CopyOnWriteArrayList<>();
        pool.addListener(event -> {
            if (event.type().equals(PoolEvent.TASK_FAILED)) {
                failed.add(event);
            }
        });
        pool.initialize();
        String id = pool.addTask(Task.testFile("stuck.java", config));
        long deadline = System.currentTimeMillis() + 10_000;
        while (pool.getStats().runningTasks() == 0 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, pool.getStats().runningTasks());
        pool.shutdown(true);
        assertEquals(1, failed.size());
        assertEquals(id, failed.get(0).taskId());
        Map<String, TaskResult> results = pool.waitForCompletion();
        TaskResult result = results.get(id);
        assertFalse(result.success());
        assertEquals("worker pool was shut down", result.error());
        PoolStats stats = pool.getStats();
        assertEquals(1, stats.tasksCompleted());
        assertEquals(0, stats.runningTasks());
        assertEquals(stats.workersCreated(), stats.workersTerminated());
    }

}
