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

import io.minitest.common.StringUtils;
import io.minitest.core.ConfigurationException;
import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Bounded pool of isolated workers fed from an unbounded FIFO task queue.
 * <p>
 * All bookkeeping (queue, running tasks, results, counters) is owned by a
 * single coordinator thread. Worker messages, worker exits and public calls
 * hop onto that thread, so none of the fields below need locking.
 * <p>
 * At most {@code maxWorkers} workers exist at any time. Two are started by
 * {@link #initialize()}, more are started on demand while tasks are waiting.
 * A worker that crashes fails its current task only, and is replaced if work
 * remains.
 */
public class WorkerPool {

    private static final Logger logger = LogContext.POOL_LOGGER;

    public static final int INITIAL_WORKERS = 2;
    public static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

    /**
     * Workers in a row that die before becoming ready, after which the pool
     * gives up if it has no working worker left.
     */
    static final int MAX_START_FAILURES = 3;

    private final int maxWorkers;
    private final WorkerFactory factory;
    private final ExecutorService coordinator;
    private final List<PoolListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong taskCounter = new AtomicLong();
    private final AtomicBoolean shutdownStarted = new AtomicBoolean();
    private volatile Thread coordinatorThread;
    private volatile boolean shutdown;

    // ========== coordinator-confined state ==========

    private final Map<String, WorkerState> workers = new LinkedHashMap<>();
    private final Deque<Task> taskQueue = new ArrayDeque<>();
    private final Map<String, RunningTask> runningTasks = new LinkedHashMap<>();
    private final Map<String, TaskResult> results = new LinkedHashMap<>();
    private final List<CompletableFuture<Map<String, TaskResult>>> completionWaiters = new ArrayList<>();
    private final List<CompletableFuture<Void>> drainWaiters = new ArrayList<>();
    private WorkerFaultException failure;
    private long workerCounter;
    private int startFailures;
    private int tasksTotal;
    private int tasksCompleted;
    private int workersCreated;
    private int workersTerminated;

    private static class WorkerState {

        final Worker worker;
        boolean ready;
        boolean terminating;
        Task currentTask;

        WorkerState(Worker worker) {
            this.worker = worker;
        }

        boolean isIdle() {
            return ready && !terminating && currentTask == null;
        }

    }

    private record RunningTask(Task task, String workerId, long startTime) {
    }

    public WorkerPool(int maxWorkers, WorkerFactory factory) {
        if (maxWorkers < 1) {
            throw new ConfigurationException("maxWorkers must be at least 1, was: " + maxWorkers);
        }
        this.maxWorkers = maxWorkers;
        this.factory = factory;
        this.coordinator = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "minitest-pool-coordinator");
            thread.setDaemon(true);
            coordinatorThread = thread;
            return thread;
        });
    }

    public WorkerPool addListener(PoolListener listener) {
        listeners.add(listener);
        return this;
    }

    /**
     * Starts the first workers, at most two. Fails only if none could be started.
     */
    public void initialize() {
        call(() -> {
            int count = Math.min(maxWorkers, INITIAL_WORKERS);
            for (int i = 0; i < count; i++) {
                createWorker();
            }
            if (workers.isEmpty()) {
                fail("unable to start any worker");
            }
            return null;
        }).join();
        if (failure != null) {
            throw failure;
        }
        logger.debug("pool initialized, workers: {}, max: {}", Math.min(maxWorkers, INITIAL_WORKERS), maxWorkers);
    }

    /**
     * Queues a task and returns its id without waiting for it to be dispatched.
     *
     * @throws IllegalStateException once shutdown has started
     */
    public String addTask(Task task) {
        if (shutdown) {
            throw new IllegalStateException("Cannot add task: worker pool is shutdown");
        }
        Task queued = task.withId("task-" + taskCounter.incrementAndGet());
        submit(() -> {
            taskQueue.add(queued);
            tasksTotal++;
            logger.trace("queued {} for {}", queued.id(), queued.filePath());
            dispatch();
        });
        return queued.id();
    }

    /**
     * Blocks until the queue and the running tasks are both empty. After the
     * pool has shut down this returns the final results right away.
     *
     * @return every result recorded so far, keyed by task id
     * @throws WorkerFaultException if the pool cannot make progress
     */
    public Map<String, TaskResult> waitForCompletion() throws InterruptedException {
        if (coordinator.isTerminated()) {
            return finalResults();
        }
        try {
            return completionFuture().get();
        } catch (ExecutionException e) {
            throw asFault(e.getCause());
        }
    }

    public Map<String, TaskResult> waitForCompletion(Duration timeout) throws InterruptedException, TimeoutException {
        if (coordinator.isTerminated()) {
            return finalResults();
        }
        try {
            return completionFuture().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw asFault(e.getCause());
        }
    }

    private CompletableFuture<Map<String, TaskResult>> completionFuture() {
        return call(() -> {
            CompletableFuture<Map<String, TaskResult>> future = new CompletableFuture<>();
            if (failure != null) {
                future.completeExceptionally(failure);
            } else {
                completionWaiters.add(future);
                checkCompletion();
            }
            return future;
        }).thenCompose(f -> f);
    }

    private Map<String, TaskResult> finalResults() {
        if (failure != null) {
            throw failure;
        }
        return new LinkedHashMap<>(results);
    }

    private static WorkerFaultException asFault(Throwable t) {
        if (t instanceof CompletionException && t.getCause() != null) {
            t = t.getCause();
        }
        if (t instanceof WorkerFaultException) {
            return (WorkerFaultException) t;
        }
        return new WorkerFaultException("worker pool failed: " + StringUtils.errorMessage(t), t);
    }

    /**
     * @param force true to terminate every worker right away, results of
     *              in-flight tasks may be lost
     */
    public void shutdown(boolean force) {
        if (!shutdownStarted.compareAndSet(false, true)) {
            if (force && !coordinator.isShutdown()) {
                call(this::terminateAll).join();
            }
            return;
        }
        shutdown = true;
        if (force) {
            logger.debug("forced shutdown");
            call(this::terminateAll).join();
        } else {
            logger.debug("graceful shutdown");
            call(() -> {
                if (!taskQueue.isEmpty()) {
                    logger.warn("shutdown discards {} queued task(s)", taskQueue.size());
                    taskQueue.clear();
                }
                CompletableFuture<Void> drained = new CompletableFuture<>();
                drainWaiters.add(drained);
                checkCompletion();
                return drained;
            }).thenCompose(f -> f).join();
            List<CompletableFuture<Integer>> exits = call(() -> {
                List<CompletableFuture<Integer>> list = new ArrayList<>();
                for (WorkerState state : workers.values()) {
                    state.terminating = true;
                    state.worker.send(WorkerMessage.shutdown());
                    list.add(state.worker.getExitFuture());
                }
                return list;
            }).join();
            try {
                CompletableFuture.allOf(exits.toArray(new CompletableFuture[0]))
                        .get(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                logger.warn("workers did not exit within {}s, terminating", SHUTDOWN_GRACE.toSeconds());
            } catch (ExecutionException e) {
                logger.warn("error waiting for workers to exit: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            call(this::terminateAll).join();
        }
        coordinator.shutdown();
        try {
            if (!coordinator.awaitTermination(1, TimeUnit.SECONDS)) {
                logger.warn("coordinator did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        logger.debug("pool shutdown complete: {}", computeStats());
    }

    public boolean isShutdown() {
        return shutdown;
    }

    /**
     * Safe to call from a {@link PoolListener}, which runs on the coordinator.
     */
    public PoolStats getStats() {
        if (Thread.currentThread() == coordinatorThread || coordinator.isTerminated()) {
            return computeStats();
        }
        try {
            return call(this::computeStats).join();
        } catch (CompletionException | RejectedExecutionException e) {
            return computeStats();
        }
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    // ========== coordinator ==========

    private <T> CompletableFuture<T> call(Supplier<T> action) {
        return CompletableFuture.supplyAsync(action, coordinator);
    }

    private void submit(Runnable action) {
        try {
            coordinator.execute(() -> {
                try {
                    action.run();
                } catch (RuntimeException e) {
                    logger.error("pool coordinator error: {}", e.getMessage(), e);
                }
            });
        } catch (RejectedExecutionException e) {
            logger.debug("pool already stopped, event dropped");
        }
    }

    private PoolStats computeStats() {
        int active = 0;
        for (WorkerState state : workers.values()) {
            if (state.currentTask != null) {
                active++;
            }
        }
        return new PoolStats(tasksTotal, tasksCompleted, workersCreated, workersTerminated,
                active, taskQueue.size(), runningTasks.size(), workers.size());
    }

    private boolean createWorker() {
        String workerId = "worker-" + (++workerCounter);
        Worker worker;
        try {
            worker = factory.create(workerId, (w, message) -> submit(() -> onMessage(w, message)));
        } catch (Exception e) {
            logger.error("failed to create {}: {}", workerId, StringUtils.errorMessage(e));
            return false;
        }
        workers.put(workerId, new WorkerState(worker));
        workersCreated++;
        worker.getExitFuture().whenComplete((code, t) -> submit(() -> onExit(worker, code == null ? -1 : code)));
        logger.debug("created {}, workers: {}/{}", workerId, workers.size(), maxWorkers);
        return true;
    }

    private int startingCount() {
        int count = 0;
        for (WorkerState state : workers.values()) {
            if (!state.ready && !state.terminating) {
                count++;
            }
        }
        return count;
    }

    private WorkerState findIdle() {
        for (WorkerState state : workers.values()) {
            if (state.isIdle()) {
                return state;
            }
        }
        return null;
    }

    private void dispatch() {
        while (failure == null && !shutdown && !taskQueue.isEmpty()) {
            WorkerState idle = findIdle();
            if (idle != null) {
                assign(idle, taskQueue.poll());
                continue;
            }
            if (workers.size() < maxWorkers && startingCount() < taskQueue.size()) {
                if (createWorker()) {
                    continue;
                }
                if (workers.isEmpty()) {
                    fail("unable to start a worker with " + taskQueue.size() + " task(s) queued");
                }
            }
            break;
        }
        checkCompletion();
    }

    private void assign(WorkerState state, Task task) {
        String workerId = state.worker.getId();
        state.currentTask = task;
        runningTasks.put(task.id(), new RunningTask(task, workerId, System.currentTimeMillis()));
        logger.debug("{} -> {}: {}", task.id(), workerId, task.filePath());
        state.worker.send(WorkerMessage.runTask(task));
        fire(PoolEvent.started(task, workerId));
    }

    private void onMessage(Worker worker, WorkerMessage message) {
        WorkerState state = workers.get(worker.getId());
        if (state == null || state.worker != worker) {
            logger.debug("ignoring {} from removed {}", message.type(), worker.getId());
            return;
        }
        switch (message.type()) {
            case WorkerMessage.WORKER_READY:
                state.ready = true;
                startFailures = 0;
                logger.debug("{} ready", worker.getId());
                dispatch();
                break;
            case WorkerMessage.TASK_COMPLETED:
                finishTask(state, message.taskId(), message.result(), null);
                dispatch();
                break;
            case WorkerMessage.TASK_FAILED:
                if (message.fatal()) {
                    // the worker is about to exit, never hand it another task
                    state.terminating = true;
                }
                if (message.taskId() != null) {
                    finishTask(state, message.taskId(), null, message.error());
                } else {
                    logger.warn("{} failed outside of a task: {}", worker.getId(), message.error());
                }
                dispatch();
                break;
            case WorkerMessage.TASK_PROGRESS:
                RunningTask rt = runningTasks.get(message.taskId());
                if (rt != null) {
                    fire(PoolEvent.progress(rt.task(), worker.getId(), message.data()));
                }
                break;
            default:
                logger.warn("{} sent unexpected message: {}", worker.getId(), message.type());
        }
    }

    private void finishTask(WorkerState state, String taskId, Map<String, Object> result, String error) {
        RunningTask rt = runningTasks.remove(taskId);
        if (state.currentTask != null && state.currentTask.id().equals(taskId)) {
            state.currentTask = null;
        }
        if (rt == null) {
            logger.debug("ignoring result for unknown task: {}", taskId);
            return;
        }
        long durationMs = System.currentTimeMillis() - rt.startTime();
        tasksCompleted++;
        if (error == null) {
            results.put(taskId, TaskResult.completed(rt.task(), rt.workerId(), result, durationMs));
            logger.debug("{} completed by {} in {}ms", taskId, rt.workerId(), durationMs);
            fire(PoolEvent.completed(rt.task(), rt.workerId(), result));
        } else {
            results.put(taskId, TaskResult.failed(rt.task(), rt.workerId(), error, durationMs));
            logger.warn("{} failed on {}: {}", taskId, rt.workerId(), error);
            fire(PoolEvent.failed(rt.task(), rt.workerId(), error));
        }
    }

    private void onExit(Worker worker, int exitCode) {
        WorkerState state = workers.get(worker.getId());
        if (state == null || state.worker != worker) {
            return;
        }
        workers.remove(worker.getId());
        workersTerminated++;
        if (state.currentTask != null) {
            finishTask(state, state.currentTask.id(), null,
                    "worker " + worker.getId() + " exited with code " + exitCode);
        }
        if (exitCode != 0 && !shutdown) {
            logger.warn("{} exited with code {}, workers left: {}", worker.getId(), exitCode, workers.size());
        } else {
            logger.debug("{} exited with code {}", worker.getId(), exitCode);
        }
        if (!state.ready && !shutdown) {
            startFailures++;
            boolean anyReady = false;
            for (WorkerState ws : workers.values()) {
                anyReady |= ws.ready;
            }
            if (startFailures >= MAX_START_FAILURES && !anyReady) {
                fail(startFailures + " workers in a row exited before becoming ready");
                return;
            }
        }
        // replaces the worker if tasks are still queued
        dispatch();
    }

    private Void terminateAll() {
        for (WorkerState state : new ArrayList<>(workers.values())) {
            state.terminating = true;
            state.worker.terminate();
            workers.remove(state.worker.getId());
            workersTerminated++;
            if (state.currentTask != null) {
                finishTask(state, state.currentTask.id(), null, "worker pool was shut down");
            }
        }
        taskQueue.clear();
        checkCompletion();
        return null;
    }

    private void fail(String message) {
        if (failure != null) {
            return;
        }
        failure = new WorkerFaultException(message);
        logger.error("worker pool failed: {}", message);
        for (CompletableFuture<Map<String, TaskResult>> waiter : completionWaiters) {
            waiter.completeExceptionally(failure);
        }
        completionWaiters.clear();
    }

    private void checkCompletion() {
        if (runningTasks.isEmpty()) {
            for (CompletableFuture<Void> waiter : drainWaiters) {
                waiter.complete(null);
            }
            drainWaiters.clear();
        }
        if (failure == null && runningTasks.isEmpty() && taskQueue.isEmpty() && !completionWaiters.isEmpty()) {
            Map<String, TaskResult> snapshot = new LinkedHashMap<>(results);
            for (CompletableFuture<Map<String, TaskResult>> waiter : completionWaiters) {
                waiter.complete(snapshot);
            }
            completionWaiters.clear();
        }
    }

    private void fire(PoolEvent event) {
        for (PoolListener listener : listeners) {
            try {
                listener.onEvent(event);
            } catch (Exception e) {
                logger.warn("pool listener error: {}", e.getMessage());
            }
        }
    }

    @Override
    public String toString() {
        return "WorkerPool{maxWorkers=" + maxWorkers + ", shutdown=" + shutdown + "}";
    }

}
