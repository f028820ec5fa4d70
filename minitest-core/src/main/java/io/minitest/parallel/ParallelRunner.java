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

import io.minitest.core.ConfigurationException;
import io.minitest.core.FileResult;
import io.minitest.core.ResultListener;
import io.minitest.core.RunConfig;
import io.minitest.core.RunResult;
import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Runs each file as one task on a {@link WorkerPool} and collects the
 * results in submission order. The pool is always shut down afterward.
 */
public class ParallelRunner {

    private static final Logger logger = LogContext.POOL_LOGGER;

    private final RunConfig config;
    private final List<ResultListener> listeners;
    private final WorkerFactory factory;
    private final List<PoolListener> poolListeners = new ArrayList<>();

    public ParallelRunner(RunConfig config) {
        this(config, Collections.emptyList());
    }

    public ParallelRunner(RunConfig config, List<ResultListener> listeners) {
        this(config, listeners, WorkerFactory.of(config.getIsolation()));
    }

    public ParallelRunner(RunConfig config, List<ResultListener> listeners, WorkerFactory factory) {
        this.config = config;
        this.listeners = listeners;
        this.factory = factory;
    }

    public ParallelRunner poolListener(PoolListener listener) {
        poolListeners.add(listener);
        return this;
    }

    /**
     * @throws ConfigurationException if parallel execution is not enabled
     * @throws WorkerFaultException   if the pool as a whole failed
     */
    public RunResult run(List<Path> files) {
        if (!config.isParallel()) {
            throw new ConfigurationException("Parallel execution is not enabled in config");
        }
        long startTime = System.currentTimeMillis();
        WorkerPool pool = new WorkerPool(config.getMaxWorkers(), factory);
        for (PoolListener listener : poolListeners) {
            pool.addListener(listener);
        }
        try {
            pool.initialize();
            List<String> taskIds = new ArrayList<>(files.size());
            for (Path file : files) {
                taskIds.add(pool.addTask(Task.testFile(file.toString(), config)));
            }
            logger.info("running {} file(s) on up to {} {} worker(s)",
                    files.size(), config.getMaxWorkers(), config.getIsolation().name().toLowerCase());
            Map<String, TaskResult> results;
            try {
                results = pool.waitForCompletion();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new WorkerFaultException("interrupted while waiting for workers", e);
            }
            List<FileResult> fileResults = new ArrayList<>(files.size());
            for (int i = 0; i < files.size(); i++) {
                TaskResult tr = results.get(taskIds.get(i));
                FileResult fr = tr == null
                        ? FileResult.workerFailure(files.get(i).toString(), null, "no result recorded")
                        : tr.toFileResult();
                fileResults.add(fr);
                for (ResultListener listener : listeners) {
                    listener.onFileEnd(fr);
                }
            }
            long elapsed = System.currentTimeMillis() - startTime;
            RunResult result = new RunResult(fileResults, elapsed);
            logStats(pool.getStats(), result, elapsed);
            return result;
        } finally {
            pool.shutdown(false);
        }
    }

    private static void logStats(PoolStats stats, RunResult result, long elapsed) {
        long avg = stats.tasksCompleted() == 0 ? 0 : elapsed / stats.tasksCompleted();
        logger.info("parallel execution stats - files: {}, tests: {}, workers created: {}, tasks completed: {}, elapsed: {}ms, avg per task: {}ms",
                result.getFiles().size(), result.getTotal(), stats.workersCreated(), stats.tasksCompleted(), elapsed, avg);
    }

}
