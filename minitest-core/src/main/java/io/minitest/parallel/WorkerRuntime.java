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
import io.minitest.core.CaseResult;
import io.minitest.core.FileExecutor;
import io.minitest.core.FileResult;
import io.minitest.core.RunConfig;
import io.minitest.loader.JavaSourceLoader;
import io.minitest.loader.TestFileLoader;
import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Worker-side message handling, shared by thread and process workers.
 * <p>
 * Every {@code run-task} gets a fresh session and a fresh load of the file.
 * Exceptions in the task path are reported as {@code task-failed}, errors are
 * left to the worker's last-resort handler, see {@link #fatal(Throwable)}.
 */
public class WorkerRuntime {

    private static final Logger logger = LogContext.WORKER_LOGGER;

    private final String workerId;
    private final Consumer<WorkerMessage> outbound;
    private final TestFileLoader loader;

    private volatile String currentTaskId;

    public WorkerRuntime(String workerId, Consumer<WorkerMessage> outbound) {
        this(workerId, outbound, new JavaSourceLoader());
    }

    public WorkerRuntime(String workerId, Consumer<WorkerMessage> outbound, TestFileLoader loader) {
        this.workerId = workerId;
        this.outbound = outbound;
        this.loader = loader;
    }

    public void ready() {
        outbound.accept(WorkerMessage.workerReady(workerId));
    }

    /**
     * @return false once the worker should stop reading messages
     */
    public boolean handle(WorkerMessage message) {
        switch (message.type()) {
            case WorkerMessage.RUN_TASK:
                runTask(message.task());
                return true;
            case WorkerMessage.SHUTDOWN:
                logger.debug("{} shutting down", workerId);
                return false;
            default:
                logger.warn("{} ignoring unexpected message: {}", workerId, message.type());
                return true;
        }
    }

    void runTask(Task task) {
        currentTaskId = task.id();
        long startTime = System.currentTimeMillis();
        try {
            if (!Task.TEST_FILE.equals(task.type())) {
                throw new IllegalArgumentException("unsupported task type: " + task.type());
            }
            RunConfig config = task.config() == null ? RunConfig.defaults() : task.config();
            FileExecutor executor = new FileExecutor(loader, config);
            FileResult fr = executor.execute(Path.of(task.filePath()),
                    cr -> outbound.accept(WorkerMessage.taskProgress(task.id(), progress(cr))));
            long durationMs = System.currentTimeMillis() - startTime;
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("filePath", task.filePath());
            result.put("results", fr.withWorkerId(workerId).toJson());
            result.put("workerId", workerId);
            result.put("durationMs", durationMs);
            logger.debug("{} completed {} in {}ms", workerId, task.filePath(), durationMs);
            outbound.accept(WorkerMessage.taskCompleted(task.id(), result));
        } catch (Exception e) {
            String error = StringUtils.errorMessage(e);
            logger.warn("{} failed {}: {}", workerId, task.filePath(), error);
            outbound.accept(WorkerMessage.taskFailed(task.id(), error, false));
        }
        // an Error skips this so the last-resort report still knows the task
        currentTaskId = null;
    }

    private static Map<String, Object> progress(CaseResult cr) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("name", cr.getName());
        data.put("status", cr.getStatus().key());
        data.put("durationMs", cr.getDurationMs());
        return data;
    }

    /**
     * Last-resort report, the caller terminates the worker right after.
     */
    public void fatal(Throwable t) {
        logger.error("{} crashed: {}", workerId, t.toString());
        try {
            outbound.accept(WorkerMessage.taskFailed(currentTaskId, StringUtils.errorMessage(t), true));
        } catch (RuntimeException e) {
            logger.error("{} could not report crash: {}", workerId, e.getMessage());
        }
    }

    public String getWorkerId() {
        return workerId;
    }

}
