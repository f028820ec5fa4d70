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

import io.minitest.core.FileResult;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one task as recorded by the pool.
 *
 * @param result the worker's {@code task-completed} payload, null on failure
 * @param error  the failure message, null on success
 */
public record TaskResult(
        String taskId,
        String filePath,
        String workerId,
        boolean success,
        Map<String, Object> result,
        String error,
        long durationMs
) {

    public static TaskResult completed(Task task, String workerId, Map<String, Object> result, long durationMs) {
        return new TaskResult(task.id(), task.filePath(), workerId, true, result, null, durationMs);
    }

    public static TaskResult failed(Task task, String workerId, String error, long durationMs) {
        return new TaskResult(task.id(), task.filePath(), workerId, false, null, error, durationMs);
    }

    /**
     * The per-file result in the same shape the sequential path produces.
     * A failed task counts as one failed test.
     */
    @SuppressWarnings("unchecked")
    public FileResult toFileResult() {
        if (success && result != null && result.get("results") instanceof Map) {
            FileResult fr = FileResult.fromJson((Map<String, Object>) result.get("results"));
            return fr.getWorkerId() == null ? fr.withWorkerId(workerId) : fr;
        }
        String message = error == null ? "task produced no results" : error;
        return FileResult.workerFailure(filePath, workerId, message);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("taskId", taskId);
        map.put("filePath", filePath);
        map.put("workerId", workerId);
        map.put("success", success);
        if (result != null) {
            map.put("result", result);
        }
        if (error != null) {
            map.put("error", error);
        }
        map.put("durationMs", durationMs);
        return map;
    }

}
