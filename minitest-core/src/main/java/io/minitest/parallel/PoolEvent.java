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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lifecycle event of a pooled task. {@code type} is one of
 * {@link #TASK_STARTED}, {@link #TASK_COMPLETED}, {@link #TASK_FAILED} or {@link #TASK_PROGRESS}.
 */
public record PoolEvent(
        String type,
        String taskId,
        String workerId,
        String taskType,
        Map<String, Object> data,
        String error
) {

    public static final String TASK_STARTED = "task-started";
    public static final String TASK_COMPLETED = WorkerMessage.TASK_COMPLETED;
    public static final String TASK_FAILED = WorkerMessage.TASK_FAILED;
    public static final String TASK_PROGRESS = WorkerMessage.TASK_PROGRESS;

    static PoolEvent started(Task task, String workerId) {
        return new PoolEvent(TASK_STARTED, task.id(), workerId, task.type(), null, null);
    }

    static PoolEvent completed(Task task, String workerId, Map<String, Object> result) {
        return new PoolEvent(TASK_COMPLETED, task.id(), workerId, task.type(), result, null);
    }

    static PoolEvent failed(Task task, String workerId, String error) {
        return new PoolEvent(TASK_FAILED, task.id(), workerId, task.type(), null, error);
    }

    static PoolEvent progress(Task task, String workerId, Map<String, Object> data) {
        return new PoolEvent(TASK_PROGRESS, task.id(), workerId, task.type(), data, null);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("taskId", taskId);
        map.put("workerId", workerId);
        if (taskType != null) {
            map.put("taskType", taskType);
        }
        if (data != null) {
            map.put("data", data);
        }
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }

}
