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

import io.minitest.common.Json;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A message between the pool and a worker. The {@code type} strings and field
 * names are the wire contract of process workers and must not change.
 * <ul>
 * <li>pool to worker: {@code run-task{task}}, {@code shutdown}</li>
 * <li>worker to pool: {@code worker-ready{workerId}}, {@code task-completed{taskId, result}},
 * {@code task-failed{taskId, error, fatal?}}, {@code task-progress{taskId, data}}</li>
 * </ul>
 */
public record WorkerMessage(
        String type,
        String workerId,
        String taskId,
        Task task,
        Map<String, Object> result,
        String error,
        Map<String, Object> data,
        boolean fatal
) {

    public static final String RUN_TASK = "run-task";
    public static final String SHUTDOWN = "shutdown";
    public static final String WORKER_READY = "worker-ready";
    public static final String TASK_COMPLETED = "task-completed";
    public static final String TASK_FAILED = "task-failed";
    public static final String TASK_PROGRESS = "task-progress";

    public static WorkerMessage runTask(Task task) {
        return new WorkerMessage(RUN_TASK, null, task.id(), task, null, null, null, false);
    }

    public static WorkerMessage shutdown() {
        return new WorkerMessage(SHUTDOWN, null, null, null, null, null, null, false);
    }

    public static WorkerMessage workerReady(String workerId) {
        return new WorkerMessage(WORKER_READY, workerId, null, null, null, null, null, false);
    }

    public static WorkerMessage taskCompleted(String taskId, Map<String, Object> result) {
        return new WorkerMessage(TASK_COMPLETED, null, taskId, null, result, null, null, false);
    }

    /**
     * @param fatal true when sent by the last-resort handler right before the worker exits
     */
    public static WorkerMessage taskFailed(String taskId, String error, boolean fatal) {
        return new WorkerMessage(TASK_FAILED, null, taskId, null, null, error, null, fatal);
    }

    public static WorkerMessage taskProgress(String taskId, Map<String, Object> data) {
        return new WorkerMessage(TASK_PROGRESS, null, taskId, null, null, null, data, false);
    }

    public boolean is(String messageType) {
        return messageType.equals(type);
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        if (workerId != null) {
            map.put("workerId", workerId);
        }
        if (task != null) {
            map.put("task", task.toJson());
        } else if (taskId != null) {
            map.put("taskId", taskId);
        }
        if (result != null) {
            map.put("result", result);
        }
        if (error != null) {
            map.put("error", error);
        }
        if (data != null) {
            map.put("data", data);
        }
        if (fatal) {
            map.put("fatal", true);
        }
        return map;
    }

    /**
     * Single line JSON, as written to a process worker's stdin or stdout.
     */
    public String toLine() {
        return Json.stringify(toJson());
    }

    /**
     * @throws IllegalArgumentException if the line is not a JSON object with a type
     */
    public static WorkerMessage fromJson(String line) {
        Json json = Json.of(line);
        String type = json.<String>getOptional("type")
                .orElseThrow(() -> new IllegalArgumentException("message has no type: " + line));
        Task task = json.<Map<String, Object>>getOptional("task").map(Task::fromJson).orElse(null);
        String taskId = json.<String>getOptional("taskId").orElse(task == null ? null : task.id());
        return new WorkerMessage(
                type,
                json.<String>getOptional("workerId").orElse(null),
                taskId,
                task,
                json.<Map<String, Object>>getOptional("result").orElse(null),
                json.<String>getOptional("error").orElse(null),
                json.<Map<String, Object>>getOptional("data").orElse(null),
                json.<Boolean>getOptional("fatal").orElse(false));
    }

}
