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
import io.minitest.core.RunConfig;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class WorkerMessageTest {

    @Test
    void testRunTaskWireFormat() {
        Task task = Task.testFile("/tmp/MathTest.java", RunConfig.builder().timeout(100).build()).withId("task-7");
        String line = WorkerMessage.runTask(task).toLine();
        Json json = Json.of(line);
        assertEquals("run-task", json.get("type"));
        assertEquals("task-7", json.get("task.id"));
        assertEquals("test-file", json.get("task.type"));
        assertEquals("/tmp/MathTest.java", json.get("task.filePath"));
        assertEquals(100, json.<Number>get("task.config.timeout").intValue());
        WorkerMessage parsed = WorkerMessage.fromJson(line);
        assertEquals("task-7", parsed.taskId());
        assertEquals(100, parsed.task().config().getTimeout());
    }

    @Test
    void testWorkerToPoolMessages() {
        assertEquals("{\"type\":\"worker-ready\",\"workerId\":\"worker-1\"}",
                WorkerMessage.workerReady("worker-1").toLine());
        assertEquals("{\"type\":\"shutdown\"}", WorkerMessage.shutdown().toLine());
        Map<String, Object> failed = WorkerMessage.taskFailed("task-1", "boom", false).toJson();
        assertEquals(List.of("type", "taskId", "error"), new ArrayList<>(failed.keySet()));
        Map<String, Object> fatal = WorkerMessage.taskFailed("task-1", "boom", true).toJson();
        assertEquals(true, fatal.get("fatal"));
    }

    @Test
    void testParseCompletedMessage() {
        String line = "{\"type\":\"task-completed\",\"taskId\":\"task-2\",\"result\":"
                + "{\"filePath\":\"a.java\",\"results\":{\"file\":\"a.java\",\"passed\":1},\"workerId\":\"worker-1\",\"durationMs\":5}}";
        WorkerMessage message = WorkerMessage.fromJson(line);
        assertTrue(message.is(WorkerMessage.TASK_COMPLETED));
        assertEquals("task-2", message.taskId());
        assertEquals("worker-1", message.result().get("workerId"));
        assertFalse(message.fatal());
    }

    @Test
    void testMessageWithoutType() {
        assertThrows(IllegalArgumentException.class, () -> WorkerMessage.fromJson("{\"taskId\":\"task-1\"}"));
    }

}
