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
 * Snapshot of pool counters.
 *
 * @param activeWorkers workers currently running a task
 * @param totalWorkers  workers alive, busy or idle
 */
public record PoolStats(
        int tasksTotal,
        int tasksCompleted,
        int workersCreated,
        int workersTerminated,
        int activeWorkers,
        int queuedTasks,
        int runningTasks,
        int totalWorkers
) {

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("tasksTotal", tasksTotal);
        map.put("tasksCompleted", tasksCompleted);
        map.put("workersCreated", workersCreated);
        map.put("workersTerminated", workersTerminated);
        map.put("activeWorkers", activeWorkers);
        map.put("queuedTasks", queuedTasks);
        map.put("runningTasks", runningTasks);
        map.put("totalWorkers", totalWorkers);
        return map;
    }

}
