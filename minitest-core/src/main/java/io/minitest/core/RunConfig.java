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
package io.minitest.core;

import io.minitest.common.StringUtils;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable execution settings. Travels inside every parallel task so that a
 * worker runs a file exactly as the sequential path would.
 */
public final class RunConfig {

    public static final long DEFAULT_TIMEOUT_MS = Case.DEFAULT_TIMEOUT_MS;

    private final boolean parallel;
    private final int maxWorkers;
    private final long timeout;
    private final WorkerIsolation isolation;

    private RunConfig(Builder builder) {
        this.parallel = builder.parallel;
        this.maxWorkers = builder.maxWorkers;
        this.timeout = builder.timeout;
        this.isolation = builder.isolation;
    }

    public static RunConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .parallel(parallel)
                .maxWorkers(maxWorkers)
                .timeout(timeout)
                .isolation(isolation);
    }

    public boolean isParallel() {
        return parallel;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    public long getTimeout() {
        return timeout;
    }

    public WorkerIsolation getIsolation() {
        return isolation;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("parallel", parallel);
        map.put("maxWorkers", maxWorkers);
        map.put("timeout", timeout);
        map.put("isolation", isolation.name().toLowerCase());
        return map;
    }

    /**
     * Missing keys keep their defaults.
     */
    public static RunConfig fromMap(Map<String, Object> map) {
        Builder builder = builder();
        if (map == null) {
            return builder.build();
        }
        builder.parallel(StringUtils.toBoolean(map.get("parallel"), builder.parallel));
        builder.maxWorkers(StringUtils.toInt(map.get("maxWorkers"), builder.maxWorkers));
        builder.timeout(StringUtils.toLong(map.get("timeout"), builder.timeout));
        Object isolation = map.get("isolation");
        if (isolation != null) {
            builder.isolation(WorkerIsolation.fromString(isolation.toString()));
        }
        return builder.build();
    }

    @Override
    public String toString() {
        return "RunConfig" + toMap();
    }

    public static class Builder {

        private boolean parallel;
        private int maxWorkers = Runtime.getRuntime().availableProcessors();
        private long timeout = DEFAULT_TIMEOUT_MS;
        private WorkerIsolation isolation = WorkerIsolation.THREAD;

        Builder() {
        }

        public Builder parallel(boolean parallel) {
            this.parallel = parallel;
            return this;
        }

        /**
         * Not validated here, a pool rejects values below one.
         */
        public Builder maxWorkers(int maxWorkers) {
            this.maxWorkers = maxWorkers;
            return this;
        }

        public Builder timeout(long timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder isolation(WorkerIsolation isolation) {
            this.isolation = isolation == null ? WorkerIsolation.THREAD : isolation;
            return this;
        }

        public RunConfig build() {
            return new RunConfig(this);
        }

    }

}
