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
import io.minitest.loader.JavaSourceLoader;
import io.minitest.log.LogContext;
import io.minitest.parallel.ParallelRunner;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Main entry point for running test files programmatically.
 * <p>
 * Example usage:
 * <pre>
 * RunResult result = Runner.path("src/test/minitest/MathTest.java", "src/test/minitest/StringTest.java")
 *     .parallel(true)
 *     .maxWorkers(4)
 *     .run();
 * </pre>
 * With parallel enabled and more than one file, files are distributed across a
 * worker pool. If the parallel path fails as a whole, the same files are run
 * again sequentially.
 */
public final class Runner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private Runner() {
    }

    /**
     * Start building a test run with one or more test files.
     */
    public static Builder path(String... paths) {
        return new Builder().path(paths);
    }

    /**
     * Start building a test run with a list of test files.
     */
    public static Builder path(List<String> paths) {
        return new Builder().path(paths);
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========== Builder ==========

    public static class Builder {

        private final List<Path> files = new ArrayList<>();
        private final List<ResultListener> resultListeners = new ArrayList<>();
        private RunConfig.Builder config = RunConfig.builder();

        Builder() {
        }

        public Builder path(String... values) {
            for (String value : values) {
                files.add(Path.of(value));
            }
            return this;
        }

        public Builder path(List<String> values) {
            if (values != null) {
                for (String value : values) {
                    files.add(Path.of(value));
                }
            }
            return this;
        }

        public Builder files(Collection<Path> values) {
            if (values != null) {
                files.addAll(values);
            }
            return this;
        }

        /**
         * Replace all settings with the given config.
         */
        public Builder config(RunConfig value) {
            config = value.toBuilder();
            return this;
        }

        public Builder parallel(boolean enabled) {
            config.parallel(enabled);
            return this;
        }

        public Builder maxWorkers(int count) {
            config.maxWorkers(count);
            return this;
        }

        /**
         * Default timeout for every case that does not declare its own.
         */
        public Builder timeout(long millis) {
            config.timeout(millis);
            return this;
        }

        public Builder isolation(WorkerIsolation isolation) {
            config.isolation(isolation);
            return this;
        }

        public Builder resultListener(ResultListener listener) {
            resultListeners.add(listener);
            return this;
        }

        /**
         * Execute the files. This is the terminal operation.
         */
        public RunResult run() {
            RunConfig rc = config.build();
            List<Path> list = List.copyOf(files);
            for (ResultListener listener : resultListeners) {
                listener.onRunStart(list);
            }
            RunResult result;
            if (rc.isParallel() && list.size() > 1) {
                try {
                    result = new ParallelRunner(rc, resultListeners).run(list);
                } catch (RuntimeException e) {
                    logger.warn("parallel execution failed, falling back to sequential: {}", StringUtils.errorMessage(e));
                    result = new SequentialRunner(rc, new JavaSourceLoader(), resultListeners).run(list);
                }
            } else {
                result = new SequentialRunner(rc, new JavaSourceLoader(), resultListeners).run(list);
            }
            for (ResultListener listener : resultListeners) {
                listener.onRunEnd(result);
            }
            logger.info("run complete, files: {}, passed: {}, failed: {}, skipped: {}, elapsed: {}ms",
                    result.getFiles().size(), result.getPassed(), result.getFailed(), result.getSkipped(),
                    result.getDurationMs());
            return result;
        }

        @Override
        public String toString() {
            return "Runner.Builder{files=" + files + ", config=" + config.build() + "}";
        }

    }

}
