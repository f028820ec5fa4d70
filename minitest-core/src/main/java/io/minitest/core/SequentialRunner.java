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
import io.minitest.loader.TestFileLoader;
import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs files one after the other in the calling thread. A file that cannot be
 * loaded is recorded as a failed file and the run continues.
 */
public class SequentialRunner {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final FileExecutor executor;
    private final List<ResultListener> listeners;

    public SequentialRunner(RunConfig config) {
        this(config, new JavaSourceLoader(), Collections.emptyList());
    }

    public SequentialRunner(RunConfig config, TestFileLoader loader, List<ResultListener> listeners) {
        this.executor = new FileExecutor(loader, config);
        this.listeners = listeners;
    }

    public RunResult run(List<Path> files) {
        long startTime = System.currentTimeMillis();
        List<FileResult> results = new ArrayList<>(files.size());
        for (Path file : files) {
            FileResult fr;
            try {
                fr = executor.execute(file, null);
            } catch (Throwable t) {
                Failures.rethrowIfUnrecoverable(t);
                String message = StringUtils.errorMessage(t);
                logger.error("failed to load {}: {}", file, message);
                fr = FileResult.loadFailure(file.toString(), message);
            }
            results.add(fr);
            for (ResultListener listener : listeners) {
                listener.onFileEnd(fr);
            }
        }
        return new RunResult(results, System.currentTimeMillis() - startTime);
    }

}
