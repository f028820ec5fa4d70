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
package io.minitest.log;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Category loggers shared by the runtime.
 * <p>
 * Logback routes all of these to stderr, stdout is reserved for the
 * process-worker protocol.
 */
public final class LogContext {

    /** Logger for runners, suites, cases and the test-file loader */
    public static final Logger RUNTIME_LOGGER = LoggerFactory.getLogger("minitest.runtime");

    /** Logger for the worker pool and its coordinator */
    public static final Logger POOL_LOGGER = LoggerFactory.getLogger("minitest.pool");

    /** Logger for code running inside a worker (thread or child process) */
    public static final Logger WORKER_LOGGER = LoggerFactory.getLogger("minitest.worker");

    private LogContext() {
    }

}
