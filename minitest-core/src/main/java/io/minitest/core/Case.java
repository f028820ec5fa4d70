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
import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * A single named test with a timeout.
 * <p>
 * The body runs on a separate daemon thread and is raced against the timeout.
 * A body that loses the race is not interrupted, its eventual outcome is
 * simply ignored.
 */
public class Case {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final long DEFAULT_TIMEOUT_MS = 5000;

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();

    private static final ExecutorService BODY_EXECUTOR = Executors.newCachedThreadPool(r -> {
        Thread thread = new Thread(r, "minitest-case-" + THREAD_COUNTER.incrementAndGet());
        thread.setDaemon(true);
        return thread;
    });

    private final String name;
    private final AsyncExecutable body;
    private final long timeoutMs;

    private CaseStatus status = CaseStatus.PENDING;
    private Throwable error;
    private long durationMs;

    public Case(String name, AsyncExecutable body, long timeoutMs) {
        this.name = name;
        this.body = body;
        this.timeoutMs = timeoutMs > 0 ? timeoutMs : DEFAULT_TIMEOUT_MS;
    }

    public static Case of(String name, Executable body, long timeoutMs) {
        return new Case(name, () -> {
            body.execute();
            return null;
        }, timeoutMs);
    }

    /**
     * A case that is never executed and always ends as skipped.
     */
    public static Case skipped(String name) {
        Case skipped = new Case(name, null, DEFAULT_TIMEOUT_MS);
        skipped.status = CaseStatus.SKIPPED;
        return skipped;
    }

    public void run() {
        if (status == CaseStatus.SKIPPED) {
            return;
        }
        status = CaseStatus.RUNNING;
        long startTime = System.currentTimeMillis();
        try {
            start().get(timeoutMs, TimeUnit.MILLISECONDS);
            status = CaseStatus.PASSED;
        } catch (TimeoutException e) {
            status = CaseStatus.FAILED;
            error = new CaseTimeoutException(name, timeoutMs);
        } catch (ExecutionException e) {
            status = CaseStatus.FAILED;
            error = Failures.unwrap(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            status = CaseStatus.FAILED;
            error = e;
        }
        durationMs = System.currentTimeMillis() - startTime;
        if (error != null) {
            Failures.rethrowIfUnrecoverable(error);
            logger.debug("case failed: {} - {}", name, StringUtils.errorMessage(error));
        } else {
            logger.debug("case passed: {} ({}ms)", name, durationMs);
        }
    }

    private CompletableFuture<Object> start() {
        CompletableFuture<Object> settled = new CompletableFuture<>();
        BODY_EXECUTOR.execute(() -> {
            try {
                CompletionStage<?> stage = body.execute();
                if (stage == null) {
                    settled.complete(null);
                } else {
                    stage.whenComplete((value, t) -> {
                        if (t != null) {
                            settled.completeExceptionally(Failures.unwrap(t));
                        } else {
                            settled.complete(value);
                        }
                    });
                }
            } catch (Throwable t) {
                settled.completeExceptionally(t);
            }
        });
        return settled;
    }

    public CaseResult toResult() {
        return new CaseResult(name, status, durationMs, StringUtils.errorMessage(error));
    }

    public String getName() {
        return name;
    }

    public long getTimeoutMs() {
        return timeoutMs;
    }

    public CaseStatus getStatus() {
        return status;
    }

    public Throwable getError() {
        return error;
    }

    public long getDurationMs() {
        return durationMs;
    }

    @Override
    public String toString() {
        return "Case{" + name + ", " + status.key() + "}";
    }

}
