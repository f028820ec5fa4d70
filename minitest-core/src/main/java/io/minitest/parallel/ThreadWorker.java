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

import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * A worker backed by one dedicated thread and a mailbox. Test file state is
 * isolated by the class loader of each load.
 * <p>
 * An error escaping the task path reaches the thread's uncaught exception
 * handler, which reports {@code task-failed} as fatal and ends the worker with
 * exit code 1.
 */
public class ThreadWorker implements Worker {

    private static final Logger logger = LogContext.WORKER_LOGGER;

    static final int EXIT_CRASHED = 1;
    static final int EXIT_TERMINATED = 143;

    private final String id;
    private final long createdAt = System.currentTimeMillis();
    private final BlockingQueue<WorkerMessage> mailbox = new LinkedBlockingQueue<>();
    private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
    private final WorkerRuntime runtime;
    private final Thread thread;
    private volatile boolean terminated;

    private ThreadWorker(String id, WorkerListener listener) {
        this.id = id;
        this.runtime = new WorkerRuntime(id, message -> {
            if (!terminated) {
                listener.onMessage(this, message);
            }
        });
        this.thread = new Thread(this::loop, "minitest-" + id);
        thread.setDaemon(true);
        thread.setUncaughtExceptionHandler((t, e) -> {
            try {
                runtime.fatal(e);
            } finally {
                exitFuture.complete(EXIT_CRASHED);
            }
        });
    }

    public static ThreadWorker start(String id, WorkerListener listener) {
        ThreadWorker worker = new ThreadWorker(id, listener);
        worker.thread.start();
        return worker;
    }

    private void loop() {
        runtime.ready();
        try {
            while (!terminated) {
                WorkerMessage message = mailbox.take();
                if (!runtime.handle(message)) {
                    break;
                }
            }
        } catch (InterruptedException e) {
            logger.debug("{} interrupted", id);
        }
        exitFuture.complete(terminated ? EXIT_TERMINATED : 0);
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public long getCreatedAt() {
        return createdAt;
    }

    @Override
    public void send(WorkerMessage message) {
        mailbox.add(message);
    }

    /**
     * The thread is interrupted but may still be finishing a case body, its
     * messages are dropped from here on.
     */
    @Override
    public void terminate() {
        terminated = true;
        thread.interrupt();
        exitFuture.complete(EXIT_TERMINATED);
    }

    @Override
    public CompletableFuture<Integer> getExitFuture() {
        return exitFuture;
    }

    @Override
    public String toString() {
        return "ThreadWorker{" + id + "}";
    }

}
