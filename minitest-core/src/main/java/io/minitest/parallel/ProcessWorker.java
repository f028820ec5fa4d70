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
import io.minitest.loader.JavaSourceLoader;
import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A worker running in a child JVM. Messages are JSON lines: written to the
 * child's stdin, read from its stdout. The child's stderr is logged.
 */
public class ProcessWorker implements Worker {

    private static final Logger logger = LogContext.WORKER_LOGGER;

    private final String id;
    private final long createdAt = System.currentTimeMillis();
    private final WorkerListener listener;
    private final CompletableFuture<Integer> exitFuture = new CompletableFuture<>();
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private Process process;
    private BufferedWriter writer;
    private ExecutorService executor;

    private ProcessWorker(String id, WorkerListener listener) {
        this.id = id;
        this.listener = listener;
    }

    public static ProcessWorker start(String id, WorkerListener listener) throws IOException {
        ProcessWorker worker = new ProcessWorker(id, listener);
        worker.start(command(id));
        return worker;
    }

    static List<String> command(String id) {
        List<String> args = new ArrayList<>();
        args.add(System.getProperty("java.home") + File.separator + "bin" + File.separator + "java");
        args.add("-cp");
        args.add(JavaSourceLoader.defaultClassPath());
        args.add(WorkerMain.class.getName());
        args.add("--worker-id");
        args.add(id);
        return args;
    }

    private void start(List<String> args) throws IOException {
        ProcessBuilder pb = new ProcessBuilder(args);
        pb.redirectErrorStream(false);
        logger.debug("starting {}: {}", id, args);
        process = pb.start();
        writer = new BufferedWriter(new OutputStreamWriter(process.getOutputStream(), StandardCharsets.UTF_8));
        executor = Executors.newFixedThreadPool(3, r -> {
            Thread thread = new Thread(r);
            thread.setDaemon(true);
            return thread;
        });
        Future<?> stdoutReader = executor.submit(() -> {
            Thread.currentThread().setName("minitest-" + id + "-stdout");
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    handleLine(line);
                }
            } catch (IOException e) {
                if (!closed.get()) {
                    logger.warn("{} stdout reader error: {}", id, e.getMessage());
                }
            }
        });
        executor.submit(() -> {
            Thread.currentThread().setName("minitest-" + id + "-stderr");
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    logger.info("[{}] {}", id, line);
                }
            } catch (IOException e) {
                if (!closed.get()) {
                    logger.warn("{} stderr reader error: {}", id, e.getMessage());
                }
            }
        });
        executor.submit(() -> {
            Thread.currentThread().setName("minitest-" + id + "-exit");
            try {
                int code = process.waitFor();
                try {
                    stdoutReader.get();
                } catch (Exception e) {
                    logger.debug("{} stdout reader ended abnormally: {}", id, e.getMessage());
                }
                logger.debug("{} exited with code: {}", id, code);
                exitFuture.complete(code);
            } catch (InterruptedException e) {
                exitFuture.complete(-1);
            } finally {
                executor.shutdown();
            }
        });
    }

    private void handleLine(String line) {
        if (!Json.isJson(line)) {
            logger.debug("[{}] {}", id, line);
            return;
        }
        WorkerMessage message;
        try {
            message = WorkerMessage.fromJson(line);
        } catch (IllegalArgumentException e) {
            logger.warn("{} sent an invalid message: {}", id, e.getMessage());
            return;
        }
        try {
            listener.onMessage(this, message);
        } catch (Exception e) {
            logger.warn("{} listener error: {}", id, e.getMessage());
        }
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
        String line = message.toLine();
        synchronized (this) {
            try {
                writer.write(line);
                writer.newLine();
                writer.flush();
            } catch (IOException e) {
                // the exit future reports the dead process
                logger.warn("{} unable to send {}: {}", id, message.type(), e.getMessage());
            }
        }
    }

    @Override
    public void terminate() {
        if (closed.compareAndSet(false, true)) {
            process.destroyForcibly();
            logger.debug("{} terminated", id);
        }
    }

    @Override
    public CompletableFuture<Integer> getExitFuture() {
        return exitFuture;
    }

    @Override
    public String toString() {
        return "ProcessWorker{" + id + "}";
    }

}
