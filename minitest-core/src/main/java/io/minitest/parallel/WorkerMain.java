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
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Entry point of a process worker. Reads messages from stdin and writes
 * messages to stdout, one JSON object per line. Anything else printing to
 * {@code System.out} ends up on stderr.
 */
@Command(
        name = "minitest-worker",
        mixinStandardHelpOptions = true,
        description = "Runs test files on behalf of a minitest worker pool"
)
public class WorkerMain implements Callable<Integer> {

    private static final Logger logger = LogContext.WORKER_LOGGER;

    static final int EXIT_CRASHED = 1;

    @Option(names = "--worker-id", required = true, description = "Id reported back to the pool")
    String workerId;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new WorkerMain()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        PrintStream protocol = new PrintStream(System.out, false, StandardCharsets.UTF_8);
        System.setOut(System.err);
        WorkerRuntime runtime = new WorkerRuntime(workerId, message -> {
            synchronized (protocol) {
                protocol.println(message.toLine());
                protocol.flush();
            }
        });
        Thread.setDefaultUncaughtExceptionHandler((t, e) -> {
            runtime.fatal(e);
            System.exit(EXIT_CRASHED);
        });
        Thread loop = new Thread(() -> readLoop(runtime), "minitest-" + workerId);
        loop.start();
        loop.join();
        logger.debug("{} exiting", workerId);
        return 0;
    }

    private static void readLoop(WorkerRuntime runtime) {
        runtime.ready();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                WorkerMessage message;
                try {
                    message = WorkerMessage.fromJson(line);
                } catch (IllegalArgumentException e) {
                    logger.warn("{} ignoring invalid message: {}", runtime.getWorkerId(), e.getMessage());
                    continue;
                }
                if (!runtime.handle(message)) {
                    break;
                }
            }
        } catch (IOException e) {
            logger.error("{} lost its input: {}", runtime.getWorkerId(), e.getMessage());
        }
    }

}
