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

import java.util.concurrent.CompletableFuture;

/**
 * Pool-side handle of an isolated execution unit. All interaction is by
 * message, the pool never touches worker state directly.
 */
public interface Worker {

    String getId();

    long getCreatedAt();

    /**
     * Delivers a message without blocking the caller.
     */
    void send(WorkerMessage message);

    /**
     * Stops the worker immediately, an in-flight task is abandoned.
     */
    void terminate();

    /**
     * Completes with the exit code once the worker is gone, zero for a clean exit.
     * Every message the worker sent is delivered before this completes.
     */
    CompletableFuture<Integer> getExitFuture();

}
