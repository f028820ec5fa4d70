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

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Collects describe, test and hook declarations into a fresh suite tree.
 * <p>
 * One session exists per file load and is discarded afterward, nothing here
 * is static. The "current suite" cursor starts at the root and follows nested
 * {@link #describe} blocks.
 */
public class RegistrationSession {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    public static final String ROOT_SUITE_NAME = "root";

    @FunctionalInterface
    public interface DescribeBlock {
        void define() throws Exception;
    }

    private final long defaultTimeoutMs;
    private final Suite root = new Suite(ROOT_SUITE_NAME);
    private final Deque<Suite> stack = new ArrayDeque<>();

    public RegistrationSession() {
        this(Case.DEFAULT_TIMEOUT_MS);
    }

    public RegistrationSession(long defaultTimeoutMs) {
        this.defaultTimeoutMs = defaultTimeoutMs > 0 ? defaultTimeoutMs : Case.DEFAULT_TIMEOUT_MS;
        stack.push(root);
    }

    private Suite current() {
        return stack.peek();
    }

    /**
     * Declares a child suite of the current one. An error thrown by the block
     * is logged and registration continues; cases registered before it stay.
     */
    public void describe(String name, DescribeBlock block) {
        Suite child = new Suite(name);
        current().addSuite(child);
        stack.push(child);
        try {
            block.define();
        } catch (Throwable t) {
            Failures.rethrowIfUnrecoverable(t);
            logger.error("error in describe block '{}': {}", name, StringUtils.errorMessage(t), t);
        } finally {
            stack.pop();
        }
    }

    public void test(String name, Executable body) {
        test(name, body, defaultTimeoutMs);
    }

    public void test(String name, Executable body, long timeoutMs) {
        current().addCase(Case.of(name, body, timeoutMs));
    }

    public void it(String name, Executable body) {
        test(name, body);
    }

    public void it(String name, Executable body, long timeoutMs) {
        test(name, body, timeoutMs);
    }

    /**
     * Declares a case that settles when the returned stage settles.
     */
    public void testAsync(String name, AsyncExecutable body) {
        testAsync(name, body, defaultTimeoutMs);
    }

    public void testAsync(String name, AsyncExecutable body, long timeoutMs) {
        current().addCase(new Case(name, body, timeoutMs));
    }

    /**
     * Declares a case that is never run. The body is accepted so that a test
     * can be switched off without deleting it.
     */
    public void skip(String name, Executable body) {
        current().addCase(Case.skipped(name));
    }

    public void beforeAll(Executable hook) {
        current().addHook(HookType.BEFORE_ALL, hook);
    }

    public void afterAll(Executable hook) {
        current().addHook(HookType.AFTER_ALL, hook);
    }

    public void beforeEach(Executable hook) {
        current().addHook(HookType.BEFORE_EACH, hook);
    }

    public void afterEach(Executable hook) {
        current().addHook(HookType.AFTER_EACH, hook);
    }

    public long getDefaultTimeoutMs() {
        return defaultTimeoutMs;
    }

    public Suite getRootSuite() {
        return root;
    }

}
