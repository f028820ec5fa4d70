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

import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * An ordered, nestable group of cases, child suites and hooks.
 * <p>
 * Hooks are inherited from the immediate parent only: a suite run with a
 * parent executes the parent's hooks of the same kind first, then its own.
 * Any hook failure aborts the whole run of this suite and is recorded as a
 * single failing test named {@code "Suite: <name>"}.
 */
public class Suite {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final String name;
    private final List<Case> cases = new ArrayList<>();
    private final List<Suite> children = new ArrayList<>();
    private final Map<HookType, List<Executable>> hooks = new EnumMap<>(HookType.class);

    public Suite(String name) {
        this.name = name;
        for (HookType type : HookType.values()) {
            hooks.put(type, new ArrayList<>());
        }
    }

    public void addCase(Case c) {
        cases.add(c);
    }

    public void addSuite(Suite child) {
        children.add(child);
    }

    public void addHook(HookType type, Executable hook) {
        hooks.get(type).add(hook);
    }

    public SuiteResult run() {
        return run(null, null);
    }

    public SuiteResult run(Suite parent) {
        return run(parent, null);
    }

    /**
     * Runs this suite once, cases first, then child suites depth-first.
     *
     * @param parent the suite whose hooks are inherited, may be null
     * @param onCase notified after every case of this suite and its descendants, may be null
     */
    public SuiteResult run(Suite parent, Consumer<CaseResult> onCase) {
        SuiteResult result = new SuiteResult(name);
        long startTime = System.currentTimeMillis();
        try {
            runHooks(HookType.BEFORE_ALL, parent);
            for (Case c : cases) {
                runHooks(HookType.BEFORE_EACH, parent);
                c.run();
                runHooks(HookType.AFTER_EACH, parent);
                CaseResult caseResult = c.toResult();
                result.addTest(caseResult);
                if (onCase != null) {
                    onCase.accept(caseResult);
                }
            }
            for (Suite child : children) {
                result.addSuite(child.run(this, onCase));
            }
            runHooks(HookType.AFTER_ALL, parent);
        } catch (HookFailureException e) {
            logger.warn("suite '{}' aborted, {} hook failed: {}", name, e.getHookType().key(), e.getMessage());
            CaseResult failure = CaseResult.failed("Suite: " + name, e.getMessage());
            result.addTest(failure);
            if (onCase != null) {
                onCase.accept(failure);
            }
        }
        result.setDurationMs(System.currentTimeMillis() - startTime);
        return result;
    }

    private void runHooks(HookType type, Suite parent) {
        if (parent != null) {
            invokeAll(type, parent.hooks.get(type));
        }
        invokeAll(type, hooks.get(type));
    }

    private static void invokeAll(HookType type, List<Executable> list) {
        for (Executable hook : list) {
            try {
                hook.execute();
            } catch (Throwable t) {
                Failures.rethrowIfUnrecoverable(t);
                throw new HookFailureException(type, t);
            }
        }
    }

    public String getName() {
        return name;
    }

    public List<Case> getCases() {
        return Collections.unmodifiableList(cases);
    }

    public List<Suite> getChildren() {
        return Collections.unmodifiableList(children);
    }

    public List<Executable> getHooks(HookType type) {
        return Collections.unmodifiableList(hooks.get(type));
    }

    @Override
    public String toString() {
        return "Suite{" + name + ", cases=" + cases.size() + ", children=" + children.size() + "}";
    }

}
