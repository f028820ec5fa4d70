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

import io.minitest.loader.TestFileLoader;
import io.minitest.log.LogContext;
import org.slf4j.Logger;

import java.nio.file.Path;
import java.util.function.Consumer;

/**
 * Runs one test file from scratch: fresh session, fresh load, one suite run.
 * Shared by the sequential path and every worker.
 */
public class FileExecutor {

    private static final Logger logger = LogContext.RUNTIME_LOGGER;

    private final TestFileLoader loader;
    private final RunConfig config;

    public FileExecutor(TestFileLoader loader, RunConfig config) {
        this.loader = loader;
        this.config = config;
    }

    /**
     * @param onCase notified after every case, may be null
     * @throws Exception if the file cannot be loaded or its registration throws
     */
    public FileResult execute(Path file, Consumer<CaseResult> onCase) throws Exception {
        RegistrationSession session = new RegistrationSession(config.getTimeout());
        logger.debug("loading {}", file);
        TestFile testFile = loader.load(file);
        testFile.register(session);
        SuiteResult tree = session.getRootSuite().run(null, onCase);
        logger.debug("{} done, passed: {}, failed: {}, skipped: {}",
                file, tree.getPassed(), tree.getFailed(), tree.getSkipped());
        return FileResult.of(file.toString(), tree);
    }

    public RunConfig getConfig() {
        return config;
    }

}
