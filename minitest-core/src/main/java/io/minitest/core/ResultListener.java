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

import java.nio.file.Path;
import java.util.List;

/**
 * Receives results as a run progresses. Purely observational, a listener
 * cannot change or abort the run. Report renderers plug in here.
 */
public interface ResultListener {

    /**
     * Called once before any file runs.
     *
     * @param files the files about to run, in submission order
     */
    default void onRunStart(List<Path> files) {
    }

    /**
     * Called once per file. On the parallel path this happens after all
     * workers are done, in submission order.
     *
     * @param result the file result
     */
    default void onFileEnd(FileResult result) {
    }

    /**
     * Called once with the aggregate, after a fallback if there was one.
     *
     * @param result the final run result
     */
    default void onRunEnd(RunResult result) {
    }

}
