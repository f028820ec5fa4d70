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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregate of a whole run. Totals are always the sum over {@link #getFiles()}.
 */
public class RunResult {

    private final List<FileResult> files;
    private final long durationMs;

    public RunResult(List<FileResult> files, long durationMs) {
        this.files = Collections.unmodifiableList(new ArrayList<>(files));
        this.durationMs = durationMs;
    }

    public List<FileResult> getFiles() {
        return files;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public int getPassed() {
        int count = 0;
        for (FileResult fr : files) {
            count += fr.getPassed();
        }
        return count;
    }

    public int getFailed() {
        int count = 0;
        for (FileResult fr : files) {
            count += fr.getFailed();
        }
        return count;
    }

    public int getSkipped() {
        int count = 0;
        for (FileResult fr : files) {
            count += fr.getSkipped();
        }
        return count;
    }

    public int getTotal() {
        return getPassed() + getFailed() + getSkipped();
    }

    public boolean isFailed() {
        return getFailed() > 0;
    }

    public List<String> getErrors() {
        List<String> errors = new ArrayList<>();
        for (FileResult fr : files) {
            for (String error : fr.getTree().getErrors()) {
                errors.add(fr.getFile() + " - " + error);
            }
        }
        return errors;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("passed", getPassed());
        map.put("failed", getFailed());
        map.put("skipped", getSkipped());
        map.put("durationMs", durationMs);
        List<Map<String, Object>> list = new ArrayList<>(files.size());
        for (FileResult fr : files) {
            list.add(fr.toJson());
        }
        map.put("files", list);
        return map;
    }

    @Override
    public String toString() {
        return "RunResult{files=" + files.size() + ", passed=" + getPassed() + ", failed=" + getFailed()
                + ", skipped=" + getSkipped() + ", durationMs=" + durationMs + "}";
    }

}
