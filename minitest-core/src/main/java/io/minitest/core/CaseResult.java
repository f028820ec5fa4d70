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

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of one case, as recorded in the result tree.
 */
public class CaseResult {

    private final String name;
    private final CaseStatus status;
    private final long durationMs;
    private final String error;

    public CaseResult(String name, CaseStatus status, long durationMs, String error) {
        this.name = name;
        this.status = status;
        this.durationMs = durationMs;
        this.error = error;
    }

    public static CaseResult failed(String name, String error) {
        return new CaseResult(name, CaseStatus.FAILED, 0, error);
    }

    public String getName() {
        return name;
    }

    public CaseStatus getStatus() {
        return status;
    }

    public long getDurationMs() {
        return durationMs;
    }

    public String getError() {
        return error;
    }

    public boolean isPassed() {
        return status == CaseStatus.PASSED;
    }

    public boolean isFailed() {
        return status == CaseStatus.FAILED;
    }

    public boolean isSkipped() {
        return status == CaseStatus.SKIPPED;
    }

    public Map<String, Object> toJson() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("name", name);
        map.put("status", status.key());
        map.put("durationMs", durationMs);
        if (error != null) {
            map.put("error", error);
        }
        return map;
    }

    public static CaseResult fromJson(Map<String, Object> map) {
        Object error = map.get("error");
        return new CaseResult(
                (String) map.get("name"),
                CaseStatus.fromKey((String) map.get("status")),
                StringUtils.toLong(map.get("durationMs"), 0),
                error == null ? null : error.toString());
    }

    @Override
    public String toString() {
        return toJson().toString();
    }

}
