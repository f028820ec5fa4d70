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
package io.minitest.common;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest {

    @Test
    void testParseKeepsOrder() {
        Object parsed = Json.parse("{\"b\":1,\"a\":2,\"c\":3}");
        assertEquals(List.of("b", "a", "c"), new ArrayList<>(((Map<?, ?>) parsed).keySet()));
    }

    @Test
    void testPathAccess() {
        Json json = Json.of("{\"type\":\"task-completed\",\"result\":{\"workerId\":\"worker-1\"}}");
        assertEquals("task-completed", json.get("type"));
        assertEquals("worker-1", json.get("result.workerId"));
        assertTrue(json.getOptional("missing").isEmpty());
        assertFalse(json.pathExists("error"));
    }

    @Test
    void testInvalidJson() {
        assertThrows(IllegalArgumentException.class, () -> Json.parse("not json"));
        assertThrows(IllegalArgumentException.class, () -> Json.parse("42"));
        assertThrows(IllegalArgumentException.class, () -> Json.of(" "));
    }

    @Test
    void testIsJson() {
        assertTrue(Json.isJson("{\"type\":\"shutdown\"}"));
        assertFalse(Json.isJson("Picked up JAVA_TOOL_OPTIONS"));
        assertFalse(Json.isJson(null));
    }

}
