/*
 * The MIT License
 *
 * Copyright 2022 Mastfrog Technologies.
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
package com.stepwright.recorder.codegen.python;

import static com.stepwright.recorder.codegen.python.Options.formatOptions;
import static com.stepwright.recorder.codegen.python.Options.optionList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;

public class OptionsTest {

    private static Map<String, Object> options() {
        Map<String, Object> map = new HashMap<>();
        map.put("position", null);
        map.put("clickCount", 3);
        map.put("button", "right");
        return map;
    }

    @Test
    public void testSortedKeywordArguments() {
        assertEquals("button=\"right\", click_count=3", formatOptions(options(), false));
        assertEquals(", button=\"right\", click_count=3", formatOptions(options(), true));
    }

    @Test
    public void testDictEntries() {
        assertEquals(Arrays.asList("\"button\": \"right\"", "\"click_count\": 3"), optionList(options(), true));
    }

    @Test
    public void testEmptyOptions() {
        assertEquals("", formatOptions(Collections.emptyMap(), true));
        assertEquals("", formatOptions(Collections.singletonMap("position", null), true));
    }
}
