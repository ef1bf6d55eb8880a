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
package com.stepwright.recorder.codegen;

import static com.stepwright.recorder.codegen.Quoting.escapeWithQuotes;
import static com.stepwright.recorder.codegen.Quoting.quote;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

public class QuotingTest {

    @Test
    public void testDoubleQuotes() {
        assertEquals("\"plain\"", quote("plain"));
        assertEquals("\"say \\\"hi\\\"\"", quote("say \"hi\""));
        assertEquals("\"C:\\\\temp\"", quote("C:\\temp"));
        assertEquals("\"one\\ntwo\"", quote("one\ntwo"));
    }

    @Test
    public void testSingleQuotes() {
        assertEquals("'it\\'s \"x\"'", escapeWithQuotes("it's \"x\"", '\''));
    }

    @Test
    public void testOtherQuoteCharacterIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> escapeWithQuotes("x", '`'));
    }
}
