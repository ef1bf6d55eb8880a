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

import com.fasterxml.jackson.core.io.JsonStringEncoder;
import static com.mastfrog.util.preconditions.Checks.notNull;

/**
 * String literal quoting shared by all generators. Text is escaped the way
 * JSON escapes it, which is also valid in Python, JavaScript, Java and C#
 * string literals, and then wrapped in the requested quote character.
 */
public final class Quoting {

    private Quoting() {
        throw new AssertionError();
    }

    /**
     * Quote with double quotes.
     *
     * @param text Some text
     * @return A quoted literal
     */
    public static String quote(String text) {
        return escapeWithQuotes(text, '"');
    }

    public static String escapeWithQuotes(String text, char quote) {
        String escaped = new String(JsonStringEncoder.getInstance()
                .quoteAsString(notNull("text", text)));
        switch (quote) {
            case '"':
                return '"' + escaped + '"';
            case '\'':
                return '\'' + escaped.replace("\\\"", "\"").replace("'", "\\'") + '\'';
            default:
                throw new IllegalArgumentException("Invalid quote character: " + quote);
        }
    }
}
