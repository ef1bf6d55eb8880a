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

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Identifier case conversions for option names.
 */
public final class Casing {

    private static final Pattern LOWER_THEN_UPPER = Pattern.compile("([a-z0-9])([A-Z])");
    private static final Pattern ACRONYM_THEN_WORD = Pattern.compile("([A-Z])([A-Z][a-z])");

    private Casing() {
        throw new AssertionError();
    }

    /**
     * Convert a camel case name to snake case, keeping acronyms together, so
     * <code>ignoreHTTPSErrors</code> becomes <code>ignore_https_errors</code>.
     *
     * @param name A name
     * @return The name in snake case
     */
    public static String toSnakeCase(String name) {
        String result = LOWER_THEN_UPPER.matcher(name).replaceAll("$1_$2");
        result = ACRONYM_THEN_WORD.matcher(result).replaceAll("$1_$2");
        return result.toLowerCase(Locale.ROOT);
    }
}
