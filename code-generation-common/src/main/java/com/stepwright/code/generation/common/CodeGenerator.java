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
package com.stepwright.code.generation.common;

/**
 * Element of a generated script, which can format itself into a LinesBuilder,
 * which owns indentation, block nesting and comment syntax.
 */
public interface CodeGenerator {

    /**
     * Drive the passed LinesBuilder to append the contents of this element to
     * it.
     *
     * @param lines A LinesBuilder
     */
    void generateInto(LinesBuilder lines);

    /**
     * Create a single-line element; the text is trimmed, and multiple lines
     * become multiple sibling lines.
     *
     * @param text Some code
     * @return A generator
     */
    public static CodeGenerator line(String text) {
        return lb -> lb.line(text);
    }

    /**
     * Create a new LinesBuilder, preconfigured with the formatting settings
     * for the language being generated; the default is Python with no base
     * offset.
     *
     * @return A new LinesBuilder
     */
    default LinesBuilder newLinesBuilder() {
        return new LinesBuilder(new PythonLinesSettings());
    }

    /**
     * Render this element into a new LinesBuilder.
     *
     * @return A string
     */
    default String stringify() {
        LinesBuilder lb = newLinesBuilder();
        generateInto(lb);
        return lb.toString();
    }
}
