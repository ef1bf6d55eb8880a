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
 * Python indentation: four spaces per level, <code>#</code> comments.
 * Blocks in marker notation are written with a trailing <code>{</code> and a
 * standalone <code>}</code>; neither is ever emitted.
 */
public final class PythonLinesSettings implements LinesSettings {

    private final int baseOffset;
    private final int indentBy;

    public PythonLinesSettings(int baseOffset, int indentBy) {
        if (baseOffset < 0) {
            throw new IllegalArgumentException("Negative base offset: " + baseOffset);
        }
        if (indentBy < 0) {
            throw new IllegalArgumentException("Negative indent: " + indentBy);
        }
        this.baseOffset = baseOffset;
        this.indentBy = indentBy;
    }

    public PythonLinesSettings(int baseOffset) {
        this(baseOffset, 4);
    }

    public PythonLinesSettings() {
        this(0, 4);
    }

    @Override
    public String lineCommentPrefix() {
        return "# ";
    }

    @Override
    public int indentBy() {
        return indentBy;
    }

    @Override
    public int baseOffset() {
        return baseOffset;
    }

    @Override
    public char blockOpen() {
        return '{';
    }

    @Override
    public char blockClose() {
        return '}';
    }

    @Override
    public String toString() {
        return "python(offset=" + baseOffset + ", indent=" + indentBy + ")";
    }
}
