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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * A node in the tree a LinesBuilder accumulates. Nesting is structural, so
 * indentation is computed in a single recursive pass when rendering rather
 * than tracked while lines are appended.
 */
abstract class TextNode {

    abstract void render(LinesSettings settings, int depth, List<String> into);

    static String spaces(int count) {
        char[] c = new char[count];
        Arrays.fill(c, ' ');
        return new String(c);
    }

    static String indentation(LinesSettings settings, int depth) {
        return spaces(settings.baseOffset() + (depth * settings.indentBy()));
    }

    static void renderAll(List<TextNode> nodes, LinesSettings settings, int depth, List<String> into) {
        for (TextNode node : nodes) {
            node.render(settings, depth, into);
        }
    }

    static final class Line extends TextNode {

        private final String text;

        Line(String text) {
            this.text = text;
        }

        @Override
        void render(LinesSettings settings, int depth, List<String> into) {
            into.add(indentation(settings, depth) + text);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    static final class BlankLine extends TextNode {

        static final BlankLine INSTANCE = new BlankLine();

        @Override
        void render(LinesSettings settings, int depth, List<String> into) {
            into.add("");
        }

        @Override
        public String toString() {
            return "";
        }
    }

    /**
     * Text which is already formatted; emitted exactly as passed, with no
     * indentation applied.
     */
    static final class Verbatim extends TextNode {

        private final String text;

        Verbatim(String text) {
            this.text = text;
        }

        @Override
        void render(LinesSettings settings, int depth, List<String> into) {
            into.add(text);
        }

        @Override
        public String toString() {
            return text;
        }
    }

    static final class Block extends TextNode {

        private final String header;
        final List<TextNode> children = new ArrayList<>();

        Block(String header) {
            this.header = header;
        }

        @Override
        void render(LinesSettings settings, int depth, List<String> into) {
            into.add(indentation(settings, depth) + header);
            renderAll(children, settings, depth + 1, into);
        }

        @Override
        public String toString() {
            return header + " " + children;
        }
    }
}
