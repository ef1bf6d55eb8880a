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

import static com.stepwright.code.generation.common.util.Utils.notNull;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;

/**
 * Accumulates the lines of a generated fragment as a tree of plain lines,
 * blank lines and indented blocks, and renders it with the indentation rules
 * of its LinesSettings. Callers describe nesting with
 * {@link #block(String, Consumer)}; the amount of indentation is decided only
 * when {@link #toString()} is called.
 * <p>
 * For templates, {@link #add(String)} also understands a marker notation in
 * which a line ending with the block-open character starts a block and a line
 * consisting only of the block-close character ends it. Unbalanced markers are
 * rejected rather than producing misindented output.
 * </p>
 */
public final class LinesBuilder {

    private final LinesSettings settings;
    private final List<TextNode> root = new ArrayList<>();
    private List<TextNode> current = root;

    public LinesBuilder(LinesSettings settings) {
        this.settings = notNull("settings", settings);
    }

    public LinesBuilder(int baseOffset) {
        this(new PythonLinesSettings(baseOffset));
    }

    public LinesBuilder() {
        this(new PythonLinesSettings());
    }

    public int indentBy() {
        return settings.indentBy();
    }

    public int baseOffset() {
        return settings.baseOffset();
    }

    public LinesSettings settings() {
        return settings;
    }

    public boolean isEmpty() {
        return root.isEmpty();
    }

    /**
     * Append one or more lines of text; the text is split on line breaks and
     * each piece is trimmed; empty pieces become blank lines.
     *
     * @param text Some text
     * @return this
     */
    public LinesBuilder line(String text) {
        current.addAll(plainLines(text));
        return this;
    }

    public LinesBuilder blankLine() {
        current.add(TextNode.BlankLine.INSTANCE);
        return this;
    }

    /**
     * Append pre-formatted text exactly as passed, one node per line, with no
     * trimming or indentation.
     *
     * @param text Some text
     * @return this
     */
    public LinesBuilder verbatim(String text) {
        for (String part : notNull("text", text).split("\n", -1)) {
            current.add(new TextNode.Verbatim(part));
        }
        return this;
    }

    public LinesBuilder lineComment(String txt) {
        for (String part : notNull("txt", txt).trim().split("\n")) {
            part = part.trim();
            if (part.isEmpty()) {
                current.add(TextNode.BlankLine.INSTANCE);
            } else {
                current.add(new TextNode.Line(settings.lineCommentPrefix() + part));
            }
        }
        return this;
    }

    /**
     * Append a header line followed by a nested block, whose contents are
     * whatever the consumer adds to this builder before it returns.
     *
     * @param header The block header, such as <code>with x() as y:</code>
     * @param c A consumer which populates the block
     * @return this
     */
    public LinesBuilder block(String header, Consumer<LinesBuilder> c) {
        TextNode.Block block = new TextNode.Block(notNull("header", header).trim());
        current.add(block);
        List<TextNode> old = current;
        current = block.children;
        try {
            c.accept(this);
        } finally {
            current = old;
        }
        return this;
    }

    public LinesBuilder generate(CodeGenerator gen) {
        gen.generateInto(this);
        return this;
    }

    /**
     * Insert lines before everything added so far at the top level.
     *
     * @param text Some text
     * @return this
     */
    public LinesBuilder prepend(String text) {
        root.addAll(0, plainLines(text));
        return this;
    }

    /**
     * Append text written in the block marker notation.
     *
     * @param text Some text
     * @return this
     * @throws IllegalStateException if a close marker has no matching open
     * marker, an open marker stands alone on its line, or a block is left
     * open at the end of the text; nothing is appended in that case
     */
    public LinesBuilder add(String text) {
        List<TextNode> parsed = new ArrayList<>();
        Deque<List<TextNode>> stack = new ArrayDeque<>();
        List<TextNode> target = parsed;
        int lineNumber = 0;
        for (String part : notNull("text", text).trim().split("\n")) {
            lineNumber++;
            String ln = part.trim();
            if (ln.isEmpty()) {
                target.add(TextNode.BlankLine.INSTANCE);
            } else if (ln.length() == 1 && ln.charAt(0) == settings.blockClose()) {
                if (stack.isEmpty()) {
                    throw new IllegalStateException("Unmatched '" + settings.blockClose()
                            + "' at line " + lineNumber + " of:\n" + text);
                }
                target = stack.pop();
            } else if (ln.charAt(ln.length() - 1) == settings.blockOpen()) {
                String header = ln.substring(0, ln.length() - 1).trim();
                if (header.isEmpty()) {
                    throw new IllegalStateException("Block with no header at line "
                            + lineNumber + " of:\n" + text);
                }
                TextNode.Block block = new TextNode.Block(header);
                target.add(block);
                stack.push(target);
                target = block.children;
            } else {
                target.add(new TextNode.Line(ln));
            }
        }
        if (!stack.isEmpty()) {
            throw new IllegalStateException(stack.size() + " block(s) not closed with '"
                    + settings.blockClose() + "' in:\n" + text);
        }
        current.addAll(parsed);
        return this;
    }

    private static List<TextNode> plainLines(String text) {
        List<TextNode> result = new ArrayList<>();
        for (String part : notNull("text", text).trim().split("\n")) {
            part = part.trim();
            result.add(part.isEmpty() ? TextNode.BlankLine.INSTANCE : new TextNode.Line(part));
        }
        return result;
    }

    /**
     * Render the lines, indented, joined with newlines with no trailing
     * newline.
     *
     * @return The text
     */
    @Override
    public String toString() {
        List<String> lines = new ArrayList<>(root.size() + 8);
        TextNode.renderAll(root, settings, 0, lines);
        return String.join("\n", lines);
    }
}
