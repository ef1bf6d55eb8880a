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

import com.stepwright.code.generation.common.LinesBuilder;
import com.stepwright.code.generation.common.SourceFileBuilder;
import static com.stepwright.code.generation.common.util.Utils.notBlank;
import static com.stepwright.code.generation.common.util.Utils.notNull;
import java.util.Optional;

/**
 * The finished text of a generated script, which can be saved as a source
 * file.
 */
public final class GeneratedScript implements SourceFileBuilder {

    public static final String DEFAULT_NAME = "tasks";
    private final String name;
    private final String fileExtension;
    private final String text;
    private final String namespace;

    public GeneratedScript(String name, String fileExtension, String text) {
        this(name, fileExtension, text, null);
    }

    private GeneratedScript(String name, String fileExtension, String text, String namespace) {
        this.name = notBlank("name", name);
        this.fileExtension = notNull("fileExtension", fileExtension);
        this.text = notNull("text", text);
        this.namespace = namespace;
    }

    public GeneratedScript named(String newName) {
        return new GeneratedScript(newName, fileExtension, text, namespace);
    }

    public GeneratedScript inNamespace(String newNamespace) {
        return new GeneratedScript(name, fileExtension, text, newNamespace);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public String fileExtension() {
        return fileExtension;
    }

    @Override
    public Optional<String> namespace() {
        return Optional.ofNullable(namespace);
    }

    public String text() {
        return text;
    }

    @Override
    public void generateInto(LinesBuilder lines) {
        lines.verbatim(text);
    }

    @Override
    public String stringify() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}
