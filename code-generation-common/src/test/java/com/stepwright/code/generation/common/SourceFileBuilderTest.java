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

import java.io.IOException;
import static java.nio.charset.StandardCharsets.UTF_8;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import static org.junit.jupiter.api.Assertions.assertEquals;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class SourceFileBuilderTest {

    @TempDir
    Path dir;

    @Test
    public void testSaveIntoNamespace() throws IOException {
        SourceFileBuilder sfb = new TestFile(Optional.of("robots.checkout"));
        assertEquals(Paths.get("robots", "checkout", "tasks.py"), sfb.sourceRootRelativePath());
        Path saved = sfb.save(dir);
        assertEquals(dir.resolve("robots/checkout/tasks.py"), saved);
        assertEquals("def run():\n    go()", new String(Files.readAllBytes(saved), UTF_8));
    }

    @Test
    public void testSaveWithoutNamespace() throws IOException {
        SourceFileBuilder sfb = new TestFile(Optional.empty());
        assertEquals(Paths.get("tasks.py"), sfb.sourceRootRelativePath());
        assertEquals(dir.resolve("tasks.py"), sfb.save(dir));
    }

    static final class TestFile implements SourceFileBuilder {

        private final Optional<String> namespace;

        TestFile(Optional<String> namespace) {
            this.namespace = namespace;
        }

        @Override
        public String name() {
            return "tasks";
        }

        @Override
        public String fileExtension() {
            return "py";
        }

        @Override
        public Optional<String> namespace() {
            return namespace;
        }

        @Override
        public void generateInto(LinesBuilder lines) {
            lines.block("def run():", b -> b.line("go()"));
        }
    }
}
