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

import com.stepwright.recorder.actions.ActionInContext;
import com.stepwright.recorder.actions.ActionKind;
import com.stepwright.recorder.actions.AssertVisibleAction;
import com.stepwright.recorder.actions.ClickAction;
import com.stepwright.recorder.actions.OpenPageAction;
import com.stepwright.recorder.codegen.error.ActionGenerationException;
import com.stepwright.recorder.codegen.error.UnsupportedActionException;
import com.stepwright.recorder.codegen.python.RobocorpLanguageGenerator;
import java.io.IOException;
import static java.nio.charset.StandardCharsets.UTF_8;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class ScriptGeneratorTest {

    @TempDir
    Path dir;

    private final RobocorpLanguageGenerator robocorp = new RobocorpLanguageGenerator();

    @Test
    public void testScriptIsHeaderActionsAndFooter() {
        List<ActionInContext> actions = Arrays.asList(
                ActionInContext.onMainFrame("page", new OpenPageAction("about:blank")),
                ActionInContext.onMainFrame("page", new ClickAction("#a")));
        LanguageGeneratorOptions opts = LanguageGeneratorOptions.builder().saveStorage("auth.json").build();
        GeneratedScript script = new ScriptGenerator(robocorp).generate(opts, actions);
        assertEquals(robocorp.generateHeader(opts) + "\n"
                + "    page.locator(\"#a\").click()\n"
                + "\n"
                + "    browser.context().storage_state(path=\"auth.json\")\n"
                + "    # ---------------------", script.text());
        assertEquals("tasks", script.name());
        assertEquals("py", script.fileExtension());
    }

    @Test
    public void testRegexLocatorsHaveTheirImport() {
        GeneratedScript script = new ScriptGenerator(robocorp).generate(LanguageGeneratorOptions.DEFAULTS,
                Arrays.asList(ActionInContext.onMainFrame("page", new ClickAction("internal:text=/sign\\s+in/i"))));
        String text = script.text();
        int use = text.indexOf("re.compile(");
        int imp = text.indexOf("import re\n");
        assertTrue(use > 0, text);
        assertTrue(imp >= 0 && imp < use, text);
    }

    @Test
    public void testFailureNamesTheAction() {
        List<ActionInContext> actions = Arrays.asList(
                ActionInContext.onMainFrame("page", new ClickAction("#a")),
                ActionInContext.onMainFrame("page", new AssertVisibleAction("#done")));
        ActionGenerationException ex = assertThrows(ActionGenerationException.class,
                () -> new ScriptGenerator(robocorp).generate(LanguageGeneratorOptions.DEFAULTS, actions));
        assertEquals(1, ex.index());
        assertEquals(ActionKind.ASSERT_VISIBLE, ex.kind());
        assertTrue(ex.getCause() instanceof UnsupportedActionException, ex::toString);
    }

    @Test
    public void testSave() throws IOException {
        GeneratedScript script = new ScriptGenerator(robocorp).generate(LanguageGeneratorOptions.DEFAULTS,
                Arrays.asList(ActionInContext.onMainFrame("page", new OpenPageAction("https://example.com"))))
                .inNamespace("robots");
        Path saved = script.save(dir);
        assertEquals(dir.resolve("robots").resolve("tasks.py"), saved);
        assertEquals(script.text(), new String(Files.readAllBytes(saved), UTF_8));
    }
}
