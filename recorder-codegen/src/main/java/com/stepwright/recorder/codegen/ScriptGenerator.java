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

import static com.mastfrog.util.preconditions.Checks.notNull;
import com.stepwright.recorder.actions.ActionInContext;
import com.stepwright.recorder.codegen.error.ActionGenerationException;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Assembles a complete script from a recording: the generator's header, the
 * code for each action in recording order, and the footer. Actions which
 * produce no code (such as opening a blank page) contribute no line.
 */
public final class ScriptGenerator {

    private static final Logger LOG = Logger.getLogger(ScriptGenerator.class.getName());
    private final LanguageGenerator generator;

    public ScriptGenerator(LanguageGenerator generator) {
        this.generator = notNull("generator", generator);
    }

    public LanguageGenerator generator() {
        return generator;
    }

    /**
     * Generate a script.
     *
     * @param options Session settings for the header and footer
     * @param actions The recording
     * @return A script
     * @throws ActionGenerationException if any action cannot be translated;
     * its cause is the generator's exception
     */
    public GeneratedScript generate(LanguageGeneratorOptions options, List<ActionInContext> actions) {
        notNull("options", options);
        List<String> parts = new ArrayList<>(actions.size() + 2);
        parts.add(generator.generateHeader(options));
        for (int i = 0; i < actions.size(); i++) {
            ActionInContext aic = actions.get(i);
            String code;
            try {
                code = generator.generateAction(aic);
            } catch (RuntimeException ex) {
                LOG.log(Level.WARNING, "Action " + i + " (" + aic + ") failed", ex);
                throw new ActionGenerationException(i, aic.action().kind(), ex);
            }
            LOG.log(Level.FINE, "{0}: {1} -> {2}", new Object[]{i, aic, code});
            if (!code.isEmpty()) {
                parts.add(code);
            }
        }
        parts.add(generator.generateFooter(options.saveStorage().orElse(null)));
        return new GeneratedScript(GeneratedScript.DEFAULT_NAME, generator.fileExtension(),
                String.join("\n", parts));
    }
}
