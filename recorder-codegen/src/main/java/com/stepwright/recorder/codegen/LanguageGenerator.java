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

/**
 * Generates source code in one target language and library from recorded
 * actions. A script is the header, then the fragment for each action in
 * recording order, then the footer.
 * <p>
 * Implementations are stateless; each call builds its output from its
 * arguments alone. They are registered in
 * <code>META-INF/services/com.stepwright.recorder.codegen.LanguageGenerator</code>
 * and need a public no-argument constructor.
 * </p>
 */
public interface LanguageGenerator {

    /**
     * Unique id, used to look the generator up.
     *
     * @return An id
     */
    String id();

    /**
     * Group to list the generator under in a chooser, such as the language
     * name.
     *
     * @return A group name
     */
    String groupName();

    /**
     * Human-readable name.
     *
     * @return A name
     */
    String name();

    /**
     * Syntax highlighting mode for displaying the output.
     *
     * @return A highlighter name
     */
    String highlighter();

    String fileExtension();

    /**
     * Generate code for one action.
     *
     * @param actionInContext The action and where it happened
     * @return Some code, possibly empty, never null
     * @throws com.stepwright.recorder.codegen.error.UnsupportedActionException
     * if this generator has no code for the kind of action
     */
    String generateAction(ActionInContext actionInContext);

    String generateHeader(LanguageGeneratorOptions options);

    /**
     * Generate the end of a script.
     *
     * @param saveStorage If non-null, a path to save browser storage state to
     * when the script finishes
     * @return Some code
     */
    String generateFooter(String saveStorage);
}
