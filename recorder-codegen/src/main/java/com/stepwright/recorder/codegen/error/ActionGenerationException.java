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
package com.stepwright.recorder.codegen.error;

import com.stepwright.recorder.actions.ActionKind;

/**
 * Identifies which recorded step of a script could not be translated.
 */
public final class ActionGenerationException extends CodeGenerationException {

    private final int index;
    private final ActionKind kind;

    public ActionGenerationException(int index, ActionKind kind, RuntimeException cause) {
        super("Could not generate code for action " + index + " (" + kind + "): "
                + cause.getMessage(), cause);
        this.index = index;
        this.kind = kind;
    }

    /**
     * The zero-based position of the failed action in the recording.
     *
     * @return An index
     */
    public int index() {
        return index;
    }

    public ActionKind kind() {
        return kind;
    }
}
