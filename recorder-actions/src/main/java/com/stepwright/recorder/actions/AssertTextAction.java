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
package com.stepwright.recorder.actions;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Collections;
import java.util.List;

/**
 * An assertion, recorded in assertion mode, that an element contains (or,
 * when not a substring match, has exactly) some text.
 */
public final class AssertTextAction extends SelectorAction {

    private final String text;
    private final boolean substring;

    @JsonCreator
    public AssertTextAction(@JsonProperty("selector") String selector,
            @JsonProperty("text") String text,
            @JsonProperty("substring") boolean substring,
            @JsonProperty("signals") List<Signal> signals) {
        super(selector, signals);
        this.text = text == null ? "" : text;
        this.substring = substring;
    }

    public AssertTextAction(String selector, String text, boolean substring) {
        this(selector, text, substring, Collections.emptyList());
    }

    public String text() {
        return text;
    }

    public boolean isSubstring() {
        return substring;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.ASSERT_TEXT;
    }
}
