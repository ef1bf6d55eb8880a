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
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import static com.mastfrog.util.preconditions.Checks.notNull;

/**
 * An action paired with the frame it happened in; the unit code is generated
 * for.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ActionInContext {

    private final FrameDescription frame;
    private final Action action;

    @JsonCreator
    public ActionInContext(@JsonProperty("frame") FrameDescription frame,
            @JsonProperty("action") Action action) {
        this.frame = notNull("frame", frame);
        this.action = notNull("action", action);
    }

    public static ActionInContext onMainFrame(String pageAlias, Action action) {
        return new ActionInContext(FrameDescription.mainFrame(pageAlias), action);
    }

    public FrameDescription frame() {
        return frame;
    }

    public Action action() {
        return action;
    }

    @Override
    public String toString() {
        return action + " in " + frame;
    }
}
