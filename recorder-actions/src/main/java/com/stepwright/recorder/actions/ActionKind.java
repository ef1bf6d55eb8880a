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

import java.util.Optional;

/**
 * The kinds of action the recorder emits, under the names it uses on the
 * wire.
 */
public enum ActionKind {
    OPEN_PAGE("openPage"),
    CLOSE_PAGE("closePage"),
    CLICK("click"),
    CHECK("check"),
    UNCHECK("uncheck"),
    FILL("fill"),
    SET_INPUT_FILES("setInputFiles"),
    PRESS("press"),
    NAVIGATE("navigate"),
    SELECT("select"),
    ASSERT_TEXT("assertText"),
    ASSERT_VALUE("assertValue"),
    ASSERT_CHECKED("assertChecked"),
    ASSERT_VISIBLE("assertVisible");

    private final String recordedName;

    ActionKind(String recordedName) {
        this.recordedName = recordedName;
    }

    public String recordedName() {
        return recordedName;
    }

    public static Optional<ActionKind> forRecordedName(String name) {
        for (ActionKind kind : values()) {
            if (kind.recordedName.equals(name)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return recordedName;
    }
}
