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

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One recorded user interaction. Subclasses carry only the fields their kind
 * needs; instances are immutable. On the wire, the kind is the
 * <code>name</code> property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "name")
@JsonSubTypes({
    @JsonSubTypes.Type(value = OpenPageAction.class, name = "openPage"),
    @JsonSubTypes.Type(value = ClosePageAction.class, name = "closePage"),
    @JsonSubTypes.Type(value = ClickAction.class, name = "click"),
    @JsonSubTypes.Type(value = CheckAction.class, name = "check"),
    @JsonSubTypes.Type(value = UncheckAction.class, name = "uncheck"),
    @JsonSubTypes.Type(value = FillAction.class, name = "fill"),
    @JsonSubTypes.Type(value = SetInputFilesAction.class, name = "setInputFiles"),
    @JsonSubTypes.Type(value = PressAction.class, name = "press"),
    @JsonSubTypes.Type(value = NavigateAction.class, name = "navigate"),
    @JsonSubTypes.Type(value = SelectAction.class, name = "select"),
    @JsonSubTypes.Type(value = AssertTextAction.class, name = "assertText"),
    @JsonSubTypes.Type(value = AssertValueAction.class, name = "assertValue"),
    @JsonSubTypes.Type(value = AssertCheckedAction.class, name = "assertChecked"),
    @JsonSubTypes.Type(value = AssertVisibleAction.class, name = "assertVisible")
})
@JsonIgnoreProperties(ignoreUnknown = true)
public abstract class Action {

    private final List<Signal> signals;

    Action(List<? extends Signal> signals) {
        List<Signal> copy = new ArrayList<>(signals == null ? 0 : signals.size());
        if (signals != null) {
            for (Signal sig : signals) {
                if (sig != null) {
                    copy.add(sig);
                }
            }
        }
        this.signals = copy.isEmpty() ? Collections.emptyList() : Collections.unmodifiableList(copy);
    }

    public abstract ActionKind kind();

    /**
     * Side effects the recorder attributed to this action, in the order it
     * reported them.
     *
     * @return An unmodifiable list
     */
    public List<Signal> signals() {
        return signals;
    }

    public SignalMap signalMap() {
        return SignalMap.of(signals);
    }

    @Override
    public String toString() {
        return signals.isEmpty() ? kind().toString() : kind() + " " + signals;
    }
}
