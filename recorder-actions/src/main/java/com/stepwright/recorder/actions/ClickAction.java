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
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * A mouse click. A click count of two is a double click; the recorder reports
 * higher counts for triple clicks and beyond.
 */
public final class ClickAction extends SelectorAction {

    private final MouseButton button;
    private final Set<KeyModifier> modifiers;
    private final int clickCount;
    private final Position position;

    @JsonCreator
    public ClickAction(@JsonProperty("selector") String selector,
            @JsonProperty("button") MouseButton button,
            @JsonProperty("modifiers") @JsonDeserialize(using = KeyModifierSetDeserializer.class) Set<KeyModifier> modifiers,
            @JsonProperty("clickCount") Integer clickCount,
            @JsonProperty("position") Position position,
            @JsonProperty("signals") List<Signal> signals) {
        super(selector, signals);
        this.button = button == null ? MouseButton.LEFT : button;
        this.modifiers = modifiers == null || modifiers.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
        this.clickCount = clickCount == null ? 1 : clickCount;
        if (this.clickCount < 1) {
            throw new IllegalArgumentException("Click count must be at least 1: " + clickCount);
        }
        this.position = position;
    }

    public ClickAction(String selector, MouseButton button, Set<KeyModifier> modifiers, int clickCount, Position position) {
        this(selector, button, modifiers, clickCount, position, Collections.emptyList());
    }

    public ClickAction(String selector) {
        this(selector, MouseButton.LEFT, Collections.emptySet(), 1, null);
    }

    public MouseButton button() {
        return button;
    }

    /**
     * The modifier keys held, in Alt, Control, Meta, Shift order.
     *
     * @return An unmodifiable set
     */
    public Set<KeyModifier> modifiers() {
        return modifiers;
    }

    public int clickCount() {
        return clickCount;
    }

    public Optional<Position> position() {
        return Optional.ofNullable(position);
    }

    @Override
    public ActionKind kind() {
        return ActionKind.CLICK;
    }
}
