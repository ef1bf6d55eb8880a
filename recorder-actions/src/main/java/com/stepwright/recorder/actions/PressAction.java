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
import static com.mastfrog.util.preconditions.Checks.notNull;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * A key press, with any modifiers held while pressing it.
 */
public final class PressAction extends SelectorAction {

    private final String key;
    private final Set<KeyModifier> modifiers;

    @JsonCreator
    public PressAction(@JsonProperty("selector") String selector,
            @JsonProperty("key") String key,
            @JsonProperty("modifiers") @JsonDeserialize(using = KeyModifierSetDeserializer.class) Set<KeyModifier> modifiers,
            @JsonProperty("signals") List<Signal> signals) {
        super(selector, signals);
        this.key = notNull("key", key);
        this.modifiers = modifiers == null || modifiers.isEmpty()
                ? Collections.emptySet()
                : Collections.unmodifiableSet(EnumSet.copyOf(modifiers));
    }

    public PressAction(String selector, String key, Set<KeyModifier> modifiers) {
        this(selector, key, modifiers, Collections.emptyList());
    }

    public String key() {
        return key;
    }

    public Set<KeyModifier> modifiers() {
        return modifiers;
    }

    @Override
    public ActionKind kind() {
        return ActionKind.PRESS;
    }
}
