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
import java.util.Collection;
import java.util.EnumSet;
import java.util.Set;

/**
 * Keyboard modifiers held during a click or key press. The recorder encodes a
 * set of them as a bitmask; sets iterate in declaration order, which is the
 * order generated code lists them in.
 */
public enum KeyModifier {
    ALT("Alt", 1),
    CONTROL("Control", 2),
    META("Meta", 4),
    SHIFT("Shift", 8);

    private final String keyName;
    private final int mask;

    KeyModifier(String keyName, int mask) {
        this.keyName = keyName;
        this.mask = mask;
    }

    public String keyName() {
        return keyName;
    }

    public int mask() {
        return mask;
    }

    public static Set<KeyModifier> fromMask(int bits) {
        Set<KeyModifier> result = EnumSet.noneOf(KeyModifier.class);
        for (KeyModifier mod : values()) {
            if ((bits & mod.mask) != 0) {
                result.add(mod);
            }
        }
        return result;
    }

    public static int toMask(Collection<KeyModifier> mods) {
        int result = 0;
        for (KeyModifier mod : mods) {
            result |= mod.mask;
        }
        return result;
    }

    @JsonCreator
    public static KeyModifier forKeyName(String name) {
        for (KeyModifier mod : values()) {
            if (mod.keyName.equalsIgnoreCase(name)) {
                return mod;
            }
        }
        throw new IllegalArgumentException("Not a modifier key: '" + name + "'");
    }

    @Override
    public String toString() {
        return keyName;
    }
}
