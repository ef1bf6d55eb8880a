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

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;
import java.io.IOException;
import java.util.EnumSet;
import java.util.Set;

/**
 * Reads modifiers either as the recorder's bitmask or as an array of key
 * names such as <code>["Control", "Shift"]</code>.
 */
final class KeyModifierSetDeserializer extends StdDeserializer<Set<KeyModifier>> {

    public KeyModifierSetDeserializer() {
        super(Set.class);
    }

    @Override
    public Set<KeyModifier> deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
        JsonToken tok = p.currentToken();
        if (tok == JsonToken.VALUE_NUMBER_INT) {
            return KeyModifier.fromMask(p.getIntValue());
        }
        if (tok != JsonToken.START_ARRAY) {
            throw ctxt.wrongTokenException(p, Set.class, JsonToken.START_ARRAY,
                    "modifiers must be a bitmask or an array of key names");
        }
        Set<KeyModifier> result = EnumSet.noneOf(KeyModifier.class);
        while (p.nextToken() != JsonToken.END_ARRAY) {
            String name = p.getValueAsString();
            try {
                result.add(KeyModifier.forKeyName(name));
            } catch (IllegalArgumentException ex) {
                throw ctxt.weirdStringException(name, KeyModifier.class, ex.getMessage());
            }
        }
        return result;
    }
}
