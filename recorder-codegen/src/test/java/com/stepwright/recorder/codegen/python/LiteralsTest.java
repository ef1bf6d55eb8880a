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
package com.stepwright.recorder.codegen.python;

import com.stepwright.recorder.actions.KeyModifier;
import com.stepwright.recorder.actions.MouseButton;
import com.stepwright.recorder.actions.Position;
import com.stepwright.recorder.codegen.error.UnsupportedValueException;
import static com.stepwright.recorder.codegen.python.Literals.formatValue;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

public class LiteralsTest {

    @Test
    public void testScalars() {
        assertEquals("None", formatValue(null));
        assertEquals("True", formatValue(true));
        assertEquals("False", formatValue(Boolean.FALSE));
        assertEquals("\"hello\"", formatValue("hello"));
        assertEquals("3", formatValue(3));
        assertEquals("2", formatValue(2.0D));
        assertEquals("2.5", formatValue(2.5D));
    }

    @Test
    public void testEnumsUseRecordedNames() {
        assertEquals("\"Shift\"", formatValue(KeyModifier.SHIFT));
        assertEquals("\"right\"", formatValue(MouseButton.RIGHT));
    }

    @Test
    public void testListsAndArrays() {
        assertEquals("[\"a.txt\", \"b.txt\"]", formatValue(Arrays.asList("a.txt", "b.txt")));
        assertEquals("[1, 2]", formatValue(new int[]{1, 2}));
        assertEquals("[]", formatValue(new String[0]));
        assertEquals("[[True], None]", formatValue(Arrays.asList(Arrays.asList(true), null)));
    }

    @Test
    public void testRecordsAndMaps() {
        assertEquals("{\"x\":12,\"y\":7.5}", formatValue(new Position(12, 7.5)));
        Map<String, Object> viewport = new LinkedHashMap<>();
        viewport.put("width", 1280);
        viewport.put("height", 720);
        assertEquals("{\"width\": 1280, \"height\": 720}", formatValue(viewport));
    }

    @Test
    public void testUnrenderableValues() {
        assertThrows(UnsupportedValueException.class, () -> formatValue(Double.NaN));
        assertThrows(UnsupportedValueException.class, () -> formatValue(Double.POSITIVE_INFINITY));
        UnsupportedValueException ex = assertThrows(UnsupportedValueException.class,
                () -> formatValue(Optional.of("x")));
        assertEquals(Optional.class, ex.valueType());
        Runnable r = () -> {
        };
        assertThrows(UnsupportedValueException.class, () -> formatValue(r));
        ex = assertThrows(UnsupportedValueException.class, () -> formatValue(new Object()));
        assertNotNull(ex.getCause());
    }
}
