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

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class SignalMapTest {

    @Test
    public void testLastSignalOfAKindWins() {
        SignalMap map = SignalMap.of(Arrays.asList(Signal.popup("page1"), Signal.download(""),
                Signal.popup("page2")));
        assertEquals("page2", map.popup().get().popupAlias());
        assertEquals("", map.download().get().downloadAlias());
        assertTrue(!map.dialog().isPresent());
    }

    @Test
    public void testEmpty() {
        assertSame(SignalMap.EMPTY, SignalMap.of(Collections.emptyList()));
        assertSame(SignalMap.EMPTY, new ClosePageAction().signalMap());
    }

    @Test
    public void testActionSignalsAreImmutable() {
        ClosePageAction close = new ClosePageAction(Arrays.asList(Signal.dialog("d")));
        assertThrows(UnsupportedOperationException.class, () -> close.signals().add(Signal.popup("p")));
    }

    @Test
    public void testNullSignalsAreDropped() {
        ClosePageAction close = new ClosePageAction(Arrays.asList(null, Signal.popup("page1"), null));
        assertEquals(Arrays.asList(Signal.popup("page1")), close.signals());
        assertEquals("page1", close.signalMap().popup().get().popupAlias());
        assertSame(SignalMap.EMPTY, SignalMap.of(Arrays.asList((Signal) null)));
    }

    @Test
    public void testEmptyFrameNameIsAbsent() {
        FrameDescription frame = FrameDescription.childFrame("page", null, "", "https://x.test/f");
        assertTrue(!frame.name().isPresent());
        assertEquals(FrameDescription.childFrame("page", null, null, "https://x.test/f"), frame);
    }

    @Test
    public void testModifierMask() {
        assertEquals(EnumSet.of(KeyModifier.ALT, KeyModifier.META), KeyModifier.fromMask(5));
        assertEquals(15, KeyModifier.toMask(EnumSet.allOf(KeyModifier.class)));
        assertEquals(KeyModifier.CONTROL, KeyModifier.forKeyName("control"));
        assertThrows(IllegalArgumentException.class, () -> KeyModifier.forKeyName("Hyper"));
    }

    @Test
    public void testKindNames() {
        assertEquals(ActionKind.SET_INPUT_FILES, ActionKind.forRecordedName("setInputFiles").get());
        assertTrue(!ActionKind.forRecordedName("hover").isPresent());
        assertEquals("closePage", ActionKind.CLOSE_PAGE.toString());
    }
}
