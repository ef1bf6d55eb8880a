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

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

public class RecordingReaderTest {

    private static List<ActionInContext> recording;

    @BeforeAll
    public static void readFixture() throws IOException {
        try ( InputStream in = RecordingReaderTest.class.getResourceAsStream("recording.json")) {
            assertNotNull(in, "recording.json missing");
            recording = new RecordingReader().read(in);
        }
    }

    @Test
    public void testKindsInOrder() {
        ActionKind[] kinds = recording.stream().map(aic -> aic.action().kind()).toArray(ActionKind[]::new);
        assertEquals(Arrays.asList(ActionKind.OPEN_PAGE, ActionKind.NAVIGATE, ActionKind.CLICK,
                ActionKind.PRESS, ActionKind.SET_INPUT_FILES, ActionKind.ASSERT_TEXT), Arrays.asList(kinds));
    }

    @Test
    public void testFrameDescription() {
        FrameDescription main = recording.get(0).frame();
        assertTrue(main.isMainFrame());
        assertEquals("page", main.pageAlias());
        assertTrue(main.selectorsChain().isEmpty());

        FrameDescription child = recording.get(2).frame();
        assertFalse(child.isMainFrame());
        assertEquals(Arrays.asList("iframe[name=\"checkout\"]"), child.selectorsChain());
        assertEquals("checkout", child.name().get());
        assertEquals("https://example.com/checkout", child.url().get());
    }

    @Test
    public void testClickFields() {
        ClickAction click = (ClickAction) recording.get(2).action();
        assertEquals("internal:role=button[name=\"Pay now\"i]", click.selector());
        assertEquals(MouseButton.RIGHT, click.button());
        assertEquals(EnumSet.of(KeyModifier.CONTROL, KeyModifier.SHIFT), click.modifiers());
        assertEquals(1, click.clickCount());
        assertEquals(new Position(12, 7.5), click.position().get());

        SignalMap signals = click.signalMap();
        assertEquals("page1", signals.popup().get().popupAlias());
        assertTrue(signals.dialog().isPresent());
        assertFalse(signals.download().isPresent());
    }

    @Test
    public void testModifierNamesAndDownload() {
        PressAction press = (PressAction) recording.get(3).action();
        assertEquals("Enter", press.key());
        assertEquals(EnumSet.of(KeyModifier.CONTROL, KeyModifier.SHIFT), press.modifiers());
        assertEquals("1", press.signalMap().download().get().downloadAlias());
    }

    @Test
    public void testNavigationSignalIsReadButNotMapped() {
        Action nav = recording.get(1).action();
        assertEquals(Arrays.asList(Signal.navigation("https://example.com/")), nav.signals());
        assertTrue(nav.signalMap().isEmpty());
    }

    @Test
    public void testListsAndAssertions() {
        SetInputFilesAction files = (SetInputFilesAction) recording.get(4).action();
        assertEquals(Arrays.asList("a.txt", "b.txt"), files.files());
        AssertTextAction assertion = (AssertTextAction) recording.get(5).action();
        assertEquals("42", assertion.text());
        assertTrue(assertion.isSubstring());
    }

    @Test
    public void testUnknownKindFails() {
        String json = "[{\"frame\":{\"pageAlias\":\"page\",\"isMainFrame\":true},"
                + "\"action\":{\"name\":\"hover\",\"selector\":\"a\"}}]";
        assertThrows(IOException.class, () -> new RecordingReader().parse(json));
    }

    @Test
    public void testBadModifierFails() {
        String json = "[{\"frame\":{\"pageAlias\":\"page\",\"isMainFrame\":true},"
                + "\"action\":{\"name\":\"press\",\"selector\":\"a\",\"key\":\"x\",\"modifiers\":[\"Hyper\"]}}]";
        assertThrows(IOException.class, () -> new RecordingReader().parse(json));
    }

    @Test
    public void testDefaultsForMissingClickFields() throws IOException {
        String json = "[{\"frame\":{\"pageAlias\":\"page\",\"isMainFrame\":true},"
                + "\"action\":{\"name\":\"click\",\"selector\":\"#go\"}}]";
        ClickAction click = (ClickAction) new RecordingReader().parse(json).get(0).action();
        assertEquals(MouseButton.LEFT, click.button());
        assertTrue(click.modifiers().isEmpty());
        assertEquals(1, click.clickCount());
        assertFalse(click.position().isPresent());
        assertTrue(click.signals().isEmpty());
    }
}
