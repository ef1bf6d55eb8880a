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

import java.util.Arrays;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import org.junit.jupiter.api.Test;

public class PythonLocatorAdapterTest {

    private final PythonLocatorAdapter adapter = new PythonLocatorAdapter();

    private String locator(String selector) {
        return adapter.toLocator("python", selector);
    }

    @Test
    public void testCssAndOtherSelectors() {
        assertEquals("locator(\"#submit\")", locator("#submit"));
        assertEquals("locator(\"input[name=\\\"q\\\"]\")", locator("input[name=\"q\"]"));
    }

    @Test
    public void testRole() {
        assertEquals("get_by_role(\"button\", name=\"Submit\")", locator("internal:role=button[name=\"Submit\"i]"));
        assertEquals("get_by_role(\"button\", name=\"Submit\", exact=True)", locator("internal:role=button[name=\"Submit\"s]"));
        assertEquals("get_by_role(\"link\")", locator("internal:role=link"));
        assertEquals("get_by_role(\"checkbox\", checked=True, include_hidden=True)",
                locator("internal:role=checkbox[checked=true][include-hidden=true]"));
        assertEquals("get_by_role(\"heading\", name=\"Intro\", level=2)",
                locator("internal:role=heading[level=2][name=\"Intro\"i]"));
    }

    @Test
    public void testTextEngines() {
        assertEquals("get_by_text(\"Hello\")", locator("internal:text=\"Hello\"i"));
        assertEquals("get_by_text(\"Hello\", exact=True)", locator("internal:text=\"Hello\"s"));
        assertEquals("get_by_text(re.compile(\"sign\\\\s+in\", re.IGNORECASE))", locator("internal:text=/sign\\s+in/i"));
        assertEquals("get_by_label(\"Email\")", locator("internal:label=\"Email\"i"));
        assertEquals("get_by_test_id(\"login\")", locator("internal:testid=[data-testid=\"login\"s]"));
        assertEquals("get_by_placeholder(\"Search\")", locator("internal:attr=[placeholder=\"Search\"i]"));
        assertEquals("get_by_alt_text(\"Logo\", exact=True)", locator("internal:attr=[alt=\"Logo\"s]"));
        assertEquals("get_by_title(\"Help\")", locator("internal:attr=[title=\"Help\"i]"));
    }

    @Test
    public void testChains() {
        assertEquals("locator(\"ul.items\").first", locator("ul.items >> nth=0"));
        assertEquals("locator(\"ul.items\").last", locator("ul.items >> nth=-1"));
        assertEquals("get_by_role(\"row\").nth(2).get_by_text(\"Edit\")",
                locator("internal:role=row >> nth=2 >> internal:text=\"Edit\"i"));
        assertEquals("locator(\"nth=0\")", locator("nth=0"));
    }

    @Test
    public void testChainOperatorInsideQuotes() {
        assertEquals(Arrays.asList("internal:text=\"a >> b\"i"), PythonLocatorAdapter.splitChain("internal:text=\"a >> b\"i"));
        assertEquals("get_by_text(\"a >> b\")", locator("internal:text=\"a >> b\"i"));
    }

    @Test
    public void testOtherLanguagesAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> adapter.toLocator("java", "#x"));
    }
}
