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
package com.stepwright.code.generation.common;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import org.junit.jupiter.api.Test;

public class LinesBuilderTest {

    @Test
    public void testLinesAreTrimmedAndSplit() {
        LinesBuilder lb = new LinesBuilder();
        lb.line("  first  \n   second");
        assertEquals("first\nsecond", lb.toString());
    }

    @Test
    public void testNestedBlocksIndentByFour() {
        LinesBuilder lb = new LinesBuilder();
        lb.block("def outer():", outer -> {
            outer.line("a = 1");
            outer.block("with thing() as t:", inner -> {
                inner.line("t.go()");
            });
            outer.line("b = 2");
        });
        lb.line("done()");
        assertEquals("def outer():\n"
                + "    a = 1\n"
                + "    with thing() as t:\n"
                + "        t.go()\n"
                + "    b = 2\n"
                + "done()", lb.toString());
    }

    @Test
    public void testBaseOffsetAppliesToEveryLevel() {
        LinesBuilder lb = new LinesBuilder(4);
        lb.block("with page.expect_popup() as page1_info:", b -> b.line("page.click()"));
        lb.line("page1 = page1_info.value");
        assertEquals("    with page.expect_popup() as page1_info:\n"
                + "        page.click()\n"
                + "    page1 = page1_info.value", lb.toString());
    }

    @Test
    public void testBlankLinesAreNotIndented() {
        LinesBuilder lb = new LinesBuilder(4);
        lb.block("def f():", b -> {
            b.line("x()");
            b.blankLine();
            b.line("y()");
        });
        assertEquals("    def f():\n        x()\n\n        y()", lb.toString());
    }

    @Test
    public void testPrependGoesBeforeEverything() {
        LinesBuilder lb = new LinesBuilder();
        lb.block("with a() as b:", b -> b.line("c()"));
        lb.prepend("  page.once(\"dialog\", handler)");
        assertEquals("page.once(\"dialog\", handler)\nwith a() as b:\n    c()", lb.toString());
    }

    @Test
    public void testMarkerNotation() {
        LinesBuilder lb = new LinesBuilder();
        lb.add("\ndef init(): {\n"
                + "    configure( {\n"
                + "        headless=True,\n"
                + "    }\n"
                + "    )\n"
                + "}\n"
                + "\n"
                + "after()\n");
        assertEquals("def init():\n"
                + "    configure(\n"
                + "        headless=True,\n"
                + "    )\n"
                + "\n"
                + "after()", lb.toString());
    }

    @Test
    public void testUnmatchedCloseMarkerThrows() {
        LinesBuilder lb = new LinesBuilder();
        lb.line("kept()");
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> lb.add("a()\n}\nb()"));
        assertTrue(ex.getMessage().contains("line 2"), ex.getMessage());
        assertEquals("kept()", lb.toString(), "Nothing should be appended after a failure");
    }

    @Test
    public void testUnclosedBlockThrows() {
        LinesBuilder lb = new LinesBuilder();
        assertThrows(IllegalStateException.class, () -> lb.add("def f(): {\nx()"));
        assertTrue(lb.isEmpty());
    }

    @Test
    public void testOpenMarkerWithoutHeaderThrows() {
        LinesBuilder lb = new LinesBuilder(4);
        IllegalStateException ex = assertThrows(IllegalStateException.class,
                () -> lb.add("a()\n  {\nb()\n}"));
        assertTrue(ex.getMessage().contains("line 2"), ex.getMessage());
        assertTrue(lb.isEmpty());
    }

    @Test
    public void testLineDoesNotInterpretMarkers() {
        LinesBuilder lb = new LinesBuilder();
        lb.line("x = {\n}");
        assertEquals("x = {\n}", lb.toString());
    }

    @Test
    public void testLineComment() {
        LinesBuilder lb = new LinesBuilder(4);
        lb.lineComment("first part\nsecond part");
        assertEquals("    # first part\n    # second part", lb.toString());
    }

    @Test
    public void testVerbatimKeepsIndentation() {
        LinesBuilder lb = new LinesBuilder(8);
        lb.verbatim("def f():\n    pass");
        assertEquals("def f():\n    pass", lb.toString());
    }

    @Test
    public void testRenderingIsRepeatable() {
        LinesBuilder lb = new LinesBuilder(2);
        lb.block("if x:", b -> b.line("y()"));
        String first = lb.toString();
        assertEquals(first, lb.toString());
        assertEquals("  if x:\n      y()", first);
    }

    @Test
    public void testCodeGeneratorStringify() {
        CodeGenerator gen = lines -> lines.block("for x in y:", b -> b.generate(CodeGenerator.line("print(x)")));
        assertEquals("for x in y:\n    print(x)", gen.stringify());
    }

    @Test
    public void testInvalidSettings() {
        assertThrows(IllegalArgumentException.class, () -> new PythonLinesSettings(-1));
        assertThrows(IllegalArgumentException.class, () -> new PythonLinesSettings(0, -4));
    }
}
