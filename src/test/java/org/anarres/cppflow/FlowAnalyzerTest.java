/*
 * Anarres C Preprocessor
 * Copyright (c) 2007-2015, Shevek
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express
 * or implied.  See the License for the specific language governing
 * permissions and limitations under the License.
 */
package org.anarres.cppflow;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class FlowAnalyzerTest {

    private static class Collector implements VariantReceiver {

        private final List<Variant> variants = new ArrayList<Variant>();

        @Override
        public boolean receive(Variant variant) {
            variants.add(variant);
            return true;
        }
    }

    private static FlowAnalyzer analyzer(String text) throws Exception {
        FlowAnalyzer analyzer = new FlowAnalyzer(new StringLexerSource(text));
        analyzer.addFeature(Feature.DEBUG);
        return analyzer;
    }

    private static List<Variant> variants(FlowAnalyzer analyzer) throws Exception {
        Collector collector = new Collector();
        int count = analyzer.generateVariants(collector);
        assertEquals(collector.variants.size(), count);
        for (Variant v : collector.variants) {
            for (Token tok : v.getTokens()) {
                assertFalse(v.toString(), tok.isConditional());
                assertFalse(v.toString(), tok.getType() == Token.MACRO_NAME);
            }
        }
        int macros = analyzer.getUsedMacros().size();
        assertTrue(count + " variants for " + macros + " macros", count <= (1 << macros));
        return collector.variants;
    }

    private static List<String> texts(List<Variant> variants) {
        List<String> out = new ArrayList<String>();
        for (Variant v : variants)
            out.add(v.getText());
        return out;
    }

    /* Asserts the assumption of each named macro, in the variant. A null value means unresolved. */
    private static void assertAssumed(FlowAnalyzer analyzer, Variant variant, Object... pairs) throws Exception {
        for (int i = 0; i < pairs.length; i += 2) {
            Macro m = analyzer.getMacro((String) pairs[i]);
            assertNotNull(m);
            Boolean expected = (Boolean) pairs[i + 1];
            if (expected == null) {
                assertFalse(m + " in " + variant, variant.isResolved(m.getId()));
            } else {
                assertTrue(m + " in " + variant, variant.isResolved(m.getId()));
                assertEquals(m + " in " + variant, expected, variant.isAssumed(m.getId()));
            }
        }
    }

    @Test
    public void testNoConditionals() throws Exception {
        FlowAnalyzer analyzer = analyzer("module m; endmodule");
        List<Variant> variants = variants(analyzer);
        assertEquals(Arrays.asList("module m ; endmodule"), texts(variants));
        assertTrue(variants.get(0).getResolved().isEmpty());
    }

    @Test
    public void testEmpty() throws Exception {
        List<Variant> variants = variants(analyzer("  // nothing\n"));
        assertEquals(1, variants.size());
        assertTrue(variants.get(0).getTokens().isEmpty());
    }

    @Test
    public void testSingleIfdef() throws Exception {
        FlowAnalyzer analyzer = analyzer("a `ifdef A b `else c `endif d");
        List<Variant> variants = variants(analyzer);
        assertEquals(Arrays.asList("a b d", "a c d"), texts(variants));
        assertAssumed(analyzer, variants.get(0), "A", true);
        assertAssumed(analyzer, variants.get(1), "A", false);
    }

    @Test
    public void testSingleIfndef() throws Exception {
        FlowAnalyzer analyzer = analyzer("`ifndef A b `endif");
        List<Variant> variants = variants(analyzer);
        assertEquals(Arrays.asList("b", ""), texts(variants));
        assertAssumed(analyzer, variants.get(0), "A", false);
        assertAssumed(analyzer, variants.get(1), "A", true);
    }

    @Test
    public void testSequentialBlocksOnDistinctMacros() throws Exception {
        FlowAnalyzer analyzer = analyzer("`ifdef A a `endif `ifdef B b `endif");
        assertEquals(Arrays.asList("a b", "a", "b", ""), texts(variants(analyzer)));
    }

    @Test
    public void testMultipleConditionalsSameMacro() throws Exception {
        FlowAnalyzer analyzer = analyzer(
                "`ifdef A\n  a1\n`else\n  a2\n`endif\n"
                + "`ifndef A\n  b1\n`endif\n"
                + "`ifdef A\n  c1\n`endif\n");
        List<Variant> variants = variants(analyzer);
        assertEquals(Arrays.asList("a1 c1", "a2 b1"), texts(variants));
        assertEquals(1, analyzer.getUsedMacros().size());
        assertAssumed(analyzer, variants.get(0), "A", true);
        assertAssumed(analyzer, variants.get(1), "A", false);
    }

    @Test
    public void testNested() throws Exception {
        FlowAnalyzer analyzer = analyzer(
                "`ifdef A\n `ifdef B\n  ab\n `else\n  a\n `endif\n`else\n  na\n`endif\n");
        List<Variant> variants = variants(analyzer);
        assertEquals(Arrays.asList("ab", "a", "na"), texts(variants));
        assertAssumed(analyzer, variants.get(0), "A", true, "B", true);
        assertAssumed(analyzer, variants.get(1), "A", true, "B", false);
        assertAssumed(analyzer, variants.get(2), "A", false, "B", null);
    }

    @Test
    public void testMultipleElsifs() throws Exception {
        FlowAnalyzer analyzer = analyzer(
                "`ifdef A a `elsif B b `elsif EMPTY `elsif C c `else d `endif");
        List<Variant> variants = variants(analyzer);
        assertEquals(Arrays.asList("a", "b", "", "c", "d"), texts(variants));

        List<String> names = new ArrayList<String>();
        for (Macro m : analyzer.getUsedMacros())
            names.add(m.getName());
        assertEquals(Arrays.asList("A", "B", "EMPTY", "C"), names);

        assertAssumed(analyzer, variants.get(0), "A", true, "B", null);
        assertAssumed(analyzer, variants.get(2), "A", false, "B", false, "EMPTY", true, "C", null);
        assertAssumed(analyzer, variants.get(4), "A", false, "B", false, "EMPTY", false, "C", false);
    }

    @Test
    public void testSwappedNegatedConditionals() throws Exception {
        FlowAnalyzer analyzer = analyzer(
                "`ifdef A `ifndef B x `endif `else `ifdef B y `endif `endif");
        List<Variant> variants = variants(analyzer);
        assertEquals(Arrays.asList("x", "", "y", ""), texts(variants));
        assertAssumed(analyzer, variants.get(0), "A", true, "B", false);
        assertAssumed(analyzer, variants.get(1), "A", true, "B", true);
        assertAssumed(analyzer, variants.get(2), "A", false, "B", true);
        assertAssumed(analyzer, variants.get(3), "A", false, "B", false);
    }

    @Test
    public void testContradictoryNestingIsPruned() throws Exception {
        FlowAnalyzer analyzer = analyzer("`ifdef A `ifndef A x `else y `endif `endif z");
        assertEquals(Arrays.asList("y z", "z"), texts(variants(analyzer)));
    }

    @Test
    public void testEmptyBodies() throws Exception {
        assertEquals(Arrays.asList("x y", "y"), texts(variants(analyzer("`ifdef A x `else `endif y"))));
        assertEquals(Arrays.asList("z", "z"), texts(variants(analyzer("`ifdef A `endif z"))));
    }

    @Test
    public void testIfInsideIfdef() throws Exception {
        FlowAnalyzer analyzer = analyzer("#ifdef A\na\n#if 0\nb\n#else\nc\n#endif\n#endif\n");
        assertEquals(Arrays.asList("a #if 0 b #else c #endif", ""), texts(variants(analyzer)));
        assertEquals(1, analyzer.getUsedMacros().size());

        analyzer = analyzer("#ifdef A\nx\n#if B > 1\ny\n#endif\nz\n#endif\nw\n");
        assertEquals(Arrays.asList("x #if B > 1 y #endif z w", "w"), texts(variants(analyzer)));
        assertNull(analyzer.getMacro("B"));
    }

    @Test
    public void testEarlyStop() throws Exception {
        FlowAnalyzer analyzer = analyzer("`ifdef A a `endif `ifdef B b `endif `ifdef C c `endif");
        final List<Variant> seen = new ArrayList<Variant>();
        int count = analyzer.generateVariants(new VariantReceiver() {
            @Override
            public boolean receive(Variant variant) {
                seen.add(variant);
                return seen.size() < 3;
            }
        });
        assertEquals(3, count);
        assertEquals(Arrays.asList("a b c", "a b", "a c"), texts(seen));
        assertEquals(8, variants(analyzer).size());
    }

    @Test
    public void testRepeatable() throws Exception {
        FlowAnalyzer analyzer = analyzer("`ifdef A a `elsif B b `endif `ifndef B c `endif");
        List<Variant> first = variants(analyzer);
        List<Variant> second = variants(analyzer);
        assertEquals(first, second);
        assertSame(analyzer.getFlowGraph(), analyzer.getFlowGraph());
        assertEquals(first, variants(analyzer("`ifdef A a `elsif B b `endif `ifndef B c `endif")));
    }

    @Test
    public void testMacroLookup() throws Exception {
        FlowAnalyzer analyzer = analyzer("`ifdef A `elsif B `endif `define C");
        assertEquals(0, analyzer.getMacro("A").getId());
        assertEquals(1, analyzer.getMacro("B").getId());
        assertNull(analyzer.getMacro("C"));
    }

    @Test
    public void testFailureIsRepeated() throws Exception {
        FlowAnalyzer analyzer = analyzer("`ifdef A a `endif `endif");
        final List<Variant> seen = new ArrayList<Variant>();
        for (int i = 0; i < 2; i++) {
            try {
                analyzer.generateVariants(new VariantReceiver() {
                    @Override
                    public boolean receive(Variant variant) {
                        seen.add(variant);
                        return true;
                    }
                });
                fail("Enumerated a malformed view");
            } catch (FlowException e) {
                assertEquals(ErrorKind.UNMATCHED_DIRECTIVE, e.getKind());
            }
        }
        assertTrue(seen.isEmpty());
        try {
            analyzer.minCoverVariants();
            fail("Covered a malformed view");
        } catch (FlowException e) {
            assertEquals(ErrorKind.UNMATCHED_DIRECTIVE, e.getKind());
        }
    }

    @Test
    public void testMacroCapacity() throws Exception {
        FlowAnalyzer analyzer = analyzer("`ifdef A `endif `ifdef B `endif `ifdef C `endif");
        analyzer.setMacroCapacity(2);
        assertEquals(2, analyzer.getMacroCapacity());
        try {
            analyzer.getFlowGraph();
            fail("Built a graph over too many macros");
        } catch (FlowException e) {
            assertEquals(ErrorKind.MACRO_CAPACITY_EXCEEDED, e.getKind());
            assertEquals("C", e.getToken().getText());
        }
        try {
            analyzer.setMacroCapacity(3);
            fail("Changed capacity after building");
        } catch (IllegalStateException e) {
            // expected
        }
    }

    @Test
    public void testTokenViewConstructor() throws Exception {
        List<Token> tokens = Arrays.asList(
                new Token(Token.IFNDEF, "`ifndef"),
                new Token(Token.MACRO_NAME, "X"),
                new Token(Token.IDENTIFIER, "x"),
                new Token(Token.ENDIF, "`endif"));
        FlowAnalyzer analyzer = new FlowAnalyzer(TokenView.of(tokens));
        assertEquals(Arrays.asList("x", ""), texts(variants(analyzer)));
        assertFalse(analyzer.getFeature(Feature.DEBUG));
    }
}
