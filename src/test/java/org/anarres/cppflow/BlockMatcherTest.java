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

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class BlockMatcherTest {

    private static List<ConditionalBlock> match(String text) throws Exception {
        TokenView view = TokenView.lex(new StringLexerSource(text));
        return new BlockMatcher(view, new MacroRegistry()).match();
    }

    private static FlowException failure(String text) throws Exception {
        try {
            match(text);
        } catch (FlowException e) {
            return e;
        }
        fail("Matched " + text);
        return null;
    }

    @Test
    public void testSingleBlock() throws Exception {
        // 0 ifdef, 1 A, 2 x, 3 elsif, 4 B, 5 y, 6 elsif, 7 C, 8 else, 9 z, 10 endif
        List<ConditionalBlock> blocks = match("`ifdef A x `elsif B y `elsif C `else z `endif");
        assertEquals(1, blocks.size());
        ConditionalBlock block = blocks.get(0);
        assertEquals(0, block.getIfPosition());
        assertEquals(0, block.getIfMacro());
        assertEquals(Arrays.asList(3, 6), block.getElsifPositions());
        assertEquals(1, block.getElsifMacro(0));
        assertEquals(2, block.getElsifMacro(1));
        assertEquals(8, block.getElsePosition());
        assertEquals(10, block.getEndifPosition());
        assertTrue(block.isClosed());
    }

    @Test
    public void testNestedBlocksCloseInnerFirst() throws Exception {
        // 0 ifndef, 1 A, 2 ifdef, 3 B, 4 b, 5 endif, 6 else, 7 endif
        List<ConditionalBlock> blocks = match("`ifndef A `ifdef B b `endif `else `endif");
        assertEquals(2, blocks.size());
        assertEquals(2, blocks.get(0).getIfPosition());
        assertEquals(5, blocks.get(0).getEndifPosition());
        assertFalse(blocks.get(0).sawElse());
        assertEquals(0, blocks.get(1).getIfPosition());
        assertEquals(6, blocks.get(1).getElsePosition());
        assertEquals(7, blocks.get(1).getEndifPosition());
        assertFalse(blocks.get(1).hasElsif());
    }

    @Test
    public void testSameMacroRegisteredOnce() throws Exception {
        TokenView view = TokenView.lex(new StringLexerSource("`ifdef A `endif `ifndef B `elsif A `endif"));
        MacroRegistry registry = new MacroRegistry();
        new BlockMatcher(view, registry).match();
        assertEquals(2, registry.size());
        assertEquals("A", registry.getMacro(0).getName());
        assertEquals("B", registry.getMacro(1).getName());
    }

    @Test
    public void testNoConditionals() throws Exception {
        assertTrue(match("a b c").isEmpty());
        assertTrue(match("").isEmpty());
    }

    @Test
    public void testUnmatched() throws Exception {
        for (String text : new String[]{"`endif", "`else", "`elsif A", "`ifdef A `endif `endif", "x `else y"}) {
            FlowException e = failure(text);
            assertEquals(text, ErrorKind.UNMATCHED_DIRECTIVE, e.getKind());
            assertTrue(e.getMessage(), e.getMessage().toLowerCase().startsWith("unmatched"));
        }
    }

    @Test
    public void testUncompleted() throws Exception {
        for (String text : new String[]{"`ifdef A", "`ifndef A `else x", "`ifdef A `ifdef B `endif"}) {
            FlowException e = failure(text);
            assertEquals(text, ErrorKind.UNCOMPLETED_CONDITIONAL, e.getKind());
            assertTrue(e.getMessage(), e.getMessage().toLowerCase().startsWith("uncompleted"));
        }
        assertTrue(failure("`ifdef A\n`ifdef B\n`endif\n").getMessage().endsWith("at 1:1"));
    }

    @Test
    public void testMalformedOperand() throws Exception {
        for (String text : new String[]{"`ifdef", "`ifndef\nA `endif", "`ifdef A `elsif `endif", "`ifdef 1 `endif"}) {
            FlowException e = failure(text);
            assertEquals(text, ErrorKind.MALFORMED_OPERAND, e.getKind());
            assertTrue(e.getMessage(), e.getMessage().toLowerCase().startsWith("expected identifier"));
        }
    }

    @Test
    public void testClauseAfterElse() throws Exception {
        FlowException e = failure("`ifdef A `else `else `endif");
        assertEquals(ErrorKind.CLAUSE_AFTER_ELSE, e.getKind());
        assertEquals(Token.ELSE, e.getToken().getType());

        e = failure("`ifdef A `else `elsif B `endif");
        assertEquals(ErrorKind.CLAUSE_AFTER_ELSE, e.getKind());
        assertEquals(Token.ELSIF, e.getToken().getType());
    }
}
