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
import java.util.List;
import java.util.Stack;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Matches every ifdef/ifndef with its elsif chain, else and endif in a
 * single forward scan, registering the macro operands on the way.
 */
/* pp */ class BlockMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(BlockMatcher.class);

    private final TokenView view;
    private final MacroRegistry registry;
    private final Stack<ConditionalBlock> states = new Stack<ConditionalBlock>();

    /* pp */ BlockMatcher(@Nonnull TokenView view, @Nonnull MacroRegistry registry) {
        this.view = view;
        this.registry = registry;
    }

    /**
     * Returns the blocks of the view in the order their endif appears,
     * so that inner blocks precede the blocks enclosing them.
     */
    @Nonnull
    /* pp */ List<ConditionalBlock> match()
            throws FlowException {
        List<ConditionalBlock> closed = new ArrayList<ConditionalBlock>();
        states.clear();

        for (int i = 0; i < view.size(); i++) {
            Token tok = view.get(i);
            switch (tok.getType()) {
                case Token.IFDEF:
                case Token.IFNDEF:
                    states.push(new ConditionalBlock(i, macro(i)));
                    break;

                case Token.ELSIF: {
                    ConditionalBlock block = top(tok);
                    if (block.sawElse())
                        throw new FlowException(ErrorKind.CLAUSE_AFTER_ELSE, tok,
                                tok.getText() + " after else");
                    block.addElsif(i, macro(i));
                    break;
                }

                case Token.ELSE: {
                    ConditionalBlock block = top(tok);
                    if (block.sawElse())
                        throw new FlowException(ErrorKind.CLAUSE_AFTER_ELSE, tok,
                                tok.getText() + " after else");
                    block.setElse(i);
                    break;
                }

                case Token.ENDIF: {
                    ConditionalBlock block = top(tok);
                    block.setEndif(i);
                    states.pop();
                    closed.add(block);
                    if (LOG.isDebugEnabled())
                        LOG.debug("Matched block " + block);
                    break;
                }

                default:
                    break;
            }
        }

        if (!states.isEmpty()) {
            ConditionalBlock open = states.peek();
            throw new FlowException(ErrorKind.UNCOMPLETED_CONDITIONAL, view.get(open.getIfPosition()),
                    "Uncompleted conditional " + view.get(open.getIfPosition()).getText());
        }
        return closed;
    }

    @Nonnull
    private ConditionalBlock top(@Nonnull Token tok)
            throws FlowException {
        if (states.isEmpty())
            throw new FlowException(ErrorKind.UNMATCHED_DIRECTIVE, tok,
                    "Unmatched " + tok.getText());
        return states.peek();
    }

    /* Registers the macro operand of the directive at the given position. */
    private int macro(int position)
            throws FlowException {
        if (view.getType(position + 1) != Token.MACRO_NAME)
            throw new FlowException(ErrorKind.MALFORMED_OPERAND, view.get(position),
                    "Expected identifier for macro name after " + view.get(position).getText());
        return registry.register(view.get(position + 1)).getId();
    }
}
