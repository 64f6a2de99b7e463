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

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import javax.annotation.Nonnull;

import org.pcollections.TreePVector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Enumerates every variant of a flow graph, depth first.
 *
 * A macro is decided the first time a path meets it and the decision is
 * reused for every later conditional on that path, so the number of
 * variants is bounded by 2^D for D distinct macros rather than by the
 * number of conditionals.
 *
 * The search keeps an explicit stack. Each pending node carries the
 * state of its path: the tokens collected so far as an {@link FList},
 * which siblings share, and the assumed and resolved bit vectors, which
 * are copied when a macro is decided and never changed afterwards.
 */
/* pp */ class VariantEnumerator {

    private static final Logger LOG = LoggerFactory.getLogger(VariantEnumerator.class);

    private static class Step {

        final int position;
        final FList<Token> path;
        final BitSet assumed;
        final BitSet resolved;

        Step(int position, FList<Token> path, BitSet assumed, BitSet resolved) {
            this.position = position;
            this.path = path;
            this.assumed = assumed;
            this.resolved = resolved;
        }
    }

    private final FlowGraph graph;
    private final boolean debug;

    /* pp */ VariantEnumerator(@Nonnull FlowGraph graph, boolean debug) {
        this.graph = graph;
        this.debug = debug;
    }

    @Nonnull
    private Variant variant(@Nonnull Step step) {
        return new Variant(TreePVector.from(FList.fromReversed(step.path)), step.assumed, step.resolved);
    }

    private static BitSet with(@Nonnull BitSet bits, int index, boolean value) {
        BitSet copy = (BitSet) bits.clone();
        copy.set(index, value);
        return copy;
    }

    /**
     * Hands every variant to the receiver until it returns false.
     *
     * @return the number of variants handed to the receiver.
     */
    /* pp */ int generate(@Nonnull VariantReceiver receiver) {
        if (graph.size() == 0) {
            receiver.receive(new Variant(TreePVector.<Token>empty(), new BitSet(), new BitSet()));
            return 1;
        }

        TokenView view = graph.getView();
        Deque<Step> stack = new ArrayDeque<Step>();
        stack.push(new Step(0, FList.<Token>empty(), new BitSet(), new BitSet()));
        int count = 0;

        while (!stack.isEmpty()) {
            Step step = stack.pop();
            int position = step.position;
            FList<Token> path = step.path;
            if (graph.isEmitted(position))
                path = path.push(view.get(position));

            if (graph.isTerminal(position)) {
                Variant variant = variant(new Step(position, path, step.assumed, step.resolved));
                count++;
                if (debug)
                    LOG.debug("variant " + count + ": " + variant);
                if (!receiver.receive(variant)) {
                    LOG.debug("Receiver stopped the enumeration after " + count + " variants");
                    return count;
                }
                continue;
            }

            if (graph.isBranch(position)) {
                int macro = graph.getMacroId(position);
                boolean negated = graph.isNegated(position);
                if (step.resolved.get(macro)) {
                    boolean holds = negated ^ step.assumed.get(macro);
                    stack.push(new Step(graph.getSuccessor(position, holds ? 0 : 1),
                            path, step.assumed, step.resolved));
                } else {
                    BitSet resolved = with(step.resolved, macro, true);
                    // Pushed in reverse, so the holding branch is explored first.
                    stack.push(new Step(graph.getSuccessor(position, 1),
                            path, with(step.assumed, macro, negated), resolved));
                    stack.push(new Step(graph.getSuccessor(position, 0),
                            path, with(step.assumed, macro, !negated), resolved));
                }
            } else {
                for (int slot = graph.getSuccessorCount(position) - 1; slot >= 0; slot--)
                    stack.push(new Step(graph.getSuccessor(position, slot),
                            path, step.assumed, step.resolved));
            }
        }

        LOG.debug("Enumerated " + count + " variants");
        return count;
    }
}
