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
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Chooses a small number of define sets whose walks through the flow
 * graph together reach every token.
 *
 * Each pass walks the graph once from the first token. The first time a
 * pass meets a macro it takes the branch whose body still holds
 * uncovered tokens, preferring the condition holding; later conditionals
 * on the same macro follow that decision. Passes repeat until every
 * token is covered or a pass covers nothing new.
 *
 * The cover may be incomplete even when some consistent assignment
 * reaches the missing tokens: a pass never revisits a decision, so a
 * combination such as A defined with B undefined is only tried if the
 * greedy choices happen to produce it. {@link MinCoverResult#isComplete()}
 * reports this.
 */
/* pp */ class MinCoverGenerator {

    private static final Logger LOG = LoggerFactory.getLogger(MinCoverGenerator.class);

    private final FlowGraph graph;
    private final boolean debug;

    /* pp */ MinCoverGenerator(@Nonnull FlowGraph graph, boolean debug) {
        this.graph = graph;
        this.debug = debug;
    }

    @Nonnull
    private DefineSet walk(@Nonnull IntervalSet covered) {
        TokenView view = graph.getView();
        DefineSet defines = DefineSet.empty();
        Set<String> decided = new HashSet<String>();

        int position = 0;
        while (position < graph.size()) {
            covered.add(position);
            if (graph.isBranch(position)) {
                String name = view.get(position + 1).getText();
                boolean negated = graph.isNegated(position);
                int taken = graph.getSuccessor(position, 0);
                int skipped = graph.getSuccessor(position, 1);
                if (decided.contains(name)) {
                    boolean holds = negated ^ defines.contains(name);
                    position = holds ? taken : skipped;
                } else {
                    decided.add(name);
                    if (!covered.containsRange(taken, skipped)) {
                        if (!negated)
                            defines = defines.plus(name);
                        position = taken;
                    } else {
                        if (negated)
                            defines = defines.plus(name);
                        position = skipped;
                    }
                }
            } else if (graph.getSuccessorCount(position) == 0) {
                position++;
            } else {
                position = graph.getSuccessor(position, 0);
            }
        }
        return defines;
    }

    @Nonnull
    /* pp */ MinCoverResult generate() {
        int size = graph.size();
        IntervalSet covered = new IntervalSet();
        IntervalSet last = new IntervalSet();
        List<DefineSet> out = new ArrayList<DefineSet>();

        while (!covered.containsRange(0, size)) {
            DefineSet defines = walk(covered);
            out.add(defines);
            if (debug)
                LOG.debug("pass " + out.size() + " defines " + defines + " covered " + covered);
            if (covered.equals(last)) {
                LOG.warn("Min-cover stopped after " + out.size() + " passes without covering "
                        + covered.complement(0, size));
                break;
            }
            last = covered.copy();
        }

        LOG.debug("Min-cover chose " + out.size() + " define sets for " + size + " tokens");
        return new MinCoverResult(out, covered.copy(), size);
    }
}
