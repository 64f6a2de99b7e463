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
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Builds the {@link FlowGraph} of a token view.
 */
/* pp */ class FlowGraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(FlowGraphBuilder.class);

    private final TokenView view;
    private final MacroRegistry registry;
    private final boolean debug;
    private final List<List<Integer>> edges;
    private final int[] macroIds;

    /* pp */ FlowGraphBuilder(@Nonnull TokenView view, @Nonnull MacroRegistry registry, boolean debug) {
        this.view = view;
        this.registry = registry;
        this.debug = debug;
        this.edges = new ArrayList<List<Integer>>(view.size());
        for (int i = 0; i < view.size(); i++)
            edges.add(new ArrayList<Integer>(2));
        this.macroIds = new int[view.size()];
        Arrays.fill(macroIds, -1);
    }

    /* else, elsif and endif are only reached through block edges */
    private boolean isClause(int position) {
        switch (view.getType(position)) {
            case Token.ELSIF:
            case Token.ELSE:
            case Token.ENDIF:
                return true;
            default:
                return false;
        }
    }

    private void edge(int from, int to) {
        List<Integer> out = edges.get(from);
        if (out.contains(to))
            return;
        out.add(to);
        if (debug)
            LOG.debug("edge " + from + " " + view.get(from).getText()
                    + " -> " + to + " " + view.get(to).getText());
    }

    /* The false successor of a clause: the next elsif, else the else, else the endif. */
    private int nextClause(@Nonnull ConditionalBlock block, int elsifIndex) {
        List<Integer> elsifs = block.getElsifPositions();
        if (elsifIndex < elsifs.size())
            return elsifs.get(elsifIndex);
        if (block.sawElse())
            return block.getElsePosition();
        return block.getEndifPosition();
    }

    private void addBlockEdges(@Nonnull ConditionalBlock block) {
        int endif = block.getEndifPosition();
        List<Integer> elsifs = block.getElsifPositions();

        int ifPosition = block.getIfPosition();
        macroIds[ifPosition] = block.getIfMacro();
        edge(ifPosition, ifPosition + 1);
        edge(ifPosition, nextClause(block, 0));

        for (int k = 0; k < elsifs.size(); k++) {
            int elsif = elsifs.get(k);
            macroIds[elsif] = block.getElsifMacro(k);
            edge(elsif, elsif + 1);
            edge(elsif, nextClause(block, k + 1));
        }

        if (block.sawElse())
            edge(block.getElsePosition(), block.getElsePosition() + 1);

        // The last token of every clause body reconverges on the endif.
        edge(endif - 1, endif);
        for (int elsif : elsifs)
            edge(elsif - 1, endif);
        if (block.sawElse())
            edge(block.getElsePosition() - 1, endif);

        int next = endif + 1;
        if (next < view.size() && !isClause(next))
            edge(endif, next);
    }

    @Nonnull
    /* pp */ FlowGraph build()
            throws FlowException {
        List<ConditionalBlock> blocks = new BlockMatcher(view, registry).match();

        for (int i = 0; i < view.size(); i++) {
            if (view.get(i).isConditional())
                continue;
            int next = i + 1;
            if (next < view.size() && !isClause(next))
                edge(i, next);
        }

        for (ConditionalBlock block : blocks)
            addBlockEdges(block);

        int[][] successors = new int[view.size()][];
        for (int i = 0; i < view.size(); i++) {
            List<Integer> out = edges.get(i);
            if (macroIds[i] >= 0 ? out.size() != 2 : out.size() > 1)
                throw new InternalException("Bad successors for " + view.get(i) + ": " + out);
            successors[i] = new int[out.size()];
            for (int slot = 0; slot < out.size(); slot++)
                successors[i][slot] = out.get(slot);
        }

        LOG.debug("Built flow graph of " + view.size() + " nodes over "
                + blocks.size() + " conditional blocks and "
                + registry.size() + " macros");
        return new FlowGraph(view, registry.getMacros(), successors, macroIds);
    }
}
