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

import java.util.List;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * The control flow graph over the positions of a {@link TokenView}.
 *
 * A branch node (ifdef, ifndef, elsif) has exactly two successors: slot
 * 0 is taken when the directive's condition holds and slot 1 when it
 * does not. For ifndef the condition holds when the macro is undefined.
 * Every other node has at most one successor.
 *
 * Once built the graph is never modified, and may be shared between
 * threads.
 */
public final class FlowGraph {

    private static final int[] NO_SUCCESSORS = new int[0];

    private final TokenView view;
    private final List<Macro> macros;
    private final int[][] successors;
    private final int[] macroIds;

    /* pp */ FlowGraph(@Nonnull TokenView view, @Nonnull List<Macro> macros,
            @Nonnull int[][] successors, @Nonnull int[] macroIds) {
        this.view = view;
        this.macros = macros;
        this.successors = successors;
        this.macroIds = macroIds;
    }

    @Nonnull
    public TokenView getView() {
        return view;
    }

    /** The number of nodes, which is the size of the view. */
    public int size() {
        return successors.length;
    }

    /** Returns a copy of the successors of the given position. */
    @Nonnull
    public int[] getSuccessors(@Nonnegative int position) {
        int[] s = successors[position];
        return s.length == 0 ? NO_SUCCESSORS : s.clone();
    }

    public int getSuccessorCount(@Nonnegative int position) {
        return successors[position].length;
    }

    public int getSuccessor(@Nonnegative int position, @Nonnegative int slot) {
        return successors[position][slot];
    }

    public boolean isBranch(@Nonnegative int position) {
        return macroIds[position] >= 0;
    }

    /**
     * Returns the id of the macro tested at the given branch position,
     * or -1 if the position is not a branch.
     */
    public int getMacroId(@Nonnegative int position) {
        return macroIds[position];
    }

    /** True if the branch at the given position is an ifndef. */
    public boolean isNegated(@Nonnegative int position) {
        return view.getType(position) == Token.IFNDEF;
    }

    /** True if the position is the last token of the view. */
    public boolean isTerminal(@Nonnegative int position) {
        return position == view.last();
    }

    /**
     * True if the token at the given position belongs in a variant, that
     * is, it is neither a conditional directive nor its macro name.
     */
    public boolean isEmitted(@Nonnegative int position) {
        Token tok = view.get(position);
        return !tok.isConditional() && tok.getType() != Token.MACRO_NAME;
    }

    /** Returns the macros tested by this graph, ordered by id. */
    @Nonnull
    public List<Macro> getMacros() {
        return macros;
    }

    private static String escape(@Nonnull String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"");
    }

    /**
     * Renders this graph in Graphviz DOT form.
     *
     * Branch edges are labelled with the macro name and T or F for the
     * condition holding or not.
     */
    @Nonnull
    public String toDot() {
        StringBuilder buf = new StringBuilder();
        buf.append("digraph flow {\n");
        for (int i = 0; i < successors.length; i++) {
            buf.append("  n").append(i)
                    .append(" [label=\"").append(i).append(": ")
                    .append(escape(view.get(i).getText())).append('"');
            if (isBranch(i))
                buf.append(", shape=diamond");
            buf.append("];\n");
        }
        for (int i = 0; i < successors.length; i++) {
            int[] s = successors[i];
            for (int slot = 0; slot < s.length; slot++) {
                buf.append("  n").append(i).append(" -> n").append(s[slot]);
                if (isBranch(i)) {
                    buf.append(" [label=\"")
                            .append(escape(macros.get(macroIds[i]).getName()))
                            .append(slot == 0 ? " T" : " F")
                            .append("\"]");
                }
                buf.append(";\n");
            }
        }
        buf.append("}\n");
        return buf.toString();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        for (int i = 0; i < successors.length; i++) {
            buf.append(i).append(" -> [");
            for (int slot = 0; slot < successors[i].length; slot++) {
                if (slot > 0)
                    buf.append(", ");
                buf.append(successors[i][slot]);
            }
            buf.append("]\n");
        }
        return buf.toString();
    }
}
