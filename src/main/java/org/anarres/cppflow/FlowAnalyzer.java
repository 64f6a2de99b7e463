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

import java.io.IOException;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Analyzes the conditional compilation of a token view.
 *
 * The analyzer matches the ifdef/ifndef blocks of the view and builds a
 * {@link FlowGraph} over its token positions, once, on first use. Two
 * independent analyses run over that graph:
 * <ul>
 * <li>{@link #generateVariants(VariantReceiver)} enumerates every
 * distinct variant under every consistent assumption of macros being
 * defined or undefined;</li>
 * <li>{@link #minCoverVariants()} chooses a few define sets which between
 * them reach every token.</li>
 * </ul>
 *
 * Only definedness is considered; macro values and expansion are not.
 */
public class FlowAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(FlowAnalyzer.class);

    private final TokenView view;
    private final Set<Feature> features;
    private int macroCapacity;

    private FlowGraph graph;
    private FlowException failure;

    public FlowAnalyzer(@Nonnull TokenView view) {
        this.view = view;
        this.features = EnumSet.noneOf(Feature.class);
        this.macroCapacity = MacroRegistry.DEFAULT_CAPACITY;
    }

    /** Equivalent to 'new FlowAnalyzer(TokenView.lex(source))'. */
    public FlowAnalyzer(@Nonnull Source source)
            throws IOException,
            LexerException {
        this(TokenView.lex(source));
    }

    @Nonnull
    public TokenView getView() {
        return view;
    }

    /**
     * Adds a feature to the feature-set of this analyzer.
     */
    public void addFeature(@Nonnull Feature f) {
        features.add(f);
    }

    /**
     * Adds features to the feature-set of this analyzer.
     */
    public void addFeatures(@Nonnull Collection<Feature> f) {
        features.addAll(f);
    }

    /**
     * Returns true if the given feature is in
     * the feature-set of this analyzer.
     */
    public boolean getFeature(@Nonnull Feature f) {
        return features.contains(f);
    }

    /**
     * Sets the maximum number of distinct macros the conditionals may
     * test. Must be called before the graph is built.
     */
    public void setMacroCapacity(@Nonnegative int macroCapacity) {
        if (graph != null || failure != null)
            throw new IllegalStateException("Flow graph already built");
        if (macroCapacity <= 0)
            throw new IllegalArgumentException("Macro capacity must be positive: " + macroCapacity);
        this.macroCapacity = macroCapacity;
    }

    public int getMacroCapacity() {
        return macroCapacity;
    }

    /**
     * Returns the flow graph of the view, building it on first use.
     *
     * @throws FlowException if the conditionals are malformed. The same
     * exception is thrown by every later call.
     */
    @Nonnull
    public FlowGraph getFlowGraph()
            throws FlowException {
        if (failure != null)
            throw failure;
        if (graph == null) {
            try {
                MacroRegistry registry = new MacroRegistry(macroCapacity);
                graph = new FlowGraphBuilder(view, registry, getFeature(Feature.DEBUG)).build();
            } catch (FlowException e) {
                LOG.debug("Failed to build flow graph: " + e.getMessage());
                failure = e;
                throw e;
            }
        }
        return graph;
    }

    /**
     * Hands every variant of the view to the receiver, in depth-first
     * order, until the receiver returns false.
     *
     * @return the number of variants handed to the receiver.
     * @throws FlowException if the conditionals are malformed, in which
     * case the receiver is never called.
     */
    public int generateVariants(@Nonnull VariantReceiver receiver)
            throws FlowException {
        FlowGraph g = getFlowGraph();
        return new VariantEnumerator(g, getFeature(Feature.DEBUG)).generate(receiver);
    }

    /**
     * Returns the macros tested by the conditionals of the view, in order
     * of first occurrence. The id of each macro is its bit offset in the
     * vectors of a {@link Variant}.
     */
    @Nonnull
    public List<Macro> getUsedMacros()
            throws FlowException {
        return getFlowGraph().getMacros();
    }

    /**
     * Returns the id of the named macro, or null if no conditional
     * tests it.
     */
    @CheckForNull
    public Macro getMacro(@Nonnull String name)
            throws FlowException {
        for (Macro m : getUsedMacros())
            if (m.getName().equals(name))
                return m;
        return null;
    }

    /**
     * Chooses define sets which between them reach every token.
     *
     * The result is not guaranteed minimal. If some tokens cannot be
     * reached the passes stop once they make no progress, and the result
     * reports the cover as incomplete.
     */
    @Nonnull
    public MinCoverResult minCoverVariants()
            throws FlowException {
        FlowGraph g = getFlowGraph();
        return new MinCoverGenerator(g, getFeature(Feature.DEBUG)).generate();
    }

    @Override
    public String toString() {
        return "FlowAnalyzer(" + view.size() + " tokens, features=" + features + ")";
    }
}
