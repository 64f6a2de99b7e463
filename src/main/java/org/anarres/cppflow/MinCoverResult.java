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

import java.util.Collections;
import java.util.List;
import javax.annotation.Nonnull;

/**
 * The define sets chosen by {@link FlowAnalyzer#minCoverVariants()}, with
 * the token positions their passes covered.
 */
public final class MinCoverResult {

    private final List<DefineSet> defineSets;
    private final IntervalSet covered;
    private final int tokenCount;

    /* pp */ MinCoverResult(@Nonnull List<DefineSet> defineSets, @Nonnull IntervalSet covered, int tokenCount) {
        this.defineSets = Collections.unmodifiableList(defineSets);
        this.covered = covered;
        this.tokenCount = tokenCount;
    }

    @Nonnull
    public List<DefineSet> getDefineSets() {
        return defineSets;
    }

    @Nonnull
    public IntervalSet getCovered() {
        return covered.copy();
    }

    /** The positions no pass reached; empty when the cover is complete. */
    @Nonnull
    public IntervalSet getUncovered() {
        return covered.complement(0, tokenCount);
    }

    public int getTokenCount() {
        return tokenCount;
    }

    /** True if every token position was reached by some pass. */
    public boolean isComplete() {
        return covered.containsRange(0, tokenCount);
    }

    @Override
    public String toString() {
        return "MinCoverResult(" + defineSets + ", covered=" + covered + " of " + tokenCount + ")";
    }
}
