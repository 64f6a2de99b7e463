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

import java.util.BitSet;
import java.util.List;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.pcollections.PVector;

/**
 * One compiled variant of the token view.
 *
 * Bit i of the assumed vector is set when the macro with id i is assumed
 * defined along this variant's path. Bit i of the resolved vector is set
 * when that macro was decided at all; a macro nested inside a branch
 * that was not taken stays unresolved.
 */
public final class Variant {

    private final PVector<Token> tokens;
    private final BitSet assumed;
    private final BitSet resolved;

    /* pp */ Variant(@Nonnull PVector<Token> tokens, @Nonnull BitSet assumed, @Nonnull BitSet resolved) {
        this.tokens = tokens;
        this.assumed = assumed;
        this.resolved = resolved;
    }

    /** The tokens of this variant, without any conditional directive. */
    @Nonnull
    public List<Token> getTokens() {
        return tokens;
    }

    @Nonnull
    public BitSet getAssumed() {
        return (BitSet) assumed.clone();
    }

    @Nonnull
    public BitSet getResolved() {
        return (BitSet) resolved.clone();
    }

    public boolean isAssumed(@Nonnegative int macroId) {
        return assumed.get(macroId);
    }

    public boolean isResolved(@Nonnegative int macroId) {
        return resolved.get(macroId);
    }

    /** Returns the text of the tokens, separated by single spaces. */
    @Nonnull
    public String getText() {
        StringBuilder buf = new StringBuilder();
        for (Token tok : tokens) {
            if (buf.length() > 0)
                buf.append(' ');
            buf.append(tok.getText());
        }
        return buf.toString();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Variant))
            return false;
        Variant v = (Variant) o;
        return tokens.equals(v.tokens)
                && assumed.equals(v.assumed)
                && resolved.equals(v.resolved);
    }

    @Override
    public int hashCode() {
        return (tokens.hashCode() * 31 + assumed.hashCode()) * 31 + resolved.hashCode();
    }

    @Override
    public String toString() {
        return "Variant(assumed=" + assumed + ", resolved=" + resolved + ", tokens=" + getText() + ")";
    }
}
