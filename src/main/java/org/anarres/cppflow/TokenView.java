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
import java.util.AbstractList;
import java.util.Collection;
import java.util.RandomAccess;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

import org.pcollections.PVector;
import org.pcollections.TreePVector;

/**
 * A read-only, randomly indexable sequence of tokens.
 *
 * Positions in the view are plain int indices; the flow graph uses them
 * as node identities. The view never contains an EOF token.
 */
public final class TokenView extends AbstractList<Token> implements RandomAccess {

    private static final TokenView EMPTY = new TokenView(TreePVector.<Token>empty());

    private final PVector<Token> tokens;

    private TokenView(@Nonnull PVector<Token> tokens) {
        this.tokens = tokens;
    }

    @Nonnull
    public static TokenView empty() {
        return EMPTY;
    }

    /**
     * Creates a view over the given tokens, stopping at the first EOF.
     */
    @Nonnull
    public static TokenView of(@Nonnull Collection<Token> tokens) {
        PVector<Token> out = TreePVector.empty();
        for (Token tok : tokens) {
            if (tok.isEOF())
                break;
            out = out.plus(tok);
        }
        return new TokenView(out);
    }

    /**
     * Drains the given Source into a view.
     */
    @Nonnull
    public static TokenView lex(@Nonnull Source source)
            throws IOException,
            LexerException {
        PVector<Token> out = TreePVector.empty();
        for (;;) {
            Token tok = source.token();
            if (tok.isEOF())
                break;
            out = out.plus(tok);
        }
        return new TokenView(out);
    }

    @Override
    @Nonnull
    public Token get(@Nonnegative int index) {
        return tokens.get(index);
    }

    @Override
    public int size() {
        return tokens.size();
    }

    /**
     * Returns the type of the token at the given position, or
     * {@link Token#EOF} if the position is past the end.
     */
    public int getType(@Nonnegative int index) {
        if (index >= tokens.size())
            return Token.EOF;
        return tokens.get(index).getType();
    }

    /** Returns the position of the last token, or -1 for an empty view. */
    public int last() {
        return tokens.size() - 1;
    }
}
