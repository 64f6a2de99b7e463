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
import java.io.Reader;
import java.util.ArrayDeque;
import java.util.Deque;
import javax.annotation.Nonnull;

import org.apache.commons.io.IOUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static org.anarres.cppflow.Token.*;

/**
 * Lexes a character stream into the tokens the flow analyzer needs.
 *
 * Directives are introduced either by a backtick anywhere on a line
 * ({@code `ifdef FOO}) or by a hash as the first non-blank character of
 * a line ({@code #ifdef FOO}). Whitespace and comments are dropped.
 * The identifier following an ifdef, ifndef or elsif on the same line
 * is returned as a {@link Token#MACRO_NAME}.
 *
 * An {@code if} conditional tests an expression, not a macro. It is
 * returned as a {@link Token#DIRECTIVE}, and so are the elsif, else and
 * endif clauses belonging to it.
 */
public class LexerSource extends Source {

    private static final Logger LOG = LoggerFactory.getLogger(LexerSource.class);

    private final String text;
    private int pos;
    private int line;
    private int column;

    /* true until something other than whitespace was seen on this line */
    private boolean bol;
    /* true between a macro-taking directive and the end of its line */
    private boolean expectMacro;
    /* one entry per open conditional, true for an if whose clauses are opaque */
    private final Deque<Boolean> conditionals = new ArrayDeque<Boolean>();

    public LexerSource(@Nonnull Reader r)
            throws IOException {
        this(IOUtils.toString(r));
    }

    /* pp */ LexerSource(@Nonnull String text) {
        this.text = text;
        this.pos = 0;
        this.line = 1;
        this.column = 1;
        this.bol = true;
        this.expectMacro = false;
    }

    private int peek(int offset) {
        int i = pos + offset;
        if (i >= text.length())
            return -1;
        return text.charAt(i);
    }

    private int read() {
        if (pos >= text.length())
            return -1;
        char c = text.charAt(pos++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void error(int line, int column, @Nonnull String msg)
            throws LexerException {
        String name = getName();
        String where = (name == null) ? "" : name + ":";
        throw new LexerException("Error at " + where + line + ":" + column + ": " + msg);
    }

    private static boolean isIdentifierStart(int c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    private static boolean isNumberPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '.' || c == '\'';
    }

    /* Skips whitespace and comments. */
    private void skipWhite()
            throws LexerException {
        for (;;) {
            int c = peek(0);
            if (c == '\n') {
                read();
                bol = true;
                expectMacro = false;
            } else if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
                read();
            } else if (c == '/' && peek(1) == '/') {
                while (peek(0) != -1 && peek(0) != '\n')
                    read();
            } else if (c == '/' && peek(1) == '*') {
                int l = line;
                int col = column;
                read();
                read();
                for (;;) {
                    int d = read();
                    if (d == -1)
                        error(l, col, "Unterminated comment");
                    if (d == '\n') {
                        bol = true;
                        expectMacro = false;
                    } else if (d == '*' && peek(0) == '/') {
                        read();
                        break;
                    }
                }
            } else {
                return;
            }
        }
    }

    @Nonnull
    private String word() {
        StringBuilder buf = new StringBuilder();
        while (isIdentifierPart(peek(0)))
            buf.append((char) read());
        return buf.toString();
    }

    @Nonnull
    private Token directive(@Nonnull String prefix, int l, int col) {
        String name = word();
        if (name.isEmpty())
            return new Token(PUNCT, l, col, prefix);
        PreprocessorCommand cmd = PreprocessorCommand.forText(name);
        if (cmd == null)
            return new Token(DIRECTIVE, l, col, prefix + name);
        switch (cmd) {
            case PP_IF:
                conditionals.push(Boolean.TRUE);
                break;
            case PP_IFDEF:
            case PP_IFNDEF:
                conditionals.push(Boolean.FALSE);
                break;
            case PP_ELSIF:
            case PP_ELIF:
            case PP_ELSE:
                if (isOpaque())
                    return new Token(DIRECTIVE, l, col, prefix + name);
                break;
            case PP_ENDIF:
                if (isOpaque()) {
                    conditionals.pop();
                    return new Token(DIRECTIVE, l, col, prefix + name);
                }
                // Closes an ifdef; an unmatched endif is reported by the block matcher.
                conditionals.poll();
                break;
            default:
                break;
        }
        expectMacro = cmd.takesMacro();
        return new Token(cmd.getTokenType(), l, col, prefix + name);
    }

    private boolean isOpaque() {
        Boolean top = conditionals.peek();
        return top != null && top.booleanValue();
    }

    @Nonnull
    private Token string(int l, int col)
            throws LexerException {
        StringBuilder buf = new StringBuilder();
        buf.append((char) read());
        for (;;) {
            int c = read();
            if (c == -1 || c == '\n')
                error(l, col, "Unterminated string literal");
            buf.append((char) c);
            if (c == '\\') {
                int d = read();
                if (d == -1)
                    error(l, col, "Unterminated string literal");
                buf.append((char) d);
            } else if (c == '"') {
                return new Token(STRING, l, col, buf.toString());
            }
        }
    }

    @Override
    @Nonnull
    public Token token()
            throws IOException,
            LexerException {
        skipWhite();

        int l = line;
        int col = column;
        int c = peek(0);
        boolean macroOperand = expectMacro;
        expectMacro = false;

        Token tok;
        if (c == -1) {
            tok = new Token(EOF, l, col, "");
        } else if (c == '`') {
            read();
            tok = directive("`", l, col);
        } else if (c == '#' && bol) {
            read();
            while (peek(0) == ' ' || peek(0) == '\t')
                read();
            tok = directive("#", l, col);
        } else if (isIdentifierStart(c)) {
            tok = new Token(macroOperand ? MACRO_NAME : IDENTIFIER, l, col, word());
        } else if (Character.isDigit(c)) {
            StringBuilder buf = new StringBuilder();
            while (isNumberPart(peek(0)))
                buf.append((char) read());
            tok = new Token(NUMBER, l, col, buf.toString());
        } else if (c == '"') {
            tok = string(l, col);
        } else {
            read();
            tok = new Token(Character.isISOControl(c) ? INVALID : PUNCT, l, col, String.valueOf((char) c));
        }
        bol = false;

        if (LOG.isTraceEnabled())
            LOG.trace("lexed " + tok);
        return tok;
    }

    @Override
    public String toString() {
        String name = getName();
        return "LexerSource(" + (name == null ? "<anonymous>" : name) + " at " + line + ":" + column + ")";
    }
}
