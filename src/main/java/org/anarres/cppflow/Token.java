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

import javax.annotation.Nonnull;

/**
 * A lexical token.
 *
 * The type is one of the int constants declared here. Conditional
 * directives have their own types; every other directive is a
 * {@link #DIRECTIVE} and is copied through verbatim.
 */
public final class Token {

    public static final int IDENTIFIER = 1;
    public static final int NUMBER = 2;
    public static final int STRING = 3;
    public static final int PUNCT = 4;
    public static final int DIRECTIVE = 5;
    public static final int IFDEF = 6;
    public static final int IFNDEF = 7;
    public static final int ELSIF = 8;
    public static final int ELSE = 9;
    public static final int ENDIF = 10;
    /** The identifier naming the macro of an ifdef, ifndef or elsif. */
    public static final int MACRO_NAME = 11;
    public static final int INVALID = 12;
    public static final int EOF = 13;

    private static final String[] names = new String[EOF + 1];

    static {
        names[IDENTIFIER] = "IDENTIFIER";
        names[NUMBER] = "NUMBER";
        names[STRING] = "STRING";
        names[PUNCT] = "PUNCT";
        names[DIRECTIVE] = "DIRECTIVE";
        names[IFDEF] = "IFDEF";
        names[IFNDEF] = "IFNDEF";
        names[ELSIF] = "ELSIF";
        names[ELSE] = "ELSE";
        names[ENDIF] = "ENDIF";
        names[MACRO_NAME] = "MACRO_NAME";
        names[INVALID] = "INVALID";
        names[EOF] = "EOF";
    }

    private final int type;
    private final int line;
    private final int column;
    private final String text;

    public Token(int type, int line, int column, @Nonnull String text) {
        this.type = type;
        this.line = line;
        this.column = column;
        this.text = text;
    }

    /** Convenience constructor for tokens without a source location. */
    public Token(int type, @Nonnull String text) {
        this(type, -1, -1, text);
    }

    public int getType() {
        return type;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    public boolean isEOF() {
        return type == EOF;
    }

    /**
     * Returns true for ifdef, ifndef, elsif, else and endif.
     */
    public boolean isConditional() {
        switch (type) {
            case IFDEF:
            case IFNDEF:
            case ELSIF:
            case ELSE:
            case ENDIF:
                return true;
            default:
                return false;
        }
    }

    /**
     * Returns true for the directives which take a macro operand.
     */
    public boolean isBranch() {
        return type == IFDEF || type == IFNDEF || type == ELSIF;
    }

    /**
     * Returns the descriptive name of the given token type.
     */
    @Nonnull
    public static String getTokenName(int type) {
        if (type < 0 || type >= names.length || names[type] == null)
            return "Unknown" + type;
        return names[type];
    }

    /** Returns "line:column", or "?" when the token has no location. */
    @Nonnull
    String getLocation() {
        if (line < 0)
            return "?";
        return line + ":" + column;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Token))
            return false;
        Token t = (Token) o;
        return type == t.type
                && line == t.line
                && column == t.column
                && text.equals(t.text);
    }

    @Override
    public int hashCode() {
        return ((type * 31 + line) * 31 + column) * 31 + text.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder();
        buf.append('[').append(getTokenName(type));
        if (line != -1) {
            buf.append('@').append(line);
            if (column != -1)
                buf.append(',').append(column);
        }
        buf.append("]:\"").append(text).append('"');
        return buf.toString();
    }
}
