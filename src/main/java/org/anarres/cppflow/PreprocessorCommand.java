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

import java.util.HashMap;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * The conditional preprocessor directives understood by the flow analyzer.
 *
 * Any other directive word is lexed as an opaque {@link Token#DIRECTIVE}.
 * An {@code if} takes an expression rather than a macro, so it and its
 * clauses are lexed as opaque directives too.
 */
public enum PreprocessorCommand {

    PP_IF("if", Token.DIRECTIVE),
    PP_IFDEF("ifdef", Token.IFDEF),
    PP_IFNDEF("ifndef", Token.IFNDEF),
    PP_ELSIF("elsif", Token.ELSIF),
    PP_ELIF("elif", Token.ELSIF),
    PP_ELSE("else", Token.ELSE),
    PP_ENDIF("endif", Token.ENDIF);

    private final String text;
    private final int tokenType;

    PreprocessorCommand(@Nonnull String text, int tokenType) {
        this.text = text;
        this.tokenType = tokenType;
    }

    @Nonnull
    public String getText() {
        return text;
    }

    /** The {@link Token} type a directive of this kind is lexed as. */
    public int getTokenType() {
        return tokenType;
    }

    /** True if the directive is followed by a macro operand. */
    public boolean takesMacro() {
        return tokenType == Token.IFDEF
                || tokenType == Token.IFNDEF
                || tokenType == Token.ELSIF;
    }

    private static final Map<String, PreprocessorCommand> map;

    static {
        map = new HashMap<String, PreprocessorCommand>();
        for (PreprocessorCommand cmd : PreprocessorCommand.values())
            map.put(cmd.text, cmd);
    }

    @CheckForNull
    public static PreprocessorCommand forText(@Nonnull String text) {
        return map.get(text);
    }
}
