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

import javax.annotation.CheckForNull;
import javax.annotation.Nonnull;

/**
 * A structural error in the conditional directives of a token view.
 *
 * Thrown while matching blocks or registering macros, before any
 * variant is produced.
 */
public class FlowException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;
    private final Token token;

    public FlowException(@Nonnull ErrorKind kind, @CheckForNull Token token, @Nonnull String msg) {
        super(token == null ? msg : msg + " at " + token.getLocation());
        this.kind = kind;
        this.token = token;
    }

    @Nonnull
    public ErrorKind getKind() {
        return kind;
    }

    /** Returns the offending token, or null at end of input. */
    @CheckForNull
    public Token getToken() {
        return token;
    }
}
