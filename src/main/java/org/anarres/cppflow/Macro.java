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

import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * A macro name tested by a conditional directive, with the id used as its
 * bit offset in {@link Variant} bit vectors.
 */
public final class Macro {

    private final String name;
    private final int id;
    private final Token token;

    /* pp */ Macro(@Nonnull String name, @Nonnegative int id, @Nonnull Token token) {
        this.name = name;
        this.id = id;
        this.token = token;
    }

    @Nonnull
    public String getName() {
        return name;
    }

    public int getId() {
        return id;
    }

    /** Returns the token of the first occurrence of this macro. */
    @Nonnull
    public Token getToken() {
        return token;
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Macro))
            return false;
        Macro m = (Macro) o;
        return id == m.id && name.equals(m.name);
    }

    @Override
    public int hashCode() {
        return name.hashCode() * 31 + id;
    }

    @Override
    public String toString() {
        return name + "=" + id;
    }
}
