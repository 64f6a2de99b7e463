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

import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nonnull;

import org.pcollections.OrderedPSet;
import org.pcollections.PSet;

/**
 * The names of the macros assumed defined for one min-cover pass, in the
 * order they were decided. Every other macro is assumed undefined.
 *
 * Two define sets are equal if they hold the same names, in any order.
 */
public final class DefineSet {

    private static final DefineSet EMPTY = new DefineSet(OrderedPSet.<String>empty());

    private final PSet<String> names;

    private DefineSet(@Nonnull PSet<String> names) {
        this.names = names;
    }

    @Nonnull
    public static DefineSet empty() {
        return EMPTY;
    }

    @Nonnull
    public static DefineSet of(@Nonnull String... names) {
        DefineSet out = EMPTY;
        for (String name : names)
            out = out.plus(name);
        return out;
    }

    @Nonnull
    public DefineSet plus(@Nonnull String name) {
        return new DefineSet(names.plus(name));
    }

    public boolean contains(@Nonnull String name) {
        return names.contains(name);
    }

    @Nonnull
    public List<String> getNames() {
        return new ArrayList<String>(names);
    }

    public int size() {
        return names.size();
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof DefineSet))
            return false;
        return names.equals(((DefineSet) o).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return getNames().toString();
    }
}
