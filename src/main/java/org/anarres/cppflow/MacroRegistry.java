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
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import javax.annotation.CheckForNull;
import javax.annotation.Nonnegative;
import javax.annotation.Nonnull;

/**
 * Assigns ids to the macros tested by conditional directives, in order
 * of first occurrence.
 */
public class MacroRegistry {

    public static final int DEFAULT_CAPACITY = 128;

    private final int capacity;
    private final Map<String, Macro> macros = new HashMap<String, Macro>();
    private final List<Macro> ordered = new ArrayList<Macro>();

    public MacroRegistry(@Nonnegative int capacity) {
        if (capacity <= 0)
            throw new IllegalArgumentException("Macro capacity must be positive: " + capacity);
        this.capacity = capacity;
    }

    public MacroRegistry() {
        this(DEFAULT_CAPACITY);
    }

    public int getCapacity() {
        return capacity;
    }

    /**
     * Returns the macro for the given name token, registering it if this
     * is its first occurrence.
     *
     * @throws FlowException if the name is new and the registry is full.
     */
    @Nonnull
    public Macro register(@Nonnull Token name)
            throws FlowException {
        Macro m = macros.get(name.getText());
        if (m != null)
            return m;
        if (ordered.size() >= capacity)
            throw new FlowException(ErrorKind.MACRO_CAPACITY_EXCEEDED, name,
                    "Too many distinct macros in conditionals (limit " + capacity + "): " + name.getText());
        m = new Macro(name.getText(), ordered.size(), name);
        macros.put(m.getName(), m);
        ordered.add(m);
        return m;
    }

    @CheckForNull
    public Macro getMacro(@Nonnull String name) {
        return macros.get(name);
    }

    @Nonnull
    public Macro getMacro(@Nonnegative int id) {
        return ordered.get(id);
    }

    public int size() {
        return ordered.size();
    }

    /** Returns the registered macros, ordered by id. */
    @Nonnull
    public List<Macro> getMacros() {
        return Collections.unmodifiableList(ordered);
    }
}
