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
import java.util.List;
import javax.annotation.Nonnull;

/**
 * The positions of one ifdef/ifndef group: the opener, its elsif chain,
 * the optional else and the endif.
 */
/* pp */ class ConditionalBlock {

    /** Sentinel for an else or endif which has not been seen. */
    public static final int NONE = -1;

    private final int ifPosition;
    private final int ifMacro;
    private final List<Integer> elsifPositions = new ArrayList<Integer>();
    private final List<Integer> elsifMacros = new ArrayList<Integer>();
    private int elsePosition = NONE;
    private int endifPosition = NONE;

    /* pp */ ConditionalBlock(int ifPosition, int ifMacro) {
        this.ifPosition = ifPosition;
        this.ifMacro = ifMacro;
    }

    /* pp */ int getIfPosition() {
        return ifPosition;
    }

    /* pp */ int getIfMacro() {
        return ifMacro;
    }

    /* pp */ void addElsif(int position, int macro) {
        elsifPositions.add(position);
        elsifMacros.add(macro);
    }

    @Nonnull
    /* pp */ List<Integer> getElsifPositions() {
        return Collections.unmodifiableList(elsifPositions);
    }

    /* pp */ int getElsifMacro(int index) {
        return elsifMacros.get(index);
    }

    /* pp */ boolean hasElsif() {
        return !elsifPositions.isEmpty();
    }

    /* pp */ void setElse(int position) {
        this.elsePosition = position;
    }

    /* pp */ int getElsePosition() {
        return elsePosition;
    }

    /* pp */ boolean sawElse() {
        return elsePosition != NONE;
    }

    /* pp */ void setEndif(int position) {
        this.endifPosition = position;
    }

    /* pp */ int getEndifPosition() {
        return endifPosition;
    }

    /* pp */ boolean isClosed() {
        return endifPosition != NONE;
    }

    @Override
    public String toString() {
        return "if=" + ifPosition
                + ", elsif=" + elsifPositions
                + ", else=" + elsePosition
                + ", endif=" + endifPosition;
    }
}
