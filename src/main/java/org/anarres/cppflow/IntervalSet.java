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

import java.util.Map;
import java.util.TreeMap;
import javax.annotation.Nonnull;

/**
 * A set of integers, held as sorted, disjoint, non-adjacent half-open
 * intervals [lower, upper).
 *
 * Adjacent and overlapping intervals are merged as they are added, so
 * two sets holding the same integers are equal.
 */
public final class IntervalSet {

    /* lower bound -> exclusive upper bound */
    private final TreeMap<Integer, Integer> intervals;

    public IntervalSet() {
        this.intervals = new TreeMap<Integer, Integer>();
    }

    private IntervalSet(@Nonnull TreeMap<Integer, Integer> intervals) {
        this.intervals = intervals;
    }

    /** Adds the single integer i. */
    public void add(int i) {
        add(i, i + 1);
    }

    /** Adds every integer in [lower, upper). */
    public void add(int lower, int upper) {
        if (lower >= upper)
            return;
        Map.Entry<Integer, Integer> floor = intervals.floorEntry(lower);
        if (floor != null && floor.getValue() >= lower) {
            lower = floor.getKey();
            upper = Math.max(upper, floor.getValue());
            intervals.remove(floor.getKey());
        }
        for (;;) {
            Map.Entry<Integer, Integer> e = intervals.ceilingEntry(lower);
            if (e == null || e.getKey() > upper)
                break;
            upper = Math.max(upper, e.getValue());
            intervals.remove(e.getKey());
        }
        intervals.put(lower, upper);
    }

    public boolean contains(int i) {
        return containsRange(i, i + 1);
    }

    /**
     * True if every integer in [lower, upper) is in this set. An empty
     * range is always contained.
     */
    public boolean containsRange(int lower, int upper) {
        if (lower >= upper)
            return true;
        Map.Entry<Integer, Integer> floor = intervals.floorEntry(lower);
        return floor != null && floor.getValue() >= upper;
    }

    /** Returns the integers of [lower, upper) which are not in this set. */
    @Nonnull
    public IntervalSet complement(int lower, int upper) {
        IntervalSet out = new IntervalSet();
        int cursor = lower;
        for (Map.Entry<Integer, Integer> e : intervals.entrySet()) {
            if (e.getValue() <= cursor)
                continue;
            if (e.getKey() >= upper)
                break;
            if (e.getKey() > cursor)
                out.add(cursor, e.getKey());
            cursor = Math.max(cursor, e.getValue());
        }
        if (cursor < upper)
            out.add(cursor, upper);
        return out;
    }

    /** The number of integers in this set. */
    public int cardinality() {
        int n = 0;
        for (Map.Entry<Integer, Integer> e : intervals.entrySet())
            n += e.getValue() - e.getKey();
        return n;
    }

    public boolean isEmpty() {
        return intervals.isEmpty();
    }

    @Nonnull
    public IntervalSet copy() {
        return new IntervalSet(new TreeMap<Integer, Integer>(intervals));
    }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof IntervalSet))
            return false;
        return intervals.equals(((IntervalSet) o).intervals);
    }

    @Override
    public int hashCode() {
        return intervals.hashCode();
    }

    @Override
    public String toString() {
        StringBuilder buf = new StringBuilder("{");
        for (Map.Entry<Integer, Integer> e : intervals.entrySet()) {
            if (buf.length() > 1)
                buf.append(", ");
            buf.append('[').append(e.getKey()).append(", ").append(e.getValue()).append(')');
        }
        return buf.append('}').toString();
    }
}
