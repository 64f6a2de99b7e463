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

import java.util.AbstractSequentialList;
import java.util.List;
import java.util.ListIterator;
import java.util.NoSuchElementException;
import javax.annotation.Nonnull;

/**
 * An immutable cons list.
 *
 * The enumerator keeps the tokens of a path newest-first in an FList, so
 * that a sibling branch shares the prefix it was forked from and
 * backtracking is just dropping a reference.
 */
/* pp */ final class FList<E> extends AbstractSequentialList<E> {

    @SuppressWarnings("rawtypes")
    private static final FList EMPTY = new FList();

    @Nonnull
    @SuppressWarnings("unchecked")
    public static <E> FList<E> empty() {
        return EMPTY;
    }

    /** Returns the elements of the given list in reverse order. */
    @Nonnull
    public static <E> FList<E> fromReversed(@Nonnull List<E> list) {
        FList<E> result = empty();
        for (E e : list) {
            result = new FList<E>(e, result);
        }
        return result;
    }

    @Nonnull
    public final FList<E> next;
    public final E cur;
    public final int size;

    private FList() {
        cur = null;
        next = this;
        size = 0;
    }

    public FList(E cur, @Nonnull FList<E> next) {
        this.cur = cur;
        this.next = next;
        this.size = next.size + 1;
    }

    /** Returns a list with the given element in front of this one. */
    @Nonnull
    public FList<E> push(E e) {
        return new FList<E>(e, this);
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public boolean isEmpty() {
        return size == 0;
    }

    @Override
    @Nonnull
    public ListIterator<E> listIterator(int index) {
        if (index < 0 || index > size)
            throw new IndexOutOfBoundsException();
        FList<E> list = this;
        for (int i = 0; i < index; i++)
            list = list.next;
        return new Iterator<E>(list, index);
    }

    private static final class Iterator<E> implements ListIterator<E> {

        private FList<E> list;
        private int index;

        Iterator(FList<E> list, int index) {
            this.list = list;
            this.index = index;
        }

        @Override
        public boolean hasNext() {
            return list.size != 0;
        }

        @Override
        public E next() {
            if (list.size == 0)
                throw new NoSuchElementException();
            E element = list.cur;
            index++;
            list = list.next;
            return element;
        }

        @Override
        public boolean hasPrevious() {
            return index > 0;
        }

        @Override
        public E previous() {
            throw new UnsupportedOperationException("not supported");
        }

        @Override
        public int nextIndex() {
            return index;
        }

        @Override
        public int previousIndex() {
            return index - 1;
        }

        @Override
        public void remove() {
            throw new UnsupportedOperationException("immutable list");
        }

        @Override
        public void set(E e) {
            throw new UnsupportedOperationException("immutable list");
        }

        @Override
        public void add(E e) {
            throw new UnsupportedOperationException("immutable list");
        }
    }
}
