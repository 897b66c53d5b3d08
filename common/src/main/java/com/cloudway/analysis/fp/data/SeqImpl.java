/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.NoSuchElementException;
import java.util.Objects;

final class SeqImpl {
    private SeqImpl() {}

    @SuppressWarnings("rawtypes")
    private static final Seq NIL = new Seq() {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public Object head() {
            throw new NoSuchElementException();
        }

        @Override
        public Seq tail() {
            throw new NoSuchElementException();
        }

        @Override
        public Seq reverse() {
            return this;
        }

        public boolean equals(Object obj) {
            return (obj instanceof Seq) && ((Seq)obj).isEmpty();
        }

        public int hashCode() {
            return 1;
        }

        @Override
        public String toString() {
            return "[]";
        }
    };

    private static final class Cons<T> implements Seq<T> {
        private final T head;
        private final Seq<T> tail;

        Cons(T head, Seq<T> tail) {
            this.head = head;
            this.tail = tail;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public T head() {
            return head;
        }

        @Override
        public Seq<T> tail() {
            return tail;
        }

        public boolean equals(Object obj) {
            return (obj instanceof Seq) && SeqImpl.equals(this, (Seq<?>)obj);
        }

        public int hashCode() {
            return foldLeft(1, (h, x) -> 31 * h + Objects.hashCode(x));
        }

        @Override
        public String toString() {
            return show(", ", "[", "]");
        }
    }

    @SuppressWarnings("unchecked")
    static <T> Seq<T> nil() {
        return (Seq<T>)NIL;
    }

    static <T> Seq<T> cons(T head, Seq<T> tail) {
        Objects.requireNonNull(tail);
        return new Cons<>(head, tail);
    }

    static boolean equals(Seq<?> xs, Seq<?> ys) {
        while (!xs.isEmpty() && !ys.isEmpty()) {
            if (xs == ys)
                return true;
            if (!Objects.equals(xs.head(), ys.head()))
                return false;
            xs = xs.tail();
            ys = ys.tail();
        }
        return xs.isEmpty() && ys.isEmpty();
    }
}
