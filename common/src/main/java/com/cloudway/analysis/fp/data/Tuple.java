/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Objects;
import java.util.function.BiFunction;

/**
 * A tuple with two elements.
 */
public final class Tuple<A, B> {
    private final A first;
    private final B second;

    private Tuple(A first, B second) {
        this.first = first;
        this.second = second;
    }

    /**
     * Construct a new Tuple with two arguments.
     *
     * @param first the first argument
     * @param second the second argument
     */
    public static <A, B> Tuple<A, B> of(A first, B second) {
        return new Tuple<>(first, second);
    }

    /**
     * Construct a new Tuple with three elements.
     *
     * @param a the first argument
     * @param b the second argument
     * @param c the third argument
     */
    public static <A, B, C> Triple<A, B, C> of(A a, B b, C c) {
        return new Triple<>(a, b, c);
    }

    /**
     * Returns the first element.
     */
    public A first() {
        return first;
    }

    /**
     * Returns the second element.
     */
    public B second() {
        return second;
    }

    /**
     * Apply this tuple as arguments to a function.
     */
    public <R> R as(BiFunction<? super A, ? super B, ? extends R> fn) {
        return fn.apply(first, second);
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Tuple))
            return false;

        @SuppressWarnings("rawtypes") Tuple other = (Tuple)obj;
        return Objects.equals(first, other.first)
            && Objects.equals(second, other.second);
    }

    public int hashCode() {
        return 31 * (31 + Objects.hashCode(first)) + Objects.hashCode(second);
    }

    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
