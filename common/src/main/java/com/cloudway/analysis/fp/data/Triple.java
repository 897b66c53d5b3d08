/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Objects;

import com.cloudway.analysis.fp.function.TriFunction;

/**
 * A tuple with three elements.
 */
public final class Triple<A, B, C> {
    private final A a;
    private final B b;
    private final C c;

    Triple(A a, B b, C c) {
        this.a = a;
        this.b = b;
        this.c = c;
    }

    /**
     * Returns the first element.
     */
    public A _1() {
        return a;
    }

    /**
     * Returns the second element.
     */
    public B _2() {
        return b;
    }

    /**
     * Returns the third element.
     */
    public C _3() {
        return c;
    }

    /**
     * Apply this triple as arguments to a function.
     */
    public <R> R as(TriFunction<? super A, ? super B, ? super C, ? extends R> fn) {
        return fn.apply(a, b, c);
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Triple))
            return false;

        @SuppressWarnings("rawtypes") Triple other = (Triple)obj;
        return Objects.equals(a, other.a)
            && Objects.equals(b, other.b)
            && Objects.equals(c, other.c);
    }

    public int hashCode() {
        return Objects.hash(a, b, c);
    }

    public String toString() {
        return "(" + a + "," + b + "," + c + ")";
    }
}
