/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * The {@code These} class represents the presence of a key in two merged maps:
 * a value of type {@code These a b} is either {@code Left a} (only in the left
 * map), {@code Right b} (only in the right map), or {@code Both a b}.
 *
 * @param <A> the type of the left value
 * @param <B> the type of the right value
 */
public abstract class These<A, B> {
    private static final class Left<A, B> extends These<A, B> {
        private final A a;

        Left(A a) {
            this.a = a;
        }

        @Override
        public boolean isLeft() {
            return true;
        }

        @Override
        public A left() {
            return a;
        }

        public String toString() {
            return "Left(" + a + ")";
        }
    }

    private static final class Right<A, B> extends These<A, B> {
        private final B b;

        Right(B b) {
            this.b = b;
        }

        @Override
        public boolean isRight() {
            return true;
        }

        @Override
        public B right() {
            return b;
        }

        public String toString() {
            return "Right(" + b + ")";
        }
    }

    private static final class Both<A, B> extends These<A, B> {
        private final A a;
        private final B b;

        Both(A a, B b) {
            this.a = a;
            this.b = b;
        }

        @Override
        public boolean isBoth() {
            return true;
        }

        @Override
        public A left() {
            return a;
        }

        @Override
        public B right() {
            return b;
        }

        public String toString() {
            return "Both(" + a + "," + b + ")";
        }
    }

    These() {}

    /**
     * Construct a 'Left' value.
     */
    public static <A, B> These<A, B> left(A left) {
        return new Left<>(left);
    }

    /**
     * Construct a 'Right' value.
     */
    public static <A, B> These<A, B> right(B right) {
        return new Right<>(right);
    }

    /**
     * Construct a 'Both' value.
     */
    public static <A, B> These<A, B> both(A left, B right) {
        return new Both<>(left, right);
    }

    /**
     * Returns true if only the left value is present.
     */
    public boolean isLeft() {
        return false;
    }

    /**
     * Returns true if only the right value is present.
     */
    public boolean isRight() {
        return false;
    }

    /**
     * Returns true if both values are present.
     */
    public boolean isBoth() {
        return false;
    }

    /**
     * Returns true if the left value is present, alone or together with
     * the right value.
     */
    public boolean hasLeft() {
        return !isRight();
    }

    /**
     * Returns true if the right value is present, alone or together with
     * the left value.
     */
    public boolean hasRight() {
        return !isLeft();
    }

    /**
     * Returns the left value.
     *
     * @throws NoSuchElementException if this is a 'Right' value
     */
    public A left() {
        throw new NoSuchElementException();
    }

    /**
     * Returns the right value.
     *
     * @throws NoSuchElementException if this is a 'Left' value
     */
    public B right() {
        throw new NoSuchElementException();
    }

    /**
     * Case analysis for the These type.
     */
    public <C> C these(Function<? super A, ? extends C> af,
                       Function<? super B, ? extends C> bf,
                       BiFunction<? super A, ? super B, ? extends C> abf) {
        return isLeft()  ? af.apply(left()) :
               isRight() ? bf.apply(right())
                         : abf.apply(left(), right());
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof These))
            return false;

        These<?,?> other = (These<?,?>)obj;
        return isLeft() == other.isLeft()
            && isRight() == other.isRight()
            && (!hasLeft() || Objects.equals(left(), other.left()))
            && (!hasRight() || Objects.equals(right(), other.right()));
    }

    public int hashCode() {
        return Objects.hash(isLeft(), isRight(),
                            hasLeft() ? left() : null,
                            hasRight() ? right() : null);
    }
}
