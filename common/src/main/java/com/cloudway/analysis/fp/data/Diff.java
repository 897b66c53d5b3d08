/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;

/**
 * Classifies the difference of a single key between two maps.
 *
 * @param <V> the type of mapped values
 */
public final class Diff<V> {
    /**
     * The kind of a difference.
     */
    public enum Kind {
        /** The key is only present in the left map. */
        LEFT,
        /** The key is only present in the right map. */
        RIGHT,
        /** The key is present in both maps with unequal values. */
        UNEQUAL
    }

    private final Kind kind;
    private final V left;
    private final V right;

    private Diff(Kind kind, V left, V right) {
        this.kind = kind;
        this.left = left;
        this.right = right;
    }

    public static <V> Diff<V> left(V value) {
        return new Diff<>(Kind.LEFT, Objects.requireNonNull(value), null);
    }

    public static <V> Diff<V> right(V value) {
        return new Diff<>(Kind.RIGHT, null, Objects.requireNonNull(value));
    }

    public static <V> Diff<V> unequal(V left, V right) {
        return new Diff<>(Kind.UNEQUAL, Objects.requireNonNull(left), Objects.requireNonNull(right));
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the value in the left map, empty for a {@link Kind#RIGHT} difference.
     */
    public Optional<V> leftValue() {
        return Optional.ofNullable(left);
    }

    /**
     * Returns the value in the right map, empty for a {@link Kind#LEFT} difference.
     */
    public Optional<V> rightValue() {
        return Optional.ofNullable(right);
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Diff))
            return false;

        Diff<?> other = (Diff<?>)obj;
        return kind == other.kind
            && Objects.equals(left, other.left)
            && Objects.equals(right, other.right);
    }

    public int hashCode() {
        return Objects.hash(kind, left, right);
    }

    public String toString() {
        return MoreObjects.toStringHelper(this)
            .omitNullValues()
            .add("kind", kind)
            .add("left", left)
            .add("right", right)
            .toString();
    }
}
