/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;

import com.google.common.base.MoreObjects;

/**
 * Classifies a map by its number of bindings: none, exactly one, or more.
 *
 * @param <K> the type of keys
 * @param <V> the type of mapped values
 */
public final class Cardinality<K, V> {
    public enum Kind { ZERO, ONE, MANY }

    private static final Cardinality<?,?> ZERO = new Cardinality<>(Kind.ZERO, null);
    private static final Cardinality<?,?> MANY = new Cardinality<>(Kind.MANY, null);

    private final Kind kind;
    private final Map.Entry<K, V> binding;

    private Cardinality(Kind kind, Map.Entry<K, V> binding) {
        this.kind = kind;
        this.binding = binding;
    }

    @SuppressWarnings("unchecked")
    public static <K, V> Cardinality<K, V> zero() {
        return (Cardinality<K,V>)ZERO;
    }

    public static <K, V> Cardinality<K, V> one(Map.Entry<K, V> binding) {
        return new Cardinality<>(Kind.ONE, Objects.requireNonNull(binding));
    }

    @SuppressWarnings("unchecked")
    public static <K, V> Cardinality<K, V> many() {
        return (Cardinality<K,V>)MANY;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Returns the only binding of a {@link Kind#ONE} classification.
     *
     * @throws NoSuchElementException if the classified map is empty or has
     * more than one binding
     */
    public Map.Entry<K, V> binding() {
        if (binding == null)
            throw new NoSuchElementException();
        return binding;
    }

    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Cardinality))
            return false;

        Cardinality<?,?> other = (Cardinality<?,?>)obj;
        if (kind != other.kind)
            return false;
        if (kind != Kind.ONE)
            return true;
        return Objects.equals(binding.getKey(), other.binding.getKey())
            && Objects.equals(binding.getValue(), other.binding.getValue());
    }

    public int hashCode() {
        return kind == Kind.ONE
            ? Objects.hash(kind, binding.getKey(), binding.getValue())
            : kind.hashCode();
    }

    public String toString() {
        MoreObjects.ToStringHelper helper = MoreObjects.toStringHelper(this).add("kind", kind);
        if (binding != null) {
            helper.add("key", binding.getKey()).add("value", binding.getValue());
        }
        return helper.toString();
    }
}
