/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;

import com.google.common.collect.ImmutableList;

/**
 * A sequential, ordered and immutable list.
 *
 * @param <T> the element type
 */
public interface Seq<T> extends Iterable<T>
{
    /**
     * Returns {@code true} if this list contains no elements.
     *
     * @return {@code true} if this list contains no elements
     */
    boolean isEmpty();

    /**
     * Returns the first element in the list.
     *
     * @return the first element in the list
     * @throws java.util.NoSuchElementException if the list is empty
     */
    T head();

    /**
     * Returns remaining elements in the list.
     *
     * @return remaining elements in the list
     * @throws java.util.NoSuchElementException if the list is empty
     */
    Seq<T> tail();

    /**
     * Peek the head element as an optional.
     *
     * @return {@code Optional.empty()} if the sequence is empty, otherwise
     * an optional wrapping the head value.
     */
    default Optional<T> peek() {
        return isEmpty() ? Optional.empty() : Optional.of(head());
    }

    // Constructors

    /**
     * Construct an empty list.
     *
     * @return the empty list
     */
    static <T> Seq<T> nil() {
        return SeqImpl.nil();
    }

    /**
     * Construct a list with head and tail.
     *
     * @param head the first element in the list
     * @param tail the remaining elements in the list
     * @return the list that concatenate from head and tail
     */
    static <T> Seq<T> cons(T head, Seq<T> tail) {
        return SeqImpl.cons(head, tail);
    }

    /**
     * Construct a list with given elements
     */
    @SafeVarargs
    static <T> Seq<T> of(T... elements) {
        Seq<T> res = nil();
        for (int i = elements.length; --i >= 0; ) {
            res = cons(elements[i], res);
        }
        return res;
    }

    /**
     * Construct a list with elements of the given iterable, keeping
     * iteration order.
     */
    static <T> Seq<T> fromIterable(Iterable<? extends T> elements) {
        Seq<T> res = nil();
        for (T x : elements) {
            res = cons(x, res);
        }
        return res.reverse();
    }

    // Operations

    /**
     * Returns the number of elements in this list. Takes linear time.
     */
    default int size() {
        int n = 0;
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            n++;
        }
        return n;
    }

    /**
     * Reverse elements in this list.
     */
    default Seq<T> reverse() {
        Seq<T> res = nil();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            res = cons(xs.head(), res);
        }
        return res;
    }

    /**
     * Returns a list consisting of the results of applying the given function
     * to the elements of this list.
     */
    default <R> Seq<R> map(Function<? super T, ? extends R> mapper) {
        Seq<R> res = nil();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            res = cons(mapper.apply(xs.head()), res);
        }
        return res.reverse();
    }

    /**
     * Returns an iterator over elements of this list.
     *
     * @return an iterator
     */
    @Override
    default Iterator<T> iterator() {
        return new Iterator<T>() {
            Seq<T> cur = Seq.this;

            @Override
            public boolean hasNext() {
                return !cur.isEmpty();
            }

            @Override
            public T next() {
                T res = cur.head();
                cur = cur.tail();
                return res;
            }
        };
    }

    /**
     * Reduce the list using the binary operator, from left to right.
     */
    default <R> R foldLeft(R identity, BiFunction<R, ? super T, R> accumulator) {
        R result = identity;
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            result = accumulator.apply(result, xs.head());
        }
        return result;
    }

    /**
     * Returns whether any elements of this list match the provided predicate.
     */
    default boolean anyMatch(Predicate<? super T> predicate) {
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            if (predicate.test(xs.head()))
                return true;
        }
        return false;
    }

    /**
     * Returns whether all elements of this list match the provided predicate.
     * If the list is empty then {@code true} is returned and the predicate is
     * not evaluated.
     */
    default boolean allMatch(Predicate<? super T> predicate) {
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            if (!predicate.test(xs.head()))
                return false;
        }
        return true;
    }

    /**
     * Copies elements of this list into an immutable {@code List}. Elements
     * must not be {@code null}.
     */
    default List<T> toList() {
        return ImmutableList.copyOf(this);
    }

    /**
     * Returns the string representation of a sequence.
     *
     * @param delimiter the sequence of characters to be used between each element
     * @param prefix the sequence of characters to be used at the beginning
     * @param suffix the sequence of characters to be used at the end
     */
    default String show(CharSequence delimiter, CharSequence prefix, CharSequence suffix) {
        StringJoiner joiner = new StringJoiner(delimiter, prefix, suffix);
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            joiner.add(String.valueOf(xs.head()));
        }
        return joiner.toString();
    }
}
