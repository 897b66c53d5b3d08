/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Comparator;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Function;
import java.util.function.Predicate;

import com.google.common.collect.AbstractIterator;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import com.cloudway.analysis.fp.function.TriFunction;

// @formatter:off

/**
 * The underlying implementation for TreePMap.
 */
final class Tree {
    private Tree() {}

    /**
     * The common operations of a balanced binary tree.
     */
    interface Node<K,V> {
        boolean isEmpty();
        int size();
        Tip<K,V> tip();
        V __lookup(K k);

        Node<K,V> __put(K k, V v);
        Node<K,V> __remove(K k);
        Node<K,V> __change(K k, Function<Optional<V>, Optional<? extends V>> f);

        <R> Node<K,R> __map(BiFunction<? super K, ? super V, ? extends R> f);
        Node<K,V> __mapEndo(Function<? super V, ? extends V> f);

        boolean valid();
    }

    /**
     * An empty tree and responsible to compare elements and construct
     * tree node.
     */
    static abstract class Tip<K,V> implements Node<K,V> {
        final Comparator<? super K> cmp;

        protected Tip(Comparator<? super K> cmp) {
            this.cmp = cmp;
        }

        int compare(K k1, K k2) {
            return cmp.compare(k1, k2);
        }

        abstract Node<K,V> cons(int sz, K k, V v, Node<K,V> l, Node<K,V> r);

        /**
         * The tip only depends on the key type, so it can construct trees
         * with any value type.
         */
        @SuppressWarnings("unchecked")
        <R> Tip<K,R> retype() {
            return (Tip<K,R>)(Tip<K,?>)this;
        }

        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public int size() {
            return 0;
        }

        @Override
        public Tip<K,V> tip() {
            return this;
        }

        @Override
        public V __lookup(K k) {
            return null;
        }

        @Override
        public Node<K,V> __put(K k, V v) {
            return cons(1, k, v, this, this);
        }

        @Override
        public Node<K,V> __remove(K k) {
            return this;
        }

        @Override
        public Node<K,V> __change(K k, Function<Optional<V>, Optional<? extends V>> f) {
            Optional<? extends V> v = f.apply(Optional.empty());
            return v.isPresent() ? __put(k, v.get()) : this;
        }

        @Override
        public <R> Node<K,R> __map(BiFunction<? super K, ? super V, ? extends R> f) {
            return retype();
        }

        @Override
        public Node<K,V> __mapEndo(Function<? super V, ? extends V> f) {
            return this;
        }

        @Override
        public boolean valid() {
            return true;
        }
    }

    /**
     * A tree node that contains data and child nodes.
     */
    static class Bin<K,V> implements Node<K,V> {
        final Tip<K,V> tip;
        final int size;
        final K key;
        final V value;
        final Node<K,V> left;
        final Node<K,V> right;

        protected Bin(Tip<K,V> tip, int size, K key, V value, Node<K,V> left, Node<K,V> right) {
            this.tip   = tip;
            this.size  = size;
            this.key   = key;
            this.value = value;
            this.left  = left;
            this.right = right;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public int size() {
            return size;
        }

        @Override
        public Tip<K,V> tip() {
            return tip;
        }

        Map.Entry<K,V> toEntry() {
            return Maps.immutableEntry(key, value);
        }

        @Override
        public V __lookup(K k) {
            Node<K,V> t = this;
            while (!t.isEmpty()) {
                Bin<K,V> tb = (Bin<K,V>)t;
                int cmp = tip.compare(k, tb.key);
                if (cmp < 0) {
                    t = tb.left;
                } else if (cmp > 0) {
                    t = tb.right;
                } else {
                    return tb.value;
                }
            }
            return null;
        }

        @Override
        public Node<K,V> __put(K k, V v) {
            int cmp = tip.compare(k, key);
            return cmp < 0 ? balance(left.__put(k, v), right) :
                   cmp > 0 ? balance(left, right.__put(k, v))
                           : modify(v);
        }

        @Override
        public Node<K,V> __remove(K k) {
            int cmp = tip.compare(k, key);
            return cmp < 0 ? balance(left.__remove(k), right) :
                   cmp > 0 ? balance(left, right.__remove(k))
                           : delete();
        }

        @Override
        public Node<K,V> __change(K k, Function<Optional<V>, Optional<? extends V>> f) {
            int cmp = tip.compare(k, key);
            if (cmp < 0) {
                return balance(left.__change(k, f), right);
            } else if (cmp > 0) {
                return balance(left, right.__change(k, f));
            } else {
                Optional<? extends V> v = f.apply(Optional.of(value));
                return v.isPresent() ? modify(v.get()) : delete();
            }
        }

        @Override
        public <R> Node<K,R> __map(BiFunction<? super K, ? super V, ? extends R> f) {
            Tip<K,R> t = tip.retype();
            Node<K,R> l = left.__map(f);
            R v = Objects.requireNonNull(f.apply(key, value));
            Node<K,R> r = right.__map(f);
            return t.cons(size, key, v, l, r);
        }

        @Override
        public Node<K,V> __mapEndo(Function<? super V, ? extends V> f) {
            Node<K,V> l = left.__mapEndo(f);
            V v = Objects.requireNonNull(f.apply(value));
            Node<K,V> r = right.__mapEndo(f);
            return (l == left && r == right && v == value) ? this : tip.cons(size, key, v, l, r);
        }

        static <K,V> Bin<K,V> findMin(Node<K,V> t) {
            if (t.isEmpty())
                throw new NoSuchElementException();
            Bin<K,V> b = (Bin<K,V>)t;
            while (!b.left.isEmpty())
                b = (Bin<K,V>)b.left;
            return b;
        }

        static <K,V> Bin<K,V> findMax(Node<K,V> t) {
            if (t.isEmpty())
                throw new NoSuchElementException();
            Bin<K,V> b = (Bin<K,V>)t;
            while (!b.right.isEmpty())
                b = (Bin<K,V>)b.right;
            return b;
        }

        /**
         * Returns the node with least key that satisfies the predicate, or
         * null if no key satisfies the predicate.
         */
        static <K,V> Bin<K,V> findFirst(Node<K,V> t, Predicate<? super K> p) {
            while (!t.isEmpty()) {
                Bin<K,V> b = (Bin<K,V>)t;
                Bin<K,V> found = findFirst(b.left, p);
                if (found != null)
                    return found;
                if (p.test(b.key))
                    return b;
                t = b.right;
            }
            return null;
        }

        static <K,V> boolean anyMatch(Node<K,V> t, BiPredicate<? super K, ? super V> p) {
            while (!t.isEmpty()) {
                Bin<K,V> b = (Bin<K,V>)t;
                if (anyMatch(b.left, p) || p.test(b.key, b.value))
                    return true;
                t = b.right;
            }
            return false;
        }

        static <K,V,R> R foldLeft(Node<K,V> t, R z, TriFunction<R, ? super K, ? super V, R> f) {
            while (!t.isEmpty()) {
                Bin<K,V> b = (Bin<K,V>)t;
                z = f.apply(foldLeft(b.left, z, f), b.key, b.value);
                t = b.right;
            }
            return z;
        }

        static <K,V,R> R foldRight(Node<K,V> t, R z, TriFunction<? super K, ? super V, R, R> f) {
            while (!t.isEmpty()) {
                Bin<K,V> b = (Bin<K,V>)t;
                z = f.apply(b.key, b.value, foldRight(b.right, z, f));
                t = b.left;
            }
            return z;
        }

        // Helper methods

        Node<K,V> modify(V v) {
            return (v == value) ? this : tip.cons(size, key, v, left, right);
        }

        Node<K,V> delete() {
            return glue(tip, left, right);
        }

        Node<K,V> balance(Node<K,V> l, Node<K,V> r) {
            return (l == left && r == right) ? this : balance(tip, key, value, l, r);
        }

        Node<K,V> link(Node<K,V> l, Node<K,V> r) {
            return (l == left && r == right) ? this : link(tip, key, value, l, r);
        }

        /**
         * Performs a split and also returns the value of the pivot element if
         * it was found in the original tree, otherwise null.
         */
        static <K,V> Triple<V, Node<K,V>, Node<K,V>> splitMember(Node<K,V> t, K k) {
            if (t.isEmpty()) {
                return Tuple.<V, Node<K,V>, Node<K,V>>of(null, t, t);
            }

            Bin<K,V> b = (Bin<K,V>)t;
            int cmp = b.tip.compare(k, b.key);
            if (cmp < 0) {
                Triple<V, Node<K,V>, Node<K,V>> s = splitMember(b.left, k);
                return Tuple.of(s._1(), s._2(), b.link(s._3(), b.right));
            } else if (cmp > 0) {
                Triple<V, Node<K,V>, Node<K,V>> s = splitMember(b.right, k);
                return Tuple.of(s._1(), b.link(b.left, s._2()), s._3());
            } else {
                return Tuple.of(b.value, b.left, b.right);
            }
        }

        /**
         * Returns true if all keys in t1 are in t2, and p returns true when
         * applied to their respective values.
         */
        static <K,V> boolean isSubsetOf(Node<K,V> t1, Node<K,V> t2, BiPredicate<? super V, ? super V> p) {
            if (t1.isEmpty()) {
                return true;
            } else if (t2.isEmpty()) {
                return false;
            } else {
                Bin<K,V> b = (Bin<K,V>)t1;
                Triple<V, Node<K,V>, Node<K,V>> s = splitMember(t2, b.key);
                return s._1() != null && p.test(b.value, s._1())
                    && isSubsetOf(b.left, s._2(), p)
                    && isSubsetOf(b.right, s._3(), p);
            }
        }

        // Merge

        /**
         * Merges two trees. The function is applied in key order to every key
         * in either tree, the key is dropped from the result if the function
         * returns nothing. Nodes of the first tree whose subtrees and value are
         * unchanged are reused in the result.
         */
        static <K,A,B,C> Node<K,C> mergeWithKey(Tip<K,C> tip, Node<K,A> t1, Node<K,B> t2,
                BiFunction<? super K, These<A,B>, Optional<? extends C>> f) {
            if (t2.isEmpty()) {
                return filterMap(tip, t1, (k, a) -> f.apply(k, These.left(a)));
            } else if (t1.isEmpty()) {
                return filterMap(tip, t2, (k, b) -> f.apply(k, These.right(b)));
            } else {
                Bin<K,A> b1 = (Bin<K,A>)t1;
                Triple<B, Node<K,B>, Node<K,B>> s = splitMember(t2, b1.key);
                Node<K,C> l = mergeWithKey(tip, b1.left, s._2(), f);
                These<A,B> x = s._1() == null ? These.left(b1.value) : These.both(b1.value, s._1());
                Optional<? extends C> c = f.apply(b1.key, x);
                Node<K,C> r = mergeWithKey(tip, b1.right, s._3(), f);
                return rebuild(tip, b1, c, l, r);
            }
        }

        /**
         * Map values and collect the results that are present.
         */
        static <K,A,C> Node<K,C> filterMap(Tip<K,C> tip, Node<K,A> t,
                BiFunction<? super K, ? super A, Optional<? extends C>> f) {
            if (t.isEmpty()) {
                return tip;
            }

            Bin<K,A> b = (Bin<K,A>)t;
            Node<K,C> l = filterMap(tip, b.left, f);
            Optional<? extends C> c = f.apply(b.key, b.value);
            Node<K,C> r = filterMap(tip, b.right, f);
            return rebuild(tip, b, c, l, r);
        }

        /**
         * Splits a tree in one walk into the bindings that satisfy the
         * predicate and those that don't. The predicate is applied once per
         * binding, in key order.
         */
        static <K,V> Tuple<Node<K,V>, Node<K,V>> partition(Tip<K,V> tip, Node<K,V> t,
                BiPredicate<? super K, ? super V> p) {
            if (t.isEmpty()) {
                return Tuple.<Node<K,V>, Node<K,V>>of(tip, tip);
            }

            Bin<K,V> b = (Bin<K,V>)t;
            Tuple<Node<K,V>, Node<K,V>> l = partition(tip, b.left, p);
            boolean accept = p.test(b.key, b.value);
            Tuple<Node<K,V>, Node<K,V>> r = partition(tip, b.right, p);

            Optional<V> v = Optional.of(b.value), none = Optional.empty();
            return Tuple.of(rebuild(tip, b, accept ? v : none, l.first(), r.first()),
                            rebuild(tip, b, accept ? none : v, l.second(), r.second()));
        }

        @SuppressWarnings("unchecked")
        private static <K,A,C> Node<K,C> rebuild(Tip<K,C> tip, Bin<K,A> b, Optional<? extends C> c,
                                                 Node<K,C> l, Node<K,C> r) {
            if (!c.isPresent()) {
                return concat(l, r);
            }

            C v = c.get();
            if ((Object)v == b.value && (Object)l == b.left && (Object)r == b.right) {
                return (Node<K,C>)(Node<K,?>)b;
            }
            return link(tip, b.key, v, l, r);
        }

        // Utility methods that maintain the balance properties of the tree.

        /**
         * Joins two trees with a key between them. All keys in l must be
         * less than k and all keys in r must be greater than k.
         */
        static <K,V> Node<K,V> link(Tip<K,V> tip, K k, V v, Node<K,V> l, Node<K,V> r) {
            if (l.isEmpty()) {
                return insertMin(tip, k, v, r);
            } else if (r.isEmpty()) {
                return insertMax(tip, k, v, l);
            } else {
                Bin<K,V> lb = (Bin<K,V>)l, rb = (Bin<K,V>)r;
                if (lb.size * DELTA < rb.size) {
                    return rb.balance(link(tip, k, v, l, rb.left), rb.right);
                } else if (rb.size * DELTA < lb.size) {
                    return lb.balance(lb.left, link(tip, k, v, lb.right, r));
                } else {
                    return bin(tip, k, v, l, r);
                }
            }
        }

        static <K,V> Node<K,V> insertMax(Tip<K,V> tip, K k, V v, Node<K,V> t) {
            if (t.isEmpty()) {
                return tip.cons(1, k, v, tip, tip);
            } else {
                Bin<K,V> b = (Bin<K,V>)t;
                return b.balance(b.left, insertMax(tip, k, v, b.right));
            }
        }

        static <K,V> Node<K,V> insertMin(Tip<K,V> tip, K k, V v, Node<K,V> t) {
            if (t.isEmpty()) {
                return tip.cons(1, k, v, tip, tip);
            } else {
                Bin<K,V> b = (Bin<K,V>)t;
                return b.balance(insertMin(tip, k, v, b.left), b.right);
            }
        }

        /**
         * Concatenates two trees. All keys in l must be less than all keys in r.
         */
        static <K,V> Node<K,V> concat(Node<K,V> l, Node<K,V> r) {
            if (l.isEmpty()) {
                return r;
            } else if (r.isEmpty()) {
                return l;
            } else {
                Bin<K,V> lb = (Bin<K,V>)l, rb = (Bin<K,V>)r;
                if (lb.size * DELTA < rb.size) {
                    return rb.balance(concat(l, rb.left), rb.right);
                } else if (rb.size * DELTA < lb.size) {
                    return lb.balance(lb.left, concat(lb.right, r));
                } else {
                    return glue(lb.tip, l, r);
                }
            }
        }

        /**
         * Glues two trees together. Assumes that 'l' and 'r' are already
         * balanced with respect to each other.
         */
        static <K,V> Node<K,V> glue(Tip<K,V> tip, Node<K,V> l, Node<K,V> r) {
            if (l.isEmpty()) {
                return r;
            } else if (r.isEmpty()) {
                return l;
            } else if (l.size() > r.size()) {
                return deleteFindMax(l, (k, v, t) -> balance(tip, k, v, t, r));
            } else {
                return deleteFindMin(r, (k, v, t) -> balance(tip, k, v, l, t));
            }
        }

        /**
         * Delete and find the minimal element.
         */
        static <K,V,R> R deleteFindMin(Node<K,V> t, TriFunction<K, V, Node<K,V>, R> f) {
            if (t.isEmpty()) {
                throw new IllegalStateException("Cannot return the minimal element of an empty map");
            }

            Seq<Bin<K,V>> stack = Seq.nil();
            Bin<K,V> b = (Bin<K,V>)t;
            while (!b.left.isEmpty()) {
                stack = Seq.cons(b, stack);
                b = (Bin<K,V>)b.left;
            }

            return f.apply(b.key, b.value, stack.foldLeft(b.right,
                        (min, x) -> x.balance(min, x.right)));
        }

        /**
         * Delete and find the maximal element.
         */
        static <K,V,R> R deleteFindMax(Node<K,V> t, TriFunction<K, V, Node<K,V>, R> f) {
            if (t.isEmpty()) {
                throw new IllegalStateException("Cannot return the maximal element of an empty map");
            }

            Seq<Bin<K,V>> stack = Seq.nil();
            Bin<K,V> b = (Bin<K,V>)t;
            while (!b.right.isEmpty()) {
                stack = Seq.cons(b, stack);
                b = (Bin<K,V>)b.right;
            }

            return f.apply(b.key, b.value, stack.foldLeft(b.left,
                        (max, x) -> x.balance(x.left, max)));
        }

        // Balance trees

        private static final int DELTA = 3;
        private static final int RATIO = 2;

        /**
         * Balance two trees with value x.  The sizes of the trees should balance
         * after decreasing the size of one of them (a rotation).
         *
         * <ul>
         * <li>{@code DELTA} is the maximum relative difference between the sizes of
         * two trees, it corresponds with the [w] in Adams' paper.</li>
         * <li>{@code RATIO} is the ratio between an outer and inner sibling of the
         * heavier subtree in an unbalanced setting. It determines whether a double
         * or single rotation should be performed to restore balance.  It is corresponds
         * with the inverse of {@code &alpha;} in Adam's article.</li>
         * </ul>
         */
        static <K,V> Node<K,V> balance(Tip<K,V> tip, K k, V v, Node<K,V> l, Node<K,V> r) {
            int sl = l.size(), sr = r.size();
            if (sl + sr <= 1) {
                return bin(tip, k, v, l, r);
            } else if (sr > DELTA * sl) {
                Bin<K,V> rb = (Bin<K,V>)r;
                return rb.left.size() < RATIO * rb.right.size()
                    ? singleL(tip, k, v, l, rb)
                    : doubleL(tip, k, v, l, rb);
            } else if (sl > DELTA * sr) {
                Bin<K,V> lb = (Bin<K,V>)l;
                return lb.right.size() < RATIO * lb.left.size()
                    ? singleR(tip, k, v, lb, r)
                    : doubleR(tip, k, v, lb, r);
            } else {
                return bin(tip, k, v, l, r);
            }
        }

        private static <K,V> Node<K,V> singleL(Tip<K,V> tip, K k, V v, Node<K,V> l, Bin<K,V> r) {
            return bin(tip, r.key, r.value, bin(tip, k, v, l, r.left), r.right);
        }

        private static <K,V> Node<K,V> doubleL(Tip<K,V> tip, K k, V v, Node<K,V> l, Bin<K,V> r) {
            Bin<K,V> rl = (Bin<K,V>)r.left;
            return bin(tip, rl.key, rl.value,
                       bin(tip, k, v, l, rl.left),
                       bin(tip, r.key, r.value, rl.right, r.right));
        }

        private static <K,V> Node<K,V> singleR(Tip<K,V> tip, K k, V v, Bin<K,V> l, Node<K,V> r) {
            return bin(tip, l.key, l.value, l.left, bin(tip, k, v, l.right, r));
        }

        private static <K,V> Node<K,V> doubleR(Tip<K,V> tip, K k, V v, Bin<K,V> l, Node<K,V> r) {
            Bin<K,V> lr = (Bin<K,V>)l.right;
            return bin(tip, lr.key, lr.value,
                       bin(tip, l.key, l.value, l.left, lr.left),
                       bin(tip, k, v, lr.right, r));
        }

        private static <K,V> Node<K,V> bin(Tip<K,V> tip, K k, V v, Node<K,V> l, Node<K,V> r) {
            return tip.cons(l.size() + r.size() + 1, k, v, l, r);
        }

        // Show

        static <K,V> String showTree(Node<K,V> t, BiFunction<? super K, ? super V, String> elem, Seq<String> bars) {
            if (t.isEmpty()) {
                return showBars(bars) + "@\n";
            }

            Bin<K,V> tb = (Bin<K,V>)t;
            if (tb.left.isEmpty() && tb.right.isEmpty()) {
                return showBars(bars) + elem.apply(tb.key, tb.value) + "\n";
            } else {
                return showBars(bars) + elem.apply(tb.key, tb.value) + "\n"
                     + showTree(tb.left, elem, withBar(bars))
                     + showTree(tb.right, elem, withEmpty(bars));
            }
        }

        static Seq<String> withBar(Seq<String> bars) {
            return Seq.cons("|  ", bars);
        }

        static Seq<String> withEmpty(Seq<String> bars) {
            return Seq.cons("   ", bars);
        }

        static String showBars(Seq<String> bars) {
            return bars.isEmpty() ? "" : bars.tail().reverse().show("", "", "") + "+--";
        }

        // Assertions

        @Override
        public boolean valid() {
            return balanced(this) && ordered(this, null, null) && realsize(this) == size;
        }

        private static <K,V> boolean balanced(Node<K,V> t) {
            if (t.isEmpty()) {
                return true;
            } else {
                Node<K,V> l = ((Bin<K,V>)t).left, r = ((Bin<K,V>)t).right;
                return (l.size() + r.size() <= 1 || (l.size() <= DELTA * r.size() &&
                                                     r.size() <= DELTA * l.size()))
                    && balanced(l) && balanced(r);
            }
        }

        // lo and hi are exclusive bounds, null means unbounded
        private static <K,V> boolean ordered(Node<K,V> t, Bin<K,V> lo, Bin<K,V> hi) {
            if (t.isEmpty()) {
                return true;
            } else {
                Bin<K,V> b = (Bin<K,V>)t;
                return (lo == null || b.tip.compare(lo.key, b.key) < 0)
                    && (hi == null || b.tip.compare(b.key, hi.key) < 0)
                    && ordered(b.left, lo, b)
                    && ordered(b.right, b, hi);
            }
        }

        // returns -1 if any cached size is wrong
        private static <K,V> int realsize(Node<K,V> t) {
            if (t.isEmpty()) {
                return 0;
            }

            Bin<K,V> b = (Bin<K,V>)t;
            int n = realsize(b.left), m = realsize(b.right);
            return (n >= 0 && m >= 0 && n + m + 1 == b.size) ? b.size : -1;
        }
    }

    /**
     * Iterates the tree in key order.
     */
    static final class EntryIterator<K,V> extends AbstractIterator<Map.Entry<K,V>> {
        private Seq<Bin<K,V>> stack = Seq.nil();

        EntryIterator(Node<K,V> t) {
            pushLeft(t);
        }

        private void pushLeft(Node<K,V> t) {
            while (!t.isEmpty()) {
                Bin<K,V> b = (Bin<K,V>)t;
                stack = Seq.cons(b, stack);
                t = b.left;
            }
        }

        @Override
        protected Map.Entry<K,V> computeNext() {
            if (stack.isEmpty()) {
                return endOfData();
            }

            Bin<K,V> b = stack.head();
            stack = stack.tail();
            pushLeft(b.right);
            return b.toEntry();
        }
    }

    // ------------------------------------------------------------------------

    @SuppressWarnings({"rawtypes", "unchecked"})
    static final MapTip EMPTY_MAP = new MapTip(Comparator.naturalOrder());

    // mixin interface to convert generic tree node to map node
    @SuppressWarnings("unchecked")
    interface MapNode<K,V> extends Node<K,V>, TreePMap<K,V> {
        @Override
        default Comparator<? super K> comparator() {
            return tip().cmp;
        }

        @Override
        default boolean containsKey(K k) {
            return __lookup(k) != null;
        }

        @Override
        default Optional<V> lookup(K k) {
            return Optional.ofNullable(__lookup(k));
        }

        @Override
        default V get(K k) {
            V v = __lookup(k);
            if (v == null)
                throw new NoSuchElementException("key not found: " + k);
            return v;
        }

        @Override
        default V getOrDefault(K k, V d) {
            V v = __lookup(k);
            return v != null ? v : d;
        }

        @Override
        default TreePMap<K,V> put(K k, V v) {
            Objects.requireNonNull(k);
            Objects.requireNonNull(v);
            return (TreePMap<K,V>)__put(k, v);
        }

        @Override
        default TreePMap<K,V> remove(K k) {
            return (TreePMap<K,V>)__remove(k);
        }

        @Override
        default TreePMap<K,V> change(K k, Function<Optional<V>, Optional<? extends V>> f) {
            Objects.requireNonNull(k);
            return (TreePMap<K,V>)__change(k, f);
        }

        @Override
        default Optional<Tuple<V, TreePMap<K,V>>> findAndRemove(K k) {
            V v = __lookup(k);
            if (v == null)
                return Optional.empty();
            return Optional.of(Tuple.of(v, (TreePMap<K,V>)__remove(k)));
        }

        @Override
        default Triple<TreePMap<K,V>, Optional<V>, TreePMap<K,V>> split(K k) {
            Triple<V, Node<K,V>, Node<K,V>> s = Bin.splitMember(this, k);
            return Tuple.of((TreePMap<K,V>)s._2(), Optional.ofNullable(s._1()), (TreePMap<K,V>)s._3());
        }

        @Override
        default Optional<K> chooseKey() {
            return isEmpty() ? Optional.empty() : Optional.of(((Bin<K,V>)this).key);
        }

        @Override
        default Optional<Map.Entry<K,V>> choose() {
            return isEmpty() ? Optional.empty() : Optional.of(((Bin<K,V>)this).toEntry());
        }

        @Override
        default Optional<Triple<K, V, TreePMap<K,V>>> pop() {
            if (isEmpty())
                return Optional.empty();
            Bin<K,V> b = (Bin<K,V>)this;
            return Optional.of(Tuple.of(b.key, b.value, (TreePMap<K,V>)b.delete()));
        }

        @Override
        default Optional<Map.Entry<K,V>> minBinding() {
            return isEmpty() ? Optional.empty() : Optional.of(Bin.findMin(this).toEntry());
        }

        @Override
        default Optional<Map.Entry<K,V>> maxBinding() {
            return isEmpty() ? Optional.empty() : Optional.of(Bin.findMax(this).toEntry());
        }

        @Override
        default Optional<Triple<K, V, TreePMap<K,V>>> popMinBinding() {
            if (isEmpty())
                return Optional.empty();
            return Optional.of(Bin.<K, V, Triple<K, V, TreePMap<K,V>>>deleteFindMin(this,
                (k, v, t) -> Tuple.of(k, v, (TreePMap<K,V>)t)));
        }

        @Override
        default Optional<Map.Entry<K,V>> onlyBinding() {
            if (isEmpty())
                return Optional.empty();
            Bin<K,V> b = (Bin<K,V>)this;
            return b.left.isEmpty() && b.right.isEmpty()
                ? Optional.of(b.toEntry())
                : Optional.empty();
        }

        @Override
        default Cardinality<K,V> classify() {
            if (isEmpty())
                return Cardinality.zero();
            Bin<K,V> b = (Bin<K,V>)this;
            return b.left.isEmpty() && b.right.isEmpty()
                ? Cardinality.one(b.toEntry())
                : Cardinality.many();
        }

        @Override
        default Optional<Map.Entry<K,V>> findFirst(Predicate<? super K> p) {
            Bin<K,V> b = Bin.findFirst(this, p);
            return b == null ? Optional.empty() : Optional.of(b.toEntry());
        }

        @Override
        default <R> TreePMap<K,R> map(Function<? super V, ? extends R> f) {
            return (TreePMap<K,R>)this.<R>__map((k, v) -> f.apply(v));
        }

        @Override
        default <R> TreePMap<K,R> mapKV(BiFunction<? super K, ? super V, ? extends R> f) {
            return (TreePMap<K,R>)this.<R>__map(f);
        }

        @Override
        default TreePMap<K,V> mapEndo(Function<? super V, ? extends V> f) {
            return (TreePMap<K,V>)__mapEndo(f);
        }

        @Override
        default <R> TreePMap<K,R> filterMap(BiFunction<? super K, ? super V, Optional<? extends R>> f) {
            Tip<K,R> t = tip().retype();
            return (TreePMap<K,R>)Bin.filterMap(t, this, f);
        }

        @Override
        default TreePMap<K,V> filter(BiPredicate<? super K, ? super V> p) {
            return (TreePMap<K,V>)Bin.<K,V,V>filterMap(tip(), this, (k, v) -> {
                if (p.test(k, v))
                    return Optional.of(v);
                return Optional.empty();
            });
        }

        @Override
        default Tuple<TreePMap<K,V>, TreePMap<K,V>> partition(BiPredicate<? super K, ? super V> p) {
            Tuple<Node<K,V>, Node<K,V>> t = Bin.partition(tip(), this, p);
            return Tuple.of((TreePMap<K,V>)t.first(), (TreePMap<K,V>)t.second());
        }

        @Override
        default boolean containsAll(TreePMap<K,V> m) {
            return this.size() >= m.size() && Bin.isSubsetOf((Node<K,V>)m, this, Objects::equals);
        }

        @Override
        default <U,R> TreePMap<K,R> merge(TreePMap<K,U> other,
                BiFunction<? super K, These<V,U>, Optional<? extends R>> f) {
            Tip<K,R> t = tip().retype();
            return (TreePMap<K,R>)Bin.mergeWithKey(t, this, (Node<K,U>)other, f);
        }

        @Override
        default TreePMap<K,V> mergeEndo(TreePMap<K,V> other,
                BiFunction<? super K, These<V,V>, Optional<? extends V>> f) {
            BooleanRef changed = new BooleanRef();
            TreePMap<K,V> result = this.<V,V>merge(other, (k, x) -> {
                Optional<? extends V> r = f.apply(k, x);
                boolean same = x.hasLeft()
                    ? r.isPresent() && r.get() == x.left()
                    : !r.isPresent();
                if (!same)
                    changed.set(true);
                return r;
            });
            return changed.get() ? result : this;
        }

        @Override
        default TreePMap<K,V> mergeSkewed(TreePMap<K,V> other,
                TriFunction<? super K, ? super V, ? super V, ? extends V> combine) {
            return this.<V,V>merge(other, (k, x) -> {
                if (x.isBoth())
                    return Optional.of(combine.apply(k, x.left(), x.right()));
                return Optional.of(x.hasLeft() ? x.left() : x.right());
            });
        }

        @Override
        default TreePMap<K,V> union(TreePMap<K,V> other,
                TriFunction<? super K, ? super V, ? super V, Optional<? extends V>> f) {
            return this.<V,V>merge(other, (k, x) -> {
                if (x.isBoth())
                    return f.apply(k, x.left(), x.right());
                return Optional.of(x.hasLeft() ? x.left() : x.right());
            });
        }

        @Override
        default Seq<Map.Entry<K, Diff<V>>> symmetricDiff(TreePMap<K,V> other,
                BiPredicate<? super V, ? super V> equal) {
            return this.<V, Diff<V>>merge(other, (k, x) -> {
                if (x.isLeft())
                    return Optional.of(Diff.left(x.left()));
                if (x.isRight())
                    return Optional.of(Diff.right(x.right()));
                V v1 = x.left(), v2 = x.right();
                if (equal.test(v1, v2))
                    return Optional.empty();
                return Optional.of(Diff.unequal(v1, v2));
            }).entries();
        }

        @Override
        default boolean equivalent(TreePMap<K,V> other, BiPredicate<? super V, ? super V> equal) {
            return size() == other.size() && Bin.isSubsetOf(this, (Node<K,V>)other, equal);
        }

        @Override
        default int compare(TreePMap<K,V> other, Comparator<? super V> valueComparator) {
            Comparator<? super K> kc = comparator();
            Iterator<Map.Entry<K,V>> i1 = iterator(), i2 = other.iterator();
            while (i1.hasNext() && i2.hasNext()) {
                Map.Entry<K,V> e1 = i1.next(), e2 = i2.next();
                int c = kc.compare(e1.getKey(), e2.getKey());
                if (c == 0)
                    c = valueComparator.compare(e1.getValue(), e2.getValue());
                if (c != 0)
                    return c;
            }
            return Boolean.compare(i1.hasNext(), i2.hasNext());
        }

        @Override
        default boolean anyMatch(BiPredicate<? super K, ? super V> p) {
            return Bin.anyMatch(this, p);
        }

        @Override
        default boolean allMatch(BiPredicate<? super K, ? super V> p) {
            return !Bin.anyMatch(this, (k, v) -> !p.test(k, v));
        }

        @Override
        default <R> R foldLeft(R z, BiFunction<R, ? super V, R> f) {
            return Bin.foldLeft(this, z, (r, k, v) -> f.apply(r, v));
        }

        @Override
        default <R> R foldLeftKV(R z, TriFunction<R, ? super K, ? super V, R> f) {
            return Bin.foldLeft(this, z, f);
        }

        @Override
        default Seq<K> keys() {
            return Bin.<K, V, Seq<K>>foldRight(this, Seq.nil(), (k, v, ks) -> Seq.cons(k, ks));
        }

        @Override
        default Seq<V> values() {
            return Bin.<K, V, Seq<V>>foldRight(this, Seq.nil(), (k, v, vs) -> Seq.cons(v, vs));
        }

        @Override
        default Seq<Map.Entry<K,V>> entries() {
            return Bin.<K, V, Seq<Map.Entry<K,V>>>foldRight(this, Seq.nil(),
                (k, v, es) -> Seq.cons(Maps.immutableEntry(k, v), es));
        }

        @Override
        default Iterator<Map.Entry<K,V>> iterator() {
            return new EntryIterator<>(this);
        }

        @Override
        default SortedMap<K,V> asJavaMap() {
            ImmutableSortedMap.Builder<K,V> builder = new ImmutableSortedMap.Builder<>(comparator());
            forEach((k, v) -> builder.put(k, v));
            return builder.build();
        }

        @Override
        default String showTree() {
            return showTree((k, v) -> "(" + k + "," + v + ")");
        }

        @Override
        default String showTree(BiFunction<? super K, ? super V, String> showelem) {
            return Bin.showTree(this, showelem, Seq.nil());
        }
    }

    static class MapTip<K,V> extends Tip<K,V> implements MapNode<K,V> {
        MapTip(Comparator<? super K> cmp) {
            super(cmp);
        }

        @Override
        Node<K,V> cons(int sz, K k, V v, Node<K,V> l, Node<K,V> r) {
            return new MapBin<>(this, sz, k, v, l, r);
        }

        @SuppressWarnings("rawtypes")
        public boolean equals(Object obj) {
            return (obj instanceof TreePMap) && ((TreePMap)obj).isEmpty();
        }

        public int hashCode() {
            return 0;
        }

        public String toString() {
            return "[]";
        }
    }

    static class MapBin<K,V> extends Bin<K,V> implements MapNode<K,V> {
        MapBin(Tip<K,V> tip, int size, K key, V value, Node<K,V> left, Node<K,V> right) {
            super(tip, size, key, value, left, right);
        }

        @SuppressWarnings("unchecked")
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof TreePMap))
                return false;

            TreePMap<K,V> other = (TreePMap<K,V>)obj;
            if (size() != other.size())
                return false;

            // keys of another type or order are looked up one by one
            try {
                if (comparator().equals(other.comparator()))
                    return containsAll(other);
                return other.allMatch((k, v) -> v.equals(__lookup(k)));
            } catch (ClassCastException ex) {
                return false;
            }
        }

        public int hashCode() {
            return foldLeftKV(0, (h, k, v) -> h + (k.hashCode() ^ v.hashCode()));
        }

        public String toString() {
            return MapPrinter.show(this, String::valueOf, String::valueOf);
        }
    }
}
