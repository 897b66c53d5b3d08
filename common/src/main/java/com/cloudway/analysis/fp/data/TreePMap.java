/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Comparator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.SortedMap;
import java.util.function.BiConsumer;
import java.util.function.BiFunction;
import java.util.function.BiPredicate;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;

import com.cloudway.analysis.fp.function.TriFunction;

/**
 * <p>An immutable, persistent map from totally ordered keys to values.</p>
 *
 * <p>The implementation of map is based on size balanced binary trees (or trees
 * of bounded balance) as described by:</p>
 *
 * <ul>
 * <li>Stephen Adams, <a href="http://www.swiss.ai.mit.edu/~adams/BB/">
 *     "Efficient sets: a balancing act"</a>, Journal of Functional Programming
 *     3(4):553-562, October 1993,</li>
 * <li>J. Nievergelt and E.M. Reingold, "Binary search trees of bounded balance",
 *     SIAM journal of computing 2(1), March 1973.</li>
 * </ul>
 *
 * <p>Every operation that looks like a modification returns a new map and
 * leaves the original unchanged. Subtrees that are not touched by an operation
 * are shared between the old and the new map, and an operation that has no
 * effect returns the original map itself.</p>
 *
 * <p>Keys and values must not be {@code null}. Operations over two maps assume
 * both maps are ordered by the same comparator.</p>
 *
 * @param <K> the type of keys maintained by this map
 * @param <V> the type of mapped values
 */
public interface TreePMap<K, V> extends Iterable<Map.Entry<K, V>> {
    // Construction

    /**
     * Construct an empty map, sorted according to the natural ordering
     * of its elements.
     */
    @SuppressWarnings("unchecked")
    static <K extends Comparable<K>, V> TreePMap<K, V> empty() {
        return Tree.EMPTY_MAP;
    }

    /**
     * Construct an empty map, sorted according to the specified comparator.
     *
     * @param c the comparator that will be used to order this map
     * @throws NullPointerException if {@code c} is null
     */
    static <K, V> TreePMap<K, V> empty(Comparator<? super K> c) {
        Objects.requireNonNull(c);
        return new Tree.MapTip<>(c);
    }

    /**
     * Construct a map with a single element, sorted according to the natural
     * ordering of its elements.
     */
    static <K extends Comparable<K>, V> TreePMap<K, V> singleton(K key, V value) {
        return TreePMap.<K,V>empty().put(key, value);
    }

    /**
     * Construct a map with a single element, sorted according to the specified
     * comparator.
     *
     * @param c the comparator that will be used to order this map
     * @throws NullPointerException if {@code c} is null
     */
    static <K, V> TreePMap<K, V> singleton(Comparator<? super K> c, K key, V value) {
        return TreePMap.<K,V>empty(c).put(key, value);
    }

    /**
     * Construct a map from the given entries, sorted according to the natural
     * ordering of keys. Later entries replace earlier entries with the same key.
     */
    static <K extends Comparable<K>, V> TreePMap<K, V>
    fromEntries(Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        return fromEntries(TreePMap.<K,V>empty(), entries);
    }

    /**
     * Construct a map from the given entries, sorted according to the specified
     * comparator. Later entries replace earlier entries with the same key.
     */
    static <K, V> TreePMap<K, V>
    fromEntries(Comparator<? super K> c, Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        return fromEntries(TreePMap.<K,V>empty(c), entries);
    }

    static <K, V> TreePMap<K, V>
    fromEntries(TreePMap<K, V> m, Iterable<? extends Map.Entry<? extends K, ? extends V>> entries) {
        for (Map.Entry<? extends K, ? extends V> e : entries) {
            m = m.put(e.getKey(), e.getValue());
        }
        return m;
    }

    // Multi-maps

    /**
     * Adds a value to the list of values bound to the key. The new value is
     * placed in front of the values already bound to the key.
     *
     * @param m the multi-map
     * @param key the key
     * @param value the value to add
     * @return the map that contains new mappings, the original map is unchanged
     */
    static <K, V> TreePMap<K, Seq<V>> addMulti(TreePMap<K, Seq<V>> m, K key, V value) {
        Objects.requireNonNull(value);
        return m.update(key, vs -> Seq.cons(value, vs.orElse(Seq.nil())));
    }

    /**
     * Returns the list of values bound to the key, or an empty list if the
     * key is absent.
     */
    static <K, V> Seq<V> findMulti(TreePMap<K, Seq<V>> m, K key) {
        return m.getOrDefault(key, Seq.nil());
    }

    // Query Operations

    /**
     * Returns {@code true} if this map contains no key-value mappings.
     *
     * @return {@code true} if this map contains no key-value mappings
     */
    boolean isEmpty();

    /**
     * Returns the number of key-value mappings in this map.
     *
     * @return the number of key-value mappings in this map
     */
    int size();

    /**
     * Returns the comparator used to order the keys in this map.
     */
    Comparator<? super K> comparator();

    /**
     * Returns {@code true} if this map contains a mapping for the specified
     * key.
     *
     * @param key key whose presence in this map is to be tested
     * @return {@code true} if this map contains a mapping for the specified key
     */
    boolean containsKey(K key);

    /**
     * Lookup the value to which the specified key is mapped.  Returns
     * {@code Optional.empty()} if this map contains no mapping for the key.
     *
     * @param key the key whose associated value is to be returned
     * @return the value to which the specified key is mapped, or
     *         {@code Optional.empty()} if this map contains no mapping
     *         for the key
     */
    Optional<V> lookup(K key);

    /**
     * Returns the value to which the specified key is mapped. The caller
     * asserts that the key is present; if this map contains no mapping for
     * the key, a NoSuchElementException is thrown.
     *
     * @param key the key whose associated value is to returned
     * @return the value to which specified key is mapped
     * @throws NoSuchElementException if this map contains no mapping for the key
     */
    V get(K key);

    /**
     * Returns the value to which the specified key is mapped, or default value
     * if this map contains no mapping for the key.
     *
     * @param key the key whose associated value is to be returned
     * @param def the default mapping of the key
     */
    V getOrDefault(K key, V def);

    // Modification Operations

    /**
     * Insert a new key and value in the map. If the key is already present
     * in the map, the associated value is replaced with the supplied value.
     *
     * @param key key with which the specified value is to be associated
     * @param value value to be associated with the specified key
     * @return the map that contains new mappings, the original map is unchanged
     */
    TreePMap<K, V> put(K key, V value);

    /**
     * Insert a key that is expected to be fresh. Behaves exactly as
     * {@link #put(Object,Object) put}: an existing binding is replaced.
     *
     * @param key key with which the specified value is to be associated
     * @param value value to be associated with the specified key
     * @return the map that contains new mappings, the original map is unchanged
     */
    default TreePMap<K, V> add(K key, V value) {
        return put(key, value);
    }

    /**
     * Removes the mapping for a key from this map if it is present. Returns
     * this map itself if the key is absent.
     *
     * @param key key with which the specified value is associated
     * @return the map that contains new mappings, the original map is unchanged
     */
    TreePMap<K, V> remove(K key);

    /**
     * Changes the binding of a key. The function receives the current value
     * of the key, if any. If the function returns {@code Optional.empty()} the
     * binding is removed, otherwise the key is bound to the returned value.
     *
     * @param key key with which the specified value is associated
     * @param f the function to compute the new value
     * @return the map that contains new mappings, the original map is unchanged
     */
    TreePMap<K, V> change(K key, Function<Optional<V>, Optional<? extends V>> f);

    /**
     * Binds a key to the value computed from its current value, if any.
     *
     * @param key key with which the specified value is associated
     * @param f the function to compute the new value
     * @return the map that contains new mappings, the original map is unchanged
     */
    default TreePMap<K, V> update(K key, Function<Optional<V>, ? extends V> f) {
        return change(key, v -> Optional.of(f.apply(v)));
    }

    /**
     * Removes a key and returns its value together with the map without the
     * key, or an empty {@code Optional} if the key is absent.
     */
    Optional<Tuple<V, TreePMap<K, V>>> findAndRemove(K key);

    /**
     * Splits this map by a key. Returns a triple of the map of keys less than
     * the given key, the value bound to the key, if any, and the map of keys
     * greater than the given key.
     */
    Triple<TreePMap<K, V>, Optional<V>, TreePMap<K, V>> split(K key);

    // Introspection

    /**
     * Returns an arbitrary key of this map. The key is taken from the root of
     * the tree, so the choice is deterministic for a given tree shape.
     */
    Optional<K> chooseKey();

    /**
     * Returns an arbitrary binding of this map, the same binding whose key
     * is returned by {@link #chooseKey()}.
     */
    Optional<Map.Entry<K, V>> choose();

    /**
     * Returns an arbitrary binding of this map.
     *
     * @throws NoSuchElementException if this map is empty
     */
    default Map.Entry<K, V> chooseExn() {
        return choose().orElseThrow(() -> new NoSuchElementException("empty map"));
    }

    /**
     * Removes an arbitrary binding from this map. Returns the key and value
     * of the binding, and the map without the binding.
     */
    Optional<Triple<K, V, TreePMap<K, V>>> pop();

    /**
     * Returns the binding with the least key.
     */
    Optional<Map.Entry<K, V>> minBinding();

    /**
     * Returns the binding with the greatest key.
     */
    Optional<Map.Entry<K, V>> maxBinding();

    /**
     * Removes the binding with the least key. Returns the key and value of
     * the binding, and the map without the binding.
     */
    Optional<Triple<K, V, TreePMap<K, V>>> popMinBinding();

    /**
     * Returns the binding of this map if the map has exactly one binding.
     */
    Optional<Map.Entry<K, V>> onlyBinding();

    /**
     * Classifies this map as having zero, one or many bindings.
     */
    Cardinality<K, V> classify();

    /**
     * Returns {@code true} if this map has exactly one binding.
     */
    default boolean isSingleton() {
        return onlyBinding().isPresent();
    }

    /**
     * Returns the binding with the least key satisfying the predicate. The
     * search stops at the first match in key order.
     */
    Optional<Map.Entry<K, V>> findFirst(Predicate<? super K> predicate);

    // Bulk Operations

    /**
     * Applies a function to all values of this map.
     */
    <R> TreePMap<K, R> map(Function<? super V, ? extends R> f);

    /**
     * Applies a function to all keys and values of this map.
     */
    <R> TreePMap<K, R> mapKV(BiFunction<? super K, ? super V, ? extends R> f);

    /**
     * Applies a function to all values of this map. If the function returns
     * its argument for every value, this map itself is returned. Values are
     * compared by reference, not by {@code equals}.
     */
    TreePMap<K, V> mapEndo(Function<? super V, ? extends V> f);

    /**
     * Applies a function to all keys and values of this map, keeping the
     * bindings for which the function returns a value.
     */
    <R> TreePMap<K, R> filterMap(BiFunction<? super K, ? super V, Optional<? extends R>> f);

    /**
     * Returns a map consisting of the mappings of this map that matches
     * the given predicate.
     */
    TreePMap<K, V> filter(BiPredicate<? super K, ? super V> predicate);

    /**
     * Partitions this map into the map of bindings that satisfy the predicate
     * and the map of bindings that do not. The predicate is evaluated
     * exactly once for each binding.
     */
    Tuple<TreePMap<K, V>, TreePMap<K, V>> partition(BiPredicate<? super K, ? super V> predicate);

    /**
     * Unions all of the mappings from the specified map to this map. Mappings
     * from the specified map replace mappings of this map with the same key.
     *
     * @param m mappings to be union in this map
     * @return the union of two maps
     */
    default TreePMap<K, V> putAll(TreePMap<K, V> m) {
        return mergeSkewed(m, (k, x, y) -> y);
    }

    /**
     * Returns {@code true} if every mapping of the given map is also a mapping
     * of this map.
     */
    boolean containsAll(TreePMap<K, V> m);

    // Two-map algebra

    /**
     * Merges two maps. The function is called in key order for each key that
     * is present in either map, with a {@link These} describing the values of
     * the key in this map and the other map. The key is kept with the returned
     * value, or dropped if the function returns {@code Optional.empty()}.
     *
     * @param other the map to merge with
     * @param f the merge function
     * @return the merged map
     */
    <U, R> TreePMap<K, R> merge(TreePMap<K, U> other,
            BiFunction<? super K, These<V, U>, Optional<? extends R>> f);

    /**
     * Merges two maps like {@link #merge(TreePMap,BiFunction) merge}, but
     * returns this map itself if the merge made no change: for every key
     * present in this map the function returned the identical object it
     * received from this map, and for every key present only in the other
     * map it returned nothing. A key of the other map that is dropped leaves
     * this map as it was, so it does not count as a change.
     *
     * @param other the map to merge with
     * @param f the merge function
     * @return the merged map, or this map if nothing changed
     */
    TreePMap<K, V> mergeEndo(TreePMap<K, V> other,
            BiFunction<? super K, These<V, V>, Optional<? extends V>> f);

    /**
     * Unions two maps. Keys present in only one map carry through unchanged,
     * values of keys present in both maps are combined by the given function.
     */
    TreePMap<K, V> mergeSkewed(TreePMap<K, V> other,
            TriFunction<? super K, ? super V, ? super V, ? extends V> combine);

    /**
     * Unions two maps. Keys present in only one map carry through unchanged.
     * For keys present in both maps the function decides the value, or drops
     * the key by returning {@code Optional.empty()}.
     */
    TreePMap<K, V> union(TreePMap<K, V> other,
            TriFunction<? super K, ? super V, ? super V, Optional<? extends V>> f);

    /**
     * Computes the symmetric difference of this map and the other map, in key
     * order. Keys bound to equal values in both maps are omitted. The
     * equality is called for every key present in both maps, even when both
     * values are the same object.
     *
     * @param other the right map
     * @param equal the equality of values
     */
    Seq<Map.Entry<K, Diff<V>>> symmetricDiff(TreePMap<K, V> other, BiPredicate<? super V, ? super V> equal);

    /**
     * Computes the symmetric difference of this map and the other map, values
     * are compared by {@code equals}.
     */
    default Seq<Map.Entry<K, Diff<V>>> symmetricDiff(TreePMap<K, V> other) {
        return symmetricDiff(other, Objects::equals);
    }

    /**
     * Returns {@code true} if both maps have the same keys and the values of
     * every key are equal under the given predicate.
     */
    boolean equivalent(TreePMap<K, V> other, BiPredicate<? super V, ? super V> equal);

    /**
     * Compares two maps lexicographically by their bindings in key order.
     * Keys are compared with the comparator of this map, values with the
     * given comparator.
     */
    int compare(TreePMap<K, V> other, Comparator<? super V> valueComparator);

    // Traversal

    /**
     * Perform the given action for each entry in this map, in key order.
     *
     * @param action an action to perform on each key and value
     */
    default void forEach(BiConsumer<? super K, ? super V> action) {
        foldLeftKV(this, (z, k, v) -> { action.accept(k, v); return z; });
    }

    /**
     * Perform the given action for each value in this map, in key order.
     */
    default void forEachValue(Consumer<? super V> action) {
        foldLeft(this, (z, v) -> { action.accept(v); return z; });
    }

    /**
     * Returns whether any binding of this map satisfies the predicate.
     */
    boolean anyMatch(BiPredicate<? super K, ? super V> predicate);

    /**
     * Returns whether all bindings of this map satisfy the predicate.
     */
    boolean allMatch(BiPredicate<? super K, ? super V> predicate);

    /**
     * Reduce the map elements using the accumulator function that accept
     * element value, in key order.
     */
    <R> R foldLeft(R seed, BiFunction<R, ? super V, R> accumulator);

    /**
     * Reduce the map elements using the accumulator function that accept
     * element key and value, in key order.
     */
    <R> R foldLeftKV(R seed, TriFunction<R, ? super K, ? super V, R> accumulator);

    // Views

    /**
     * Returns a list of the keys contained in this map, in key order.
     */
    Seq<K> keys();

    /**
     * Returns a list of the values contained in this map, in key order.
     */
    Seq<V> values();

    /**
     * Returns a list of the mappings contained in this map, in key order.
     */
    Seq<Map.Entry<K, V>> entries();

    /**
     * Copies this map into an immutable {@link SortedMap} that uses the
     * same comparator.
     */
    SortedMap<K, V> asJavaMap();

    // Debugging

    /**
     * Show the tree that implements the map. This method is used for debugging
     * purposes only.
     */
    String showTree();

    /**
     * Shows the tree that implements the map. Elements are shown using the
     * {@code showElem} function. This method is used for debugging purposes only.
     */
    String showTree(BiFunction<? super K, ? super V, String> showElem);

    /**
     * Test if the internal map structure is valid.
     */
    boolean valid();
}
