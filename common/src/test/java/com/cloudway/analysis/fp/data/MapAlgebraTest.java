/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import com.google.common.collect.Maps;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class MapAlgebraTest {
    private TreePMap<Integer, Integer> m1;
    private TreePMap<Integer, Integer> m2;
    private HashMap<Integer, Integer> h1;
    private HashMap<Integer, Integer> h2;

    @Before
    public void initialize() {
        Random rnd = new Random();
        m1 = m2 = TreePMap.empty();
        h1 = new HashMap<>();
        h2 = new HashMap<>();
        for (int i = 0; i < 300; i++) {
            int k1 = rnd.nextInt(500), k2 = rnd.nextInt(500);
            m1 = m1.put(k1, i);
            h1.put(k1, i);
            m2 = m2.put(k2, -i);
            h2.put(k2, -i);
        }
    }

    private static <K, V> TreePMap<K, V> validate(TreePMap<K, V> m) {
        assertTrue(m.showTree(), m.valid());
        return m;
    }

    private static TreePMap<String, String> map(String... kvs) {
        TreePMap<String, String> m = TreePMap.empty();
        for (int i = 0; i < kvs.length; i += 2) {
            m = m.put(kvs[i], kvs[i + 1]);
        }
        return m;
    }

    @Test
    public void test_merge() {
        TreePMap<String, String> left = map("a", "1", "b", "2");
        TreePMap<String, Integer> right = TreePMap.<String, Integer>empty().put("b", 10).put("c", 20);

        List<String> calls = new ArrayList<>();
        TreePMap<String, String> merged = left.merge(right, (k, x) -> {
            calls.add(k);
            return Optional.of(x.<String>these(a -> "L" + a, b -> "R" + b, (a, b) -> a + "+" + b));
        });

        assertEquals(map("a", "L1", "b", "2+10", "c", "R20"), merged);
        assertEquals(Arrays.asList("a", "b", "c"), calls);
    }

    @Test
    public void test_merge_key_order() {
        List<Integer> calls = new ArrayList<>();
        TreePMap<Integer, Integer> merged = validate(m1.<Integer, Integer>merge(m2, (k, x) -> {
            calls.add(k);
            return Optional.of(0);
        }));

        assertEquals(merged.size(), calls.size());
        for (int i = 1; i < calls.size(); i++) {
            assertTrue(calls.get(i - 1) < calls.get(i));
        }
    }

    @Test
    public void test_merge_drop() {
        // keep only keys present in both maps
        TreePMap<Integer, Integer> both = validate(m1.<Integer, Integer>merge(m2, (k, x) ->
            x.isBoth() ? Optional.of(x.left() + x.right()) : Optional.empty()));

        HashMap<Integer, Integer> expected = new HashMap<>();
        h1.forEach((k, v) -> {
            if (h2.containsKey(k))
                expected.put(k, v + h2.get(k));
        });
        assertEquals(expected, both.asJavaMap());
    }

    @Test
    public void test_merge_with_empty() {
        TreePMap<Integer, Integer> empty = TreePMap.empty();
        assertSame(m1, m1.<Integer, Integer>merge(empty, (k, x) -> Optional.of(x.left())));
        assertTrue(empty.<Integer, Integer>merge(empty, (k, x) -> Optional.of(0)).isEmpty());
        assertEquals(m2, empty.<Integer, Integer>merge(m2, (k, x) -> Optional.of(x.right())));
    }

    @Test
    public void test_mergeEndo_identity() {
        assertSame(m1, m1.mergeEndo(m1, (k, x) -> Optional.of(x.left())));
        assertSame(m1, m1.mergeEndo(m2, (k, x) -> x.hasLeft() ? Optional.of(x.left()) : Optional.empty()));
        assertSame(m1, m1.mergeEndo(TreePMap.empty(), (k, x) -> Optional.of(x.left())));
    }

    @Test
    public void test_mergeEndo_changed() {
        TreePMap<String, String> m = map("a", "1", "b", "2");

        // equal but not identical value forces a new map
        TreePMap<String, String> m2 = m.mergeEndo(m, (k, x) ->
            Optional.of(k.equals("b") ? new String(x.left()) : x.left()));
        assertNotSame(m, m2);
        assertEquals(m, m2);

        // a key from the right map is a change
        TreePMap<String, String> m3 = m.mergeEndo(map("c", "3"), (k, x) ->
            Optional.of(x.hasLeft() ? x.left() : x.right()));
        assertNotSame(m, m3);
        assertEquals(map("a", "1", "b", "2", "c", "3"), m3);

        // dropping a key is a change
        TreePMap<String, String> m4 = m.mergeEndo(m, (k, x) ->
            k.equals("a") ? Optional.empty() : Optional.of(x.left()));
        assertEquals(map("b", "2"), m4);
    }

    @Test
    public void test_mergeSkewed() {
        TreePMap<Integer, Integer> merged = validate(m1.mergeSkewed(m2, (k, x, y) -> x * 1000 + y));

        HashMap<Integer, Integer> expected = new HashMap<>(h2);
        h1.forEach((k, v) -> expected.merge(k, v, (y, x) -> x * 1000 + y));
        assertEquals(expected, merged.asJavaMap());
    }

    @Test
    public void test_mergeSkewed_left_only_keys_shared() {
        TreePMap<String, String> m = map("a", "1", "b", "2");
        assertSame(m, m.mergeSkewed(TreePMap.empty(), (k, x, y) -> x + y));
        assertEquals(map("a", "1", "b", "2+9"), m.mergeSkewed(map("b", "9"), (k, x, y) -> x + "+" + y));
    }

    @Test
    public void test_union() {
        TreePMap<String, String> left = map("a", "1", "b", "2", "c", "3");
        TreePMap<String, String> right = map("b", "2", "c", "4", "d", "5");

        TreePMap<String, String> u = validate(left.union(right, (k, x, y) ->
            x.equals(y) ? Optional.of(x) : Optional.empty()));
        assertEquals(map("a", "1", "b", "2", "d", "5"), u);
    }

    @Test
    public void test_union_random() {
        TreePMap<Integer, Integer> u = validate(m1.union(m2, (k, x, y) -> Optional.of(Math.max(x, y))));

        HashMap<Integer, Integer> expected = new HashMap<>(h1);
        h2.forEach((k, v) -> expected.merge(k, v, Integer::max));
        assertEquals(expected, u.asJavaMap());
    }

    @Test
    public void test_putAll() {
        TreePMap<Integer, Integer> u = validate(m1.putAll(m2));
        HashMap<Integer, Integer> expected = new HashMap<>(h1);
        expected.putAll(h2);
        assertEquals(expected, u.asJavaMap());
    }

    @Test
    public void test_partition() {
        Tuple<TreePMap<Integer, Integer>, TreePMap<Integer, Integer>> p = m1.partition((k, v) -> k % 2 == 0);
        validate(p.first());
        validate(p.second());

        assertTrue(p.first().allMatch((k, v) -> k % 2 == 0));
        assertTrue(p.second().allMatch((k, v) -> k % 2 != 0));
        assertEquals(m1.size(), p.first().size() + p.second().size());
        assertEquals(m1, p.first().putAll(p.second()));
    }

    @Test
    public void test_partition_all() {
        Tuple<TreePMap<Integer, Integer>, TreePMap<Integer, Integer>> p = m1.partition((k, v) -> true);
        assertSame(m1, p.first());
        assertTrue(p.second().isEmpty());
    }

    @Test
    public void test_partition_evaluates_once() {
        // alternating answers must still put every binding in exactly one side
        int[] calls = new int[1];
        Tuple<TreePMap<Integer, Integer>, TreePMap<Integer, Integer>> p =
            m1.partition((k, v) -> calls[0]++ % 2 == 0);
        validate(p.first());
        validate(p.second());

        assertEquals(m1.size(), calls[0]);
        assertEquals(m1.size(), p.first().size() + p.second().size());
        assertTrue(p.first().allMatch((k, v) -> !p.second().containsKey(k)));
        assertEquals(m1, p.first().putAll(p.second()));
    }

    @Test
    public void test_symmetricDiff_self() {
        assertTrue(m1.symmetricDiff(m1).isEmpty());
        assertTrue(m1.symmetricDiff(m1.map(x -> x)).isEmpty());
    }

    @Test
    public void test_symmetricDiff_calls_equal_on_same_values() {
        List<Integer> seen = new ArrayList<>();
        Seq<Map.Entry<Integer, Diff<Integer>>> diff = m1.symmetricDiff(m1, (x, y) -> {
            seen.add(x);
            return false;
        });
        assertEquals(m1.size(), seen.size());
        assertEquals(m1.size(), diff.size());
        assertTrue(diff.allMatch(e -> e.getValue().kind() == Diff.Kind.UNEQUAL));
    }

    @Test
    public void test_symmetricDiff_single() {
        Integer k = m1.chooseKey().get();
        Integer v = m1.get(k);

        assertEquals(Seq.of(Maps.immutableEntry(k, Diff.left(v))), m1.symmetricDiff(m1.remove(k)));
        assertEquals(Seq.of(Maps.immutableEntry(k, Diff.right(v))), m1.remove(k).symmetricDiff(m1));
        assertEquals(Seq.of(Maps.immutableEntry(k, Diff.unequal(v, v + 1))), m1.symmetricDiff(m1.put(k, v + 1)));
    }

    @Test
    public void test_symmetricDiff() {
        TreePMap<String, String> left = map("a", "1", "b", "x", "c", "3");
        TreePMap<String, String> right = map("b", "X", "c", "4", "d", "5");

        Seq<Map.Entry<String, Diff<String>>> diff = left.symmetricDiff(right);
        assertEquals(Seq.of(
            Maps.immutableEntry("a", Diff.left("1")),
            Maps.immutableEntry("b", Diff.unequal("x", "X")),
            Maps.immutableEntry("c", Diff.unequal("3", "4")),
            Maps.immutableEntry("d", Diff.right("5"))), diff);

        Seq<Map.Entry<String, Diff<String>>> relaxed = left.symmetricDiff(right, String::equalsIgnoreCase);
        assertEquals(3, relaxed.size());
        assertFalse(relaxed.anyMatch(e -> e.getKey().equals("b")));
    }

    @Test
    public void test_symmetricDiff_random() {
        Seq<Map.Entry<Integer, Diff<Integer>>> diff = m1.symmetricDiff(m2);

        Integer prev = null;
        for (Map.Entry<Integer, Diff<Integer>> e : diff) {
            Integer k = e.getKey();
            assertTrue(prev == null || prev < k);
            prev = k;

            Diff<Integer> d = e.getValue();
            switch (d.kind()) {
            case LEFT:
                assertFalse(h2.containsKey(k));
                assertEquals(h1.get(k), d.leftValue().get());
                break;
            case RIGHT:
                assertFalse(h1.containsKey(k));
                assertEquals(h2.get(k), d.rightValue().get());
                break;
            default:
                assertNotEquals(h1.get(k), h2.get(k));
                break;
            }
        }
    }
}
