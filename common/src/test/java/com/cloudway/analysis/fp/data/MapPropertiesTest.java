/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;

import com.google.common.collect.Maps;
import org.junit.Before;
import org.junit.Test;
import static org.junit.Assert.*;

public class MapPropertiesTest {
    private static final List<Map.Entry<Integer, String>> ABC = Arrays.asList(
        Maps.immutableEntry(1, "a"), Maps.immutableEntry(2, "b"), Maps.immutableEntry(3, "c"));

    private TreePMap<Integer, String> m;

    @Before
    public void initialize() {
        Random rnd = new Random();
        m = TreePMap.empty();
        for (int i = 0; i < 100; i++) {
            int k = rnd.nextInt(200);
            m = m.add(k, "v" + k);
        }
    }

    @Test
    public void remove_then_lookup() {
        for (int k = -1; k <= 200; k++) {
            assertEquals(Optional.empty(), m.remove(k).lookup(k));
        }
    }

    @Test
    public void add_then_lookup() {
        for (int k = -1; k <= 200; k++) {
            assertEquals(Optional.of("x"), m.add(k, "x").lookup(k));
        }
    }

    @Test
    public void add_is_idempotent() {
        String v = "x";
        TreePMap<Integer, String> once = m.add(42, v);
        TreePMap<Integer, String> twice = once.add(42, v);
        assertEquals(once.entries(), twice.entries());
        assertSame(once, twice);
    }

    @Test
    public void entries_in_key_order() {
        int[][] orders = {{1, 2, 3}, {3, 2, 1}, {2, 3, 1}, {2, 1, 3}};
        for (int[] order : orders) {
            TreePMap<Integer, String> t = TreePMap.empty();
            for (int i : order) {
                t = t.add(i, ABC.get(i - 1).getValue());
            }
            assertEquals(ABC, t.entries().toList());
        }
    }

    @Test
    public void classify_by_size() {
        assertEquals(Cardinality.zero(), TreePMap.<Integer, String>empty().classify());
        assertEquals(Cardinality.one(Maps.immutableEntry(1, "x")), TreePMap.singleton(1, "x").classify());
        assertEquals(Cardinality.many(), TreePMap.singleton(1, "x").add(2, "y").classify());
    }

    @Test
    public void symmetricDiff_of_fresh_key() {
        int k = 1000;
        assertTrue(m.symmetricDiff(m).isEmpty());
        assertEquals(Seq.of(Maps.immutableEntry(k, Diff.right("v"))), m.symmetricDiff(m.add(k, "v")));
        assertEquals(Seq.of(Maps.immutableEntry(k, Diff.left("v"))), m.add(k, "v").symmetricDiff(m));
    }

    @Test
    public void mergeEndo_returns_same_map() {
        assertSame(m, m.mergeEndo(m, (k, x) -> Optional.of(x.left())));
    }

    @Test
    public void findMulti_absent_key() {
        TreePMap<Integer, Seq<String>> multi = TreePMap.empty();
        assertTrue(TreePMap.findMulti(multi, 1).isEmpty());
        assertTrue(TreePMap.findMulti(TreePMap.addMulti(multi, 2, "x"), 1).isEmpty());
    }

    @Test
    public void popMinBinding_scenario() {
        TreePMap<Integer, String> t = TreePMap.<Integer, String>empty().add(1, "a").add(2, "b");
        assertEquals(Optional.of(Tuple.of(1, "a", TreePMap.singleton(2, "b"))), t.popMinBinding());
    }

    @Test
    public void onlyBinding_scenario() {
        assertEquals(Optional.of(Maps.immutableEntry(5, "z")), TreePMap.singleton(5, "z").onlyBinding());
        assertEquals(Optional.empty(), TreePMap.singleton(5, "z").add(6, "y").onlyBinding());
    }
}
