/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.cloudway.analysis.fp.data;

import java.util.Arrays;
import java.util.NoSuchElementException;

import org.junit.Test;
import static org.junit.Assert.*;

public class SeqTest {
    @Test
    public void test_nil() {
        Seq<Integer> xs = Seq.nil();
        assertTrue(xs.isEmpty());
        assertEquals(0, xs.size());
        assertFalse(xs.peek().isPresent());
        assertEquals("[]", xs.toString());
        assertSame(xs, xs.reverse());
    }

    @Test(expected = NoSuchElementException.class)
    public void test_nil_head() {
        Seq.nil().head();
    }

    @Test
    public void test_cons() {
        Seq<Integer> xs = Seq.cons(1, Seq.cons(2, Seq.nil()));
        assertEquals(Integer.valueOf(1), xs.head());
        assertEquals(Seq.of(2), xs.tail());
        assertEquals(Seq.of(1, 2), xs);
        assertEquals(Seq.of(1, 2).hashCode(), xs.hashCode());
        assertNotEquals(Seq.of(1, 2, 3), xs);
        assertNotEquals(Seq.nil(), xs);
    }

    @Test
    public void test_operations() {
        Seq<Integer> xs = Seq.of(1, 2, 3, 4);
        assertEquals(4, xs.size());
        assertEquals(Seq.of(4, 3, 2, 1), xs.reverse());
        assertEquals(Seq.of(2, 4, 6, 8), xs.map(x -> x * 2));
        assertEquals(Integer.valueOf(10), xs.foldLeft(0, Integer::sum));
        assertTrue(xs.anyMatch(x -> x == 3));
        assertFalse(xs.allMatch(x -> x < 4));
        assertEquals(Arrays.asList(1, 2, 3, 4), xs.toList());
        assertEquals(xs, Seq.fromIterable(Arrays.asList(1, 2, 3, 4)));
    }

    @Test
    public void test_show() {
        assertEquals("[1, 2, 3]", Seq.of(1, 2, 3).toString());
        assertEquals("<1|2>", Seq.of(1, 2).show("|", "<", ">"));
    }
}
