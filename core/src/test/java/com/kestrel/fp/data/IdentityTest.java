/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import static org.junit.Assert.*;

public class IdentityTest
{
    @Test
    public void strictTest() {
        Identity<Integer> id = Identity.of(21);
        assertFalse(id.isLazy());
        assertEquals(42, (int)id.map(x -> x * 2).get());
        assertEquals(Identity.of(22), id.bind(x -> Identity.of(x + 1)));
        assertEquals("Identity 21", id.toString());
    }

    @Test
    public void lazyIsEvaluatedOnceOnDemand() {
        AtomicInteger calls = new AtomicInteger();
        Identity<Integer> id = Identity.lazy(() -> {
            calls.incrementAndGet();
            return 7;
        });
        Identity<Integer> doubled = id.map(x -> x * 2);

        assertTrue(id.isLazy());
        assertEquals(0, calls.get());
        assertEquals(14, (int)doubled.get());
        assertEquals(7, (int)id.get());
        assertEquals(1, calls.get());
    }

    @Test
    public void monadTest() {
        assertEquals(Identity.of(3), Identity.tclass.ap2(Integer::sum, Identity.of(1), Identity.of(2)));
        assertEquals(5, (int)Identity.run(Identity.tclass.pure(5)));
        assertEquals(Identity.of(Seq.of(1, 1, 1)), Identity.tclass.replicateM(3, Identity.of(1)));
    }

    @Test
    public void foldTest() {
        assertEquals(1, Identity.of("a").count());
        assertEquals("ab", Identity.of("b").foldLeft("a", String::concat));
        assertEquals(Seq.of("a"), Identity.of("a").asList());
    }
}
