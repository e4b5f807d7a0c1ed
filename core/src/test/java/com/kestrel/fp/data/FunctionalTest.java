/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import org.junit.Test;
import static org.junit.Assert.*;

import com.kestrel.fp.function.TriFunction;

public class FunctionalTest
{
    @Test
    public void composeAndIdentity() {
        Function<Integer, Integer> inc = x -> x + 1;
        Function<Integer, Integer> dbl = x -> x * 2;
        assertEquals(8, (int)Fn.compose(dbl, inc).apply(3));
        assertEquals(3, (int)Fn.<Integer>id().apply(3));
        assertEquals("k", Fn.<Integer, String>pure("k").apply(42));
    }

    @Test
    public void curryTest() {
        BiFunction<String, Integer, String> repeat = (s, n) -> {
            StringBuilder buf = new StringBuilder();
            for (int i = 0; i < n; i++)
                buf.append(s);
            return buf.toString();
        };
        assertEquals("ababab", Fn.curry(repeat).apply("ab").apply(3));
        assertEquals("xx", Fn.flip(repeat).apply(2, "x"));
        assertEquals("zzz", Fn.uncurry(Fn.curry(repeat)).apply("z", 3));

        TriFunction<Integer, Integer, Integer, Integer> sum3 = (a, b, c) -> a + b + c;
        assertEquals(6, (int)Fn.curry3(sum3).apply(1).apply(2).apply(3));
    }

    @Test
    public void lazyThunkIsEvaluatedOnce() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Integer> thunk = Fn.lazy(calls::incrementAndGet);
        assertEquals(0, calls.get());
        assertEquals(1, (int)thunk.get());
        assertEquals(1, (int)thunk.get());
        assertSame(thunk, Fn.lazy(thunk));
    }

    @Test
    public void lazyThunkRetriesAfterFailure() {
        AtomicInteger calls = new AtomicInteger();
        Supplier<Integer> thunk = Fn.lazy(() -> {
            if (calls.incrementAndGet() == 1)
                throw new IllegalStateException("first call fails");
            return calls.get();
        });
        try {
            thunk.get();
            fail("IllegalStateException was not thrown");
        } catch (IllegalStateException ex) {
            // expected
        }
        assertEquals(2, (int)thunk.get());
        assertEquals(2, (int)thunk.get());
    }

    @Test
    public void monoidTest() {
        assertEquals(10, (int)Monoid.intSum.concat(Seq.of(1, 2, 3, 4)));
        assertEquals("abc", Monoid.stringConcat.concat(Seq.of("a", "b", "c")));
        assertEquals(Seq.of(1, 2, 3), Monoid.<Integer>seq().concat(Seq.of(Seq.of(1), Seq.of(2, 3))));
        assertEquals(Maybe.of(1), Monoid.<Integer>first().concat(Seq.of(Maybe.empty(), Maybe.of(1), Maybe.of(2))));
        assertEquals(Maybe.of(2), Monoid.<Integer>last().concat(Seq.of(Maybe.of(1), Maybe.of(2), Maybe.empty())));
        assertTrue(Monoid.conjunction.concat(Seq.of(true, true)));
        assertFalse(Monoid.disjunction.concat(Seq.<Boolean>nil()));
    }

    @Test
    public void disjunctionShortCircuitsOnInfiniteList() {
        assertTrue(Monoid.disjunction.foldMap(Seq.iterate(1, x -> x + 1), x -> x > 100));
    }

    @Test
    public void tupleTest() {
        Tuple<Integer, String> t = Tuple.of(1, "a");
        assertEquals(Tuple.of("a", 1), t.swap());
        assertEquals("1a", t.as((x, y) -> x + y));
        assertEquals(Tuple.of(2, "A"), t.map(x -> x + 1, String::toUpperCase));
        assertEquals(Tuple.of(1, 1), t.mapSecond(String::length));
    }
}
