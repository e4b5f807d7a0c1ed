/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

public class MaybeTest
{
    @Test
    public void emptyTest() {
        Maybe<String> m = Maybe.empty();
        assertFalse(m.isPresent());
        assertTrue(m.isAbsent());
        assertEquals("default", m.orElse("default"));
        assertEquals("computed", m.orElseGet(() -> "computed"));
        assertSame(Maybe.empty(), Maybe.ofNullable(null));
    }

    @Test(expected = NoSuchElementException.class)
    public void getOnEmptyThrows() {
        Maybe.empty().get();
    }

    @Test(expected = NullPointerException.class)
    public void ofNullThrows() {
        Maybe.of(null);
    }

    @Test
    public void mapTest() {
        assertEquals(Maybe.of(4), Maybe.of(2).map(x -> x * 2));
        assertEquals(Maybe.empty(), Maybe.<Integer>empty().map(x -> x * 2));
        assertEquals(Maybe.empty(), Maybe.of(2).map(x -> null));
    }

    @Test
    public void flatMapAndFilterTest() {
        assertEquals(Maybe.of(3), Maybe.of(6).flatMap(x -> x % 2 == 0 ? Maybe.of(x / 2) : Maybe.<Integer>empty()));
        assertEquals(Maybe.empty(), Maybe.of(3).flatMap(x -> x % 2 == 0 ? Maybe.of(x / 2) : Maybe.<Integer>empty()));
        assertEquals(Maybe.of(6), Maybe.of(6).filter(x -> x > 5));
        assertEquals(Maybe.empty(), Maybe.of(4).filter(x -> x > 5));
    }

    @Test
    public void matchTest() {
        assertEquals("some 1", Maybe.of(1).match(x -> "some " + x, () -> "none"));
        assertEquals("none", Maybe.<Integer>empty().match(x -> "some " + x, () -> "none"));
    }

    @Test
    public void orIsLazy() {
        AtomicInteger calls = new AtomicInteger();
        assertEquals(Maybe.of(1), Maybe.of(1).or(() -> {
            calls.incrementAndGet();
            return Maybe.of(2);
        }));
        assertEquals(0, calls.get());
        assertEquals(Maybe.of(2), Maybe.<Integer>empty().or(() -> Maybe.of(2)));
    }

    @Test
    public void conversionTest() {
        assertEquals(Optional.of("a"), Maybe.of("a").toOptional());
        assertEquals(Maybe.of("a"), Maybe.fromOptional(Optional.of("a")));
        assertEquals(Either.right("a"), Maybe.of("a").toEither(() -> 0));
        assertEquals(Either.left(0), Maybe.<String>empty().toEither(() -> 0));
    }

    @Test
    public void foldTest() {
        assertEquals(1, Maybe.of("x").count());
        assertEquals(0, Maybe.empty().count());
        assertEquals(Seq.of("x"), Maybe.of("x").asList());
        assertEquals(5, (int)Maybe.of(2).foldLeft(3, Integer::sum));
    }

    @Test
    public void monadTest() {
        assertEquals(Maybe.of(3), Maybe.tclass.ap2(Integer::sum, Maybe.of(1), Maybe.of(2)));
        assertEquals(Maybe.empty(), Maybe.tclass.ap2(Integer::sum, Maybe.of(1), Maybe.<Integer>empty()));
        assertEquals(Maybe.of(1), Maybe.tclass.mplus(Maybe.empty(), Maybe.of(1)));
        assertEquals(Maybe.empty(), Maybe.tclass.fail("no"));
    }

    @Test
    public void flatMTest() {
        assertEquals(Maybe.of(Seq.of(1, 2)), Maybe.flatM(Seq.of(Maybe.of(1), Maybe.of(2))));
        assertEquals(Maybe.empty(), Maybe.flatM(Seq.of(Maybe.of(1), Maybe.<Integer>empty())));
    }

    @Test
    public void toStringTest() {
        assertThat(Maybe.of(1).toString(), containsString("1"));
        assertThat(Maybe.of(1), is(not(Maybe.<Integer>empty())));
    }
}
