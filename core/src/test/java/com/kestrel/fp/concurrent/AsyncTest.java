/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.concurrent;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import com.google.common.util.concurrent.UncheckedExecutionException;
import org.junit.After;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.kestrel.fp.data.Maybe;
import com.kestrel.fp.data.Seq;

public class AsyncTest
{
    private final ExecutorService executor = Executors.newFixedThreadPool(2);

    @After
    public void shutdown() throws InterruptedException {
        executor.shutdown();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }

    @Test
    public void supplyAndMap() {
        Async<Integer> a = Async.supply(() -> 20, executor).map(x -> x + 1).map(x -> x * 2);
        assertEquals(42, (int)a.join());
    }

    @Test
    public void bindTest() {
        Async<String> a = Async.pure(2).bind(x -> Async.supply(() -> "n=" + x, executor));
        assertEquals("n=2", a.join());

        Async<Integer> b = Async.pure(3).mapAsync(x -> CompletableFuture.completedFuture(x * 3));
        assertEquals(9, (int)b.join());
    }

    @Test(expected = IllegalStateException.class)
    public void joinRethrowsUncheckedCause() {
        Async.failed(new IllegalStateException("boom")).join();
    }

    @Test
    public void joinWrapsCheckedCause() {
        try {
            Async.failed(new IOException("disk")).map(x -> x).join();
            fail("UncheckedExecutionException was not thrown");
        } catch (UncheckedExecutionException ex) {
            assertThat(ex.getCause(), instanceOf(IOException.class));
        }
    }

    @Test
    public void apCombinesResults() {
        CompletableFuture<Integer> left = new CompletableFuture<>();
        Async<Integer> sum = Async.narrow(Async.tclass.ap2(Integer::sum, Async.of(left), Async.pure(2)));
        assertEquals("Async(pending)", sum.toString());

        left.complete(40);
        assertEquals(42, (int)sum.join());
        assertEquals("Async(42)", sum.toString());
    }

    @Test
    public void apFailsIfEitherSideFails() {
        Async<Integer> sum = Async.narrow(Async.tclass.ap2(Integer::sum, Async.pure(1), Async.<Integer>failed(new IllegalStateException())));
        assertTrue(sum.toFuture().isCompletedExceptionally());
        assertEquals("Async(failed)", sum.toString());
    }

    @Test
    public void sequenceSeq() {
        Seq<Async<Integer>> xs = Seq.of(Async.supply(() -> 1, executor), Async.supply(() -> 2, executor), Async.pure(3));
        assertEquals(Seq.of(1, 2, 3), Async.sequence(xs).join());
        assertEquals(Seq.nil(), Async.sequence(Seq.<Async<Integer>>nil()).join());
    }

    @Test
    public void sequenceLongList() {
        int n = 100_000;
        CompletableFuture<Integer> gate = new CompletableFuture<>();
        Async<Integer> pending = Async.of(gate);
        Async<Seq<Integer>> all = Async.sequence(Seq.replicate(n, pending));
        assertFalse(all.toFuture().isDone());

        gate.complete(1);
        Seq<Integer> values = all.join();
        assertEquals(n, values.count());
        assertEquals(n, (long)values.foldLeft(0L, (r, x) -> r + x));
    }

    @Test
    public void sequenceMaybe() {
        assertEquals(Maybe.of(5), Async.sequence(Maybe.of(Async.pure(5))).join());
        assertEquals(Maybe.empty(), Async.sequence(Maybe.<Async<Integer>>empty()).join());
    }

    @Test
    public void monadFailIsFailedComputation() {
        Async<Integer> a = Async.tclass.fail("no");
        assertTrue(a.toFuture().isCompletedExceptionally());
    }

    @Test
    public void defaultExecutorRunsComputation() {
        assertEquals("done", Async.supply(() -> "done").join());
    }
}
