/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.concurrent;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.UncheckedExecutionException;

import com.kestrel.fp.$;
import com.kestrel.fp.control.Monad;
import com.kestrel.fp.data.Fn;
import com.kestrel.fp.data.Maybe;
import com.kestrel.fp.data.Seq;
import com.kestrel.fp.data.Try;

/**
 * A computation that completes asynchronously, wrapping a
 * {@link CompletableFuture} so it can be used wherever an {@code Applicative}
 * or {@code Monad} is expected.
 *
 * @param <A> the type of the result
 */
public final class Async<A> implements $<Async.µ, A> {
    private final CompletableFuture<A> future;

    private Async(CompletableFuture<A> future) {
        this.future = Objects.requireNonNull(future);
    }

    public static <A> Async<A> of(CompletableFuture<A> future) {
        return new Async<>(future);
    }

    /**
     * Returns an already completed computation.
     */
    public static <A> Async<A> pure(A value) {
        return new Async<>(CompletableFuture.completedFuture(value));
    }

    /**
     * Run the supplier on the given executor.
     */
    public static <A> Async<A> supply(Supplier<A> supplier, Executor executor) {
        return new Async<>(CompletableFuture.supplyAsync(supplier, executor));
    }

    /**
     * Run the supplier on the default executor.
     *
     * @see AsyncExecutors#getDefault()
     */
    public static <A> Async<A> supply(Supplier<A> supplier) {
        return supply(supplier, AsyncExecutors.getDefault());
    }

    /**
     * Returns a computation that has already failed with the given cause.
     */
    public static <A> Async<A> failed(Throwable cause) {
        CompletableFuture<A> future = new CompletableFuture<>();
        future.completeExceptionally(cause);
        return new Async<>(future);
    }

    public <B> Async<B> map(Function<? super A, ? extends B> f) {
        return new Async<>(future.thenApply(f));
    }

    public <B> Async<B> mapAsync(Function<? super A, ? extends CompletableFuture<B>> f) {
        return new Async<>(future.thenCompose(f));
    }

    public <B> Async<B> bind(Function<? super A, ? extends $<µ, B>> f) {
        return new Async<>(future.thenCompose(a -> narrow(f.apply(a)).future));
    }

    public CompletableFuture<A> toFuture() {
        return future;
    }

    /**
     * Wait for the computation to complete and return its result. A failure
     * is rethrown with the wrapping {@code CompletionException} removed;
     * checked causes are wrapped in {@code UncheckedExecutionException}.
     */
    public A join() {
        try {
            return future.join();
        } catch (CompletionException ex) {
            Throwable cause = Try.unwrap(ex);
            Throwables.throwIfUnchecked(cause);
            throw new UncheckedExecutionException(cause);
        }
    }

    @Override
    public String toString() {
        if (!future.isDone())
            return "Async(pending)";
        if (future.isCompletedExceptionally())
            return "Async(failed)";
        return "Async(" + future.getNow(null) + ")";
    }

    // Traversals

    /**
     * Turn a list of computations into a computation of the list of results.
     */
    public static <A> Async<Seq<A>> sequence(Seq<Async<A>> xs) {
        return narrow(xs.traverse(tclass, Fn.<Async<A>>id()));
    }

    /**
     * Turn an optional computation into a computation of an optional result.
     */
    public static <A> Async<Maybe<A>> sequence(Maybe<Async<A>> m) {
        return narrow(m.traverse(tclass, Fn.<Async<A>>id()));
    }

    // Type Classes

    /**
     * The {@code Async} typeclass. Sequential application runs both
     * computations concurrently and combines their results.
     */
    public static final class µ implements Monad<µ> {
        @Override
        public <A> Async<A> pure(A a) {
            return Async.pure(a);
        }

        @Override
        public <A, B> Async<B> map($<µ, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> Async<B> bind($<µ, A> a, Function<? super A, ? extends $<µ, B>> k) {
            return narrow(a).bind(k);
        }

        @Override
        public <A, B> Async<B> ap($<µ, Function<? super A, ? extends B>> fs, $<µ, A> a) {
            CompletableFuture<Function<? super A, ? extends B>> ff = narrow(fs).future;
            return new Async<>(ff.thenCombine(narrow(a).future, (f, x) -> f.apply(x)));
        }

        @Override
        public <A> Async<A> fail(String msg) {
            return failed(new IllegalStateException(msg));
        }
    }

    public static <A> Async<A> narrow($<µ, A> value) {
        return (Async<A>)value;
    }

    public static final µ tclass = new µ();

    @Override
    public µ getTypeClass() {
        return tclass;
    }
}
