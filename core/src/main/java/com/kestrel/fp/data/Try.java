/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.base.Throwables;
import com.google.common.util.concurrent.UncheckedExecutionException;

import com.kestrel.fp.$;
import com.kestrel.fp.control.Monad;

/**
 * The result of a computation that either produced a value or failed with
 * an exception.
 *
 * @param <A> the type of the successful value
 */
public abstract class Try<A> implements $<Try.µ, A>, Foldable<A> {
    private Try() {}

    private static final class Success<A> extends Try<A> {
        private final A value;

        Success(A value) {
            this.value = value;
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public A get() {
            return value;
        }

        @Override
        public Throwable getCause() {
            throw new NoSuchElementException("Try.getCause() on a successful result");
        }

        @Override
        public String toString() {
            return "Success(" + value + ")";
        }
    }

    private static final class Failure<A> extends Try<A> {
        private final Throwable cause;

        Failure(Throwable cause) {
            this.cause = cause;
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public A get() {
            Throwables.throwIfUnchecked(cause);
            throw new UncheckedExecutionException(cause);
        }

        @Override
        public Throwable getCause() {
            return cause;
        }

        @Override
        public String toString() {
            return "Failure(" + cause + ")";
        }
    }

    /**
     * Construct a successful result.
     */
    public static <A> Try<A> success(A value) {
        return new Success<>(value);
    }

    /**
     * Construct a failed result. Wrapping {@code CompletionException} and
     * {@code ExecutionException} are removed so the original cause is kept.
     */
    public static <A> Try<A> failure(Throwable cause) {
        return new Failure<>(unwrap(Objects.requireNonNull(cause)));
    }

    /**
     * Run the given computation, capturing either its result or the
     * exception it throws.
     */
    public static <A> Try<A> of(Callable<? extends A> computation) {
        try {
            return success(computation.call());
        } catch (Exception ex) {
            return failure(ex);
        }
    }

    /**
     * Strip the wrappers that asynchronous computations put around a failure.
     */
    public static Throwable unwrap(Throwable ex) {
        Throwable cause = ex;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause;
    }

    /**
     * Returns {@code true} if the computation succeeded.
     */
    public abstract boolean isSuccess();

    /**
     * Returns {@code true} if the computation failed.
     */
    public boolean isFailure() {
        return !isSuccess();
    }

    /**
     * Returns the successful value, or rethrows the failure. A checked failure
     * is rethrown wrapped in an {@code UncheckedExecutionException}.
     */
    public abstract A get();

    /**
     * Returns the failure cause.
     *
     * @throws NoSuchElementException if the computation succeeded
     */
    public abstract Throwable getCause();

    /**
     * Case analysis for the result.
     */
    public <R> R match(Function<? super A, ? extends R> success, Function<? super Throwable, ? extends R> failure) {
        return isSuccess() ? success.apply(get()) : failure.apply(getCause());
    }

    @SuppressWarnings("unchecked")
    public <B> Try<B> map(Function<? super A, ? extends B> f) {
        if (isFailure())
            return (Try<B>)this;
        try {
            return success(f.apply(get()));
        } catch (RuntimeException ex) {
            return failure(ex);
        }
    }

    @SuppressWarnings("unchecked")
    public <B> Try<B> flatMap(Function<? super A, ? extends $<µ, B>> f) {
        if (isFailure())
            return (Try<B>)this;
        try {
            return narrow(f.apply(get()));
        } catch (RuntimeException ex) {
            return failure(ex);
        }
    }

    /**
     * Turn a failure into a successful value computed from the cause.
     */
    public Try<A> recover(Function<? super Throwable, ? extends A> f) {
        return isSuccess() ? this : of(() -> f.apply(getCause()));
    }

    /**
     * Returns the value as a {@code Maybe}, discarding a failure. A
     * {@code null} value becomes an empty {@code Maybe}.
     */
    public Maybe<A> toMaybe() {
        return isSuccess() ? Maybe.ofNullable(get()) : Maybe.empty();
    }

    /**
     * Returns the value as a right, or the failure cause as a left.
     */
    public Either<Throwable, A> toEither() {
        return isSuccess() ? Either.right(get()) : Either.left(getCause());
    }

    @Override
    public <R> R foldRight(BiFunction<? super A, Supplier<R>, R> f, Supplier<R> r) {
        return isSuccess() ? f.apply(get(), r) : r.get();
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Try))
            return false;
        Try<?> other = (Try<?>)obj;
        if (isSuccess() != other.isSuccess())
            return false;
        return isSuccess() ? Objects.equals(get(), other.get())
                           : Objects.equals(getCause(), other.getCause());
    }

    @Override
    public int hashCode() {
        return isSuccess() ? Objects.hashCode(get()) : 31 * getCause().hashCode();
    }

    // Type Classes

    public static final class µ implements Monad<µ> {
        @Override
        public <A> Try<A> pure(A a) {
            return success(a);
        }

        @Override
        public <A> Try<A> fail(String msg) {
            return failure(new IllegalStateException(msg));
        }

        @Override
        public <A, B> Try<B> map($<µ, A> a, Function<? super A, ? extends B> f) {
            return narrow(a).map(f);
        }

        @Override
        public <A, B> Try<B> bind($<µ, A> a, Function<? super A, ? extends $<µ, B>> k) {
            return narrow(a).flatMap(k);
        }
    }

    public static <A> Try<A> narrow($<µ, A> value) {
        return (Try<A>)value;
    }

    public static final µ tclass = new µ();

    @Override
    public µ getTypeClass() {
        return tclass;
    }
}
