/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.control;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;

import com.kestrel.fp.$;
import com.kestrel.fp.data.Either;
import com.kestrel.fp.data.Maybe;
import com.kestrel.fp.data.Seq;
import com.kestrel.fp.data.Try;
import com.kestrel.fp.data.Unit;

/**
 * The typeclass of asynchronous optional values: containers that eventually
 * hold zero or one value.
 *
 * <p>Only {@link #none()}, {@link #some(Object)} and {@link #toFuture($)}
 * must be implemented. Every other operation is derived from the future of
 * the underlying {@link Maybe}, so all asynchronous optional containers share
 * one definition of matching, folding and conversion.
 *
 * <p>Operations that must not produce {@code null} (the safe {@code match}
 * and {@code ifNone} families) complete their result exceptionally with a
 * {@code NullPointerException} instead. The {@code Unsafe} variants let
 * {@code null} through.
 *
 * @param <M> the typeclass of the container
 */
public interface OptionalAsync<M> {
    /**
     * Returns a container in the None state.
     */
    <A> $<M, A> none();

    /**
     * Returns a container in the Some state.
     *
     * @throws NullPointerException if the value is null
     */
    <A> $<M, A> some(A a);

    /**
     * Returns the future of the underlying optional value.
     */
    <A> CompletableFuture<Maybe<A>> toFuture($<M, A> ma);

    // Queries

    default <A> CompletableFuture<Boolean> isSome($<M, A> ma) {
        return toFuture(ma).thenApply(Maybe::isPresent);
    }

    default <A> CompletableFuture<Boolean> isNone($<M, A> ma) {
        return toFuture(ma).thenApply(Maybe::isAbsent);
    }

    // Matching

    /**
     * Case analysis. A {@code null} result from either arm completes the
     * returned future with a {@code NullPointerException}.
     */
    default <A, B> CompletableFuture<B>
    match($<M, A> ma, Function<? super A, ? extends B> some, Supplier<? extends B> none) {
        return matchUnsafe(ma, some, none).thenApply(b -> Objects.requireNonNull(b, "match returned null"));
    }

    /**
     * Case analysis with asynchronous arms. A {@code null} result from
     * either arm completes the returned future with a
     * {@code NullPointerException}.
     */
    default <A, B> CompletableFuture<B>
    matchAsync($<M, A> ma,
               Function<? super A, ? extends CompletableFuture<B>> some,
               Supplier<? extends CompletableFuture<B>> none) {
        return matchUnsafeAsync(ma, some, none).thenApply(b -> Objects.requireNonNull(b, "match returned null"));
    }

    /**
     * Case analysis that allows {@code null} results.
     */
    default <A, B> CompletableFuture<B>
    matchUnsafe($<M, A> ma, Function<? super A, ? extends B> some, Supplier<? extends B> none) {
        return toFuture(ma).thenApply(m -> m.isPresent() ? some.apply(m.get()) : none.get());
    }

    /**
     * Case analysis with asynchronous arms that allows {@code null} results.
     */
    default <A, B> CompletableFuture<B>
    matchUnsafeAsync($<M, A> ma,
                     Function<? super A, ? extends CompletableFuture<B>> some,
                     Supplier<? extends CompletableFuture<B>> none) {
        return toFuture(ma).thenCompose(m -> m.isPresent() ? some.apply(m.get()) : none.get());
    }

    /**
     * Case analysis for side effects.
     */
    default <A> CompletableFuture<Unit> match_($<M, A> ma, Consumer<? super A> some, Runnable none) {
        return toFuture(ma).thenApply(m -> m.isPresent() ? Effects.run(some, m.get()) : Effects.run(none));
    }

    // Side effects

    /**
     * Invoke the action with the bound value, if any.
     */
    default <A> CompletableFuture<Unit> ifSome($<M, A> ma, Consumer<? super A> f) {
        return match_(ma, f, () -> {});
    }

    /**
     * Invoke the asynchronous action with the bound value, if any, and wait
     * for the action to complete.
     */
    default <A> CompletableFuture<Unit>
    ifSomeAsync($<M, A> ma, Function<? super A, ? extends CompletableFuture<?>> f) {
        return toFuture(ma).thenCompose(m -> m.isPresent()
            ? f.apply(m.get()).thenApply(x -> Unit.U)
            : CompletableFuture.completedFuture(Unit.U));
    }

    /**
     * Returns the bound value, or the result of the supplier if in the None
     * state. A {@code null} result completes the future with a
     * {@code NullPointerException}.
     */
    default <A> CompletableFuture<A> ifNone($<M, A> ma, Supplier<? extends A> none) {
        return match(ma, Function.<A>identity(), none);
    }

    /**
     * Returns the bound value, or the asynchronous result of the supplier if
     * in the None state.
     */
    default <A> CompletableFuture<A> ifNoneAsync($<M, A> ma, Supplier<? extends CompletableFuture<A>> none) {
        return matchAsync(ma, CompletableFuture::completedFuture, none);
    }

    /**
     * Returns the bound value, or the result of the supplier if in the None
     * state. The supplier may return {@code null}.
     */
    default <A> CompletableFuture<A> ifNoneUnsafe($<M, A> ma, Supplier<? extends A> none) {
        return matchUnsafe(ma, Function.<A>identity(), none);
    }

    default <A> CompletableFuture<Unit> iter($<M, A> ma, Consumer<? super A> f) {
        return ifSome(ma, f);
    }

    default <A> CompletableFuture<Unit> biIter($<M, A> ma, Consumer<? super A> some, Runnable none) {
        return match_(ma, some, none);
    }

    // Folds

    /**
     * Fold the zero or one bound values from left to right.
     */
    default <A, S> CompletableFuture<S> fold($<M, A> ma, S state, BiFunction<S, ? super A, S> folder) {
        return toFuture(ma).thenApply(m -> m.isPresent() ? folder.apply(state, m.get()) : state);
    }

    default <A, S> CompletableFuture<S>
    foldAsync($<M, A> ma, S state, BiFunction<S, ? super A, ? extends CompletableFuture<S>> folder) {
        return toFuture(ma).thenCompose(m -> m.isPresent()
            ? folder.apply(state, m.get())
            : CompletableFuture.completedFuture(state));
    }

    /**
     * Fold the zero or one bound values from right to left. For an optional
     * value this is the same as {@link #fold}.
     */
    default <A, S> CompletableFuture<S> foldBack($<M, A> ma, S state, BiFunction<S, ? super A, S> folder) {
        return fold(ma, state, folder);
    }

    default <A, S> CompletableFuture<S>
    biFold($<M, A> ma, S state, BiFunction<S, ? super A, S> some, Function<S, S> none) {
        return toFuture(ma).thenApply(m -> m.isPresent() ? some.apply(state, m.get()) : none.apply(state));
    }

    /**
     * Returns 1 in the Some state, 0 otherwise.
     */
    default <A> CompletableFuture<Integer> count($<M, A> ma) {
        return toFuture(ma).thenApply(m -> m.isPresent() ? 1 : 0);
    }

    /**
     * True in the None state, otherwise the result of the predicate.
     */
    default <A> CompletableFuture<Boolean> forAll($<M, A> ma, Predicate<? super A> pred) {
        return toFuture(ma).thenApply(m -> m.isAbsent() || pred.test(m.get()));
    }

    /**
     * False in the None state, otherwise the result of the predicate.
     */
    default <A> CompletableFuture<Boolean> exists($<M, A> ma, Predicate<? super A> pred) {
        return toFuture(ma).thenApply(m -> m.isPresent() && pred.test(m.get()));
    }

    default <A> CompletableFuture<Boolean>
    biForAll($<M, A> ma, Predicate<? super A> some, BooleanSupplier none) {
        return toFuture(ma).thenApply(m -> m.isPresent() ? some.test(m.get()) : none.getAsBoolean());
    }

    default <A> CompletableFuture<Boolean>
    biExists($<M, A> ma, Predicate<? super A> some, BooleanSupplier none) {
        return biForAll(ma, some, none);
    }

    // Conversions

    default <A> CompletableFuture<Seq<A>> toSeq($<M, A> ma) {
        return toFuture(ma).thenApply(m -> m.isPresent() ? Seq.of(m.get()) : Seq.<A>nil());
    }

    default <A> CompletableFuture<ImmutableList<A>> toList($<M, A> ma) {
        return toFuture(ma).thenApply(m -> m.isPresent() ? ImmutableList.of(m.get()) : ImmutableList.<A>of());
    }

    default <A, L> CompletableFuture<Either<L, A>> toEither($<M, A> ma, Supplier<? extends L> left) {
        return toFuture(ma).thenApply(m -> m.toEither(left));
    }

    default <A> CompletableFuture<Maybe<A>> toMaybe($<M, A> ma) {
        return toFuture(ma);
    }

    /**
     * Convert to a {@link Try}. The None state becomes a failure with
     * {@code NoSuchElementException}; a failed future becomes a failure with
     * the original cause. The returned future never completes exceptionally.
     */
    default <A> CompletableFuture<Try<A>> toTry($<M, A> ma) {
        return toFuture(ma).handle((m, ex) -> {
            if (ex != null)
                return Try.<A>failure(ex);
            return m.isPresent()
                ? Try.success(m.get())
                : Try.<A>failure(new NoSuchElementException("No value present"));
        });
    }
}
