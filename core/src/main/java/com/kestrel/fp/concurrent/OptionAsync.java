/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.concurrent;

import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.function.BiFunction;
import java.util.function.BooleanSupplier;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.FutureCallback;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;

import com.kestrel.fp.$;
import com.kestrel.fp.control.Applicative;
import com.kestrel.fp.control.MonadPlus;
import com.kestrel.fp.control.OptionalAsync;
import com.kestrel.fp.data.Either;
import com.kestrel.fp.data.Fn;
import com.kestrel.fp.data.Maybe;
import com.kestrel.fp.data.Seq;
import com.kestrel.fp.data.Try;
import com.kestrel.fp.data.Unit;
import com.kestrel.fp.function.TriFunction;

/**
 * An optional value that becomes known asynchronously.
 *
 * <p>An {@code OptionAsync} is either <em>strict</em>, whose computation is
 * already running, or <em>lazy</em>, whose computation starts the first
 * time the value is demanded and is shared by every later demand.
 * Operations derived from a lazy value stay lazy.
 *
 * <p>Every method forwards to the {@link #tclass typeclass instance}. Two
 * instances are equal only if they are the same object, since comparing
 * values would require waiting for them. {@link #toString()} never waits.
 *
 * @param <A> the type of the bound value
 */
public abstract class OptionAsync<A> implements $<OptionAsync.µ, A> {
    OptionAsync() {
        // no public instantiation
    }

    /**
     * Returns the future of the optional value, starting the computation if
     * it is lazy and not yet started.
     */
    abstract CompletableFuture<Maybe<A>> future();

    /**
     * Returns the future if the computation has been started, or {@code null}.
     */
    abstract CompletableFuture<Maybe<A>> peekFuture();

    /**
     * Derive a new value by transforming the future of this one. A lazy value
     * yields a lazy result.
     */
    abstract <B> OptionAsync<B> derive(Function<CompletableFuture<Maybe<A>>, CompletableFuture<Maybe<B>>> f);

    /**
     * Returns {@code true} if this instance evaluates lazily.
     */
    public abstract boolean isLazy();

    // Implementation

    private static final class Strict<A> extends OptionAsync<A> {
        private final CompletableFuture<Maybe<A>> future;

        Strict(CompletableFuture<Maybe<A>> future) {
            this.future = future;
        }

        @Override
        CompletableFuture<Maybe<A>> future() {
            return future;
        }

        @Override
        CompletableFuture<Maybe<A>> peekFuture() {
            return future;
        }

        @Override
        <B> OptionAsync<B> derive(Function<CompletableFuture<Maybe<A>>, CompletableFuture<Maybe<B>>> f) {
            return new Strict<>(f.apply(future));
        }

        @Override
        public boolean isLazy() {
            return false;
        }
    }

    private static final class Lazy<A> extends OptionAsync<A> {
        private volatile Supplier<? extends CompletableFuture<Maybe<A>>> thunk;
        private volatile CompletableFuture<Maybe<A>> future;

        Lazy(Supplier<? extends CompletableFuture<Maybe<A>>> thunk) {
            this.thunk = thunk;
        }

        @Override
        CompletableFuture<Maybe<A>> future() {
            if (future == null)
                start();
            return future;
        }

        private synchronized void start() {
            if (future == null) {
                CompletableFuture<Maybe<A>> f;
                try {
                    f = Objects.requireNonNull(thunk.get(), "lazy computation returned null");
                } catch (RuntimeException ex) {
                    f = new CompletableFuture<>();
                    f.completeExceptionally(ex);
                }
                future = f;
                thunk = null; // no longer used again
            }
        }

        @Override
        CompletableFuture<Maybe<A>> peekFuture() {
            return future;
        }

        @Override
        <B> OptionAsync<B> derive(Function<CompletableFuture<Maybe<A>>, CompletableFuture<Maybe<B>>> f) {
            return new Lazy<>(() -> f.apply(future()));
        }

        @Override
        public boolean isLazy() {
            return true;
        }
    }

    // Construction

    private static final OptionAsync<?> NONE = new Strict<>(CompletableFuture.completedFuture(Maybe.empty()));

    /**
     * Returns an {@code OptionAsync} in the None state.
     */
    @SuppressWarnings("unchecked")
    public static <A> OptionAsync<A> none() {
        return (OptionAsync<A>)NONE;
    }

    /**
     * Returns an {@code OptionAsync} in the Some state.
     *
     * @throws NullPointerException if the value is null
     */
    public static <A> OptionAsync<A> some(A value) {
        return new Strict<>(CompletableFuture.completedFuture(Maybe.of(value)));
    }

    /**
     * Returns an {@code OptionAsync} in the Some state if the value is not
     * {@code null}, otherwise in the None state.
     */
    public static <A> OptionAsync<A> optional(A value) {
        return value == null ? none() : some(value);
    }

    public static <A> OptionAsync<A> fromMaybe(Maybe<A> value) {
        return value.isPresent() ? some(value.get()) : none();
    }

    /**
     * Wraps a future of an optional value. A {@code null} result is treated
     * as the None state.
     */
    public static <A> OptionAsync<A> fromFuture(CompletableFuture<Maybe<A>> future) {
        return new Strict<>(future.thenApply(m -> m == null ? Maybe.<A>empty() : m));
    }

    /**
     * Wraps a future of a value. A {@code null} result is treated as the
     * None state.
     */
    public static <A> OptionAsync<A> of(CompletableFuture<A> future) {
        return new Strict<>(future.thenApply(Maybe::ofNullable));
    }

    /**
     * Returns an {@code OptionAsync} whose computation is started the first
     * time its value is demanded.
     */
    public static <A> OptionAsync<A> lazy(Supplier<? extends CompletableFuture<Maybe<A>>> computation) {
        return new Lazy<>(Objects.requireNonNull(computation));
    }

    /**
     * Compute the value on the given executor. A {@code null} result fails
     * the computation with a {@code NullPointerException}.
     */
    public static <A> OptionAsync<A> someAsync(Supplier<? extends A> supplier, Executor executor) {
        return new Strict<>(CompletableFuture.supplyAsync(() -> Maybe.<A>of(supplier.get()), executor));
    }

    /**
     * Compute the value on the default executor.
     *
     * @see AsyncExecutors#getDefault()
     */
    public static <A> OptionAsync<A> someAsync(Supplier<? extends A> supplier) {
        return someAsync(supplier, AsyncExecutors.getDefault());
    }

    /**
     * Returns the first element of the given iterable, or None if the
     * iterable is empty or its first element is {@code null}.
     */
    public static <A> OptionAsync<A> fromIterable(Iterable<? extends A> iterable) {
        Iterator<? extends A> it = iterable.iterator();
        return it.hasNext() ? optional(it.next()) : none();
    }

    /**
     * Adapts a Guava {@code ListenableFuture}. A {@code null} result is
     * treated as the None state.
     */
    public static <A> OptionAsync<A> fromListenable(ListenableFuture<? extends A> future) {
        CompletableFuture<A> result = new CompletableFuture<>();
        Futures.addCallback(future, new FutureCallback<A>() {
            @Override
            public void onSuccess(A value) {
                result.complete(value);
            }

            @Override
            public void onFailure(Throwable cause) {
                result.completeExceptionally(cause);
            }
        }, MoreExecutors.directExecutor());
        return of(result);
    }

    // Queries

    public CompletableFuture<Boolean> isSome() {
        return tclass.isSome(this);
    }

    public CompletableFuture<Boolean> isNone() {
        return tclass.isNone(this);
    }

    /**
     * Returns the future of the underlying optional value.
     */
    public CompletableFuture<Maybe<A>> toFuture() {
        return tclass.toFuture(this);
    }

    // Functor and Monad

    public <B> OptionAsync<B> map(Function<? super A, ? extends B> f) {
        return tclass.map(this, f);
    }

    public <B> OptionAsync<B> mapAsync(Function<? super A, ? extends CompletableFuture<B>> f) {
        return tclass.mapAsync(this, f);
    }

    public <B> OptionAsync<B> bind(Function<? super A, ? extends $<µ, B>> f) {
        return tclass.bind(this, f);
    }

    /**
     * Bind and then project the pair of values.
     */
    public <B, C> OptionAsync<C> bind(Function<? super A, ? extends $<µ, B>> bind,
                                      BiFunction<? super A, ? super B, ? extends C> project) {
        return tclass.bind(this, a -> tclass.map(bind.apply(a), b -> project.apply(a, b)));
    }

    public OptionAsync<A> filter(Predicate<? super A> pred) {
        return tclass.filter(this, pred);
    }

    /**
     * Coalescing: this value if in the Some state, otherwise the other one.
     * The other value is only demanded if this one is None.
     */
    public OptionAsync<A> or($<µ, A> other) {
        return tclass.mplus(this, other);
    }

    /**
     * Some with the projection of both values when both are in the Some
     * state and their keys are equal, None otherwise.
     */
    public <B, K, D> OptionAsync<D> join($<µ, B> inner,
                                         Function<? super A, ? extends K> outerKey,
                                         Function<? super B, ? extends K> innerKey,
                                         BiFunction<? super A, ? super B, ? extends D> project) {
        return tclass.bind(this, a -> tclass.bind(inner, b ->
            Objects.equals(outerKey.apply(a), innerKey.apply(b))
                ? tclass.<D>pure(project.apply(a, b))
                : tclass.<D>mzero()));
    }

    /**
     * Partial application map.
     */
    public <B, C> OptionAsync<Function<B, C>> parMap(BiFunction<? super A, ? super B, ? extends C> f) {
        return map(a -> b -> f.apply(a, b));
    }

    /**
     * Partial application map.
     */
    public <B, C, D> OptionAsync<Function<B, Function<C, D>>>
    parMap(TriFunction<? super A, ? super B, ? super C, ? extends D> f) {
        return map(a -> b -> c -> f.apply(a, b, c));
    }

    /**
     * Map the bound value with {@code some}, or produce a value with
     * {@code none} in the None state.
     */
    public <B> OptionAsync<B> biMap(Function<? super A, ? extends B> some, Supplier<? extends B> none) {
        return tclass.biMap(this, some, none);
    }

    // Matching

    public <B> CompletableFuture<B> match(Function<? super A, ? extends B> some, Supplier<? extends B> none) {
        return tclass.match(this, some, none);
    }

    public <B> CompletableFuture<B> matchAsync(Function<? super A, ? extends CompletableFuture<B>> some,
                                               Supplier<? extends CompletableFuture<B>> none) {
        return tclass.matchAsync(this, some, none);
    }

    public <B> CompletableFuture<B> matchUnsafe(Function<? super A, ? extends B> some, Supplier<? extends B> none) {
        return tclass.matchUnsafe(this, some, none);
    }

    public <B> CompletableFuture<B> matchUnsafeAsync(Function<? super A, ? extends CompletableFuture<B>> some,
                                                     Supplier<? extends CompletableFuture<B>> none) {
        return tclass.matchUnsafeAsync(this, some, none);
    }

    /**
     * Case analysis for side effects.
     */
    public CompletableFuture<Unit> match_(Consumer<? super A> some, Runnable none) {
        return tclass.match_(this, some, none);
    }

    /**
     * Case analysis where the bound value is seen as an {@code Object}.
     */
    public <R> CompletableFuture<R> matchUntyped(Function<Object, ? extends R> some, Supplier<? extends R> none) {
        return tclass.match(this, some, none);
    }

    // Side effects

    public CompletableFuture<Unit> ifSome(Consumer<? super A> f) {
        return tclass.ifSome(this, f);
    }

    public CompletableFuture<Unit> ifSomeAsync(Function<? super A, ? extends CompletableFuture<?>> f) {
        return tclass.ifSomeAsync(this, f);
    }

    public CompletableFuture<A> ifNone(Supplier<? extends A> none) {
        return tclass.ifNone(this, none);
    }

    public CompletableFuture<A> ifNone(A noneValue) {
        Objects.requireNonNull(noneValue);
        return tclass.ifNone(this, () -> noneValue);
    }

    public CompletableFuture<A> ifNoneAsync(Supplier<? extends CompletableFuture<A>> none) {
        return tclass.ifNoneAsync(this, none);
    }

    public CompletableFuture<A> ifNoneUnsafe(Supplier<? extends A> none) {
        return tclass.ifNoneUnsafe(this, none);
    }

    public CompletableFuture<Unit> iter(Consumer<? super A> f) {
        return tclass.iter(this, f);
    }

    public CompletableFuture<Unit> biIter(Consumer<? super A> some, Runnable none) {
        return tclass.biIter(this, some, none);
    }

    // Folds

    public <S> CompletableFuture<S> fold(S state, BiFunction<S, ? super A, S> folder) {
        return tclass.fold(this, state, folder);
    }

    public <S> CompletableFuture<S> foldAsync(S state, BiFunction<S, ? super A, ? extends CompletableFuture<S>> folder) {
        return tclass.foldAsync(this, state, folder);
    }

    public <S> CompletableFuture<S> foldBack(S state, BiFunction<S, ? super A, S> folder) {
        return tclass.foldBack(this, state, folder);
    }

    public <S> CompletableFuture<S> biFold(S state, BiFunction<S, ? super A, S> some, Function<S, S> none) {
        return tclass.biFold(this, state, some, none);
    }

    public CompletableFuture<Integer> count() {
        return tclass.count(this);
    }

    public CompletableFuture<Boolean> forAll(Predicate<? super A> pred) {
        return tclass.forAll(this, pred);
    }

    public CompletableFuture<Boolean> exists(Predicate<? super A> pred) {
        return tclass.exists(this, pred);
    }

    public CompletableFuture<Boolean> biForAll(Predicate<? super A> some, BooleanSupplier none) {
        return tclass.biForAll(this, some, none);
    }

    public CompletableFuture<Boolean> biExists(Predicate<? super A> some, BooleanSupplier none) {
        return tclass.biExists(this, some, none);
    }

    // Conversions

    public CompletableFuture<Seq<A>> toSeq() {
        return tclass.toSeq(this);
    }

    public CompletableFuture<ImmutableList<A>> toList() {
        return tclass.toList(this);
    }

    public <L> CompletableFuture<Either<L, A>> toEither(L left) {
        return tclass.toEither(this, () -> left);
    }

    public <L> CompletableFuture<Either<L, A>> toEither(Supplier<? extends L> left) {
        return tclass.toEither(this, left);
    }

    public CompletableFuture<Maybe<A>> toMaybe() {
        return tclass.toMaybe(this);
    }

    public CompletableFuture<Try<A>> toTry() {
        return tclass.toTry(this);
    }

    /**
     * Wait for the value, then traverse it with the given applicative.
     */
    public <F, B> CompletableFuture<$<F, OptionAsync<B>>>
    traverse(Applicative<F> m, Function<? super A, ? extends $<F, B>> f) {
        return tclass.traverse(this, m, f);
    }

    /**
     * Turn a list of asynchronous options into an asynchronous option of a
     * list: Some with every value if all are Some, otherwise None.
     */
    public static <A> OptionAsync<Seq<A>> sequence(Seq<OptionAsync<A>> xs) {
        return narrow(xs.traverse(tclass, Fn.<OptionAsync<A>>id()));
    }

    /**
     * Wait for an asynchronous option of a list and turn it into a list of
     * options: {@code None} gives a single None, {@code Some([])} gives the
     * empty list and {@code Some([x, y])} gives {@code [Some(x), Some(y)]}.
     */
    public static <A> CompletableFuture<Seq<OptionAsync<A>>> sequence(OptionAsync<Seq<A>> m) {
        return m.traverse(Seq.tclass, Fn.<Seq<A>>id()).thenApply(Seq::narrow);
    }

    // Object

    @Override
    public String toString() {
        CompletableFuture<Maybe<A>> f = peekFuture();
        if (f == null || !f.isDone())
            return "OptionAsync(pending)";
        if (f.isCompletedExceptionally())
            return "OptionAsync(failed)";
        Maybe<A> m = f.getNow(Maybe.empty());
        return m.isPresent() ? "Some(" + m.get() + ")" : "None";
    }

    // Type Classes

    /**
     * The {@code OptionAsync} typeclass definition.
     */
    public static final class µ implements MonadPlus<µ>, OptionalAsync<µ> {
        @Override
        public <A> OptionAsync<A> none() {
            return OptionAsync.none();
        }

        @Override
        public <A> OptionAsync<A> some(A a) {
            return OptionAsync.some(a);
        }

        @Override
        public <A> CompletableFuture<Maybe<A>> toFuture($<µ, A> ma) {
            return narrow(ma).future();
        }

        @Override
        public <A> OptionAsync<A> pure(A a) {
            return OptionAsync.some(a);
        }

        @Override
        public <A> OptionAsync<A> fail(String msg) {
            return OptionAsync.none();
        }

        @Override
        public <A, B> OptionAsync<B> map($<µ, A> ma, Function<? super A, ? extends B> f) {
            return narrow(ma).derive(cf -> cf.thenApply(m -> m.map(f)));
        }

        public <A, B> OptionAsync<B> mapAsync($<µ, A> ma, Function<? super A, ? extends CompletableFuture<B>> f) {
            return narrow(ma).derive(cf -> cf.thenCompose(m -> m.isPresent()
                ? f.apply(m.get()).thenApply(Maybe::ofNullable)
                : CompletableFuture.completedFuture(Maybe.<B>empty())));
        }

        @Override
        public <A, B> OptionAsync<B> bind($<µ, A> ma, Function<? super A, ? extends $<µ, B>> k) {
            return narrow(ma).derive(cf -> cf.thenCompose(m -> m.isPresent()
                ? narrow(k.apply(m.get())).future()
                : CompletableFuture.completedFuture(Maybe.<B>empty())));
        }

        /**
         * Sequential application. Both values are demanded at once and
         * complete independently.
         */
        @Override
        public <A, B> OptionAsync<B> ap($<µ, Function<? super A, ? extends B>> mf, $<µ, A> ma) {
            OptionAsync<Function<? super A, ? extends B>> fs = narrow(mf);
            OptionAsync<A> xs = narrow(ma);
            return fs.derive(cf -> cf.thenCombine(xs.future(), (f, x) -> f.flatMap(g -> x.map(g))));
        }

        public <A> OptionAsync<A> filter($<µ, A> ma, Predicate<? super A> p) {
            return narrow(ma).derive(cf -> cf.thenApply(m -> m.filter(p)));
        }

        public <A, B> OptionAsync<B> biMap($<µ, A> ma, Function<? super A, ? extends B> some, Supplier<? extends B> none) {
            return narrow(ma).derive(cf -> cf.thenApply(m -> m.isPresent()
                ? m.<B>map(some)
                : Maybe.<B>ofNullable(none.get())));
        }

        @Override
        public <A> OptionAsync<A> mzero() {
            return OptionAsync.none();
        }

        @Override
        public <A> OptionAsync<A> mplus($<µ, A> a, $<µ, A> b) {
            OptionAsync<A> other = narrow(b);
            return narrow(a).derive(cf -> cf.thenCompose(m -> m.isPresent()
                ? CompletableFuture.completedFuture(m)
                : other.future()));
        }

        public <A, F, B> CompletableFuture<$<F, OptionAsync<B>>>
        traverse($<µ, A> ma, Applicative<F> m, Function<? super A, ? extends $<F, B>> f) {
            return toFuture(ma).thenApply(opt -> m.map(opt.traverse(m, f), OptionAsync::fromMaybe));
        }
    }

    public static <A> OptionAsync<A> narrow($<µ, A> value) {
        return (OptionAsync<A>)value;
    }

    public static final µ tclass = new µ();

    @Override
    public µ getTypeClass() {
        return tclass;
    }
}
