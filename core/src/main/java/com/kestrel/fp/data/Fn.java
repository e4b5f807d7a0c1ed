/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.google.common.base.Suppliers;

import com.kestrel.fp.function.TriFunction;

/**
 * Small combinators over {@code java.util.function} types.
 */
public final class Fn {
    private Fn() {}

    public static <A> Function<A, A> id() {
        return Function.identity();
    }

    /**
     * A function that ignores its argument and always answers {@code b}.
     */
    public static <A, B> Function<A, B> pure(B b) {
        return ignored -> b;
    }

    /**
     * {@code compose(f, g).apply(x) == f.apply(g.apply(x))}
     */
    public static <A, B, C> Function<A, C> compose(Function<? super B, ? extends C> f, Function<? super A, ? extends B> g) {
        return x -> f.apply(g.apply(x));
    }

    public static <A, B, C> BiFunction<B, A, C> flip(BiFunction<? super A, ? super B, ? extends C> f) {
        return (b, a) -> f.apply(a, b);
    }

    public static <A, B, C> Function<A, Function<B, C>> curry(BiFunction<? super A, ? super B, ? extends C> f) {
        return a -> b -> f.apply(a, b);
    }

    public static <A, B, C, D> Function<A, Function<B, Function<C, D>>>
    curry3(TriFunction<? super A, ? super B, ? super C, ? extends D> f) {
        return a -> b -> c -> f.apply(a, b, c);
    }

    public static <A, B, C> BiFunction<A, B, C> uncurry(Function<? super A, ? extends Function<? super B, ? extends C>> f) {
        return (a, b) -> f.apply(a).apply(b);
    }

    /**
     * Memoise a supplier. The returned supplier calls {@code thunk} at most
     * once, even under concurrent access, and then keeps answering the
     * stored value. If {@code thunk} throws, the next call tries again.
     * Passing a supplier that this method already returned gives it back
     * unchanged.
     */
    public static <T> Supplier<T> lazy(Supplier<T> thunk) {
        Objects.requireNonNull(thunk);
        if (thunk instanceof Memo)
            return thunk;
        return new Memo<>(thunk);
    }

    private static final class Memo<T> implements Supplier<T> {
        private final com.google.common.base.Supplier<T> memo;

        Memo(Supplier<T> thunk) {
            memo = Suppliers.memoize(thunk::get);
        }

        @Override
        public T get() {
            return memo.get();
        }
    }
}
