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

import com.kestrel.fp.$;
import com.kestrel.fp.control.Applicative;
import com.kestrel.fp.control.Monad;

/**
 * A box around exactly one value. Lets code written against
 * {@link Monad} or {@link Traversable} run with no effect at all.
 *
 * <p>A box made by {@link #lazy} computes its value on the first
 * {@link #get}, and everything derived from it stays lazy.
 *
 * @param <A> the type of the boxed value
 */
public final class Identity<A> implements $<Identity.µ, A>, Foldable<A>, Traversable<Identity.µ, A> {
    private final Supplier<A> value;
    private final boolean lazy;

    private Identity(Supplier<A> value, boolean lazy) {
        this.value = value;
        this.lazy = lazy;
    }

    public static <A> Identity<A> of(A a) {
        return new Identity<>(Suppliers.ofInstance(a), false);
    }

    /**
     * Box a value that is computed at most once, when first asked for.
     */
    public static <A> Identity<A> lazy(Supplier<A> a) {
        return new Identity<>(Fn.lazy(a), true);
    }

    public A get() {
        return value.get();
    }

    public boolean isLazy() {
        return lazy;
    }

    /**
     * Unbox a generic identity value.
     */
    public static <A> A run($<µ, A> m) {
        return narrow(m).get();
    }

    // strict boxes apply f now, lazy boxes defer it
    private <B> Identity<B> derive(Supplier<B> next) {
        return lazy ? lazy(next) : of(next.get());
    }

    public <B> Identity<B> map(Function<? super A, ? extends B> f) {
        return derive(() -> f.apply(get()));
    }

    public <B> Identity<B> bind(Function<? super A, ? extends $<µ, B>> f) {
        return derive(() -> run(f.apply(get())));
    }

    public <B> Identity<B> ap($<µ, Function<? super A, ? extends B>> f) {
        return derive(() -> run(f).apply(get()));
    }

    @Override
    public <R> R foldRight(BiFunction<? super A, Supplier<R>, R> f, Supplier<R> z) {
        return f.apply(get(), z);
    }

    @Override
    public <R> R foldRight_(R z, BiFunction<? super A, R, R> f) {
        return f.apply(get(), z);
    }

    @Override
    public <R> R foldLeft(R z, BiFunction<R, ? super A, R> f) {
        return f.apply(z, get());
    }

    @Override
    public long count() {
        return 1;
    }

    @Override
    public <F, B> $<F, Identity<B>> traverse(Applicative<F> m, Function<? super A, ? extends $<F, B>> f) {
        return m.map(f.apply(get()), Identity::<B>of);
    }

    public static final class µ implements Monad<µ> {
        @Override
        public <A> Identity<A> pure(A a) {
            return of(a);
        }

        @Override
        public <A, B> Identity<B> map($<µ, A> m, Function<? super A, ? extends B> f) {
            return narrow(m).map(f);
        }

        @Override
        public <A, B> Identity<B> bind($<µ, A> m, Function<? super A, ? extends $<µ, B>> k) {
            return narrow(m).bind(k);
        }

        @Override
        public <A, B> Identity<B> ap($<µ, Function<? super A, ? extends B>> f, $<µ, A> m) {
            return narrow(m).ap(f);
        }
    }

    public static final µ tclass = new µ();

    public static <A> Identity<A> narrow($<µ, A> value) {
        return (Identity<A>)value;
    }

    @Override
    public µ getTypeClass() {
        return tclass;
    }

    /**
     * Compares the boxed values, forcing lazy boxes.
     */
    @Override
    public boolean equals(Object obj) {
        return obj == this
            || (obj instanceof Identity && Objects.equals(get(), ((Identity<?>)obj).get()));
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(get());
    }

    @Override
    public String toString() {
        return "Identity " + get();
    }
}
