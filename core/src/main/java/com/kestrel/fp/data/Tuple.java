/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;

/**
 * An immutable pair. Either component may be {@code null}.
 */
public final class Tuple<A, B> {
    private final A first;
    private final B second;

    private Tuple(A first, B second) {
        this.first = first;
        this.second = second;
    }

    public static <A, B> Tuple<A, B> of(A first, B second) {
        return new Tuple<>(first, second);
    }

    public A first() {
        return first;
    }

    public B second() {
        return second;
    }

    public Tuple<B, A> swap() {
        return of(second, first);
    }

    /**
     * Spread the pair over the two parameters of {@code f}.
     */
    public <R> R as(BiFunction<? super A, ? super B, ? extends R> f) {
        return f.apply(first, second);
    }

    public <X, Y> Tuple<X, Y> map(Function<? super A, ? extends X> f, Function<? super B, ? extends Y> g) {
        return of(f.apply(first), g.apply(second));
    }

    public <Y> Tuple<A, Y> mapSecond(Function<? super B, ? extends Y> g) {
        return of(first, g.apply(second));
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof Tuple))
            return false;
        Tuple<?, ?> that = (Tuple<?, ?>)obj;
        return Objects.equals(first, that.first) && Objects.equals(second, that.second);
    }

    @Override
    public int hashCode() {
        return Objects.hash(first, second);
    }

    @Override
    public String toString() {
        return "(" + first + "," + second + ")";
    }
}
