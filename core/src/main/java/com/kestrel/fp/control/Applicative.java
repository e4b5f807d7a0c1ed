/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.control;

import java.util.function.BiFunction;
import java.util.function.Function;

import com.kestrel.fp.$;
import com.kestrel.fp.data.Functor;
import com.kestrel.fp.function.TriFunction;

/**
 * A functor that can combine independent effectful values.
 *
 * <p>Where a {@link Monad} lets the next step depend on a previous result,
 * an applicative only runs effects whose structure is known up front. That
 * is all {@link com.kestrel.fp.data.Traversable#traverse traverse} needs, so
 * every container can be turned inside out against any applicative.
 *
 * <p>Instances obey, writing {@code ap(ff, fa)} as {@code ff <*> fa}:
 * <pre>{@code
 * pure(x -> x) <*> v          == v
 * pure(f) <*> pure(x)         == pure(f(x))
 * u <*> pure(y)               == pure(g -> g(y)) <*> u
 * map(fa, f)                  == pure(f) <*> fa
 * }</pre>
 *
 * @param <F> the typeclass of the container
 */
public interface Applicative<F> extends Functor<F> {
    /**
     * Wrap a plain value with no effect.
     */
    <A> $<F, A> pure(A a);

    /**
     * Apply the functions held by {@code ff} to the values held by
     * {@code fa}. Effects of {@code ff} come before those of {@code fa}.
     */
    <A, B> $<F, B> ap($<F, Function<? super A, ? extends B>> ff, $<F, A> fa);

    /**
     * Combine two values with a binary function.
     */
    default <A, B, C> $<F, C>
    ap2(BiFunction<? super A, ? super B, ? extends C> f, $<F, A> fa, $<F, B> fb) {
        $<F, Function<? super B, ? extends C>> partial = map(fa, a -> b -> f.apply(a, b));
        return ap(partial, fb);
    }

    /**
     * Combine three values with a ternary function.
     */
    default <A, B, C, D> $<F, D>
    ap3(TriFunction<? super A, ? super B, ? super C, ? extends D> f, $<F, A> fa, $<F, B> fb, $<F, C> fc) {
        $<F, Function<? super C, ? extends D>> partial = ap2((a, b) -> c -> f.apply(a, b, c), fa, fb);
        return ap(partial, fc);
    }

    /**
     * Run both, keep the right value.
     */
    default <A, B> $<F, B> seqR($<F, A> fa, $<F, B> fb) {
        return ap2((a, b) -> b, fa, fb);
    }

    /**
     * Run both, keep the left value.
     */
    default <A, B> $<F, A> seqL($<F, A> fa, $<F, B> fb) {
        return ap2((a, b) -> a, fa, fb);
    }

    default <A, B> Function<$<F, A>, $<F, B>> liftA(Function<? super A, ? extends B> f) {
        return fa -> map(fa, f);
    }

    default <A, B, C> BiFunction<$<F, A>, $<F, B>, $<F, C>>
    liftA2(BiFunction<? super A, ? super B, ? extends C> f) {
        return (fa, fb) -> ap2(f, fa, fb);
    }

    default <A, B, C, D> TriFunction<$<F, A>, $<F, B>, $<F, C>, $<F, D>>
    liftA3(TriFunction<? super A, ? super B, ? super C, ? extends D> f) {
        return (fa, fb, fc) -> ap3(f, fa, fb, fc);
    }
}
