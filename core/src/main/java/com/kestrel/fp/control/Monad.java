/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.control;

import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.kestrel.fp.$;
import com.kestrel.fp.data.Foldable;
import com.kestrel.fp.data.Seq;
import com.kestrel.fp.data.Unit;
import com.kestrel.fp.function.TriFunction;

/**
 * An applicative whose next computation may depend on the value produced
 * by the previous one.
 *
 * <p>Only {@link #pure} and {@link #bind} are required. {@code map} and
 * {@code ap} are derived from them, and every helper in this interface is
 * written in terms of those two operations, so a container gets the whole
 * set by implementing two methods. Instances must satisfy:
 * <pre>{@code
 * bind(pure(a), k)                == k(a)
 * bind(m, this::pure)             == m
 * bind(bind(m, k), h)             == bind(m, x -> bind(k(x), h))
 * }</pre>
 *
 * <p>Helpers that walk a {@link Seq} build their result with a left fold
 * over the elements, so long inputs do not grow the call stack.
 *
 * @param <M> the typeclass of the container
 */
public interface Monad<M> extends Applicative<M> {
    /**
     * Feed the value of {@code m} to {@code k} and continue with the
     * computation it returns.
     */
    <A, B> $<M, B> bind($<M, A> m, Function<? super A, ? extends $<M, B>> k);

    @Override
    default <A, B> $<M, B> map($<M, A> m, Function<? super A, ? extends B> f) {
        return bind(m, a -> pure(f.apply(a)));
    }

    @Override
    default <A, B> $<M, B> ap($<M, Function<? super A, ? extends B>> mf, $<M, A> m) {
        return bind(mf, f -> bind(m, a -> pure(f.apply(a))));
    }

    @Override
    default <A, B> $<M, B> seqR($<M, A> first, $<M, B> second) {
        return bind(first, ignored -> second);
    }

    /**
     * Like {@link #seqR($, $)} but the second computation is only built
     * when the first one produced a value.
     */
    default <A, B> $<M, B> seqR($<M, A> first, Supplier<? extends $<M, B>> second) {
        return bind(first, ignored -> second.get());
    }

    /**
     * Abort the computation. Containers with a failure state override this;
     * the default throws.
     */
    default <A> $<M, A> fail(String message) {
        throw new RuntimeException(message);
    }

    /**
     * Collapse a nested computation into one.
     */
    default <A> $<M, A> join($<M, ? extends $<M, A>> mm) {
        return bind(mm, inner -> inner);
    }

    default <A, B> Function<$<M, A>, $<M, B>> liftM(Function<? super A, ? extends B> f) {
        return m -> map(m, f);
    }

    /**
     * Lift a binary function. The first argument is evaluated first.
     */
    default <A, B, C> BiFunction<$<M, A>, $<M, B>, $<M, C>>
    liftM2(BiFunction<? super A, ? super B, ? extends C> f) {
        return (ma, mb) -> bind(ma, a -> map(mb, b -> f.apply(a, b)));
    }

    default <A, B, C, D> TriFunction<$<M, A>, $<M, B>, $<M, C>, $<M, D>>
    liftM3(TriFunction<? super A, ? super B, ? super C, ? extends D> f) {
        return (ma, mb, mc) -> bind(ma, a -> bind(mb, b -> map(mc, c -> f.apply(a, b, c))));
    }

    /**
     * Run each computation from left to right and collect their values.
     */
    default <A> $<M, Seq<A>> flatM(Seq<? extends $<M, A>> ms) {
        return mapM(ms, m -> m);
    }

    /**
     * Apply {@code f} to each element from left to right and collect the
     * values of the resulting computations.
     */
    default <A, B> $<M, Seq<B>> mapM(Seq<A> xs, Function<? super A, ? extends $<M, B>> f) {
        return xs.traverse(this, f);
    }

    /**
     * Run each computation from left to right for its effect only.
     */
    default <A> $<M, Unit> sequence(Foldable<? extends $<M, A>> ms) {
        $<M, Unit> start = pure(Unit.U);
        return ms.foldLeft(start, (done, m) -> bind(done, u -> fill(m, Unit.U)));
    }

    /**
     * Apply {@code f} to each element from left to right for its effect
     * only.
     */
    default <A, B> $<M, Unit> mapM_(Foldable<A> xs, Function<? super A, ? extends $<M, B>> f) {
        $<M, Unit> start = pure(Unit.U);
        return xs.foldLeft(start, (done, x) -> bind(done, u -> fill(f.apply(x), Unit.U)));
    }

    /**
     * Keep the elements for which the monadic predicate holds. Effects of
     * the predicate run in list order.
     */
    default <A> $<M, Seq<A>> filterM(Seq<A> xs, Function<? super A, ? extends $<M, Boolean>> p) {
        $<M, Seq<A>> kept = pure(Seq.nil());
        return xs.reverse().foldLeft(kept, (rest, x) ->
            bind(p.apply(x), keep -> map(rest, ys -> keep ? Seq.cons(x, ys) : ys)));
    }

    /**
     * A left fold whose step function returns a computation. Steps run in
     * the order of the elements.
     */
    default <A, B> $<M, B> foldM(B initial, Foldable<A> xs, BiFunction<B, ? super A, ? extends $<M, B>> f) {
        $<M, B> start = pure(initial);
        return xs.foldLeft(start, (acc, x) -> bind(acc, r -> f.apply(r, x)));
    }

    /**
     * Run {@code m} {@code n} times and collect the values.
     */
    default <A> $<M, Seq<A>> replicateM(int n, $<M, A> m) {
        return flatM(Seq.replicate(n, m));
    }

    default <A> $<M, Unit> replicateM_(int n, $<M, A> m) {
        return sequence(Seq.replicate(n, m));
    }

    /**
     * Kleisli composition: run {@code f}, then feed its value to {@code g}.
     */
    default <A, B, C> Function<A, $<M, C>>
    compose(Function<? super A, ? extends $<M, B>> f, Function<? super B, ? extends $<M, C>> g) {
        return a -> bind(f.apply(a), g);
    }
}
