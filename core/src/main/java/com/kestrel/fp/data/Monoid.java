/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * An associative combining operation together with its neutral element.
 * For every {@code x}, {@code y} and {@code z}:
 *
 * <pre>{@code
 *   append(empty(), x) == x
 *   append(x, empty()) == x
 *   append(x, append(y, z)) == append(append(x, y), z)
 * }</pre>
 *
 * <p>A monoid built by {@link #monoid} receives its right operand as a
 * supplier and may leave it unevaluated, which lets {@link #foldMap} stop
 * early, even on an infinite list. One built by {@link #monoid_} always
 * evaluates both operands and folds from the left.
 */
public final class Monoid<A> {
    private final A empty;
    private final BiFunction<A, Supplier<A>, A> op;
    private final boolean strict;

    private Monoid(A empty, BiFunction<A, Supplier<A>, A> op, boolean strict) {
        this.empty = empty;
        this.op = op;
        this.strict = strict;
    }

    /**
     * A monoid whose operation may skip its right operand.
     */
    public static <A> Monoid<A> monoid(A empty, BiFunction<A, Supplier<A>, A> append) {
        return new Monoid<>(empty, append, false);
    }

    /**
     * A monoid whose operation needs both operands.
     */
    public static <A> Monoid<A> monoid_(A empty, BinaryOperator<A> append) {
        return new Monoid<>(empty, (a, b) -> append.apply(a, b.get()), true);
    }

    public A empty() {
        return empty;
    }

    public A append(A a1, Supplier<A> a2) {
        return op.apply(a1, a2);
    }

    public A append(A a1, A a2) {
        return op.apply(a1, () -> a2);
    }

    public A concat(Foldable<A> xs) {
        return foldMap(xs, Fn.id());
    }

    /**
     * Map every element into the monoid and combine the results in order.
     */
    public <T> A foldMap(Foldable<T> xs, Function<? super T, ? extends A> f) {
        if (strict)
            return xs.foldLeft(empty, (acc, x) -> append(acc, f.apply(x)));
        return xs.foldRight((x, rest) -> op.apply(f.apply(x), rest), () -> empty);
    }

    public static final Monoid<Integer> intSum = monoid_(0, Integer::sum);

    public static final Monoid<Long> longSum = monoid_(0L, Long::sum);

    /** Logical and; stops at the first {@code false}. */
    public static final Monoid<Boolean> conjunction = monoid(true, (a, b) -> a && b.get());

    /** Logical or; stops at the first {@code true}. */
    public static final Monoid<Boolean> disjunction = monoid(false, (a, b) -> a || b.get());

    public static final Monoid<String> stringConcat = monoid_("", String::concat);

    public static <A> Monoid<Seq<A>> seq() {
        return monoid(Seq.nil(), (a, b) -> a.append(b));
    }

    /**
     * Keeps the leftmost {@code Just}.
     */
    public static <A> Monoid<Maybe<A>> first() {
        return monoid(Maybe.empty(), (a, b) -> a.isPresent() ? a : b.get());
    }

    /**
     * Keeps the rightmost {@code Just}.
     */
    public static <A> Monoid<Maybe<A>> last() {
        return monoid_(Maybe.empty(), (a, b) -> b.isPresent() ? b : a);
    }
}
