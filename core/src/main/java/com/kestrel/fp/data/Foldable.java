/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.Iterator;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * A container whose elements can be reduced to a single value.
 *
 * <p>Implementations supply the lazy right fold
 * {@link #foldRight(BiFunction, Supplier)}; every other operation has a
 * default built on it. Containers that can walk their elements with a
 * loop should also override {@link #foldLeft} and {@link #foldRight_}.
 *
 * @param <T> the element type
 */
public interface Foldable<T> extends Iterable<T> {
    /**
     * Fold from the right. {@code f} gets an element and the fold of
     * everything after it, as a supplier it may never call. Not calling it
     * ends the walk there.
     */
    <R> R foldRight(BiFunction<? super T, Supplier<R>, R> f, Supplier<R> z);

    default <R> R foldRight(R z, BiFunction<? super T, Supplier<R>, R> f) {
        return foldRight(f, () -> z);
    }

    /**
     * Fold from the right, always visiting every element.
     */
    default <R> R foldRight_(R z, BiFunction<? super T, R, R> f) {
        return foldRight((x, rest) -> f.apply(x, rest.get()), () -> z);
    }

    /**
     * Fold from the left: {@code f(...f(f(z, x1), x2)..., xn)}.
     */
    default <R> R foldLeft(R z, BiFunction<R, ? super T, R> f) {
        // build "apply the remaining elements" right to left, then run it on z
        Function<R, R> run = foldRight_(Fn.<R>id(), (x, next) -> acc -> next.apply(f.apply(acc, x)));
        return run.apply(z);
    }

    default T fold(Monoid<T> monoid) {
        return monoid.concat(this);
    }

    default <R> R foldMap(Monoid<R> monoid, Function<? super T, ? extends R> f) {
        return monoid.foldMap(this, f);
    }

    default long count() {
        return foldLeft(0L, (n, x) -> n + 1);
    }

    /**
     * The first element that satisfies {@code p}. Nothing past it is read.
     */
    default Maybe<T> find(Predicate<? super T> p) {
        return foldRight((x, rest) -> p.test(x) ? Maybe.ofNullable(x) : rest.get(), Maybe::<T>empty);
    }

    /**
     * Whether some element satisfies {@code p}; {@code false} when empty.
     */
    default boolean anyMatch(Predicate<? super T> p) {
        return this.<Boolean>foldRight((x, rest) -> p.test(x) || rest.get(), () -> Boolean.FALSE);
    }

    /**
     * Whether every element satisfies {@code p}; {@code true} when empty.
     */
    default boolean allMatch(Predicate<? super T> p) {
        return !anyMatch(p.negate());
    }

    default boolean noneMatch(Predicate<? super T> p) {
        return !anyMatch(p);
    }

    default Seq<T> asList() {
        return foldRight_(Seq.<T>nil(), Seq::cons);
    }

    @Override
    default Iterator<T> iterator() {
        return asList().iterator();
    }

    @Override
    default void forEach(Consumer<? super T> action) {
        Objects.requireNonNull(action);
        foldLeft(Unit.U, (u, x) -> {
            action.accept(x);
            return u;
        });
    }

    default String show(CharSequence delimiter, CharSequence prefix, CharSequence suffix) {
        StringJoiner out = new StringJoiner(delimiter, prefix, suffix);
        forEach(x -> out.add(String.valueOf(x)));
        return out.toString();
    }
}
