/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.function.BiFunction;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

import com.google.common.collect.ImmutableList;

import com.kestrel.fp.$;
import com.kestrel.fp.control.Applicative;
import com.kestrel.fp.control.MonadPlus;

/**
 * An immutable singly linked list whose tails may be computed on demand.
 *
 * <p>{@link #map}, {@link #filter}, {@link #flatMap}, {@link #take},
 * {@link #zip} and {@link #append} are lazy: they look at no more of the
 * source than the caller reads, so they work on infinite lists built by
 * {@link #iterate} or {@link #repeat}. Folds, {@link #reverse},
 * {@link #traverse}, {@code equals} and {@code hashCode} walk the whole
 * list and never return for an infinite one. They loop rather than
 * recurse, so long finite lists are fine.
 *
 * <p>Two lists are equal when they hold equal elements in the same order,
 * whatever mix of strict and lazy cells they are built from.
 *
 * @param <T> the element type
 */
public interface Seq<T> extends $<Seq.µ, T>, Foldable<T>, Traversable<Seq.µ, T> {
    boolean isEmpty();

    /**
     * @throws NoSuchElementException on the empty list
     */
    T head();

    /**
     * Everything after the head. A lazy tail is computed here, once.
     *
     * @throws NoSuchElementException on the empty list
     */
    Seq<T> tail();

    /**
     * The head, or {@code Nothing} for the empty list or a {@code null}
     * head.
     */
    default Maybe<T> peek() {
        return isEmpty() ? Maybe.<T>empty() : Maybe.ofNullable(head());
    }

    // Building lists

    static <T> Seq<T> nil() {
        return SeqImpl.nil();
    }

    static <T> Seq<T> cons(T head, Seq<T> tail) {
        return SeqImpl.cons(head, tail);
    }

    /**
     * A list whose tail is produced by {@code tail} the first time it is
     * asked for. The supplier must not return {@code null}.
     */
    static <T> Seq<T> cons(T head, Supplier<Seq<T>> tail) {
        return SeqImpl.cons(head, tail);
    }

    static <T> Seq<T> of(T value) {
        return cons(value, Seq.<T>nil());
    }

    @SafeVarargs
    static <T> Seq<T> of(T... values) {
        Seq<T> result = nil();
        for (int i = values.length - 1; i >= 0; i--)
            result = cons(values[i], result);
        return result;
    }

    /**
     * A list that pulls from {@code it} as it is read. The iterator must
     * not be used elsewhere afterwards.
     */
    static <T> Seq<T> wrap(Iterator<T> it) {
        if (!it.hasNext())
            return nil();
        T first = it.next();
        return cons(first, () -> wrap(it));
    }

    /**
     * View an {@code Iterable} as a list. A {@code Seq} is returned as is.
     */
    @SuppressWarnings("unchecked")
    static <T> Seq<T> wrap(Iterable<T> iterable) {
        return iterable instanceof Seq ? (Seq<T>)iterable : wrap(iterable.iterator());
    }

    /**
     * The infinite list {@code seed, f(seed), f(f(seed)), ...}.
     */
    static <T> Seq<T> iterate(T seed, UnaryOperator<T> f) {
        return cons(seed, () -> iterate(f.apply(seed), f));
    }

    /**
     * The infinite list holding {@code value} at every position.
     */
    static <T> Seq<T> repeat(T value) {
        return SeqImpl.repeat(value);
    }

    /**
     * {@code n} copies of {@code value}; empty when {@code n <= 0}.
     */
    static <T> Seq<T> replicate(int n, T value) {
        return repeat(value).take(n);
    }

    /**
     * Concatenate a list of lists.
     */
    static <T> Seq<T> flatten(Seq<? extends Seq<T>> lists) {
        return lists.flatMap(xs -> xs);
    }

    // Transformations

    default Seq<T> reverse() {
        Seq<T> reversed = nil();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail())
            reversed = cons(xs.head(), reversed);
        return reversed;
    }

    default Seq<T> append(Seq<? extends T> other) {
        return SeqImpl.concat(this, other);
    }

    /**
     * Append a list that is only built once this one has been read to its
     * end.
     */
    default Seq<T> append(Supplier<? extends Seq<T>> other) {
        return SeqImpl.concat(this, other);
    }

    default Seq<T> append(T last) {
        return append(of(last));
    }

    default <R> Seq<R> map(Function<? super T, ? extends R> f) {
        if (isEmpty())
            return nil();
        return cons(f.apply(head()), () -> tail().map(f));
    }

    /**
     * The elements that satisfy {@code p}. Finding the first one reads the
     * source up to that element.
     */
    default Seq<T> filter(Predicate<? super T> p) {
        Seq<T> xs = this;
        while (!xs.isEmpty() && !p.test(xs.head()))
            xs = xs.tail();
        if (xs.isEmpty())
            return nil();
        Seq<T> found = xs;
        return cons(found.head(), () -> found.tail().filter(p));
    }

    /**
     * Replace each element with the list {@code f} returns for it. Empty
     * results are skipped without building a cell.
     */
    default <R> Seq<R> flatMap(Function<? super T, ? extends $<µ, R>> f) {
        Seq<T> xs = this;
        while (!xs.isEmpty()) {
            Seq<R> ys = narrow(f.apply(xs.head()));
            if (!ys.isEmpty()) {
                Seq<T> cell = xs;
                return ys.append(() -> cell.tail().flatMap(f));
            }
            xs = xs.tail();
        }
        return nil();
    }

    /**
     * At most the first {@code n} elements. The tail after the last one
     * taken is never read.
     */
    default Seq<T> take(int n) {
        if (n <= 0 || isEmpty())
            return nil();
        if (n == 1)
            return of(head());
        return cons(head(), () -> tail().take(n - 1));
    }

    default Seq<T> drop(int n) {
        Seq<T> xs = this;
        for (int i = 0; i < n && !xs.isEmpty(); i++)
            xs = xs.tail();
        return xs;
    }

    default <U> Seq<Tuple<T, U>> zip(Seq<? extends U> other) {
        return zip(other, Tuple::of);
    }

    /**
     * Combine elements pairwise. The result is as long as the shorter list.
     */
    default <U, R> Seq<R> zip(Seq<? extends U> other, BiFunction<? super T, ? super U, ? extends R> f) {
        return SeqImpl.zip(this, other, f);
    }

    /**
     * Copy the elements into an {@code ImmutableList}.
     *
     * @throws NullPointerException if the list holds a {@code null} element,
     *         which {@code ImmutableList} does not accept
     */
    default ImmutableList<T> toList() {
        ImmutableList.Builder<T> out = ImmutableList.builder();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail())
            out.add(xs.head());
        return out.build();
    }

    default String show() {
        return show(", ", "[", "]");
    }

    // Foldable

    /**
     * Lazy right fold. Each step receives the rest of the fold as a
     * memoised supplier and may stop the walk by not calling it.
     */
    @Override
    default <R> R foldRight(BiFunction<? super T, Supplier<R>, R> f, Supplier<R> z) {
        if (isEmpty())
            return z.get();
        return f.apply(head(), Fn.lazy(() -> tail().foldRight(f, z)));
    }

    @Override
    default <R> R foldRight_(R z, BiFunction<? super T, R, R> f) {
        R acc = z;
        for (Seq<T> xs = reverse(); !xs.isEmpty(); xs = xs.tail())
            acc = f.apply(xs.head(), acc);
        return acc;
    }

    @Override
    default <R> R foldLeft(R z, BiFunction<R, ? super T, R> f) {
        R acc = z;
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail())
            acc = f.apply(acc, xs.head());
        return acc;
    }

    @Override
    default long count() {
        return foldLeft(0L, (n, x) -> n + 1);
    }

    @Override
    default Maybe<T> find(Predicate<? super T> p) {
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail()) {
            if (p.test(xs.head()))
                return Maybe.ofNullable(xs.head());
        }
        return Maybe.empty();
    }

    @Override
    default Seq<T> asList() {
        return this;
    }

    @Override
    default void forEach(Consumer<? super T> action) {
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail())
            action.accept(xs.head());
    }

    @Override
    default Iterator<T> iterator() {
        return new Iterator<T>() {
            private Seq<T> rest = Seq.this;

            @Override
            public boolean hasNext() {
                return !rest.isEmpty();
            }

            @Override
            public T next() {
                if (rest.isEmpty())
                    throw new NoSuchElementException();
                T next = rest.head();
                rest = rest.tail();
                return next;
            }
        };
    }

    // Traversable

    /**
     * Apply {@code f} to the elements from left to right, then combine the
     * resulting effects in the same order into one effect holding the
     * list of results. The combination starts from the last element and
     * loops, so the call stack does not grow with the length of the list.
     */
    @Override
    default <F, B> $<F, Seq<B>> traverse(Applicative<F> m, Function<? super T, ? extends $<F, B>> f) {
        Seq<$<F, B>> effects = nil();
        for (Seq<T> xs = this; !xs.isEmpty(); xs = xs.tail())
            effects = cons(f.apply(xs.head()), effects);

        $<F, Seq<B>> result = m.pure(nil());
        for (Seq<$<F, B>> es = effects; !es.isEmpty(); es = es.tail())
            result = m.ap2((B y, Seq<B> ys) -> cons(y, ys), es.head(), result);
        return result;
    }

    // Typeclass

    /**
     * The list monad. {@code ap} pairs every function with every value,
     * functions varying slowest, and {@code mplus} appends.
     */
    final class µ implements MonadPlus<µ> {
        µ() {}

        @Override
        public <A> Seq<A> pure(A a) {
            return of(a);
        }

        @Override
        public <A> Seq<A> fail(String message) {
            return nil();
        }

        @Override
        public <A, B> Seq<B> map($<µ, A> xs, Function<? super A, ? extends B> f) {
            return narrow(xs).map(f);
        }

        @Override
        public <A, B> Seq<B> bind($<µ, A> xs, Function<? super A, ? extends $<µ, B>> k) {
            return narrow(xs).flatMap(k);
        }

        @Override
        public <A, B> Seq<B> ap($<µ, Function<? super A, ? extends B>> fs, $<µ, A> xs) {
            Seq<A> values = narrow(xs);
            return narrow(fs).flatMap(f -> values.map(f));
        }

        @Override
        public <A> Seq<A> mzero() {
            return nil();
        }

        @Override
        public <A> Seq<A> mplus($<µ, A> first, $<µ, A> second) {
            return narrow(first).append(narrow(second));
        }
    }

    µ tclass = new µ();

    static <A> Seq<A> narrow($<µ, A> value) {
        return (Seq<A>)value;
    }

    @Override
    default µ getTypeClass() {
        return tclass;
    }
}
