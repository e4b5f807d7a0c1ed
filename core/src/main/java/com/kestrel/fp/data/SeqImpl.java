/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.StringJoiner;
import java.util.function.BiFunction;
import java.util.function.Supplier;

/**
 * The cell types behind {@link Seq}. A list is a chain of {@code Node}s
 * ending in {@code EMPTY}, or looping back on itself in a {@code Cycle}.
 * A node's tail is either given up front or computed on first demand.
 */
final class SeqImpl {
    private SeqImpl() {}

    private abstract static class Base<T> implements Seq<T> {
        /**
         * Element-wise comparison with any other {@code Seq}. Forces both
         * lists, so it does not return when both are infinite and share
         * an infinite common prefix.
         */
        @Override
        public boolean equals(Object obj) {
            if (obj == this)
                return true;
            if (!(obj instanceof Seq))
                return false;
            Seq<?> left = this;
            Seq<?> right = (Seq<?>)obj;
            for (;;) {
                if (left.isEmpty() || right.isEmpty())
                    return left.isEmpty() && right.isEmpty();
                if (!Objects.equals(left.head(), right.head()))
                    return false;
                left = left.tail();
                right = right.tail();
            }
        }

        /**
         * Same formula as {@link java.util.List#hashCode}. Forces the whole
         * list, so it never returns for an infinite one.
         */
        @Override
        public int hashCode() {
            return foldLeft(1, (h, x) -> 31 * h + Objects.hashCode(x));
        }

        @Override
        public String toString() {
            return render(this);
        }
    }

    private static final class Empty extends Base<Object> {
        @Override
        public boolean isEmpty() {
            return true;
        }

        @Override
        public Object head() {
            throw new NoSuchElementException("head of empty list");
        }

        @Override
        public Seq<Object> tail() {
            throw new NoSuchElementException("tail of empty list");
        }

        @Override
        public Seq<Object> reverse() {
            return this;
        }
    }

    private static final Seq<Object> EMPTY = new Empty();

    private static final class Node<T> extends Base<T> {
        private final T head;
        private volatile Seq<T> tail;
        private volatile Supplier<Seq<T>> pending;

        Node(T head, Seq<T> tail) {
            this.head = head;
            this.tail = tail;
        }

        Node(T head, Supplier<Seq<T>> pending) {
            this.head = head;
            this.pending = pending;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public T head() {
            return head;
        }

        @Override
        public Seq<T> tail() {
            Seq<T> result = tail;
            if (result == null) {
                synchronized (this) {
                    if (tail == null) {
                        tail = Objects.requireNonNull(pending.get(), "lazy tail");
                        pending = null;
                    }
                    result = tail;
                }
            }
            return result;
        }

        boolean forced() {
            return tail != null;
        }
    }

    private static final class Cycle<T> extends Base<T> {
        private final T value;

        Cycle(T value) {
            this.value = value;
        }

        @Override
        public boolean isEmpty() {
            return false;
        }

        @Override
        public T head() {
            return value;
        }

        @Override
        public Seq<T> tail() {
            return this;
        }

        @Override
        public Seq<T> reverse() {
            return this;
        }
    }

    @SuppressWarnings("unchecked")
    static <T> Seq<T> nil() {
        return (Seq<T>)EMPTY;
    }

    static <T> Seq<T> cons(T head, Seq<T> tail) {
        return new Node<>(head, Objects.requireNonNull(tail));
    }

    static <T> Seq<T> cons(T head, Supplier<Seq<T>> tail) {
        return new Node<>(head, Objects.requireNonNull(tail));
    }

    static <T> Seq<T> repeat(T value) {
        return new Cycle<>(value);
    }

    static <T> Seq<T> concat(Seq<? extends T> first, Seq<? extends T> second) {
        if (second.isEmpty())
            return narrowElements(first);
        return concat(first, () -> narrowElements(second));
    }

    static <T> Seq<T> concat(Seq<? extends T> first, Supplier<? extends Seq<T>> second) {
        if (first.isEmpty())
            return second.get();
        return cons(first.head(), () -> concat(first.tail(), second));
    }

    static <T, U, R> Seq<R> zip(Seq<? extends T> xs, Seq<? extends U> ys,
                                BiFunction<? super T, ? super U, ? extends R> f) {
        if (xs.isEmpty() || ys.isEmpty())
            return nil();
        return cons(f.apply(xs.head(), ys.head()), () -> zip(xs.tail(), ys.tail(), f));
    }

    // lists are read-only, so a list of a subtype is a list of its supertype
    @SuppressWarnings("unchecked")
    private static <T> Seq<T> narrowElements(Seq<? extends T> xs) {
        return (Seq<T>)xs;
    }

    /**
     * Render the part of the list that is already known. An unforced tail
     * shows as {@code ?} and a cycle as {@code ...}.
     */
    private static String render(Seq<?> xs) {
        StringJoiner out = new StringJoiner(", ", "[", "]");
        while (!xs.isEmpty()) {
            out.add(String.valueOf(xs.head()));
            if (xs instanceof Cycle) {
                out.add("...");
                break;
            }
            if (xs instanceof Node && !((Node<?>)xs).forced()) {
                out.add("?");
                break;
            }
            xs = xs.tail();
        }
        return out.toString();
    }
}
