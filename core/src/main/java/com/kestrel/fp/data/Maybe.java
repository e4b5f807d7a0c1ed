/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Optional;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.function.Supplier;

import com.kestrel.fp.$;
import com.kestrel.fp.control.Applicative;
import com.kestrel.fp.control.MonadPlus;

/**
 * An optional value: either {@code Just} a non-null value or
 * {@code Nothing}.
 *
 * <p>{@code Maybe} never holds {@code null}. Operations whose function
 * returns {@code null}, such as {@link #map}, answer {@code Nothing}
 * instead.
 *
 * @param <A> the type of the value
 */
public abstract class Maybe<A> implements $<Maybe.µ, A>, Foldable<A>, Traversable<Maybe.µ, A> {
    private Maybe() {}

    private static final class Just<A> extends Maybe<A> {
        private final A value;

        Just(A value) {
            this.value = Objects.requireNonNull(value);
        }

        @Override
        public <R> R match(Function<? super A, ? extends R> just, Supplier<? extends R> nothing) {
            return just.apply(value);
        }

        @Override
        public boolean isPresent() {
            return true;
        }

        @Override
        public A get() {
            return value;
        }

        @Override
        public boolean equals(Object obj) {
            return obj == this || (obj instanceof Just && value.equals(((Just<?>)obj).value));
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }

        @Override
        public String toString() {
            return "Just " + value;
        }
    }

    private static final class Nothing<A> extends Maybe<A> {
        @Override
        public <R> R match(Function<? super A, ? extends R> just, Supplier<? extends R> nothing) {
            return nothing.get();
        }

        @Override
        public boolean isPresent() {
            return false;
        }

        @Override
        public A get() {
            throw new NoSuchElementException("Nothing");
        }

        @Override
        public String toString() {
            return "Nothing";
        }
    }

    private static final Maybe<?> NOTHING = new Nothing<>();

    @SuppressWarnings("unchecked")
    public static <A> Maybe<A> empty() {
        return (Maybe<A>)NOTHING;
    }

    /**
     * @throws NullPointerException if {@code value} is null
     */
    public static <A> Maybe<A> of(A value) {
        return new Just<>(value);
    }

    /**
     * {@code Nothing} for {@code null}, otherwise {@code Just value}.
     */
    public static <A> Maybe<A> ofNullable(A value) {
        if (value == null)
            return empty();
        return new Just<>(value);
    }

    public static <A> Maybe<A> fromOptional(Optional<A> optional) {
        return ofNullable(optional.orElse(null));
    }

    public Optional<A> toOptional() {
        return match(Optional::of, Optional::empty);
    }

    /**
     * Case analysis: apply {@code just} to the value, or call
     * {@code nothing} when there is none.
     */
    public abstract <R> R match(Function<? super A, ? extends R> just, Supplier<? extends R> nothing);

    public abstract boolean isPresent();

    public final boolean isAbsent() {
        return !isPresent();
    }

    /**
     * @throws NoSuchElementException on {@code Nothing}
     */
    public abstract A get();

    public <B> Maybe<B> map(Function<? super A, ? extends B> f) {
        if (isAbsent())
            return empty();
        return ofNullable(f.apply(get()));
    }

    /**
     * @throws NullPointerException if {@code f} returns null
     */
    public <B> Maybe<B> flatMap(Function<? super A, ? extends $<µ, B>> f) {
        if (isAbsent())
            return empty();
        return narrow(Objects.requireNonNull(f.apply(get())));
    }

    public Maybe<A> filter(Predicate<? super A> p) {
        if (isPresent() && p.test(get()))
            return this;
        return empty();
    }

    /**
     * This value when present, otherwise the alternative. The alternative
     * is not computed for {@code Just}.
     */
    public Maybe<A> or(Supplier<? extends $<µ, A>> alternative) {
        return isPresent() ? this : narrow(alternative.get());
    }

    public A orElse(A other) {
        return isPresent() ? get() : other;
    }

    public A orElseGet(Supplier<? extends A> other) {
        return isPresent() ? get() : other.get();
    }

    public <X extends Throwable> A orElseThrow(Supplier<? extends X> error) throws X {
        if (isAbsent())
            throw error.get();
        return get();
    }

    /**
     * {@code Right} with the value, or {@code Left} with the supplied value
     * for {@code Nothing}.
     */
    public <L> Either<L, A> toEither(Supplier<? extends L> left) {
        if (isPresent())
            return Either.right(get());
        return Either.left(left.get());
    }

    /**
     * {@code Nothing} becomes {@code pure(Nothing)}; {@code Just x} becomes
     * {@code f(x)} with its result wrapped back in {@code Just}.
     */
    @Override
    public <F, B> $<F, Maybe<B>> traverse(Applicative<F> m, Function<? super A, ? extends $<F, B>> f) {
        if (isAbsent())
            return m.pure(empty());
        return m.map(f.apply(get()), Maybe::of);
    }

    // Foldable

    @Override
    public <R> R foldRight(BiFunction<? super A, Supplier<R>, R> f, Supplier<R> r) {
        return isPresent() ? f.apply(get(), r) : r.get();
    }

    @Override
    public <R> R foldRight_(R z, BiFunction<? super A, R, R> f) {
        return isPresent() ? f.apply(get(), z) : z;
    }

    @Override
    public <R> R foldLeft(R z, BiFunction<R, ? super A, R> f) {
        return isPresent() ? f.apply(z, get()) : z;
    }

    @Override
    public long count() {
        return isPresent() ? 1 : 0;
    }

    // Typeclass

    /**
     * {@code mplus} keeps the first {@code Just}; {@code fail} gives
     * {@code Nothing}.
     */
    public static final class µ implements MonadPlus<µ> {
        @Override
        public <A> Maybe<A> pure(A a) {
            return of(a);
        }

        @Override
        public <A> Maybe<A> fail(String message) {
            return empty();
        }

        @Override
        public <A, B> Maybe<B> map($<µ, A> m, Function<? super A, ? extends B> f) {
            return narrow(m).map(f);
        }

        @Override
        public <A, B> Maybe<B> bind($<µ, A> m, Function<? super A, ? extends $<µ, B>> k) {
            return narrow(m).flatMap(k);
        }

        @Override
        public <A, B> Maybe<B> ap($<µ, Function<? super A, ? extends B>> mf, $<µ, A> m) {
            Maybe<Function<? super A, ? extends B>> f = narrow(mf);
            if (f.isAbsent())
                return empty();
            return narrow(m).map(f.get());
        }

        @Override
        public <A> Maybe<A> mzero() {
            return empty();
        }

        @Override
        public <A> Maybe<A> mplus($<µ, A> first, $<µ, A> second) {
            return narrow(first).or(() -> second);
        }
    }

    public static final µ tclass = new µ();

    public static <A> Maybe<A> narrow($<µ, A> value) {
        return (Maybe<A>)value;
    }

    @Override
    public µ getTypeClass() {
        return tclass;
    }

    // Shortcuts for the Maybe monad

    public static <A> Maybe<Seq<A>> flatM(Seq<? extends $<µ, A>> ms) {
        return narrow(tclass.flatM(ms));
    }

    public static <A, B> Maybe<Seq<B>> mapM(Seq<A> xs, Function<? super A, ? extends $<µ, B>> f) {
        return narrow(tclass.mapM(xs, f));
    }

    public static <A> Maybe<Unit> sequence(Foldable<? extends $<µ, A>> ms) {
        return narrow(tclass.sequence(ms));
    }

    public static <A, B> Maybe<B> foldM(B initial, Foldable<A> xs, BiFunction<B, ? super A, ? extends $<µ, B>> f) {
        return narrow(tclass.foldM(initial, xs, f));
    }
}
