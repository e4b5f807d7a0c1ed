/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.Supplier;

import com.kestrel.fp.$;
import com.kestrel.fp.control.Applicative;
import com.kestrel.fp.control.Monad;

/**
 * A value of one of two types. By convention {@code Left} carries an error
 * and {@code Right} carries a result; {@link #map}, {@link #flatMap} and the
 * {@link µ monad} act on the right side and pass a left value through
 * untouched.
 *
 * @param <L> the type of the left value
 * @param <R> the type of the right value
 */
public abstract class Either<L, R> implements $<Either.µ<L>, R>, Foldable<R>, Traversable<Either.µ<L>, R> {
    private Either() {}

    private static final class Left<L, R> extends Either<L, R> {
        private final L value;

        Left(L value) {
            this.value = value;
        }

        @Override
        public <T> T either(Function<? super L, ? extends T> ifLeft, Function<? super R, ? extends T> ifRight) {
            return ifLeft.apply(value);
        }

        @Override
        public boolean isLeft() {
            return true;
        }

        @Override
        public L left() {
            return value;
        }

        @Override
        public R right() {
            throw new NoSuchElementException("right() called on " + this);
        }

        @Override
        @SuppressWarnings("unchecked")
        <T> Either<L, T> retype() {
            return (Either<L, T>)this;
        }

        @Override
        public String toString() {
            return "Left(" + value + ")";
        }
    }

    private static final class Right<L, R> extends Either<L, R> {
        private final R value;

        Right(R value) {
            this.value = value;
        }

        @Override
        public <T> T either(Function<? super L, ? extends T> ifLeft, Function<? super R, ? extends T> ifRight) {
            return ifRight.apply(value);
        }

        @Override
        public boolean isLeft() {
            return false;
        }

        @Override
        public L left() {
            throw new NoSuchElementException("left() called on " + this);
        }

        @Override
        public R right() {
            return value;
        }

        @Override
        <T> Either<L, T> retype() {
            throw new IllegalStateException("retype() called on " + this);
        }

        @Override
        public String toString() {
            return "Right(" + value + ")";
        }
    }

    public static <L, R> Either<L, R> left(L value) {
        return new Left<>(value);
    }

    public static <L, R> Either<L, R> right(R value) {
        return new Right<>(value);
    }

    /**
     * Case analysis: apply {@code ifLeft} or {@code ifRight} depending on
     * which side holds the value.
     */
    public abstract <T> T either(Function<? super L, ? extends T> ifLeft, Function<? super R, ? extends T> ifRight);

    public abstract boolean isLeft();

    public final boolean isRight() {
        return !isLeft();
    }

    /**
     * @throws NoSuchElementException on a {@code Right}
     */
    public abstract L left();

    /**
     * @throws NoSuchElementException on a {@code Left}
     */
    public abstract R right();

    // a Left has no R inside, so it can stand for any right type
    abstract <T> Either<L, T> retype();

    public <T> Either<L, T> map(Function<? super R, ? extends T> f) {
        if (isLeft())
            return retype();
        return right(f.apply(right()));
    }

    public <T> Either<T, R> mapLeft(Function<? super L, ? extends T> f) {
        return bimap(f, r -> r);
    }

    public <T, U> Either<T, U> bimap(Function<? super L, ? extends T> lf, Function<? super R, ? extends U> rf) {
        return either(l -> Either.<T, U>left(lf.apply(l)), r -> Either.<T, U>right(rf.apply(r)));
    }

    public <T> Either<L, T> flatMap(Function<? super R, ? extends $<µ<L>, T>> f) {
        if (isLeft())
            return retype();
        return narrow(f.apply(right()));
    }

    /**
     * The right value, or the exception built from the left value.
     */
    public <X extends Throwable> R getOrThrow(Function<? super L, ? extends X> error) throws X {
        if (isLeft())
            throw error.apply(left());
        return right();
    }

    /**
     * The right value as a {@code Maybe}. A left value, or a {@code null}
     * right value, gives {@code Nothing}.
     */
    public Maybe<R> toMaybe() {
        return isLeft() ? Maybe.<R>empty() : Maybe.ofNullable(right());
    }

    /**
     * A left value is returned as {@code pure(this)} without calling
     * {@code f}.
     */
    @Override
    public <F, T> $<F, Either<L, T>> traverse(Applicative<F> m, Function<? super R, ? extends $<F, T>> f) {
        if (isLeft())
            return m.pure(this.<T>retype());
        return m.map(f.apply(right()), Either::<L, T>right);
    }

    @Override
    public <S> S foldRight(BiFunction<? super R, Supplier<S>, S> f, Supplier<S> z) {
        return isLeft() ? z.get() : f.apply(right(), z);
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this)
            return true;
        if (!(obj instanceof Either))
            return false;
        Either<?, ?> that = (Either<?, ?>)obj;
        if (isLeft())
            return that.isLeft() && Objects.equals(left(), that.left());
        return that.isRight() && Objects.equals(right(), that.right());
    }

    @Override
    public int hashCode() {
        return isLeft() ? Objects.hash("Left", left()) : Objects.hash("Right", right());
    }

    // Typeclass

    /**
     * The right-biased monad of {@code Either<L, ?>}. The first left value
     * met stops the computation.
     */
    public static final class µ<L> implements Monad<µ<L>> {
        @Override
        public <R> Either<L, R> pure(R r) {
            return right(r);
        }

        @Override
        public <R, T> Either<L, T> map($<µ<L>, R> m, Function<? super R, ? extends T> f) {
            return narrow(m).map(f);
        }

        @Override
        public <R, T> Either<L, T> bind($<µ<L>, R> m, Function<? super R, ? extends $<µ<L>, T>> k) {
            return narrow(m).flatMap(k);
        }
    }

    private static final µ<?> TCLASS = new µ<>();

    @SuppressWarnings("unchecked")
    public static <L> µ<L> tclass() {
        return (µ<L>)TCLASS;
    }

    public static <L, R> Either<L, R> narrow($<µ<L>, R> value) {
        return (Either<L, R>)value;
    }

    @Override
    public µ<L> getTypeClass() {
        return tclass();
    }

    // Shortcuts for the Either monad

    public static <L, A> Either<L, Seq<A>> flatM(Seq<? extends $<µ<L>, A>> ms) {
        return narrow(Either.<L>tclass().flatM(ms));
    }

    public static <L, A, B> Either<L, Seq<B>> mapM(Seq<A> xs, Function<? super A, ? extends $<µ<L>, B>> f) {
        return narrow(Either.<L>tclass().mapM(xs, f));
    }

    public static <L, A, B> Either<L, B> foldM(B initial, Foldable<A> xs, BiFunction<B, ? super A, ? extends $<µ<L>, B>> f) {
        return narrow(Either.<L>tclass().foldM(initial, xs, f));
    }
}
