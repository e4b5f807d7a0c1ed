/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

/**
 * Typed shortcuts for turning common pairs of containers inside out. Each
 * method is {@link Traversable#sequence} specialized to one pair, so results
 * need no cast. Async pairs live on {@code Async} and {@code OptionAsync}.
 */
public final class Traversals {
    private Traversals() {}

    /**
     * {@code Nothing} gives {@code [Nothing]}, {@code Just []} gives {@code []}
     * and {@code Just [x, y]} gives {@code [Just x, Just y]}.
     */
    public static <A> Seq<Maybe<A>> seqOfMaybe(Maybe<Seq<A>> m) {
        return Seq.narrow(m.traverse(Seq.tclass, Fn.<Seq<A>>id()));
    }

    /**
     * {@code Just} of all values if every element is {@code Just}, otherwise
     * {@code Nothing}.
     */
    public static <A> Maybe<Seq<A>> maybeOfSeq(Seq<Maybe<A>> xs) {
        return Maybe.narrow(xs.traverse(Maybe.tclass, Fn.<Maybe<A>>id()));
    }

    /**
     * A {@code Left} gives a singleton list holding that {@code Left}.
     */
    public static <L, A> Seq<Either<L, A>> seqOfEither(Either<L, Seq<A>> e) {
        return Seq.narrow(e.traverse(Seq.tclass, Fn.<Seq<A>>id()));
    }

    /**
     * {@code Right} of all values, or the first {@code Left}.
     */
    public static <L, A> Either<L, Seq<A>> eitherOfSeq(Seq<Either<L, A>> xs) {
        return Either.narrow(xs.traverse(Either.<L>tclass(), Fn.<Either<L, A>>id()));
    }

    public static <L, A> Either<L, Maybe<A>> eitherOfMaybe(Maybe<Either<L, A>> m) {
        return Either.narrow(m.traverse(Either.<L>tclass(), Fn.<Either<L, A>>id()));
    }

    public static <A> Seq<Identity<A>> seqOfIdentity(Identity<Seq<A>> m) {
        return Seq.narrow(m.traverse(Seq.tclass, Fn.<Seq<A>>id()));
    }

    public static <A> Identity<Seq<A>> identityOfSeq(Seq<Identity<A>> xs) {
        return Identity.narrow(xs.traverse(Identity.tclass, Fn.<Identity<A>>id()));
    }
}
