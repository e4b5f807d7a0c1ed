/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.function.Function;

import org.junit.Test;
import static org.junit.Assert.*;

public class TraversalsTest
{
    @Test
    public void seqOfMaybe() {
        assertEquals(Seq.of(Maybe.<Integer>empty()), Traversals.seqOfMaybe(Maybe.<Seq<Integer>>empty()));
        assertEquals(Seq.<Maybe<Integer>>nil(), Traversals.seqOfMaybe(Maybe.of(Seq.<Integer>nil())));
        assertEquals(Seq.of(Maybe.of(1), Maybe.of(2), Maybe.of(3)),
                     Traversals.seqOfMaybe(Maybe.of(Seq.of(1, 2, 3))));
    }

    @Test
    public void maybeOfSeq() {
        assertEquals(Maybe.of(Seq.of(1, 2, 3)),
                     Traversals.maybeOfSeq(Seq.of(Maybe.of(1), Maybe.of(2), Maybe.of(3))));
        assertEquals(Maybe.empty(),
                     Traversals.maybeOfSeq(Seq.of(Maybe.of(1), Maybe.<Integer>empty(), Maybe.of(3))));
        assertEquals(Maybe.of(Seq.nil()), Traversals.maybeOfSeq(Seq.<Maybe<Integer>>nil()));
    }

    @Test
    public void seqOfEither() {
        Either<String, Seq<Integer>> left = Either.left("e");
        assertEquals(Seq.of(Either.<String, Integer>left("e")), Traversals.seqOfEither(left));

        Either<String, Seq<Integer>> right = Either.right(Seq.of(1, 2));
        assertEquals(Seq.of(Either.<String, Integer>right(1), Either.<String, Integer>right(2)),
                     Traversals.seqOfEither(right));
    }

    @Test
    public void eitherOfSeqStopsAtFirstLeft() {
        Seq<Either<String, Integer>> xs = Seq.of(Either.right(1), Either.left("a"), Either.left("b"));
        assertEquals(Either.left("a"), Traversals.eitherOfSeq(xs));

        Seq<Either<String, Integer>> ys = Seq.of(Either.right(1), Either.right(2));
        assertEquals(Either.right(Seq.of(1, 2)), Traversals.eitherOfSeq(ys));
    }

    @Test
    public void longListsDoNotOverflowStack() {
        int n = 100_000;
        Seq<Integer> ones = Seq.replicate(n, 1);

        Maybe<Seq<Integer>> maybe = Traversals.maybeOfSeq(ones.map(Maybe::of));
        assertEquals(n, maybe.get().count());
        assertEquals(Maybe.empty(), Traversals.maybeOfSeq(ones.map(Maybe::of).append(Maybe.<Integer>empty())));

        Either<String, Seq<Integer>> either = Traversals.eitherOfSeq(ones.map(Either::<String, Integer>right));
        assertEquals(n, either.right().count());

        Identity<Seq<Integer>> identity = Traversals.identityOfSeq(ones.map(Identity::of));
        assertEquals(n, (long)identity.get().foldLeft(0L, (r, x) -> r + x));
    }

    @Test
    public void traverseAppliesFunctionInListOrder() {
        StringBuilder order = new StringBuilder();
        Maybe<Seq<Integer>> result = Maybe.narrow(Seq.of(1, 2, 3).traverse(Maybe.tclass, x -> {
            order.append(x);
            return Maybe.of(x * 10);
        }));
        assertEquals(Maybe.of(Seq.of(10, 20, 30)), result);
        assertEquals("123", order.toString());
    }

    @Test
    public void eitherOfMaybe() {
        assertEquals(Either.right(Maybe.empty()), Traversals.eitherOfMaybe(Maybe.<Either<String, Integer>>empty()));
        assertEquals(Either.right(Maybe.of(1)), Traversals.eitherOfMaybe(Maybe.of(Either.<String, Integer>right(1))));
        assertEquals(Either.left("e"), Traversals.eitherOfMaybe(Maybe.of(Either.<String, Integer>left("e"))));
    }

    @Test
    public void identityPairs() {
        assertEquals(Seq.of(Identity.of(1), Identity.of(2)), Traversals.seqOfIdentity(Identity.of(Seq.of(1, 2))));
        assertEquals(Identity.of(Seq.of(1, 2)), Traversals.identityOfSeq(Seq.of(Identity.of(1), Identity.of(2))));
    }

    @Test
    public void traverseWithIdentityIsMap() {
        Seq<Integer> xs = Seq.of(1, 2, 3);
        Function<Integer, Identity<Integer>> f = x -> Identity.of(x * 2);
        assertEquals(Identity.of(xs.map(x -> x * 2)), xs.traverse(Identity.tclass, f));
    }

    @Test
    public void traverseIsNatural() {
        // Maybe to Seq preserves traversal: toSeq(traverse f xs) == traverse (toSeq . f) xs
        Seq<Integer> xs = Seq.of(1, 2);
        Function<Integer, Maybe<Integer>> f = x -> Maybe.of(x + 1);
        Seq<Seq<Integer>> lhs = Maybe.narrow(xs.traverse(Maybe.tclass, f)).asList();
        Seq<Seq<Integer>> rhs = Seq.narrow(xs.traverse(Seq.tclass, x -> f.apply(x).asList()));
        assertEquals(lhs, rhs);
    }

    @Test
    public void sequenceThroughTraversable() {
        Maybe<Seq<Integer>> m = Maybe.of(Seq.of(1, 2));
        assertEquals(Seq.of(Maybe.of(1), Maybe.of(2)), Traversable.sequence(Seq.tclass, m));
    }
}
