/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.control;

import com.kestrel.fp.$;
import com.kestrel.fp.data.Maybe;
import com.kestrel.fp.data.Unit;

/**
 * An applicative with an empty value and a way to pick between two
 * alternatives. {@code mzero} is the identity of {@code mplus}, and
 * {@code mplus} is associative.
 *
 * @param <F> the typeclass of the container
 */
public interface Alternative<F> extends Applicative<F> {
    /**
     * The alternative that never yields a value.
     */
    <A> $<F, A> mzero();

    /**
     * Combine two alternatives. What "combine" means is up to the
     * container: an option keeps the first present value, a list appends.
     */
    <A> $<F, A> mplus($<F, A> first, $<F, A> second);

    /**
     * Continue only when {@code condition} holds.
     */
    default $<F, Unit> guard(boolean condition) {
        if (condition)
            return pure(Unit.U);
        return mzero();
    }

    /**
     * Turn a failing alternative into a successful {@code Nothing}.
     */
    default <A> $<F, Maybe<A>> optional($<F, A> fa) {
        $<F, Maybe<A>> found = map(fa, Maybe::of);
        return mplus(found, pure(Maybe.<A>empty()));
    }
}
