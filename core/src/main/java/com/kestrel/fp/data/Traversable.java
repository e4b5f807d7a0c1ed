/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.function.Function;

import com.kestrel.fp.$;
import com.kestrel.fp.control.Applicative;

/**
 * A structure that can run an effect for each of its elements, left to
 * right, and rebuild itself from the results inside that effect.
 *
 * <p>Traversing with {@code Identity.pure} gives back an equal structure,
 * and the effects are combined in element order. A {@code Seq} of length
 * {@code n} yields one effect holding {@code n} results, or the first
 * failure the effect reports.
 *
 * @param <T> the typeclass of the structure
 * @param <A> the element type
 */
public interface Traversable<T, A> {
    /**
     * Apply {@code f} to every element and collect the results inside the
     * applicative {@code m}.
     */
    <F, B> $<F, ? extends Traversable<T, B>>
    traverse(Applicative<F> m, Function<? super A, ? extends $<F, B>> f);

    /**
     * Turn a structure of effects into one effect holding the structure,
     * so a {@code Seq<Maybe<A>>} becomes a {@code Maybe<Seq<A>>}.
     */
    static <T, F, A> $<F, ? extends Traversable<T, A>>
    sequence(Applicative<F> m, Traversable<T, ? extends $<F, A>> t) {
        return t.traverse(m, Fn.<$<F, A>>id());
    }
}
