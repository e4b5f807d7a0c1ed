/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

import java.util.function.Function;

import com.kestrel.fp.$;

/**
 * A typeclass for containers whose contents can be transformed without
 * changing their shape.
 *
 * <p>Implementations must keep {@code map(fa, x -> x)} equal to {@code fa},
 * and mapping with {@code f} then {@code g} must equal one map with their
 * composition.
 *
 * @param <F> the typeclass of the container
 */
public interface Functor<F> {
    /**
     * Apply {@code f} to every value held by {@code fa}.
     */
    <A, B> $<F, B> map($<F, A> fa, Function<? super A, ? extends B> f);

    /**
     * Keep the shape of {@code fa} but put {@code b} in place of each value.
     */
    default <A, B> $<F, B> fill($<F, A> fa, B b) {
        return map(fa, ignored -> b);
    }
}
