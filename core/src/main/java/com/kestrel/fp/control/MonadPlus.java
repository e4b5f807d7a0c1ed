/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.control;

/**
 * A monad with choice. {@code mzero} must be a left zero of {@code bind}:
 * binding it to any function gives {@code mzero} again.
 *
 * @param <M> the typeclass of the container
 */
public interface MonadPlus<M> extends Alternative<M>, Monad<M> {
}
