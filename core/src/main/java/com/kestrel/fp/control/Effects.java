/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.control;

import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.kestrel.fp.data.Unit;

/**
 * Runs side-effecting callbacks on behalf of asynchronous containers.
 */
final class Effects {
    private static final Logger logger = Logger.getLogger(Effects.class.getName());

    private Effects() {}

    static <A> Unit run(Consumer<? super A> action, A value) {
        try {
            action.accept(value);
            return Unit.U;
        } catch (RuntimeException ex) {
            logger.log(Level.FINE, "Callback failed on value " + value, ex);
            throw ex;
        }
    }

    static Unit run(Runnable action) {
        try {
            action.run();
            return Unit.U;
        } catch (RuntimeException ex) {
            logger.log(Level.FINE, "Callback failed on empty value", ex);
            throw ex;
        }
    }
}
