/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.data;

/**
 * The result of an action run for its effect alone.
 */
public enum Unit {
    U;

    @Override
    public String toString() {
        return "()";
    }
}
