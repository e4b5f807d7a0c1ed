/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.config;

import com.kestrel.fp.data.Maybe;

/**
 * A read-only set of named string settings.
 */
public interface Configuration
{
    /**
     * Look up a setting.
     *
     * @param name the setting name
     * @return the value, or {@code Nothing} when the setting is absent
     */
    Maybe<String> getProperty(String name);

    /**
     * Source of {@code Configuration} objects. {@link Config#setProvider}
     * replaces the default class-path provider, mostly in tests.
     */
    interface Provider {
        /**
         * @param name the resource name, such as {@code kestrel.properties}
         * @return the settings stored under that name, possibly empty
         */
        Configuration load(String name);
    }
}
