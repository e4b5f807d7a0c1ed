/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.config;

import com.kestrel.fp.data.Maybe;

public final class Config
{
    private static final Configuration.Provider DEFAULT_PROVIDER = new DefaultConfiguration.Provider();
    private static volatile Configuration.Provider provider = DEFAULT_PROVIDER;

    /**
     * The name of the configuration resource looked up on the class path.
     */
    public static final String DEFAULT_NAME = "kestrel.properties";

    /**
     * Number of threads in the default executor used for asynchronous work.
     */
    public static final String ASYNC_THREADS_KEY = "kestrel.async.threads";

    /**
     * Name format of the threads in the default executor.
     */
    public static final String ASYNC_THREAD_NAME_KEY = "kestrel.async.threadName";

    public static final String DEFAULT_ASYNC_THREAD_NAME = "kestrel-async-%d";

    public static void setProvider(Configuration.Provider prov) {
        provider = prov != null ? prov : DEFAULT_PROVIDER;
    }

    private final Configuration conf;

    public Config(String name) {
        conf = provider.load(name);
    }

    public static Config getDefault() {
        return new Config(DEFAULT_NAME);
    }

    public Maybe<String> get(String name) {
        return conf.getProperty(name);
    }

    public String get(String name, String deflt) {
        return get(name).orElse(deflt);
    }

    public boolean getBoolean(String name, boolean deflt) {
        return get(name).map(Boolean::valueOf).orElse(deflt);
    }

    /**
     * Returns an integer property.
     *
     * @throws IllegalArgumentException if the property is not an integer
     */
    public int getInt(String name, int deflt) {
        return get(name).map(String::trim).map(v -> {
            try {
                return Integer.valueOf(v);
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("Invalid integer value for " + name + ": " + v, ex);
            }
        }).orElse(deflt);
    }

    @Override
    public String toString() {
        return conf.toString();
    }
}
