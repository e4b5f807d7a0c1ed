/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.concurrent;

import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.logging.Logger;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.util.concurrent.ThreadFactoryBuilder;

import com.kestrel.fp.config.Config;

/**
 * Provides the default executor for asynchronous computations that are not
 * given an explicit {@link Executor}. The executor is created on first use
 * from the {@code kestrel.async.*} configuration properties and runs daemon
 * threads.
 */
public final class AsyncExecutors {
    private static final Logger logger = Logger.getLogger(AsyncExecutors.class.getName());

    private static final Supplier<ExecutorService> DEFAULT =
        Suppliers.memoize(() -> newExecutor(Config.getDefault()));

    private AsyncExecutors() {}

    /**
     * Returns the shared default executor.
     */
    public static Executor getDefault() {
        return DEFAULT.get();
    }

    /**
     * Create an executor from the given configuration.
     *
     * @throws IllegalArgumentException if the configured thread count is not
     * positive or the thread name format is invalid
     */
    public static ExecutorService newExecutor(Config conf) {
        int threads = conf.getInt(Config.ASYNC_THREADS_KEY, Runtime.getRuntime().availableProcessors());
        if (threads <= 0) {
            throw new IllegalArgumentException(Config.ASYNC_THREADS_KEY + " must be positive: " + threads);
        }

        String nameFormat = conf.get(Config.ASYNC_THREAD_NAME_KEY, Config.DEFAULT_ASYNC_THREAD_NAME);
        ThreadFactory factory = new ThreadFactoryBuilder()
            .setNameFormat(nameFormat)
            .setDaemon(true)
            .build();

        logger.config("Creating async executor with " + threads + " threads named " + nameFormat);
        return Executors.newFixedThreadPool(threads, factory);
    }
}
