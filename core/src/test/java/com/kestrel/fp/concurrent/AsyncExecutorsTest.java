/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.concurrent;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.After;
import org.junit.Rule;
import org.junit.Test;
import static org.hamcrest.CoreMatchers.*;
import static org.junit.Assert.*;

import com.kestrel.fp.config.Config;
import com.kestrel.fp.config.Configuration;
import com.kestrel.fp.data.Maybe;

public class AsyncExecutorsTest
{
    public final @Rule JUnitRuleMockery context = new JUnitRuleMockery();

    @After
    public void reset() {
        Config.setProvider(null);
    }

    private Config config(String threads, String nameFormat) {
        Configuration configuration = context.mock(Configuration.class);
        Configuration.Provider provider = context.mock(Configuration.Provider.class);
        context.checking(new Expectations() {{
            allowing(configuration).getProperty(Config.ASYNC_THREADS_KEY);
                will(returnValue(Maybe.ofNullable(threads)));
            allowing(configuration).getProperty(Config.ASYNC_THREAD_NAME_KEY);
                will(returnValue(Maybe.ofNullable(nameFormat)));
            allowing(provider).load("async.properties");
                will(returnValue(configuration));
        }});
        Config.setProvider(provider);
        return new Config("async.properties");
    }

    @Test
    public void executorFollowsConfiguration() throws Exception {
        ExecutorService executor = AsyncExecutors.newExecutor(config("3", "worker-%d"));
        try {
            assertEquals(3, ((ThreadPoolExecutor)executor).getCorePoolSize());

            Future<Thread> worker = executor.submit(Thread::currentThread);
            Thread thread = worker.get(5, TimeUnit.SECONDS);
            assertThat(thread.getName(), startsWith("worker-"));
            assertTrue(thread.isDaemon());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    public void defaultsApplyWhenUnset() {
        ExecutorService executor = AsyncExecutors.newExecutor(config(null, null));
        try {
            assertEquals(Runtime.getRuntime().availableProcessors(),
                         ((ThreadPoolExecutor)executor).getCorePoolSize());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void nonPositiveThreadCountIsRejected() {
        AsyncExecutors.newExecutor(config("0", null));
    }

    @Test
    public void defaultExecutorIsShared() {
        Config.setProvider(null);
        assertSame(AsyncExecutors.getDefault(), AsyncExecutors.getDefault());
    }
}
