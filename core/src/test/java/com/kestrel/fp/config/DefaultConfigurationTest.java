/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.config;

import org.junit.After;
import org.junit.Test;
import static org.junit.Assert.*;

import com.kestrel.fp.data.Maybe;

public class DefaultConfigurationTest
{
    private static final String OVERRIDE_KEY = "kestrel.test.flag";

    @After
    public void clearOverride() {
        System.clearProperty(OVERRIDE_KEY);
    }

    @Test
    public void loadFromClassPath() {
        Configuration conf = new DefaultConfiguration.Provider().load("kestrel-test.properties");
        assertEquals(Maybe.of("2"), conf.getProperty(Config.ASYNC_THREADS_KEY));
        assertEquals(Maybe.of("true"), conf.getProperty(OVERRIDE_KEY));
        assertEquals(Maybe.empty(), conf.getProperty("kestrel.test.undefined"));
    }

    @Test
    public void missingResourceGivesEmptyConfiguration() {
        Configuration conf = new DefaultConfiguration.Provider().load("no-such-file.properties");
        assertEquals(Maybe.empty(), conf.getProperty(Config.ASYNC_THREADS_KEY));
    }

    @Test
    public void systemPropertyTakesPrecedence() {
        Configuration conf = new DefaultConfiguration.Provider().load("kestrel-test.properties");
        System.setProperty(OVERRIDE_KEY, "false");
        assertEquals(Maybe.of("false"), conf.getProperty(OVERRIDE_KEY));
    }

    @Test
    public void configurationsAreCached() {
        DefaultConfiguration.Provider provider = new DefaultConfiguration.Provider();
        assertSame(provider.load("kestrel-test.properties"), provider.load("kestrel-test.properties"));
    }

    @Test(expected = NullPointerException.class)
    public void nullNameIsRejected() {
        new DefaultConfiguration.Provider().load(null);
    }
}
