/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.config;

import org.jmock.Expectations;
import org.jmock.integration.junit4.JUnitRuleMockery;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import static org.junit.Assert.*;

import com.kestrel.fp.data.Maybe;

public class ConfigTest
{
    public final @Rule JUnitRuleMockery context = new JUnitRuleMockery();

    private final Configuration configuration = context.mock(Configuration.class);

    @Before
    public void configure() {
        Configuration.Provider provider = context.mock(Configuration.Provider.class);
        context.checking(new Expectations() {{
            allowing(configuration).getProperty("app.name");
                will(returnValue(Maybe.of("demo")));
            allowing(configuration).getProperty("app.port");
                will(returnValue(Maybe.of(" 8080 ")));
            allowing(configuration).getProperty("app.debug");
                will(returnValue(Maybe.of("true")));
            allowing(configuration).getProperty("app.bad");
                will(returnValue(Maybe.of("eighty")));
            allowing(configuration).getProperty(with(any(String.class)));
                will(returnValue(Maybe.empty()));
            allowing(provider).load("app.properties");
                will(returnValue(configuration));
        }});
        Config.setProvider(provider);
    }

    @After
    public void reset() {
        Config.setProvider(null);
    }

    @Test
    public void stringProperties() {
        Config config = new Config("app.properties");
        assertEquals(Maybe.of("demo"), config.get("app.name"));
        assertEquals("demo", config.get("app.name", "other"));
        assertEquals("other", config.get("app.missing", "other"));
        assertFalse(config.get("app.missing").isPresent());
    }

    @Test
    public void typedProperties() {
        Config config = new Config("app.properties");
        assertEquals(8080, config.getInt("app.port", 80));
        assertEquals(80, config.getInt("app.missing", 80));
        assertTrue(config.getBoolean("app.debug", false));
        assertTrue(config.getBoolean("app.missing", true));
    }

    @Test(expected = IllegalArgumentException.class)
    public void invalidIntegerIsRejected() {
        new Config("app.properties").getInt("app.bad", 80);
    }

    @Test
    public void resetRestoresDefaultProvider() {
        Config.setProvider(null);
        Config config = new Config("kestrel-test.properties");
        assertEquals(Maybe.of("kestrel-test-%d"), config.get(Config.ASYNC_THREAD_NAME_KEY));
    }
}
