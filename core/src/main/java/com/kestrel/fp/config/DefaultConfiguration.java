/**
 * Cloudway Platform
 * Copyright (c) 2012-2013 Cloudway Technology, Inc.
 * All rights reserved.
 */

package com.kestrel.fp.config;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.Properties;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheLoader;
import com.google.common.cache.LoadingCache;
import com.google.common.io.Resources;

import com.kestrel.fp.data.Maybe;

import static java.util.Objects.requireNonNull;

/**
 * Properties loaded from a class path resource. System properties take
 * precedence over the values in the resource.
 */
class DefaultConfiguration implements Configuration
{
    private static final Logger logger = Logger.getLogger(DefaultConfiguration.class.getName());

    private final Properties props = new Properties();

    @Override
    public Maybe<String> getProperty(String name) {
        Maybe<String> val = Maybe.ofNullable(System.getProperty(name));
        return val.isPresent() ? val : Maybe.ofNullable(props.getProperty(name));
    }

    @Override
    public String toString() {
        return props.toString();
    }

    static class ConfigurationLoader extends CacheLoader<String, DefaultConfiguration> {
        @Override
        public DefaultConfiguration load(String name) {
            DefaultConfiguration conf = new DefaultConfiguration();
            URL url = resource(name);
            if (url == null) {
                // use defaults if configuration file not found
                logger.config("Configuration " + name + " not found, using defaults");
                return conf;
            }

            try (InputStream in = Resources.asByteSource(url).openStream()) {
                conf.props.load(in);
            } catch (IOException ex) {
                logger.log(Level.WARNING, "Failed to load configuration from " + url, ex);
            }
            return conf;
        }

        private static URL resource(String name) {
            ClassLoader loader = Thread.currentThread().getContextClassLoader();
            if (loader == null)
                loader = DefaultConfiguration.class.getClassLoader();
            return loader.getResource(name);
        }
    }

    @SuppressWarnings("ClassNameSameAsAncestorName")
    static class Provider implements Configuration.Provider {
        private final LoadingCache<String, DefaultConfiguration> cache =
            CacheBuilder.newBuilder().build(new ConfigurationLoader());

        @Override
        public Configuration load(String name) {
            return cache.getUnchecked(requireNonNull(name));
        }
    }
}
