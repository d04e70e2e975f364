/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 * Two-level configuration: sections of string keys and values. Files use the properties format with
 * keys written as {@code section.key}; a loaded value overrides the default of the same key.
 */
public class MomConfig {
    private static final Logger LOG = LogManager.getLogger(MomConfig.class);

    private final Map<String, Map<String, String>> sections = new LinkedHashMap<>();

    public synchronized MomConfig set(final String section, final String key, final Object value) {
        this.sections.computeIfAbsent(section, s -> new LinkedHashMap<>())
                .put(key, value == null ? "" : String.valueOf(value));
        return this;
    }

    public synchronized boolean has(final String section, final String key) {
        final Map<String, String> s = this.sections.get(section);
        return s != null && s.containsKey(key);
    }

    /// Raw value, or null if unset
    public synchronized String get(final String section, final String key) {
        final Map<String, String> s = this.sections.get(section);
        return s == null ? null : s.get(key);
    }

    public String getString(final String section, final String key, final String defaultValue) {
        final String value = get(section, key);
        return value == null ? defaultValue : value;
    }

    public double getDouble(final String section, final String key) {
        final String value = require(section, key);
        try {
            return Double.parseDouble(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Config %s.%s must be a number, got '%s'", section, key, value), e);
        }
    }

    public int getInt(final String section, final String key) {
        final String value = require(section, key);
        try {
            return Integer.parseInt(value.trim());
        } catch (final NumberFormatException e) {
            throw new IllegalArgumentException(
                    String.format("Config %s.%s must be an integer, got '%s'", section, key, value), e);
        }
    }

    public boolean getBoolean(final String section, final String key) {
        return Boolean.parseBoolean(require(section, key).trim());
    }

    /// Comma separated list, empty entries dropped
    public List<String> getList(final String section, final String key) {
        final String value = get(section, key);
        if (value == null) {
            return Collections.emptyList();
        }
        final List<String> ret = new ArrayList<>();
        for (final String item : value.split(",")) {
            if (!item.isBlank()) {
                ret.add(item.trim());
            }
        }
        return ret;
    }

    private String require(final String section, final String key) {
        final String value = get(section, key);
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(String.format("Missing config value %s.%s", section, key));
        }
        return value;
    }

    public synchronized MomConfig copy() {
        final MomConfig ret = new MomConfig();
        for (final Map.Entry<String, Map<String, String>> s : this.sections.entrySet()) {
            for (final Map.Entry<String, String> e : s.getValue().entrySet()) {
                ret.set(s.getKey(), e.getKey(), e.getValue());
            }
        }
        return ret;
    }

    /**
     * Override values from a properties file.
     *
     * @param path the file to read
     * @throws IOException if the file cannot be read
     */
    public void load(final Path path) throws IOException {
        final Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        for (final String name : props.stringPropertyNames()) {
            final int dot = name.indexOf('.');
            if (dot <= 0 || dot == name.length() - 1) {
                LOG.warn("Ignoring config key '{}' in {}: expected section.key", name, path);
                continue;
            }
            set(name.substring(0, dot), name.substring(dot + 1), props.getProperty(name).trim());
        }
        LOG.info("Loaded configuration from {}", path);
    }

    @Override
    public synchronized String toString() {
        return "MomConfig" + this.sections;
    }
}
