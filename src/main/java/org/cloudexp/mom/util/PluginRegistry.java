/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Maps the plugin names used in the configuration to their factories. Plugins are added by
 * explicit registration calls.
 *
 * @param <F> the factory type
 */
public class PluginRegistry<F> {
    private final String kind;
    private final Map<String, F> factories = new ConcurrentSkipListMap<>();

    public PluginRegistry(final String kind) {
        this.kind = kind;
    }

    /**
     * Register a factory under a name.
     *
     * @param name    the name used in the configuration
     * @param factory the factory
     * @return false if the name is already taken
     */
    public boolean register(final String name, final F factory) {
        return this.factories.putIfAbsent(name, factory) == null;
    }

    public boolean unregister(final String name) {
        return this.factories.remove(name) != null;
    }

    /**
     * @param name the configured name, surrounding whitespace is ignored
     * @return the factory
     * @throws IllegalArgumentException if no such plugin was registered
     */
    public F get(final String name) {
        final F factory = name == null ? null : this.factories.get(name.trim());
        if (factory == null) {
            throw new IllegalArgumentException(String.format("No such %s: '%s'. Choose one of the following: %s",
                    this.kind, name, names()));
        }
        return factory;
    }

    public Set<String> names() {
        return this.factories.keySet();
    }
}
