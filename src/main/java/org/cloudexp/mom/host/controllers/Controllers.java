/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host.controllers;

import org.cloudexp.mom.util.PluginRegistry;

import java.util.Map;
import java.util.function.BiFunction;

/// Controllers by the names used in {@code policy.<resource>-controller}
public class Controllers {
    public static final PluginRegistry<BiFunction<String, Map<String, Object>, Controller>> REGISTRY =
            new PluginRegistry<>("controller");

    static {
        REGISTRY.register("Balloon", BalloonController::new);
    }

    /**
     * @param name       the configured name
     * @param resource   the resource the controller applies
     * @param properties shared objects, see {@link org.cloudexp.mom.host.HostPolicy}
     * @return a new controller
     */
    public static Controller create(final String name, final String resource, final Map<String, Object> properties) {
        return REGISTRY.get(name).apply(resource, properties);
    }
}
