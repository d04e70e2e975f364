/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor;

import org.cloudexp.mom.monitor.collectors.CpuUsage;
import org.cloudexp.mom.monitor.collectors.GuestHypervisorStats;
import org.cloudexp.mom.monitor.collectors.GuestStats;
import org.cloudexp.mom.monitor.collectors.MemoryStatistics;
import org.cloudexp.mom.util.PluginRegistry;

import java.util.Map;
import java.util.function.Function;

/// Collectors by the names used in the monitor configuration
public class Collectors {
    public static final PluginRegistry<Function<Map<String, Object>, Collector>> REGISTRY =
            new PluginRegistry<>("collector");

    static {
        REGISTRY.register("MemoryStatistics", props -> new MemoryStatistics());
        REGISTRY.register("CpuUsage", props -> new CpuUsage());
        REGISTRY.register("GuestStats", GuestStats::new);
        REGISTRY.register("GuestHypervisorStats", GuestHypervisorStats::new);
    }

    /**
     * @param name       the configured name
     * @param properties the properties of the owning monitor
     * @return a new collector
     * @throws IllegalArgumentException if the name is unknown or the properties do not fit the collector
     */
    public static Collector create(final String name, final Map<String, Object> properties) {
        return REGISTRY.get(name).apply(properties);
    }
}
