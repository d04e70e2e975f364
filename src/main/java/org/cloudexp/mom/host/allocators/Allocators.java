/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host.allocators;

import org.cloudexp.mom.util.PluginRegistry;

import java.util.List;
import java.util.function.Function;

/// Allocators by the names used in the policy configuration; factories take the resource list
public class Allocators {
    public static final PluginRegistry<Function<List<String>, Allocator>> REGISTRY =
            new PluginRegistry<>("allocator");

    static {
        REGISTRY.register("InquiryAllocator", InquiryAllocator::new);
    }

    public static Allocator create(final String name, final List<String> resources) {
        return REGISTRY.get(name).apply(resources);
    }
}
