/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host.allocators;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.monitor.MonitorDataEntity;
import org.cloudexp.mom.util.DictUtils;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/// Grants every guest exactly what it asked for in its inquiry answer
public class InquiryAllocator implements Allocator {
    private static final Logger LOG = LogManager.getLogger(InquiryAllocator.class);
    public static final String VAR_INQUIRY = "inquiry";

    private final Set<String> resources;

    public InquiryAllocator(final List<String> resources) {
        this.resources = new LinkedHashSet<>(resources);
    }

    @Override
    public void applyPolicy(final MonitorDataEntity host, final List<MonitorDataEntity> guests) {
        for (final MonitorDataEntity g : guests) {
            final Object inquiry = g.getVar(VAR_INQUIRY);
            if (!(inquiry instanceof Map)) {
                LOG.warn("No inquiry results for guest: {}", g.getName());
                continue;
            }
            final Map<String, Double> requested = DictUtils.toDoubleMap(inquiry);
            for (final String r : this.resources) {
                final Double value = requested.get(r);
                if (value != null) {
                    g.control(r, value);
                }
            }
        }
    }
}
