/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor.collectors;

import org.cloudexp.mom.hypervisor.DomainInfo;
import org.cloudexp.mom.hypervisor.HypervisorException;
import org.cloudexp.mom.hypervisor.HypervisorInterface;
import org.cloudexp.mom.monitor.CollectionError;
import org.cloudexp.mom.monitor.Collector;
import org.cloudexp.mom.monitor.Monitor;

import java.util.HashMap;
import java.util.Map;

/// Domain state and memory sizes (MB) as the hypervisor sees them, under {@code hypervisor}
public class GuestHypervisorStats implements Collector {
    private final HypervisorInterface hypervisor;
    private final int guestId;

    public GuestHypervisorStats(final Map<String, Object> properties) {
        final Object hypervisor = properties.get(Monitor.PROP_HYPERVISOR);
        final Object id = properties.get(Monitor.PROP_ID);
        if (!(hypervisor instanceof HypervisorInterface) || !(id instanceof Integer)) {
            throw new IllegalArgumentException("GuestHypervisorStats requires the '" + Monitor.PROP_HYPERVISOR
                    + "' and '" + Monitor.PROP_ID + "' properties");
        }
        this.hypervisor = (HypervisorInterface) hypervisor;
        this.guestId = (Integer) id;
    }

    @Override
    public Map<String, Object> collect() throws CollectionError {
        final DomainInfo info;
        try {
            info = this.hypervisor.getDomainInfo(this.guestId);
        } catch (final HypervisorException e) {
            throw new CollectionError("Failed to get domain info of " + this.guestId, e);
        }
        final Map<String, Object> stats = new HashMap<>();
        stats.put("state", info.getState());
        stats.put("maxmem", info.getMaxMemMb());
        stats.put("curmem", info.getCurMemMb());
        final Map<String, Object> ret = new HashMap<>();
        ret.put("hypervisor", stats);
        return ret;
    }
}
