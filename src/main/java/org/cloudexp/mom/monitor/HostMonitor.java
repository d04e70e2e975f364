/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor;

import org.cloudexp.mom.hypervisor.HypervisorInterface;
import org.cloudexp.mom.util.LoggedThread;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;
import org.cloudexp.mom.util.TimeUtils;

import java.util.HashMap;
import java.util.Map;

/// Collects statistics about the host at a fixed interval. Ready as soon as it is created.
public class HostMonitor extends Monitor {
    private final double interval;
    private final LoggedThread thread;

    public HostMonitor(final MomConfig config, final HypervisorInterface hypervisor, final Terminable terminable) {
        super(config, "host", "host", properties(config, hypervisor),
                config.getList("host-monitor", "collectors"), terminable);
        this.interval = config.getDouble("host-monitor", "interval");
        this.thread = new LoggedThread("HostMonitor", this::run);
        setReady();
    }

    private static Map<String, Object> properties(final MomConfig config, final HypervisorInterface hypervisor) {
        final Map<String, Object> ret = new HashMap<>();
        ret.put(PROP_INTERVAL, config.getDouble("host-monitor", "interval"));
        if (hypervisor != null) {
            ret.put(PROP_HYPERVISOR, hypervisor);
        }
        return ret;
    }

    private void run() {
        while (this.terminable.shouldRun()) {
            final double start = TimeUtils.now();
            collect();
            this.terminable.sleep(this.interval - (TimeUtils.now() - start));
        }
    }

    public void start() {
        this.thread.start();
    }

    public boolean isAlive() {
        return this.thread.isAlive();
    }

    public void join(final long millis) throws InterruptedException {
        this.thread.join(millis);
    }
}
