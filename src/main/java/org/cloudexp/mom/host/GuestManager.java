/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.communication.GuestClient;
import org.cloudexp.mom.communication.GuestClientFactory;
import org.cloudexp.mom.hypervisor.HypervisorException;
import org.cloudexp.mom.hypervisor.HypervisorInterface;
import org.cloudexp.mom.monitor.GuestMonitor;
import org.cloudexp.mom.monitor.MonitorDataEntity;
import org.cloudexp.mom.util.LoggedThread;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;
import org.cloudexp.mom.util.TimeUtils;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Keeps one {@link GuestMonitor} per running domain. New domains get a monitor on the next poll;
 * monitors of vanished domains are terminated, and monitors whose thread died are dropped.
 */
public class GuestManager extends LoggedThread {
    private static final Logger LOG = LogManager.getLogger(GuestManager.class);
    private static final long JOIN_TIMEOUT_MILLIS = 5000;

    private final MomConfig config;
    private final HypervisorInterface hypervisor;
    private final GuestClientFactory clientFactory;
    private final Terminable terminable;
    private final int maxGuests;

    private final Object guestMonitorsLock = new Object();
    private final Map<Integer, GuestMonitor> guestMonitors = new TreeMap<>();

    public GuestManager(final MomConfig config, final HypervisorInterface hypervisor,
            final GuestClientFactory clientFactory, final Terminable terminable) {
        super("GuestManager");
        this.config = config;
        this.hypervisor = hypervisor;
        this.clientFactory = clientFactory != null ? clientFactory
                : (address, name) -> GuestClient.create(address, name, config);
        this.terminable = terminable;
        this.maxGuests = config.getInt("guest-manager", "max-guests");
    }

    public GuestManager(final MomConfig config, final HypervisorInterface hypervisor, final Terminable terminable) {
        this(config, hypervisor, null, terminable);
    }

    /// Guest name to readiness of every tracked monitor
    public Map<String, Boolean> getGuestsReadiness() {
        final Map<String, Boolean> ret = new HashMap<>();
        synchronized (this.guestMonitorsLock) {
            for (final GuestMonitor m : this.guestMonitors.values()) {
                ret.put(m.getName(), m.isReady());
            }
        }
        return ret;
    }

    public int getGuestCount() {
        synchronized (this.guestMonitorsLock) {
            return this.guestMonitors.size();
        }
    }

    /**
     * Spawn monitors for domains that are not tracked yet. The monitor constructor talks to the
     * hypervisor, so it runs without holding the lock.
     *
     * @param domainIds the running domains
     */
    void spawnGuestMonitors(final Collection<Integer> domainIds) {
        final List<Integer> spawnList = new ArrayList<>();
        int free;
        synchronized (this.guestMonitorsLock) {
            free = this.maxGuests - this.guestMonitors.size();
            for (final Integer id : domainIds) {
                if (!this.guestMonitors.containsKey(id)) {
                    spawnList.add(id);
                }
            }
        }

        for (final Integer guestId : spawnList) {
            if (free <= 0) {
                LOG.warn("Reached the maximum of {} guests, not monitoring guest {}", this.maxGuests, guestId);
                continue;
            }
            final Terminable guestTerminable = this.terminable.child();
            final GuestMonitor monitor;
            try {
                monitor = new GuestMonitor(this.config, guestId, this.hypervisor, this.clientFactory,
                        guestTerminable);
            } catch (final HypervisorException | RuntimeException e) {
                LOG.error("Failed to create a monitor for guest {}: {}", guestId, e.toString());
                guestTerminable.terminate();
                continue;
            }
            monitor.start();
            boolean added = false;
            if (monitor.isAlive()) {
                synchronized (this.guestMonitorsLock) {
                    if (!this.guestMonitors.containsKey(guestId)) {
                        this.guestMonitors.put(guestId, monitor);
                        added = true;
                    }
                }
            }
            if (added) {
                free--;
                LOG.info("Monitoring guest {} ({})", monitor.getName(), guestId);
            } else {
                monitor.terminate();
            }
        }
    }

    /**
     * Drop monitors whose thread died and terminate the monitors of vanished domains.
     *
     * @param domainIds the running domains
     */
    void checkThreads(final Collection<Integer> domainIds) {
        final Set<Integer> running = new HashSet<>(domainIds);
        synchronized (this.guestMonitorsLock) {
            this.guestMonitors.entrySet().removeIf(e -> {
                final GuestMonitor monitor = e.getValue();
                if (!monitor.isAlive()) {
                    LOG.info("Monitor of guest {} ended", monitor.getName());
                    return true;
                }
                if (!running.contains(e.getKey())) {
                    LOG.info("Guest {} is gone", monitor.getName());
                    monitor.terminate();
                    return true;
                }
                return false;
            });
        }
    }

    /**
     * Snapshot every ready guest.
     *
     * @return guest id to entity
     */
    public Map<Integer, MonitorDataEntity> interrogate() {
        final Map<Integer, MonitorDataEntity> ret = new TreeMap<>();
        synchronized (this.guestMonitorsLock) {
            for (final Map.Entry<Integer, GuestMonitor> e : this.guestMonitors.entrySet()) {
                if (!e.getValue().isReady()) {
                    continue;
                }
                final MonitorDataEntity entity = e.getValue().interrogate();
                if (entity != null) {
                    ret.put(e.getKey(), entity);
                }
            }
        }
        return ret;
    }

    /// Poll the hypervisor once
    void poll() {
        try {
            final List<Integer> domainIds = this.hypervisor.listDomainIds();
            spawnGuestMonitors(domainIds);
            checkThreads(domainIds);
        } catch (final HypervisorException e) {
            LOG.error("Failed to list the running domains: {}", e.getMessage());
        }
    }

    private void waitForGuestMonitors() {
        final List<GuestMonitor> monitors;
        synchronized (this.guestMonitorsLock) {
            monitors = new ArrayList<>(this.guestMonitors.values());
            this.guestMonitors.clear();
        }
        for (final GuestMonitor m : monitors) {
            m.terminate();
        }
        for (final GuestMonitor m : monitors) {
            try {
                m.join(JOIN_TIMEOUT_MILLIS);
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    @Override
    protected void loggedRun() {
        final double interval = this.config.getDouble("guest-manager", "interval");
        try {
            while (this.terminable.shouldRun()) {
                final double start = TimeUtils.now();
                poll();
                this.terminable.sleep(interval - (TimeUtils.now() - start));
            }
        } finally {
            waitForGuestMonitors();
        }
    }
}
