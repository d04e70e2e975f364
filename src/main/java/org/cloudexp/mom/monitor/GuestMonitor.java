/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.communication.GuestClient;
import org.cloudexp.mom.communication.GuestClientFactory;
import org.cloudexp.mom.communication.MessageError;
import org.cloudexp.mom.communication.MessageNotify;
import org.cloudexp.mom.hypervisor.DomainInfo;
import org.cloudexp.mom.hypervisor.HypervisorException;
import org.cloudexp.mom.hypervisor.HypervisorInterface;
import org.cloudexp.mom.util.LoggedThread;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;
import org.cloudexp.mom.util.TimeUtils;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Collects statistics about one running guest. The monitor becomes ready once the guest server
 * answers and has been told its current memory allocation.
 */
public class GuestMonitor extends Monitor {
    private static final Logger LOG = LogManager.getLogger(GuestMonitor.class);
    static final double READINESS_TIMEOUT = 3;
    static final int READINESS_RETRIES = 24;

    private final int guestId;
    private final HypervisorInterface hypervisor;
    private final GuestClient guestClient;
    private final double interval;
    private final LoggedThread thread;

    /**
     * @param config      the daemon configuration
     * @param guestId     the domain id
     * @param hypervisor  the hypervisor running the domain
     * @param factory     creates the client to the guest server
     * @param terminable  the token of this guest alone
     * @throws HypervisorException if the domain info cannot be read
     */
    public GuestMonitor(final MomConfig config, final int guestId, final HypervisorInterface hypervisor,
            final GuestClientFactory factory, final Terminable terminable) throws HypervisorException {
        this(config, guestId, hypervisor, factory, hypervisor.getDomainInfo(guestId), terminable);
    }

    private GuestMonitor(final MomConfig config, final int guestId, final HypervisorInterface hypervisor,
            final GuestClientFactory factory, final DomainInfo info, final Terminable terminable) {
        this(config, guestId, hypervisor, info, factory.create(info.getAddress(), info.getName()), terminable);
    }

    private GuestMonitor(final MomConfig config, final int guestId, final HypervisorInterface hypervisor,
            final DomainInfo info, final GuestClient guestClient, final Terminable terminable) {
        super(config, info.getName(), info.getName(), properties(config, guestId, hypervisor, info, guestClient),
                config.getList("guest-monitor", "collectors"), terminable);
        this.guestId = guestId;
        this.hypervisor = hypervisor;
        this.guestClient = guestClient;
        this.interval = config.getDouble("guest-monitor", "interval");
        this.thread = new LoggedThread("GuestMonitor-" + info.getName(), this::run);
    }

    private static Map<String, Object> properties(final MomConfig config, final int guestId,
            final HypervisorInterface hypervisor, final DomainInfo info, final GuestClient guestClient) {
        final Map<String, Object> ret = new HashMap<>();
        ret.put(PROP_ID, guestId);
        ret.put(PROP_HYPERVISOR, hypervisor);
        ret.put(PROP_GUEST_CLIENT, guestClient);
        ret.put(PROP_INTERVAL, config.getDouble("guest-monitor", "interval"));
        ret.put("uuid", info.getUuid());
        ret.put("address", info.getAddress());
        return ret;
    }

    public int getGuestId() {
        return this.guestId;
    }

    public GuestClient getGuestClient() {
        return this.guestClient;
    }

    /**
     * Wait for the guest server, then notify it of its current allocation.
     *
     * @return false if terminated while waiting
     */
    boolean checkGuestReadiness() throws IOException, MessageError, HypervisorException {
        LOG.debug("{}: checking readiness", getName());
        final double readinessInterval = this.config.getDouble("guest-monitor", "check-readiness-interval");
        if (!this.guestClient.waitForServer(readinessInterval, READINESS_TIMEOUT, READINESS_RETRIES,
                this.terminable)) {
            return false;
        }
        final double curMem = this.hypervisor.getDomainInfo(this.guestId).getCurMemMb();
        final Map<String, Double> alloc = new HashMap<>();
        alloc.put("memory", curMem);
        this.guestClient.sendReceiveMessage(new MessageNotify(alloc, null));
        setReady();
        return true;
    }

    private void run() {
        try {
            if (!checkGuestReadiness()) {
                return;
            }
            LOG.debug("{}: monitor interval: {} sec", getName(), this.interval);
            while (this.terminable.shouldRun()) {
                final double start = TimeUtils.now();
                collect();
                this.terminable.sleep(this.interval - (TimeUtils.now() - start));
            }
        } catch (final IOException | MessageError | HypervisorException e) {
            setNotReady("Guest monitor failed: " + e);
        } finally {
            this.guestClient.close();
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
