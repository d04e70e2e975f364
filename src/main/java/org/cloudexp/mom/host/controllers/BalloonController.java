/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host.controllers;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.hypervisor.DomainInfo;
import org.cloudexp.mom.hypervisor.HypervisorException;
import org.cloudexp.mom.hypervisor.HypervisorInterface;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.monitor.MonitorDataEntity;
import org.cloudexp.mom.util.MemoryUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

/**
 * Resizes guest memory balloons through the hypervisor. Guests that shrink go first, so that
 * memory is released before it is handed out.
 */
public class BalloonController implements Controller {
    private static final Logger LOG = LogManager.getLogger(BalloonController.class);
    /// Changes smaller than this (MB) are not worth a balloon operation
    static final double BALLOON_EPSILON = 5;

    private final String resource;
    private final HypervisorInterface hypervisor;

    public BalloonController(final String resource, final Map<String, Object> properties) {
        final Object hypervisor = properties.get(Monitor.PROP_HYPERVISOR);
        if (!(hypervisor instanceof HypervisorInterface)) {
            throw new IllegalArgumentException("Balloon controller requires the '" + Monitor.PROP_HYPERVISOR
                    + "' property");
        }
        this.resource = resource;
        this.hypervisor = (HypervisorInterface) hypervisor;
    }

    @Override
    public String getResource() {
        return this.resource;
    }

    @Override
    public void applyControl(final MonitorDataEntity host, final List<MonitorDataEntity> guests) {
        final List<MonitorDataEntity> sorted = new ArrayList<>(guests);
        sorted.sort(Comparator.comparingDouble(this::sortKey));
        for (final MonitorDataEntity guest : sorted) {
            try {
                applyGuestControl(guest);
            } catch (final HypervisorException e) {
                LOG.warn("Error while ballooning {} ({} -> {}): {}", guest.getName(), this.resource,
                        guest.getControl(this.resource), e.getMessage());
            }
        }
    }

    /// target - current; negative values (shrinking guests) sort first
    double sortKey(final MonitorDataEntity guest) {
        final Double target = guest.getControl(this.resource);
        if (target == null) {
            return 0;
        }
        final Double current = currentMemory(guest);
        return current == null ? 0 : target - current;
    }

    /// Last collected memory of the guest, or the hypervisor's view before the first collection
    private Double currentMemory(final MonitorDataEntity guest) {
        final Object stat = guest.stat("hypervisor", "curmem");
        if (stat instanceof Number) {
            return ((Number) stat).doubleValue();
        }
        final Object id = guest.prop(Monitor.PROP_ID);
        if (!(id instanceof Integer)) {
            return null;
        }
        try {
            return this.hypervisor.getDomainInfo((Integer) id).getCurMemMb();
        } catch (final HypervisorException e) {
            LOG.debug("No current memory for {}: {}", guest.getName(), e.getMessage());
            return null;
        }
    }

    void applyGuestControl(final MonitorDataEntity guest) throws HypervisorException {
        final Object id = guest.prop(Monitor.PROP_ID);
        Double target = guest.getControl(this.resource);
        if (!(id instanceof Integer) || target == null) {
            return;
        }
        final int guestId = (Integer) id;

        final DomainInfo info = this.hypervisor.getDomainInfo(guestId);
        final double maxMem = info.getMaxMemMb();
        final double curMem = info.getCurMemMb();

        // Hard limit of the domain
        if (target > maxMem) {
            LOG.warn("{} reached its memory limit ({} MB)", guest.getName(), maxMem);
            target = maxMem;
            guest.control(this.resource, target);
        }

        if (MemoryUtils.isMemoryClose(target, curMem, BALLOON_EPSILON)) {
            return;
        }

        LOG.debug("Ballooning {}: from {} to {} MB", guest.getName(), curMem, target);
        this.hypervisor.setMemory(guestId, (long) (target * MemoryUtils.KIB_IN_MB));
    }
}
