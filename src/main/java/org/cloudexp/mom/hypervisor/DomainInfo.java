/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.hypervisor;

import org.cloudexp.mom.util.MemoryUtils;

public class DomainInfo {
    private final int id;
    private final String name;
    private final String uuid;
    private final String state;
    private final long maxMemKib;
    private final long curMemKib;

    public DomainInfo(final int id, final String name, final String uuid, final String state,
            final long maxMemKib, final long curMemKib) {
        this.id = id;
        this.name = name;
        this.uuid = uuid;
        this.state = state;
        this.maxMemKib = maxMemKib;
        this.curMemKib = curMemKib;
    }

    public int getId() {
        return this.id;
    }

    public String getName() {
        return this.name;
    }

    public String getUuid() {
        return this.uuid;
    }

    public String getState() {
        return this.state;
    }

    public long getMaxMemKib() {
        return this.maxMemKib;
    }

    public long getCurMemKib() {
        return this.curMemKib;
    }

    public double getMaxMemMb() {
        return this.maxMemKib / MemoryUtils.KIB_IN_MB;
    }

    public double getCurMemMb() {
        return this.curMemKib / MemoryUtils.KIB_IN_MB;
    }

    /// Address of the guest server; guests are reachable by their domain name
    public String getAddress() {
        return this.name;
    }

    @Override
    public String toString() {
        return String.format("DomainInfo(id=%d, name=%s, state=%s, maxmem=%d KiB, curmem=%d KiB)",
                this.id, this.name, this.state, this.maxMemKib, this.curMemKib);
    }
}
