/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.hypervisor;

import java.util.List;

/// The few hypervisor operations the manager needs: discovery, domain info and ballooning
public interface HypervisorInterface {
    /// Ids of the running domains
    List<Integer> listDomainIds() throws HypervisorException;

    /// Info of a running domain
    DomainInfo getDomainInfo(int domainId) throws HypervisorException;

    /// Set the balloon target of a domain
    void setMemory(int domainId, long memoryKib) throws HypervisorException;
}
