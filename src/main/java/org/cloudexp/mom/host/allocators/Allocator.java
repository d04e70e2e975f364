/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host.allocators;

import org.cloudexp.mom.monitor.MonitorDataEntity;

import java.util.List;

/// Computes the controls of every guest for one policy cycle
public interface Allocator {
    /// Write the controls of this cycle into the entities
    void applyPolicy(MonitorDataEntity host, List<MonitorDataEntity> guests);
}
