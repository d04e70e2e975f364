/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host.controllers;

import org.cloudexp.mom.monitor.MonitorDataEntity;

import java.util.List;

/// Applies the controls of one resource to the guests
public interface Controller {
    String getResource();

    void applyControl(MonitorDataEntity host, List<MonitorDataEntity> guests);
}
