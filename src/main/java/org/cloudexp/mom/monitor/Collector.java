/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor;

import java.util.Map;

/// One source of statistics for a monitor
public interface Collector {
    /// Collect one record; nested maps are merged with the records of the other collectors
    Map<String, Object> collect() throws CollectionError;
}
