/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.cloudexp.mom.guest.GuestPolicy;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.util.DictUtils;

import java.util.HashMap;
import java.util.Map;

/// Report the gap between the allocated resource and what the guest actually sees
public class MessageUpdateResourceDiff extends Message {
    public MessageUpdateResourceDiff(final Map<String, ?> content) {
        super(content);
    }

    public MessageUpdateResourceDiff(final String resource, final double diff) {
        super(Map.of(resource, diff));
    }

    @Override
    public RPCID id() {
        return RPCID.UPDATE_RESOURCE_DIFF;
    }

    @Override
    public Map<String, Object> process(final Map<String, Object> data, final Monitor monitor,
            final GuestPolicy policy) {
        policy.updateResourceDiff(DictUtils.toDoubleMap(this.content));
        return new HashMap<>();
    }
}
