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

/// Wait up to a timeout for a new host notification, then answer with the latest one
public class MessageTargetAllocation extends Message {
    public static final String NEW_NOTIFICATION = "is-new-notification";

    public MessageTargetAllocation(final Map<String, ?> content) {
        super(content);
    }

    public MessageTargetAllocation(final Double timeout) {
        super(new HashMap<>());
        this.content.put("timeout", timeout);
    }

    @Override
    public RPCID id() {
        return RPCID.TARGET_ALLOCATION;
    }

    @Override
    public Map<String, Object> process(final Map<String, Object> data, final Monitor monitor,
            final GuestPolicy policy) {
        final boolean isNew = policy.waitForNotify(DictUtils.getDouble(this.content, "timeout"));
        final Map<String, Object> notification;
        synchronized (data) {
            notification = DictUtils.deepCopy(DictUtils.getMap(data, MessageNotify.KEY));
        }
        notification.put(NEW_NOTIFICATION, isNew);
        return notification;
    }
}
