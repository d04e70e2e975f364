/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.cloudexp.mom.guest.GuestPolicy;
import org.cloudexp.mom.monitor.Monitor;

import java.util.HashMap;
import java.util.Map;

/// Report the resource level the guest-resident application settled on
public class MessageUpdateApplicationTarget extends Message {
    public static final String KEY = "app-target";

    public MessageUpdateApplicationTarget(final Map<String, ?> content) {
        super(content);
    }

    public MessageUpdateApplicationTarget(final String resource, final double target) {
        super(Map.of(resource, target));
    }

    @Override
    public RPCID id() {
        return RPCID.UPDATE_APPLICATION_TARGET;
    }

    @Override
    public Map<String, Object> process(final Map<String, Object> data, final Monitor monitor,
            final GuestPolicy policy) {
        MessageInquiry.mergeState(data, KEY, this.content);
        return new HashMap<>();
    }
}
