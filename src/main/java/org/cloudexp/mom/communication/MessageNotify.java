/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.cloudexp.mom.guest.GuestPolicy;
import org.cloudexp.mom.monitor.Monitor;

import java.util.HashMap;
import java.util.Map;

/**
 * The host tells the guest its allocation. A null grace period means the allocation is already
 * applied; otherwise the guest has that many seconds before it is.
 */
public class MessageNotify extends Message {
    public static final String KEY = "notify";

    public MessageNotify(final Map<String, ?> content) {
        super(content);
    }

    public MessageNotify(final Map<String, Double> alloc, final Double gracePeriod) {
        super(request(alloc, gracePeriod));
    }

    private static Map<String, Object> request(final Map<String, Double> alloc, final Double gracePeriod) {
        final Map<String, Object> ret = new HashMap<>();
        ret.put("alloc", new HashMap<>(alloc));
        ret.put("grace-period", gracePeriod);
        return ret;
    }

    @Override
    public RPCID id() {
        return RPCID.NOTIFY;
    }

    @Override
    public Map<String, Object> process(final Map<String, Object> data, final Monitor monitor,
            final GuestPolicy policy) {
        policy.notifyAllocation(MessageInquiry.mergeState(data, KEY, this.content));
        return new HashMap<>();
    }
}
