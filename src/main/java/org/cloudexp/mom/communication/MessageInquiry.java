/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.cloudexp.mom.guest.GuestPolicy;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.util.DictUtils;
import org.cloudexp.mom.util.TimeUtils;

import java.util.HashMap;
import java.util.Map;

/**
 * The host asks the guest how much of each resource it wants. The request carries the last
 * allocation, the grace period the host intends to give and the inquiry timeout.
 */
public class MessageInquiry extends Message {
    public static final String KEY = "inquiry";

    public MessageInquiry(final Map<String, ?> content) {
        super(content);
    }

    public MessageInquiry(final Map<String, ?> lastAlloc, final Double gracePeriod, final double timeout) {
        super(request(lastAlloc, gracePeriod, timeout));
    }

    private static Map<String, Object> request(final Map<String, ?> lastAlloc, final Double gracePeriod,
            final double timeout) {
        final Map<String, Object> ret = new HashMap<>();
        ret.put("last-alloc", lastAlloc == null ? new HashMap<>() : lastAlloc);
        ret.put("grace-period", gracePeriod);
        ret.put("timeout", timeout);
        return ret;
    }

    @Override
    public RPCID id() {
        return RPCID.INQUIRY;
    }

    @Override
    public Map<String, Object> process(final Map<String, Object> data, final Monitor monitor,
            final GuestPolicy policy) {
        final Map<String, Object> inquiry = mergeState(data, KEY, this.content);
        return new HashMap<>(policy.inquiry(inquiry));
    }

    /// Merge content into a state entry, stamping it with the update time; returns a copy of the result
    static Map<String, Object> mergeState(final Map<String, Object> data, final String key,
            final Map<String, Object> content) {
        synchronized (data) {
            final Map<String, Object> merged = DictUtils.deepCopy(DictUtils.getMap(data, key));
            merged.putAll(DictUtils.deepCopy(content));
            merged.put("update-time", TimeUtils.now());
            data.put(key, merged);
            return DictUtils.deepCopy(merged);
        }
    }
}
