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
 * A request sent from a host (or a guest-resident application) to a guest server. The content is a
 * free-form map; the receiver runs {@link #process(Map, Monitor, GuestPolicy)} and sends back the
 * returned map.
 */
public abstract class Message {
    protected final Map<String, Object> content;

    protected Message(final Map<String, ?> content) {
        this.content = content == null ? new HashMap<>() : new HashMap<>(content);
    }

    protected Message() {
        this(null);
    }

    /// The wire type of this message
    public abstract RPCID id();

    public Map<String, Object> getContent() {
        return this.content;
    }

    /**
     * Run on the receiver's side.
     *
     * @param data    the guest server state shared by all connections
     * @param monitor the guest's local monitor
     * @param policy  the guest's policy
     * @return the response content
     * @throws Exception anything thrown is reported back to the sender as a failed message
     */
    public Map<String, Object> process(final Map<String, Object> data, final Monitor monitor,
            final GuestPolicy policy) throws Exception {
        return new HashMap<>();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.content + ")";
    }
}
