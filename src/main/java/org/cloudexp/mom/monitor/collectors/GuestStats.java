/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor.collectors;

import org.cloudexp.mom.communication.GuestClient;
import org.cloudexp.mom.communication.MessageError;
import org.cloudexp.mom.communication.MessageStats;
import org.cloudexp.mom.monitor.CollectionError;
import org.cloudexp.mom.monitor.Collector;
import org.cloudexp.mom.monitor.Monitor;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * Runs on the host and asks the guest server for its statistics. Failures before the first
 * successful answer are expected while the guest boots and yield an empty record.
 */
public class GuestStats implements Collector {
    private final GuestClient guestClient;
    private boolean guestReady = false;

    public GuestStats(final Map<String, Object> properties) {
        final Object client = properties.get(Monitor.PROP_GUEST_CLIENT);
        if (!(client instanceof GuestClient)) {
            throw new IllegalArgumentException("GuestStats requires the '" + Monitor.PROP_GUEST_CLIENT
                    + "' property");
        }
        this.guestClient = (GuestClient) client;
    }

    @Override
    public Map<String, Object> collect() throws CollectionError {
        final Map<String, Object> response;
        try {
            response = this.guestClient.sendReceiveMessage(new MessageStats());
        } catch (final IOException | MessageError e) {
            if (this.guestReady) {
                throw new CollectionError("Failed to get stats from " + this.guestClient.getName(), e);
            }
            return new HashMap<>();
        }
        this.guestReady = true;
        try {
            return MessageStats.unpack(response);
        } catch (final MessageError e) {
            throw new CollectionError(e.getMessage(), e);
        }
    }
}
