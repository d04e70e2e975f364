/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.guest.GuestPolicy;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.util.DictUtils;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * The host asks for the guest's statistics. The guest answers with a fresh collection merged over
 * its server state, compressed into the {@code monitor} field.
 */
public class MessageStats extends Message {
    private static final Logger LOG = LogManager.getLogger(MessageStats.class);
    public static final String KEY = "monitor";

    public MessageStats(final Map<String, ?> content) {
        super(content);
    }

    public MessageStats() {
        super();
    }

    @Override
    public RPCID id() {
        return RPCID.STATS;
    }

    @Override
    public Map<String, Object> process(final Map<String, Object> data, final Monitor monitor,
            final GuestPolicy policy) throws IOException {
        Map<String, Object> monitorData = null;
        try {
            monitorData = monitor.collect();
        } catch (final RuntimeException e) {
            LOG.error("Error collecting data: {}", e.toString());
        }

        final Map<String, Object> ret;
        synchronized (data) {
            ret = DictUtils.deepCopy(data);
        }
        DictUtils.recursiveUpdate(ret, monitorData);

        final Map<String, Object> response = new HashMap<>();
        response.put(KEY, MessageCodec.compress(ret));
        return response;
    }

    /// Host side: unpack the statistics from a response
    public static Map<String, Object> unpack(final Map<String, Object> response) throws MessageError {
        final Object packed = response.get(KEY);
        if (!(packed instanceof String)) {
            throw new MessageError("Stats response is missing the '" + KEY + "' field");
        }
        try {
            return MessageCodec.decompress((String) packed);
        } catch (final IOException e) {
            throw new MessageError("Failed to unpack stats: " + e.getMessage(), e);
        }
    }
}
