/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.rpc.RPCHandler;
import org.cloudexp.mom.rpc.RPCMessage;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.Map;

/// Decodes a frame into a message, has the guest server process it and encodes the envelope back
public class MessageHandler extends RPCHandler<GuestServer> {
    private static final Logger LOG = LogManager.getLogger(MessageHandler.class);

    @Override
    public RPCMessage handleRPC(final RPCMessage msg, final GuestServer server) {
        MessageResponse response;
        final RPCID id = RPCID.fromId(msg.hdr().getType());
        if (id == null) {
            response = MessageResponse.failure("Unknown message type " + msg.hdr().getType());
        } else {
            try {
                final Map<String, Object> content = MessageCodec.decode(msg.payload());
                response = server.processMessage(MessageCodec.toMessage(id, content));
            } catch (final IOException e) {
                LOG.warn("Malformed {} payload: {}", id, e.toString());
                response = MessageResponse.failure("Malformed payload: " + e.getMessage());
            }
        }
        try {
            return msg.reply(MessageCodec.encode(response.toMap()));
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to encode response to " + id, e);
        }
    }
}
