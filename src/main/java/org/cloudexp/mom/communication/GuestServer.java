/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.guest.GuestPolicy;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.rpc.TCPServer;
import org.cloudexp.mom.util.DictUtils;
import org.cloudexp.mom.util.TimeUtils;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

/**
 * The guest side of the host/guest protocol. Keeps the state the messages share (last inquiry,
 * last notification, application target) and answers every connection from the same state.
 */
public class GuestServer {
    private static final Logger LOG = LogManager.getLogger(GuestServer.class);

    private final Monitor monitor;
    private final GuestPolicy policy;
    private final String name;
    /// Guarded by itself
    private final Map<String, Object> data = new HashMap<>();
    private TCPServer<GuestServer> server = null;

    public GuestServer(final Monitor monitor, final GuestPolicy policy, final String name) {
        this.monitor = monitor;
        this.policy = policy;
        this.name = name;
    }

    /**
     * Open the listening socket and register a handler for every message kind.
     *
     * @param host address to bind
     * @param port port to bind, 0 picks a free one
     * @throws IOException if the socket cannot be bound
     */
    public void bind(final String host, final int port) throws IOException {
        this.server = new TCPServer<>(host, port);
        final MessageHandler handler = new MessageHandler();
        for (final RPCID id : RPCID.values()) {
            this.server.register(id, handler);
        }
        LOG.info("{}: guest server bound to {}:{}", this.name, host, this.server.getLocalPort());
    }

    /// Serve until {@link #shutdown()}
    public void serveForever() throws IOException {
        if (this.server == null) {
            throw new IllegalStateException("Guest server is not bound");
        }
        this.server.runServer(this);
    }

    public void shutdown() {
        if (this.server != null) {
            this.server.stopServer();
        }
    }

    public int getLocalPort() {
        return this.server == null ? -1 : this.server.getLocalPort();
    }

    public MessageResponse processMessage(final Message message) {
        final double startProcess = TimeUtils.now();
        MessageResponse response;
        try {
            response = MessageResponse.success(message.process(this.data, this.monitor, this.policy));
        } catch (final Exception e) {
            LOG.error("{}: failed to process message {}", this.name, message, e);
            response = MessageResponse.failure(e.getMessage() == null ? e.toString() : e.getMessage());
        }
        response.setProcessTime(TimeUtils.now() - startProcess);
        return response;
    }

    /// A copy of the shared message state
    public Map<String, Object> interrogate() {
        synchronized (this.data) {
            return DictUtils.deepCopy(this.data);
        }
    }
}
