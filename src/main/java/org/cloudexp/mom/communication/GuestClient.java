/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.rpc.RPCClient;
import org.cloudexp.mom.rpc.TCPClient;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;
import org.cloudexp.mom.util.TimeUtils;

import java.io.IOException;
import java.util.Map;

/**
 * Sends messages to one guest server and validates the answers. Calls are serialized: at most one
 * message is in flight per client.
 */
public class GuestClient {
    private static final Logger LOG = LogManager.getLogger(GuestClient.class);

    private final String name;
    private final RPCClient client;
    private final Double defaultTimeout;

    /**
     * @param name           used in log lines
     * @param client         the transport
     * @param defaultTimeout seconds to wait for an answer, null waits forever
     */
    public GuestClient(final String name, final RPCClient client, final Double defaultTimeout) {
        this.name = name;
        this.client = client;
        this.defaultTimeout = defaultTimeout;
    }

    /// A TCP client using the guest-client section of the configuration
    public static GuestClient create(final String host, final String name, final MomConfig config) {
        final int port = config.getInt("guest-client", "port");
        final double timeout = config.getDouble("guest-client", "timeout");
        return new GuestClient(name, new TCPClient(host, port), timeout);
    }

    public String getName() {
        return this.name;
    }

    public Map<String, Object> sendReceiveMessage(final Message msg) throws IOException, MessageError {
        return sendReceiveMessage(msg, this.defaultTimeout);
    }

    /**
     * Send a message and wait for the answer.
     *
     * @param msg     the message
     * @param timeout seconds to wait, null waits forever
     * @return the response content
     * @throws IOException  on transport failures and timeouts
     * @throws MessageError if the guest failed to process the message or answered out of contract
     */
    public synchronized Map<String, Object> sendReceiveMessage(final Message msg, final Double timeout)
            throws IOException, MessageError {
        final int timeoutMillis = timeout == null ? 0 : TimeUtils.toMillis(timeout);
        final byte[] payload = this.client.call(msg.id(), MessageCodec.encode(msg.getContent()), timeoutMillis);
        final Object decoded;
        try {
            decoded = MessageCodec.decodeValue(payload);
        } catch (final IOException e) {
            throw new MessageError("Malformed response to " + msg + ": " + e.getMessage(), e);
        }
        return MessageResponse.fromMap(decoded).getResponse();
    }

    /**
     * Probe the server with echo messages until it answers.
     *
     * @param interval   seconds between attempts
     * @param timeout    seconds to wait for each answer
     * @param maxRetries number of attempts
     * @param terminable stops the wait early, may be null
     * @return true once the server answered, false if terminated first
     * @throws IOException if the server did not answer any attempt
     * @throws MessageError if the server answered out of contract
     */
    public boolean waitForServer(final double interval, final double timeout, final int maxRetries,
            final Terminable terminable) throws IOException, MessageError {
        final double startWait = TimeUtils.now();
        final EchoMessage msg = new EchoMessage();
        LOG.debug("{}: waiting for guest server", this.name);

        for (int c = 0; c < maxRetries; c++) {
            if (terminable != null && !terminable.shouldRun()) {
                return false;
            }
            final double startAttempt = TimeUtils.now();
            try {
                sendReceiveMessage(msg, timeout);
                LOG.info("{}: guest server is ready", this.name);
                return true;
            } catch (final IOException e) {
                LOG.debug("{}: guest server not ready: {}", this.name, e.toString());
            }

            if (c < maxRetries - 1) {
                final double sleepTime = interval - (TimeUtils.now() - startAttempt);
                if (terminable != null) {
                    terminable.sleep(sleepTime);
                } else if (sleepTime > 0) {
                    try {
                        Thread.sleep((long) (sleepTime * 1000));
                    } catch (final InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return false;
                    }
                }
            }
        }
        if (terminable != null && !terminable.shouldRun()) {
            return false;
        }
        throw new IOException(String.format("Guest server is not ready after %d attempts (%.1f sec.)",
                maxRetries, TimeUtils.now() - startWait));
    }

    public void close() {
        this.client.cleanUp();
        LOG.debug("{}: closed", this.name);
    }

    @Override
    public String toString() {
        return "GuestClient(" + this.name + ")";
    }
}
