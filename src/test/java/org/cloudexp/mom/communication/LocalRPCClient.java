/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import org.cloudexp.mom.rpc.RPCClient;
import org.cloudexp.mom.rpc.RPCHeader;
import org.cloudexp.mom.rpc.RPCMessage;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/// Delivers frames straight to a guest server's message handler, without sockets
public class LocalRPCClient extends RPCClient {
    private final GuestServer server;
    private final MessageHandler handler = new MessageHandler();
    private final AtomicInteger calls = new AtomicInteger();
    private volatile boolean unreachable = false;
    private volatile boolean timingOut = false;
    private byte nextId = 0;

    public LocalRPCClient(final GuestServer server) {
        this.server = server;
    }

    public void setUnreachable(final boolean unreachable) {
        this.unreachable = unreachable;
    }

    public void setTimingOut(final boolean timingOut) {
        this.timingOut = timingOut;
    }

    public int getCallCount() {
        return this.calls.get();
    }

    @Override
    public boolean connect() {
        return !this.unreachable;
    }

    @Override
    public synchronized byte[] call(final RPCID id, final byte[] dataIn, final int timeoutMillis)
            throws IOException {
        this.calls.incrementAndGet();
        if (this.unreachable) {
            throw new IOException("Connection refused");
        }
        if (this.timingOut) {
            throw new SocketTimeoutException("Read timed out");
        }
        final RPCHeader hdr = new RPCHeader(++this.nextId, id.id(), dataIn.length);
        return this.handler.handleRPC(new RPCMessage(hdr, dataIn), this.server).payload();
    }

    @Override
    public void cleanUp() {
    }
}
