/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.communication.RPCID;

import java.io.InputStream;
import java.io.OutputStream;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;

/**
 * Blocking client for {@link TCPServer}. The socket is opened on the first call; any failure closes
 * it so that the next call reconnects. One call at a time, but {@link #cleanUp()} may be called
 * from any thread to abort a call in flight.
 */
public class TCPClient extends RPCClient {
    private static final Logger LOG = LogManager.getLogger(TCPClient.class);
    private static final int CONNECT_TIMEOUT_MILLIS = 3000;

    final String host;
    final int port;
    private volatile Socket socket = null;
    private final byte[] hdrBuff = new byte[RPCHeader.BYTE_LEN];
    private byte nextId = 0;

    public TCPClient(final String host, final int port) {
        this.host = host;
        this.port = port;
    }

    @Override
    public boolean connect() {
        try {
            this.openSocket();
            return true;
        } catch (final IOException e) {
            LOG.debug("Failed to connect to {}:{}: {}", this.host, this.port, e.toString());
            cleanUp();
            return false;
        }
    }

    private Socket openSocket() throws IOException {
        final Socket current = this.socket;
        if (current != null) {
            return current;
        }
        final Socket s = new Socket();
        try {
            s.connect(new InetSocketAddress(this.host, this.port), CONNECT_TIMEOUT_MILLIS);
        } catch (final IOException e) {
            s.close();
            throw e;
        }
        LOG.debug("Local client socket address: {}", s.getLocalSocketAddress());
        this.socket = s;
        return s;
    }

    @Override
    public synchronized byte[] call(final RPCID id, final byte[] dataIn, final int timeoutMillis)
            throws IOException {
        try {
            final Socket s = this.openSocket();
            s.setSoTimeout(timeoutMillis);
            final RPCHeader hdr = new RPCHeader(++this.nextId, id.id(), dataIn.length);
            send(s.getOutputStream(), new RPCMessage(hdr, dataIn));
            final RPCMessage msg = this.receive(s.getInputStream());
            if (msg.hdr().getId() != hdr.getId()) {
                throw new IOException(String.format("Response id %d does not match request id %d",
                        msg.hdr().getId(), hdr.getId()));
            }
            LOG.trace("TCPClient received msg: {}", msg);
            return msg.payload();
        } catch (final IOException e) {
            cleanUp();
            throw e;
        }
    }

    @Override
    public void cleanUp() {
        final Socket s = this.socket;
        this.socket = null;
        if (null != s) {
            try {
                s.close();
            } catch (final IOException e) {
                LOG.debug("Failed to close client socket: {}", e.toString());
            }
        }
    }

    private RPCMessage receive(final InputStream in) throws IOException {
        Utils.readFully(in, this.hdrBuff);
        final RPCHeader hdr = new RPCHeader(this.hdrBuff);
        if (hdr.msgLen < 0) {
            throw new IOException("Invalid payload length in " + hdr);
        }
        final byte[] payload = new byte[hdr.msgLen];
        Utils.readFully(in, payload);
        return new RPCMessage(hdr, payload);
    }

    private static void send(final OutputStream out, final RPCMessage msg) throws IOException {
        out.write(msg.hdr().toBytes());
        if (msg.payload().length > 0) {
            out.write(msg.payload());
        }
        out.flush();
    }
}
