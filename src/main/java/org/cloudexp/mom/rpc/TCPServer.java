/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.communication.RPCID;

import java.io.EOFException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.IOException;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Multi-client TCP server. Every accepted connection is served by its own task until the peer
 * disconnects, sends an unknown message type or the server stops.
 */
public class TCPServer<S> extends RPCServer<S> {
    private static final Logger LOG = LogManager.getLogger(TCPServer.class);
    private static final int BIND_RETRIES = 3;
    private static final long BIND_RETRY_SLEEP_MILLIS = 1000;

    private final ServerSocket socket;
    private final Map<Byte, RPCHandler<S>> handlers = new ConcurrentHashMap<>();
    private final Set<Socket> clientSockets = ConcurrentHashMap.newKeySet();
    private final AtomicInteger connectionCount = new AtomicInteger();
    private final ExecutorService connections = Executors.newCachedThreadPool(r -> {
        final Thread t = new Thread(r, "TCPServer-conn-" + connectionCount.incrementAndGet());
        t.setDaemon(true);
        return t;
    });
    private volatile boolean shutdown = false;

    public TCPServer(final String ip, final int port) throws IOException {
        // Retry a few times in case the port is still held by a previous instance
        ServerSocket s = null;
        for (int attempt = 1; s == null; attempt++) {
            try {
                s = new ServerSocket(port, 50, InetAddress.getByName(ip));
            } catch (final IOException e) {
                if (attempt >= BIND_RETRIES) {
                    throw e;
                }
                LOG.warn("Failed to bind {}:{} (attempt {}): {}", ip, port, attempt, e.toString());
                try {
                    Thread.sleep(BIND_RETRY_SLEEP_MILLIS);
                } catch (final InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IOException("Interrupted while binding", ie);
                }
            }
        }
        this.socket = s;
        LOG.info("Server socket address: {}", this.socket.getLocalSocketAddress());
    }

    public int getLocalPort() {
        return this.socket.getLocalPort();
    }

    @Override
    public boolean register(final RPCID rpcId, final RPCHandler<S> handler) {
        // Cannot add if key already exists
        return this.handlers.putIfAbsent(rpcId.id(), handler) == null;
    }

    @Override
    public void runServer(final S serverContext) throws IOException {
        try {
            while (!this.shutdown) {
                final Socket client = this.socket.accept();
                this.clientSockets.add(client);
                this.connections.execute(() -> this.serveClient(client, serverContext));
            }
        } catch (final IOException e) {
            if (!this.shutdown) {
                LOG.error("Server failed", e);
                this.stopServer();
                throw e;
            }
        }
        LOG.info("Shutting down TCPServer");
    }

    private void serveClient(final Socket client, final S serverContext) {
        try (client) {
            final InputStream in = client.getInputStream();
            final OutputStream out = client.getOutputStream();
            while (!this.shutdown) {
                final RPCMessage msg;
                try {
                    msg = this.receive(in);
                } catch (final EOFException e) {
                    break;
                }
                final RPCHandler<S> handler = this.handlers.get(msg.hdr().getType());
                if (handler == null) {
                    LOG.error("Invalid msgType: {}", msg.hdr().getType());
                    break;
                }
                this.respond(out, handler.handleRPC(msg, serverContext));
            }
        } catch (final IOException e) {
            if (!this.shutdown) {
                LOG.warn("Connection from {} failed: {}", client.getRemoteSocketAddress(), e.toString());
            }
        } catch (final RuntimeException e) {
            LOG.error("Handler failed, closing connection from {}", client.getRemoteSocketAddress(), e);
        } finally {
            this.clientSockets.remove(client);
        }
    }

    @Override
    public void stopServer() {
        this.shutdown = true;
        try {
            this.socket.close();
        } catch (final IOException e) {
            LOG.warn("Failed to close server socket: {}", e.toString());
        }
        for (final Socket client : this.clientSockets) {
            try {
                client.close();
            } catch (final IOException e) {
                LOG.debug("Failed to close client socket: {}", e.toString());
            }
        }
        this.connections.shutdownNow();
    }

    private RPCMessage receive(final InputStream in) throws IOException {
        final byte[] hdrBuff = new byte[RPCHeader.BYTE_LEN];
        Utils.readFully(in, hdrBuff);
        final RPCHeader hdr = new RPCHeader(hdrBuff);
        if (hdr.msgLen < 0) {
            throw new IOException("Invalid payload length in " + hdr);
        }
        final byte[] payload = new byte[hdr.msgLen];
        Utils.readFully(in, payload);
        return new RPCMessage(hdr, payload);
    }

    private void respond(final OutputStream out, final RPCMessage msg) throws IOException {
        out.write(msg.hdr().toBytes());
        if (msg.payload().length > 0) {
            out.write(msg.payload());
        }
        out.flush();
    }
}
