/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Arrays;

import org.junit.jupiter.api.Test;

import org.cloudexp.mom.communication.RPCID;

public class TestTCPClientServer {

    class EchoHandler extends RPCHandler<Integer> {
        @Override
        public RPCMessage handleRPC(final RPCMessage msg, final Integer someState) {
            return msg;
        }
    }

    class SlowHandler extends RPCHandler<Integer> {
        @Override
        public RPCMessage handleRPC(final RPCMessage msg, final Integer someState) {
            try {
                Thread.sleep(1000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return msg;
        }
    }

    private Thread startServer(final TCPServer<Integer> rpcServer) {
        final Runnable serverRunner = () -> {
            try {
                rpcServer.runServer(1);
            } catch (final IOException e) {
                throw new RuntimeException("Failed to run server!");
            }
        };
        final Thread serverThread = new Thread(serverRunner);
        serverThread.setDaemon(true);
        serverThread.start();
        return serverThread;
    }

    @Test
    public void testTCPClientServer() throws IOException, InterruptedException {
        final TCPServer<Integer> rpcServer = new TCPServer<Integer>("127.0.0.1", 0);
        rpcServer.register(RPCID.ECHO, new EchoHandler());
        final Thread serverThread = startServer(rpcServer);
        final TCPClient rpcClient = new TCPClient("127.0.0.1", rpcServer.getLocalPort());
        assert(rpcClient.connect());

        final int buffLength = 64;
        byte[] buff = new byte[buffLength];
        for (int i = 0; i < buff.length; i++) {
            buff[i] = (byte) i;
        }
        // Several calls on the same connection
        for (int round = 0; round < 3; round++) {
            final byte[] retBuff = rpcClient.call(RPCID.ECHO, buff, 2000);
            assertEquals(buff.length, retBuff.length, "Received payload is: " + Arrays.toString(retBuff));
            for (int i = 0; i < buff.length; i++) {
                assertEquals(i, retBuff[i], "Expecting " + i + " but got " + retBuff[i]);
            }
        }

        rpcClient.cleanUp();
        rpcServer.stopServer();
        serverThread.join(2000);
    }

    @Test
    public void testTimeoutReconnects() throws IOException, InterruptedException {
        final TCPServer<Integer> rpcServer = new TCPServer<Integer>("127.0.0.1", 0);
        rpcServer.register(RPCID.ECHO, new EchoHandler());
        rpcServer.register(RPCID.STATS, new SlowHandler());
        final Thread serverThread = startServer(rpcServer);
        final TCPClient rpcClient = new TCPClient("127.0.0.1", rpcServer.getLocalPort());

        final byte[] buff = new byte[] {1, 2, 3};
        assertThrows(SocketTimeoutException.class, () -> rpcClient.call(RPCID.STATS, buff, 100));
        // The failed call dropped the socket; the next call opens a new one
        assertEquals(3, rpcClient.call(RPCID.ECHO, buff, 2000).length);

        rpcClient.cleanUp();
        rpcServer.stopServer();
        serverThread.join(2000);
    }

    @Test
    public void testUnknownTypeClosesConnection() throws IOException, InterruptedException {
        final TCPServer<Integer> rpcServer = new TCPServer<Integer>("127.0.0.1", 0);
        rpcServer.register(RPCID.ECHO, new EchoHandler());
        final Thread serverThread = startServer(rpcServer);
        final TCPClient rpcClient = new TCPClient("127.0.0.1", rpcServer.getLocalPort());

        assertThrows(IOException.class, () -> rpcClient.call(RPCID.NOTIFY, new byte[] {1}, 2000));
        assertEquals(1, rpcClient.call(RPCID.ECHO, new byte[] {1}, 2000).length);

        rpcClient.cleanUp();
        rpcServer.stopServer();
        serverThread.join(2000);
    }

    @Test
    public void testConnectRefused() {
        final TCPClient rpcClient = new TCPClient("127.0.0.1", 1);
        assert(!rpcClient.connect());
    }
}
