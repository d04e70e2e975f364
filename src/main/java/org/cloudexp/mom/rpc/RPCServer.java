/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

import org.cloudexp.mom.communication.RPCID;

import java.io.IOException;

/// RPC server operations
public abstract class RPCServer<S> {
    /// Register an RPC func with an ID
    public abstract boolean register(RPCID id, RPCHandler<S> handler);

    /// Run the RPC server until stopped
    public abstract void runServer(S serverContext) throws IOException;

    /// Stop accepting clients and close open connections
    public abstract void stopServer();
}
