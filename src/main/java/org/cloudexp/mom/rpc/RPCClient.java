/*
 * Copyright 2023 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

import java.io.IOException;

import org.cloudexp.mom.communication.RPCID;

/// RPC client operations
public abstract class RPCClient {
    /// Connect with the server
    public abstract boolean connect();

    /// Trigger an RPC, timeoutMillis of 0 waits forever
    public abstract byte[] call(RPCID id, byte[] dataIn, int timeoutMillis) throws IOException;

    /// Teardown the client gracefully
    public abstract void cleanUp();
}
