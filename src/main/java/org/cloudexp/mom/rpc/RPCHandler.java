/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

public abstract class RPCHandler<S> {
    /// Answer one request; the reply must carry the request's id
    public abstract RPCMessage handleRPC(RPCMessage msg, S serverContext);
}
