/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

/// A header and the payload it describes
public record RPCMessage(RPCHeader hdr, byte[] payload) {

    /// Build a reply to this message, keeping its request id and type
    public RPCMessage reply(final byte[] data) {
        return new RPCMessage(new RPCHeader(this.hdr.getId(), this.hdr.getType(), data.length), data);
    }

    @Override
    public String toString() {
        return "RPCMessage(" + this.hdr + ")";
    }
}
