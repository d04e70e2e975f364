/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.rpc;

public class RPCHeader {
    public static final int BYTE_LEN = 6;
    private final byte msgId;       // 1 byte
    private final byte msgType;     // 1 byte
    public int msgLen;              // 4 bytes

    public RPCHeader(final byte msgId, final byte msgType, final int msgLen) {
        this.msgId = msgId;
        this.msgType = msgType;
        this.msgLen = msgLen;
    }

    public RPCHeader(final byte[] data) {
        assert (data.length == RPCHeader.BYTE_LEN);
        this.msgId = data[0];
        this.msgType = data[1];
        this.msgLen = Utils.bytesToInt(data, 2);
    }

    public byte[] toBytes() {
        final byte[] buff = new byte[RPCHeader.BYTE_LEN];
        buff[0] = this.msgId;
        buff[1] = this.msgType;
        Utils.intToBytes(this.msgLen, buff, 2);
        return buff;
    }

    public byte getId() {
        return this.msgId;
    }

    public byte getType() {
        return this.msgType;
    }

    @Override
    public String toString() {
        return String.format("RPCHdr(id=%d, type=%d, len=%d)", this.msgId, this.msgType, this.msgLen);
    }
}
