/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

public enum RPCID {
    ECHO((byte) 1),
    INQUIRY((byte) 2),
    NOTIFY((byte) 3),
    STATS((byte) 4),
    TARGET_ALLOCATION((byte) 5),
    UPDATE_RESOURCE_DIFF((byte) 6),
    UPDATE_APPLICATION_TARGET((byte) 7);

    private final byte id;

    public byte id() {
        return this.id;
    }

    private RPCID(final byte handlerId) {
        this.id = handlerId;
    }

    /// The kind with the given wire id, or null if there is none
    public static RPCID fromId(final byte id) {
        for (final RPCID rpcId : values()) {
            if (rpcId.id == id) {
                return rpcId;
            }
        }
        return null;
    }
}
