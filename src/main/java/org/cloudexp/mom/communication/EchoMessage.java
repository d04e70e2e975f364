/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

import java.util.Map;

/// Liveness probe, answered with an empty map
public class EchoMessage extends Message {
    public EchoMessage() {
        super();
    }

    public EchoMessage(final Map<String, ?> content) {
        super(content);
    }

    @Override
    public RPCID id() {
        return RPCID.ECHO;
    }
}
