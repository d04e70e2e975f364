/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

/// The other side answered, but the answer breaks the message contract
public class MessageError extends Exception {
    public MessageError(final String message) {
        super(message);
    }

    public MessageError(final String message, final Throwable cause) {
        super(message, cause);
    }
}
