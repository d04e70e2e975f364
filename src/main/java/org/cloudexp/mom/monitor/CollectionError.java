/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor;

/// A collector could not produce a complete, coherent record
public class CollectionError extends Exception {
    public CollectionError(final String message) {
        super(message);
    }

    public CollectionError(final String message, final Throwable cause) {
        super(message, cause);
    }
}
