/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.hypervisor;

public class HypervisorException extends Exception {
    public HypervisorException(final String message) {
        super(message);
    }

    public HypervisorException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
