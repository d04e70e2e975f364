/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.communication;

/// Creates the client the host uses to reach a guest server
@FunctionalInterface
public interface GuestClientFactory {
    GuestClient create(String address, String name);
}
