/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

/// Memory amounts are doubles in MB; NaN marks an unknown amount
public class MemoryUtils {
    public static final double INVALID_MEMORY = Double.NaN;
    public static final double DEFAULT_EPSILON = 1;
    public static final double KIB_IN_MB = 1 << 10;

    public static boolean isValidMem(final Double mem) {
        return mem != null && !mem.isNaN() && !mem.isInfinite();
    }

    public static boolean isMemoryClose(final Double mem1, final Double mem2) {
        return isMemoryClose(mem1, mem2, DEFAULT_EPSILON);
    }

    /**
     * Check if two memory amounts are similar up to epsilon.
     *
     * @param mem1 first amount
     * @param mem2 second amount
     * @param eps  the tolerance
     * @return false if either amount is invalid
     */
    public static boolean isMemoryClose(final Double mem1, final Double mem2, final double eps) {
        return isValidMem(mem1) && isValidMem(mem2) && mem1 + eps > mem2 && mem2 + eps > mem1;
    }
}
