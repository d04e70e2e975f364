/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

public class TimeUtils {
    /// Wall-clock time in seconds, the unit used for every interval and timestamp on the wire
    public static double now() {
        return System.currentTimeMillis() / 1000.0;
    }

    /// Convert a timeout in seconds to socket milliseconds, where 0 means no timeout
    public static int toMillis(final double seconds) {
        if (seconds <= 0 || Double.isNaN(seconds)) {
            return 0;
        }
        return (int) Math.max(1, Math.min(Integer.MAX_VALUE, Math.round(seconds * 1000)));
    }
}
