/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor.collectors;

import org.cloudexp.mom.monitor.CollectionError;
import org.cloudexp.mom.monitor.Collector;
import org.cloudexp.mom.util.TimeUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Cumulative CPU times from /proc/stat in seconds, under {@code cpu} as {@code cpu-total} and
 * {@code cpu-<n>} per core.
 */
public class CpuUsage implements Collector {
    private static final String[] HEADERS = {
        "user", "nice", "system", "idle", "iowait", "irq", "softirq", "steal", "guest", "guest_nice",
    };
    /// USER_HZ, fixed at 100 on every architecture Linux exposes to user space
    static final double CLOCK_TICKS = 100;

    private final Path procStat;

    public CpuUsage(final Path procStat) {
        this.procStat = procStat;
    }

    public CpuUsage() {
        this(Paths.get("/proc/stat"));
    }

    @Override
    public Map<String, Object> collect() throws CollectionError {
        final String contents;
        try {
            contents = Files.readString(this.procStat, StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new CollectionError("Failed to read " + this.procStat, e);
        }

        final Map<String, Object> cpu = new HashMap<>();
        cpu.put("time", TimeUtils.now());
        for (final String line : contents.split("\n")) {
            if (!line.startsWith("cpu")) {
                continue;
            }
            final String[] tokens = line.trim().split("\\s+");
            final long[] v = new long[HEADERS.length];
            try {
                for (int i = 0; i < HEADERS.length && i + 1 < tokens.length; i++) {
                    v[i] = Long.parseLong(tokens[i + 1]);
                }
            } catch (final NumberFormatException e) {
                throw new CollectionError("Unexpected /proc/stat line: " + line, e);
            }
            final String name = tokens[0].length() > 3 ? "cpu-" + tokens[0].substring(3) : "cpu-total";
            cpu.put(name, cpuTimes(v));
        }
        final Map<String, Object> ret = new HashMap<>();
        ret.put("cpu", cpu);
        return ret;
    }

    private static Map<String, Double> cpuTimes(final long[] v) {
        final long user = v[0];
        final long nice = v[1];
        final long system = v[2];
        final long idle = v[3];
        final long iowait = v[4];
        final long irq = v[5];
        final long softirq = v[6];
        final long steal = v[7];
        final long guest = v[8];
        final long guestNice = v[9];

        // Guest time is already accounted in user and nice
        final long userTime = user - guest;
        final long niceTime = nice - guestNice;
        final long idleAllTime = idle + iowait;
        final long systemAllTime = system + irq + softirq;
        final long virtualTime = guest + guestNice;
        final long totalTime = userTime + niceTime + systemAllTime + idleAllTime + steal + virtualTime;

        final Map<String, Double> ret = new LinkedHashMap<>();
        ret.put("total", totalTime / CLOCK_TICKS);
        ret.put("virtual", virtualTime / CLOCK_TICKS);
        ret.put("system-all", systemAllTime / CLOCK_TICKS);
        ret.put("idle-all", idleAllTime / CLOCK_TICKS);
        ret.put("user-non-virtual", userTime / CLOCK_TICKS);
        for (int i = 0; i < HEADERS.length; i++) {
            ret.put(HEADERS[i], v[i] / CLOCK_TICKS);
        }
        return ret;
    }
}
