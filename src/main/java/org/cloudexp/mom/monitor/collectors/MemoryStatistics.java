/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor.collectors;

import org.cloudexp.mom.monitor.CollectionError;
import org.cloudexp.mom.monitor.Collector;
import org.cloudexp.mom.util.MemoryUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Memory statistics from /proc/meminfo and /proc/vmstat, reported under {@code memory}:
 * <ul>
 *     <li>available - total memory (MB)</li>
 *     <li>unused - memory not used for any purpose (MB)</li>
 *     <li>free - unused memory plus buffers and page cache (MB)</li>
 *     <li>cache_and_buff - buffers and page cache (MB)</li>
 *     <li>swap_in, swap_out, page_in, page_out, major_fault, minor_fault - counters since boot</li>
 * </ul>
 * Every other meminfo field is reported too, lower-cased, kB values in MB.
 */
public class MemoryStatistics implements Collector {
    private static final Pattern MEM_INFO_PATTERN =
            Pattern.compile("^[ \\t]*([a-z_\\d\\-()\\[\\]]+)[ \\t]*:[ \\t]*(\\d+)[ \\t]*([a-z]*)",
                    Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

    private final boolean meminfo;
    private final boolean vmstat;
    private final Path procDir;

    public MemoryStatistics(final boolean meminfo, final boolean vmstat, final Path procDir) {
        this.meminfo = meminfo;
        this.vmstat = vmstat;
        this.procDir = procDir;
    }

    public MemoryStatistics(final boolean meminfo, final boolean vmstat) {
        this(meminfo, vmstat, Paths.get("/proc"));
    }

    public MemoryStatistics() {
        this(true, true);
    }

    @Override
    public Map<String, Object> collect() throws CollectionError {
        final Map<String, Object> memory = new HashMap<>();
        if (this.meminfo) {
            memory.putAll(getMemInfo());
        }
        if (this.vmstat) {
            memory.putAll(getVmStat());
        }
        final Map<String, Object> ret = new HashMap<>();
        ret.put("memory", memory);
        return ret;
    }

    private String read(final String name) throws CollectionError {
        try {
            return Files.readString(this.procDir.resolve(name), StandardCharsets.UTF_8);
        } catch (final IOException e) {
            throw new CollectionError("Failed to read " + name, e);
        }
    }

    Map<String, Object> getMemInfo() throws CollectionError {
        final String memInfo = read("meminfo");
        final Map<String, Double> fields = new HashMap<>();
        final Matcher m = MEM_INFO_PATTERN.matcher(memInfo);
        while (m.find()) {
            double value = Long.parseLong(m.group(2));
            if ("kb".equalsIgnoreCase(m.group(3))) {
                value /= MemoryUtils.KIB_IN_MB;
            }
            fields.put(m.group(1).toLowerCase(), value);
        }
        if (fields.isEmpty()) {
            throw new CollectionError("meminfo output could not be parsed: " + memInfo);
        }

        final Map<String, Object> ret = new HashMap<>(fields);
        final Double total = fields.get("memtotal");
        final Double unused = fields.get("memfree");
        final Double buffers = fields.get("buffers");
        final Double cached = fields.get("cached");
        if (total == null || unused == null) {
            throw new CollectionError("meminfo is missing MemTotal or MemFree");
        }
        ret.put("available", total);
        ret.put("unused", unused);
        if (buffers != null && cached != null) {
            ret.put("free", unused + buffers + cached);
            ret.put("cache_and_buff", cached + buffers);
        } else {
            ret.put("free", null);
            ret.put("cache_and_buff", null);
        }
        return ret;
    }

    Map<String, Object> getVmStat() throws CollectionError {
        final String vmStat = read("vmstat");
        final Map<String, Object> ret = new HashMap<>();
        ret.put("swap_in", parseCounter("pswpin", vmStat));
        ret.put("swap_out", parseCounter("pswpout", vmStat));
        ret.put("page_in", parseCounter("pgpgin", vmStat));
        ret.put("page_out", parseCounter("pgpgout", vmStat));
        ret.put("major_fault", parseCounter("pgmajfault", vmStat));
        ret.put("minor_fault", parseCounter("pgfault", vmStat));
        return ret;
    }

    /// Missing counters read as zero
    private static long parseCounter(final String name, final String vmStat) {
        final Matcher m = Pattern.compile("^" + name + "\\s+(\\d+)", Pattern.MULTILINE).matcher(vmStat);
        return m.find() ? Long.parseLong(m.group(1)) : 0;
    }
}
