/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.guest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.util.DictUtils;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.TimeUtils;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Answers the host's inquiries from per-resource response scripts, corrected by the resource diff
 * the guest application reports, and lets guest-side threads wait for host notifications.
 */
public class GuestPolicy {
    private static final Logger LOG = LogManager.getLogger(GuestPolicy.class);

    private final Map<String, FunctionOfTime> responseScripts;
    private final Map<String, Double> resourceDiff = new ConcurrentHashMap<>();
    private final Object notifyLock = new Object();
    private boolean notified = false;
    private double initTime = Double.NaN;

    public GuestPolicy(final Map<String, FunctionOfTime> responseScripts) {
        this.responseScripts = Collections.unmodifiableMap(new LinkedHashMap<>(responseScripts));
    }

    public GuestPolicy(final MomConfig config) {
        this(parseResponseScripts(config.getList("policy", "response-scripts")));
    }

    /**
     * Parse {@code resource=script} entries, see {@link FunctionOfTime#parse(String)}.
     *
     * @param entries the entries
     * @return resource to script
     */
    static Map<String, FunctionOfTime> parseResponseScripts(final Iterable<String> entries) {
        final Map<String, FunctionOfTime> ret = new LinkedHashMap<>();
        for (final String entry : entries) {
            final int eq = entry.indexOf('=');
            if (eq <= 0) {
                throw new IllegalArgumentException("Malformed response script '" + entry + "', expected resource=script");
            }
            ret.put(entry.substring(0, eq).trim(), FunctionOfTime.parse(entry.substring(eq + 1)));
        }
        return ret;
    }

    public void updateResourceDiff(final Map<String, Double> diff) {
        this.resourceDiff.putAll(diff);
        LOG.debug("Resource diff updated: {}", this.resourceDiff);
    }

    public Map<String, Double> getResourceDiff() {
        return new HashMap<>(this.resourceDiff);
    }

    /**
     * The desired level of every scripted resource at the time the allocation will take effect. Time
     * starts at the first inquiry.
     *
     * @param inquiryData the merged inquiry state; its grace period shifts the lookup time
     * @return resource to desired level
     */
    public Map<String, Double> inquiry(final Map<String, Object> inquiryData) {
        double curTime;
        synchronized (this) {
            if (Double.isNaN(this.initTime)) {
                this.initTime = TimeUtils.now();
                curTime = 0;
            } else {
                curTime = TimeUtils.now() - this.initTime;
            }
        }

        final Double gracePeriod = DictUtils.getDouble(inquiryData, "grace-period");
        if (gracePeriod != null) {
            curTime += gracePeriod;
        }
        final Map<String, Double> ret = new HashMap<>();
        for (final Map.Entry<String, FunctionOfTime> e : this.responseScripts.entrySet()) {
            final double diff = this.resourceDiff.getOrDefault(e.getKey(), 0.0);
            ret.put(e.getKey(), e.getValue().valueAt(curTime) + diff);
        }
        return ret;
    }

    public void notifyAllocation(final Map<String, Object> notifyData) {
        synchronized (this.notifyLock) {
            this.notified = true;
            this.notifyLock.notifyAll();
        }
    }

    /**
     * Wait for a notification that arrived since the previous call.
     *
     * @param timeout seconds to wait, null waits until a notification arrives
     * @return true if a notification arrived
     */
    public boolean waitForNotify(final Double timeout) {
        synchronized (this.notifyLock) {
            try {
                if (timeout == null) {
                    while (!this.notified) {
                        this.notifyLock.wait();
                    }
                } else {
                    final long deadline = System.nanoTime() + (long) (Math.max(0, timeout) * 1e9);
                    long remaining = deadline - System.nanoTime();
                    while (!this.notified && remaining > 0) {
                        this.notifyLock.wait(Math.max(1, remaining / 1_000_000));
                        remaining = deadline - System.nanoTime();
                    }
                }
            } catch (final InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            final boolean ret = this.notified;
            this.notified = false;
            return ret;
        }
    }
}
