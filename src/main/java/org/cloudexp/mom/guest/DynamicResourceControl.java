/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.guest;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.communication.GuestClient;
import org.cloudexp.mom.communication.Message;
import org.cloudexp.mom.communication.MessageError;
import org.cloudexp.mom.communication.MessageTargetAllocation;
import org.cloudexp.mom.communication.MessageUpdateApplicationTarget;
import org.cloudexp.mom.communication.MessageUpdateResourceDiff;
import org.cloudexp.mom.monitor.CollectionError;
import org.cloudexp.mom.monitor.Collector;
import org.cloudexp.mom.monitor.collectors.MemoryStatistics;
import org.cloudexp.mom.util.DeferredStart;
import org.cloudexp.mom.util.DictUtils;
import org.cloudexp.mom.util.LoggedThread;
import org.cloudexp.mom.util.MemoryUtils;
import org.cloudexp.mom.util.Terminable;
import org.cloudexp.mom.util.TimeUtils;

import java.io.IOException;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.DoubleSupplier;

/**
 * Runs next to a memory-elastic application inside the guest. Waits for the host's allocation
 * through the local guest server, reconciles it with the memory the guest actually sees, and
 * resizes the application accordingly.
 *
 * <p>Growth is only applied once the memory is really there. Shrinking is postponed until the
 * grace period is almost over, leaving the application {@code decreaseMemTime} seconds to release
 * memory. The gap between what the host grants and what the guest sees (the resource diff) is
 * measured when the guest is stable, and reported to the guest policy.
 */
public class DynamicResourceControl extends LoggedThread {
    private static final Logger LOG = LogManager.getLogger(DynamicResourceControl.class);

    public static final double STATS_POLL_TIMEOUT = 0.5;
    public static final double STATS_POLL_INTERVAL = 0.1;
    static final double MIN_GRACE = 1e-2;

    /// Resizes the application; all amounts in MB
    @FunctionalInterface
    public interface ChangeMemFunction {
        /// Returns the target the application settled on, or null if there is nothing to report
        Double changeMem(double memTotal, double memUsage, double memCacheAndBuff, double appRss) throws Exception;
    }

    /// How long to wait for the next notification, and the memory to apply (null keeps all available)
    public record MemoryDecision(double waitTime, Double targetMemory) { }

    private record PollResult(double value, double stableTime) { }

    private final GuestClient client;
    private final double waitTimeout;
    private final double decreaseMemTime;
    private final double memoryEpsilon;
    private final Collector statsCollector;
    private final ChangeMemFunction changeMem;
    private final DoubleSupplier applicationRss;
    private final Terminable terminable;
    private final ExecutorService reporter;

    private volatile double memoryDiff = MemoryUtils.INVALID_MEMORY;
    private volatile double availableMemory = MemoryUtils.INVALID_MEMORY;

    /**
     * @param name            thread name
     * @param client          client to the local guest server
     * @param waitTimeout     seconds to wait for a notification, at least 1
     * @param decreaseMemTime seconds the application needs to release memory
     * @param memoryEpsilon   MB under which two amounts are considered equal
     * @param statsCollector  source of the guest's memory statistics
     * @param changeMem       resizes the application
     * @param applicationRss  the application's resident memory in MB, NaN if unknown
     * @param terminable      cancellation token
     * @param deferredStart   start gate, may be null
     */
    public DynamicResourceControl(final String name, final GuestClient client, final double waitTimeout,
            final double decreaseMemTime, final double memoryEpsilon, final Collector statsCollector,
            final ChangeMemFunction changeMem, final DoubleSupplier applicationRss, final Terminable terminable,
            final DeferredStart deferredStart) {
        super(name, deferredStart);
        this.client = client;
        this.waitTimeout = Math.max(1, waitTimeout);
        this.decreaseMemTime = Math.max(0, decreaseMemTime);
        this.memoryEpsilon = memoryEpsilon;
        this.statsCollector = statsCollector;
        this.changeMem = changeMem;
        this.applicationRss = applicationRss == null ? () -> Double.NaN : applicationRss;
        this.terminable = terminable;
        this.reporter = Executors.newSingleThreadExecutor(r -> {
            final Thread t = new Thread(r, name + "-reporter");
            t.setDaemon(true);
            return t;
        });
        terminable.onTerminate(client::close);
        terminable.onTerminate(this.reporter::shutdownNow);
    }

    public DynamicResourceControl(final String name, final GuestClient client, final double waitTimeout,
            final double decreaseMemTime, final ChangeMemFunction changeMem, final Terminable terminable) {
        this(name, client, waitTimeout, decreaseMemTime, MemoryUtils.DEFAULT_EPSILON,
                new MemoryStatistics(true, false), changeMem, null, terminable, null);
    }

    public double getMemoryDiff() {
        return this.memoryDiff;
    }

    public double getAvailableMemory() {
        return this.availableMemory;
    }

    void setAvailableMemory(final double availableMemory) {
        this.availableMemory = availableMemory;
    }

    /// Memory statistics with {@code used = available - unused}, or null if they cannot be read
    Map<String, Double> getStats() {
        try {
            final Map<String, Double> stats = DictUtils.toDoubleMap(this.statsCollector.collect().get("memory"));
            final Double available = stats.get("available");
            final Double unused = stats.get("unused");
            if (available == null || unused == null) {
                LOG.error("{}: memory statistics lack available or unused memory: {}", getName(), stats);
                return null;
            }
            stats.put("used", available - unused);
            return stats;
        } catch (final CollectionError | RuntimeException e) {
            LOG.error("{}: failed getting data on available memory: {}", getName(), e.toString());
            return null;
        }
    }

    /// Poll the available memory until it reaches the target or the timeout passes
    private PollResult pollStats(final double target, final double initialValue) {
        double curValue = initialValue;
        final double endTime = TimeUtils.now() + STATS_POLL_TIMEOUT;
        double stableTime = TimeUtils.now();
        while (TimeUtils.now() < endTime && !MemoryUtils.isMemoryClose(target, curValue, this.memoryEpsilon)) {
            if (!this.terminable.sleep(STATS_POLL_INTERVAL)) {
                break;
            }
            final Map<String, Double> stats = getStats();
            if (stats == null) {
                break;
            }
            final double newValue = stats.get("available");
            if (!MemoryUtils.isMemoryClose(newValue, curValue, this.memoryEpsilon)) {
                stableTime = TimeUtils.now();
            }
            curValue = newValue;
        }
        return new PollResult(curValue, TimeUtils.now() - stableTime);
    }

    /**
     * Wait for the host's latest notification.
     *
     * @param timeout seconds the guest server waits for a new notification
     * @return the notification with its grace period reduced by the time since it arrived, or null on failure
     */
    Map<String, Object> requestTarget(final double timeout) {
        try {
            final Map<String, Object> target = this.client.sendReceiveMessage(
                    new MessageTargetAllocation(timeout), Math.max(1, timeout + 1));
            Double gracePeriod = DictUtils.getDouble(target, "grace-period");
            if (gracePeriod != null) {
                final double curTime = TimeUtils.now();
                final Double updateTime = DictUtils.getDouble(target, "update-time");
                gracePeriod -= curTime - (updateTime == null ? curTime : updateTime);
                if (gracePeriod < MIN_GRACE) {
                    gracePeriod = null;
                }
            }
            target.put("grace-period", gracePeriod);
            return target;
        } catch (final IOException | MessageError e) {
            if (this.terminable.shouldRun()) {
                LOG.warn("{}: failed getting hint on target allocation: {}", getName(), e.toString());
            }
            return null;
        }
    }

    private void reportResourceDiff() {
        final double diff = this.memoryDiff;
        if (!MemoryUtils.isValidMem(diff)) {
            return;
        }
        report(new MessageUpdateResourceDiff("memory", diff));
    }

    private void reportApplicationTarget(final double appTarget) {
        if (!MemoryUtils.isValidMem(appTarget)) {
            return;
        }
        report(new MessageUpdateApplicationTarget("memory", appTarget));
    }

    private void report(final Message msg) {
        try {
            this.reporter.execute(() -> {
                try {
                    this.client.sendReceiveMessage(msg, this.waitTimeout);
                } catch (final IOException | MessageError e) {
                    LOG.warn("{}: failed to report {}: {}", getName(), msg, e.toString());
                }
            });
        } catch (final RejectedExecutionException e) {
            LOG.debug("{}: reporter stopped, dropping {}", getName(), msg);
        }
    }

    /**
     * Decide what to do with a notification given the currently available memory.
     *
     * @param target the notification, may be null
     * @return the decision
     */
    public MemoryDecision updateMemory(final Map<String, Object> target) {
        if (target == null) {
            return new MemoryDecision(this.waitTimeout, null);
        }

        final Double gracePeriod = DictUtils.getDouble(target, "grace-period");
        final Double alloc = DictUtils.getDouble(DictUtils.getMap(target, "alloc"), "memory");
        if (alloc == null) {
            LOG.warn("{}: notification did not include memory allocation", getName());
            return new MemoryDecision(this.waitTimeout, null);
        }

        // The first notification without grace describes a stable allocation
        if (!MemoryUtils.isValidMem(this.memoryDiff) && gracePeriod == null
                && MemoryUtils.isValidMem(this.availableMemory)) {
            this.memoryDiff = Math.max(0, alloc - this.availableMemory);
            reportResourceDiff();
        }

        if (!MemoryUtils.isValidMem(this.memoryDiff)) {
            return new MemoryDecision(this.waitTimeout, null);
        }

        final double memoryAlloc = alloc - this.memoryDiff;

        if (MemoryUtils.isMemoryClose(memoryAlloc, this.availableMemory, this.memoryEpsilon)) {
            return new MemoryDecision(this.waitTimeout, null);
        } else if (memoryAlloc > this.availableMemory && gracePeriod != null) {
            // Growing: wait for the host to apply it
            return new MemoryDecision(gracePeriod, null);
        } else if (memoryAlloc > this.availableMemory) {
            final PollResult poll = pollStats(memoryAlloc, this.availableMemory);
            this.availableMemory = poll.value();
            final boolean isReady = MemoryUtils.isMemoryClose(memoryAlloc, this.availableMemory, this.memoryEpsilon);
            final double appliedTarget = Math.min(memoryAlloc, this.availableMemory);
            if (isReady || poll.stableTime() + MIN_GRACE > STATS_POLL_TIMEOUT) {
                this.memoryDiff = Math.max(0, memoryAlloc + this.memoryDiff - this.availableMemory);
                reportResourceDiff();
                return new MemoryDecision(this.waitTimeout, appliedTarget);
            }
            return new MemoryDecision(STATS_POLL_INTERVAL, appliedTarget);
        } else if (gracePeriod != null && gracePeriod > this.decreaseMemTime) {
            // Shrinking: keep the memory until the application has to start releasing it
            return new MemoryDecision(gracePeriod - this.decreaseMemTime, null);
        } else {
            return new MemoryDecision(this.waitTimeout, Math.min(memoryAlloc, this.availableMemory));
        }
    }

    /// The memory handed to the application never exceeds what is available
    static double clampToAvailable(final Double targetMemory, final double available) {
        if (targetMemory != null && targetMemory > 0) {
            return Math.min(targetMemory, available);
        }
        return available;
    }

    @Override
    protected void loggedRun() {
        double waitTime = this.waitTimeout;
        while (this.terminable.shouldRun()) {
            final Map<String, Object> target = requestTarget(waitTime);
            if (!this.terminable.shouldRun()) {
                return;
            }
            final Map<String, Double> stats = getStats();
            if (stats == null) {
                this.terminable.sleep(this.waitTimeout);
                continue;
            }
            final double appRss = this.applicationRss.getAsDouble();
            if (!this.terminable.shouldRun()) {
                return;
            }

            this.availableMemory = stats.get("available");
            final double cacheAndBuff = stats.getOrDefault("cache_and_buff", Double.NaN);
            final double used = stats.get("used");

            final MemoryDecision decision = updateMemory(target);
            waitTime = decision.waitTime();
            LOG.debug("{}: [state] next={} | target={} | available={} | used={} | rss={} | cache={} | diff={}",
                    getName(), decision.waitTime(), decision.targetMemory(), this.availableMemory, used, appRss,
                    cacheAndBuff, this.memoryDiff);
            if (!this.terminable.shouldRun()) {
                return;
            }

            final double applied = clampToAvailable(decision.targetMemory(), this.availableMemory);
            Double appTarget;
            try {
                appTarget = this.changeMem.changeMem(applied, used, cacheAndBuff, appRss);
            } catch (final Exception e) {
                LOG.error("{}: failed to update the application memory", getName(), e);
                appTarget = null;
            }
            if (appTarget != null) {
                reportApplicationTarget(appTarget);
            }

            if (target == null) {
                // The guest server is unreachable; do not spin
                this.terminable.sleep(waitTime);
            }
        }
    }

    public void terminate() {
        this.terminable.terminate();
    }
}
