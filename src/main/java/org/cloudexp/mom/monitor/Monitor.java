/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.util.DataLogger;
import org.cloudexp.mom.util.DictUtils;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;
import org.cloudexp.mom.util.TimeUtils;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The data collected about one subject (the host, a guest, or the guest itself inside the guest
 * daemon). Each monitor holds relatively static properties, a bounded history of collected
 * statistics and the variables the policy stores between cycles.
 */
public class Monitor {
    private static final Logger LOG = LogManager.getLogger(Monitor.class);

    public static final String PROP_CONFIG = "config";
    public static final String PROP_NAME = "name";
    public static final String PROP_SOURCE = "source";
    public static final String PROP_ID = "id";
    public static final String PROP_GUEST_CLIENT = "guest-client";
    public static final String PROP_HYPERVISOR = "hypervisor";
    public static final String PROP_INTERVAL = "interval";

    public static final String VAR_LAST_CONTROL = "last_control";

    protected final MomConfig config;
    protected final Terminable terminable;
    private final String name;
    private final String source;
    private final Map<String, Object> properties;
    private final List<Collector> collectors = new CopyOnWriteArrayList<>();
    private final int histLen;
    private final DataLogger dataLogger;

    private final Object dataLock = new Object();
    private final Deque<Map<String, Object>> statistics = new ArrayDeque<>();
    private final Map<String, Object> variables = new HashMap<>();
    private volatile boolean ready = false;

    /**
     * @param config         the daemon configuration
     * @param name           name of the monitored subject
     * @param source         source tag of the data log records
     * @param properties     extra properties, handed to the collectors
     * @param collectorNames collectors to create, in merge order
     * @param terminable     the cancellation token of this monitor
     */
    public Monitor(final MomConfig config, final String name, final String source,
            final Map<String, Object> properties, final List<String> collectorNames,
            final Terminable terminable) {
        this.config = config;
        this.name = name;
        this.source = source;
        this.terminable = terminable;
        this.histLen = Math.max(1, config.getInt("monitor", "sample-history-length"));
        this.dataLogger = new DataLogger("monitor", source);

        final Map<String, Object> props = new HashMap<>();
        props.put(PROP_CONFIG, config);
        props.put(PROP_NAME, name);
        props.put(PROP_SOURCE, source);
        if (properties != null) {
            props.putAll(properties);
        }
        this.properties = Collections.unmodifiableMap(props);

        for (final String collectorName : collectorNames) {
            try {
                this.collectors.add(Collectors.create(collectorName, this.properties));
            } catch (final RuntimeException e) {
                LOG.error("{}: failed to initiate collector '{}'", name, collectorName, e);
            }
        }
    }

    public String getName() {
        return this.name;
    }

    public String getSource() {
        return this.source;
    }

    public Map<String, Object> getProperties() {
        return this.properties;
    }

    public Terminable getTerminable() {
        return this.terminable;
    }

    public void addCollector(final Collector collector) {
        this.collectors.add(collector);
    }

    public int getCollectorCount() {
        return this.collectors.size();
    }

    /**
     * Invoke every collector and merge their records into one. When two collectors produce the
     * same statistic, the later one in configuration order wins.
     *
     * @return the merged record, also pushed onto the history
     */
    public Map<String, Object> collect() {
        final Map<String, Object> data = new HashMap<>();
        final double collectStart = TimeUtils.now();
        for (final Collector c : this.collectors) {
            try {
                DictUtils.recursiveUpdate(data, c.collect());
            } catch (final CollectionError | RuntimeException e) {
                if (this.terminable.shouldRun()) {
                    LOG.error("{}: collection {} error: {}", this.name, c.getClass().getSimpleName(), e.toString());
                }
            }
        }
        final double collectEnd = TimeUtils.now();

        synchronized (this.dataLock) {
            this.statistics.addLast(data);
            while (this.statistics.size() > this.histLen) {
                this.statistics.removeFirst();
            }
        }

        this.dataLogger.appendData(data, collectStart, collectEnd);
        return data;
    }

    /**
     * Take a snapshot of this monitor.
     *
     * @return the snapshot, or null if the monitor is not ready
     */
    public MonitorDataEntity interrogate() {
        if (!this.ready) {
            LOG.warn("{}: not ready yet for interrogation", this.name);
            return null;
        }
        synchronized (this.dataLock) {
            return new MonitorDataEntity(this, this.properties, new ArrayList<>(this.statistics),
                    DictUtils.deepCopy(this.variables));
        }
    }

    /**
     * Commit variables written during a cycle, together with the controls of that cycle.
     *
     * @param vars        the variables to store
     * @param lastControl the controls to store as {@value #VAR_LAST_CONTROL}, may be null
     */
    public void updateVariables(final Map<String, ?> vars, final Map<String, Double> lastControl) {
        synchronized (this.dataLock) {
            this.variables.putAll(DictUtils.deepCopy(vars));
            if (lastControl != null) {
                this.variables.put(VAR_LAST_CONTROL, new HashMap<>(lastControl));
            }
        }
    }

    public Map<String, Object> getVariables() {
        synchronized (this.dataLock) {
            return DictUtils.deepCopy(this.variables);
        }
    }

    public List<Map<String, Object>> getStatistics() {
        synchronized (this.dataLock) {
            return new ArrayList<>(this.statistics);
        }
    }

    public void setReady() {
        if (!this.ready) {
            LOG.info("{}: ready", this.name);
        }
        this.ready = true;
    }

    public void setNotReady(final String message) {
        this.ready = false;
        LOG.error("{}: {}", this.name, message);
    }

    public boolean isReady() {
        return this.ready;
    }

    public void terminate() {
        this.terminable.terminate();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "(" + this.name + ")";
    }
}
