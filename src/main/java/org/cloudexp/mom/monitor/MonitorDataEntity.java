/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor;

import org.apache.commons.math3.stat.StatUtils;
import org.cloudexp.mom.util.DictUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A snapshot of one monitor, taken once per policy cycle. Policies read its properties and
 * statistics, write variables and controls, and commit the variables back with
 * {@link #storeVariables()}. The snapshot never shares mutable state with its monitor.
 */
public class MonitorDataEntity {
    private final Monitor monitor;
    private final Map<String, Object> properties;
    private final List<Map<String, Object>> statistics;
    private final Map<String, Object> variables;
    private final Map<String, Double> controls = new LinkedHashMap<>();

    public MonitorDataEntity(final Monitor monitor, final Map<String, Object> properties,
            final List<Map<String, Object>> statistics, final Map<String, Object> variables) {
        this.monitor = monitor;
        this.properties = Collections.unmodifiableMap(properties);
        this.statistics = Collections.unmodifiableList(new ArrayList<>(statistics));
        this.variables = variables;
    }

    public Monitor getMonitor() {
        return this.monitor;
    }

    public String getName() {
        return (String) this.properties.get(Monitor.PROP_NAME);
    }

    public Object prop(final String key) {
        return this.properties.get(key);
    }

    public Map<String, Object> getProperties() {
        return this.properties;
    }

    public List<Map<String, Object>> getStatistics() {
        return this.statistics;
    }

    /**
     * The most recent value of a statistic.
     *
     * @param path keys into the nested record, e.g. {@code "memory", "available"}
     * @return the value, or null if there are no statistics or the path is missing
     */
    public Object stat(final String... path) {
        if (this.statistics.isEmpty()) {
            return null;
        }
        return lookup(this.statistics.get(this.statistics.size() - 1), path);
    }

    /**
     * Mean of a numeric statistic over the whole history. Records without the statistic are skipped.
     *
     * @param path keys into the nested record
     * @return the mean
     * @throws IllegalStateException if no record holds the statistic
     */
    public double statAvg(final String... path) {
        final double[] values = this.statistics.stream()
                .map(record -> lookup(record, path))
                .filter(v -> v instanceof Number)
                .mapToDouble(v -> ((Number) v).doubleValue())
                .toArray();
        if (values.length == 0) {
            throw new IllegalStateException("Statistic '" + String.join(".", path) + "' not available");
        }
        return StatUtils.mean(values);
    }

    private static Object lookup(final Map<String, Object> record, final String... path) {
        Object cur = record;
        for (final String key : path) {
            if (!(cur instanceof Map)) {
                return null;
            }
            cur = ((Map<?, ?>) cur).get(key);
        }
        return cur;
    }

    public Object getVar(final String key) {
        return this.variables.get(key);
    }

    public Object getVar(final String key, final Object defaultValue) {
        return this.variables.getOrDefault(key, defaultValue);
    }

    public void setVar(final String key, final Object value) {
        this.variables.put(key, value);
    }

    public Map<String, Object> getVariables() {
        return this.variables;
    }

    /// Controls committed at the end of the previous cycle, empty if none
    public Map<String, Double> getLastControl() {
        return DictUtils.toDoubleMap(this.variables.get(Monitor.VAR_LAST_CONTROL));
    }

    public void control(final String key, final double value) {
        this.controls.put(key, value);
    }

    public Double getControl(final String key) {
        return this.controls.get(key);
    }

    public Map<String, Double> getControls() {
        return this.controls;
    }

    /// Commit the variables and this cycle's controls back into the monitor
    public void storeVariables() {
        if (this.monitor != null) {
            this.monitor.updateVariables(this.variables, this.controls);
        }
    }

    @Override
    public String toString() {
        return "MonitorDataEntity(" + getName() + ")";
    }
}
