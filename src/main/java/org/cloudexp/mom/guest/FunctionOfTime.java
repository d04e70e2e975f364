/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.guest;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A step function of time: a sequence of values, each held for a duration in seconds. Before zero
 * the first value applies; past the end the last value holds.
 */
public class FunctionOfTime {
    private final List<Double> times = new ArrayList<>();
    private final List<Double> values = new ArrayList<>();
    private double nextTime = 0;

    /**
     * Append a step.
     *
     * @param value    the value
     * @param duration seconds to hold it, must be positive
     * @return this
     */
    public FunctionOfTime add(final double value, final double duration) {
        if (!(duration > 0)) {
            throw new IllegalArgumentException("Duration must be positive, got " + duration);
        }
        this.times.add(this.nextTime);
        this.values.add(value);
        this.nextTime += duration;
        return this;
    }

    public double valueAt(final double time) {
        if (this.values.isEmpty()) {
            throw new IllegalStateException("Empty function of time");
        }
        final int pos = Collections.binarySearch(this.times, time);
        // Start times are strictly increasing; a miss takes the step that began before the time
        final int i = pos >= 0 ? pos : -pos - 2;
        return this.values.get(Math.max(0, i));
    }

    /// Sum of all durations
    public double getMaxTime() {
        return this.nextTime;
    }

    public int size() {
        return this.values.size();
    }

    public static FunctionOfTime constant(final double value) {
        return new FunctionOfTime().add(value, Double.POSITIVE_INFINITY);
    }

    /**
     * Parse {@code value:duration} steps separated by semicolons, e.g. {@code 2048:60;1024:60}.
     * A step without a duration lasts forever.
     *
     * @param script the steps
     * @return the function
     * @throws IllegalArgumentException on malformed steps
     */
    public static FunctionOfTime parse(final String script) {
        final FunctionOfTime ret = new FunctionOfTime();
        for (final String step : script.split(";")) {
            if (step.isBlank()) {
                continue;
            }
            final String[] parts = step.split(":");
            try {
                final double value = Double.parseDouble(parts[0].trim());
                final double duration = parts.length > 1 ? Double.parseDouble(parts[1].trim())
                        : Double.POSITIVE_INFINITY;
                ret.add(value, duration);
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("Malformed step '" + step + "' in '" + script + "'", e);
            }
        }
        if (ret.size() == 0) {
            throw new IllegalArgumentException("No steps in '" + script + "'");
        }
        return ret;
    }
}
