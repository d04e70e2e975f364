/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Helpers for the free-form string-keyed maps that collectors, messages and entities exchange.
 */
public class DictUtils {

    /**
     * Update a map recursively: nested maps present on both sides are merged key by key,
     * anything else in the input replaces the value in the source.
     *
     * @param source the map to update
     * @param input  the map to update from
     */
    @SuppressWarnings("unchecked")
    public static void recursiveUpdate(final Map<String, Object> source, final Map<String, ?> input) {
        if (input == null) {
            return;
        }
        for (final Map.Entry<String, ?> e : input.entrySet()) {
            final Object sourceValue = source.get(e.getKey());
            final Object value = e.getValue();
            if (sourceValue instanceof Map && value instanceof Map) {
                final Map<String, Object> merged = new HashMap<>((Map<String, Object>) sourceValue);
                recursiveUpdate(merged, (Map<String, ?>) value);
                source.put(e.getKey(), merged);
            } else {
                source.put(e.getKey(), deepCopyValue(value));
            }
        }
    }

    /**
     * Copy a map and every nested map and list in it.
     *
     * @param source the map to copy, may be null
     * @return a new mutable map
     */
    public static Map<String, Object> deepCopy(final Map<String, ?> source) {
        final Map<String, Object> ret = new HashMap<>();
        if (source != null) {
            for (final Map.Entry<String, ?> e : source.entrySet()) {
                ret.put(e.getKey(), deepCopyValue(e.getValue()));
            }
        }
        return ret;
    }

    @SuppressWarnings("unchecked")
    private static Object deepCopyValue(final Object value) {
        if (value instanceof Map) {
            return deepCopy((Map<String, ?>) value);
        }
        if (value instanceof List) {
            final List<Object> ret = new ArrayList<>();
            for (final Object o : (List<Object>) value) {
                ret.add(deepCopyValue(o));
            }
            return ret;
        }
        return value;
    }

    /// Numeric value of a key, or null when missing or not a number
    public static Double getDouble(final Map<String, ?> map, final String key) {
        if (map == null) {
            return null;
        }
        final Object value = map.get(key);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        return null;
    }

    /// Nested map of a key, or null when missing or not a map
    @SuppressWarnings("unchecked")
    public static Map<String, Object> getMap(final Map<String, ?> map, final String key) {
        if (map == null) {
            return null;
        }
        final Object value = map.get(key);
        if (value instanceof Map) {
            return (Map<String, Object>) value;
        }
        return null;
    }

    /**
     * Keep only the numeric entries of a map.
     *
     * @param value a map, or anything else
     * @return the numeric entries as doubles, empty if the value is not a map
     */
    public static Map<String, Double> toDoubleMap(final Object value) {
        final Map<String, Double> ret = new HashMap<>();
        if (value instanceof Map) {
            for (final Map.Entry<?, ?> e : ((Map<?, ?>) value).entrySet()) {
                if (e.getValue() instanceof Number) {
                    ret.put(String.valueOf(e.getKey()), ((Number) e.getValue()).doubleValue());
                }
            }
        }
        return ret;
    }
}
