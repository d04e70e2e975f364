/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.Test;

import org.cloudexp.mom.hypervisor.FakeHypervisor;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;

public class TestMonitor {

    /// Reports an increasing sample count under memory.sample
    class CountingCollector implements Collector {
        final AtomicInteger count = new AtomicInteger();

        @Override
        public Map<String, Object> collect() {
            final Map<String, Object> memory = new HashMap<>();
            memory.put("sample", (double) count.incrementAndGet());
            memory.put("source", "counting");
            final Map<String, Object> ret = new HashMap<>();
            ret.put("memory", memory);
            return ret;
        }
    }

    private static MomConfig config(final int histLen) {
        return new MomConfig().set("monitor", "sample-history-length", histLen);
    }

    @Test
    public void testHistoryIsBounded() {
        final Monitor monitor = new Monitor(config(3), "vm1", "vm1", null, List.of(), new Terminable());
        monitor.addCollector(new CountingCollector());
        for (int i = 0; i < 5; i++) {
            monitor.collect();
        }
        final List<Map<String, Object>> stats = monitor.getStatistics();
        assertEquals(3, stats.size());

        monitor.setReady();
        final MonitorDataEntity entity = monitor.interrogate();
        assertEquals(5.0, entity.stat("memory", "sample"));
        assertEquals(4.0, entity.statAvg("memory", "sample"));
        assertNull(entity.stat("memory", "missing"));
        assertThrows(IllegalStateException.class, () -> entity.statAvg("cpu", "total"));
    }

    @Test
    public void testCollectorFailuresAreIsolated() {
        final Monitor monitor = new Monitor(config(3), "vm1", "vm1", null, List.of("NoSuchCollector"),
                new Terminable());
        assertEquals(0, monitor.getCollectorCount());

        monitor.addCollector(() -> {
            throw new CollectionError("broken");
        });
        monitor.addCollector(() -> {
            throw new IllegalStateException("bug");
        });
        monitor.addCollector(new CountingCollector());
        final Map<String, Object> data = monitor.collect();
        assertEquals(1.0, ((Map<?, ?>) data.get("memory")).get("sample"));
    }

    @Test
    public void testLaterCollectorWins() {
        final Monitor monitor = new Monitor(config(3), "vm1", "vm1", null, List.of(), new Terminable());
        monitor.addCollector(new CountingCollector());
        monitor.addCollector(() -> Map.of("memory", Map.of("source", "second")));
        final Map<?, ?> memory = (Map<?, ?>) monitor.collect().get("memory");
        assertEquals("second", memory.get("source"));
        assertEquals(1.0, memory.get("sample"));
    }

    @Test
    public void testInterrogateRequiresReady() {
        final Monitor monitor = new Monitor(config(3), "vm1", "vm1", null, List.of(), new Terminable());
        assertNull(monitor.interrogate());
        monitor.setReady();
        assertTrue(monitor.isReady());
        assertEquals("vm1", monitor.interrogate().getName());
        monitor.setNotReady("gone");
        assertFalse(monitor.isReady());
        assertNull(monitor.interrogate());
    }

    @Test
    public void testVariablesAndControls() {
        final Monitor monitor = new Monitor(config(3), "vm1", "vm1", Map.of(Monitor.PROP_ID, 4), List.of(),
                new Terminable());
        monitor.setReady();

        final MonitorDataEntity first = monitor.interrogate();
        assertEquals(4, first.prop(Monitor.PROP_ID));
        assertTrue(first.getLastControl().isEmpty());
        first.setVar("note", "x");
        first.control("memory", 1024);
        // Not visible before it is stored
        assertNull(monitor.interrogate().getVar("note"));
        first.storeVariables();

        final MonitorDataEntity second = monitor.interrogate();
        assertEquals("x", second.getVar("note"));
        assertEquals(1024.0, second.getLastControl().get("memory"));
        assertTrue(second.getControls().isEmpty());

        // Snapshots do not share variables
        second.setVar("note", "y");
        assertEquals("x", monitor.getVariables().get("note"));
    }

    @Test
    public void testCollectorRegistry() {
        final Map<String, Object> props = new HashMap<>();
        assertTrue(Collectors.create("CpuUsage", props) instanceof org.cloudexp.mom.monitor.collectors.CpuUsage);
        assertThrows(IllegalArgumentException.class, () -> Collectors.create("GuestStats", props));
        assertThrows(IllegalArgumentException.class, () -> Collectors.create("Nope", props));

        props.put(Monitor.PROP_HYPERVISOR, new FakeHypervisor());
        props.put(Monitor.PROP_ID, 1);
        Collectors.create("GuestHypervisorStats", props);
    }

    @Test
    public void testHostMonitorCollectsUntilTerminated() throws InterruptedException {
        final MomConfig config = config(3)
                .set("host-monitor", "interval", 0.05)
                .set("host-monitor", "collectors", "");
        final Terminable terminable = new Terminable();
        final HostMonitor monitor = new HostMonitor(config, new FakeHypervisor(), terminable);
        assertTrue(monitor.isReady());
        final CountingCollector counting = new CountingCollector();
        monitor.addCollector(counting);

        monitor.start();
        Thread.sleep(300);
        terminable.terminate();
        monitor.join(2000);
        assertFalse(monitor.isAlive());
        assertTrue(counting.count.get() >= 2);
        assertEquals(3, monitor.getStatistics().size());
    }
}
