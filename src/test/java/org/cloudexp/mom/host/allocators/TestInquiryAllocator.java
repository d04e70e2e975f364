/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host.allocators;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.monitor.MonitorDataEntity;

public class TestInquiryAllocator {

    private static MonitorDataEntity entity(final String name, final Map<String, Object> inquiry) {
        final Map<String, Object> variables = new HashMap<>();
        if (inquiry != null) {
            variables.put(InquiryAllocator.VAR_INQUIRY, inquiry);
        }
        return new MonitorDataEntity(null, Map.of(Monitor.PROP_NAME, name), List.of(), variables);
    }

    @Test
    public void testGrantsWhatWasAsked() {
        final MonitorDataEntity host = entity("host", null);
        final MonitorDataEntity vm1 = entity("vm1", Map.of("memory", 2048, "cpu", 2));
        final MonitorDataEntity vm2 = entity("vm2", null);
        final MonitorDataEntity vm3 = entity("vm3", Map.of("cpu", 4));

        final Allocator allocator = Allocators.create("InquiryAllocator", List.of("memory"));
        allocator.applyPolicy(host, List.of(vm1, vm2, vm3));

        assertEquals(Map.of("memory", 2048.0), vm1.getControls());
        // No answer, or nothing asked for a managed resource: no control
        assertTrue(vm2.getControls().isEmpty());
        assertTrue(vm3.getControls().isEmpty());
        assertTrue(host.getControls().isEmpty());
    }

    @Test
    public void testUnknownAllocator() {
        assertThrows(IllegalArgumentException.class, () -> Allocators.create("Nope", List.of("memory")));
    }
}
