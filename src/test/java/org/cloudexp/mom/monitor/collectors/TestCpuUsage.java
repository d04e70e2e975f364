/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.monitor.collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.cloudexp.mom.monitor.CollectionError;

public class TestCpuUsage {

    @TempDir
    Path tempDir;

    @Test
    @SuppressWarnings("unchecked")
    public void testProcStat() throws IOException, CollectionError {
        final Path stat = tempDir.resolve("stat");
        Files.write(stat, List.of(
                "cpu  1000 100 300 5000 200 10 20 5 50 0",
                "cpu0 500 50 150 2500 100 5 10 2 25 0",
                "intr 12345",
                "ctxt 67890"), StandardCharsets.UTF_8);

        final Map<String, Object> cpu = (Map<String, Object>) new CpuUsage(stat).collect().get("cpu");
        assertNotNull(cpu.get("time"));
        assertEquals(3, cpu.size());

        final Map<String, Double> total = (Map<String, Double>) cpu.get("cpu-total");
        assertEquals(10.0, total.get("user"));
        assertEquals(50.0, total.get("idle"));
        assertEquals(52.0, total.get("idle-all"));
        assertEquals(3.3, total.get("system-all"), 1e-9);
        assertEquals(9.5, total.get("user-non-virtual"), 1e-9);
        assertEquals(0.5, total.get("virtual"), 1e-9);
        // Guest time counted once
        assertEquals(66.35, total.get("total"), 1e-9);

        final Map<String, Double> cpu0 = (Map<String, Double>) cpu.get("cpu-0");
        assertEquals(5.0, cpu0.get("user"));
    }

    @Test
    public void testMissingFile() {
        assertThrows(CollectionError.class, () -> new CpuUsage(tempDir.resolve("nope")).collect());
    }
}
