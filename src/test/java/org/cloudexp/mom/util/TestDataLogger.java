/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestDataLogger {

    @TempDir
    Path tempDir;

    @Test
    public void testAppendAndRead() throws IOException {
        final Path file = tempDir.resolve("data.log");
        DataLogger.startDataLogging(file);
        try {
            new DataLogger("monitor", "host").appendData(Map.of("memory", Map.of("available", 1024)), 10.0, 10.5);
            DataLogger.appendData("policy", "vm1", Map.of("notify", Map.of("memory", 2048.0)), 11.0, 13.0);
        } finally {
            DataLogger.stopDataLogging();
        }
        // Not logging anymore
        DataLogger.appendData("policy", "vm1", Map.of(), 14.0, 15.0);
        assertFalse(DataLogger.isLogging());

        final List<Map<String, Object>> records = DataLogger.readDataLog(file);
        assertEquals(2, records.size());
        assertEquals("monitor", records.get(0).get("type"));
        assertEquals("host", records.get(0).get("source"));
        assertEquals(0.5, ((Number) records.get(0).get("interval")).doubleValue(), 1e-9);
        assertEquals(1024, DictUtils.getMap(records.get(0), "memory").get("available"));
        assertEquals("vm1", records.get(1).get("source"));
        assertEquals(2.0, ((Number) records.get(1).get("interval")).doubleValue(), 1e-9);
    }

    @Test
    public void testDisabledWritesNothing() {
        final Path file = tempDir.resolve("none.log");
        DataLogger.appendData("monitor", "host", Map.of("a", 1), 0, 1);
        assertFalse(Files.exists(file));
    }
}
