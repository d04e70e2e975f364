/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import org.cloudexp.mom.communication.GuestClient;
import org.cloudexp.mom.communication.GuestClientFactory;
import org.cloudexp.mom.communication.GuestServer;
import org.cloudexp.mom.communication.LocalRPCClient;
import org.cloudexp.mom.guest.FunctionOfTime;
import org.cloudexp.mom.guest.GuestPolicy;
import org.cloudexp.mom.hypervisor.FakeHypervisor;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.util.DataLogger;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;

public class TestMomHostDaemon {

    @TempDir
    Path tempDir;

    @Test
    public void testDefaultConfig() {
        final MomConfig config = MomHostDaemon.defaultConfig();
        assertEquals(List.of("memory"), config.getList("policy", "resources"));
        assertEquals("Balloon", config.get("policy", "memory-controller"));
        assertEquals("InquiryAllocator", config.get("policy", "allocator"));
        assertEquals(2187, config.getInt("guest-client", "port"));
        assertTrue(config.getDouble("policy", "grace-period") <= config.getDouble("policy", "interval"));
    }

    @Test
    public void testDaemonBalloonsGuest() throws InterruptedException {
        final FakeHypervisor hypervisor = new FakeHypervisor().addDomain(7, "vm7", 4096, 1024);
        final MomConfig guestConfig = new MomConfig().set("monitor", "sample-history-length", 5);
        final Monitor guestMonitor = new Monitor(guestConfig, "vm7", "vm7", Map.of(), List.of(), new Terminable());
        guestMonitor.setReady();
        final GuestServer server = new GuestServer(guestMonitor,
                new GuestPolicy(Map.of("memory", FunctionOfTime.constant(3000))), "vm7");
        final GuestClientFactory factory = (address, name) -> new GuestClient(name, new LocalRPCClient(server), 1.0);

        final Path dataLog = tempDir.resolve("mom.log");
        final MomConfig config = MomHostDaemon.defaultConfig()
                .set("main", "check-loop-interval", 0.05)
                .set("main", "data-log", dataLog.toString())
                .set("guest-manager", "interval", 0.05)
                .set("host-monitor", "interval", 0.1)
                .set("host-monitor", "collectors", "")
                .set("guest-monitor", "interval", 0.1)
                .set("guest-monitor", "collectors", "GuestHypervisorStats")
                .set("guest-monitor", "check-readiness-interval", 0.02)
                .set("policy", "interval", 1)
                .set("policy", "grace-period", 0.1)
                .set("policy", "inquiry-timeout", 0.5);

        final Terminable terminable = new Terminable();
        final MomHostDaemon daemon = new MomHostDaemon(config, hypervisor, factory, terminable);
        final Thread runner = new Thread(daemon::run, "daemon-runner");
        runner.start();
        try {
            TestGuestManager.waitFor(() -> !hypervisor.getSetMemoryCalls().isEmpty());
            assertEquals(3000L * 1024, hypervisor.getSetMemoryCalls().get(0)[1]);
            assertEquals(Map.of("vm7", true), daemon.getGuestManager().getGuestsReadiness());
        } finally {
            daemon.terminate();
            runner.join(15000);
        }
        assertFalse(runner.isAlive());
        assertFalse(daemon.getHostPolicy().isAlive());
        assertFalse(daemon.getGuestManager().isAlive());
        assertFalse(DataLogger.isLogging());
        assertTrue(Files.exists(dataLog));
    }
}
