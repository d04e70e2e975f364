/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.guest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import org.junit.jupiter.api.Test;

import org.cloudexp.mom.util.MomConfig;

public class TestGuestPolicy {

    private static Map<String, Object> inquiry(final Double grace) {
        final Map<String, Object> ret = new HashMap<>();
        ret.put("grace-period", grace);
        return ret;
    }

    @Test
    public void testInquiryFollowsScriptAtGraceEnd() {
        final GuestPolicy policy = new GuestPolicy(Map.of("memory", new FunctionOfTime().add(2048, 10).add(1024, 10)));
        assertEquals(2048.0, policy.inquiry(inquiry(null)).get("memory"));
        // Looks at the time the allocation will take effect
        assertEquals(1024.0, policy.inquiry(inquiry(15.0)).get("memory"));

        policy.updateResourceDiff(Map.of("memory", 64.0));
        assertEquals(2112.0, policy.inquiry(inquiry(0.0)).get("memory"));
        assertEquals(64.0, policy.getResourceDiff().get("memory"));
    }

    @Test
    public void testConfig() {
        final MomConfig config = new MomConfig().set("policy", "response-scripts", "memory=2048:60;1024");
        final GuestPolicy policy = new GuestPolicy(config);
        assertEquals(2048.0, policy.inquiry(inquiry(null)).get("memory"));

        assertTrue(new GuestPolicy(new MomConfig()).inquiry(inquiry(null)).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> GuestPolicy.parseResponseScripts(List.of("2048:60")));
        assertEquals(2, GuestPolicy.parseResponseScripts(List.of("memory=1", " cpu = 2")).size());
    }

    @Test
    public void testWaitForNotify() throws InterruptedException {
        final GuestPolicy policy = new GuestPolicy(Map.of());
        assertFalse(policy.waitForNotify(0.05));

        // Repeated notifications before a wait count once
        policy.notifyAllocation(Map.of());
        policy.notifyAllocation(Map.of());
        assertTrue(policy.waitForNotify(0.05));
        assertFalse(policy.waitForNotify(0.05));

        final AtomicBoolean result = new AtomicBoolean(false);
        final Thread waiter = new Thread(() -> result.set(policy.waitForNotify(null)));
        waiter.start();
        Thread.sleep(100);
        policy.notifyAllocation(Map.of());
        waiter.join(5000);
        assertFalse(waiter.isAlive());
        assertTrue(result.get());
    }
}
