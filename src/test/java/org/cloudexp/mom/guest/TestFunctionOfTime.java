/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.guest;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

public class TestFunctionOfTime {

    @Test
    public void testSteps() {
        final FunctionOfTime f = new FunctionOfTime().add(2048, 60).add(1024, 30).add(3072, 10);
        assertEquals(3, f.size());
        assertEquals(100.0, f.getMaxTime());
        assertEquals(2048.0, f.valueAt(-5));
        assertEquals(2048.0, f.valueAt(0));
        assertEquals(2048.0, f.valueAt(59.9));
        assertEquals(1024.0, f.valueAt(60));
        assertEquals(1024.0, f.valueAt(89));
        assertEquals(3072.0, f.valueAt(90));
        // The last value holds after the end
        assertEquals(3072.0, f.valueAt(1000));
    }

    @Test
    public void testParse() {
        final FunctionOfTime f = FunctionOfTime.parse("2048:60; 1024");
        assertEquals(2, f.size());
        assertEquals(2048.0, f.valueAt(10));
        assertEquals(1024.0, f.valueAt(1e6));
        assertEquals(512.0, FunctionOfTime.constant(512).valueAt(1e9));

        assertThrows(IllegalArgumentException.class, () -> FunctionOfTime.parse(""));
        assertThrows(IllegalArgumentException.class, () -> FunctionOfTime.parse("abc:10"));
        assertThrows(IllegalArgumentException.class, () -> FunctionOfTime.parse("100:0"));
        assertThrows(IllegalStateException.class, () -> new FunctionOfTime().valueAt(0));
    }
}
