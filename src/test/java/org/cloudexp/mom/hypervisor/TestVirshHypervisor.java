/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.hypervisor;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

public class TestVirshHypervisor {

    private static final String DOMINFO = String.join("\n",
            "Id:             3",
            "Name:           vm1",
            "UUID:           0b5a1f4c-8e3e-4b55-9d0c-2b0d7c9b2f11",
            "OS Type:        hvm",
            "State:          running",
            "CPU(s):         2",
            "Max memory:     4194304 KiB",
            "Used memory:    2097152 KiB",
            "Persistent:     yes",
            "");

    /// Records commands and answers with canned output
    class CannedVirsh extends VirshHypervisor {
        final List<List<String>> commands = new ArrayList<>();
        final String output;

        CannedVirsh(final String output) {
            super("qemu:///system");
            this.output = output;
        }

        @Override
        protected String runCommand(final List<String> command) {
            commands.add(command);
            return output;
        }
    }

    @Test
    public void testParseIdList() throws HypervisorException {
        assertEquals(List.of(1, 3, 12), VirshHypervisor.parseIdList(" 1\n 3\n12\n\n"));
        assertEquals(List.of(), VirshHypervisor.parseIdList("\n"));
        assertThrows(HypervisorException.class, () -> VirshHypervisor.parseIdList("error: failed"));
    }

    @Test
    public void testParseDomInfo() throws HypervisorException {
        final DomainInfo info = VirshHypervisor.parseDomInfo(3, DOMINFO);
        assertEquals(3, info.getId());
        assertEquals("vm1", info.getName());
        assertEquals("running", info.getState());
        assertEquals("0b5a1f4c-8e3e-4b55-9d0c-2b0d7c9b2f11", info.getUuid());
        assertEquals(4194304L, info.getMaxMemKib());
        assertEquals(2048.0, info.getCurMemMb());
        assertEquals(4096.0, info.getMaxMemMb());
        assertEquals("vm1", info.getAddress());
    }

    @Test
    public void testParseDomInfoUnits() throws HypervisorException {
        final DomainInfo info = VirshHypervisor.parseDomInfo(1,
                "Name: vm2\nMax memory: 4 GiB\nUsed memory: 1024 MiB\n");
        assertEquals(4096.0, info.getMaxMemMb());
        assertEquals(1024.0, info.getCurMemMb());
        assertEquals("unknown", info.getState());

        assertThrows(HypervisorException.class, () -> VirshHypervisor.parseDomInfo(1, "Name: vm2\n"));
        assertThrows(HypervisorException.class, () -> VirshHypervisor.parseDomInfo(1, "Max memory: 1 KiB\n"));
    }

    @Test
    public void testCommands() throws HypervisorException {
        final CannedVirsh virsh = new CannedVirsh(DOMINFO);
        assertEquals("vm1", virsh.getDomainInfo(3).getName());
        virsh.setMemory(3, 1048576);
        assertEquals(List.of("virsh", "-c", "qemu:///system", "dominfo", "3"), virsh.commands.get(0));
        assertEquals(List.of("virsh", "-c", "qemu:///system", "setmem", "3", "1048576", "--live"),
                virsh.commands.get(1));

        final CannedVirsh list = new CannedVirsh(" 3\n 5\n");
        assertEquals(List.of(3, 5), list.listDomainIds());
        assertEquals(List.of("virsh", "-c", "qemu:///system", "list", "--id"), list.commands.get(0));
    }

    @Test
    public void testMissingBinary() {
        final VirshHypervisor virsh = new VirshHypervisor("qemu:///system") {
            @Override
            protected String runCommand(final List<String> command) throws HypervisorException {
                final List<String> bogus = new ArrayList<>(command);
                bogus.set(0, "/nonexistent/virsh-binary");
                return super.runCommand(bogus);
            }
        };
        assertThrows(HypervisorException.class, virsh::listDomainIds);
    }
}
