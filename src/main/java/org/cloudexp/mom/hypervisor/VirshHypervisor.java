/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.hypervisor;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Talks to libvirt through the virsh command line tool.
 */
public class VirshHypervisor implements HypervisorInterface {
    private static final Logger LOG = LogManager.getLogger(VirshHypervisor.class);
    private static final long COMMAND_TIMEOUT_SECONDS = 30;

    private final String uri;

    public VirshHypervisor(final String uri) {
        this.uri = uri;
    }

    @Override
    public List<Integer> listDomainIds() throws HypervisorException {
        return parseIdList(virsh("list", "--id"));
    }

    @Override
    public DomainInfo getDomainInfo(final int domainId) throws HypervisorException {
        return parseDomInfo(domainId, virsh("dominfo", Integer.toString(domainId)));
    }

    @Override
    public void setMemory(final int domainId, final long memoryKib) throws HypervisorException {
        virsh("setmem", Integer.toString(domainId), Long.toString(memoryKib), "--live");
    }

    private String virsh(final String... args) throws HypervisorException {
        final List<String> command = new ArrayList<>(Arrays.asList("virsh", "-c", this.uri));
        command.addAll(Arrays.asList(args));
        return runCommand(command);
    }

    /**
     * Run a command and return its standard output.
     *
     * @param command the command and its arguments
     * @return the output
     * @throws HypervisorException if the command cannot run, times out or exits with an error
     */
    protected String runCommand(final List<String> command) throws HypervisorException {
        LOG.debug("Running: {}", command);
        final Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (final IOException e) {
            throw new HypervisorException("Failed to run " + command, e);
        }
        try {
            final String output = readAll(process.getInputStream());
            if (!process.waitFor(COMMAND_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new HypervisorException("Timed out: " + command);
            }
            if (process.exitValue() != 0) {
                throw new HypervisorException(String.format("%s exited with %d: %s", command,
                        process.exitValue(), output.trim()));
            }
            return output;
        } catch (final IOException e) {
            process.destroyForcibly();
            throw new HypervisorException("Failed to read the output of " + command, e);
        } catch (final InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new HypervisorException("Interrupted: " + command, e);
        }
    }

    private static String readAll(final InputStream in) throws IOException {
        final ByteArrayOutputStream out = new ByteArrayOutputStream();
        in.transferTo(out);
        return out.toString(StandardCharsets.UTF_8);
    }

    static List<Integer> parseIdList(final String output) throws HypervisorException {
        final List<Integer> ret = new ArrayList<>();
        for (final String line : output.split("\n")) {
            final String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            try {
                ret.add(Integer.parseInt(trimmed));
            } catch (final NumberFormatException e) {
                throw new HypervisorException("Unexpected domain id: '" + trimmed + "'", e);
            }
        }
        return ret;
    }

    static DomainInfo parseDomInfo(final int domainId, final String output) throws HypervisorException {
        final Map<String, String> fields = new HashMap<>();
        for (final String line : output.split("\n")) {
            final int colon = line.indexOf(':');
            if (colon > 0) {
                fields.put(line.substring(0, colon).trim().toLowerCase(), line.substring(colon + 1).trim());
            }
        }
        final String name = fields.get("name");
        if (name == null) {
            throw new HypervisorException("No domain name in dominfo of " + domainId);
        }
        return new DomainInfo(domainId, name, fields.get("uuid"), fields.getOrDefault("state", "unknown"),
                parseKib(fields.get("max memory")), parseKib(fields.get("used memory")));
    }

    private static long parseKib(final String value) throws HypervisorException {
        if (value == null) {
            throw new HypervisorException("Missing memory field in dominfo");
        }
        final String[] tokens = value.split("\\s+");
        try {
            final long amount = Long.parseLong(tokens[0]);
            final String unit = tokens.length > 1 ? tokens[1].toLowerCase() : "kib";
            switch (unit) {
                case "b":
                    return amount >> 10;
                case "mib":
                    return amount << 10;
                case "gib":
                    return amount << 20;
                default:
                    return amount;
            }
        } catch (final NumberFormatException e) {
            throw new HypervisorException("Unexpected memory value: '" + value + "'", e);
        }
    }
}
