/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.communication.GuestClientFactory;
import org.cloudexp.mom.hypervisor.HypervisorInterface;
import org.cloudexp.mom.hypervisor.VirshHypervisor;
import org.cloudexp.mom.monitor.HostMonitor;
import org.cloudexp.mom.util.DataLogger;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;

import java.io.IOException;
import java.nio.file.Paths;

/**
 * The host daemon: a host monitor, a guest manager and the host policy, each on its own thread.
 * If any of them dies before termination, the whole daemon stops.
 */
public class MomHostDaemon {
    private static final Logger LOG = LogManager.getLogger(MomHostDaemon.class);
    private static final long JOIN_TIMEOUT_MILLIS = 10000;

    private static final String CONFIG_OPTION = "config";
    private static final String INTERVAL_OPTION = "interval";
    private static final String GRACE_OPTION = "gracePeriod";
    private static final String DATA_LOG_OPTION = "dataLog";

    private final MomConfig config;
    private final Terminable terminable;
    private final HostMonitor hostMonitor;
    private final GuestManager guestManager;
    private final HostPolicy hostPolicy;

    public MomHostDaemon(final MomConfig config, final HypervisorInterface hypervisor,
            final GuestClientFactory clientFactory, final Terminable terminable) {
        this.config = config;
        this.terminable = terminable;
        this.guestManager = new GuestManager(config, hypervisor, clientFactory, terminable);
        this.hostMonitor = new HostMonitor(config, hypervisor, terminable);
        this.hostPolicy = new HostPolicy(config, hypervisor, this.hostMonitor, this.guestManager, terminable);
    }

    public MomHostDaemon(final MomConfig config, final Terminable terminable) {
        this(config, new VirshHypervisor(config.get("main", "hypervisor-uri")), null, terminable);
    }

    public static MomConfig defaultConfig() {
        return new MomConfig()
                .set("main", "check-loop-interval", 10)
                .set("main", "hypervisor-uri", "qemu:///system")
                .set("main", "data-log", "")
                .set("guest-manager", "interval", 5)
                .set("guest-manager", "max-guests", 64)
                .set("monitor", "sample-history-length", 10)
                .set("monitor", "collectors", "MemoryStatistics,CpuUsage")
                .set("host-monitor", "interval", 10)
                .set("host-monitor", "collectors", "MemoryStatistics,CpuUsage")
                .set("guest-monitor", "interval", 10)
                .set("guest-monitor", "collectors", "GuestStats,GuestHypervisorStats")
                .set("guest-monitor", "check-readiness-interval", 5)
                .set("guest-client", "port", 2187)
                .set("guest-client", "timeout", 10)
                .set("policy", "resources", "memory")
                .set("policy", "memory-controller", "Balloon")
                .set("policy", "allocator", "InquiryAllocator")
                .set("policy", "interval", 30)
                .set("policy", "inquiry-timeout", 2)
                .set("policy", "grace-period", 20)
                .set("policy", "max-workers", 16);
    }

    public GuestManager getGuestManager() {
        return this.guestManager;
    }

    public HostMonitor getHostMonitor() {
        return this.hostMonitor;
    }

    public HostPolicy getHostPolicy() {
        return this.hostPolicy;
    }

    private boolean threadsOk() {
        return this.guestManager.isAlive() && this.hostMonitor.isAlive() && this.hostPolicy.isAlive();
    }

    /// Start the threads and watch them until terminated
    public void run() {
        LOG.info("Starting");
        final String dataLog = this.config.getString("main", "data-log", "");
        final boolean logData = !dataLog.isBlank();
        if (logData) {
            DataLogger.startDataLogging(Paths.get(dataLog));
        }

        if (this.terminable.shouldRun()) {
            this.guestManager.start();
            this.hostMonitor.start();
            this.hostPolicy.start();
        }

        final double interval = this.config.getDouble("main", "check-loop-interval");
        while (this.terminable.sleep(interval)) {
            if (!threadsOk()) {
                if (this.terminable.shouldRun()) {
                    LOG.warn("One of the threads ended before it should. Terminating.");
                }
                break;
            }
        }
        this.terminable.terminate();

        try {
            this.hostPolicy.join(JOIN_TIMEOUT_MILLIS);
            this.hostMonitor.join(JOIN_TIMEOUT_MILLIS);
            this.guestManager.join(JOIN_TIMEOUT_MILLIS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        if (logData) {
            DataLogger.stopDataLogging();
        }
        LOG.info("Daemon ending");
    }

    public void terminate() {
        this.terminable.terminate();
    }

    public static void main(final String[] args) {
        final MomConfig config = defaultConfig();

        final Options options = new Options();
        options.addOption(Option.builder("h")
                .longOpt("help").argName("h")
                .hasArg(false)
                .desc("print help message")
                .build());
        options.addOption(Option.builder("c")
                .longOpt(CONFIG_OPTION).argName(CONFIG_OPTION)
                .hasArg()
                .desc("configuration file (section.key=value)")
                .type(String.class)
                .build());
        options.addOption(Option.builder("i")
                .longOpt(INTERVAL_OPTION).argName(INTERVAL_OPTION)
                .hasArg()
                .desc(String.format("seconds between policy cycles.%nDefault: %s", config.get("policy", "interval")))
                .type(Double.class)
                .build());
        options.addOption(Option.builder("g")
                .longOpt(GRACE_OPTION).argName(GRACE_OPTION)
                .hasArg()
                .desc(String.format("seconds the guests get before controls are applied.%nDefault: %s",
                        config.get("policy", "grace-period")))
                .type(Double.class)
                .build());
        options.addOption(Option.builder("d")
                .longOpt(DATA_LOG_OPTION).argName(DATA_LOG_OPTION)
                .hasArg()
                .desc("file to append the data log to")
                .type(String.class)
                .build());

        final CommandLineParser parser = new DefaultParser();
        try {
            final CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption("h")) {
                final HelpFormatter formatter = new HelpFormatter();
                formatter.printHelp("java -jar target/mom-1.0-SNAPSHOT-jar-with-dependencies.jar [options]",
                        options);
                return;
            }
            if (cmd.hasOption(CONFIG_OPTION)) {
                config.load(Paths.get(cmd.getOptionValue(CONFIG_OPTION)));
            }
            if (cmd.hasOption(INTERVAL_OPTION)) {
                config.set("policy", "interval", Double.parseDouble(cmd.getOptionValue(INTERVAL_OPTION)));
            }
            if (cmd.hasOption(GRACE_OPTION)) {
                config.set("policy", "grace-period", Double.parseDouble(cmd.getOptionValue(GRACE_OPTION)));
            }
            if (cmd.hasOption(DATA_LOG_OPTION)) {
                config.set("main", "data-log", cmd.getOptionValue(DATA_LOG_OPTION));
            }
        } catch (final ParseException | NumberFormatException e) {
            LOG.error("Failed to parse command line: {}", e.getMessage());
            new HelpFormatter().printHelp(MomHostDaemon.class.getName(), options);
            System.exit(-1);
        } catch (final IOException e) {
            LOG.error("Failed to load configuration: {}", e.toString());
            System.exit(-1);
        }

        final Terminable terminable = new Terminable();
        try {
            final MomHostDaemon daemon = new MomHostDaemon(config, terminable);
            Runtime.getRuntime().addShutdownHook(new Thread(daemon::terminate, "MomHostDaemon-shutdown"));
            daemon.run();
        } catch (final IllegalArgumentException e) {
            LOG.error("Host daemon failed", e);
            System.exit(-1);
        }
    }
}
