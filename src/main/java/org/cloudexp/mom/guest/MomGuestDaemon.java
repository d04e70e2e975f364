/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.guest;

import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.CommandLineParser;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.commons.cli.ParseException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.communication.GuestServer;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.PluginRegistry;
import org.cloudexp.mom.util.Terminable;

import java.io.IOException;
import java.nio.file.Paths;
import java.util.Map;
import java.util.function.Function;

/**
 * The daemon inside each guest: a local monitor (collected on demand, not on a thread), a guest
 * policy and the guest server answering the host.
 */
public class MomGuestDaemon {
    private static final Logger LOG = LogManager.getLogger(MomGuestDaemon.class);

    public static final PluginRegistry<Function<MomConfig, GuestPolicy>> POLICIES = new PluginRegistry<>("guest policy");

    static {
        POLICIES.register("BaseGuestPolicy", GuestPolicy::new);
    }

    private static final String CONFIG_OPTION = "config";
    private static final String PORT_OPTION = "port";
    private static final String NAME_OPTION = "name";
    private static final String NAME_DEFAULT = "guest";

    private final MomConfig config;
    private final Monitor monitor;
    private final GuestPolicy policy;
    private final GuestServer server;
    private final Terminable terminable;

    public MomGuestDaemon(final MomConfig config, final String guestName, final Terminable terminable) {
        this.config = config;
        this.terminable = terminable;
        this.monitor = new Monitor(config, guestName, guestName, Map.of(), config.getList("monitor", "collectors"),
                terminable);
        this.monitor.setReady();
        this.policy = POLICIES.get(config.get("policy", "policy")).apply(config);
        this.server = new GuestServer(this.monitor, this.policy, guestName);
    }

    public static MomConfig defaultConfig() {
        return new MomConfig()
                .set("monitor", "sample-history-length", 10)
                .set("monitor", "collectors", "MemoryStatistics,CpuUsage")
                .set("policy", "policy", "BaseGuestPolicy")
                .set("policy", "response-scripts", "")
                .set("server", "host", "0.0.0.0")
                .set("server", "port", 2187);
    }

    public Monitor getMonitor() {
        return this.monitor;
    }

    public GuestPolicy getPolicy() {
        return this.policy;
    }

    public GuestServer getServer() {
        return this.server;
    }

    /// Bind the guest server; separate from {@link #start()} so callers can learn the bound port
    public void bind() throws IOException {
        final String host = this.config.get("server", "host");
        final int port = this.config.getInt("server", "port");
        LOG.info("Starting guest server, listening on {}:{}", host, port);
        this.server.bind(host, port);
        this.terminable.onTerminate(this.server::shutdown);
    }

    /// Serve until terminated
    public void start() throws IOException {
        this.server.serveForever();
        this.server.shutdown();
        LOG.info("Ended");
    }

    public void terminate() {
        this.terminable.terminate();
    }

    public static void main(final String[] args) {
        final MomConfig config = defaultConfig();
        String name = NAME_DEFAULT;

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
        options.addOption(Option.builder("p")
                .longOpt(PORT_OPTION).argName(PORT_OPTION)
                .hasArg()
                .desc(String.format("port of the guest server.%nDefault: %s", config.get("server", "port")))
                .type(Integer.class)
                .build());
        options.addOption(Option.builder("n")
                .longOpt(NAME_OPTION).argName(NAME_OPTION)
                .hasArg()
                .desc(String.format("name of this guest.%nDefault: %s", NAME_DEFAULT))
                .type(String.class)
                .build());

        final CommandLineParser parser = new DefaultParser();
        try {
            final CommandLine cmd = parser.parse(options, args);
            if (cmd.hasOption("h")) {
                final HelpFormatter formatter = new HelpFormatter();
                formatter.printHelp("java -cp target/mom-1.0-SNAPSHOT-jar-with-dependencies.jar "
                        + MomGuestDaemon.class.getName() + " [options]", options);
                return;
            }
            if (cmd.hasOption(CONFIG_OPTION)) {
                config.load(Paths.get(cmd.getOptionValue(CONFIG_OPTION)));
            }
            if (cmd.hasOption(PORT_OPTION)) {
                config.set("server", "port", Integer.parseInt(cmd.getOptionValue(PORT_OPTION)));
            }
            if (cmd.hasOption(NAME_OPTION)) {
                name = cmd.getOptionValue(NAME_OPTION);
            }
        } catch (final ParseException | NumberFormatException e) {
            LOG.error("Failed to parse command line: {}", e.getMessage());
            new HelpFormatter().printHelp(MomGuestDaemon.class.getName(), options);
            System.exit(-1);
        } catch (final IOException e) {
            LOG.error("Failed to load configuration: {}", e.toString());
            System.exit(-1);
        }

        final Terminable terminable = new Terminable();
        try {
            final MomGuestDaemon daemon = new MomGuestDaemon(config, name, terminable);
            Runtime.getRuntime().addShutdownHook(new Thread(daemon::terminate, "MomGuestDaemon-shutdown"));
            daemon.bind();
            daemon.start();
        } catch (final IOException | IllegalArgumentException e) {
            LOG.error("Guest daemon failed", e);
            System.exit(-1);
        }
    }
}
