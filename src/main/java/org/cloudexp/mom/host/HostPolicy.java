/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.host;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.cloudexp.mom.communication.GuestClient;
import org.cloudexp.mom.communication.Message;
import org.cloudexp.mom.communication.MessageError;
import org.cloudexp.mom.communication.MessageInquiry;
import org.cloudexp.mom.communication.MessageNotify;
import org.cloudexp.mom.host.allocators.Allocator;
import org.cloudexp.mom.host.allocators.Allocators;
import org.cloudexp.mom.host.allocators.InquiryAllocator;
import org.cloudexp.mom.host.controllers.Controller;
import org.cloudexp.mom.host.controllers.Controllers;
import org.cloudexp.mom.hypervisor.HypervisorInterface;
import org.cloudexp.mom.monitor.Monitor;
import org.cloudexp.mom.monitor.MonitorDataEntity;
import org.cloudexp.mom.util.DataLogger;
import org.cloudexp.mom.util.DictUtils;
import org.cloudexp.mom.util.LoggedThread;
import org.cloudexp.mom.util.MomConfig;
import org.cloudexp.mom.util.Terminable;
import org.cloudexp.mom.util.TimeUtils;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * The host control loop. Every cycle it asks the guests what they want, lets the allocator decide,
 * tells the guests the decision, gives them the grace period to get ready, and then applies the
 * controls.
 */
public class HostPolicy extends LoggedThread {
    private static final Logger LOG = LogManager.getLogger(HostPolicy.class);
    public static final String DATA_LOG_TYPE = "policy";
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Terminable terminable;
    private final Monitor hostMonitor;
    private final GuestManager guestManager;

    private final double interval;
    private final double gracePeriod;
    private final double inquiryTimeout;
    private final List<String> resources;
    private final Allocator allocator;
    private final List<Controller> controllers = new ArrayList<>();

    private final ReentrantLock policyLock = new ReentrantLock();
    private final ExecutorService dispatcher;

    public HostPolicy(final MomConfig config, final HypervisorInterface hypervisor, final Monitor hostMonitor,
            final GuestManager guestManager, final Terminable terminable) {
        super("HostPolicy");
        this.terminable = terminable;
        this.hostMonitor = hostMonitor;
        this.guestManager = guestManager;

        this.interval = Math.max(1, config.getDouble("policy", "interval"));
        this.gracePeriod = Math.max(0, Math.min(this.interval, config.getDouble("policy", "grace-period")));
        this.inquiryTimeout = Math.max(0, Math.min(this.interval, config.getDouble("policy", "inquiry-timeout")));
        this.resources = config.getList("policy", "resources");
        this.allocator = Allocators.create(config.get("policy", "allocator"), this.resources);

        final Map<String, Object> controllerProperties = new HashMap<>();
        controllerProperties.put(Monitor.PROP_CONFIG, config);
        if (hypervisor != null) {
            controllerProperties.put(Monitor.PROP_HYPERVISOR, hypervisor);
        }
        for (final String resource : this.resources) {
            final String name = config.get("policy", resource + "-controller");
            if (name == null) {
                LOG.warn("No controller configured for resource '{}'", resource);
                continue;
            }
            try {
                this.controllers.add(Controllers.create(name, resource, controllerProperties));
            } catch (final RuntimeException e) {
                LOG.error("Failed to initiate controller '{}' for resource '{}'", name, resource, e);
            }
        }

        final int maxWorkers = Math.max(1, config.getInt("policy", "max-workers"));
        final AtomicInteger threadCount = new AtomicInteger();
        this.dispatcher = Executors.newFixedThreadPool(maxWorkers, r -> {
            final Thread t = new Thread(r, "HostPolicy-dispatcher-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });

        LOG.info("Policy interval: {} sec, grace period: {} sec, inquiry timeout: {} sec", this.interval,
                this.gracePeriod, this.inquiryTimeout);
    }

    public double getInterval() {
        return this.interval;
    }

    public double getGracePeriod() {
        return this.gracePeriod;
    }

    public double getInquiryTimeout() {
        return this.inquiryTimeout;
    }

    public List<Controller> getControllers() {
        return Collections.unmodifiableList(this.controllers);
    }

    /**
     * What is left of the grace period.
     *
     * @param gracePeriod the full grace period
     * @param elapsed     seconds since the cycle's inquiry started
     * @return the remaining seconds, never negative
     */
    public static double remainingGrace(final double gracePeriod, final double elapsed) {
        return Math.max(0, gracePeriod - elapsed);
    }

    /// Run fn on every guest through the dispatcher pool and wait for all of them
    private void dispatch(final List<MonitorDataEntity> guests, final Consumer<MonitorDataEntity> fn) {
        final List<Callable<Void>> tasks = new ArrayList<>();
        for (final MonitorDataEntity guest : guests) {
            tasks.add(() -> {
                fn.accept(guest);
                return null;
            });
        }
        try {
            this.dispatcher.invokeAll(tasks);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Map<String, Object> sendToGuest(final MonitorDataEntity guest, final Message msg, final double timeout)
            throws IOException, MessageError {
        final GuestClient client = (GuestClient) guest.prop(Monitor.PROP_GUEST_CLIENT);
        if (client == null) {
            throw new MessageError("No guest client for " + guest.getName());
        }
        return client.sendReceiveMessage(msg, timeout);
    }

    private void inquireGuest(final MonitorDataEntity guest) {
        guest.getVariables().remove(InquiryAllocator.VAR_INQUIRY);
        try {
            final Map<String, Object> result = sendToGuest(guest,
                    new MessageInquiry(guest.getLastControl(), this.gracePeriod, this.inquiryTimeout),
                    this.inquiryTimeout);
            guest.setVar(InquiryAllocator.VAR_INQUIRY, result);
        } catch (final SocketTimeoutException e) {
            if (this.terminable.shouldRun()) {
                LOG.error("{}: inquiry timed out after {} sec", guest.getName(), this.inquiryTimeout);
            }
        } catch (final IOException | MessageError | RuntimeException e) {
            if (this.terminable.shouldRun()) {
                LOG.error("{}: inquiry failed", guest.getName(), e);
            }
        }
    }

    private Map<String, Double> allocation(final MonitorDataEntity guest) {
        final Map<String, Double> alloc = new LinkedHashMap<>();
        for (final String r : this.resources) {
            final Double value = guest.getControl(r);
            if (value != null) {
                alloc.put(r, value);
            }
        }
        return alloc;
    }

    private void notifyGuest(final MonitorDataEntity guest, final Double grace) {
        final Map<String, Double> alloc = allocation(guest);
        if (alloc.isEmpty()) {
            return;
        }
        final double timeout = grace != null && grace > 0 ? grace : this.inquiryTimeout;
        try {
            sendToGuest(guest, new MessageNotify(alloc, grace), timeout);
        } catch (final SocketTimeoutException e) {
            if (this.terminable.shouldRun()) {
                LOG.error("{}: notification timed out after {} sec", guest.getName(), timeout);
            }
        } catch (final IOException | MessageError | RuntimeException e) {
            if (this.terminable.shouldRun()) {
                LOG.error("{}: notification failed", guest.getName(), e);
            }
        }
    }

    private void applyControls(final MonitorDataEntity host, final List<MonitorDataEntity> guests) {
        for (final Controller controller : this.controllers) {
            try {
                controller.applyControl(host, guests);
            } catch (final RuntimeException e) {
                LOG.error("Controller {} of resource '{}' failed", controller.getClass().getName(),
                        controller.getResource(), e);
            }
        }
    }

    private static void logPolicyData(final MonitorDataEntity entity, final Map<String, ?> data, final double start,
            final double end) {
        DataLogger.appendData(DATA_LOG_TYPE, (String) entity.prop(Monitor.PROP_SOURCE), data, start, end);
    }

    /// One policy cycle; returns early once terminated
    public void doControls() {
        if (!this.terminable.shouldRun()) {
            return;
        }
        final MonitorDataEntity host = this.hostMonitor.interrogate();
        if (host == null) {
            return;
        }
        final List<MonitorDataEntity> guests = new ArrayList<>(this.guestManager.interrogate().values());

        final double inquiryStart = TimeUtils.now();
        dispatch(guests, this::inquireGuest);
        if (!this.terminable.shouldRun()) {
            return;
        }

        final double policyStart = TimeUtils.now();
        this.policyLock.lock();
        try {
            this.allocator.applyPolicy(host, guests);
        } catch (final RuntimeException e) {
            LOG.error("Policy computation failed, skipping this cycle", e);
            return;
        } finally {
            this.policyLock.unlock();
        }
        if (!this.terminable.shouldRun()) {
            return;
        }

        final double notifyStart = TimeUtils.now();
        final double grace = remainingGrace(this.gracePeriod, notifyStart - inquiryStart);
        dispatch(guests, g -> notifyGuest(g, grace));
        final double notifyEnd = TimeUtils.now();
        final List<MonitorDataEntity> entities = new ArrayList<>(guests);
        entities.add(host);
        for (final MonitorDataEntity e : entities) {
            logPolicyData(e, Map.of("notify", new LinkedHashMap<>(e.getControls())), notifyStart, notifyEnd);
        }

        if (!this.terminable.sleep(remainingGrace(this.gracePeriod, TimeUtils.now() - inquiryStart))) {
            return;
        }

        applyControls(host, guests);
        final double policyEnd = TimeUtils.now();

        for (final MonitorDataEntity e : entities) {
            final Map<String, Object> data = new LinkedHashMap<>();
            data.put("controls", new LinkedHashMap<>(e.getControls()));
            data.put("variables", DictUtils.deepCopy(e.getVariables()));
            logPolicyData(e, data, policyStart, policyEnd);
            e.storeVariables();
        }

        dispatch(guests, g -> notifyGuest(g, null));
    }

    public void shutdownDispatcher() {
        this.dispatcher.shutdownNow();
        try {
            if (!this.dispatcher.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                LOG.warn("Dispatcher threads did not end in time");
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    protected void loggedRun() {
        try {
            while (this.terminable.shouldRun()) {
                final double start = TimeUtils.now();
                doControls();
                this.terminable.sleep(this.interval - (TimeUtils.now() - start));
            }
        } finally {
            shutdownDispatcher();
        }
    }
}
