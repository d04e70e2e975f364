/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * A daemon thread that logs its start and end, and logs (instead of printing) whatever escapes its body.
 * Subclasses override {@link #loggedRun()}, or pass a body to the constructor.
 */
public class LoggedThread extends Thread {
    private static final Logger LOG = LogManager.getLogger(LoggedThread.class);

    private final Runnable body;
    private final DeferredStart deferredStart;
    private final boolean verbose;

    public LoggedThread(final String name, final Runnable body, final DeferredStart deferredStart,
            final boolean verbose) {
        super(name);
        this.body = body;
        this.deferredStart = deferredStart;
        this.verbose = verbose;
        setDaemon(true);
    }

    public LoggedThread(final String name, final Runnable body) {
        this(name, body, null, true);
    }

    protected LoggedThread(final String name, final DeferredStart deferredStart) {
        this(name, null, deferredStart, true);
    }

    protected LoggedThread(final String name) {
        this(name, null, null, true);
    }

    @Override
    public final void run() {
        if (this.deferredStart != null) {
            LOG.info("{}: started deferred, waiting for start event", getName());
            if (!this.deferredStart.await()) {
                return;
            }
        }
        try {
            if (this.verbose) {
                LOG.info("{}: started", getName());
            }
            loggedRun();
            if (this.verbose) {
                LOG.info("{}: ended", getName());
            }
        } catch (final RuntimeException e) {
            LOG.error("{}: exception in thread", getName(), e);
        }
    }

    protected void loggedRun() {
        if (this.body != null) {
            this.body.run();
        }
    }
}
