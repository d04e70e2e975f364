/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A shared cancellation handle. Every component that has to observe daemon termination receives the
 * same instance (or a child of it) in its constructor. Termination is idempotent and wakes up every
 * thread blocked in {@link #sleep(double)} immediately.
 */
public class Terminable {
    public static final double MINIMAL_SLEEP = 1e-2;

    private final CountDownLatch terminated = new CountDownLatch(1);
    private final AtomicBoolean terminating = new AtomicBoolean(false);
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * Create a token that is terminated together with this one, but can also be terminated on
     * its own without affecting this token.
     *
     * @return the child token
     */
    public Terminable child() {
        final Terminable child = new Terminable();
        final Runnable propagate = child::terminate;
        this.onTerminate(propagate);
        child.onTerminate(() -> this.listeners.remove(propagate));
        return child;
    }

    /**
     * Register a callback to run once on termination. Runs right away if already terminated.
     * Callbacks must be idempotent.
     *
     * @param listener the callback
     */
    public void onTerminate(final Runnable listener) {
        this.listeners.add(listener);
        if (!shouldRun()) {
            listener.run();
        }
    }

    public void terminate() {
        if (!this.terminating.compareAndSet(false, true)) {
            return;
        }
        this.terminated.countDown();
        for (final Runnable listener : this.listeners) {
            listener.run();
        }
    }

    public boolean shouldRun() {
        return this.terminated.getCount() > 0;
    }

    /**
     * Sleep until the timeout elapsed or until termination, whichever comes first.
     *
     * @param seconds the time to sleep, non-positive values return immediately
     * @return true if the caller should keep running
     */
    public boolean sleep(final double seconds) {
        if (seconds <= MINIMAL_SLEEP) {
            return shouldRun();
        }
        try {
            return !this.terminated.await((long) (seconds * 1000), TimeUnit.MILLISECONDS);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
