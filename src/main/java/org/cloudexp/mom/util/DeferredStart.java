/*
 * Copyright 2022 VMware, Inc. All Rights Reserved.
 * SPDX-License-Identifier: BSD-2 OR MIT
 */

package org.cloudexp.mom.util;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A start gate shared by threads that must not enter their main loop before an external "go".
 * Termination of the owning {@link Terminable} opens the gate so no thread hangs on it.
 */
public class DeferredStart {
    private final CountDownLatch startLatch = new CountDownLatch(1);
    private final Terminable terminable;
    private final double startTimeout;
    private volatile double startTime = Double.NaN;

    /**
     * @param terminable   the cancellation token of the threads waiting on this gate
     * @param startTimeout seconds to wait for the go signal, non-positive waits forever
     */
    public DeferredStart(final Terminable terminable, final double startTimeout) {
        this.terminable = terminable;
        this.startTimeout = startTimeout;
        terminable.onTerminate(this.startLatch::countDown);
    }

    public DeferredStart(final Terminable terminable) {
        this(terminable, 0);
    }

    public synchronized void go() {
        if (this.startLatch.getCount() > 0) {
            this.startTime = TimeUtils.now();
            this.startLatch.countDown();
        }
    }

    public double getStartTime() {
        return this.startTime;
    }

    public boolean isStarted() {
        return this.startLatch.getCount() == 0;
    }

    /**
     * Block until go, termination or the start timeout.
     *
     * @return true if the waiting thread should proceed to its main loop
     */
    public boolean await() {
        try {
            if (this.startTimeout > 0) {
                this.startLatch.await((long) (this.startTimeout * 1000), TimeUnit.MILLISECONDS);
            } else {
                this.startLatch.await();
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return this.terminable.shouldRun();
    }
}
