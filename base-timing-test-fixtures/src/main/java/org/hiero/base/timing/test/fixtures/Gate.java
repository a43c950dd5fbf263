// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.timing.test.fixtures;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * A one-shot gate. Threads knocking on a closed gate block until it is opened.
 */
public class Gate {
    private final CountDownLatch latch = new CountDownLatch(1);

    private Gate() {}

    /**
     * Creates a gate that blocks until {@link #open()} is called.
     *
     * @return a new Gate
     */
    public static Gate closedGate() {
        return new Gate();
    }

    /**
     * Blocks the calling thread while the gate is closed.
     *
     * @param timeout the maximum time to wait for the gate to open
     * @throws IllegalStateException if the gate is still closed after the timeout
     */
    public void knock(final Duration timeout) {
        try {
            if (!latch.await(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw new IllegalStateException("Gate is still closed after " + timeout);
            }
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting for the gate to open", e);
        }
    }

    /**
     * Opens the gate and releases all blocked threads.
     */
    public void open() {
        latch.countDown();
    }

    /**
     * @return {@code true} if the gate is open
     */
    public boolean isOpen() {
        return latch.getCount() == 0;
    }

    @Override
    public String toString() {
        return "Gate{" + "open=" + isOpen() + '}';
    }
}
