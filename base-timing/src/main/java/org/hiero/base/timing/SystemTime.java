// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.timing;

/**
 * {@link Time} backed by the JVM's monotonic clock.
 */
final class SystemTime implements Time {

    static final SystemTime INSTANCE = new SystemTime();

    private SystemTime() {}

    @Override
    public long nanoTime() {
        return System.nanoTime();
    }
}
