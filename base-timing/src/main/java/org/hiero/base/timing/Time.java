// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.timing;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A source of monotonic time used to measure elapsed durations.
 *
 * <p>Values returned by {@link #nanoTime()} are only meaningful relative to other values from the same source.
 */
@FunctionalInterface
public interface Time {

    /**
     * Returns the current value of the time source, in nanoseconds.
     *
     * @return the current value of the time source
     */
    long nanoTime();

    /**
     * Returns the time source backed by {@link System#nanoTime()}.
     *
     * @return the system time source
     */
    @NonNull
    static Time getCurrent() {
        return SystemTime.INSTANCE;
    }
}
