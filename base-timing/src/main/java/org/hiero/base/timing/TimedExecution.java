// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.timing;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;

/**
 * A handle to an operation that runs (or has run) in the background and whose execution time is being measured.
 *
 * <p>Implementations must be safe to query from any thread while the operation is running. Once the operation has
 * finished, {@link #elapsed()} no longer changes, {@link #isRunning()} returns {@code false} and
 * {@link #capturedException()} returns the same value on every call.
 */
public interface TimedExecution {

    /**
     * Returns a human-readable description of the measured operation, used in failure messages.
     *
     * @return the description of the operation
     */
    @NonNull
    String description();

    /**
     * Returns the time that has elapsed since the operation was started. While the operation is running the value is
     * non-decreasing between calls; after it finished the value is frozen at the total execution time.
     *
     * @return the elapsed time
     */
    @NonNull
    Duration elapsed();

    /**
     * Returns whether the operation is still running.
     *
     * @return {@code true} if the operation has not finished yet
     */
    boolean isRunning();

    /**
     * Returns the exception thrown by the operation, if it terminated abnormally.
     *
     * @return the exception thrown by the operation, or {@code null} if it is running or finished normally
     */
    @Nullable
    Throwable capturedException();

    /**
     * Blocks the calling thread until the operation has finished or the given timeout has passed, whichever comes
     * first.
     *
     * @param timeout the maximum time to wait; zero or negative values do not block
     * @return {@code true} if the operation has finished, {@code false} if the timeout passed first
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    boolean awaitCompletion(@NonNull Duration timeout) throws InterruptedException;
}
