// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;

/**
 * The state of an execution at the moment the {@link ElapsedTimePoller} stopped waiting.
 *
 * @param termination why polling stopped
 * @param elapsed the last elapsed time sampled from the execution
 */
public record PollOutcome(@NonNull PollTermination termination, @NonNull Duration elapsed) {

    /**
     * Creates a new instance.
     *
     * @param termination why polling stopped
     * @param elapsed the last elapsed time sampled from the execution
     */
    public PollOutcome {
        requireNonNull(termination, "termination must not be null");
        requireNonNull(elapsed, "elapsed must not be null");
    }

    /**
     * @return {@code true} if the execution had not finished when polling stopped
     */
    public boolean stillRunning() {
        return termination != PollTermination.FINISHED;
    }
}
