// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions;

/**
 * The reason the {@link ElapsedTimePoller} stopped waiting.
 */
public enum PollTermination {
    /** The condition reached the result the poller was waiting for while the execution was still running. */
    DECIDED,
    /** The execution finished. */
    FINISHED,
    /** The configured poll ceiling was reached while the execution was still running. */
    CEILING_REACHED
}
