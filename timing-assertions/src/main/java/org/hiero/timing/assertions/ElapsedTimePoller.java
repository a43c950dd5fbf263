// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.base.timing.ExecutionFailedException;
import org.hiero.base.timing.TimedExecution;
import org.hiero.timing.assertions.config.TimingAssertionsConfig;

/**
 * Waits on a {@link TimedExecution} until a condition on its elapsed time is decided.
 *
 * <p>The poller samples the elapsed time, and while the execution is running and the condition has not yet produced
 * the awaited result, blocks until either the execution finishes or the poll rate has passed. Waiting on the
 * execution's completion is the only point where the calling thread blocks. There is no internal deadline unless a
 * {@linkplain TimingAssertionsConfig#pollCeiling() ceiling} is configured.
 *
 * <p>If the execution terminated with an exception, that exception is rethrown once polling stops, regardless of
 * what the condition decided.
 */
public final class ElapsedTimePoller {

    private static final Logger log = LogManager.getLogger();

    private final TimedExecution execution;
    private final TimingAssertionsConfig config;

    /**
     * Creates a poller for the given execution.
     *
     * @param execution the execution to poll
     * @param config the poll settings
     */
    public ElapsedTimePoller(@NonNull final TimedExecution execution, @NonNull final TimingAssertionsConfig config) {
        this.execution = requireNonNull(execution, "execution must not be null");
        this.config = requireNonNull(config, "config must not be null");
    }

    /**
     * Polls the execution until the condition returns {@code expectedResult}, the execution finishes, or the ceiling
     * is reached.
     *
     * @param condition the condition to evaluate on each sample
     * @param expectedResult the result of the condition at which polling stops early
     * @param rate how long to wait for the execution to finish between two samples; raised to the configured minimum
     *             poll interval if smaller
     * @return the state of the execution when polling stopped
     * @throws RuntimeException the exception captured by the execution, if it is unchecked
     * @throws Error the error captured by the execution
     * @throws ExecutionFailedException wrapping the exception captured by the execution, if it is checked
     */
    @NonNull
    public PollOutcome pollUntil(
            @NonNull final ElapsedTimeCondition condition, final boolean expectedResult, @NonNull final Duration rate) {
        requireNonNull(condition, "condition must not be null");
        requireNonNull(rate, "rate must not be null");

        final Duration pollInterval = max(rate, config.minimumPollInterval());
        final Duration ceiling = config.pollCeiling();

        Duration elapsed = execution.elapsed();
        boolean running = execution.isRunning();
        PollTermination termination = PollTermination.FINISHED;

        while (running) {
            if (condition.test(elapsed) == expectedResult) {
                termination = PollTermination.DECIDED;
                break;
            }
            if (ceiling != null && elapsed.compareTo(ceiling) >= 0) {
                log.warn(
                        "Stopped waiting for execution of {} after {}, it is still running",
                        execution.description(),
                        elapsed);
                termination = PollTermination.CEILING_REACHED;
                break;
            }

            running = !awaitCompletion(waitTime(pollInterval, ceiling, elapsed));
            elapsed = execution.elapsed();
            log.trace("Sampled execution of {}: elapsed={}, running={}", execution.description(), elapsed, running);
        }

        if (!running) {
            // the last sample may predate the completion, the frozen value is final
            elapsed = execution.elapsed();
        }

        final Throwable captured = execution.capturedException();
        if (captured != null) {
            log.debug("Execution of {} failed, rethrowing its exception", execution.description());
            throw ExecutionFailedException.rethrow(execution.description(), captured);
        }

        log.debug("Stopped polling execution of {}: {} after {}", execution.description(), termination, elapsed);
        return new PollOutcome(termination, elapsed);
    }

    private boolean awaitCompletion(@NonNull final Duration timeout) {
        try {
            return execution.awaitCompletion(timeout);
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException(
                    "Interrupted while waiting for execution of " + execution.description() + " to finish", e);
        }
    }

    @NonNull
    private static Duration waitTime(
            @NonNull final Duration pollInterval, @Nullable final Duration ceiling, @NonNull final Duration elapsed) {
        if (ceiling == null) {
            return pollInterval;
        }
        // do not sleep past the ceiling
        final Duration remaining = ceiling.minus(elapsed);
        return remaining.compareTo(pollInterval) < 0 ? remaining : pollInterval;
    }

    @NonNull
    private static Duration max(@NonNull final Duration a, @NonNull final Duration b) {
        return a.compareTo(b) >= 0 ? a : b;
    }
}
