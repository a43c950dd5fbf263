// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import org.assertj.core.api.AbstractAssert;
import org.hiero.base.timing.TimedExecution;
import org.hiero.timing.assertions.config.TimingAssertionsConfig;
import org.hiero.timing.assertions.config.TimingAssertionsConfigLoader;
import org.hiero.timing.assertions.internal.BecauseClause;
import org.hiero.timing.assertions.internal.DurationFormatter;

/**
 * Assertions on the execution time of a {@link TimedExecution}.
 *
 * <p>Each assertion waits only as long as needed to decide: an upper bound is failed as soon as the execution exceeds
 * it, a lower bound is passed as soon as the execution reaches it, and otherwise the assertion waits for the
 * execution to finish. If the execution terminated with an exception, the assertion rethrows that exception instead
 * of reporting a failure.
 *
 * <pre>{@code
 * assertThatExecutionTimeOf(() -> cache.load(key))
 *         .isLessThan(Duration.ofMillis(100), "because the cache is warm");
 * }</pre>
 */
@SuppressWarnings("UnusedReturnValue")
public class ExecutionTimeAssert extends AbstractAssert<ExecutionTimeAssert, TimedExecution> {

    private static final Duration MIN_DURATION = Duration.ofSeconds(Long.MIN_VALUE);
    private static final Duration MAX_DURATION = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    private TimingAssertionsConfig config;

    /**
     * Creates an assertion for the given execution using the default configuration.
     *
     * @param actual the execution to assert on
     * @throws NullPointerException if {@code actual} is {@code null}
     */
    public ExecutionTimeAssert(@NonNull final TimedExecution actual) {
        this(actual, TimingAssertionsConfigLoader.loadDefault());
    }

    /**
     * Creates an assertion for the given execution.
     *
     * @param actual the execution to assert on
     * @param config the poll settings
     * @throws NullPointerException if {@code actual} or {@code config} is {@code null}
     */
    public ExecutionTimeAssert(@NonNull final TimedExecution actual, @NonNull final TimingAssertionsConfig config) {
        super(requireNonNull(actual, "execution must not be null"), ExecutionTimeAssert.class);
        this.config = requireNonNull(config, "config must not be null");
    }

    /**
     * Creates an assertion for the given execution.
     *
     * @param actual the execution to assert on
     * @return a new instance of {@link ExecutionTimeAssert}
     */
    @NonNull
    public static ExecutionTimeAssert assertThat(@NonNull final TimedExecution actual) {
        return new ExecutionTimeAssert(actual);
    }

    /**
     * Stops waiting for a still running execution once its elapsed time reaches the given ceiling. An assertion that
     * is still undecided at the ceiling fails.
     *
     * @param ceiling the ceiling, or {@code null} to wait without limit
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert withPollCeiling(@Nullable final Duration ceiling) {
        config = config.withPollCeiling(ceiling);
        return myself;
    }

    /**
     * Replaces the poll settings of this assertion.
     *
     * @param config the poll settings
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert withConfiguration(@NonNull final TimingAssertionsConfig config) {
        this.config = requireNonNull(config, "config must not be null");
        return myself;
    }

    /**
     * Verifies that the execution time is less than or equal to the given duration.
     *
     * @param max the maximum allowed duration
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isLessThanOrEqualTo(@NonNull final Duration max) {
        return isLessThanOrEqualTo(max, "");
    }

    /**
     * Verifies that the execution time is less than or equal to the given duration.
     *
     * @param max the maximum allowed duration
     * @param because the reason for the assertion, a format string for {@code becauseArgs}; {@code "because "} is
     *                prepended if missing
     * @param becauseArgs the arguments for {@code because}
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isLessThanOrEqualTo(
            @NonNull final Duration max, @Nullable final String because, @Nullable final Object... becauseArgs) {
        requireNonNull(max, "max must not be null");
        final ElapsedTimeCondition condition = ElapsedTimeCondition.lessThanOrEqualTo(max);
        final PollOutcome outcome = poller().pollUntil(condition, false, max);
        if (!isSatisfied(condition, outcome)) {
            failExecution("less than or equal to " + DurationFormatter.format(max), outcome, because, becauseArgs);
        }
        return myself;
    }

    /**
     * Same as {@link #isLessThanOrEqualTo(Duration)}.
     *
     * @param max the maximum allowed duration
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isAtMost(@NonNull final Duration max) {
        return isLessThanOrEqualTo(max);
    }

    /**
     * Same as {@link #isLessThanOrEqualTo(Duration, String, Object...)}.
     *
     * @param max the maximum allowed duration
     * @param because the reason for the assertion
     * @param becauseArgs the arguments for {@code because}
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isAtMost(
            @NonNull final Duration max, @Nullable final String because, @Nullable final Object... becauseArgs) {
        return isLessThanOrEqualTo(max, because, becauseArgs);
    }

    /**
     * Verifies that the execution time is less than the given duration.
     *
     * @param max the exclusive upper bound
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isLessThan(@NonNull final Duration max) {
        return isLessThan(max, "");
    }

    /**
     * Verifies that the execution time is less than the given duration.
     *
     * @param max the exclusive upper bound
     * @param because the reason for the assertion
     * @param becauseArgs the arguments for {@code because}
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isLessThan(
            @NonNull final Duration max, @Nullable final String because, @Nullable final Object... becauseArgs) {
        requireNonNull(max, "max must not be null");
        final ElapsedTimeCondition condition = ElapsedTimeCondition.lessThan(max);
        final PollOutcome outcome = poller().pollUntil(condition, false, max);
        if (!isSatisfied(condition, outcome)) {
            failExecution("less than " + DurationFormatter.format(max), outcome, because, becauseArgs);
        }
        return myself;
    }

    /**
     * Verifies that the execution time is greater than or equal to the given duration.
     *
     * @param min the minimum required duration
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isGreaterThanOrEqualTo(@NonNull final Duration min) {
        return isGreaterThanOrEqualTo(min, "");
    }

    /**
     * Verifies that the execution time is greater than or equal to the given duration.
     *
     * @param min the minimum required duration
     * @param because the reason for the assertion
     * @param becauseArgs the arguments for {@code because}
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isGreaterThanOrEqualTo(
            @NonNull final Duration min, @Nullable final String because, @Nullable final Object... becauseArgs) {
        requireNonNull(min, "min must not be null");
        final ElapsedTimeCondition condition = ElapsedTimeCondition.greaterThanOrEqualTo(min);
        final PollOutcome outcome = poller().pollUntil(condition, true, min);
        if (!isSatisfied(condition, outcome)) {
            failExecution("greater than or equal to " + DurationFormatter.format(min), outcome, because, becauseArgs);
        }
        return myself;
    }

    /**
     * Same as {@link #isGreaterThanOrEqualTo(Duration)}.
     *
     * @param min the minimum required duration
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isAtLeast(@NonNull final Duration min) {
        return isGreaterThanOrEqualTo(min);
    }

    /**
     * Same as {@link #isGreaterThanOrEqualTo(Duration, String, Object...)}.
     *
     * @param min the minimum required duration
     * @param because the reason for the assertion
     * @param becauseArgs the arguments for {@code because}
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isAtLeast(
            @NonNull final Duration min, @Nullable final String because, @Nullable final Object... becauseArgs) {
        return isGreaterThanOrEqualTo(min, because, becauseArgs);
    }

    /**
     * Verifies that the execution time is greater than the given duration.
     *
     * @param min the exclusive lower bound
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isGreaterThan(@NonNull final Duration min) {
        return isGreaterThan(min, "");
    }

    /**
     * Verifies that the execution time is greater than the given duration.
     *
     * @param min the exclusive lower bound
     * @param because the reason for the assertion
     * @param becauseArgs the arguments for {@code because}
     * @return this assertion object for method chaining
     */
    @NonNull
    public ExecutionTimeAssert isGreaterThan(
            @NonNull final Duration min, @Nullable final String because, @Nullable final Object... becauseArgs) {
        requireNonNull(min, "min must not be null");
        final ElapsedTimeCondition condition = ElapsedTimeCondition.greaterThan(min);
        final PollOutcome outcome = poller().pollUntil(condition, true, min);
        if (!isSatisfied(condition, outcome)) {
            failExecution("greater than " + DurationFormatter.format(min), outcome, because, becauseArgs);
        }
        return myself;
    }

    /**
     * Verifies that the execution time differs from the expected duration by at most the given precision, both ends
     * inclusive.
     *
     * @param expected the expected duration
     * @param precision the maximum allowed difference, must not be negative
     * @return this assertion object for method chaining
     * @throws IllegalArgumentException if {@code precision} is negative
     */
    @NonNull
    public ExecutionTimeAssert isCloseTo(@NonNull final Duration expected, @NonNull final Duration precision) {
        return isCloseTo(expected, precision, "");
    }

    /**
     * Verifies that the execution time differs from the expected duration by at most the given precision, both ends
     * inclusive.
     *
     * @param expected the expected duration
     * @param precision the maximum allowed difference, must not be negative
     * @param because the reason for the assertion
     * @param becauseArgs the arguments for {@code because}
     * @return this assertion object for method chaining
     * @throws IllegalArgumentException if {@code precision} is negative
     */
    @NonNull
    public ExecutionTimeAssert isCloseTo(
            @NonNull final Duration expected,
            @NonNull final Duration precision,
            @Nullable final String because,
            @Nullable final Object... becauseArgs) {
        requireNonNull(expected, "expected must not be null");
        requireNonNull(precision, "precision must not be null");
        if (precision.isNegative()) {
            throw new IllegalArgumentException("The value of precision must be non-negative but was " + precision);
        }

        final Duration min = windowStart(expected, precision);
        final Duration max = windowEnd(expected, precision);
        final ElapsedTimeCondition minCondition = ElapsedTimeCondition.greaterThanOrEqualTo(min);
        final ElapsedTimeCondition maxCondition = ElapsedTimeCondition.lessThanOrEqualTo(max);

        // reaching the lower bound must not stop polling, only exceeding the upper bound can decide early
        final PollOutcome outcome = poller().pollUntil(maxCondition, false, max);
        if (!isSatisfied(minCondition.and(maxCondition), outcome)) {
            failExecution(
                    "within " + DurationFormatter.format(precision) + " from " + DurationFormatter.format(expected),
                    outcome,
                    because,
                    becauseArgs);
        }
        return myself;
    }

    /**
     * The window endpoints saturate at the limits of {@link Duration}, so a precision like
     * {@code ChronoUnit.FOREVER.getDuration()} means an unbounded window.
     */
    @NonNull
    private static Duration windowStart(@NonNull final Duration expected, @NonNull final Duration precision) {
        try {
            return expected.minus(precision);
        } catch (final ArithmeticException e) {
            return MIN_DURATION;
        }
    }

    @NonNull
    private static Duration windowEnd(@NonNull final Duration expected, @NonNull final Duration precision) {
        try {
            return expected.plus(precision);
        } catch (final ArithmeticException e) {
            return MAX_DURATION;
        }
    }

    /**
     * An execution abandoned at the poll ceiling was never shown to satisfy the condition, whatever its elapsed time
     * was at that moment.
     */
    private static boolean isSatisfied(
            @NonNull final ElapsedTimeCondition condition, @NonNull final PollOutcome outcome) {
        return outcome.termination() != PollTermination.CEILING_REACHED && condition.test(outcome.elapsed());
    }

    @NonNull
    private ElapsedTimePoller poller() {
        return new ElapsedTimePoller(actual, config);
    }

    private void failExecution(
            @NonNull final String expectation,
            @NonNull final PollOutcome outcome,
            @Nullable final String because,
            @Nullable final Object... becauseArgs) {
        final String elapsed = DurationFormatter.format(outcome.elapsed());
        final String actualPart;
        if (outcome.termination() == PollTermination.CEILING_REACHED) {
            actualPart = "it was still running after " + elapsed;
        } else {
            actualPart = "it required " + (outcome.stillRunning() ? "more than " : "exactly ") + elapsed;
        }
        final String message = "Execution of " + actual.description() + " should be " + expectation
                + BecauseClause.format(because, becauseArgs) + ", but " + actualPart + ".";
        // the message may contain '%' from the reason, keep it away from the format string
        failWithMessage("%s", message);
    }
}
