// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;

/**
 * A condition on the elapsed time of an execution. Conditions are pure functions of their argument and may be
 * evaluated any number of times.
 */
@FunctionalInterface
public interface ElapsedTimeCondition {

    /**
     * Evaluates this condition.
     *
     * @param elapsed the elapsed time to check
     * @return {@code true} if the elapsed time satisfies this condition
     */
    boolean test(@NonNull Duration elapsed);

    /**
     * Returns a condition that holds when both this condition and the other one hold.
     *
     * @param other the other condition
     * @return the combined condition
     */
    @NonNull
    default ElapsedTimeCondition and(@NonNull final ElapsedTimeCondition other) {
        requireNonNull(other, "other must not be null");
        return elapsed -> test(elapsed) && other.test(elapsed);
    }

    /**
     * @param max the inclusive upper bound
     * @return a condition holding when the elapsed time is at most {@code max}
     */
    @NonNull
    static ElapsedTimeCondition lessThanOrEqualTo(@NonNull final Duration max) {
        requireNonNull(max, "max must not be null");
        return elapsed -> elapsed.compareTo(max) <= 0;
    }

    /**
     * @param max the exclusive upper bound
     * @return a condition holding when the elapsed time is below {@code max}
     */
    @NonNull
    static ElapsedTimeCondition lessThan(@NonNull final Duration max) {
        requireNonNull(max, "max must not be null");
        return elapsed -> elapsed.compareTo(max) < 0;
    }

    /**
     * @param min the inclusive lower bound
     * @return a condition holding when the elapsed time is at least {@code min}
     */
    @NonNull
    static ElapsedTimeCondition greaterThanOrEqualTo(@NonNull final Duration min) {
        requireNonNull(min, "min must not be null");
        return elapsed -> elapsed.compareTo(min) >= 0;
    }

    /**
     * @param min the exclusive lower bound
     * @return a condition holding when the elapsed time is above {@code min}
     */
    @NonNull
    static ElapsedTimeCondition greaterThan(@NonNull final Duration min) {
        requireNonNull(min, "min must not be null");
        return elapsed -> elapsed.compareTo(min) > 0;
    }
}
