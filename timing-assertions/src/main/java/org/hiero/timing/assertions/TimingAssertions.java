// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.function.Consumer;
import org.assertj.core.api.Assertions;
import org.hiero.base.timing.ExecutionTime;
import org.hiero.base.timing.TimedExecution;

/**
 * This class contains all {@code assertThat()} methods for execution times, next to the ones inherited from AssertJ.
 */
public class TimingAssertions extends Assertions {

    private TimingAssertions() {}

    /**
     * Creates an assertion for the given execution.
     *
     * @param actual the execution to assert on
     * @return an assertion for the given execution
     * @throws NullPointerException if {@code actual} is {@code null}
     */
    @NonNull
    public static ExecutionTimeAssert assertThat(@NonNull final TimedExecution actual) {
        return ExecutionTimeAssert.assertThat(actual);
    }

    /**
     * Starts the given action in the background and creates an assertion on its execution time.
     *
     * @param action the action to measure
     * @return an assertion on the execution time of the action
     */
    @NonNull
    public static ExecutionTimeAssert assertThatExecutionTimeOf(@NonNull final Runnable action) {
        return assertThat(ExecutionTime.start(action));
    }

    /**
     * Starts the given action in the background and creates an assertion on its execution time.
     *
     * @param description the description of the action used in failure messages
     * @param action the action to measure
     * @return an assertion on the execution time of the action
     */
    @NonNull
    public static ExecutionTimeAssert assertThatExecutionTimeOf(
            @NonNull final String description, @NonNull final Runnable action) {
        return assertThat(ExecutionTime.start(description, action));
    }

    /**
     * Starts an operation on the given subject in the background and creates an assertion on its execution time.
     *
     * @param subject the subject the operation is performed on
     * @param member the operation to measure
     * @param <T> the type of the subject
     * @return an assertion on the execution time of the operation
     */
    @NonNull
    public static <T> ExecutionTimeAssert assertThatExecutionTimeOf(
            @NonNull final T subject, @NonNull final Consumer<? super T> member) {
        return assertThatExecutionTimeOf(subject, member, null);
    }

    /**
     * Starts an operation on the given subject in the background and creates an assertion on its execution time.
     *
     * @param subject the subject the operation is performed on
     * @param member the operation to measure
     * @param description the description of the operation used in failure messages, or {@code null} to derive one
     *                    from the subject's type
     * @param <T> the type of the subject
     * @return an assertion on the execution time of the operation
     */
    @NonNull
    public static <T> ExecutionTimeAssert assertThatExecutionTimeOf(
            @NonNull final T subject, @NonNull final Consumer<? super T> member, @Nullable final String description) {
        return assertThat(ExecutionTime.startMember(subject, member, description));
    }
}
