// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hiero.timing.assertions.ElapsedTimeCondition.greaterThan;
import static org.hiero.timing.assertions.ElapsedTimeCondition.lessThan;
import static org.hiero.timing.assertions.ElapsedTimeCondition.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import org.hiero.base.timing.ExecutionFailedException;
import org.hiero.base.timing.TimedExecution;
import org.hiero.base.timing.test.fixtures.ScriptedExecution;
import org.hiero.timing.assertions.config.TimingAssertionsConfig;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ElapsedTimePollerTest {

    private static final Duration MS_100 = Duration.ofMillis(100);

    @Mock
    private TimedExecution mockExecution;

    @AfterEach
    void clearInterrupt() {
        // a test may leave the interrupt flag set on purpose
        Thread.interrupted();
    }

    private static ElapsedTimePoller poller(final TimedExecution execution) {
        return new ElapsedTimePoller(execution, TimingAssertionsConfig.DEFAULT);
    }

    @Test
    @DisplayName("An execution that already finished is not waited on")
    void finishedExecutionReturnsImmediately() {
        final ScriptedExecution execution = ScriptedExecution.finishedAfter(Duration.ofMillis(250));

        final PollOutcome outcome = poller(execution).pollUntil(lessThan(MS_100), false, MS_100);

        assertEquals(PollTermination.FINISHED, outcome.termination());
        assertFalse(outcome.stillRunning());
        assertEquals(Duration.ofMillis(250), outcome.elapsed());
        assertThat(execution.awaitTimeouts()).isEmpty();
    }

    @Test
    @DisplayName("Polling stops as soon as the condition reaches the awaited result")
    void stopsWhenDecided() {
        final ScriptedExecution execution = ScriptedExecution.neverFinishing();

        final PollOutcome outcome = poller(execution).pollUntil(lessThanOrEqualTo(MS_100), false, MS_100);

        assertEquals(PollTermination.DECIDED, outcome.termination());
        assertTrue(outcome.stillRunning());
        assertEquals(Duration.ofMillis(200), outcome.elapsed());
        assertEquals(List.of(MS_100, MS_100), execution.awaitTimeouts(), "the poll rate is the given rate");
    }

    @Test
    @DisplayName("Polling waits for the execution to finish while the condition is undecided")
    void waitsForCompletion() {
        final ScriptedExecution execution = ScriptedExecution.finishingAfter(Duration.ofMillis(50));

        final PollOutcome outcome = poller(execution).pollUntil(lessThan(MS_100), false, MS_100);

        assertEquals(PollTermination.FINISHED, outcome.termination());
        assertEquals(Duration.ofMillis(50), outcome.elapsed());
        assertEquals(List.of(MS_100), execution.awaitTimeouts(), "one wait is enough for a fast execution");
    }

    @Test
    @DisplayName("A lower bound is decided without waiting for the execution to finish")
    void lowerBoundDecidesEarly() {
        final ScriptedExecution execution = ScriptedExecution.finishingAfter(Duration.ofSeconds(10));

        final PollOutcome outcome = poller(execution).pollUntil(greaterThan(MS_100), true, MS_100);

        assertEquals(PollTermination.DECIDED, outcome.termination());
        assertEquals(Duration.ofMillis(200), outcome.elapsed());
        assertTrue(execution.isRunning());
    }

    @Test
    @DisplayName("Elapsed samples never decrease during one poll")
    void samplesAreMonotonic() {
        final ScriptedExecution execution = ScriptedExecution.finishingAfter(Duration.ofMillis(1050));

        final PollOutcome outcome = poller(execution).pollUntil(greaterThan(Duration.ofSeconds(2)), true, MS_100);

        assertEquals(PollTermination.FINISHED, outcome.termination());
        assertEquals(Duration.ofMillis(1050), outcome.elapsed());
        assertThat(execution.samples()).hasSizeGreaterThan(10).isSortedAccordingTo(Comparator.naturalOrder());
    }

    @Test
    @DisplayName("A captured unchecked exception is rethrown although the finished execution satisfies the condition")
    void capturedExceptionBeatsPassingCondition() {
        final IllegalStateException failure = new IllegalStateException("invalid operation");
        final ScriptedExecution execution = ScriptedExecution.failingAfter(Duration.ofMillis(50), failure);

        assertThatThrownBy(() -> poller(execution).pollUntil(lessThan(Duration.ofSeconds(1)), false, MS_100))
                .isSameAs(failure);
    }

    @Test
    @DisplayName("A captured error is rethrown as is")
    void capturedErrorIsRethrown() {
        final StackOverflowError failure = new StackOverflowError();
        final ScriptedExecution execution = ScriptedExecution.failingAfter(Duration.ofMillis(10), failure);

        assertThatThrownBy(() -> poller(execution).pollUntil(lessThan(MS_100), false, MS_100))
                .isSameAs(failure);
    }

    @Test
    @DisplayName("A captured checked exception is rethrown wrapped, keeping the original as cause")
    void capturedCheckedExceptionIsWrapped() {
        final IOException failure = new IOException("connection reset");
        final ScriptedExecution execution = ScriptedExecution.failingAfter(Duration.ofMillis(10), failure);

        assertThatThrownBy(() -> poller(execution).pollUntil(lessThan(MS_100), false, MS_100))
                .isInstanceOf(ExecutionFailedException.class)
                .cause()
                .isSameAs(failure);
    }

    @Test
    @DisplayName("A rate below the minimum poll interval is raised to the minimum")
    void rateIsClampedToMinimum() {
        final ScriptedExecution execution = ScriptedExecution.neverFinishing();
        final TimingAssertionsConfig config = new TimingAssertionsConfig(Duration.ofMillis(5), null);

        final PollOutcome outcome =
                new ElapsedTimePoller(execution, config).pollUntil(greaterThan(Duration.ZERO), true, Duration.ZERO);

        assertEquals(PollTermination.DECIDED, outcome.termination());
        assertEquals(Duration.ofMillis(5), outcome.elapsed());
        assertEquals(List.of(Duration.ofMillis(5)), execution.awaitTimeouts());
    }

    @Test
    @DisplayName("Polling stops at the configured ceiling without sleeping past it")
    void stopsAtCeiling() {
        final ScriptedExecution execution = ScriptedExecution.neverFinishing();
        final TimingAssertionsConfig config = TimingAssertionsConfig.DEFAULT.withPollCeiling(Duration.ofMillis(250));

        final PollOutcome outcome = new ElapsedTimePoller(execution, config)
                .pollUntil(greaterThan(Duration.ofSeconds(1)), true, Duration.ofSeconds(1));

        assertEquals(PollTermination.CEILING_REACHED, outcome.termination());
        assertTrue(outcome.stillRunning());
        assertEquals(Duration.ofMillis(250), outcome.elapsed());
        assertEquals(List.of(Duration.ofMillis(250)), execution.awaitTimeouts());
    }

    @Test
    @DisplayName("An interrupted wait restores the interrupt flag and fails")
    void interruptedWait() throws InterruptedException {
        final InterruptedException interruption = new InterruptedException();
        when(mockExecution.elapsed()).thenReturn(Duration.ZERO);
        when(mockExecution.isRunning()).thenReturn(true);
        when(mockExecution.description()).thenReturn("the mocked action");
        when(mockExecution.awaitCompletion(any())).thenThrow(interruption);

        assertThatThrownBy(() -> poller(mockExecution).pollUntil(greaterThan(MS_100), true, MS_100))
                .isInstanceOf(RuntimeException.class)
                .hasMessageContaining("the mocked action")
                .cause()
                .isSameAs(interruption);
        assertTrue(Thread.currentThread().isInterrupted());
    }

    @Test
    void nullArgumentsAreRejected() {
        final ScriptedExecution execution = ScriptedExecution.neverFinishing();

        assertThatThrownBy(() -> new ElapsedTimePoller(null, TimingAssertionsConfig.DEFAULT))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ElapsedTimePoller(execution, null)).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> poller(execution).pollUntil(null, true, MS_100))
                .isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> poller(execution).pollUntil(lessThan(MS_100), true, null))
                .isInstanceOf(NullPointerException.class);
    }
}
