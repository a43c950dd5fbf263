// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.timing;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Supplier;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Runs an operation in the background and measures how long it takes.
 *
 * <p>The clock starts immediately before the operation is handed to the executor and stops when the operation
 * returns or throws. An exception thrown by the operation is captured and made available through
 * {@link #capturedException()} instead of being propagated.
 *
 * <p>Instances are created through the static {@code start} methods and are safe to query from any thread.
 */
public final class ExecutionTime implements TimedExecution {

    private static final Logger log = LogManager.getLogger();

    /**
     * The description used when the caller does not provide one.
     */
    public static final String DEFAULT_DESCRIPTION = "the action";

    private static final String THREAD_NAME_PREFIX = "execution-time-";

    private static final ExecutorService DEFAULT_EXECUTOR = Executors.newCachedThreadPool(new DaemonThreadFactory());

    private final String description;
    private final Time time;
    private final long startNanos;
    private final CountDownLatch finished = new CountDownLatch(1);

    /**
     * Set exactly once, under the monitor of this instance, when the operation terminates.
     */
    private volatile Completion completion;

    /**
     * The end of an execution, published in a single write so that the end time and the outcome are always observed
     * together.
     *
     * @param endNanos the value of the time source when the operation terminated
     * @param exception the exception thrown by the operation, or {@code null}
     */
    private record Completion(long endNanos, @Nullable Throwable exception) {}

    private ExecutionTime(@NonNull final String description, @NonNull final Time time) {
        this.description = requireNonNull(description, "description must not be null");
        this.time = requireNonNull(time, "time must not be null");
        this.startNanos = time.nanoTime();
    }

    /**
     * Starts measuring the execution time of the given action.
     *
     * @param action the action to run in the background
     * @return the handle of the running execution
     */
    @NonNull
    public static ExecutionTime start(@NonNull final Runnable action) {
        return start(DEFAULT_DESCRIPTION, action);
    }

    /**
     * Starts measuring the execution time of the given action.
     *
     * @param description the description of the action used in failure messages
     * @param action the action to run in the background
     * @return the handle of the running execution
     */
    @NonNull
    public static ExecutionTime start(@NonNull final String description, @NonNull final Runnable action) {
        return start(description, action, Time.getCurrent(), DEFAULT_EXECUTOR);
    }

    /**
     * Starts measuring the execution time of the given action using the given time source and executor.
     *
     * @param description the description of the action used in failure messages
     * @param action the action to run
     * @param time the time source used to measure the elapsed time
     * @param executor the executor that runs the action
     * @return the handle of the running execution
     * @throws java.util.concurrent.RejectedExecutionException if the executor does not accept the action
     */
    @NonNull
    public static ExecutionTime start(
            @NonNull final String description,
            @NonNull final Runnable action,
            @NonNull final Time time,
            @NonNull final Executor executor) {
        requireNonNull(action, "action must not be null");
        requireNonNull(executor, "executor must not be null");

        final ExecutionTime execution = new ExecutionTime(description, time);
        log.debug("Started timing execution of {}", description);
        executor.execute(() -> {
            try {
                action.run();
                execution.finish(null);
            } catch (final Throwable t) {
                execution.finish(t);
            }
        });
        return execution;
    }

    /**
     * Starts measuring the execution time of an asynchronous operation. The clock keeps running until the future
     * returned by the operation completes.
     *
     * @param description the description of the operation used in failure messages
     * @param operation the operation to run in the background; it returns the future that signals its completion
     * @return the handle of the running execution
     */
    @NonNull
    public static ExecutionTime startAsync(
            @NonNull final String description, @NonNull final Supplier<? extends CompletionStage<?>> operation) {
        return startAsync(description, operation, Time.getCurrent(), DEFAULT_EXECUTOR);
    }

    /**
     * Starts measuring the execution time of an asynchronous operation using the given time source and executor.
     *
     * @param description the description of the operation used in failure messages
     * @param operation the operation to run; it returns the future that signals its completion
     * @param time the time source used to measure the elapsed time
     * @param executor the executor that invokes the operation
     * @return the handle of the running execution
     */
    @NonNull
    public static ExecutionTime startAsync(
            @NonNull final String description,
            @NonNull final Supplier<? extends CompletionStage<?>> operation,
            @NonNull final Time time,
            @NonNull final Executor executor) {
        requireNonNull(operation, "operation must not be null");
        requireNonNull(executor, "executor must not be null");

        final ExecutionTime execution = new ExecutionTime(description, time);
        log.debug("Started timing asynchronous execution of {}", description);
        executor.execute(() -> {
            try {
                final CompletionStage<?> stage = requireNonNull(operation.get(), "operation returned a null future");
                stage.whenComplete((ignored, throwable) -> execution.finish(unwrap(throwable)));
            } catch (final Throwable t) {
                execution.finish(t);
            }
        });
        return execution;
    }

    /**
     * Starts measuring the execution time of an operation performed on a subject.
     *
     * @param subject the subject the operation is performed on
     * @param member the operation to perform
     * @param description the description of the operation, or {@code null} to derive one from the subject's type
     * @param <T> the type of the subject
     * @return the handle of the running execution
     */
    @NonNull
    public static <T> ExecutionTime startMember(
            @NonNull final T subject, @NonNull final Consumer<? super T> member, @Nullable final String description) {
        requireNonNull(subject, "subject must not be null");
        requireNonNull(member, "member must not be null");
        final String actualDescription =
                description != null ? description : "the member of " + subject.getClass().getSimpleName();
        return start(actualDescription, () -> member.accept(subject));
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public String description() {
        return description;
    }

    /**
     * {@inheritDoc}
     */
    @NonNull
    @Override
    public Duration elapsed() {
        // sampled under the same monitor as finish() so no sample can exceed the frozen end time
        synchronized (this) {
            final Completion current = completion;
            final long endNanos = current != null ? current.endNanos() : time.nanoTime();
            return Duration.ofNanos(endNanos - startNanos);
        }
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean isRunning() {
        return completion == null;
    }

    /**
     * {@inheritDoc}
     */
    @Nullable
    @Override
    public Throwable capturedException() {
        final Completion current = completion;
        return current != null ? current.exception() : null;
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public boolean awaitCompletion(@NonNull final Duration timeout) throws InterruptedException {
        requireNonNull(timeout, "timeout must not be null");
        return finished.await(saturatedNanos(timeout), TimeUnit.NANOSECONDS);
    }

    private void finish(@Nullable final Throwable exception) {
        synchronized (this) {
            if (completion != null) {
                return;
            }
            completion = new Completion(time.nanoTime(), exception);
        }
        finished.countDown();

        if (exception == null) {
            log.debug("Execution of {} finished after {}", description, elapsed());
        } else {
            log.debug("Execution of {} failed after {}", description, elapsed(), exception);
        }
    }

    @Nullable
    private static Throwable unwrap(@Nullable final Throwable throwable) {
        if ((throwable instanceof CompletionException || throwable instanceof ExecutionException)
                && throwable.getCause() != null) {
            return throwable.getCause();
        }
        return throwable;
    }

    private static long saturatedNanos(@NonNull final Duration duration) {
        try {
            return duration.toNanos();
        } catch (final ArithmeticException e) {
            return duration.isNegative() ? Long.MIN_VALUE : Long.MAX_VALUE;
        }
    }

    @Override
    public String toString() {
        return "ExecutionTime{" + "description='" + description + '\'' + ", running=" + isRunning() + ", elapsed="
                + elapsed() + '}';
    }

    /**
     * Creates the daemon threads of the default executor so that an operation that never finishes does not keep the
     * JVM alive.
     */
    private static final class DaemonThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(@NonNull final Runnable runnable) {
            final Thread thread = new Thread(runnable, THREAD_NAME_PREFIX + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
