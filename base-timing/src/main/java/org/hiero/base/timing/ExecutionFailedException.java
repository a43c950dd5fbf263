// SPDX-License-Identifier: Apache-2.0
package org.hiero.base.timing;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a timed operation terminated with a checked exception that cannot be rethrown as is. The original
 * exception is available as the {@linkplain #getCause() cause}.
 */
public class ExecutionFailedException extends RuntimeException {

    /**
     * Creates a new instance.
     *
     * @param description the description of the operation that failed
     * @param cause the exception thrown by the operation
     */
    public ExecutionFailedException(@NonNull final String description, @NonNull final Throwable cause) {
        super("Execution of " + description + " failed: " + cause, cause);
    }

    /**
     * Rethrows the given exception. Unchecked exceptions and errors are thrown as the identical instance, checked
     * exceptions are wrapped in an {@link ExecutionFailedException}.
     *
     * @param description the description of the operation that failed
     * @param exception the exception to rethrow
     * @return never returns, declared so callers can write {@code throw rethrow(...)}
     */
    @NonNull
    public static RuntimeException rethrow(@NonNull final String description, @NonNull final Throwable exception) {
        if (exception instanceof final RuntimeException runtimeException) {
            throw runtimeException;
        }
        if (exception instanceof final Error error) {
            throw error;
        }
        throw new ExecutionFailedException(description, exception);
    }
}
