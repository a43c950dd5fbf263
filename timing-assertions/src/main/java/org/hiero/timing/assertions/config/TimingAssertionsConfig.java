// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Duration;

/**
 * Settings for polling executions while asserting on their execution time.
 *
 * @param minimumPollInterval the shortest time the poller waits between two samples; poll rates derived from
 *                            smaller bounds are raised to this value
 * @param pollCeiling         the elapsed time after which the poller stops waiting for an execution that is still
 *                            running, or {@code null} to wait without limit
 */
public record TimingAssertionsConfig(@NonNull Duration minimumPollInterval, @Nullable Duration pollCeiling) {

    /**
     * The default minimum poll interval.
     */
    public static final Duration DEFAULT_MINIMUM_POLL_INTERVAL = Duration.ofMillis(1);

    /**
     * The configuration used when nothing else is configured: a poll interval of at least one millisecond and no
     * ceiling.
     */
    public static final TimingAssertionsConfig DEFAULT =
            new TimingAssertionsConfig(DEFAULT_MINIMUM_POLL_INTERVAL, null);

    /**
     * Creates a new configuration.
     *
     * @throws IllegalArgumentException if the minimum poll interval or the ceiling is not positive
     */
    public TimingAssertionsConfig {
        requireNonNull(minimumPollInterval, "minimumPollInterval must not be null");
        if (minimumPollInterval.isZero() || minimumPollInterval.isNegative()) {
            throw new IllegalArgumentException("minimumPollInterval must be > 0 but was " + minimumPollInterval);
        }
        if (pollCeiling != null && (pollCeiling.isZero() || pollCeiling.isNegative())) {
            throw new IllegalArgumentException("pollCeiling must be > 0 but was " + pollCeiling);
        }
    }

    /**
     * Returns a copy of this configuration with a different ceiling.
     *
     * @param ceiling the new ceiling, or {@code null} to wait without limit
     * @return the new configuration
     */
    @NonNull
    public TimingAssertionsConfig withPollCeiling(@Nullable final Duration ceiling) {
        return new TimingAssertionsConfig(minimumPollInterval, ceiling);
    }
}
