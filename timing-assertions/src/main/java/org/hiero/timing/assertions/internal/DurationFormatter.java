// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions.internal;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders durations for failure messages, e.g. {@code 250ms}, {@code 1s and 250ms} or {@code 1h, 2m and 3s}.
 */
public final class DurationFormatter {

    private static final Duration MAX_MAGNITUDE = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    private DurationFormatter() {}

    /**
     * Formats a duration.
     *
     * @param duration the duration to format
     * @return the human-readable representation
     */
    @NonNull
    public static String format(@NonNull final Duration duration) {
        requireNonNull(duration, "duration must not be null");
        if (duration.isZero()) {
            return "0ms";
        }

        final Duration abs = magnitude(duration);
        final List<String> parts = new ArrayList<>();
        addPart(parts, abs.toDaysPart(), "d");
        addPart(parts, abs.toHoursPart(), "h");
        addPart(parts, abs.toMinutesPart(), "m");
        addPart(parts, abs.toSecondsPart(), "s");
        addPart(parts, abs.toMillisPart(), "ms");
        final int subMillis = abs.toNanosPart() % 1_000_000;
        addPart(parts, subMillis / 1_000, "µs");
        addPart(parts, subMillis % 1_000, "ns");

        final StringBuilder sb = new StringBuilder();
        if (duration.isNegative()) {
            sb.append('-');
        }
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                sb.append(i == parts.size() - 1 ? " and " : ", ");
            }
            sb.append(parts.get(i));
        }
        return sb.toString();
    }

    /**
     * The magnitude of {@code Duration.ofSeconds(Long.MIN_VALUE)} is not representable, it is clamped by one
     * nanosecond.
     */
    @NonNull
    private static Duration magnitude(@NonNull final Duration duration) {
        try {
            return duration.abs();
        } catch (final ArithmeticException e) {
            return MAX_MAGNITUDE;
        }
    }

    private static void addPart(@NonNull final List<String> parts, final long value, @NonNull final String unit) {
        if (value != 0) {
            parts.add(value + unit);
        }
    }
}
