// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions.internal;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.IllegalFormatException;
import java.util.Locale;

/**
 * Formats the optional reason a caller gives for an assertion, for example
 * {@code "because the cache is warm"}, so it can be appended to a failure message.
 */
public final class BecauseClause {

    private static final String BECAUSE = "because";

    private BecauseClause() {}

    /**
     * Formats a reason.
     *
     * <p>An empty or {@code null} reason yields an empty string. Otherwise the reason is formatted with
     * {@link String#format(String, Object...)}, trimmed, prefixed with {@code "because "} unless it already starts
     * with that word, and returned with a leading space.
     *
     * @param because the reason, may contain format specifiers
     * @param becauseArgs the arguments for the format specifiers
     * @return the formatted clause, either empty or starting with a space
     */
    @NonNull
    public static String format(@Nullable final String because, @Nullable final Object... becauseArgs) {
        if (because == null || because.isBlank()) {
            return "";
        }
        String reason = because;
        if (becauseArgs != null && becauseArgs.length > 0) {
            try {
                reason = String.format(because, becauseArgs);
            } catch (final IllegalFormatException e) {
                // not a valid format string, used verbatim
                reason = because;
            }
        }
        reason = reason.trim();
        if (!reason.toLowerCase(Locale.ROOT).startsWith(BECAUSE)) {
            reason = BECAUSE + " " + reason;
        }
        return " " + reason;
    }
}
