// SPDX-License-Identifier: Apache-2.0
package org.hiero.timing.assertions.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads {@link TimingAssertionsConfig} from an optional properties file on the classpath, overridden by system
 * properties.
 *
 * <p>Supported keys:
 * <ul>
 *     <li>{@value #MINIMUM_POLL_INTERVAL_KEY}</li>
 *     <li>{@value #POLL_CEILING_KEY} ({@code none} or an empty value disables the ceiling)</li>
 * </ul>
 * Durations are given either as a number of milliseconds ({@code 250}) or in ISO-8601 format ({@code PT0.25S}).
 */
public final class TimingAssertionsConfigLoader {

    private static final Logger log = LogManager.getLogger();

    /**
     * The classpath resource read by {@link #loadDefault()}.
     */
    public static final String DEFAULT_RESOURCE = "timing-assertions.properties";

    public static final String MINIMUM_POLL_INTERVAL_KEY = "timing.assertions.minimumPollInterval";
    public static final String POLL_CEILING_KEY = "timing.assertions.pollCeiling";

    private static volatile TimingAssertionsConfig defaultConfig;

    private TimingAssertionsConfigLoader() {}

    /**
     * Returns the configuration loaded from {@value #DEFAULT_RESOURCE} and the system properties. The configuration
     * is loaded on first use and cached afterwards.
     *
     * @return the default configuration
     */
    @NonNull
    public static TimingAssertionsConfig loadDefault() {
        TimingAssertionsConfig config = defaultConfig;
        if (config == null) {
            synchronized (TimingAssertionsConfigLoader.class) {
                config = defaultConfig;
                if (config == null) {
                    config = load(DEFAULT_RESOURCE, System.getProperties());
                    defaultConfig = config;
                }
            }
        }
        return config;
    }

    /**
     * Loads the configuration from the given classpath resource, with the given overrides taking precedence. A
     * missing resource is not an error; the defaults of {@link TimingAssertionsConfig#DEFAULT} apply to every key
     * that is set nowhere.
     *
     * @param resourceName the name of the classpath resource
     * @param overrides properties taking precedence over the resource, typically the system properties
     * @return the loaded configuration
     * @throws IllegalStateException if a value cannot be parsed or is out of range
     */
    @NonNull
    public static TimingAssertionsConfig load(@NonNull final String resourceName, @NonNull final Properties overrides) {
        requireNonNull(resourceName, "resourceName must not be null");
        requireNonNull(overrides, "overrides must not be null");

        final Properties props = new Properties();
        try (InputStream in = TimingAssertionsConfigLoader.class.getClassLoader().getResourceAsStream(resourceName)) {
            if (in != null) {
                props.load(in);
                log.debug("Loaded timing assertions configuration from {}", resourceName);
            }
        } catch (final IOException e) {
            throw new UncheckedIOException("Failed to load config: " + resourceName, e);
        }
        for (final String key : overrides.stringPropertyNames()) {
            props.setProperty(key, overrides.getProperty(key));
        }

        final Duration minimumPollInterval = getDuration(props, MINIMUM_POLL_INTERVAL_KEY);
        final Duration pollCeiling = getDuration(props, POLL_CEILING_KEY);
        try {
            return new TimingAssertionsConfig(
                    minimumPollInterval != null
                            ? minimumPollInterval
                            : TimingAssertionsConfig.DEFAULT_MINIMUM_POLL_INTERVAL,
                    pollCeiling);
        } catch (final IllegalArgumentException e) {
            throw new IllegalStateException("Invalid timing assertions configuration: " + e.getMessage(), e);
        }
    }

    @Nullable
    private static Duration getDuration(@NonNull final Properties props, @NonNull final String key) {
        final String value = props.getProperty(key);
        if (value == null || value.isBlank() || value.trim().equalsIgnoreCase("none")) {
            return null;
        }
        final String trimmed = value.trim();
        try {
            if (trimmed.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(trimmed));
            }
            return Duration.parse(trimmed);
        } catch (final NumberFormatException | DateTimeParseException e) {
            throw new IllegalStateException("Invalid duration for config key " + key + ": " + value, e);
        }
    }
}
