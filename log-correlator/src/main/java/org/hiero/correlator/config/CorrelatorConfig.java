// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.config;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import org.apache.logging.log4j.util.PropertiesUtil;

/**
 * Configuration of the correlating capture path.
 *
 * <p>Values are read from the classpath file {@value #PROPERTIES_FILE}, which system properties and environment
 * variables override.
 *
 * @param contextKey            the {@code ThreadContext} key that carries the active token
 * @param appenderName          the name under which the capturing appender is installed
 * @param matchPropertyMarkers  also match events that carry a property named after the queried token
 * @param captureAllLevels      open every logger to {@code Level.ALL} when the appender is installed
 */
public record CorrelatorConfig(
        @NonNull String contextKey,
        @NonNull String appenderName,
        boolean matchPropertyMarkers,
        boolean captureAllLevels) {

    public static final String PROPERTIES_FILE = "log-correlator.properties";

    public static final String CONTEXT_KEY_PROPERTY = "correlator.contextKey";
    public static final String APPENDER_NAME_PROPERTY = "correlator.appenderName";
    public static final String MATCH_PROPERTY_MARKERS_PROPERTY = "correlator.matchPropertyMarkers";
    public static final String CAPTURE_ALL_LEVELS_PROPERTY = "correlator.captureAllLevels";

    public static final String DEFAULT_CONTEXT_KEY = "correlationId";
    public static final String DEFAULT_APPENDER_NAME = "CorrelatedEvents";

    public CorrelatorConfig {
        requireNonNull(contextKey, "contextKey must not be null");
        requireNonNull(appenderName, "appenderName must not be null");
        if (contextKey.isBlank()) {
            throw new IllegalArgumentException("contextKey must not be blank");
        }
        if (appenderName.isBlank()) {
            throw new IllegalArgumentException("appenderName must not be blank");
        }
    }

    /**
     * @return the configuration with every value at its default
     */
    @NonNull
    public static CorrelatorConfig defaults() {
        return new CorrelatorConfig(DEFAULT_CONTEXT_KEY, DEFAULT_APPENDER_NAME, false, true);
    }

    /**
     * Loads the configuration from {@value #PROPERTIES_FILE}, system properties and the environment.
     *
     * @return the loaded configuration
     */
    @NonNull
    public static CorrelatorConfig load() {
        return from(new PropertiesUtil(PROPERTIES_FILE));
    }

    /**
     * Reads the configuration from the given properties, using defaults for missing values.
     *
     * @param properties the properties to read
     * @return the configuration
     */
    @NonNull
    public static CorrelatorConfig from(@NonNull final PropertiesUtil properties) {
        requireNonNull(properties, "properties must not be null");
        return new CorrelatorConfig(
                properties.getStringProperty(CONTEXT_KEY_PROPERTY, DEFAULT_CONTEXT_KEY),
                properties.getStringProperty(APPENDER_NAME_PROPERTY, DEFAULT_APPENDER_NAME),
                properties.getBooleanProperty(MATCH_PROPERTY_MARKERS_PROPERTY, false),
                properties.getBooleanProperty(CAPTURE_ALL_LEVELS_PROPERTY, true));
    }
}
