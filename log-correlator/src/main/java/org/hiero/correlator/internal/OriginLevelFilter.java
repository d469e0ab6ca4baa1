// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.internal;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Map;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.filter.AbstractFilter;

/**
 * Denies events that the logger they were logged with would not have enabled before it was opened to
 * {@link Level#ALL}.
 *
 * <p>Log4j checks a level only on the logger an event is logged with, not on the parents the event is passed on
 * to. Placed on an appender reference, this filter applies the original level of the originating logger, wherever
 * the appender sits in the hierarchy.
 */
final class OriginLevelFilter extends AbstractFilter {

    private final Configuration configuration;

    /** Level of every logger configuration before installation, by name. */
    private final Map<String, Level> originalLevels;

    /**
     * @param configuration the configuration that resolves logger names to logger configurations
     * @param originalLevels the levels the logger configurations had, keyed by their names
     */
    OriginLevelFilter(@NonNull final Configuration configuration, @NonNull final Map<String, Level> originalLevels) {
        super(Result.NEUTRAL, Result.DENY);
        this.configuration = requireNonNull(configuration, "configuration must not be null");
        this.originalLevels = Map.copyOf(requireNonNull(originalLevels, "originalLevels must not be null"));
    }

    @Override
    public Result filter(@NonNull final LogEvent event) {
        final String loggerName = event.getLoggerName() == null ? LogManager.ROOT_LOGGER_NAME : event.getLoggerName();
        final Level original =
                originalLevels.get(configuration.getLoggerConfig(loggerName).getName());
        // logger configurations added after installation were never opened
        if (original == null || event.getLevel().isMoreSpecificThan(original)) {
            return onMatch;
        }
        return onMismatch;
    }
}
