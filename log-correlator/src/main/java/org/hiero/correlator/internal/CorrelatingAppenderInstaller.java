// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.internal;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.beans.PropertyChangeEvent;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.LoggerContext;
import org.apache.logging.log4j.core.config.AppenderRef;
import org.apache.logging.log4j.core.config.Configuration;
import org.apache.logging.log4j.core.config.LoggerConfig;
import org.apache.logging.log4j.core.filter.CompositeFilter;
import org.hiero.correlator.config.CorrelatorConfig;

/**
 * Installs a {@link CorrelatingAppender} into the configuration of a {@link LoggerContext}.
 *
 * <p>Installing is idempotent per configuration: if the configuration already has an appender with the configured
 * name, nothing is changed. When the context is reconfigured, the appender is installed into the new configuration
 * automatically. The store the appender captures into is never replaced.
 */
public final class CorrelatingAppenderInstaller {

    private static final Logger logger = LogManager.getLogger(CorrelatingAppenderInstaller.class);

    private final EventCaptureStore store;
    private final CorrelatorConfig config;
    private final Set<LoggerContext> watchedContexts = ConcurrentHashMap.newKeySet();
    private final Object lock = new Object();

    /**
     * @param store the store the installed appenders capture into
     * @param config the configuration of the capture path
     */
    public CorrelatingAppenderInstaller(
            @NonNull final EventCaptureStore store, @NonNull final CorrelatorConfig config) {
        this.store = requireNonNull(store, "store must not be null");
        this.config = requireNonNull(config, "config must not be null");
    }

    @NonNull
    public CorrelatorConfig config() {
        return config;
    }

    /**
     * Installs the appender into the current configuration of {@code context}, unless it is there already.
     *
     * @param context the logger context
     * @return {@code true} if the appender was installed by this call, {@code false} if it was already present
     */
    public boolean install(@NonNull final LoggerContext context) {
        requireNonNull(context, "context must not be null");
        if (watchedContexts.add(context)) {
            context.addPropertyChangeListener(event -> onContextChange(context, event));
        }
        final boolean installed = installInto(context);
        if (installed) {
            logger.debug(
                    "Installed appender {} into configuration {} of logger context {}",
                    config.appenderName(),
                    context.getConfiguration().getName(),
                    context.getName());
        }
        return installed;
    }

    /**
     * Checks whether the current configuration of {@code context} has the appender.
     *
     * @param context the logger context
     * @return {@code true} if an appender with the configured name is present
     */
    public boolean isInstalled(@NonNull final LoggerContext context) {
        requireNonNull(context, "context must not be null");
        return context.getConfiguration().getAppender(config.appenderName()) != null;
    }

    private void onContextChange(@NonNull final LoggerContext context, @NonNull final PropertyChangeEvent event) {
        if (LoggerContext.PROPERTY_CONFIG.equals(event.getPropertyName()) && installInto(context)) {
            logger.debug(
                    "Re-installed appender {} after logger context {} was reconfigured",
                    config.appenderName(),
                    context.getName());
        }
    }

    private boolean installInto(@NonNull final LoggerContext context) {
        synchronized (lock) {
            final Configuration configuration = context.getConfiguration();
            if (configuration.getAppender(config.appenderName()) != null) {
                return false;
            }

            final CorrelatingAppender appender =
                    CorrelatingAppender.create(config.appenderName(), store, config.contextKey());
            appender.start();
            configuration.addAppender(appender);

            final Set<LoggerConfig> loggerConfigs = new LinkedHashSet<>(configuration.getLoggers().values());
            loggerConfigs.add(configuration.getRootLogger());
            if (config.captureAllLevels()) {
                openToAllLevels(configuration, loggerConfigs);
            }
            for (final LoggerConfig loggerConfig : loggerConfigs) {
                if (loggerConfig == configuration.getRootLogger() || !loggerConfig.isAdditive()) {
                    loggerConfig.addAppender(appender, null, null);
                }
            }

            context.updateLoggers();
            return true;
        }
    }

    /**
     * Lowers the level of every logger to {@link Level#ALL}. The appenders the loggers already had are gated by the
     * level the originating logger of an event had before, so their output does not change.
     */
    private static void openToAllLevels(
            @NonNull final Configuration configuration, @NonNull final Collection<LoggerConfig> loggerConfigs) {
        final Map<String, Level> originalLevels = new HashMap<>();
        for (final LoggerConfig loggerConfig : loggerConfigs) {
            // levels are read before any is changed, since unset levels are inherited from the parent
            if (loggerConfig.getLevel() != null) {
                originalLevels.put(loggerConfig.getName(), loggerConfig.getLevel());
            }
        }
        if (originalLevels.values().stream().allMatch(Level.ALL::equals)) {
            return;
        }

        for (final LoggerConfig loggerConfig : loggerConfigs) {
            gateExistingAppenders(configuration, loggerConfig, originalLevels);
            loggerConfig.setLevel(Level.ALL);
        }
    }

    private static void gateExistingAppenders(
            @NonNull final Configuration configuration,
            @NonNull final LoggerConfig loggerConfig,
            @NonNull final Map<String, Level> originalLevels) {
        final Map<String, AppenderRef> references = new HashMap<>();
        for (final AppenderRef reference : loggerConfig.getAppenderRefs()) {
            references.put(reference.getRef(), reference);
        }

        final List<Appender> appenders = new ArrayList<>(loggerConfig.getAppenders().values());
        for (final Appender appender : appenders) {
            final AppenderRef reference = references.get(appender.getName());
            final Level referenceLevel = reference == null ? null : reference.getLevel();
            final Filter referenceFilter = reference == null ? null : reference.getFilter();

            loggerConfig.removeAppender(appender.getName());
            // removing an appender stops the filter of its reference
            if (referenceFilter != null && referenceFilter.isStopped()) {
                referenceFilter.start();
            }
            final Filter originFilter = new OriginLevelFilter(configuration, originalLevels);
            final Filter filter = referenceFilter == null
                    ? originFilter
                    : CompositeFilter.createFilters(new Filter[] {originFilter, referenceFilter});
            filter.start();
            loggerConfig.addAppender(appender, referenceLevel, filter);
        }
    }
}
