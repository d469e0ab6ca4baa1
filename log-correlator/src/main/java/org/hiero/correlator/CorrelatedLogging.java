// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.concurrent.Callable;
import org.apache.logging.log4j.core.LoggerContext;
import org.hiero.correlator.config.CorrelatorConfig;
import org.hiero.correlator.internal.CorrelatingAppenderInstaller;
import org.hiero.correlator.internal.CorrelationContext;
import org.hiero.correlator.internal.EventCaptureStore;

/**
 * Entry point for correlating Log4j events with the logical operation that emitted them.
 *
 * <p>Typical use in a test:
 * <pre><code>
 * CorrelatedLogging.initialize();
 * try (final CorrelationScope scope = CorrelatedLogging.beginScope()) {
 *     codeUnderTest.run();
 *     assertThat(CorrelatedLogging.eventsFor(scope.token()).withLevel(Level.ERROR)).isEmpty();
 * }
 * </code></pre>
 *
 * <p>Events are kept for the lifetime of the process. Querying is valid at any time, also before
 * {@link #initialize()}, and returns what has been captured so far.
 */
public final class CorrelatedLogging {

    private static CorrelatingAppenderInstaller installer;

    private CorrelatedLogging() {}

    /**
     * Installs the capture path into the current Log4j logger context with the configuration loaded by
     * {@link CorrelatorConfig#load()}.
     *
     * @return {@code true} if the capture path was installed by this call
     * @see #initialize(CorrelatorConfig)
     */
    public static boolean initialize() {
        return initialize(CorrelatorConfig.load());
    }

    /**
     * Installs the capture path into the current Log4j logger context.
     *
     * <p>Calling this method again never discards captured events and never installs a second appender. The
     * configuration passed to the first call stays in effect for the lifetime of the process; later calls only
     * re-install the appender if Log4j was reconfigured in a way the automatic re-installation did not cover.
     *
     * @param config the configuration used if this is the first call
     * @return {@code true} if the capture path was installed by this call
     */
    public static synchronized boolean initialize(@NonNull final CorrelatorConfig config) {
        requireNonNull(config, "config must not be null");
        if (installer == null) {
            CorrelationContext.useContextKey(config.contextKey());
            EventCaptureStore.global().setMatchPropertyMarkers(config.matchPropertyMarkers());
            installer = new CorrelatingAppenderInstaller(EventCaptureStore.global(), config);
        }
        return installer.install(LoggerContext.getContext(false));
    }

    /**
     * @return {@code true} if the capture path is installed in the current Log4j configuration
     */
    public static synchronized boolean isInitialized() {
        return installer != null && installer.isInstalled(LoggerContext.getContext(false));
    }

    /**
     * @return the configuration in effect, or the loaded configuration if {@link #initialize()} was not called yet
     */
    @NonNull
    public static synchronized CorrelatorConfig config() {
        return installer != null ? installer.config() : CorrelatorConfig.load();
    }

    /**
     * Opens a correlation scope with a fresh token on the calling thread.
     *
     * @return the scope, to be closed by the calling thread
     */
    @NonNull
    public static CorrelationScope beginScope() {
        return CorrelationScope.begin();
    }

    /**
     * @return the innermost active token of the calling thread, or {@code null} if no scope is open
     */
    @Nullable
    public static CorrelationToken activeToken() {
        return CorrelationContext.activeToken();
    }

    /**
     * Returns the events captured while {@code token}, or a scope nested in it, was active.
     *
     * @param token the token to look up
     * @return a snapshot in capture order, empty if nothing was captured for {@code token}
     */
    @NonNull
    public static CapturedEvents eventsFor(@NonNull final CorrelationToken token) {
        return CapturedEvents.of(EventCaptureStore.global().query(token));
    }

    /**
     * @return a snapshot of the events captured while no correlation scope was active
     */
    @NonNull
    public static CapturedEvents untaggedEvents() {
        return CapturedEvents.of(EventCaptureStore.global().untagged());
    }

    /**
     * Wraps a task so that the events it logs are tagged with the caller's active token on any thread.
     *
     * @param task the task to wrap
     * @return the wrapped task
     */
    @NonNull
    public static Runnable wrap(@NonNull final Runnable task) {
        return CorrelationContext.wrap(task);
    }

    /**
     * Wraps a task so that the events it logs are tagged with the caller's active token on any thread.
     *
     * @param task the task to wrap
     * @param <V> the result type of the task
     * @return the wrapped task
     */
    @NonNull
    public static <V> Callable<V> wrap(@NonNull final Callable<V> task) {
        return CorrelationContext.wrap(task);
    }

    /**
     * Drops every captured event. This is the only operation that removes events, and it affects all tokens.
     */
    public static void reset() {
        EventCaptureStore.global().reset();
    }
}
