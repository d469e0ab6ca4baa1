// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.internal;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.apache.logging.log4j.core.Appender;
import org.apache.logging.log4j.core.Core;
import org.apache.logging.log4j.core.Filter;
import org.apache.logging.log4j.core.LogEvent;
import org.apache.logging.log4j.core.appender.AbstractAppender;
import org.apache.logging.log4j.core.config.Property;
import org.apache.logging.log4j.core.config.plugins.Plugin;
import org.apache.logging.log4j.core.config.plugins.PluginAttribute;
import org.apache.logging.log4j.core.config.plugins.PluginFactory;
import org.apache.logging.log4j.core.layout.PatternLayout;
import org.apache.logging.log4j.message.MapMessage;
import org.apache.logging.log4j.message.Message;
import org.hiero.correlator.CapturedEvent;
import org.hiero.correlator.CorrelationToken;
import org.hiero.correlator.config.CorrelatorConfig;

/**
 * An {@link Appender} that records every log event it receives in an {@link EventCaptureStore}, tagged with the
 * correlation token that was active on the thread that created the event.
 *
 * <p>The token is read from the context data of the event, which Log4j copies from the {@code ThreadContext} of the
 * emitting thread. If the event carries no readable token, the active token of the calling thread is used.
 *
 * <p>The appender must not log itself, since it would receive its own events.
 */
@Plugin(name = CorrelatingAppender.PLUGIN_NAME, category = Core.CATEGORY_NAME, elementType = Appender.ELEMENT_TYPE)
public class CorrelatingAppender extends AbstractAppender {

    public static final String PLUGIN_NAME = "CorrelatingAppender";

    /** No filtering is applied to the log events */
    private static final Filter NO_FILTER = null;

    /**
     * Formatting is not relevant for in-memory storage, but Log4j requires a layout to be specified.
     */
    private static final PatternLayout DEFAULT_LAYOUT = PatternLayout.createDefaultLayout();

    /** Failures of the logging system are not propagated to the code that logs */
    private static final boolean PROPAGATE_EXCEPTIONS = false;

    private static final Property[] NO_PROPERTIES = Property.EMPTY_ARRAY;

    private final EventCaptureStore store;
    private final String contextKey;

    /**
     * @param name the name of the appender
     * @param store the store events are appended to
     * @param contextKey the context data key that carries the token
     */
    protected CorrelatingAppender(
            @NonNull final String name, @NonNull final EventCaptureStore store, @NonNull final String contextKey) {
        super(name, NO_FILTER, DEFAULT_LAYOUT, PROPAGATE_EXCEPTIONS, NO_PROPERTIES);
        this.store = requireNonNull(store, "store must not be null");
        this.contextKey = requireNonNull(contextKey, "contextKey must not be null");
    }

    /**
     * Appends a log event to the store.
     *
     * @param event the log event to be appended
     */
    @Override
    public void append(@NonNull final LogEvent event) {
        store.append(toCapturedEvent(event));
    }

    /**
     * Copies the data of a log event. Log4j may reuse event instances, so nothing of {@code event} is retained.
     *
     * <p>Context entries that carry the token of the event, or of one of its enclosing scopes, are not copied into
     * the properties.
     *
     * @param event the event to copy
     * @return the captured event, tagged with its token
     */
    @NonNull
    CapturedEvent toCapturedEvent(@NonNull final LogEvent event) {
        final Message message = event.getMessage();
        final String formatted = message == null ? "" : nullToEmpty(message.getFormattedMessage());
        final String template = message == null || message.getFormat() == null ? formatted : message.getFormat();

        final CorrelationToken token = resolveToken(event);
        final Map<String, String> properties = new LinkedHashMap<>(event.getContextData().toMap());
        properties.remove(contextKey);
        if (token != null) {
            // a scope opened before the context key was configured mirrors its token under the key of that time
            final Set<String> mirrored = new HashSet<>();
            CorrelationContext.lineage(token).forEach(owner -> mirrored.add(owner.toString()));
            properties.values().removeIf(mirrored::contains);
        }
        if (message instanceof final MapMessage<?, ?> mapMessage) {
            mapMessage.getData().forEach((key, value) -> properties.put(key, value == null ? null : value.toString()));
        }

        return new CapturedEvent(
                Instant.ofEpochSecond(
                        event.getInstant().getEpochSecond(), event.getInstant().getNanoOfSecond()),
                event.getLevel(),
                template,
                formatted,
                nullToEmpty(event.getLoggerName()),
                nullToEmpty(event.getThreadName()),
                properties,
                event.getThrown(),
                token);
    }

    @Nullable
    private CorrelationToken resolveToken(@NonNull final LogEvent event) {
        final Object value = event.getContextData().getValue(contextKey);
        final CorrelationToken token = value instanceof final String text ? CorrelationToken.tryParse(text) : null;
        return token != null ? token : CorrelationContext.activeToken();
    }

    @NonNull
    private static String nullToEmpty(@Nullable final String value) {
        return value == null ? "" : value;
    }

    /**
     * Creates an appender that captures into the given store.
     *
     * @param name the name of the appender
     * @param store the store events are appended to
     * @param contextKey the context data key that carries the token
     * @return a new, not yet started appender
     */
    @NonNull
    public static CorrelatingAppender create(
            @NonNull final String name, @NonNull final EventCaptureStore store, @NonNull final String contextKey) {
        return new CorrelatingAppender(name, store, contextKey);
    }

    /**
     * Factory method used when the appender is declared in a Log4j configuration file. The appender captures into
     * the {@linkplain EventCaptureStore#global() global store}.
     *
     * @param name the name of the appender
     * @param contextKey the context data key that carries the token
     * @return a new instance of {@code CorrelatingAppender}
     */
    @PluginFactory
    @NonNull
    public static CorrelatingAppender createAppender(
            @PluginAttribute(value = "name", defaultString = CorrelatorConfig.DEFAULT_APPENDER_NAME) @NonNull
                    final String name,
            @PluginAttribute(value = "contextKey", defaultString = CorrelatorConfig.DEFAULT_CONTEXT_KEY) @NonNull
                    final String contextKey) {
        return new CorrelatingAppender(name, EventCaptureStore.global(), contextKey);
    }
}
