// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import org.apache.logging.log4j.Level;

/**
 * An immutable record of one emitted log event.
 *
 * @param timestamp        the moment the event was created
 * @param level            the severity level
 * @param messageTemplate  the message pattern before parameters were substituted
 * @param message          the formatted message
 * @param loggerName       the name of the logger that produced the event
 * @param threadName       the name of the thread that produced the event
 * @param properties       the context data and map message entries of the event, values may be {@code null}
 * @param thrown           the throwable attached to the event, if any
 * @param token            the innermost correlation token active when the event was captured, if any
 */
public record CapturedEvent(
        @NonNull Instant timestamp,
        @NonNull Level level,
        @NonNull String messageTemplate,
        @NonNull String message,
        @NonNull String loggerName,
        @NonNull String threadName,
        @NonNull Map<String, String> properties,
        @Nullable Throwable thrown,
        @Nullable CorrelationToken token) {

    private static final DateTimeFormatter FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneId.systemDefault());

    public CapturedEvent {
        requireNonNull(timestamp, "timestamp must not be null");
        requireNonNull(level, "level must not be null");
        requireNonNull(messageTemplate, "messageTemplate must not be null");
        requireNonNull(message, "message must not be null");
        requireNonNull(loggerName, "loggerName must not be null");
        requireNonNull(threadName, "threadName must not be null");
        requireNonNull(properties, "properties must not be null");
        properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
    }

    /**
     * Returns a copy of this event tagged with another token.
     *
     * @param newToken the token of the copy, may be {@code null}
     * @return the tagged copy
     */
    @NonNull
    public CapturedEvent withToken(@Nullable final CorrelationToken newToken) {
        return new CapturedEvent(
                timestamp, level, messageTemplate, message, loggerName, threadName, properties, thrown, newToken);
    }

    /**
     * @return {@code true} if this event was captured while a correlation scope was active
     */
    public boolean isTagged() {
        return token != null;
    }

    @Override
    public String toString() {
        return String.format(
                "%s [%s] [%s] (%s) %s - %s%n",
                FORMATTER.format(timestamp),
                level,
                token != null ? token : "untagged",
                threadName,
                loggerName,
                message);
    }
}
