// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.junit.assertions;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.List;
import java.util.Objects;
import org.apache.logging.log4j.Level;
import org.assertj.core.api.AbstractAssert;
import org.hiero.correlator.CapturedEvent;
import org.hiero.correlator.CapturedEvents;
import org.hiero.correlator.CorrelationToken;

/**
 * Assertion class for {@link CapturedEvents}.
 *
 * <p>Failure messages list the events that caused the failure.
 */
public class CapturedEventsAssert extends AbstractAssert<CapturedEventsAssert, CapturedEvents> {

    /**
     * Constructs an assertion for the given {@link CapturedEvents}.
     *
     * @param actual the actual {@link CapturedEvents} to assert
     */
    protected CapturedEventsAssert(@Nullable final CapturedEvents actual) {
        super(actual, CapturedEventsAssert.class);
    }

    /**
     * Creates an assertion for the given {@link CapturedEvents}.
     *
     * @param actual the actual {@link CapturedEvents} to assert
     * @return a new instance of {@link CapturedEventsAssert}
     */
    @NonNull
    public static CapturedEventsAssert assertThat(@Nullable final CapturedEvents actual) {
        return new CapturedEventsAssert(actual);
    }

    /**
     * Verifies that no event was captured.
     *
     * @return this assertion
     */
    @NonNull
    public CapturedEventsAssert isEmpty() {
        isNotNull();
        if (!actual.isEmpty()) {
            failWithEvents(String.format("Expected no events but found %d", actual.size()), actual.asList());
        }
        return this;
    }

    /**
     * Verifies the number of captured events.
     *
     * @param expected the expected number of events
     * @return this assertion
     */
    @NonNull
    public CapturedEventsAssert hasSize(final int expected) {
        isNotNull();
        if (actual.size() != expected) {
            failWithEvents(
                    String.format("Expected %d events but found %d", expected, actual.size()), actual.asList());
        }
        return this;
    }

    /**
     * Verifies that at least one event has a formatted message that contains {@code text}.
     *
     * @param text the text to look for
     * @return this assertion
     */
    @NonNull
    public CapturedEventsAssert containsMessage(@NonNull final String text) {
        Objects.requireNonNull(text, "text must not be null");
        isNotNull();
        if (actual.noneMatch(event -> event.message().contains(text))) {
            failWithEvents(String.format("Expected to find a message containing '%s'", text), actual.asList());
        }
        return this;
    }

    /**
     * Verifies that at least one event of the given level has a formatted message that contains {@code text}.
     *
     * @param level the level of the event
     * @param text the text to look for
     * @return this assertion
     */
    @NonNull
    public CapturedEventsAssert containsMessageWithLevel(@NonNull final Level level, @NonNull final String text) {
        Objects.requireNonNull(level, "level must not be null");
        Objects.requireNonNull(text, "text must not be null");
        isNotNull();
        if (actual.withLevel(level).withMessageContaining(text).isEmpty()) {
            failWithEvents(
                    String.format("Expected to find a message with level '%s' containing '%s'", level, text),
                    actual.asList());
        }
        return this;
    }

    /**
     * Verifies that no event has a level higher than the specified level.
     *
     * @param level the maximum log level to allow
     * @return this assertion
     */
    @NonNull
    public CapturedEventsAssert noMessageWithLevelHigherThan(@NonNull final Level level) {
        Objects.requireNonNull(level, "level must not be null");
        isNotNull();
        final List<CapturedEvent> events = actual.filter(event -> event.level().intLevel() < level.intLevel())
                .asList();
        if (!events.isEmpty()) {
            failWithEvents(String.format("Expected to find no message with level higher than '%s'", level), events);
        }
        return this;
    }

    /**
     * Verifies that every event is tagged with {@code token} itself, and not with a nested scope's token.
     *
     * @param token the expected token
     * @return this assertion
     */
    @NonNull
    public CapturedEventsAssert allTaggedWith(@NonNull final CorrelationToken token) {
        Objects.requireNonNull(token, "token must not be null");
        isNotNull();
        final List<CapturedEvent> events =
                actual.filter(event -> !token.equals(event.token())).asList();
        if (!events.isEmpty()) {
            failWithEvents(String.format("Expected all events to be tagged with '%s'", token), events);
        }
        return this;
    }

    /**
     * Fails the assertion with a custom message and the list of events that caused the failure.
     *
     * @param message the failure message
     * @param events the events that caused the failure
     */
    private void failWithEvents(@NonNull final String message, @NonNull final List<CapturedEvent> events) {
        final StringBuilder logStatements = new StringBuilder();
        logStatements.append(message);
        logStatements.append("\n****************\n");
        logStatements.append(" ->  Captured events:\n");
        logStatements.append("****************\n");
        events.forEach(event -> logStatements.append(event.toString()));
        logStatements.append("****************\n");

        failWithMessage("%s", logStatements.toString());
    }
}
