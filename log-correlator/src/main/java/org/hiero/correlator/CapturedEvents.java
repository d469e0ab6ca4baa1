// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.Iterator;
import java.util.List;
import java.util.function.Predicate;
import java.util.stream.Stream;
import org.apache.logging.log4j.Level;

/**
 * A read-only snapshot of captured events, in capture order.
 *
 * <p>The snapshot reflects the state of the store at the moment it was requested. Events captured later are not
 * added to it. All narrowing methods return new snapshots and leave this one unchanged.
 */
public final class CapturedEvents implements Iterable<CapturedEvent> {

    private static final CapturedEvents EMPTY = new CapturedEvents(List.of());

    private final List<CapturedEvent> events;

    private CapturedEvents(@NonNull final List<CapturedEvent> events) {
        this.events = events;
    }

    /**
     * @param events the events in capture order
     * @return a snapshot of {@code events}
     */
    @NonNull
    public static CapturedEvents of(@NonNull final List<CapturedEvent> events) {
        requireNonNull(events, "events must not be null");
        return events.isEmpty() ? EMPTY : new CapturedEvents(List.copyOf(events));
    }

    /**
     * @return an empty snapshot
     */
    @NonNull
    public static CapturedEvents empty() {
        return EMPTY;
    }

    /**
     * @return the events as an unmodifiable list
     */
    @NonNull
    public List<CapturedEvent> asList() {
        return events;
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    @NonNull
    public Stream<CapturedEvent> stream() {
        return events.stream();
    }

    @Override
    @NonNull
    public Iterator<CapturedEvent> iterator() {
        return events.iterator();
    }

    public boolean anyMatch(@NonNull final Predicate<? super CapturedEvent> predicate) {
        requireNonNull(predicate, "predicate must not be null");
        return events.stream().anyMatch(predicate);
    }

    public boolean allMatch(@NonNull final Predicate<? super CapturedEvent> predicate) {
        requireNonNull(predicate, "predicate must not be null");
        return events.stream().allMatch(predicate);
    }

    public boolean noneMatch(@NonNull final Predicate<? super CapturedEvent> predicate) {
        requireNonNull(predicate, "predicate must not be null");
        return events.stream().noneMatch(predicate);
    }

    /**
     * @param predicate the condition events have to fulfill
     * @return a snapshot with the events that match {@code predicate}
     */
    @NonNull
    public CapturedEvents filter(@NonNull final Predicate<? super CapturedEvent> predicate) {
        requireNonNull(predicate, "predicate must not be null");
        return of(events.stream().filter(predicate).toList());
    }

    @NonNull
    public CapturedEvents withLevel(@NonNull final Level level) {
        requireNonNull(level, "level must not be null");
        return filter(event -> event.level() == level);
    }

    @NonNull
    public CapturedEvents withMessageContaining(@NonNull final String text) {
        requireNonNull(text, "text must not be null");
        return filter(event -> event.message().contains(text));
    }

    /**
     * Drops the events of scopes nested inside {@code token}, keeping those captured while {@code token} itself was
     * the innermost active token.
     *
     * @param token the token events must be tagged with
     * @return the narrowed snapshot
     */
    @NonNull
    public CapturedEvents taggedExactly(@NonNull final CorrelationToken token) {
        requireNonNull(token, "token must not be null");
        return filter(event -> token.equals(event.token()));
    }

    /**
     * @return the formatted messages, in capture order
     */
    @NonNull
    public List<String> messages() {
        return events.stream().map(CapturedEvent::message).toList();
    }

    @Override
    public String toString() {
        final StringBuilder builder = new StringBuilder();
        events.forEach(builder::append);
        return builder.toString();
    }
}
