// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.internal;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.function.Function;
import java.util.function.Supplier;
import org.hiero.correlator.CapturedEvent;
import org.hiero.correlator.CorrelationToken;

/**
 * Append-only, lock-free store of every captured event.
 *
 * <p>All events are kept in one queue in capture order. Tagged events are additionally indexed under their token and
 * every ancestor of that token, so a query for an outer token also returns the events of the scopes nested in it.
 * Appends from one thread are seen by later queries of the same thread in the order they were made. Appends from
 * different threads may interleave, but the token of an event never changes once it is appended.
 *
 * <p>The store only shrinks when {@link #reset()} is called.
 */
public final class EventCaptureStore {

    private static final EventCaptureStore GLOBAL = new EventCaptureStore();

    private final Queue<CapturedEvent> events = new ConcurrentLinkedQueue<>();
    private final Map<CorrelationToken, Queue<CapturedEvent>> index = new ConcurrentHashMap<>();
    private final Supplier<CorrelationToken> activeToken;
    private final Function<CorrelationToken, List<CorrelationToken>> lineage;
    private volatile boolean matchPropertyMarkers;

    /**
     * Creates a store that reads the active token and the lineage of tokens from the {@link CorrelationContext}.
     */
    public EventCaptureStore() {
        this(CorrelationContext::activeToken, CorrelationContext::lineage);
    }

    /**
     * @param activeToken supplies the active token of the calling thread, may supply {@code null}
     * @param lineage returns a token followed by its ancestors
     */
    public EventCaptureStore(
            @NonNull final Supplier<CorrelationToken> activeToken,
            @NonNull final Function<CorrelationToken, List<CorrelationToken>> lineage) {
        this.activeToken = requireNonNull(activeToken, "activeToken must not be null");
        this.lineage = requireNonNull(lineage, "lineage must not be null");
    }

    /**
     * @return the process-wide store the logging facility captures into
     */
    @NonNull
    public static EventCaptureStore global() {
        return GLOBAL;
    }

    /**
     * Makes queries also return events that carry a property named after the queried token.
     *
     * @param enabled whether property names are matched
     */
    public void setMatchPropertyMarkers(final boolean enabled) {
        this.matchPropertyMarkers = enabled;
    }

    public boolean isMatchingPropertyMarkers() {
        return matchPropertyMarkers;
    }

    /**
     * Tags an event with the active token of the calling thread and appends it. Any token the event already carries
     * is replaced.
     *
     * @param event the event to capture
     */
    public void capture(@NonNull final CapturedEvent event) {
        requireNonNull(event, "event must not be null");
        append(event.withToken(activeToken.get()));
    }

    /**
     * Appends an event with the token it already carries.
     *
     * @param event the event to append
     */
    public void append(@NonNull final CapturedEvent event) {
        requireNonNull(event, "event must not be null");
        events.add(event);
        final CorrelationToken token = event.token();
        if (token != null) {
            for (final CorrelationToken owner : lineage.apply(token)) {
                index.computeIfAbsent(owner, key -> new ConcurrentLinkedQueue<>()).add(event);
            }
        }
    }

    /**
     * Returns the events captured while {@code token}, or a scope nested in it, was active.
     *
     * @param token the token to look up
     * @return a snapshot in capture order, empty if nothing was captured for {@code token}
     */
    @NonNull
    public List<CapturedEvent> query(@NonNull final CorrelationToken token) {
        requireNonNull(token, "token must not be null");
        if (matchPropertyMarkers) {
            final String marker = token.toString();
            return events.stream()
                    .filter(event -> belongsTo(event, token) || event.properties().containsKey(marker))
                    .toList();
        }
        final Queue<CapturedEvent> tagged = index.get(token);
        return tagged == null ? List.of() : List.copyOf(tagged);
    }

    /**
     * @return a snapshot of the events captured while no scope was active
     */
    @NonNull
    public List<CapturedEvent> untagged() {
        return events.stream().filter(event -> !event.isTagged()).toList();
    }

    /**
     * @return a snapshot of every captured event
     */
    @NonNull
    public List<CapturedEvent> all() {
        return List.copyOf(events);
    }

    /**
     * @return the number of captured events, counted in linear time
     */
    public int size() {
        return events.size();
    }

    /**
     * Drops every captured event. Events captured concurrently with this call may survive it.
     */
    public void reset() {
        events.clear();
        index.clear();
    }

    private boolean belongsTo(@NonNull final CapturedEvent event, @NonNull final CorrelationToken token) {
        final CorrelationToken eventToken = event.token();
        return eventToken != null && lineage.apply(eventToken).contains(token);
    }
}
