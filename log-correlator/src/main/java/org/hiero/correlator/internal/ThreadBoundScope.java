// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.internal;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.correlator.CorrelationScope;
import org.hiero.correlator.CorrelationToken;

/**
 * A {@link CorrelationScope} that is bound to the thread that opened it.
 *
 * <p>Only the owner thread mutates the state of a scope.
 */
final class ThreadBoundScope implements CorrelationScope {

    private final CorrelationToken token;
    private final CorrelationToken parent;
    private final Thread owner;
    private final String contextKey;
    private final String previousContextValue;
    private boolean closed;

    ThreadBoundScope(
            @NonNull final CorrelationToken token,
            @Nullable final CorrelationToken parent,
            @NonNull final Thread owner,
            @NonNull final String contextKey,
            @Nullable final String previousContextValue) {
        this.token = requireNonNull(token, "token must not be null");
        this.parent = parent;
        this.owner = requireNonNull(owner, "owner must not be null");
        this.contextKey = requireNonNull(contextKey, "contextKey must not be null");
        this.previousContextValue = previousContextValue;
    }

    @Override
    @NonNull
    public CorrelationToken token() {
        return token;
    }

    @Override
    @Nullable
    public CorrelationToken parent() {
        return parent;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        CorrelationContext.release(this);
    }

    @NonNull
    Thread owner() {
        return owner;
    }

    @NonNull
    String contextKey() {
        return contextKey;
    }

    @Nullable
    String previousContextValue() {
        return previousContextValue;
    }

    void markClosed() {
        closed = true;
    }

    @Override
    public String toString() {
        return "CorrelationScope{token=" + token + ", parent=" + parent + ", owner=" + owner.getName() + ", closed="
                + closed + '}';
    }
}
