// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import org.hiero.correlator.internal.CorrelationContext;

/**
 * The bounded lifetime during which a {@link CorrelationToken} is the active token of the thread that opened it.
 *
 * <p>Scopes nest. While a nested scope is open, its token is the one new log events are tagged with. Closing it
 * makes the token of the enclosing scope active again. A scope must be closed by the thread that opened it, and
 * scopes must be closed innermost first, which try-with-resources does on every exit path:
 * <pre><code>
 * try (final CorrelationScope scope = CorrelationScope.begin()) {
 *     logger.info("tagged with {}", scope.token());
 * }
 * </code></pre>
 *
 * <p>Closing a scope a second time does nothing. Closing it from another thread, or while a scope nested inside it
 * is still open, throws an {@link IllegalStateException} and leaves the thread's scopes untouched.
 */
public interface CorrelationScope extends AutoCloseable {

    /**
     * Opens a scope with a fresh token on the calling thread. The token active before this call, if any, becomes
     * the parent of the new token.
     *
     * @return the new scope
     */
    @NonNull
    static CorrelationScope begin() {
        return CorrelationContext.begin();
    }

    /**
     * Re-activates an existing token on the calling thread, typically a worker thread that executes part of the
     * operation the token belongs to. No new token is allocated.
     *
     * @param token the token to activate
     * @return the scope that deactivates {@code token} again when closed
     */
    @NonNull
    static CorrelationScope join(@NonNull final CorrelationToken token) {
        return CorrelationContext.join(token);
    }

    /**
     * @return the token this scope activates
     */
    @NonNull
    CorrelationToken token();

    /**
     * @return the token of the scope this one is nested in, or {@code null} for an outermost token
     */
    @Nullable
    CorrelationToken parent();

    /**
     * @return {@code true} once this scope has been closed
     */
    boolean isClosed();

    /**
     * Deactivates the token of this scope and restores the previously active one.
     *
     * @throws IllegalStateException if called from a foreign thread or while a nested scope is still open
     */
    @Override
    void close();
}
