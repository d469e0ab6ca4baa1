// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.internal;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import org.apache.logging.log4j.ThreadContext;
import org.hiero.correlator.CorrelationScope;
import org.hiero.correlator.CorrelationToken;
import org.hiero.correlator.config.CorrelatorConfig;

/**
 * Keeps the stack of open correlation scopes of every thread.
 *
 * <p>The innermost token of a thread is mirrored into the Log4j {@link ThreadContext} under the configured context
 * key, so every event created on that thread carries it in its context data. The stack itself is thread confined.
 * The only state shared between threads is the registry that maps each token to its parent.
 */
public final class CorrelationContext {

    private static final ThreadLocal<Deque<ThreadBoundScope>> SCOPES = new ThreadLocal<>();

    /** Parent of every token that was opened inside another scope. Grows with the number of nested scopes. */
    private static final Map<CorrelationToken, CorrelationToken> PARENTS = new ConcurrentHashMap<>();

    /** Starts out as the loaded configuration's key, so scopes opened before initialization use it too. */
    private static volatile String contextKey = CorrelatorConfig.load().contextKey();

    private CorrelationContext() {}

    /**
     * Sets the {@link ThreadContext} key that scopes opened from now on mirror their token into.
     *
     * @param key the context key
     */
    public static void useContextKey(@NonNull final String key) {
        contextKey = requireNonNull(key, "key must not be null");
    }

    /**
     * @return the {@link ThreadContext} key new scopes mirror their token into
     */
    @NonNull
    public static String contextKey() {
        return contextKey;
    }

    /**
     * Opens a scope with a fresh token on the calling thread.
     *
     * @return the new scope
     */
    @NonNull
    public static CorrelationScope begin() {
        final CorrelationToken parent = activeToken();
        final CorrelationToken token = CorrelationToken.random();
        if (parent != null) {
            PARENTS.put(token, parent);
        }
        return push(token, parent);
    }

    /**
     * Activates an existing token on the calling thread.
     *
     * @param token the token to activate
     * @return the new scope
     */
    @NonNull
    public static CorrelationScope join(@NonNull final CorrelationToken token) {
        requireNonNull(token, "token must not be null");
        return push(token, PARENTS.get(token));
    }

    /**
     * @return the innermost active token of the calling thread, or {@code null} if no scope is open
     */
    @Nullable
    public static CorrelationToken activeToken() {
        final Deque<ThreadBoundScope> scopes = SCOPES.get();
        if (scopes == null || scopes.isEmpty()) {
            return null;
        }
        return scopes.peek().token();
    }

    /**
     * Returns a token followed by all of its ancestors, innermost first.
     *
     * @param token the token to start with
     * @return the lineage of {@code token}
     */
    @NonNull
    public static List<CorrelationToken> lineage(@NonNull final CorrelationToken token) {
        requireNonNull(token, "token must not be null");
        final List<CorrelationToken> lineage = new ArrayList<>();
        CorrelationToken current = token;
        while (current != null && !lineage.contains(current)) {
            lineage.add(current);
            current = PARENTS.get(current);
        }
        return lineage;
    }

    /**
     * Wraps a task so that it runs with the caller's active token, wherever it is executed.
     *
     * @param task the task to wrap
     * @return the wrapped task, or {@code task} itself if no scope is open on the calling thread
     */
    @NonNull
    public static Runnable wrap(@NonNull final Runnable task) {
        requireNonNull(task, "task must not be null");
        final CorrelationToken token = activeToken();
        if (token == null) {
            return task;
        }
        return () -> {
            try (final CorrelationScope ignored = join(token)) {
                task.run();
            }
        };
    }

    /**
     * Wraps a task so that it runs with the caller's active token, wherever it is executed.
     *
     * @param task the task to wrap
     * @param <V> the result type of the task
     * @return the wrapped task, or {@code task} itself if no scope is open on the calling thread
     */
    @NonNull
    public static <V> Callable<V> wrap(@NonNull final Callable<V> task) {
        requireNonNull(task, "task must not be null");
        final CorrelationToken token = activeToken();
        if (token == null) {
            return task;
        }
        return () -> {
            try (final CorrelationScope ignored = join(token)) {
                return task.call();
            }
        };
    }

    @NonNull
    private static CorrelationScope push(
            @NonNull final CorrelationToken token, @Nullable final CorrelationToken parent) {
        Deque<ThreadBoundScope> scopes = SCOPES.get();
        if (scopes == null) {
            scopes = new ArrayDeque<>();
            SCOPES.set(scopes);
        }
        final String key = contextKey;
        final ThreadBoundScope scope =
                new ThreadBoundScope(token, parent, Thread.currentThread(), key, ThreadContext.get(key));
        scopes.push(scope);
        ThreadContext.put(key, token.toString());
        return scope;
    }

    static void release(@NonNull final ThreadBoundScope scope) {
        if (scope.owner() != Thread.currentThread()) {
            throw new IllegalStateException("Scope " + scope.token() + " was opened by thread "
                    + scope.owner().getName() + " and cannot be closed by thread "
                    + Thread.currentThread().getName());
        }
        if (scope.isClosed()) {
            return;
        }
        final Deque<ThreadBoundScope> scopes = SCOPES.get();
        if (scopes == null || scopes.peek() != scope) {
            throw new IllegalStateException(
                    "Scope " + scope.token() + " cannot be closed while a nested scope is still open");
        }
        scopes.pop();
        scope.markClosed();

        if (scope.previousContextValue() != null) {
            ThreadContext.put(scope.contextKey(), scope.previousContextValue());
        } else {
            ThreadContext.remove(scope.contextKey());
        }
        if (scopes.isEmpty()) {
            SCOPES.remove();
        }
    }
}
