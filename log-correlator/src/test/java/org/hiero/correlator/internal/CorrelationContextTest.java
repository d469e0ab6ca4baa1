// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.internal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.apache.logging.log4j.ThreadContext;
import org.hiero.correlator.CorrelationScope;
import org.hiero.correlator.CorrelationToken;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("CorrelationContext Tests")
class CorrelationContextTest {

    private static final String KEY = CorrelationContext.contextKey();

    @AfterEach
    void noScopeLeaks() {
        assertThat(CorrelationContext.activeToken())
                .withFailMessage("A test left a scope open")
                .isNull();
    }

    @Test
    @DisplayName("No token is active outside of a scope")
    void noActiveTokenOutsideOfScope() {
        assertThat(CorrelationContext.activeToken()).isNull();
        assertThat(ThreadContext.get(KEY)).isNull();
    }

    @Test
    @DisplayName("A scope activates its token until it is closed")
    void scopeActivatesToken() {
        final CorrelationToken token;
        try (final CorrelationScope scope = CorrelationContext.begin()) {
            token = scope.token();
            assertThat(CorrelationContext.activeToken()).isEqualTo(token);
            assertThat(ThreadContext.get(KEY)).isEqualTo(token.toString());
            assertThat(scope.parent()).isNull();
            assertThat(scope.isClosed()).isFalse();
        }
        assertThat(CorrelationContext.activeToken()).isNull();
        assertThat(ThreadContext.get(KEY)).isNull();
    }

    @Test
    @DisplayName("Closing a nested scope restores the outer token")
    void nestedScopeRestoresOuterToken() {
        try (final CorrelationScope outer = CorrelationContext.begin()) {
            try (final CorrelationScope inner = CorrelationContext.begin()) {
                assertThat(inner.token()).isNotEqualTo(outer.token());
                assertThat(inner.parent()).isEqualTo(outer.token());
                assertThat(CorrelationContext.activeToken()).isEqualTo(inner.token());
                assertThat(CorrelationContext.lineage(inner.token())).containsExactly(inner.token(), outer.token());
            }
            assertThat(CorrelationContext.activeToken()).isEqualTo(outer.token());
            assertThat(ThreadContext.get(KEY)).isEqualTo(outer.token().toString());
        }
    }

    @Test
    @DisplayName("Scopes mirror their token under the configured context key")
    void customContextKey() {
        CorrelationContext.useContextKey("traceId");
        try {
            final CorrelationScope early;
            try (final CorrelationScope scope = CorrelationContext.begin()) {
                assertThat(ThreadContext.get("traceId")).isEqualTo(scope.token().toString());
                assertThat(ThreadContext.get(KEY)).isNull();
                assertThat(CorrelationContext.contextKey()).isEqualTo("traceId");
            }
            assertThat(ThreadContext.get("traceId")).isNull();

            CorrelationContext.useContextKey(KEY);
            early = CorrelationContext.begin();
            CorrelationContext.useContextKey("traceId");
            try (final CorrelationScope late = CorrelationContext.begin()) {
                assertThat(ThreadContext.get(KEY)).isEqualTo(early.token().toString());
                assertThat(ThreadContext.get("traceId")).isEqualTo(late.token().toString());
            }
            early.close();
            assertThat(ThreadContext.get(KEY)).isNull();
            assertThat(ThreadContext.get("traceId")).isNull();
        } finally {
            CorrelationContext.useContextKey(KEY);
        }
    }

    @Test
    @DisplayName("A context value set before the first scope is restored")
    void previousContextValueIsRestored() {
        ThreadContext.put(KEY, "set-by-application");
        try {
            try (final CorrelationScope scope = CorrelationContext.begin()) {
                assertThat(ThreadContext.get(KEY)).isEqualTo(scope.token().toString());
            }
            assertThat(ThreadContext.get(KEY)).isEqualTo("set-by-application");
        } finally {
            ThreadContext.remove(KEY);
        }
    }

    @Test
    @DisplayName("Closing a scope twice does nothing")
    void doubleCloseIsNoOp() {
        try (final CorrelationScope outer = CorrelationContext.begin()) {
            final CorrelationScope inner = CorrelationContext.begin();
            inner.close();
            inner.close();

            assertThat(inner.isClosed()).isTrue();
            assertThat(CorrelationContext.activeToken()).isEqualTo(outer.token());
        }
    }

    @Test
    @DisplayName("Closing an outer scope before the nested one fails")
    void outOfOrderCloseFails() {
        final CorrelationScope outer = CorrelationContext.begin();
        final CorrelationScope inner = CorrelationContext.begin();

        assertThatThrownBy(outer::close)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("nested scope");
        assertThat(outer.isClosed()).isFalse();
        assertThat(CorrelationContext.activeToken()).isEqualTo(inner.token());

        inner.close();
        outer.close();
    }

    @Test
    @DisplayName("Closing a scope from another thread fails")
    void foreignThreadCloseFails() throws Exception {
        final AtomicReference<Throwable> failure = new AtomicReference<>();
        try (final CorrelationScope scope = CorrelationContext.begin()) {
            final Thread thread = new Thread(() -> {
                try {
                    scope.close();
                } catch (final Throwable t) {
                    failure.set(t);
                }
            });
            thread.start();
            thread.join(TimeUnit.SECONDS.toMillis(10));

            assertThat(failure.get()).isInstanceOf(IllegalStateException.class);
            assertThat(scope.isClosed()).isFalse();
            assertThat(CorrelationContext.activeToken()).isEqualTo(scope.token());
        }
    }

    @Test
    @DisplayName("Scopes of different threads do not affect each other")
    void scopesAreThreadConfined() throws Exception {
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try (final CorrelationScope scope = CorrelationContext.begin()) {
            final Future<CorrelationToken> otherToken = executor.submit(() -> {
                try (final CorrelationScope other = CorrelationContext.begin()) {
                    return other.token();
                }
            });
            final Future<CorrelationToken> afterwards = executor.submit(CorrelationContext::activeToken);

            assertThat(otherToken.get(10, TimeUnit.SECONDS)).isNotEqualTo(scope.token());
            assertThat(afterwards.get(10, TimeUnit.SECONDS)).isNull();
            assertThat(CorrelationContext.activeToken()).isEqualTo(scope.token());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Wrapped tasks run with the token of the caller")
    void wrappedTasksJoinCallerToken() throws Exception {
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try (final CorrelationScope scope = CorrelationContext.begin()) {
            final Callable<CorrelationToken> task = CorrelationContext::activeToken;

            assertThat(executor.submit(CorrelationContext.wrap(task)).get(10, TimeUnit.SECONDS))
                    .isEqualTo(scope.token());
            assertThat(executor.submit(task).get(10, TimeUnit.SECONDS)).isNull();

            final AtomicReference<String> contextValue = new AtomicReference<>();
            executor.submit(CorrelationContext.wrap(() -> contextValue.set(ThreadContext.get(KEY))))
                    .get(10, TimeUnit.SECONDS);
            assertThat(contextValue.get()).isEqualTo(scope.token().toString());
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Wrapping without an active scope returns the task unchanged")
    void wrappingWithoutScopeIsIdentity() {
        final Runnable task = () -> {};
        assertThat(CorrelationContext.wrap(task)).isSameAs(task);
    }

    @Test
    @DisplayName("Joining a token keeps its lineage")
    void joinKeepsLineage() {
        try (final CorrelationScope outer = CorrelationContext.begin()) {
            final CorrelationToken inner;
            try (final CorrelationScope nested = CorrelationContext.begin()) {
                inner = nested.token();
            }
            try (final CorrelationScope joined = CorrelationContext.join(inner)) {
                assertThat(joined.token()).isEqualTo(inner);
                assertThat(joined.parent()).isEqualTo(outer.token());
            }
        }
    }
}
