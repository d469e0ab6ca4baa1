// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.junit;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.hiero.correlator.CorrelatedLogging;
import org.hiero.correlator.CorrelationScope;
import org.hiero.correlator.CorrelationToken;
import org.hiero.correlator.internal.CorrelationContext;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.MethodOrderer;
import org.junit.jupiter.api.Order;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestMethodOrder;
import org.junit.jupiter.api.extension.ExtendWith;

@DisplayName("CorrelationExtension Tests")
@ExtendWith(CorrelationExtension.class)
@TestMethodOrder(MethodOrderer.OrderAnnotation.class)
class CorrelationExtensionTest {

    private static final Logger logger = LogManager.getLogger(CorrelationExtensionTest.class);

    private static CorrelationToken previousToken;

    @BeforeEach
    void logSetUp() {
        logger.info("set up");
    }

    @AfterAll
    static void noScopeIsLeftOpen() {
        assertThat(CorrelatedLogging.activeToken()).isNull();
    }

    @Test
    @Order(1)
    @DisplayName("The test runs inside an active scope")
    void testRunsInsideScope(final CorrelationToken token, final CorrelationScope scope) {
        assertThat(CorrelatedLogging.isInitialized()).isTrue();
        assertThat(CorrelatedLogging.activeToken()).isEqualTo(token);
        assertThat(scope.token()).isEqualTo(token);
        assertThat(scope.isClosed()).isFalse();
        assertThat(scope.parent()).isNull();
        previousToken = token;
    }

    @Test
    @Order(2)
    @DisplayName("Every test gets a fresh top-level scope")
    void everyTestGetsFreshScope(final CorrelationToken token) {
        assertThat(previousToken).isNotNull();
        assertThat(token).isNotEqualTo(previousToken);
        assertThat(CorrelationContext.lineage(token)).containsExactly(token);
    }

    @Test
    @Order(3)
    @DisplayName("The supplier returns the events of the test, including set up")
    void supplierReturnsEventsOfTest(final CapturedEventsSupplier events, final CorrelationToken token) {
        assertThat(events.token()).isEqualTo(token);
        assertThat(events.get().messages()).containsExactly("set up");

        logger.warn("inside the test");

        assertThat(events.get().messages()).containsExactly("set up", "inside the test");
        assertThat(events.get().allMatch(event -> token.equals(event.token()))).isTrue();
    }

    @Test
    @Order(4)
    @DisplayName("Wrapped tasks of the test are included")
    void wrappedTasksAreIncluded(final CapturedEventsSupplier events) throws Exception {
        final ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            executor.submit(CorrelatedLogging.wrap(() -> logger.info("from a worker")))
                    .get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }

        assertThat(events.get().messages()).containsExactly("set up", "from a worker");
    }

    @Test
    @Order(5)
    @DisplayName("Closing the scope inside the test is tolerated")
    void closingScopeInsideTest(final CorrelationScope scope) {
        scope.close();

        assertThat(scope.isClosed()).isTrue();
        assertThat(CorrelatedLogging.activeToken()).isNull();
    }
}
