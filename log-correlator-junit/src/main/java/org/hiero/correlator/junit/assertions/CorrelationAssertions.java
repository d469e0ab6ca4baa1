// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.junit.assertions;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import org.assertj.core.api.Assertions;
import org.hiero.correlator.CapturedEvents;

/**
 * This class contains all {@code assertThat()} methods for captured events, in addition to the ones of AssertJ.
 */
public class CorrelationAssertions extends Assertions {

    private CorrelationAssertions() {}

    /**
     * Creates an assertion for the given {@link CapturedEvents}.
     *
     * @param actual the {@link CapturedEvents} to assert
     * @return an assertion for the given {@link CapturedEvents}
     */
    @NonNull
    public static CapturedEventsAssert assertThat(@Nullable final CapturedEvents actual) {
        return CapturedEventsAssert.assertThat(actual);
    }
}
