// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator.junit;

import edu.umd.cs.findbugs.annotations.NonNull;
import java.util.function.Supplier;
import org.hiero.correlator.CapturedEvents;
import org.hiero.correlator.CorrelationToken;

/**
 * Gives a test access to the events captured for its correlation token.
 *
 * <p>Every call to {@link #get()} takes a new snapshot, so events logged after an earlier call are included.
 */
public interface CapturedEventsSupplier extends Supplier<CapturedEvents> {

    /**
     * @return the correlation token of the test
     */
    @NonNull
    CorrelationToken token();

    /**
     * @return a snapshot of the events captured for the token of the test so far
     */
    @Override
    @NonNull
    CapturedEvents get();
}
