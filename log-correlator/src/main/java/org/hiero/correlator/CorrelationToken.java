// SPDX-License-Identifier: Apache-2.0
package org.hiero.correlator;

import static java.util.Objects.requireNonNull;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;
import java.util.UUID;

/**
 * An opaque, globally unique 128-bit identifier of one logical operation.
 *
 * <p>Two tokens are equal if and only if they wrap the same {@link UUID}. The textual form returned by
 * {@link #toString()} is the canonical UUID representation and can be read back with {@link #parse(String)}.
 *
 * @param value the wrapped random UUID
 */
public record CorrelationToken(@NonNull UUID value) {

    /**
     * @throws NullPointerException if {@code value} is {@code null}
     */
    public CorrelationToken {
        requireNonNull(value, "value must not be null");
    }

    /**
     * Creates a new token backed by a random (version 4) UUID.
     *
     * @return a new, unique token
     */
    @NonNull
    public static CorrelationToken random() {
        return new CorrelationToken(UUID.randomUUID());
    }

    /**
     * Reads a token from its textual form.
     *
     * @param text the canonical UUID text
     * @return the token
     * @throws IllegalArgumentException if {@code text} is not a valid UUID
     */
    @NonNull
    public static CorrelationToken parse(@NonNull final String text) {
        requireNonNull(text, "text must not be null");
        return new CorrelationToken(UUID.fromString(text));
    }

    /**
     * Reads a token from its textual form, returning {@code null} instead of failing.
     *
     * @param text the text to read, may be {@code null}
     * @return the token, or {@code null} if {@code text} is {@code null} or not a valid UUID
     */
    @Nullable
    public static CorrelationToken tryParse(@Nullable final String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        try {
            return parse(text.trim());
        } catch (final IllegalArgumentException e) {
            return null;
        }
    }

    @Override
    public String toString() {
        return value.toString();
    }
}
