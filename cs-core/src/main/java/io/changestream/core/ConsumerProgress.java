package io.changestream.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Durable bookmark of a named consumer. {@link #NONE} marks a consumer that never acknowledged,
 * so {@link #resumeOffset()} is 0 for it.
 */
public record ConsumerProgress(String consumerId, long acknowledgedOffset, Instant updatedAt) {
    public static final long NONE = -1L;

    public ConsumerProgress {
        Objects.requireNonNull(consumerId);
        if (acknowledgedOffset < NONE) {
            throw new IllegalArgumentException("acknowledged offset must be >= " + NONE + ": " + acknowledgedOffset);
        }
    }

    public static ConsumerProgress none(String consumerId) {
        return new ConsumerProgress(consumerId, NONE, null);
    }

    public boolean acknowledged() { return acknowledgedOffset != NONE; }

    /** First offset the consumer has not yet processed. */
    public long resumeOffset() { return acknowledgedOffset + 1; }
}
