package io.changestream.store;

import io.changestream.core.ConsumerProgress;
import io.changestream.core.OffsetOutOfRangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;

/**
 * Tracks the highest acknowledged offset per named consumer, independent of cursors.
 * Acknowledgments only ever raise the stored offset, so retried or reordered calls are harmless.
 */
public final class ConsumerAcknowledgment {
    private static final Logger log = LoggerFactory.getLogger(ConsumerAcknowledgment.class);

    private final EventStore store;
    private final ConsumerProgressStore progress;
    private final Clock clock;

    public ConsumerAcknowledgment(EventStore store, ConsumerProgressStore progress, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.progress = Objects.requireNonNull(progress);
        this.clock = Objects.requireNonNull(clock);
    }

    public ConsumerProgress acknowledge(String consumerId, long offset) {
        requireConsumerId(consumerId);
        long next = store.nextOffset();
        if (offset < 0 || offset >= next) {
            throw new OffsetOutOfRangeException(offset, next, false);
        }
        var result = progress.acknowledge(consumerId, offset, clock.instant());
        if (result.acknowledgedOffset() > offset) {
            log.debug("Ignoring stale ack of {} for {}, already at {}", offset, consumerId, result.acknowledgedOffset());
        }
        return result;
    }

    /** Stored progress, or {@link ConsumerProgress#NONE} for a consumer that never acknowledged. */
    public ConsumerProgress progress(String consumerId) {
        requireConsumerId(consumerId);
        return progress.find(consumerId).orElseGet(() -> ConsumerProgress.none(consumerId));
    }

    public long resumeOffset(String consumerId) {
        return progress(consumerId).resumeOffset();
    }

    public boolean reset(String consumerId) {
        requireConsumerId(consumerId);
        boolean deleted = progress.delete(consumerId);
        if (deleted) log.info("Progress of {} reset", consumerId);
        return deleted;
    }

    public List<ConsumerProgress> consumers() {
        return progress.findAll();
    }

    private static void requireConsumerId(String consumerId) {
        Objects.requireNonNull(consumerId, "consumerId");
        if (consumerId.isBlank()) throw new IllegalArgumentException("consumerId must not be blank");
    }
}
