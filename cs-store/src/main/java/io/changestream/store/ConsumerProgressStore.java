package io.changestream.store;

import io.changestream.core.ConsumerProgress;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Durable per-consumer acknowledgment bookmarks, keyed by consumer id. */
public interface ConsumerProgressStore {

    /**
     * Raises the stored offset to {@code offset} if it is higher, atomically.
     *
     * @return the progress after the call, which may be the unchanged previous value
     */
    ConsumerProgress acknowledge(String consumerId, long offset, Instant at);

    Optional<ConsumerProgress> find(String consumerId);

    boolean delete(String consumerId);

    /** All stored progress, ordered by consumer id. */
    List<ConsumerProgress> findAll();
}
