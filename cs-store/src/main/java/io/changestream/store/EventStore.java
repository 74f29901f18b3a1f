package io.changestream.store;

import io.changestream.core.AppendResult;
import io.changestream.core.ChangeEvent;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.Flow.Publisher;

/**
 * Append-only, offset-indexed event storage. Offsets start at 0 and have no gaps.
 * All operations fail with {@link io.changestream.core.StoreClosedException} once closed.
 */
public interface EventStore extends AutoCloseable {

    /** Stores a new event at {@link #nextOffset()}. A failed append leaves the offset untouched. */
    AppendResult append(String eventType, byte[] before, byte[] after, String source);

    /** Offset the next append receives; every lower offset is readable. */
    long nextOffset();

    Optional<ChangeEvent> get(long offset);

    /** Events in {@code [fromOffset, toOffset]}, ascending. Bounds must lie below {@link #nextOffset()}. */
    List<ChangeEvent> range(long fromOffset, long toOffset);

    /** Emits the new next offset after each append. Signals may be dropped for slow subscribers, events never are. */
    Publisher<Long> appendNotifications();

    boolean isClosed();

    @Override
    void close();
}
