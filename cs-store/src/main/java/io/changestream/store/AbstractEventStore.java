package io.changestream.store;

import io.changestream.core.AppendResult;
import io.changestream.core.ChangeEvent;
import io.changestream.core.StoreClosedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Flow;
import java.util.concurrent.SubmissionPublisher;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Offset bookkeeping shared by the event stores.
 * <p>
 * Appends are serialised by a single writer lock. {@code nextOffset} is volatile and only written
 * after {@link #persist(ChangeEvent)} returned, so a reader that sees offset {@code n} as
 * assigned can always load it.
 */
public abstract class AbstractEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(AbstractEventStore.class);

    private final ReentrantLock writeLock = new ReentrantLock();
    private final SubmissionPublisher<Long> bus;
    private final Clock clock;
    private volatile long nextOffset;
    private volatile boolean closed;

    protected AbstractEventStore(Clock clock, long initialNextOffset) {
        this(clock, initialNextOffset, new SubmissionPublisher<>());
    }

    /** @param notifier runs the append-notification subscribers */
    protected AbstractEventStore(Clock clock, long initialNextOffset, Executor notifier) {
        this(clock, initialNextOffset, new SubmissionPublisher<>(Objects.requireNonNull(notifier), Flow.defaultBufferSize()));
    }

    private AbstractEventStore(Clock clock, long initialNextOffset, SubmissionPublisher<Long> bus) {
        if (initialNextOffset < 0) throw new IllegalArgumentException("next offset must be >= 0: " + initialNextOffset);
        this.clock = Objects.requireNonNull(clock);
        this.nextOffset = initialNextOffset;
        this.bus = bus;
    }

    /** Writes the event durably; throwing aborts the append. Called with the writer lock held. */
    protected abstract void persist(ChangeEvent event);

    /** Loads an event that is known to be assigned. */
    protected abstract ChangeEvent load(long offset);

    /** Loads an inclusive range of assigned offsets in ascending order. */
    protected abstract List<ChangeEvent> loadRange(long fromOffset, long toOffset);

    @Override
    public AppendResult append(String eventType, byte[] before, byte[] after, String source) {
        Objects.requireNonNull(eventType, "eventType");
        Objects.requireNonNull(source, "source");
        writeLock.lock();
        try {
            ensureOpen();
            long offset = nextOffset;
            var event = ChangeEvent.create(offset, eventType, before, after, source, clock.instant());
            persist(event);
            nextOffset = offset + 1;
            notifyAppended(offset + 1);
            log.debug("Appended {} at offset {} from {}", eventType, offset, source);
            return new AppendResult(offset, event.eventId());
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public long nextOffset() {
        ensureOpen();
        return nextOffset;
    }

    @Override
    public Optional<ChangeEvent> get(long offset) {
        if (offset < 0 || offset >= nextOffset()) return Optional.empty();
        return Optional.of(load(offset));
    }

    @Override
    public List<ChangeEvent> range(long fromOffset, long toOffset) {
        long next = nextOffset();
        if (fromOffset < 0 || toOffset >= next) {
            throw new IllegalArgumentException("range [" + fromOffset + ", " + toOffset + "] outside [0, " + next + ")");
        }
        if (fromOffset > toOffset) return List.of();
        return loadRange(fromOffset, toOffset);
    }

    @Override
    public Flow.Publisher<Long> appendNotifications() {
        return bus;
    }

    @Override
    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        writeLock.lock();
        try {
            if (closed) return;
            closed = true;
            bus.close();
            log.info("Event store closed at next offset {}", nextOffset);
        } finally {
            writeLock.unlock();
        }
    }

    /** Re-aligns the offset counter with the backing storage after a failed write. */
    protected void resetNextOffset(long offset) {
        if (!writeLock.isHeldByCurrentThread()) {
            throw new IllegalStateException("next offset may only be reset while appending");
        }
        nextOffset = offset;
    }

    protected Clock clock() {
        return clock;
    }

    // The event is already stored here: a notification failure must not fail the append.
    private void notifyAppended(long next) {
        try {
            bus.offer(next, (subscriber, dropped) -> false);
        } catch (RuntimeException e) {
            log.warn("Append notification for next offset {} dropped", next, e);
        }
    }

    private void ensureOpen() {
        if (closed) throw new StoreClosedException();
    }
}
