package io.changestream.store;

import io.changestream.core.AppendResult;
import io.changestream.core.ChangeEvent;
import io.changestream.core.ConsumerProgress;
import io.changestream.core.CursorId;
import io.changestream.core.CursorView;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Entry point of the change log: appends, cursors, consumer progress and replay over one store.
 */
public final class ChangeLog implements AutoCloseable {
    private final EventStore store;
    private final CursorRegistry cursors;
    private final ConsumerAcknowledgment acknowledgments;
    private final RangeReplay replay;

    public ChangeLog(EventStore store, ConsumerProgressStore progress, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.cursors = new CursorRegistry(store, clock);
        this.acknowledgments = new ConsumerAcknowledgment(store, progress, clock);
        this.replay = new RangeReplay(store);
    }

    public AppendResult append(String eventType, byte[] before, byte[] after, String source) {
        return store.append(eventType, before, after, source);
    }

    public long nextOffset() {
        return store.nextOffset();
    }

    public Optional<ChangeEvent> get(long offset) {
        return store.get(offset);
    }

    public CursorId subscribe(long fromOffset, String owner) {
        return cursors.subscribe(fromOffset, owner);
    }

    public CursorId subscribeAtEnd(String owner) {
        return cursors.subscribeAtEnd(owner);
    }

    /** Opens a cursor right after the last offset {@code consumerId} acknowledged. */
    public CursorId resume(String consumerId, String owner) {
        return cursors.subscribe(acknowledgments.resumeOffset(consumerId), owner);
    }

    public List<ChangeEvent> read(CursorId cursorId, int maxCount) {
        return cursors.read(cursorId, maxCount);
    }

    public void unsubscribe(CursorId cursorId) {
        cursors.unsubscribe(cursorId);
    }

    public int unsubscribeAll(String owner) {
        return cursors.unsubscribeAll(owner);
    }

    public Optional<CursorView> cursor(CursorId cursorId) {
        return cursors.cursor(cursorId);
    }

    public List<CursorView> cursors(String owner) {
        return cursors.cursors(owner);
    }

    public int expireIdleCursors(Duration idleTimeout) {
        return cursors.expireIdle(idleTimeout);
    }

    public ConsumerProgress acknowledge(String consumerId, long offset) {
        return acknowledgments.acknowledge(consumerId, offset);
    }

    public ConsumerProgress progress(String consumerId) {
        return acknowledgments.progress(consumerId);
    }

    public boolean resetProgress(String consumerId) {
        return acknowledgments.reset(consumerId);
    }

    public List<ConsumerProgress> consumers() {
        return acknowledgments.consumers();
    }

    public List<ChangeEvent> replay(long fromOffset, long toOffset) {
        return replay.replay(fromOffset, toOffset);
    }

    public EventStore store() {
        return store;
    }

    @Override
    public void close() {
        store.close();
    }
}
