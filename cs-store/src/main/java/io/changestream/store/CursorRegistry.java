package io.changestream.store;

import io.changestream.core.ChangeEvent;
import io.changestream.core.CursorId;
import io.changestream.core.CursorNotFoundException;
import io.changestream.core.CursorView;
import io.changestream.core.OffsetOutOfRangeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-subscription read cursors into an {@link EventStore}.
 * <p>
 * A read returns the events at the cursor position and moves it past them. Reads on one cursor are
 * mutually exclusive; different cursors never contend. Cursors are session state and are not
 * persisted: a restarted consumer resumes from its acknowledged progress instead.
 */
public final class CursorRegistry {
    private static final Logger log = LoggerFactory.getLogger(CursorRegistry.class);

    private final EventStore store;
    private final Clock clock;
    private final ConcurrentMap<CursorId, Cursor> cursors = new ConcurrentHashMap<>();

    public CursorRegistry(EventStore store, Clock clock) {
        this.store = Objects.requireNonNull(store);
        this.clock = Objects.requireNonNull(clock);
    }

    /** Opens a cursor at {@code fromOffset}; {@code fromOffset == nextOffset()} means future events only. */
    public CursorId subscribe(long fromOffset, String owner) {
        Objects.requireNonNull(owner, "owner");
        long next = store.nextOffset();
        if (fromOffset < 0 || fromOffset > next) {
            throw new OffsetOutOfRangeException(fromOffset, next, true);
        }
        var id = CursorId.random();
        cursors.put(id, new Cursor(id, owner, fromOffset, clock.instant()));
        log.debug("Cursor {} opened by {} at offset {}", id, owner, fromOffset);
        return id;
    }

    public CursorId subscribeAtEnd(String owner) {
        return subscribe(store.nextOffset(), owner);
    }

    /** Returns up to {@code maxCount} events and advances the cursor by the number returned. */
    public List<ChangeEvent> read(CursorId id, int maxCount) {
        if (maxCount <= 0) throw new IllegalArgumentException("maxCount must be > 0: " + maxCount);
        var cursor = lookup(id);
        cursor.lock.lock();
        try {
            if (cursor.released) throw new CursorNotFoundException(id);
            long from = cursor.position;
            long next = store.nextOffset();
            cursor.lastReadAt = clock.instant();
            if (from >= next) return List.of();

            long to = Math.min(next - 1, from + maxCount - 1);
            var events = store.range(from, to);
            cursor.position = from + events.size();
            return events;
        } finally {
            cursor.lock.unlock();
        }
    }

    public void unsubscribe(CursorId id) {
        release(lookup(id));
        log.debug("Cursor {} released", id);
    }

    /** Releases every cursor of {@code owner}, e.g. when its session ends. */
    public int unsubscribeAll(String owner) {
        int released = 0;
        for (var cursor : cursors.values()) {
            if (cursor.owner.equals(owner) && release(cursor)) released++;
        }
        if (released > 0) log.info("Released {} cursor(s) of {}", released, owner);
        return released;
    }

    /** Releases cursors that were neither created nor read within {@code idleTimeout}. */
    public int expireIdle(Duration idleTimeout) {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int expired = 0;
        for (var cursor : cursors.values()) {
            if (cursor.lastReadAt.isBefore(cutoff) && release(cursor)) expired++;
        }
        if (expired > 0) log.info("Expired {} idle cursor(s)", expired);
        return expired;
    }

    public Optional<CursorView> cursor(CursorId id) {
        return Optional.ofNullable(cursors.get(id)).map(Cursor::view);
    }

    public List<CursorView> cursors(String owner) {
        return cursors.values().stream()
                .filter(c -> c.owner.equals(owner))
                .map(Cursor::view)
                .sorted(Comparator.comparing(CursorView::createdAt))
                .toList();
    }

    public int size() {
        return cursors.size();
    }

    private Cursor lookup(CursorId id) {
        var cursor = cursors.get(Objects.requireNonNull(id, "cursorId"));
        if (cursor == null) throw new CursorNotFoundException(id);
        return cursor;
    }

    private boolean release(Cursor cursor) {
        if (!cursors.remove(cursor.id, cursor)) return false;
        cursor.lock.lock();
        try {
            cursor.released = true;
        } finally {
            cursor.lock.unlock();
        }
        return true;
    }

    private static final class Cursor {
        final CursorId id;
        final String owner;
        final Instant createdAt;
        final ReentrantLock lock = new ReentrantLock();
        // guarded by lock
        long position;
        boolean released;
        volatile Instant lastReadAt;

        Cursor(CursorId id, String owner, long position, Instant createdAt) {
            this.id = id;
            this.owner = owner;
            this.position = position;
            this.createdAt = createdAt;
            this.lastReadAt = createdAt;
        }

        CursorView view() {
            lock.lock();
            try {
                return new CursorView(id, owner, position, createdAt, lastReadAt);
            } finally {
                lock.unlock();
            }
        }
    }
}
