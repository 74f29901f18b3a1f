package io.changestream.store;

import io.changestream.core.ChangeEvent;
import io.changestream.core.InvalidRangeException;
import io.changestream.core.OffsetOutOfRangeException;

import java.util.List;
import java.util.Objects;

/** Bounded historical reads for audit and backfill. Touches no cursor or progress. */
public final class RangeReplay {
    private final EventStore store;

    public RangeReplay(EventStore store) {
        this.store = Objects.requireNonNull(store);
    }

    /** Events in the inclusive range {@code [fromOffset, toOffset]}. */
    public List<ChangeEvent> replay(long fromOffset, long toOffset) {
        if (fromOffset > toOffset) throw new InvalidRangeException(fromOffset, toOffset);
        long next = store.nextOffset();
        if (fromOffset < 0) throw new OffsetOutOfRangeException(fromOffset, next, false);
        if (toOffset >= next) throw new OffsetOutOfRangeException(toOffset, next, false);
        return store.range(fromOffset, toOffset);
    }
}
