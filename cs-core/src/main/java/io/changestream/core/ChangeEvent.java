package io.changestream.core;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One entry of the change log. Immutable; {@code before} and {@code after} are copied in and out.
 * Only {@link #offset()} orders events, {@link #timestamp()} may go backwards.
 */
public record ChangeEvent(
        long offset,
        EventId eventId,
        String eventType,
        byte[] before,
        byte[] after,
        String source,
        Instant timestamp
) {
    private static final byte[] EMPTY = new byte[0];

    public ChangeEvent {
        if (offset < 0) throw new IllegalArgumentException("offset must be >= 0: " + offset);
        Objects.requireNonNull(eventId);
        Objects.requireNonNull(eventType);
        Objects.requireNonNull(source);
        Objects.requireNonNull(timestamp);
        before = before == null ? EMPTY : before.clone();
        after = after == null ? EMPTY : after.clone();
    }

    /** Builds the event for a freshly assigned offset, deriving its id from the content. */
    public static ChangeEvent create(long offset, String eventType, byte[] before, byte[] after,
                                     String source, Instant timestamp) {
        return new ChangeEvent(offset, EventId.derive(eventType, source, timestamp, offset),
                eventType, before, after, source, timestamp);
    }

    @Override public byte[] before() { return before.clone(); }
    @Override public byte[] after() { return after.clone(); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChangeEvent e)) return false;
        return offset == e.offset
                && eventId.equals(e.eventId)
                && eventType.equals(e.eventType)
                && Arrays.equals(before, e.before)
                && Arrays.equals(after, e.after)
                && source.equals(e.source)
                && timestamp.equals(e.timestamp);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(offset, eventId, eventType, source, timestamp);
        h = 31 * h + Arrays.hashCode(before);
        return 31 * h + Arrays.hashCode(after);
    }

    @Override
    public String toString() {
        return "ChangeEvent[offset=" + offset + ", eventId=" + eventId + ", eventType=" + eventType
                + ", before=" + before.length + "B, after=" + after.length + "B, source=" + source
                + ", timestamp=" + timestamp + "]";
    }
}
