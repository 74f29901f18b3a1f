package io.changestream.api;

import io.changestream.core.ChangeEvent;

import java.time.Instant;

/** Wire form of an event; payloads travel as base64. */
public record EventView(
        long offset,
        String eventId,
        String eventType,
        byte[] before,
        byte[] after,
        String source,
        Instant timestamp
) {
    static EventView of(ChangeEvent e) {
        return new EventView(e.offset(), e.eventId().value(), e.eventType(), e.before(), e.after(), e.source(), e.timestamp());
    }
}
