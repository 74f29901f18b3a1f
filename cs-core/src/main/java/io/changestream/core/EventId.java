package io.changestream.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Content-derived event identifier: SHA-256 (hex) over type, source, timestamp and offset.
 * Stable for a given event, so callers can use it to dedupe retried appends.
 */
public record EventId(String value) {
    public EventId {
        Objects.requireNonNull(value);
        if (value.isBlank()) throw new IllegalArgumentException("event id must not be blank");
    }

    public static EventId derive(String eventType, String source, Instant timestamp, long offset) {
        var key = eventType + "|" + source + "|" + timestamp + "|" + offset;
        try {
            var md = MessageDigest.getInstance("SHA-256");
            return new EventId(HexFormat.of().formatHex(md.digest(key.getBytes(StandardCharsets.UTF_8))));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    @JsonValue public String json() { return value; }
    @Override public String toString() { return value; }
}
