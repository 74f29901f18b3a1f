package io.changestream.core;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;
import java.util.UUID;

public record CursorId(UUID value) {
    public CursorId {
        Objects.requireNonNull(value);
    }

    public static CursorId random() { return new CursorId(UUID.randomUUID()); }

    /** Parses the textual form; malformed input is reported as an unknown cursor. */
    public static CursorId parse(String text) {
        try {
            return new CursorId(UUID.fromString(text));
        } catch (IllegalArgumentException e) {
            throw new CursorNotFoundException(text);
        }
    }

    @JsonValue public String json() { return value.toString(); }
    @Override public String toString() { return value.toString(); }
}
