package io.changestream.core;

import java.util.Objects;

public record AppendResult(long offset, EventId eventId) {
    public AppendResult {
        Objects.requireNonNull(eventId);
    }
}
