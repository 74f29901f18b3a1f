package io.changestream.core;

import java.time.Instant;

/** Point-in-time snapshot of a cursor; {@code position} is the next offset a read returns. */
public record CursorView(CursorId id, String owner, long position, Instant createdAt, Instant lastReadAt) {}
