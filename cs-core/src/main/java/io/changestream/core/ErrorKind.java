package io.changestream.core;

/** Error taxonomy of the change log. Only {@link #CLOSED} is worth retrying. */
public enum ErrorKind {
    OUT_OF_RANGE,
    NOT_FOUND,
    INVALID_RANGE,
    CLOSED;

    public boolean retryable() { return this == CLOSED; }
}
