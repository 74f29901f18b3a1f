package io.changestream.core;

import java.util.Objects;

public abstract class ChangeLogException extends RuntimeException {
    private final ErrorKind kind;

    protected ChangeLogException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind);
    }

    public ErrorKind kind() { return kind; }
}
