package io.changestream.core;

public class CursorNotFoundException extends ChangeLogException {
    public CursorNotFoundException(Object cursorId) {
        super(ErrorKind.NOT_FOUND, "unknown cursor " + cursorId);
    }
}
