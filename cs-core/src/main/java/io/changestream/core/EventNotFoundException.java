package io.changestream.core;

public class EventNotFoundException extends ChangeLogException {
    public EventNotFoundException(long offset) {
        super(ErrorKind.NOT_FOUND, "no event at offset " + offset);
    }
}
