package io.changestream.core;

public class StoreClosedException extends ChangeLogException {
    public StoreClosedException() {
        super(ErrorKind.CLOSED, "event store is closed");
    }
}
