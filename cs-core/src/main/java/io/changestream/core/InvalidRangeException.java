package io.changestream.core;

public class InvalidRangeException extends ChangeLogException {
    public InvalidRangeException(long fromOffset, long toOffset) {
        super(ErrorKind.INVALID_RANGE, "fromOffset " + fromOffset + " > toOffset " + toOffset);
    }
}
