package io.changestream.core;

public class OffsetOutOfRangeException extends ChangeLogException {
    private final long offset;

    public OffsetOutOfRangeException(long offset, long nextOffset, boolean endInclusive) {
        super(ErrorKind.OUT_OF_RANGE, "offset " + offset + " outside [0, " + nextOffset + (endInclusive ? "]" : ")"));
        this.offset = offset;
    }

    public long offset() { return offset; }
}
