package db.toy.storage;

import java.io.EOFException;

/**
 * The store ended before the requested byte window did.
 */
public class ShortReadException extends EOFException {
    private final long offset;
    private final int requested;
    private final int available;

    public ShortReadException(long offset, int requested, int available) {
        super("Short read at offset " + offset + ": requested " + requested + " bytes, got " + available);
        this.offset = offset;
        this.requested = requested;
        this.available = available;
    }

    public long offset() { return offset; }
    public int requested() { return requested; }
    public int available() { return available; }
}
