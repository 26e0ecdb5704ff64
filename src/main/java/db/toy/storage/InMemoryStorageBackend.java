package db.toy.storage;

import java.util.Arrays;

/**
 * In-memory store with a cursor, for reproducing pager I/O without a filesystem.
 * Writes past the end grow the buffer and zero-fill any gap.
 */
public final class InMemoryStorageBackend implements StorageBackend {
    private byte[] contents;
    private int length;
    private long position; // last seek target, kept for inspection in tests

    public InMemoryStorageBackend() {
        this(new byte[0]);
    }

    public InMemoryStorageBackend(byte[] initialContents) {
        this.contents = initialContents.clone();
        this.length = initialContents.length;
        this.position = 0;
    }

    @Override
    public byte[] readRange(long offset, int len) throws ShortReadException {
        StorageBackend.checkRange(offset, len);
        position = offset;
        long available = Math.max(0, length - offset);
        if (available < len) {
            throw new ShortReadException(offset, len, (int) available);
        }
        byte[] out = Arrays.copyOfRange(contents, (int) offset, (int) offset + len);
        position = offset + len;
        return out;
    }

    @Override
    public void writeRange(long offset, byte[] bytes) {
        StorageBackend.checkRange(offset, bytes.length);
        long end = offset + bytes.length;
        if (end > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("In-memory store cannot grow to " + end + " bytes");
        }
        ensureCapacity((int) end);
        System.arraycopy(bytes, 0, contents, (int) offset, bytes.length);
        length = Math.max(length, (int) end);
        position = end;
    }

    @Override
    public long size() { return length; }

    public long position() { return position; }

    /** Snapshot of the bytes written so far. */
    public byte[] contents() { return Arrays.copyOf(contents, length); }

    @Override
    public void close() {}

    private void ensureCapacity(int needed) {
        if (needed <= contents.length) return;
        int grown = Math.max(needed, contents.length * 2);
        contents = Arrays.copyOf(contents, grown);
    }
}
