package db.toy.storage;

import java.io.Closeable;
import java.io.IOException;

/**
 * Random-access byte store under the pager. The only component that performs physical I/O.
 * Implementations must report a read that cannot be fully satisfied with
 * {@link ShortReadException}, never by returning fewer bytes.
 */
public interface StorageBackend extends Closeable {

    /** Read exactly {@code length} bytes starting at absolute position {@code offset}. */
    byte[] readRange(long offset, int length) throws IOException;

    /** Write all of {@code bytes} starting at absolute position {@code offset}. */
    void writeRange(long offset, byte[] bytes) throws IOException;

    /** Current size of the store in bytes. */
    long size() throws IOException;

    static void checkRange(long offset, int length) {
        if (offset < 0) throw new IllegalArgumentException("Negative offset: " + offset);
        if (length < 0) throw new IllegalArgumentException("Negative length: " + length);
    }
}
