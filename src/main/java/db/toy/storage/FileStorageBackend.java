package db.toy.storage;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.file.Path;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * File-backed store using positioned reads and writes on a {@link RandomAccessFile}.
 * The handle stays open until {@link #close()}; whoever opened it closes it.
 */
public final class FileStorageBackend implements StorageBackend {
    private static final Logger LOG = LoggerFactory.getLogger(FileStorageBackend.class);

    private final String filePath;
    private final RandomAccessFile raf;

    private FileStorageBackend(String filePath, RandomAccessFile raf) {
        this.filePath = filePath;
        this.raf = raf;
    }

    /** Open (or create) the file for reading and writing. */
    public static FileStorageBackend open(Path path) throws IOException {
        File f = path.toFile();
        File parent = f.getAbsoluteFile().getParentFile();
        if (parent != null) parent.mkdirs();
        RandomAccessFile raf = new RandomAccessFile(f, "rw");
        LOG.info("Opened database file {} ({} bytes)", f.getPath(), raf.length());
        return new FileStorageBackend(f.getPath(), raf);
    }

    @Override
    public byte[] readRange(long offset, int length) throws IOException {
        StorageBackend.checkRange(offset, length);
        byte[] buf = new byte[length];
        raf.seek(offset);
        int total = 0;
        // RandomAccessFile.read may return fewer bytes than asked; loop until EOF or full
        while (total < length) {
            int read = raf.read(buf, total, length - total);
            if (read == -1) break;
            total += read;
        }
        if (total < length) {
            throw new ShortReadException(offset, length, total);
        }
        return buf;
    }

    @Override
    public void writeRange(long offset, byte[] bytes) throws IOException {
        StorageBackend.checkRange(offset, bytes.length);
        raf.seek(offset);
        raf.write(bytes);
    }

    @Override
    public long size() throws IOException {
        return raf.length();
    }

    @Override
    public void close() throws IOException {
        LOG.debug("Closing database file {}", filePath);
        raf.close();
    }

    @Override
    public String toString() {
        return "FileStorageBackend{file='" + filePath + "'}";
    }
}
