package db.toy.storage;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.io.RandomAccessFile;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FileStorageBackendTest {

    @Test
    void readsBytesWrittenByAnotherHandle() throws Exception {
        File temp = File.createTempFile("backend-test", ".db");
        temp.deleteOnExit();
        try (RandomAccessFile raf = new RandomAccessFile(temp, "rw")) {
            byte[] data = new byte[64];
            data[40] = 42; // marker
            raf.write(data);
        }
        try (FileStorageBackend backend = FileStorageBackend.open(temp.toPath())) {
            assertEquals(64, backend.size());
            assertEquals(42, backend.readRange(40, 4)[0]);
        }
    }

    @Test
    void writeThenReadAtOffset(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("nested/toy.db");
        try (FileStorageBackend backend = FileStorageBackend.open(file)) {
            backend.writeRange(10, new byte[] {1, 2, 3});
            assertEquals(13, backend.size());
            assertArrayEquals(new byte[] {0, 1, 2, 3}, backend.readRange(9, 4));
        }
        assertTrue(file.toFile().exists());
    }

    @Test
    void readBeyondEndIsShortRead(@TempDir Path dir) throws Exception {
        try (FileStorageBackend backend = FileStorageBackend.open(dir.resolve("empty.db"))) {
            backend.writeRange(0, new byte[6]);
            ShortReadException ex = assertThrows(ShortReadException.class, () -> backend.readRange(4, 8));
            assertEquals(2, ex.available());
            assertThrows(ShortReadException.class, () -> backend.readRange(100, 1));
        }
    }
}
