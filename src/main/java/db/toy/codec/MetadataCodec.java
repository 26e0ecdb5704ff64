package db.toy.codec;

import java.nio.ByteBuffer;

import db.toy.pager.PageId;
import db.toy.pager.PagerException;

/**
 * Fixed 128-byte metadata block, big-endian.
 *
 * [0]       u8   fileSpecVersion
 * [1..2]    u16  pageSize
 * [3..6]    u32  pagesNumber
 * [7..10]   u32  firstEmptyPageId   (0xFFFFFFFF = none)
 * [11..14]  u32  tablesMetaPageId
 * [15..18]  u32  indexesMetaPageId
 * [19..127] reserved, zero
 */
public final class MetadataCodec {
    public static final int SIZE = 128;
    public static final int FILE_SPEC_VERSION = 1;

    private MetadataCodec() {}

    public static byte[] encode(Metadata meta) {
        if (meta.fileSpecVersion() < 0 || meta.fileSpecVersion() > 0xFF) {
            throw new IllegalArgumentException("fileSpecVersion does not fit u8: " + meta.fileSpecVersion());
        }
        if (meta.pageSize() < 0 || meta.pageSize() > 0xFFFF) {
            throw new IllegalArgumentException("pageSize does not fit u16: " + meta.pageSize());
        }
        if (meta.pagesNumber() < 0 || meta.pagesNumber() > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("pagesNumber does not fit u32: " + meta.pagesNumber());
        }
        ByteBuffer buffer = ByteBuffer.allocate(SIZE); // reserved tail stays zero
        buffer.put((byte) meta.fileSpecVersion());
        buffer.putShort((short) meta.pageSize());
        buffer.putInt((int) meta.pagesNumber());
        buffer.putInt(meta.firstEmptyPageId().value());
        buffer.putInt(meta.tablesMetaPageId().value());
        buffer.putInt(meta.indexesMetaPageId().value());
        return buffer.array();
    }

    public static Metadata decode(byte[] bytes) throws PagerException {
        if (bytes.length < SIZE) {
            throw PagerException.decodeError("metadata block is " + bytes.length + " bytes, expected " + SIZE);
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes, 0, SIZE);
        int version = Byte.toUnsignedInt(buffer.get());
        if (version != FILE_SPEC_VERSION) {
            throw PagerException.decodeError("unsupported file spec version " + version);
        }
        int pageSize = Short.toUnsignedInt(buffer.getShort());
        long pagesNumber = Integer.toUnsignedLong(buffer.getInt());
        PageId firstEmpty = new PageId(buffer.getInt());
        PageId tables = new PageId(buffer.getInt());
        PageId indexes = new PageId(buffer.getInt());
        return new Metadata(version, pageSize, pagesNumber, firstEmpty, tables, indexes);
    }
}
