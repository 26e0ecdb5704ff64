package db.toy.codec;

import java.nio.ByteBuffer;

import db.toy.pager.Page;
import db.toy.pager.PageId;
import db.toy.pager.PagerException;

/**
 * Encodes pages to and from their on-disk slot image.
 *
 * Layout (pageSize bytes, big-endian):
 * [0..3]  int  pageId
 * [4..7]  int  nextId   (0xFFFFFFFF = none)
 * [8.....pageSize-1]    payload
 */
public final class PageCodec {
    private static final int ID_BYTES = 4;

    /** Serialized width of the page header (id + nextId). */
    public static final int PAGE_OVERHEAD = 2 * ID_BYTES;

    private final int pageSize;

    public PageCodec(int pageSize) {
        if (pageSize <= PAGE_OVERHEAD) {
            throw new IllegalArgumentException("pageSize must exceed page overhead (" + PAGE_OVERHEAD + "): " + pageSize);
        }
        this.pageSize = pageSize;
    }

    public int payloadSize() { return pageSize - PAGE_OVERHEAD; }

    public byte[] encode(Page page) throws PagerException {
        if (page.payloadLength() != payloadSize()) {
            throw new PagerException(PagerException.Kind.SIZE_MISMATCH, page.id(),
                    "payload of " + page.id() + " is " + page.payloadLength() + " bytes, expected " + payloadSize());
        }
        ByteBuffer buffer = ByteBuffer.allocate(pageSize);
        buffer.putInt(page.id().value());
        buffer.putInt(page.nextId().value());
        buffer.put(page.payload());
        return buffer.array();
    }

    /** Decodes a slot image; everything after the header becomes the payload. */
    public static Page decode(byte[] bytes) throws PagerException {
        if (bytes.length < PAGE_OVERHEAD) {
            throw PagerException.decodeError("page image is " + bytes.length + " bytes, shorter than header (" + PAGE_OVERHEAD + ")");
        }
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        PageId id = new PageId(buffer.getInt());
        PageId nextId = new PageId(buffer.getInt());
        byte[] payload = new byte[buffer.remaining()];
        buffer.get(payload);
        return new Page(id, nextId, payload);
    }
}
