package db.toy.pager;

import java.io.IOException;

/**
 * Storage-level failure reported by the pager: a missing or corrupted page,
 * a write outside the allocated page space, or malformed bytes.
 */
public class PagerException extends IOException {

    public enum Kind {
        /** Slot absent: the store is too short to hold the requested window. */
        PAGE_NOT_FOUND,
        /** Decoded page id differs from the id used to address it. */
        PAGE_ID_MISMATCH,
        /** Write to a slot that was never allocated. */
        OVERFLOW_WRITE,
        /** Payload width does not match pageSize - PAGE_OVERHEAD. */
        SIZE_MISMATCH,
        /** Bytes cannot be decoded into a page or metadata block. */
        DECODE_ERROR,
        /** A page chain loops back on itself. */
        CORRUPTED_CHAIN,
        /** Any other failure of the underlying store. */
        IO_ERROR
    }

    private final Kind kind;
    private final PageId pageId;

    public PagerException(Kind kind, PageId pageId, String message) {
        this(kind, pageId, message, null);
    }

    public PagerException(Kind kind, PageId pageId, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
        this.pageId = pageId;
    }

    public static PagerException decodeError(String message) {
        return new PagerException(Kind.DECODE_ERROR, PageId.NONE, message);
    }

    public Kind kind() { return kind; }

    /** The page involved, or {@link PageId#NONE} when the failure is not tied to one page. */
    public PageId pageId() { return pageId; }
}
