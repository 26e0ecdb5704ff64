package db.toy.pager;

import db.toy.codec.MetadataCodec;
import db.toy.codec.PageCodec;

/**
 * Immutable pager configuration supplied by the caller.
 *
 * @param filePath    database file the backend is opened on
 * @param pageSize    bytes per page slot, header included; fixed for the life of the file
 * @param baseOffset  bytes before page 0 (normally the metadata block)
 * @param pagesNumber initial page count used to seed {@link PagerState#initial(PagerConf)}
 */
public record PagerConf(String filePath, int pageSize, long baseOffset, long pagesNumber) {

    public static final int DEFAULT_PAGE_SIZE = 4096;

    public PagerConf {
        if (filePath == null) filePath = "";
        if (pageSize <= PageCodec.PAGE_OVERHEAD || pageSize > 0xFFFF) {
            throw new IllegalArgumentException("pageSize must be in (" + PageCodec.PAGE_OVERHEAD + ", 65535]: " + pageSize);
        }
        if (baseOffset < 0) throw new IllegalArgumentException("baseOffset must be >= 0: " + baseOffset);
        if (pagesNumber < 0 || pagesNumber > PageId.MAX_VALUE) {
            throw new IllegalArgumentException("pagesNumber out of range: " + pagesNumber);
        }
    }

    /** 4 KiB pages placed right after the metadata block, no pages yet. */
    public static PagerConf defaults(String filePath) {
        return new PagerConf(filePath, DEFAULT_PAGE_SIZE, MetadataCodec.SIZE, 0);
    }

    public int payloadSize() { return pageSize - PageCodec.PAGE_OVERHEAD; }
}
