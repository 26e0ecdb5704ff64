package db.toy.pager;

/**
 * Page-level read/write capability handed to the free-list allocator.
 */
interface PageIo {
    Page read(PageId id) throws PagerException;

    void write(Page page, PagerState state) throws PagerException;

    int payloadSize();
}
