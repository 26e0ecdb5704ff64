package db.toy.pager;

import java.util.Objects;

/**
 * Pager state threaded through every operation. Operations never mutate a
 * state in place; they return the successor.
 *
 * @param pagesNumber      count of allocated slots (u32), only ever grows
 * @param firstEmptyPageId head of the free-list, {@link PageId#NONE} when empty
 */
public record PagerState(long pagesNumber, PageId firstEmptyPageId) {

    public PagerState {
        Objects.requireNonNull(firstEmptyPageId, "firstEmptyPageId");
        if (pagesNumber < 0 || pagesNumber > 0xFFFFFFFFL) {
            throw new IllegalArgumentException("pagesNumber out of u32 range: " + pagesNumber);
        }
    }

    public static PagerState initial(PagerConf conf) {
        return new PagerState(conf.pagesNumber(), PageId.NONE);
    }

    public boolean hasFreePages() { return firstEmptyPageId.exists(); }

    /** True if {@code id} names a slot that has been handed out at some point. */
    public boolean isAllocated(PageId id) {
        return id.exists() && id.toUnsignedLong() < pagesNumber;
    }

    PagerState withFirstEmpty(PageId head) {
        return new PagerState(pagesNumber, head);
    }

    PagerState grown() {
        return new PagerState(pagesNumber + 1, firstEmptyPageId);
    }
}
