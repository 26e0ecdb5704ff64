package db.toy.pager;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Free-list of reclaimed pages, threaded through their nextId fields and
 * rooted at {@link PagerState#firstEmptyPageId()}. Push and pop each touch one page.
 */
final class FreeListAllocator {
    private static final Logger LOG = LoggerFactory.getLogger(FreeListAllocator.class);

    private final PageIo io;

    FreeListAllocator(PageIo io) {
        this.io = io;
    }

    /**
     * Hand out a slot: the free-list head if there is one, otherwise a fresh
     * slot at the end of the page space.
     */
    Allocation allocate(PagerState state) throws PagerException {
        if (state.hasFreePages()) {
            return pop(state);
        }
        long next = state.pagesNumber();
        if (next > PageId.MAX_VALUE) {
            throw new PagerFault("page space exhausted at " + next + " pages");
        }
        PageId id = PageId.of(next);
        LOG.debug("Extending page space with {}", id);
        return new Allocation(id, state.grown());
    }

    /** Prepend {@code id} to the free-list, clearing its payload. */
    PagerState release(PageId id, PagerState state) throws PagerException {
        if (id.isNone()) throw PagerFault.noPageId("freePage");
        if (id.equals(state.firstEmptyPageId())) {
            throw new PagerFault(id + " is already the head of the free-list");
        }
        Page cleared = new Page(id, state.firstEmptyPageId(), new byte[io.payloadSize()]);
        io.write(cleared, state);
        LOG.debug("Freed {}; free-list continues at {}", id, state.firstEmptyPageId());
        return state.withFirstEmpty(id);
    }

    private Allocation pop(PagerState state) throws PagerException {
        PageId head = state.firstEmptyPageId();
        Page page = io.read(head);
        LOG.debug("Reusing free {}; free-list continues at {}", head, page.nextId());
        return new Allocation(head, state.withFirstEmpty(page.nextId()));
    }
}
