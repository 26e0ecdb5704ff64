package db.toy.pager;

import java.util.List;

/**
 * Pager operations bound to one {@link PagerSession#run} call. Each call reads
 * the state left by the previous one and stores the state it produces, so an
 * action never passes {@link PagerState} around by hand.
 */
public final class PagerTransaction {
    private final Pager pager;
    private PagerState state;
    private boolean finished;

    PagerTransaction(Pager pager, PagerState state) {
        this.pager = pager;
        this.state = state;
    }

    public PagerState state() {
        checkOpen();
        return state;
    }

    public PagerConf conf() { return pager.conf(); }

    public int payloadSize() { return pager.payloadSize(); }

    public Page readPage(PageId pageId) throws PagerException {
        checkOpen();
        return pager.readPage(pageId);
    }

    public void writePage(Page page) throws PagerException {
        checkOpen();
        pager.writePage(page, state);
    }

    public PageId allocatePage() throws PagerException {
        checkOpen();
        Allocation allocation = pager.allocatePage(state);
        state = allocation.state();
        return allocation.pageId();
    }

    public void freePage(PageId pageId) throws PagerException {
        checkOpen();
        state = pager.freePage(pageId, state);
    }

    public PageId createPage(byte[] payload) throws PagerException {
        checkOpen();
        Allocation allocation = pager.createPage(state, payload);
        state = allocation.state();
        return allocation.pageId();
    }

    public Page linkPage(PageId from, PageId to) throws PagerException {
        checkOpen();
        return pager.linkPage(from, to, state);
    }

    public List<Page> readChain(PageId head) throws PagerException {
        checkOpen();
        return pager.readChain(head, state);
    }

    PagerState finish() {
        finished = true;
        return state;
    }

    private void checkOpen() {
        if (finished) throw new PagerFault("transaction used after its session run ended");
    }
}
