package db.toy.pager;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import db.toy.codec.PageCodec;
import db.toy.storage.InMemoryStorageBackend;

public class PagerAllocationTest {
    private static final int PAGE_SIZE = PageCodec.PAGE_OVERHEAD + 4;

    private Pager pager;
    private PagerState state;

    @BeforeEach
    void setUp() {
        PagerConf conf = new PagerConf("", PAGE_SIZE, 0, 0);
        pager = new Pager(conf, new InMemoryStorageBackend());
        state = PagerState.initial(conf);
    }

    @Test
    void allocationWithoutFreePagesTakesNextSlot() throws Exception {
        Allocation first = pager.allocatePage(state);
        assertEquals(PageId.of(0), first.pageId());
        assertEquals(1, first.state().pagesNumber());
        Allocation second = pager.allocatePage(first.state());
        assertEquals(PageId.of(1), second.pageId());
        assertEquals(2, second.state().pagesNumber());
        assertEquals(PageId.NONE, second.state().firstEmptyPageId());
    }

    @Test
    void allocationAfterFreeReusesFreedPage() throws Exception {
        state = create(new byte[] {'a', 'a', 'a', 'a'});
        state = create(new byte[] {'b', 'b', 'b', 'b'});
        PageId before = state.firstEmptyPageId();

        state = pager.freePage(PageId.of(1), state);
        assertEquals(PageId.of(1), state.firstEmptyPageId());

        Allocation reused = pager.allocatePage(state);
        assertEquals(PageId.of(1), reused.pageId());
        assertEquals(before, reused.state().firstEmptyPageId());
        assertEquals(2, reused.state().pagesNumber(), "reuse must not grow the page space");
    }

    @Test
    void freedPagesComeBackLastInFirstOut() throws Exception {
        for (int i = 0; i < 3; i++) state = pager.allocatePage(state).state();
        state = pager.freePage(PageId.of(0), state);
        state = pager.freePage(PageId.of(2), state);

        Allocation a = pager.allocatePage(state);
        Allocation b = pager.allocatePage(a.state());
        Allocation c = pager.allocatePage(b.state());

        assertEquals(PageId.of(2), a.pageId());
        assertEquals(PageId.of(0), b.pageId());
        assertEquals(PageId.of(3), c.pageId());
        assertEquals(4, c.state().pagesNumber());
    }

    @Test
    void freeClearsPayloadAndLinksToOldHead() throws Exception {
        state = create(new byte[] {1, 2, 3, 4});
        state = create(new byte[] {5, 6, 7, 8});
        state = pager.freePage(PageId.of(0), state);
        state = pager.freePage(PageId.of(1), state);

        Page freed = pager.readPage(PageId.of(1));
        assertEquals(PageId.of(0), freed.nextId());
        assertArrayEquals(new byte[4], freed.payload());
        assertEquals(PageId.NONE, pager.readPage(PageId.of(0)).nextId());
    }

    @Test
    void freeingAnAlreadyFreePageLoopsTheFreeList() throws Exception {
        state = create(new byte[4]);
        state = create(new byte[4]);
        state = pager.freePage(PageId.of(0), state);
        state = pager.freePage(PageId.of(1), state);
        state = pager.freePage(PageId.of(0), state);

        PagerException ex = assertThrows(PagerException.class,
            () -> pager.readChain(state.firstEmptyPageId(), state));
        assertEquals(PagerException.Kind.CORRUPTED_CHAIN, ex.kind());
    }

    @Test
    void freeingNoPageIdIsAFault() {
        assertThrows(PagerFault.class, () -> pager.freePage(PageId.NONE, state));
    }

    @Test
    void chainingFromNoPageIdIsAFault() {
        assertThrows(PagerFault.class, () -> pager.linkPage(PageId.NONE, PageId.NONE, state));
        assertThrows(PagerFault.class, () -> pager.linkPage(PageId.NONE, PageId.of(0), state));
    }

    @Test
    void chainingToNoPageIdKeepsPayload() throws Exception {
        state = create(new byte[] {'r', 'o', 'w', '1'});
        state = create(new byte[] {'r', 'o', 'w', '2'});
        pager.linkPage(PageId.of(0), PageId.of(1), state);

        Page terminated = pager.linkPage(PageId.of(0), PageId.NONE, state);

        assertEquals(PageId.NONE, terminated.nextId());
        assertArrayEquals(new byte[] {'r', 'o', 'w', '1'}, pager.readPage(PageId.of(0)).payload());
        assertEquals(terminated, pager.readPage(PageId.of(0)));
    }

    @Test
    void readChainFollowsLinks() throws Exception {
        for (int i = 0; i < 3; i++) state = create(new byte[] {(byte) i, 0, 0, 0});
        pager.linkPage(PageId.of(2), PageId.of(0), state);
        pager.linkPage(PageId.of(0), PageId.of(1), state);

        List<Page> chain = pager.readChain(PageId.of(2), state);

        assertEquals(List.of(PageId.of(2), PageId.of(0), PageId.of(1)), chain.stream().map(Page::id).toList());
        assertTrue(pager.readChain(PageId.NONE, state).isEmpty());
    }

    @Test
    void loopingChainIsCorruption() throws Exception {
        state = create(new byte[4]);
        state = create(new byte[4]);
        pager.linkPage(PageId.of(0), PageId.of(1), state);
        pager.linkPage(PageId.of(1), PageId.of(0), state);

        PagerException ex = assertThrows(PagerException.class, () -> pager.readChain(PageId.of(0), state));
        assertEquals(PagerException.Kind.CORRUPTED_CHAIN, ex.kind());
    }

    @Test
    void createPageWritesTerminalPage() throws Exception {
        Allocation a = pager.createPage(state, new byte[] {1, 2, 3, 4});
        assertEquals(new Page(a.pageId(), PageId.NONE, new byte[] {1, 2, 3, 4}), pager.readPage(a.pageId()));
    }

    private PagerState create(byte[] payload) throws PagerException {
        return pager.createPage(state, payload).state();
    }
}
