package db.toy.pager;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import db.toy.codec.Metadata;
import db.toy.codec.MetadataCodec;
import db.toy.codec.PageCodec;
import db.toy.storage.ShortReadException;
import db.toy.storage.StorageBackend;

/**
 * Maps page ids onto fixed-size windows of a {@link StorageBackend} and
 * validates every page it reads against the id it was asked for.
 *
 * The pager keeps no state of its own beyond configuration: every operation
 * that depends on allocation takes the current {@link PagerState} and, if it
 * changes it, returns the successor. Use {@link PagerSession} to thread state
 * through a sequence of operations.
 */
public final class Pager {
    private static final Logger LOG = LoggerFactory.getLogger(Pager.class);

    private static final long METADATA_OFFSET = 0;

    private final PagerConf conf;
    private final StorageBackend backend;
    private final PageCodec codec;
    private final FreeListAllocator freeList;

    public Pager(PagerConf conf, StorageBackend backend) {
        this.conf = Objects.requireNonNull(conf, "conf");
        this.backend = Objects.requireNonNull(backend, "backend");
        this.codec = new PageCodec(conf.pageSize());
        this.freeList = new FreeListAllocator(new PageIo() {
            @Override
            public Page read(PageId id) throws PagerException { return readPage(id); }

            @Override
            public void write(Page page, PagerState state) throws PagerException { writePage(page, state); }

            @Override
            public int payloadSize() { return codec.payloadSize(); }
        });
    }

    public PagerConf conf() { return conf; }

    public int payloadSize() { return codec.payloadSize(); }

    /** Absolute byte offset of a page slot. Never called with NoPageId. */
    long offsetOf(PageId pageId) {
        return conf.baseOffset() + pageId.toUnsignedLong() * conf.pageSize();
    }

    public Page readPage(PageId pageId) throws PagerException {
        if (pageId.isNone()) throw PagerFault.noPageId("readPage");
        byte[] raw = readWindow(pageId, offsetOf(pageId), conf.pageSize());
        Page page = PageCodec.decode(raw);
        if (!page.id().equals(pageId)) {
            LOG.warn("Slot for {} holds {}; free-list or file is corrupted", pageId, page.id());
            throw new PagerException(PagerException.Kind.PAGE_ID_MISMATCH, pageId,
                    "expected " + pageId + " but slot holds " + page.id());
        }
        LOG.debug("Read {}", page);
        return page;
    }

    /**
     * Write a page into its slot. Only allocated slots may be written; allocation
     * is the one way to grow the page space.
     */
    public void writePage(Page page, PagerState state) throws PagerException {
        if (page.id().isNone()) throw PagerFault.noPageId("writePage");
        if (!state.isAllocated(page.id())) {
            throw new PagerException(PagerException.Kind.OVERFLOW_WRITE, page.id(),
                    page.id() + " is beyond the " + state.pagesNumber() + " allocated pages");
        }
        byte[] encoded = codec.encode(page);
        try {
            backend.writeRange(offsetOf(page.id()), encoded);
        } catch (IOException e) {
            throw new PagerException(PagerException.Kind.IO_ERROR, page.id(), "failed writing " + page.id(), e);
        }
        LOG.debug("Wrote {}", page);
    }

    public Allocation allocatePage(PagerState state) throws PagerException {
        return freeList.allocate(state);
    }

    /**
     * Put a page on the free-list, clearing its payload. Only freeing the current
     * free-list head twice is detected; freeing any other page that is already
     * free links the list into a loop, so callers must free each page once.
     */
    public PagerState freePage(PageId pageId, PagerState state) throws PagerException {
        return freeList.release(pageId, state);
    }

    /** Allocate a slot and write a terminal page holding {@code payload} into it. */
    public Allocation createPage(PagerState state, byte[] payload) throws PagerException {
        Allocation allocation = allocatePage(state);
        writePage(new Page(allocation.pageId(), PageId.NONE, payload), allocation.state());
        return allocation;
    }

    /**
     * Point {@code from}'s nextId at {@code to}. Linking to NoPageId ends the chain.
     * The payload of {@code from} is left as is.
     */
    public Page linkPage(PageId from, PageId to, PagerState state) throws PagerException {
        if (from.isNone()) throw new PagerFault("cannot chain from NoPageId to " + to);
        Page linked = readPage(from).withNextId(to);
        writePage(linked, state);
        return linked;
    }

    /** Pages of the chain starting at {@code head}, in link order. */
    public List<Page> readChain(PageId head, PagerState state) throws PagerException {
        List<Page> out = new ArrayList<>();
        PageId current = head;
        while (current.exists()) {
            if (out.size() >= state.pagesNumber()) {
                throw new PagerException(PagerException.Kind.CORRUPTED_CHAIN, head,
                        "chain from " + head + " is longer than the page space; it loops");
            }
            Page page = readPage(current);
            out.add(page);
            current = page.nextId();
        }
        return out;
    }

    /** Metadata block at the head of the file; its page size must match the configuration. */
    public Metadata readMetadata() throws PagerException {
        checkMetadataWindow();
        byte[] raw = readWindow(PageId.NONE, METADATA_OFFSET, MetadataCodec.SIZE);
        Metadata metadata = MetadataCodec.decode(raw);
        checkPageSize(metadata);
        return metadata;
    }

    public void writeMetadata(Metadata metadata) throws PagerException {
        checkMetadataWindow();
        checkPageSize(metadata);
        try {
            backend.writeRange(METADATA_OFFSET, MetadataCodec.encode(metadata));
        } catch (IOException e) {
            throw new PagerException(PagerException.Kind.IO_ERROR, PageId.NONE, "failed writing metadata block", e);
        }
    }

    // pages must start after the metadata block, or it would overwrite page 0
    private void checkMetadataWindow() {
        if (conf.baseOffset() < METADATA_OFFSET + MetadataCodec.SIZE) {
            throw new PagerFault("baseOffset " + conf.baseOffset() + " leaves no room for the "
                    + MetadataCodec.SIZE + "-byte metadata block");
        }
    }

    private void checkPageSize(Metadata metadata) throws PagerException {
        if (metadata.pageSize() != conf.pageSize()) {
            throw new PagerException(PagerException.Kind.SIZE_MISMATCH, PageId.NONE,
                    "metadata page size " + metadata.pageSize() + " differs from configured " + conf.pageSize());
        }
    }

    private byte[] readWindow(PageId pageId, long offset, int length) throws PagerException {
        try {
            return backend.readRange(offset, length);
        } catch (ShortReadException e) {
            String what = pageId.isNone() ? "metadata block" : pageId.toString();
            throw new PagerException(PagerException.Kind.PAGE_NOT_FOUND, pageId,
                    what + " not found: store ends before offset " + (offset + length), e);
        } catch (IOException e) {
            throw new PagerException(PagerException.Kind.IO_ERROR, pageId, "failed reading at offset " + offset, e);
        }
    }
}
