package db.toy.codec;

import db.toy.pager.PageId;
import db.toy.pager.PagerState;

// Immutable contents of the 128-byte metadata block at the head of a database file.
public record Metadata(int fileSpecVersion,
                       int pageSize,
                       long pagesNumber,
                       PageId firstEmptyPageId,
                       PageId tablesMetaPageId,
                       PageId indexesMetaPageId) {

    /** Metadata for a database with no pages and no catalog pages yet. */
    public static Metadata fresh(int pageSize) {
        return new Metadata(MetadataCodec.FILE_SPEC_VERSION, pageSize, 0, PageId.NONE, PageId.NONE, PageId.NONE);
    }

    public PagerState pagerState() {
        return new PagerState(pagesNumber, firstEmptyPageId);
    }

    public Metadata withState(PagerState state) {
        return new Metadata(fileSpecVersion, pageSize, state.pagesNumber(), state.firstEmptyPageId(),
                tablesMetaPageId, indexesMetaPageId);
    }

    public Metadata withCatalogPages(PageId tables, PageId indexes) {
        return new Metadata(fileSpecVersion, pageSize, pagesNumber, firstEmptyPageId, tables, indexes);
    }
}
