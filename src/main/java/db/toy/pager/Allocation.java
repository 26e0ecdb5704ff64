package db.toy.pager;

// Result of an allocation: the slot handed out and the state after handing it out.
public record Allocation(PageId pageId, PagerState state) {}
