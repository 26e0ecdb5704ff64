package db.toy.pager;

// What a session run produced, alongside the state it left behind.
public record SessionResult<T>(T result, PagerState state) {}
