package db.toy.pager;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable view of one fixed-size page slot: its own id, the link to the
 * next page of whatever chain it belongs to, and the payload bytes.
 */
public final class Page {
    private final PageId id;
    private final PageId nextId;
    private final byte[] payload; // pageSize - PAGE_OVERHEAD bytes once written

    public Page(PageId id, PageId nextId, byte[] payload) {
        this.id = Objects.requireNonNull(id, "id");
        this.nextId = Objects.requireNonNull(nextId, "nextId");
        this.payload = Objects.requireNonNull(payload, "payload").clone();
    }

    /** A terminal page with a zeroed payload. */
    public static Page empty(PageId id, int payloadSize) {
        return new Page(id, PageId.NONE, new byte[payloadSize]);
    }

    public PageId id() { return id; }
    public PageId nextId() { return nextId; }
    public byte[] payload() { return payload.clone(); }
    public int payloadLength() { return payload.length; }

    public Page withNextId(PageId newNextId) {
        return new Page(id, newNextId, payload);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Page other)) return false;
        return id.equals(other.id) && nextId.equals(other.nextId) && Arrays.equals(payload, other.payload);
    }

    @Override
    public int hashCode() {
        return (id.hashCode() * 31 + nextId.hashCode()) * 31 + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Page{id=" + id + ", next=" + nextId + ", payload=" + payload.length + " bytes}";
    }
}
