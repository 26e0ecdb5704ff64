package db.toy.pager;

/**
 * Page identifier: a 32-bit unsigned slot index stored in an int.
 * The all-ones value is reserved for "no page" ({@link #NONE}).
 */
public record PageId(int value) {

    /** Sentinel for "no page" (0xFFFFFFFF on disk). */
    public static final PageId NONE = new PageId(0xFFFFFFFF);

    /** Largest value usable as a real slot index. */
    public static final long MAX_VALUE = 0xFFFFFFFEL;

    public static PageId of(long value) {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("Page id out of range: " + value);
        }
        return new PageId((int) value);
    }

    public boolean isNone() { return value == NONE.value; }

    public boolean exists() { return !isNone(); }

    public long toUnsignedLong() { return Integer.toUnsignedLong(value); }

    @Override
    public String toString() {
        return isNone() ? "NoPageId" : "PageId " + Integer.toUnsignedString(value);
    }
}
