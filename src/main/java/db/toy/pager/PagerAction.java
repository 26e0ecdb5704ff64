package db.toy.pager;

/**
 * A unit of work run inside a {@link PagerSession}.
 */
@FunctionalInterface
public interface PagerAction<T> {
    T run(PagerTransaction tx) throws PagerException;
}
