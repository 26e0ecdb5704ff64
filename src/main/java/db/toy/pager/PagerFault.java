package db.toy.pager;

/**
 * Raised when a caller breaks a pager precondition (reading or freeing
 * NoPageId, chaining from NoPageId, using a finished transaction).
 * Unlike {@link PagerException} this is a bug in the caller, not a storage problem.
 */
public class PagerFault extends IllegalArgumentException {

    public PagerFault(String message) {
        super(message);
    }

    static PagerFault noPageId(String operation) {
        return new PagerFault(operation + " called with NoPageId");
    }
}
