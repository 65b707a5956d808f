package module;

import catalog.Transaction;

/**
 * One reported difference. {@code previous} is the baseline transaction for {@link Kind#MODIFIED}, null otherwise.
 */
public class TransactionChange {

    public enum Kind {
        NEW,
        MODIFIED
    }

    private final Kind kind;
    private final Transaction current;
    private final Transaction previous;

    private TransactionChange(Kind kind, Transaction current, Transaction previous) {
        this.kind = kind;
        this.current = current;
        this.previous = previous;
    }

    public static TransactionChange added(Transaction current) {
        return new TransactionChange(Kind.NEW, current, null);
    }

    public static TransactionChange modified(Transaction current, Transaction previous) {
        return new TransactionChange(Kind.MODIFIED, current, previous);
    }

    public Kind getKind() {
        return kind;
    }

    public Transaction getCurrent() {
        return current;
    }

    public Transaction getPrevious() {
        return previous;
    }
}
