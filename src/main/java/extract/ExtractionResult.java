package extract;

import java.util.Collections;
import java.util.List;

import catalog.Transaction;

/**
 * Outcome of extracting one service. Anything but {@link Status#EXTRACTED} means no source was
 * available; that is not an error and the transaction list is empty.
 */
public class ExtractionResult {

    public enum Status {
        EXTRACTED,
        NO_ARTIFACT,
        NO_STUB,
        NO_PROXY
    }

    private final Status status;
    private final List<Transaction> transactions;
    private final List<String> skipped;

    private ExtractionResult(Status status, List<Transaction> transactions, List<String> skipped) {
        this.status = status;
        this.transactions = Collections.unmodifiableList(transactions);
        this.skipped = Collections.unmodifiableList(skipped);
    }

    public static ExtractionResult extracted(List<Transaction> transactions, List<String> skipped) {
        return new ExtractionResult(Status.EXTRACTED, transactions, skipped);
    }

    public static ExtractionResult unavailable(Status status) {
        return new ExtractionResult(status, Collections.emptyList(), Collections.emptyList());
    }

    public boolean isAvailable() {
        return status == Status.EXTRACTED;
    }

    public Status getStatus() {
        return status;
    }

    public List<Transaction> getTransactions() {
        return transactions;
    }

    /**
     * Identifiers declared by the Stub whose proxy method could not be parsed.
     */
    public List<String> getSkipped() {
        return skipped;
    }
}
