package extract;

/**
 * A {@code TRANSACTION_<name>} constant declared by a Stub class.
 */
public class TransactionField {
    private final String binderInterface;
    private final int binderNumber;
    private final int line;

    public TransactionField(String binderInterface, int binderNumber, int line) {
        this.binderInterface = binderInterface;
        this.binderNumber = binderNumber;
        this.line = line;
    }

    /**
     * Method name the constant stands for, the part after {@code TRANSACTION_}.
     */
    public String getBinderInterface() {
        return binderInterface;
    }

    public int getBinderNumber() {
        return binderNumber;
    }

    public int getLine() {
        return line;
    }

    @Override
    public String toString() {
        return "TRANSACTION_" + binderInterface + " = 0x" + Integer.toHexString(binderNumber) + " (line " + line + ")";
    }
}
