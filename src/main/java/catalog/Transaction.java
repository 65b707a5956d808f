package catalog;

import java.util.Objects;

/**
 * One numbered binder transaction of a service interface.
 * {@code arguments} and {@code returns} are kept exactly as extracted, two catalogs only compare equal
 * when the raw strings match.
 */
public class Transaction {
    private final long id;
    private final int number;
    private final String methodName;
    private final String arguments;
    private final String returns;
    private final long serviceId;

    public Transaction(long id, int number, String methodName, String arguments, String returns, long serviceId) {
        this.id = id;
        this.number = number;
        this.methodName = methodName;
        this.arguments = arguments;
        this.returns = returns;
        this.serviceId = serviceId;
    }

    /**
     * A transaction not yet persisted and not yet bound to a service.
     */
    public Transaction(int number, String methodName, String arguments, String returns) {
        this(0, number, methodName, arguments, returns, 0);
    }

    public Transaction withServiceId(long serviceId) {
        return new Transaction(id, number, methodName, arguments, returns, serviceId);
    }

    public long getId() {
        return id;
    }

    public int getNumber() {
        return number;
    }

    public String getMethodName() {
        return methodName;
    }

    public String getArguments() {
        return arguments;
    }

    public String getReturns() {
        return returns;
    }

    public long getServiceId() {
        return serviceId;
    }

    public boolean sameSignature(Transaction other) {
        return Objects.equals(arguments, other.arguments) && Objects.equals(returns, other.returns);
    }

    /**
     * Equality over the extracted tuple (number, name, arguments, returns), ignoring surrogate keys.
     */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Transaction)) return false;
        Transaction other = (Transaction) o;
        return number == other.number
                && Objects.equals(methodName, other.methodName)
                && sameSignature(other);
    }

    @Override
    public int hashCode() {
        return Objects.hash(number, methodName, arguments, returns);
    }

    @Override
    public String toString() {
        return number + " " + methodName + "(" + arguments + ")" + returns;
    }
}
