package report;

import java.io.PrintStream;
import java.util.List;
import java.util.Set;

import catalog.Service;
import catalog.Transaction;
import device.SecurityContextLookup;
import module.ServiceDiff;
import module.TransactionChange;

/**
 * Text rendering of diff, list and dump results.
 */
public class CatalogPrinter {
    public static final String NEW_TAG = "[NEW]";
    public static final String MODIFIED_TAG = "[MODIFIED]";

    private final PrintStream out;
    private final SecurityContextLookup contexts;
    private final String unknownContext;

    public CatalogPrinter(PrintStream out, SecurityContextLookup contexts, String unknownContext) {
        this.out = out;
        this.contexts = contexts;
        this.unknownContext = unknownContext;
    }

    /**
     * Prints nothing for an existing service without changes.
     */
    public void printDiff(ServiceDiff diff, DiffOptions options) {
        if (!diff.hasChanges()) {
            return;
        }
        StringBuilder header = new StringBuilder(diff.getServiceName());
        if (diff.isNewService()) {
            header.append(' ').append(NEW_TAG);
        }
        appendContext(header, diff.getServiceName(), options);
        out.println(header);

        for (TransactionChange change : diff.getChanges()) {
            Transaction t = change.getCurrent();
            String tag = change.getKind() == TransactionChange.Kind.NEW ? NEW_TAG : MODIFIED_TAG;
            if (options.isBrief()) {
                out.println("  " + tag + " " + t.getMethodName());
                continue;
            }
            StringBuilder line = new StringBuilder("  ").append(tag).append(' ').append(format(t));
            if (change.getKind() == TransactionChange.Kind.MODIFIED) {
                Transaction old = change.getPrevious();
                line.append(" was (").append(old.getArguments()).append(')').append(old.getReturns());
            }
            out.println(line);
        }
    }

    /**
     * @param baselineNames service names of the baseline catalog, or null when none is available
     */
    public void printList(List<Service> services, DiffOptions options, Set<String> baselineNames) {
        for (Service service : services) {
            StringBuilder line = new StringBuilder(service.getName());
            if (!options.isBrief()) {
                line.append(" [").append(service.hasProject() ? service.getProject() : "-").append(']');
            }
            if (baselineNames != null && !baselineNames.contains(service.getName())) {
                line.append(' ').append(NEW_TAG);
            }
            appendContext(line, service.getName(), options);
            out.println(line);
        }
    }

    public void printDump(Service service, List<Transaction> transactions) {
        out.println(service);
        for (Transaction t : transactions) {
            out.println("  " + format(t));
        }
    }

    /**
     * Label of {@code serviceName}, or the unknown marker when the lookup has none.
     */
    public String contextOf(String serviceName) {
        return contexts.lookup(serviceName)
                .filter(label -> !label.isEmpty())
                .orElse(unknownContext);
    }

    private void appendContext(StringBuilder line, String serviceName, DiffOptions options) {
        if (options.isShowContext()) {
            line.append(" (").append(contextOf(serviceName)).append(')');
        }
    }

    static String format(Transaction t) {
        return t.getNumber() + " " + t.getMethodName() + "(" + t.getArguments() + ")" + t.getReturns();
    }
}
