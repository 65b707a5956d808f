package module;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import catalog.CatalogException;
import catalog.CatalogStore;
import catalog.Service;
import catalog.ServiceNotFoundException;
import catalog.Transaction;
import utils.Log;

/**
 * Compares a project catalog against a baseline catalog, read-only on both.
 * <p>
 * The walk is driven by the project's transactions: names only the baseline has are not reported.
 * Transactions are matched by method name; when a name repeats, only its first baseline
 * occurrence is compared.
 */
public class DiffEngine {
    private final CatalogStore project;
    private final CatalogStore baseline;

    public DiffEngine(CatalogStore project, CatalogStore baseline) {
        this.project = project;
        this.baseline = baseline;
    }

    /**
     * @throws ServiceNotFoundException when the project catalog does not track {@code serviceName}
     */
    public ServiceDiff diff(String serviceName) {
        Service current = project.findServiceByName(serviceName);
        if (current == null) {
            throw new ServiceNotFoundException(serviceName, project.getDatabase().getPath().toString());
        }
        List<Transaction> currentTransactions = transactionsOf(project, current);

        Service previous = baseline.findServiceByName(serviceName);
        if (previous == null) {
            List<TransactionChange> changes = new ArrayList<>();
            for (Transaction t : currentTransactions) {
                changes.add(TransactionChange.added(t));
            }
            return new ServiceDiff(current, true, changes);
        }

        // first occurrence wins
        Map<String, Transaction> previousByName = new LinkedHashMap<>();
        for (Transaction t : transactionsOf(baseline, previous)) {
            previousByName.putIfAbsent(t.getMethodName(), t);
        }

        List<TransactionChange> changes = new ArrayList<>();
        for (Transaction t : currentTransactions) {
            Transaction old = previousByName.get(t.getMethodName());
            if (old == null) {
                changes.add(TransactionChange.added(t));
            } else if (!t.sameSignature(old)) {
                changes.add(TransactionChange.modified(t, old));
            }
        }
        return new ServiceDiff(current, false, changes);
    }

    /**
     * Diffs every project service in name order. A failing service is logged and recorded; the batch goes on.
     */
    public DiffSummary diffAll() {
        List<String> names;
        try (Stream<Service> services = project.listServices(true)) {
            names = services.map(Service::getName).collect(Collectors.toList());
        }
        DiffSummary summary = new DiffSummary();
        for (String name : names) {
            try {
                summary.add(diff(name));
            } catch (CatalogException e) {
                Log.error("[-] Diff failed for " + name + ": " + e.getMessage());
                summary.fail(name);
            }
        }
        return summary;
    }

    private static List<Transaction> transactionsOf(CatalogStore store, Service service) {
        try (Stream<Transaction> rows = store.listTransactionsForService(service.getId(), true)) {
            return rows.collect(Collectors.toList());
        }
    }
}
