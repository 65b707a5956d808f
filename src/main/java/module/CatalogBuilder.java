package module;

import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import catalog.CatalogException;
import catalog.CatalogStore;
import catalog.Service;
import catalog.ServiceEntry;
import catalog.Transaction;
import device.ArtifactResolver;
import extract.ExtractionResult;
import extract.TransactionExtractor;
import init.Config;
import utils.Log;

/**
 * Rebuilds a catalog from a service enumeration: reset, insert services, extract and insert
 * each service's transactions, commit.
 */
public class CatalogBuilder {
    private final CatalogStore store;
    private final TransactionExtractor extractor;

    public CatalogBuilder(CatalogStore store, ArtifactResolver resolver, Config config) {
        this.store = store;
        this.extractor = new TransactionExtractor(resolver, config);
    }

    /**
     * @return true when the catalog was fully written; false after a storage error, in which case
     * nothing of this build is committed
     */
    public boolean build(List<ServiceEntry> services) {
        long startTime = System.currentTimeMillis();
        try {
            store.resetSchema();
            store.insertServices(services);

            List<Service> inserted;
            try (Stream<Service> rows = store.listServices(false)) {
                inserted = rows.collect(Collectors.toList());
            }

            int extracted = 0;
            int transactionCount = 0;
            for (Service service : inserted) {
                if (!service.hasProject()) {
                    Log.debug(service.getName() + ": no interface, kept without transactions");
                    continue;
                }
                ExtractionResult result = extractor.extract(service.getName(), service.getProject());
                if (!result.isAvailable()) {
                    continue;
                }
                List<Transaction> bound = result.getTransactions().stream()
                        .map(t -> t.withServiceId(service.getId()))
                        .collect(Collectors.toList());
                store.insertTransactions(bound);
                extracted++;
                transactionCount += bound.size();
            }
            store.commit();

            Log.info("[+] Catalog " + store.getDatabase().getPath() + ": " + inserted.size() + " services, "
                    + extracted + " extracted, " + transactionCount + " transactions in "
                    + (System.currentTimeMillis() - startTime) + "ms");
            return true;
        } catch (CatalogException e) {
            Log.errorStack("[-] Catalog build failed on " + store.getDatabase().getPath(), e);
            store.getDatabase().rollback();
            return false;
        }
    }
}
