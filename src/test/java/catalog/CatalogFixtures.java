package catalog;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import utils.Database;

/**
 * Helpers shared by the catalog, diff and front-end tests.
 */
public final class CatalogFixtures {

    private CatalogFixtures() {
    }

    public static Path resource(String name) {
        try {
            return Paths.get(CatalogFixtures.class.getResource(name).toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Path corpus() {
        return resource("/corpus");
    }

    /**
     * Writes one catalog: {@code services} in order, each followed by its transactions.
     */
    public static void writeCatalog(Path path, Object[][] services) {
        try (Database db = Database.open(path)) {
            CatalogStore store = new CatalogStore(db);
            store.resetSchema();
            List<ServiceEntry> entries = Arrays.stream(services)
                    .map(s -> new ServiceEntry((String) s[0], (String) s[1]))
                    .collect(Collectors.toList());
            store.insertServices(entries);
            for (Object[] s : services) {
                Service service = store.findServiceByName((String) s[0]);
                for (int i = 2; i < s.length; i++) {
                    Transaction t = (Transaction) s[i];
                    store.insertTransactions(List.of(t.withServiceId(service.getId())));
                }
            }
            store.commit();
        }
    }

    public static List<Service> services(CatalogStore store) {
        try (Stream<Service> rows = store.listServices(true)) {
            return rows.collect(Collectors.toList());
        }
    }

    public static List<Transaction> transactions(CatalogStore store, String serviceName) {
        Service service = store.findServiceByName(serviceName);
        try (Stream<Transaction> rows = store.listTransactionsForService(service.getId(), true)) {
            return rows.collect(Collectors.toList());
        }
    }
}
