package main;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import catalog.CatalogException;
import catalog.CatalogStore;
import catalog.Service;
import catalog.ServiceNotFoundException;
import catalog.Transaction;
import device.ArtifactResolver;
import device.SecurityContextLookup;
import device.ServiceEnumerator;
import init.Config;
import init.ConfigurationException;
import module.CatalogBuilder;
import module.DiffEngine;
import module.DiffSummary;
import module.ServiceDiff;
import report.CatalogPrinter;
import report.DiffOptions;
import report.ResultExporter;
import utils.Database;
import utils.Log;

/**
 * Operations behind the command line. Each opens the catalogs it needs, releases them on every
 * exit path and returns a status code.
 */
public class BinderCatalog {
    public static final int CODE_SUCCESS = 0;
    public static final int CODE_CONFIG_ERROR = 1;
    public static final int CODE_NOT_FOUND = 2;
    public static final int CODE_STORAGE_ERROR = 3;
    public static final int CODE_PARTIAL_FAILURE = 4;

    private final Config config;
    private final ServiceEnumerator enumerator;
    private final ArtifactResolver resolver;
    private final SecurityContextLookup contexts;
    private final PrintStream out;

    public BinderCatalog(Config config, ServiceEnumerator enumerator, ArtifactResolver resolver,
                         SecurityContextLookup contexts, PrintStream out) {
        this.config = config;
        this.enumerator = enumerator;
        this.resolver = resolver;
        this.contexts = contexts;
        this.out = out;
    }

    public int build() {
        Path catalogPath = config.getProjectCatalogPath();
        try (Database db = Database.open(catalogPath)) {
            CatalogBuilder builder = new CatalogBuilder(new CatalogStore(db), resolver, config);
            return builder.build(enumerator.enumerate()) ? CODE_SUCCESS : CODE_STORAGE_ERROR;
        } catch (ConfigurationException e) {
            Log.error("[-] " + e.getMessage());
            return CODE_CONFIG_ERROR;
        } catch (CatalogException e) {
            Log.errorStack("[-] Build failed", e);
            return CODE_STORAGE_ERROR;
        }
    }

    public int diffOne(String serviceName, DiffOptions options) {
        try (Database projectDb = Database.openReadOnly(config.getProjectCatalogPath());
             Database baselineDb = Database.openReadOnly(config.getBaselineCatalogPath(options.getBaselinePath()))) {
            DiffEngine engine = new DiffEngine(new CatalogStore(projectDb), new CatalogStore(baselineDb));
            printer().printDiff(engine.diff(serviceName), options);
            return CODE_SUCCESS;
        } catch (ConfigurationException e) {
            Log.error("[-] " + e.getMessage());
            return CODE_CONFIG_ERROR;
        } catch (ServiceNotFoundException e) {
            Log.error("[-] " + e.getMessage());
            return CODE_NOT_FOUND;
        } catch (CatalogException e) {
            Log.errorStack("[-] Diff failed for " + serviceName, e);
            return CODE_STORAGE_ERROR;
        }
    }

    public int diffAll(DiffOptions options) {
        try (Database projectDb = Database.openReadOnly(config.getProjectCatalogPath());
             Database baselineDb = Database.openReadOnly(config.getBaselineCatalogPath(options.getBaselinePath()))) {
            DiffEngine engine = new DiffEngine(new CatalogStore(projectDb), new CatalogStore(baselineDb));
            DiffSummary summary = engine.diffAll();
            CatalogPrinter printer = printer();
            for (ServiceDiff diff : summary.getDiffs()) {
                printer.printDiff(diff, options);
            }
            if (summary.failed()) {
                Log.error("[-] " + summary.getFailures().size() + " service(s) failed: " + summary.getFailures());
                return CODE_PARTIAL_FAILURE;
            }
            return CODE_SUCCESS;
        } catch (ConfigurationException e) {
            Log.error("[-] " + e.getMessage());
            return CODE_CONFIG_ERROR;
        } catch (CatalogException e) {
            Log.errorStack("[-] Diff failed", e);
            return CODE_STORAGE_ERROR;
        }
    }

    public int dump(String serviceName) {
        try (Database db = Database.openReadOnly(config.getProjectCatalogPath())) {
            CatalogStore store = new CatalogStore(db);
            Service service = store.findServiceByName(serviceName);
            if (service == null) {
                Log.error("[-] Service " + serviceName + " not found in " + db.getPath());
                return CODE_NOT_FOUND;
            }
            List<Transaction> transactions;
            try (Stream<Transaction> rows = store.listTransactionsForService(service.getId(), true)) {
                transactions = rows.collect(Collectors.toList());
            }
            printer().printDump(service, transactions);
            if (config.getExportPath() != null) {
                ResultExporter.export(config.getExportPath(), service, transactions);
            }
            return CODE_SUCCESS;
        } catch (ConfigurationException e) {
            Log.error("[-] " + e.getMessage());
            return CODE_CONFIG_ERROR;
        } catch (IOException e) {
            Log.errorStack("[-] Export failed: " + config.getExportPath(), e);
            return CODE_STORAGE_ERROR;
        } catch (CatalogException e) {
            Log.errorStack("[-] Dump failed for " + serviceName, e);
            return CODE_STORAGE_ERROR;
        }
    }

    /**
     * Lists the project catalog. Services missing from the baseline are tagged new when a baseline
     * catalog exists; an explicitly requested baseline must exist.
     */
    public int list(DiffOptions options) {
        try (Database db = Database.openReadOnly(config.getProjectCatalogPath())) {
            List<Service> services;
            try (Stream<Service> rows = new CatalogStore(db).listServices(true)) {
                services = rows.collect(Collectors.toList());
            }
            printer().printList(services, options, baselineNames(options));
            return CODE_SUCCESS;
        } catch (ConfigurationException e) {
            Log.error("[-] " + e.getMessage());
            return CODE_CONFIG_ERROR;
        } catch (CatalogException e) {
            Log.errorStack("[-] List failed", e);
            return CODE_STORAGE_ERROR;
        }
    }

    private Set<String> baselineNames(DiffOptions options) {
        Path baselinePath = config.getBaselineCatalogPath(options.getBaselinePath());
        if (options.getBaselinePath() == null && !Files.isRegularFile(baselinePath)) {
            Log.debug("No baseline at " + baselinePath + ", novelty not marked");
            return null;
        }
        try (Database baselineDb = Database.openReadOnly(baselinePath);
             Stream<Service> rows = new CatalogStore(baselineDb).listServices(false)) {
            return rows.map(Service::getName).collect(Collectors.toCollection(HashSet::new));
        }
    }

    private CatalogPrinter printer() {
        return new CatalogPrinter(out, contexts, config.getUnknownContextMarker());
    }
}
