package main;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import device.ArtifactResolver;
import device.CorpusArtifactResolver;
import device.SecurityContextLookup;
import device.ServiceContextsFile;
import device.ServiceListFile;
import init.Config;
import init.ConfigurationException;
import report.DiffOptions;
import utils.Log;

/**
 * {@code build | diff <service> | diff-all | dump <service> | list} with {@code -c} (contexts),
 * {@code -b} (brief) and {@code --baseline <catalog>}. Settings come from {@code catalog.properties}
 * and {@code -D} system properties.
 */
public class Main {

    public static int run(String[] args) {
        Config config = Config.load(System.getProperties());
        Log.initLogLevel(config);

        DiffOptions options = DiffOptions.defaults();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "-c":
                    options.showContext(true);
                    break;
                case "-b":
                    options.brief(true);
                    break;
                case "--baseline":
                    if (i + 1 >= args.length) {
                        Log.error("[-] --baseline needs a catalog path");
                        return BinderCatalog.CODE_CONFIG_ERROR;
                    }
                    options.baselinePath(Paths.get(args[++i]));
                    break;
                default:
                    positional.add(args[i]);
            }
        }
        if (positional.isEmpty()) {
            Log.error("[-] No operation given");
            return BinderCatalog.CODE_CONFIG_ERROR;
        }

        SecurityContextLookup contexts;
        try {
            contexts = options.isShowContext() && config.getServiceContextsPath() != null
                    ? ServiceContextsFile.load(config.getServiceContextsPath())
                    : SecurityContextLookup.NONE;
        } catch (ConfigurationException e) {
            Log.error("[-] " + e.getMessage());
            return BinderCatalog.CODE_CONFIG_ERROR;
        }
        ArtifactResolver resolver = config.getCorpusPath() != null
                ? new CorpusArtifactResolver(config.getCorpusPath(), config.getArtifactExtension())
                : fqn -> Collections.emptyList();
        BinderCatalog catalog = new BinderCatalog(config, new ServiceListFile(config.getServiceListPath()),
                resolver, contexts, System.out);

        String operation = positional.get(0);
        String service = positional.size() > 1 ? positional.get(1) : null;
        switch (operation) {
            case "build":
                if (config.getCorpusPath() == null) {
                    Log.warn("[-] corpus.path not set, services will have no transactions");
                }
                return catalog.build();
            case "diff":
                return service == null ? catalog.diffAll(options) : catalog.diffOne(service, options);
            case "diff-all":
                return catalog.diffAll(options);
            case "dump":
                if (service == null) {
                    Log.error("[-] dump needs a service name");
                    return BinderCatalog.CODE_CONFIG_ERROR;
                }
                return catalog.dump(service);
            case "list":
                return catalog.list(options);
            default:
                Log.error("[-] Unknown operation: " + operation);
                return BinderCatalog.CODE_CONFIG_ERROR;
        }
    }

    public static void main(String[] args) {
        System.exit(run(args));
    }
}
