package extract;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import catalog.Transaction;
import device.ArtifactResolver;
import init.Config;
import utils.Log;

/**
 * Recovers the transaction table of a service interface from its disassembled
 * {@code I<Name>$Stub} and {@code I<Name>$Stub$Proxy} classes.
 * <p>
 * Numbers and names come from the Stub's {@code TRANSACTION_*} constants, signatures from the
 * matching Proxy methods. Missing files and unmatched methods only cost the affected entries.
 */
public class TransactionExtractor {
    public static final String STUB_SUFFIX = "$Stub";
    public static final String PROXY_SUFFIX = "$Stub$Proxy";

    private final ArtifactResolver resolver;
    private final FieldDeclarationScanner fieldScanner = new FieldDeclarationScanner();
    private final MethodBlockScanner blockScanner;
    private final ParameterAnnotationScanner paramScanner = new ParameterAnnotationScanner();

    public TransactionExtractor(ArtifactResolver resolver, Config config) {
        this(resolver, config.getPrologueMarker());
    }

    public TransactionExtractor(ArtifactResolver resolver, String prologueMarker) {
        this.resolver = resolver;
        this.blockScanner = new MethodBlockScanner(prologueMarker);
    }

    public ExtractionResult extract(String serviceName, String project) {
        List<Path> resolved = resolver.resolve(project);
        if (resolved.isEmpty()) {
            Log.info("[-] " + serviceName + ": no disassembly for " + project + ", probably native");
            return ExtractionResult.unavailable(ExtractionResult.Status.NO_ARTIFACT);
        }
        Path base = resolved.get(0);
        if (resolved.size() > 1) {
            Log.debug(serviceName + ": " + resolved.size() + " matches for " + project + ", using " + base);
        }

        Path stub = companion(base, STUB_SUFFIX);
        List<String> stubLines = readLines(stub);
        if (stubLines == null) {
            Log.warn("[-] " + serviceName + ": stub not found " + stub);
            return ExtractionResult.unavailable(ExtractionResult.Status.NO_STUB);
        }
        Path proxy = companion(base, PROXY_SUFFIX);
        List<String> proxyLines = readLines(proxy);
        if (proxyLines == null) {
            Log.warn("[-] " + serviceName + ": proxy not found " + proxy);
            return ExtractionResult.unavailable(ExtractionResult.Status.NO_PROXY);
        }

        List<TransactionField> fields = fieldScanner.scan(stubLines);
        List<Transaction> transactions = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        for (TransactionField field : fields) {
            MethodBlock block = blockScanner.find(proxyLines, field.getBinderInterface());
            if (block == null) {
                Log.warn("[-] " + serviceName + ": no proxy method for " + field);
                skipped.add(field.getBinderInterface());
                continue;
            }
            MethodSignature signature;
            try {
                signature = MethodBlockScanner.parseSignature(block, paramScanner);
            } catch (IllegalArgumentException e) {
                Log.warn("[-] " + serviceName + ": " + e.getMessage());
                skipped.add(field.getBinderInterface());
                continue;
            }
            transactions.add(new Transaction(field.getBinderNumber(), field.getBinderInterface(),
                    signature.getArguments(), signature.getReturns()));
        }
        Log.debug("[+] " + serviceName + ": " + transactions.size() + "/" + fields.size() + " transactions");
        return ExtractionResult.extracted(transactions, skipped);
    }

    /**
     * {@code .../IFoo.smali} with suffix {@code $Stub} gives {@code .../IFoo$Stub.smali}.
     */
    static Path companion(Path base, String suffix) {
        String fileName = base.getFileName().toString();
        int dot = fileName.lastIndexOf('.');
        String stem = dot > 0 ? fileName.substring(0, dot) : fileName;
        String extension = dot > 0 ? fileName.substring(dot) : "";
        return base.resolveSibling(stem + suffix + extension);
    }

    private static List<String> readLines(Path path) {
        if (!Files.isRegularFile(path)) {
            return null;
        }
        try {
            return Files.readAllLines(path, StandardCharsets.UTF_8);
        } catch (IOException e) {
            Log.warn("Failed to read " + path + ": " + e.getMessage());
            return null;
        }
    }
}
