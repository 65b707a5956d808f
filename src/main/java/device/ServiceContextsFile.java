package device;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import init.ConfigurationException;

/**
 * Labels from a {@code service_contexts} file, one {@code <name> <label>} pair per line.
 * The first label seen for a name wins.
 */
public class ServiceContextsFile implements SecurityContextLookup {
    private final Map<String, String> contexts;

    public ServiceContextsFile(Map<String, String> contexts) {
        this.contexts = contexts;
    }

    public static ServiceContextsFile load(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("service_contexts not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return new ServiceContextsFile(parse(reader));
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + path, e);
        }
    }

    static Map<String, String> parse(BufferedReader reader) throws IOException {
        Map<String, String> contexts = new HashMap<>();
        String line;
        while ((line = reader.readLine()) != null) {
            line = line.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            String[] parts = line.split("\\s+");
            if (parts.length < 2) {
                continue;
            }
            contexts.putIfAbsent(parts[0], parts[1]);
        }
        return contexts;
    }

    @Override
    public Optional<String> lookup(String serviceName) {
        return Optional.ofNullable(contexts.get(serviceName));
    }
}
