package device;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import catalog.ServiceEntry;
import init.ConfigurationException;
import utils.Log;

/**
 * Reads a saved {@code adb shell service list} output:
 * <pre>
 * Found 2 services:
 * 0	activity: [android.app.IActivityManager]
 * 1	vold: []
 * </pre>
 */
public class ServiceListFile implements ServiceEnumerator {
    private static final Pattern ENTRY = Pattern.compile("^\\s*\\d+\\s+(\\S+?):\\s*\\[([^\\]]*)\\]\\s*$");

    private final Path path;

    public ServiceListFile(Path path) {
        this.path = path;
    }

    @Override
    public List<ServiceEntry> enumerate() {
        if (path == null || !Files.isRegularFile(path)) {
            throw new ConfigurationException("Service list not found: " + path);
        }
        try (BufferedReader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read service list " + path, e);
        }
    }

    static List<ServiceEntry> parse(BufferedReader reader) throws IOException {
        List<ServiceEntry> services = new ArrayList<>();
        String line;
        while ((line = reader.readLine()) != null) {
            if (line.trim().isEmpty() || line.startsWith("Found ")) {
                continue;
            }
            Matcher m = ENTRY.matcher(line);
            if (!m.matches()) {
                Log.debug("Ignoring service list line: " + line);
                continue;
            }
            String project = m.group(2).trim();
            services.add(new ServiceEntry(m.group(1), project.isEmpty() ? null : project));
        }
        return services;
    }
}
