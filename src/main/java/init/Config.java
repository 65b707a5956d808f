package init;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Properties;

/**
 * Settings resolved once at startup and handed to the builder, the extractor and the front-end.
 * Values come from {@code catalog.properties} on the classpath, then from the overrides passed to {@link #load(Properties)}.
 */
public class Config {

    public static final String RESOURCE = "catalog.properties";

    // Basic Config
    private final String logLevel;
    private final String unknownContextMarker;

    // Catalog Config
    private final Path catalogDir;
    private final String catalogName;
    private final Path baselineDir;

    // Extraction Config
    private final Path corpusPath;
    private final String artifactExtension;
    private final String prologueMarker;

    // Collaborator files
    private final Path serviceListPath;
    private final Path serviceContextsPath;
    private final Path exportPath;

    private Config(Properties p) {
        this.logLevel = p.getProperty("log.level", "INFO");
        this.unknownContextMarker = p.getProperty("context.unknown", "UNKNOWN");

        this.catalogDir = Paths.get(p.getProperty("catalog.dir", "."));
        this.catalogName = p.getProperty("catalog.name", "binder.db");
        String baseline = p.getProperty("baseline.dir");
        this.baselineDir = isBlank(baseline) ? catalogDir.resolve("baseline") : Paths.get(baseline);

        this.corpusPath = optionalPath(p, "corpus.path");
        this.artifactExtension = p.getProperty("artifact.extension", ".smali");
        this.prologueMarker = p.getProperty("extract.prologue", ".prologue");

        this.serviceListPath = optionalPath(p, "services.list");
        this.serviceContextsPath = optionalPath(p, "services.contexts");
        this.exportPath = optionalPath(p, "export.path");
    }

    /**
     * Reads the bundled defaults and applies {@code overrides} on top. A null override set is allowed.
     */
    public static Config load(Properties overrides) {
        Properties merged = new Properties();
        try (InputStream in = Config.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                merged.load(in);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to read " + RESOURCE, e);
        }
        if (overrides != null) {
            for (String key : overrides.stringPropertyNames()) {
                merged.setProperty(key, overrides.getProperty(key));
            }
        }
        return new Config(merged);
    }

    public static Config fromProperties(Properties properties) {
        return new Config(properties);
    }

    private static Path optionalPath(Properties p, String key) {
        String value = p.getProperty(key);
        return isBlank(value) ? null : Paths.get(value.trim());
    }

    private static boolean isBlank(String value) {
        return value == null || value.trim().isEmpty();
    }

    public Path getProjectCatalogPath() {
        return catalogDir.resolve(catalogName);
    }

    /**
     * Baseline catalog location: the explicit path when given, otherwise {@code <baseline.dir>/<catalog.name>}.
     */
    public Path getBaselineCatalogPath(Path explicit) {
        return explicit != null ? explicit : baselineDir.resolve(catalogName);
    }

    public String getLogLevel() {
        return logLevel;
    }

    public String getUnknownContextMarker() {
        return unknownContextMarker;
    }

    public Path getBaselineDir() {
        return baselineDir;
    }

    public Path getCorpusPath() {
        return corpusPath;
    }

    public String getArtifactExtension() {
        return artifactExtension;
    }

    public String getPrologueMarker() {
        return prologueMarker;
    }

    public Path getServiceListPath() {
        return serviceListPath;
    }

    public Path getServiceContextsPath() {
        return serviceContextsPath;
    }

    public Path getExportPath() {
        return exportPath;
    }
}
