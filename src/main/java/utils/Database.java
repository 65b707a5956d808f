package utils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import catalog.CatalogException;
import init.ConfigurationException;
import org.sqlite.SQLiteConfig;

/**
 * One SQLite connection to one catalog file. Writes stay uncommitted until {@link #commit()}.
 */
public class Database implements AutoCloseable {
    private final Path path;
    private final Connection c;

    private Database(Path path, boolean readOnly) {
        this.path = path;
        try {
            Class.forName("org.sqlite.JDBC");
            SQLiteConfig config = new SQLiteConfig();
            config.setReadOnly(readOnly);
            config.enforceForeignKeys(true);
            c = DriverManager.getConnection(String.format("jdbc:sqlite:%s", path), config.toProperties());
            c.setAutoCommit(false);
            Log.debug("Opened catalog " + path + (readOnly ? " (read-only)" : ""));
        } catch (ClassNotFoundException e) {
            throw new CatalogException("SQLite JDBC driver not on classpath", e);
        } catch (SQLException e) {
            throw new CatalogException("Failed to open catalog " + path, e);
        }
    }

    /**
     * Opens (creating if needed) a catalog for writing.
     */
    public static Database open(Path path) {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null && !Files.isDirectory(parent)) {
            throw new ConfigurationException("Catalog directory does not exist: " + parent);
        }
        return new Database(path, false);
    }

    /**
     * Opens an existing catalog for reading. A missing file is a configuration error, the driver would
     * otherwise create an empty one.
     */
    public static Database openReadOnly(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new ConfigurationException("Catalog not found: " + path);
        }
        return new Database(path, true);
    }

    public Connection getConnection() {
        return c;
    }

    public Path getPath() {
        return path;
    }

    public Statement createStatement() throws SQLException {
        return c.createStatement();
    }

    public void commit() {
        try {
            c.commit();
        } catch (SQLException e) {
            throw new CatalogException("Commit failed on " + path, e);
        }
    }

    public void rollback() {
        try {
            c.rollback();
        } catch (SQLException e) {
            Log.errorStack("Rollback failed on " + path, e);
        }
    }

    @Override
    public void close() {
        try {
            c.close();
        } catch (SQLException e) {
            throw new CatalogException("Failed to close catalog " + path, e);
        }
    }
}
