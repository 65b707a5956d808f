package catalog;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.function.Consumer;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

import utils.Database;
import utils.Log;

/**
 * The two-table catalog ({@code services}, {@code transactions}) inside one SQLite file.
 * <p>
 * Listing methods return lazy streams over an open result set; close them (try-with-resources) to
 * release the statement. Every call runs a fresh query.
 */
public class CatalogStore {

    private static final String[] DROP_SCHEMA = {
            "DROP TABLE IF EXISTS transactions",
            "DROP TABLE IF EXISTS services"
    };

    private static final String[] CREATE_SCHEMA = {
            "CREATE TABLE services ("
                    + "id INTEGER PRIMARY KEY, "
                    + "name TEXT NOT NULL UNIQUE, "
                    + "project TEXT)",
            "CREATE TABLE transactions ("
                    + "id INTEGER PRIMARY KEY, "
                    + "number INTEGER NOT NULL, "
                    + "method_name TEXT NOT NULL, "
                    + "arguments TEXT NOT NULL, "
                    + "returns TEXT NOT NULL, "
                    + "service_id INTEGER NOT NULL REFERENCES services(id) ON DELETE CASCADE)",
            "CREATE INDEX transactions_service ON transactions(service_id)"
    };

    private final Database db;

    public CatalogStore(Database db) {
        this.db = db;
    }

    public Database getDatabase() {
        return db;
    }

    public void resetSchema() {
        try (Statement stmt = db.createStatement()) {
            for (String sql : DROP_SCHEMA) {
                stmt.executeUpdate(sql);
            }
            for (String sql : CREATE_SCHEMA) {
                stmt.executeUpdate(sql);
            }
            Log.debug("Schema reset on " + db.getPath());
        } catch (SQLException e) {
            throw new CatalogException("Failed to reset schema on " + db.getPath(), e);
        }
    }

    /**
     * Inserts all services in one batch.
     *
     * @throws UniqueConstraintException when a name repeats, within the list or against stored rows
     */
    public void insertServices(List<ServiceEntry> services) {
        Set<String> seen = new HashSet<>();
        for (ServiceEntry entry : services) {
            if (!seen.add(entry.getName())) {
                throw new UniqueConstraintException("Duplicate service name: " + entry.getName());
            }
        }
        String sql = "INSERT INTO services (name, project) VALUES (?, ?)";
        try (PreparedStatement ps = db.getConnection().prepareStatement(sql)) {
            for (ServiceEntry entry : services) {
                ps.setString(1, entry.getName());
                if (entry.getProject() == null) {
                    ps.setNull(2, Types.VARCHAR);
                } else {
                    ps.setString(2, entry.getProject());
                }
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new UniqueConstraintException("Service name already in catalog", e);
            }
            throw new CatalogException("Failed to insert services", e);
        }
    }

    public void insertTransactions(List<Transaction> transactions) {
        if (transactions.isEmpty()) {
            return;
        }
        String sql = "INSERT INTO transactions (number, method_name, arguments, returns, service_id) VALUES (?, ?, ?, ?, ?)";
        try (PreparedStatement ps = db.getConnection().prepareStatement(sql)) {
            for (Transaction t : transactions) {
                ps.setInt(1, t.getNumber());
                ps.setString(2, t.getMethodName());
                ps.setString(3, t.getArguments());
                ps.setString(4, t.getReturns());
                ps.setLong(5, t.getServiceId());
                ps.addBatch();
            }
            ps.executeBatch();
        } catch (SQLException e) {
            throw new CatalogException("Failed to insert transactions", e);
        }
    }

    public Stream<Service> listServices(boolean orderByName) {
        String sql = "SELECT id, name, project FROM services ORDER BY " + (orderByName ? "name" : "id");
        return query(sql, null, rs -> new Service(rs.getLong(1), rs.getString(2), rs.getString(3)));
    }

    /**
     * @return the service, or null when the catalog does not track {@code name}
     */
    public Service findServiceByName(String name) {
        String sql = "SELECT id, name, project FROM services WHERE name = ?";
        try (PreparedStatement ps = db.getConnection().prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return new Service(rs.getLong(1), rs.getString(2), rs.getString(3));
                }
                return null;
            }
        } catch (SQLException e) {
            throw new CatalogException("Failed to look up service " + name, e);
        }
    }

    /**
     * Transactions of one service. With {@code orderByNumber} they come by number, ties in extraction order;
     * otherwise in extraction order.
     */
    public Stream<Transaction> listTransactionsForService(long serviceId, boolean orderByNumber) {
        String sql = "SELECT id, number, method_name, arguments, returns, service_id FROM transactions "
                + "WHERE service_id = ? ORDER BY " + (orderByNumber ? "number, id" : "id");
        return query(sql, serviceId, rs -> new Transaction(
                rs.getLong(1), rs.getInt(2), rs.getString(3), rs.getString(4), rs.getString(5), rs.getLong(6)));
    }

    public void commit() {
        db.commit();
    }

    private <T> Stream<T> query(String sql, Long param, RowMapper<T> mapper) {
        PreparedStatement ps = null;
        ResultSet rs;
        try {
            ps = db.getConnection().prepareStatement(sql);
            if (param != null) {
                ps.setLong(1, param);
            }
            rs = ps.executeQuery();
        } catch (SQLException e) {
            closeQuietly(ps);
            throw new CatalogException("Query failed: " + sql, e);
        }
        PreparedStatement statement = ps;
        ResultSet resultSet = rs;
        Spliterator<T> rows = new Spliterators.AbstractSpliterator<T>(Long.MAX_VALUE, Spliterator.ORDERED) {
            @Override
            public boolean tryAdvance(Consumer<? super T> action) {
                try {
                    if (!resultSet.next()) {
                        return false;
                    }
                    action.accept(mapper.map(resultSet));
                    return true;
                } catch (SQLException e) {
                    throw new CatalogException("Failed to read row: " + sql, e);
                }
            }
        };
        return StreamSupport.stream(rows, false).onClose(() -> closeQuietly(statement));
    }

    private static void closeQuietly(Statement statement) {
        if (statement == null) {
            return;
        }
        try {
            statement.close();
        } catch (SQLException e) {
            Log.warn("Failed to close statement: " + e.getMessage());
        }
    }

    static boolean isUniqueViolation(SQLException e) {
        Throwable t = e;
        while (t != null) {
            String msg = t.getMessage();
            if (msg != null && msg.contains("UNIQUE constraint failed")) {
                return true;
            }
            t = t.getCause();
        }
        return false;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }
}
