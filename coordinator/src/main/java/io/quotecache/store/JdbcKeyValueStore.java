package io.quotecache.store;

import io.quotecache.error.StoreException;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

/**
 * JDBC-backed store with schema (k VARCHAR PRIMARY KEY, v VARCHAR). Survives restarts and can be shared by
 * several processes pointing at the same database. Opens a connection per call; use a pooled URL in production.
 */
public class JdbcKeyValueStore implements KeyValueStore {
    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final String table;

    public JdbcKeyValueStore(String jdbcUrl, String user, String password, String table) {
        if (!table.matches("[A-Za-z_][A-Za-z0-9_]*")) throw new IllegalArgumentException("bad table name: " + table);
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.table = table;
    }

    /** Creates the backing table if it does not exist yet. */
    public JdbcKeyValueStore initSchema() {
        try (Connection c = getConnection(); Statement s = c.createStatement()) {
            s.execute("CREATE TABLE IF NOT EXISTS " + table + " (k VARCHAR(512) PRIMARY KEY, v VARCHAR(1000000) NOT NULL)");
        } catch (SQLException e) {
            throw new StoreException("cannot create table " + table, e);
        }
        return this;
    }

    @Override
    public Optional<String> get(String key) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT v FROM " + table + " WHERE k = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("get " + key + " failed", e);
        }
    }

    @Override
    public void set(String key, String value) {
        try (Connection c = getConnection()) {
            if (update(c, key, value) > 0) return;
            try {
                insert(c, key, value);
            } catch (SQLIntegrityConstraintViolationException raced) {
                // another writer inserted first; last writer wins
                update(c, key, value);
            }
        } catch (SQLException e) {
            throw new StoreException("set " + key + " failed", e);
        }
    }

    @Override
    public void delete(String key) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE k = ?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("delete " + key + " failed", e);
        }
    }

    @Override
    public Set<String> keys(String prefix) {
        Set<String> out = new HashSet<>();
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT k FROM " + table + " WHERE k LIKE ? ESCAPE '!'")) {
            ps.setString(1, escapeLike(prefix) + "%");
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreException("keys " + prefix + " failed", e);
        }
        return out;
    }

    @Override
    public boolean compareAndSet(String key, String expected, String value) {
        try (Connection c = getConnection()) {
            if (expected == null) {
                try {
                    insert(c, key, value);
                    return true;
                } catch (SQLIntegrityConstraintViolationException taken) {
                    return false;
                }
            }
            try (PreparedStatement ps = c.prepareStatement("UPDATE " + table + " SET v = ? WHERE k = ? AND v = ?")) {
                ps.setString(1, value);
                ps.setString(2, key);
                ps.setString(3, expected);
                return ps.executeUpdate() == 1;
            }
        } catch (SQLException e) {
            throw new StoreException("compareAndSet " + key + " failed", e);
        }
    }

    @Override
    public boolean compareAndDelete(String key, String expected) {
        if (expected == null) return false;
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM " + table + " WHERE k = ? AND v = ?")) {
            ps.setString(1, key);
            ps.setString(2, expected);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("compareAndDelete " + key + " failed", e);
        }
    }

    private int update(Connection c, String key, String value) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("UPDATE " + table + " SET v = ? WHERE k = ?")) {
            ps.setString(1, value);
            ps.setString(2, key);
            return ps.executeUpdate();
        }
    }

    private void insert(Connection c, String key, String value) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("INSERT INTO " + table + " (k, v) VALUES (?, ?)")) {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.executeUpdate();
        }
    }

    private static String escapeLike(String s) {
        return s.replace("!", "!!").replace("%", "!%").replace("_", "!_");
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
