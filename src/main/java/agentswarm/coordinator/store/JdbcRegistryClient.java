package agentswarm.coordinator.store;

import agentswarm.coordinator.registry.RegistryClient;
import agentswarm.coordinator.registry.RegistryUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Collections;

/**
 * JDBC implementation of RegistryClient over a single {@code registry_entries} table.
 * Expiry is evaluated against the injected clock on read; expired rows are removed lazily.
 */
public class JdbcRegistryClient implements RegistryClient {

    private static final Logger log = LoggerFactory.getLogger(JdbcRegistryClient.class);

    private final Database db;
    private final Clock clock;
    private final boolean ownsDatabase;

    public JdbcRegistryClient(Database db, Clock clock) {
        this(db, clock, false);
    }

    JdbcRegistryClient(Database db, Clock clock, boolean ownsDatabase) {
        this.db = db;
        this.clock = clock;
        this.ownsDatabase = ownsDatabase;
    }

    @Override
    public void setWithTtl(String key, String value, Duration ttl) {
        String sql = """
                    MERGE INTO registry_entries (entry_key, entry_value, expires_at)
                    KEY (entry_key)
                    VALUES (?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            ps.setString(2, value);
            ps.setLong(3, expiresAt(ttl));

            ps.executeUpdate();
            conn.commit();
        } catch (SQLException e) {
            throw new RegistryUnavailableException("set", key, e);
        }
    }

    @Override
    public boolean setIfAbsentWithTtl(String key, String value, Duration ttl) {
        String purgeSql = "DELETE FROM registry_entries WHERE entry_key = ? AND expires_at <= ?";
        String insertSql = "INSERT INTO registry_entries (entry_key, entry_value, expires_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection()) {
            try (PreparedStatement purge = conn.prepareStatement(purgeSql);
                    PreparedStatement insert = conn.prepareStatement(insertSql)) {

                purge.setString(1, key);
                purge.setLong(2, clock.millis());
                purge.executeUpdate();

                insert.setString(1, key);
                insert.setString(2, value);
                insert.setLong(3, expiresAt(ttl));
                insert.executeUpdate();

                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                if (isConflict(e)) {
                    log.debug("Key {} already present, set-if-absent skipped", key);
                    return false;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new RegistryUnavailableException("setIfAbsent", key, e);
        }
    }

    @Override
    public String get(String key) {
        String sql = "SELECT entry_value, expires_at FROM registry_entries WHERE entry_key = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, key);
            String value = null;
            boolean expired = false;
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    if (rs.getLong("expires_at") > clock.millis()) {
                        value = rs.getString("entry_value");
                    } else {
                        expired = true;
                    }
                }
            }

            if (expired) {
                evict(conn, key);
            }
            conn.commit();
            return value;
        } catch (SQLException e) {
            throw new RegistryUnavailableException("get", key, e);
        }
    }

    @Override
    public long delete(String... keys) {
        if (keys == null || keys.length == 0) {
            return 0;
        }
        String placeholders = String.join(", ", Collections.nCopies(keys.length, "?"));
        String sql = "DELETE FROM registry_entries WHERE expires_at > ? AND entry_key IN (" + placeholders + ")";
        String expiredSql = "DELETE FROM registry_entries WHERE entry_key IN (" + placeholders + ")";

        try (Connection conn = db.getConnection();
                PreparedStatement live = conn.prepareStatement(sql);
                PreparedStatement rest = conn.prepareStatement(expiredSql)) {

            live.setLong(1, clock.millis());
            for (int i = 0; i < keys.length; i++) {
                live.setString(i + 2, keys[i]);
                rest.setString(i + 1, keys[i]);
            }
            int deleted = live.executeUpdate();
            rest.executeUpdate();
            conn.commit();
            return deleted;
        } catch (SQLException e) {
            throw new RegistryUnavailableException("delete", String.join(",", keys), e);
        }
    }

    @Override
    public boolean ping() {
        return db.isHealthy();
    }

    @Override
    public void close() {
        if (ownsDatabase) {
            db.close();
        }
    }

    private void evict(Connection conn, String key) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "DELETE FROM registry_entries WHERE entry_key = ? AND expires_at <= ?")) {
            ps.setString(1, key);
            ps.setLong(2, clock.millis());
            ps.executeUpdate();
        }
    }

    private long expiresAt(Duration ttl) {
        if (ttl == null || ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be positive");
        }
        return clock.millis() + ttl.toMillis();
    }

    /** Unique-key violation, or H2's concurrent update error on the same row. */
    private static boolean isConflict(SQLException e) {
        String state = e.getSQLState();
        return (state != null && state.startsWith("23")) || e.getErrorCode() == 90131;
    }
}
