package com.invdash.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.invdash.model.ScopeName;
import com.invdash.model.SnapshotPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.HexFormat;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores snapshot payloads as JSON text in table {@code inventory_snapshots}, one row per
 * provider, scope, hosts key and level. The hosts key is matched through its SHA-256 and kept in
 * full alongside.
 */
public class JdbcSnapshotRepository implements SnapshotRepository {
    private static final Logger log = LoggerFactory.getLogger(JdbcSnapshotRepository.class);

    private static final String CREATE_TABLE = "CREATE TABLE IF NOT EXISTS inventory_snapshots ("
            + "id BIGINT AUTO_INCREMENT PRIMARY KEY, "
            + "provider VARCHAR(64) NOT NULL, "
            + "scope_name VARCHAR(16) NOT NULL, "
            + "hosts_hash CHAR(64) NOT NULL, "
            + "hosts_key CLOB NOT NULL, "
            + "detail_level VARCHAR(64) NOT NULL, "
            + "payload CLOB NOT NULL, "
            + "created_at TIMESTAMP NOT NULL, "
            + "updated_at TIMESTAMP NOT NULL, "
            + "CONSTRAINT uq_inventory_snapshots UNIQUE (provider, scope_name, hosts_hash, detail_level))";

    private static final String UPDATE = "UPDATE inventory_snapshots SET payload = ?, updated_at = ? "
            + "WHERE provider = ? AND scope_name = ? AND hosts_hash = ? AND detail_level = ?";

    private static final String INSERT = "INSERT INTO inventory_snapshots "
            + "(provider, scope_name, hosts_hash, hosts_key, detail_level, payload, created_at, updated_at) "
            + "VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

    private static final String SELECT = "SELECT payload FROM inventory_snapshots "
            + "WHERE provider = ? AND scope_name = ? AND hosts_hash = ? AND detail_level = ?";

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public JdbcSnapshotRepository(DataSource dataSource, ObjectMapper objectMapper, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates the snapshot table if it does not exist yet.
     */
    public void initializeSchema() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_TABLE);
            log.info("Snapshot table ready: inventory_snapshots");
        } catch (SQLException e) {
            throw new SnapshotPersistenceException("Failed to create table inventory_snapshots", e);
        }
    }

    @Override
    public void save(String provider, ScopeName scope, String hostsKey, String level, SnapshotPayload payload) {
        String json;
        try {
            json = objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new SnapshotPersistenceException("Failed to serialize snapshot: " + describe(provider, scope, hostsKey, level), e);
        }

        Timestamp now = Timestamp.from(clock.instant());
        String hostsHash = hostsHash(hostsKey);
        try (Connection conn = dataSource.getConnection()) {
            int updated;
            try (PreparedStatement ps = conn.prepareStatement(UPDATE)) {
                ps.setString(1, json);
                ps.setTimestamp(2, now);
                ps.setString(3, provider);
                ps.setString(4, scope.getValue());
                ps.setString(5, hostsHash);
                ps.setString(6, level);
                updated = ps.executeUpdate();
            }
            if (updated == 0) {
                try (PreparedStatement ps = conn.prepareStatement(INSERT)) {
                    ps.setString(1, provider);
                    ps.setString(2, scope.getValue());
                    ps.setString(3, hostsHash);
                    ps.setString(4, hostsKey);
                    ps.setString(5, level);
                    ps.setString(6, json);
                    ps.setTimestamp(7, now);
                    ps.setTimestamp(8, now);
                    ps.executeUpdate();
                }
            }
        } catch (SQLException e) {
            throw new SnapshotPersistenceException("Failed to save snapshot: " + describe(provider, scope, hostsKey, level), e);
        }
    }

    @Override
    public Optional<SnapshotPayload> load(String provider, ScopeName scope, String hostsKey, String level) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(SELECT)) {
            ps.setString(1, provider);
            ps.setString(2, scope.getValue());
            ps.setString(3, hostsHash(hostsKey));
            ps.setString(4, level);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(objectMapper.readValue(rs.getString(1), SnapshotPayload.class));
            }
        } catch (SQLException e) {
            throw new SnapshotPersistenceException("Failed to load snapshot: " + describe(provider, scope, hostsKey, level), e);
        } catch (JsonProcessingException e) {
            throw new SnapshotPersistenceException("Stored snapshot is not readable: " + describe(provider, scope, hostsKey, level), e);
        }
    }

    /**
     * SHA-256 of the hosts key, hex encoded. Rows are keyed on it so the host list has no length limit.
     */
    static String hostsHash(String hostsKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(hostsKey.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    private static String describe(String provider, ScopeName scope, String hostsKey, String level) {
        return "provider=" + provider + ", scope=" + scope.getValue() + ", hosts_key=" + hostsKey + ", level=" + level;
    }
}
