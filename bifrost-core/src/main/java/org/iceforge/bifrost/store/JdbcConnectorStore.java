package org.iceforge.bifrost.store;

import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.EncryptedBlob;
import org.iceforge.bifrost.model.LinkTarget;
import org.iceforge.bifrost.model.ProxyConnector;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class JdbcConnectorStore implements ConnectorStore {

    private static final String COLUMNS = "id, owner_id, name, description, connector_type, access_token, "
            + "credentials_ciphertext, credentials_nonce, allowed_operations, visible_to_others, total_requests, "
            + "created_at, updated_at, last_accessed_at, revoked_at";

    private final DataSource dataSource;

    public JdbcConnectorStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public void insert(ProxyConnector c) {
        String sql = "INSERT INTO proxy_connector (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, c.id());
            ps.setString(2, c.ownerId());
            ps.setString(3, c.name());
            Jdbc.setString(ps, 4, c.description());
            ps.setString(5, c.type().name());
            ps.setString(6, c.accessToken());
            ps.setString(7, c.credentials().ciphertextBase64());
            ps.setString(8, c.credentials().nonceBase64());
            ps.setString(9, Jdbc.joinList(c.allowedOperations()));
            ps.setBoolean(10, c.visibleToOthers());
            ps.setLong(11, c.totalRequests());
            Jdbc.setInstant(ps, 12, c.createdAt());
            Jdbc.setInstant(ps, 13, c.updatedAt());
            Jdbc.setInstant(ps, 14, c.lastAccessedAt());
            Jdbc.setInstant(ps, 15, c.revokedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert connector " + c.id(), e);
        }
    }

    @Override
    public Optional<ProxyConnector> findById(String id) {
        return findOne("SELECT " + COLUMNS + " FROM proxy_connector WHERE id = ?", id);
    }

    @Override
    public Optional<ProxyConnector> findByAccessToken(String accessToken) {
        return findOne("SELECT " + COLUMNS + " FROM proxy_connector WHERE access_token = ?", accessToken);
    }

    @Override
    public List<ProxyConnector> findByOwner(String ownerId) {
        String sql = "SELECT " + COLUMNS + " FROM proxy_connector WHERE owner_id = ? AND revoked_at IS NULL "
                + "ORDER BY created_at DESC";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, ownerId);
            try (ResultSet rs = ps.executeQuery()) {
                List<ProxyConnector> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(map(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list connectors of " + ownerId, e);
        }
    }

    @Override
    public boolean update(ProxyConnector c) {
        String sql = "UPDATE proxy_connector SET name = ?, description = ?, credentials_ciphertext = ?, "
                + "credentials_nonce = ?, allowed_operations = ?, visible_to_others = ?, updated_at = ? "
                + "WHERE id = ? AND revoked_at IS NULL";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, c.name());
            Jdbc.setString(ps, 2, c.description());
            ps.setString(3, c.credentials().ciphertextBase64());
            ps.setString(4, c.credentials().nonceBase64());
            ps.setString(5, Jdbc.joinList(c.allowedOperations()));
            ps.setBoolean(6, c.visibleToOthers());
            Jdbc.setInstant(ps, 7, c.updatedAt());
            ps.setString(8, c.id());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to update connector " + c.id(), e);
        }
    }

    @Override
    public boolean incrementRequests(String id, Instant at) {
        String sql = "UPDATE proxy_connector SET total_requests = total_requests + 1, last_accessed_at = ? "
                + "WHERE id = ? AND revoked_at IS NULL";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            Jdbc.setInstant(ps, 1, at);
            ps.setString(2, id);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to count request on connector " + id, e);
        }
    }

    @Override
    public int revokeCascade(String id, Instant at) {
        try (Connection conn = dataSource.getConnection()) {
            boolean autoCommit = conn.getAutoCommit();
            conn.setAutoCommit(false);
            try {
                int connectors;
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE proxy_connector SET revoked_at = ? WHERE id = ? AND revoked_at IS NULL")) {
                    Jdbc.setInstant(ps, 1, at);
                    ps.setString(2, id);
                    connectors = ps.executeUpdate();
                }
                if (connectors == 0) {
                    conn.rollback();
                    return -1;
                }
                int links;
                try (PreparedStatement ps = conn.prepareStatement(
                        "UPDATE shared_link SET revoked_at = ? "
                                + "WHERE target_kind = ? AND target_id = ? AND revoked_at IS NULL")) {
                    Jdbc.setInstant(ps, 1, at);
                    ps.setString(2, LinkTarget.Kind.CONNECTOR.name());
                    ps.setString(3, id);
                    links = ps.executeUpdate();
                }
                conn.commit();
                return links;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            } finally {
                conn.setAutoCommit(autoCommit);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to revoke connector " + id, e);
        }
    }

    private Optional<ProxyConnector> findOne(String sql, String key) {
        if (key == null) return Optional.empty();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read connector", e);
        }
    }

    private static ProxyConnector map(ResultSet rs) throws SQLException {
        return new ProxyConnector(
                rs.getString("id"),
                rs.getString("owner_id"),
                rs.getString("name"),
                rs.getString("description"),
                ConnectorType.valueOf(rs.getString("connector_type")),
                rs.getString("access_token"),
                EncryptedBlob.fromBase64(rs.getString("credentials_ciphertext"), rs.getString("credentials_nonce")),
                new LinkedHashSet<>(Jdbc.splitList(rs.getString("allowed_operations"))),
                rs.getBoolean("visible_to_others"),
                rs.getLong("total_requests"),
                Jdbc.getInstant(rs, "created_at"),
                Jdbc.getInstant(rs, "updated_at"),
                Jdbc.getInstant(rs, "last_accessed_at"),
                Jdbc.getInstant(rs, "revoked_at"));
    }
}
