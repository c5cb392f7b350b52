package org.iceforge.bifrost.store;

import org.iceforge.bifrost.model.LinkTarget;
import org.iceforge.bifrost.model.SharedLink;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class JdbcSharedLinkStore implements SharedLinkStore {

    private static final String COLUMNS = "share_id, target_kind, target_id, name, description, public_path, "
            + "requires_authentication, password_hash, expires_at, max_uses, current_uses, allowed_users, "
            + "created_by, created_at, revoked_at";

    // Single statement so the row lock serializes concurrent consumers.
    private static final String CONSUME = "UPDATE shared_link SET current_uses = current_uses + 1 "
            + "WHERE share_id = ? AND revoked_at IS NULL "
            + "AND (expires_at IS NULL OR expires_at > ?) "
            + "AND (max_uses IS NULL OR current_uses < max_uses)";

    private final DataSource dataSource;

    public JdbcSharedLinkStore(DataSource dataSource) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
    }

    @Override
    public void insert(SharedLink l) {
        String sql = "INSERT INTO shared_link (" + COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, l.shareId());
            ps.setString(2, l.target().kind().name());
            ps.setString(3, l.target().id());
            ps.setString(4, l.name());
            Jdbc.setString(ps, 5, l.description());
            ps.setString(6, l.publicPath());
            ps.setBoolean(7, l.requiresAuthentication());
            Jdbc.setString(ps, 8, l.passwordHash());
            Jdbc.setInstant(ps, 9, l.expiresAt());
            if (l.maxUses() == null) {
                ps.setNull(10, Types.INTEGER);
            } else {
                ps.setInt(10, l.maxUses());
            }
            ps.setLong(11, l.currentUses());
            ps.setString(12, Jdbc.joinList(l.allowedUsers()));
            ps.setString(13, l.createdBy());
            Jdbc.setInstant(ps, 14, l.createdAt());
            Jdbc.setInstant(ps, 15, l.revokedAt());
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Failed to insert shared link", e);
        }
    }

    @Override
    public Optional<SharedLink> findById(String shareId) {
        if (shareId == null) return Optional.empty();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement("SELECT " + COLUMNS + " FROM shared_link WHERE share_id = ?")) {
            ps.setString(1, shareId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.of(map(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to read shared link", e);
        }
    }

    @Override
    public List<SharedLink> findByTarget(LinkTarget target) {
        String sql = "SELECT " + COLUMNS + " FROM shared_link WHERE target_kind = ? AND target_id = ? "
                + "ORDER BY created_at DESC";
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, target.kind().name());
            ps.setString(2, target.id());
            try (ResultSet rs = ps.executeQuery()) {
                List<SharedLink> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(map(rs));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to list shared links of " + target, e);
        }
    }

    @Override
    public boolean revoke(String shareId, Instant at) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(
                     "UPDATE shared_link SET revoked_at = ? WHERE share_id = ? AND revoked_at IS NULL")) {
            Jdbc.setInstant(ps, 1, at);
            ps.setString(2, shareId);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to revoke shared link", e);
        }
    }

    @Override
    public boolean tryConsume(String shareId, Instant now) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(CONSUME)) {
            ps.setString(1, shareId);
            Jdbc.setInstant(ps, 2, now);
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new StoreException("Failed to consume shared link use", e);
        }
    }

    private static SharedLink map(ResultSet rs) throws SQLException {
        int maxUses = rs.getInt("max_uses");
        Integer max = rs.wasNull() ? null : maxUses;
        return new SharedLink(
                rs.getString("share_id"),
                new LinkTarget(LinkTarget.Kind.valueOf(rs.getString("target_kind")), rs.getString("target_id")),
                rs.getString("name"),
                rs.getString("description"),
                rs.getString("public_path"),
                rs.getBoolean("requires_authentication"),
                rs.getString("password_hash"),
                Jdbc.getInstant(rs, "expires_at"),
                max,
                rs.getLong("current_uses"),
                Jdbc.splitList(rs.getString("allowed_users")),
                rs.getString("created_by"),
                Jdbc.getInstant(rs, "created_at"),
                Jdbc.getInstant(rs, "revoked_at"));
    }
}
