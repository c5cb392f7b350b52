package org.iceforge.bifrost.model;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * A revocable, optionally limited grant of access to a connector or dataset.
 *
 * <p>{@code shareId} doubles as the bearer token presented on the wire.
 * {@code passwordHash} is never exposed outside the links and token packages.
 */
public record SharedLink(
        String shareId,
        LinkTarget target,
        String name,
        String description,
        String publicPath,
        boolean requiresAuthentication,
        String passwordHash,
        Instant expiresAt,
        Integer maxUses,
        long currentUses,
        List<String> allowedUsers,
        String createdBy,
        Instant createdAt,
        Instant revokedAt
) {
    public SharedLink {
        Objects.requireNonNull(shareId, "shareId");
        Objects.requireNonNull(target, "target");
        allowedUsers = allowedUsers == null ? List.of() : List.copyOf(allowedUsers);
    }

    /**
     * Status as of {@code now}. Revocation wins over expiry, expiry over exhaustion.
     * A link whose expiry instant equals {@code now} is already expired.
     */
    public LinkStatus statusAt(Instant now) {
        if (revokedAt != null) {
            return LinkStatus.REVOKED;
        }
        if (expiresAt != null && !now.isBefore(expiresAt)) {
            return LinkStatus.EXPIRED;
        }
        if (maxUses != null && currentUses >= maxUses) {
            return LinkStatus.EXHAUSTED;
        }
        return LinkStatus.ACTIVE;
    }

    public boolean hasPassword() {
        return passwordHash != null && !passwordHash.isEmpty();
    }

    public boolean restrictsUsers() {
        return !allowedUsers.isEmpty();
    }

    @Override
    public String toString() {
        return "SharedLink[id=" + shareId + ", target=" + target + ", uses=" + currentUses
                + (maxUses == null ? "" : "/" + maxUses) + ", expiresAt=" + expiresAt
                + ", auth=" + requiresAuthentication + ", password=" + (hasPassword() ? "set" : "none")
                + ", revoked=" + (revokedAt != null) + "]";
    }
}
