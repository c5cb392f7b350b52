package org.iceforge.bifrost.links;

import org.iceforge.bifrost.model.LinkTarget;
import org.iceforge.bifrost.model.SharingLevel;

import java.time.Instant;
import java.util.List;

/**
 * Link creation request. {@code requiresAuthentication} overrides what the sharing level implies;
 * null limits mean unlimited.
 */
public record NewSharedLink(
        LinkTarget target,
        String name,
        String description,
        String createdBy,
        SharingLevel sharingLevel,
        Boolean requiresAuthentication,
        String password,
        Instant expiresAt,
        Integer maxUses,
        List<String> allowedUsers
) {}
