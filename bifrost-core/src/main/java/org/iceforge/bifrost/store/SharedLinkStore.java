package org.iceforge.bifrost.store;

import org.iceforge.bifrost.model.LinkTarget;
import org.iceforge.bifrost.model.SharedLink;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Durable home of {@link SharedLink} rows. */
public interface SharedLinkStore {

    void insert(SharedLink link);

    Optional<SharedLink> findById(String shareId);

    List<SharedLink> findByTarget(LinkTarget target);

    /** Sets {@code revoked_at} if not already set. Returns true when this call revoked it. */
    boolean revoke(String shareId, Instant at);

    /**
     * Consumes one use if, and only if, the link is unrevoked, unexpired at {@code now} and
     * below its use limit. Concurrent callers never exceed {@code max_uses} successes.
     */
    boolean tryConsume(String shareId, Instant now);
}
