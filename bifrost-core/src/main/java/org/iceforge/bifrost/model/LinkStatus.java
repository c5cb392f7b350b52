package org.iceforge.bifrost.model;

/** Lifecycle of a shared link. Every state except {@code ACTIVE} is terminal. */
public enum LinkStatus {
    ACTIVE,
    EXPIRED,
    EXHAUSTED,
    REVOKED
}
