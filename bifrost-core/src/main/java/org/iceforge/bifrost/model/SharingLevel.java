package org.iceforge.bifrost.model;

/**
 * Owner-facing preset for a new link.
 *
 * <p>{@code PUBLIC} links need nothing but the link id. {@code RESTRICTED} links require a
 * verified caller identity unless the owner says otherwise.
 */
public enum SharingLevel {
    PUBLIC,
    RESTRICTED
}
