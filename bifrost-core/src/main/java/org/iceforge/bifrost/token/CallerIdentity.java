package org.iceforge.bifrost.token;

/** A verified end user, identified by the subject the identity provider vouched for. */
public record CallerIdentity(String subject) {
    public CallerIdentity {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
    }
}
