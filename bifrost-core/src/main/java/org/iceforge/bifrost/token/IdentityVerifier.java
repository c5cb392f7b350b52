package org.iceforge.bifrost.token;

import java.util.Optional;

/** Turns a caller-supplied identity token into a verified identity, or nothing. */
public interface IdentityVerifier {

    Optional<CallerIdentity> verify(String identityToken);
}
