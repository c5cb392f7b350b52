package org.iceforge.bifrost.token;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.links.PasswordHasher;
import org.iceforge.bifrost.model.ConnectorType;
import org.iceforge.bifrost.model.ProxyConnector;
import org.iceforge.bifrost.model.SharedLink;
import org.iceforge.bifrost.registry.ConnectorRegistry;
import org.iceforge.bifrost.store.SharedLinkStore;
import org.iceforge.bifrost.usage.UsageAccountant;
import org.iceforge.bifrost.vault.CredentialHandle;
import org.iceforge.bifrost.vault.CredentialVault;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Decides whether presented credentials may run an operation, and hands out the scoped
 * credential handle when they may.
 *
 * <p>Checks run in a fixed order: unknown token, revoked, expired, exhausted, link password,
 * caller identity, operation allow-list, then the atomic use consumption. The first failing
 * check wins. A token that belongs to a connector type the listener does not serve is
 * reported as unknown.
 */
public class TokenResolver {
    private static final Logger log = LoggerFactory.getLogger(TokenResolver.class);

    /** The only operation a dataset link grants. */
    public static final String READ = "READ";

    /** Fetching a link's public descriptor on a link-only listener. Every link grants it there. */
    public static final String INFO = "INFO";

    private final ConnectorRegistry registry;
    private final SharedLinkStore links;
    private final PasswordHasher hasher;
    private final IdentityVerifier identities;
    private final UsageAccountant usage;
    private final CredentialVault vault;
    private final Clock clock;

    public TokenResolver(ConnectorRegistry registry, SharedLinkStore links, PasswordHasher hasher,
                         IdentityVerifier identities, UsageAccountant usage, CredentialVault vault, Clock clock) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.links = Objects.requireNonNull(links, "links");
        this.hasher = Objects.requireNonNull(hasher, "hasher");
        this.identities = Objects.requireNonNull(identities, "identities");
        this.usage = Objects.requireNonNull(usage, "usage");
        this.vault = Objects.requireNonNull(vault, "vault");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    private record Target(ProxyConnector connector, SharedLink link, String datasetId, CallerIdentity caller) {}

    /**
     * Token, status, password and identity checks without touching any counter. Used at
     * wire-protocol login so that bad credentials fail before the first statement.
     */
    public AuthorizationResult authenticate(AuthorizationRequest req) {
        Target t = resolve(req);
        return new AuthorizationResult(t.connector(), t.link(), t.datasetId(), t.caller(), null, null);
    }

    public AuthorizationResult authorize(AuthorizationRequest req) {
        Target t = resolve(req);
        String op = ConnectorType.normalizeOperation(req.operation());
        String token = req.credentials().token();

        boolean descriptorOnly = INFO.equals(op) && t.link() != null && !req.directTokensAccepted();
        if (!descriptorOnly && !permits(t, op)) {
            throw deny(ErrorCode.OPERATION_NOT_ALLOWED, token, op);
        }

        if (t.link() != null && !usage.tryConsume(t.link().shareId())) {
            // Lost the race against another consumer or a revocation; report what the link is now.
            ErrorCode code = links.findById(t.link().shareId())
                    .map(l -> switch (l.statusAt(clock.instant())) {
                        case REVOKED -> ErrorCode.TOKEN_REVOKED;
                        case EXPIRED -> ErrorCode.TOKEN_EXPIRED;
                        default -> ErrorCode.TOKEN_EXHAUSTED;
                    })
                    .orElse(ErrorCode.TOKEN_NOT_FOUND);
            throw deny(code, token, op);
        }
        if (t.connector() != null && !usage.recordAttempt(t.connector().id())) {
            throw deny(ErrorCode.TOKEN_REVOKED, token, op);
        }

        CredentialHandle handle = t.connector() == null
                ? null
                : vault.open(t.connector().id(), t.connector().credentials());
        return new AuthorizationResult(t.connector(), t.link(), t.datasetId(), t.caller(), op, handle);
    }

    private Target resolve(AuthorizationRequest req) {
        ClientCredentials creds = req.credentials();
        String token = creds.token();
        if (!creds.hasToken()) {
            throw deny(ErrorCode.TOKEN_NOT_FOUND, token, req.operation());
        }

        Optional<ProxyConnector> direct = registry.resolveByToken(token);
        if (direct.isPresent()) {
            ProxyConnector c = direct.get();
            if (!req.directTokensAccepted() || !req.acceptedTypes().contains(c.type())) {
                throw deny(ErrorCode.TOKEN_NOT_FOUND, token, req.operation());
            }
            if (c.isRevoked()) {
                throw deny(ErrorCode.TOKEN_REVOKED, token, req.operation());
            }
            return new Target(c, null, null, identities.verify(creds.identityToken()).orElse(null));
        }

        SharedLink link = links.findById(token)
                .orElseThrow(() -> deny(ErrorCode.TOKEN_NOT_FOUND, token, req.operation()));

        ProxyConnector target = null;
        String datasetId = null;
        if (link.target().isConnector()) {
            target = registry.resolve(link.target().id()).orElse(null);
            if (target != null && !req.acceptedTypes().contains(target.type())) {
                throw deny(ErrorCode.TOKEN_NOT_FOUND, token, req.operation());
            }
        } else {
            if (!req.datasetLinksAccepted()) {
                throw deny(ErrorCode.TOKEN_NOT_FOUND, token, req.operation());
            }
            datasetId = link.target().id();
        }

        Instant now = clock.instant();
        switch (link.statusAt(now)) {
            case REVOKED -> throw deny(ErrorCode.TOKEN_REVOKED, token, req.operation());
            case EXPIRED -> throw deny(ErrorCode.TOKEN_EXPIRED, token, req.operation());
            case EXHAUSTED -> throw deny(ErrorCode.TOKEN_EXHAUSTED, token, req.operation());
            case ACTIVE -> { }
        }
        if (link.target().isConnector() && (target == null || target.isRevoked())) {
            throw deny(ErrorCode.TOKEN_REVOKED, token, req.operation());
        }

        if (link.hasPassword()) {
            if (creds.password() == null || creds.password().isEmpty()) {
                throw deny(ErrorCode.PASSWORD_REQUIRED, token, req.operation());
            }
            if (!hasher.matches(creds.password(), link.passwordHash())) {
                throw deny(ErrorCode.PASSWORD_INCORRECT, token, req.operation());
            }
        }

        Optional<CallerIdentity> caller = identities.verify(creds.identityToken());
        if (link.requiresAuthentication()) {
            if (caller.isEmpty()) {
                throw deny(ErrorCode.AUTHENTICATION_REQUIRED, token, req.operation());
            }
            if (link.restrictsUsers() && !isListed(link, caller.get())) {
                throw deny(ErrorCode.CALLER_NOT_ALLOWED, token, req.operation());
            }
        }
        return new Target(target, link, datasetId, caller.orElse(null));
    }

    private static boolean permits(Target t, String op) {
        return t.datasetId() != null ? READ.equals(op) : t.connector().allows(op);
    }

    private static boolean isListed(SharedLink link, CallerIdentity caller) {
        String subject = caller.subject().toLowerCase(Locale.ROOT);
        return link.allowedUsers().stream().anyMatch(u -> u.toLowerCase(Locale.ROOT).equals(subject));
    }

    private static GatewayException deny(ErrorCode code, String token, String operation) {
        if (log.isDebugEnabled()) {
            log.debug("Denied token={} op={} code={}", ClientCredentials.mask(token), operation, code);
        }
        return new GatewayException(code, code + " for token " + ClientCredentials.mask(token));
    }
}
