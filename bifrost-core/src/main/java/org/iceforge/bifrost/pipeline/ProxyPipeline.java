package org.iceforge.bifrost.pipeline;

import org.iceforge.bifrost.audit.AccessEvent;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.error.MalformedRequestException;
import org.iceforge.bifrost.token.AuthorizationRequest;
import org.iceforge.bifrost.token.AuthorizationResult;
import org.iceforge.bifrost.token.ClientCredentials;
import org.iceforge.bifrost.token.TokenResolver;
import org.iceforge.bifrost.usage.UsageAccountant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * The shared request path of every listener: parse, authorize, call the backend, frame the
 * answer, account for it.
 *
 * <p>Read-only operations get one retry after a short backoff when the backend is
 * unreachable or timed out. Writes are never retried. Nothing reaches the backend unless
 * authorization succeeded.
 */
public class ProxyPipeline {
    private static final Logger log = LoggerFactory.getLogger(ProxyPipeline.class);

    private final TokenResolver resolver;
    private final UsageAccountant usage;
    private final Clock clock;
    private final Duration retryBackoff;

    public ProxyPipeline(TokenResolver resolver, UsageAccountant usage, Clock clock, Duration retryBackoff) {
        this.resolver = Objects.requireNonNull(resolver, "resolver");
        this.usage = Objects.requireNonNull(usage, "usage");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.retryBackoff = retryBackoff == null ? Duration.ofMillis(200) : retryBackoff;
    }

    /**
     * Runs one request end to end. Malformed input propagates as {@link MalformedRequestException}
     * after being audited so the listener can close the connection. Other errors raised while
     * parsing are framed to the client like authorization failures. I/O errors towards the
     * client propagate as-is.
     */
    public <Q, B, O> ProxyResult handle(ProtocolAdapter<Q, B, O> adapter, Q request, ClientContext ctx,
                                        BackendInvoker<Q, B> backend, O out) throws IOException {
        long start = System.nanoTime();
        Protocol protocol = adapter.protocol();

        ClientCredentials creds;
        String operation;
        try {
            creds = adapter.parseToken(request);
            operation = adapter.parseOperation(request);
        } catch (MalformedRequestException e) {
            audit(protocol, null, null, null, AccessEvent.Outcome.REJECTED, e.code(), null, ctx, start, 0);
            throw e;
        } catch (GatewayException e) {
            // Well-formed but unacceptable request; the session stays usable.
            audit(protocol, null, null, null, AccessEvent.Outcome.REJECTED, e.code(), null, ctx, start, 0);
            adapter.frameError(e, out);
            return new ProxyResult(AccessEvent.Outcome.REJECTED, e.code(), 0);
        }

        AuthorizationResult grant;
        try {
            grant = resolver.authorize(new AuthorizationRequest(creds, operation,
                    adapter.acceptedTypes(request), adapter.acceptsDatasetLinks(request),
                    adapter.acceptsDirectTokens(request)));
        } catch (GatewayException e) {
            audit(protocol, null, null, operation, AccessEvent.Outcome.REJECTED, e.code(), null, ctx, start, 0);
            adapter.frameError(e, out);
            return new ProxyResult(AccessEvent.Outcome.REJECTED, e.code(), 0);
        }

        try (grant) {
            B result;
            try {
                result = invoke(adapter, backend, request, grant);
            } catch (GatewayException e) {
                log.warn("{} backend call failed connector={} op={} code={}: {}",
                        protocol.id(), grant.connectorId(), grant.operation(), e.code(), e.getMessage());
                audit(protocol, grant, grant.operation(), AccessEvent.Outcome.FAILED, e.code(), ctx, start, 0);
                adapter.frameError(e, out);
                return new ProxyResult(AccessEvent.Outcome.FAILED, e.code(), 0);
            }

            long bytes;
            try {
                bytes = adapter.frameResponse(result, out);
            } catch (IOException | RuntimeException e) {
                audit(protocol, grant, grant.operation(), AccessEvent.Outcome.FAILED,
                        e instanceof GatewayException ge ? ge.code() : null, ctx, start, 0);
                throw e;
            } finally {
                closeResult(result);
            }
            audit(protocol, grant, grant.operation(), AccessEvent.Outcome.SUCCEEDED, null, ctx, start, bytes);
            return new ProxyResult(AccessEvent.Outcome.SUCCEEDED, null, bytes);
        }
    }

    /**
     * Login-time check for wire protocols. Nothing is consumed; failures are audited and rethrown.
     */
    public AuthorizationResult authenticate(Protocol protocol, ClientCredentials creds, ClientContext ctx) {
        long start = System.nanoTime();
        try {
            return resolver.authenticate(new AuthorizationRequest(creds, null, protocol.connectorTypes(), false));
        } catch (GatewayException e) {
            if (e.code() != ErrorCode.PASSWORD_REQUIRED) {
                audit(protocol, null, null, "LOGIN", AccessEvent.Outcome.REJECTED, e.code(), null, ctx, start, 0);
            }
            throw e;
        }
    }

    /** Records a request the listener answered without the pipeline, such as a failed local parse. */
    public void recordRejected(Protocol protocol, String operation, ErrorCode code, ClientContext ctx) {
        audit(protocol, null, null, operation, AccessEvent.Outcome.REJECTED, code, null, ctx, System.nanoTime(), 0);
    }

    private <Q, B> B invoke(ProtocolAdapter<Q, B, ?> adapter, BackendInvoker<Q, B> backend, Q request,
                            AuthorizationResult grant) {
        try {
            return call(backend, request, grant);
        } catch (GatewayException e) {
            if (!e.code().isTransient() || !adapter.isReadOnly(grant.operation())) {
                throw e;
            }
            log.debug("Retrying read-only {} on connector {} after {}", grant.operation(), grant.connectorId(), e.code());
            sleep(retryBackoff);
            return call(backend, request, grant);
        }
    }

    private static <Q, B> B call(BackendInvoker<Q, B> backend, Q request, AuthorizationResult grant) {
        try {
            return backend.invoke(request, grant);
        } catch (GatewayException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new GatewayException(ErrorCode.BACKEND_UNREACHABLE, "backend call failed: " + e, e);
        }
    }

    private static void closeResult(Object result) {
        if (result instanceof AutoCloseable c) {
            try {
                c.close();
            } catch (Exception e) {
                log.debug("Closing backend result failed: {}", e.toString());
            }
        }
    }

    private static void sleep(Duration d) {
        try {
            Thread.sleep(d.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GatewayException(ErrorCode.BACKEND_TIMEOUT, "interrupted while waiting to retry", e);
        }
    }

    private void audit(Protocol protocol, AuthorizationResult grant, String operation, AccessEvent.Outcome outcome,
                       ErrorCode code, ClientContext ctx, long startNanos, long bytes) {
        audit(protocol, grant.connectorId(), grant.shareId(), operation, outcome, code, grant.callerName(),
                ctx, startNanos, bytes);
    }

    private void audit(Protocol protocol, String connectorId, String shareId, String operation,
                       AccessEvent.Outcome outcome, ErrorCode code, String caller, ClientContext ctx,
                       long startNanos, long bytes) {
        long latencyMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
        usage.recordOutcome(new AccessEvent(clock.instant(), protocol.id(), connectorId, shareId, operation,
                outcome, code, caller, ctx == null ? null : ctx.remoteAddress(), latencyMs, bytes));
    }
}
