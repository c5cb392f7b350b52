package org.iceforge.bifrost.pipeline;

import org.iceforge.bifrost.token.AuthorizationResult;

/**
 * Runs an authorized request against the backend.
 *
 * <p>Errors the backend itself reports (a SQL error, a 404) are results, not exceptions.
 * Connection problems are thrown as {@code GatewayException} with
 * {@code BACKEND_UNREACHABLE} or {@code BACKEND_TIMEOUT}.
 */
@FunctionalInterface
public interface BackendInvoker<Q, B> {

    B invoke(Q request, AuthorizationResult grant);
}
