package org.iceforge.bifrost.gateway.pgwire;

import org.iceforge.bifrost.token.ClientCredentials;

/** One statement from a logged-in session, with the credentials it was opened with. */
record PgQuery(ClientCredentials credentials, String sql) {
}
