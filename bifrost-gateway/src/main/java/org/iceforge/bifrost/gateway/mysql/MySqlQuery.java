package org.iceforge.bifrost.gateway.mysql;

import org.iceforge.bifrost.token.ClientCredentials;

record MySqlQuery(ClientCredentials credentials, String sql) {
}
