package org.iceforge.bifrost.gateway.jdbc;

import org.iceforge.bifrost.vault.ConnectorSecrets;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcUrlsTest {

    @Test
    void explicitUrlWins() {
        var secrets = ConnectorSecrets.of(Map.of("jdbc_url", "jdbc:h2:mem:x", "host", "ignored"));
        assertThat(JdbcUrls.forConnector(Dialect.POSTGRESQL, secrets)).isEqualTo("jdbc:h2:mem:x");
    }

    @Test
    void hostPortDatabaseWithDialectDefaults() {
        var secrets = ConnectorSecrets.of(Map.of("host", "db.internal", "database", "sales"));
        assertThat(JdbcUrls.forConnector(Dialect.MYSQL, secrets))
                .isEqualTo("jdbc:mysql://db.internal:3306/sales?sslMode=DISABLED");
        assertThat(JdbcUrls.forConnector(Dialect.POSTGRESQL, secrets))
                .isEqualTo("jdbc:postgresql://db.internal:5432/sales?sslmode=disable");
    }

    @Test
    void sslAndCustomPort() {
        var secrets = ConnectorSecrets.of(Map.of("host", "pg", "port", "6543", "ssl", "true"));
        assertThat(JdbcUrls.forConnector(Dialect.POSTGRESQL, secrets))
                .isEqualTo("jdbc:postgresql://pg:6543/?sslmode=require");
    }
}
