package org.iceforge.bifrost.gateway.mysql;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MySqlSessionVariablesTest {

    @Test
    void cliVersionCommentQuery() {
        var answer = MySqlSessionVariables.answer("select @@version_comment limit 1").orElseThrow();
        assertThat(answer.columns()).containsExactly("@@version_comment");
        assertThat(answer.values()).containsExactly("Bifrost gateway");
    }

    @Test
    void driverVariablesWithAliases() {
        var answer = MySqlSessionVariables.answer(
                "/* mysql-connector-j */ SELECT @@session.auto_increment_increment AS auto_increment_increment, "
                        + "@@character_set_client AS character_set_client").orElseThrow();
        assertThat(answer.columns()).containsExactly("auto_increment_increment", "character_set_client");
        assertThat(answer.values()).containsExactly("1", "utf8mb4");
    }

    @Test
    void sessionSetupStatementsAreAcknowledged() {
        assertThat(MySqlSessionVariables.answer("SET NAMES utf8mb4;").orElseThrow().isOk()).isTrue();
        assertThat(MySqlSessionVariables.answer("use sales").orElseThrow().isOk()).isTrue();
        assertThat(MySqlSessionVariables.answer("SHOW WARNINGS").orElseThrow().columns())
                .containsExactly("Level", "Code", "Message");
    }

    @Test
    void realQueriesAreNotLocal() {
        assertThat(MySqlSessionVariables.answer("SELECT 1")).isEmpty();
        assertThat(MySqlSessionVariables.answer("SELECT @@version, name FROM users")).isEmpty();
        assertThat(MySqlSessionVariables.answer("SHOW TABLES")).isEmpty();
        assertThat(MySqlSessionVariables.answer("DELETE FROM users")).isEmpty();
    }
}
