package org.iceforge.bifrost.audit;

import org.iceforge.bifrost.CoreFixture;
import org.iceforge.bifrost.error.ErrorCode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.Statement;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class JdbcAccessLogSinkTest {

    private final CoreFixture fx = new CoreFixture();

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void appendedEvents_landInAccessLog() throws Exception {
        try (JdbcAccessLogSink sink = new JdbcAccessLogSink(fx.dataSource, 100)) {
            sink.append(new AccessEvent(fx.clock.instant(), "s3", "c1", null, "GET",
                    AccessEvent.Outcome.SUCCEEDED, null, null, "10.1.1.1:9", 12, 2048));
            sink.append(new AccessEvent(fx.clock.instant(), "s3", "c1", "l1", "PUT",
                    AccessEvent.Outcome.REJECTED, ErrorCode.OPERATION_NOT_ALLOWED, "dan", null, 1, 0));

            assertThat(sink.awaitDrained(Duration.ofSeconds(10))).isTrue();
        }

        try (Connection conn = fx.dataSource.getConnection();
             Statement st = conn.createStatement();
             ResultSet rs = st.executeQuery(
                     "SELECT operation, outcome, error_code, caller, response_bytes FROM access_log ORDER BY id")) {
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString("operation")).isEqualTo("GET");
            assertThat(rs.getString("caller")).isEqualTo(AccessEvent.ANONYMOUS);
            assertThat(rs.getLong("response_bytes")).isEqualTo(2048);
            assertThat(rs.next()).isTrue();
            assertThat(rs.getString("error_code")).isEqualTo("OPERATION_NOT_ALLOWED");
            assertThat(rs.getString("caller")).isEqualTo("dan");
            assertThat(rs.next()).isFalse();
        }
    }
}
