package org.iceforge.bifrost.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Arrays;
import java.util.List;

/** Applies the bundled DDL. Every statement is idempotent, so this runs on each start. */
public final class SchemaInitializer {
    private static final Logger log = LoggerFactory.getLogger(SchemaInitializer.class);
    static final String SCHEMA_RESOURCE = "/org/iceforge/bifrost/store/schema.sql";

    private SchemaInitializer() {}

    public static void apply(DataSource dataSource) {
        List<String> statements = statements();
        try (Connection conn = dataSource.getConnection();
             Statement st = conn.createStatement()) {
            for (String sql : statements) {
                st.execute(sql);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to apply schema", e);
        }
        log.info("Store schema applied ({} statements)", statements.size());
    }

    static List<String> statements() {
        try (InputStream in = SchemaInitializer.class.getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            String ddl = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            return Arrays.stream(ddl.split(";"))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
