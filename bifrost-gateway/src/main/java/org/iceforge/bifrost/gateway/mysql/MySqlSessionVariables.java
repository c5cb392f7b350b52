package org.iceforge.bifrost.gateway.mysql;

import org.iceforge.bifrost.gateway.jdbc.SqlVerbs;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Statements that drivers and the mysql CLI issue while setting up a session. They are
 * answered from fixed server variables and never reach a backend.
 */
final class MySqlSessionVariables {

    private static final Pattern VARIABLE = Pattern.compile(
            "@@(?:(?:session|global|local)\\.)?([a-z_0-9]+)(?:\\s+(?:as\\s+)?([`'\"]?)([a-z_0-9]+)\\2)?",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_LIMIT = Pattern.compile("\\s+limit\\s+\\d+\\s*$", Pattern.CASE_INSENSITIVE);

    static final Map<String, String> DEFAULTS = Map.ofEntries(
            Map.entry("version", MySqlMessages.SERVER_VERSION),
            Map.entry("version_comment", "Bifrost gateway"),
            Map.entry("auto_increment_increment", "1"),
            Map.entry("autocommit", "1"),
            Map.entry("character_set_client", "utf8mb4"),
            Map.entry("character_set_connection", "utf8mb4"),
            Map.entry("character_set_results", "utf8mb4"),
            Map.entry("character_set_server", "utf8mb4"),
            Map.entry("collation_connection", "utf8mb4_general_ci"),
            Map.entry("collation_server", "utf8mb4_general_ci"),
            Map.entry("init_connect", ""),
            Map.entry("interactive_timeout", "28800"),
            Map.entry("license", "GPL"),
            Map.entry("lower_case_table_names", "0"),
            Map.entry("max_allowed_packet", "67108864"),
            Map.entry("net_buffer_length", "16384"),
            Map.entry("net_write_timeout", "60"),
            Map.entry("performance_schema", "0"),
            Map.entry("query_cache_size", "0"),
            Map.entry("query_cache_type", "OFF"),
            Map.entry("sql_mode", "ONLY_FULL_GROUP_BY,STRICT_TRANS_TABLES,NO_ENGINE_SUBSTITUTION"),
            Map.entry("system_time_zone", "UTC"),
            Map.entry("time_zone", "SYSTEM"),
            Map.entry("transaction_isolation", "REPEATABLE-READ"),
            Map.entry("tx_isolation", "REPEATABLE-READ"),
            Map.entry("transaction_read_only", "0"),
            Map.entry("tx_read_only", "0"),
            Map.entry("wait_timeout", "28800"));

    /** A local answer: an OK packet when {@code columns} is null, else a one-row resultset. */
    record Answer(String[] columns, String[] values) {
        static Answer ok() {
            return new Answer(null, null);
        }

        boolean isOk() {
            return columns == null;
        }
    }

    private MySqlSessionVariables() {
    }

    static Optional<Answer> answer(String sql) {
        String s = SqlVerbs.stripLeadingComments(sql).trim();
        while (s.endsWith(";")) s = s.substring(0, s.length() - 1).trim();
        String verb = SqlVerbs.verb(s);
        switch (verb) {
            case "SET", "USE", "BEGIN", "START", "COMMIT", "ROLLBACK" -> {
                return Optional.of(Answer.ok());
            }
            case "SHOW" -> {
                String what = s.substring(4).trim().toUpperCase(Locale.ROOT);
                if (what.equals("WARNINGS") || what.equals("ERRORS")) {
                    return Optional.of(new Answer(new String[]{"Level", "Code", "Message"}, null));
                }
                return Optional.empty();
            }
            case "SELECT" -> {
                return selectVariables(s.substring(6));
            }
            default -> {
                return Optional.empty();
            }
        }
    }

    /** {@code SELECT @@a, @@session.b AS c [LIMIT n]}; anything else is not local. */
    private static Optional<Answer> selectVariables(String list) {
        String body = TRAILING_LIMIT.matcher(list).replaceFirst("").trim();
        if (body.isEmpty()) return Optional.empty();
        List<String> columns = new ArrayList<>();
        List<String> values = new ArrayList<>();
        for (String item : body.split(",")) {
            String expr = item.trim();
            Matcher m = VARIABLE.matcher(expr);
            if (!m.matches()) return Optional.empty();
            String name = m.group(1).toLowerCase(Locale.ROOT);
            columns.add(m.group(3) != null ? m.group(3) : expr);
            values.add(DEFAULTS.getOrDefault(name, ""));
        }
        return Optional.of(new Answer(columns.toArray(String[]::new), values.toArray(String[]::new)));
    }
}
