package org.iceforge.bifrost.gateway.pgwire;

import java.util.List;

/**
 * Inlines text-format Bind parameters into the statement, so the backend receives one
 * plain SQL string regardless of how the client prepared it.
 */
final class PgParameters {
    private PgParameters() {}

    /** Replaces {@code $n} outside quoted strings and identifiers with a quoted literal or NULL. */
    static String inline(String sql, List<String> values) {
        if (values.isEmpty()) return sql;
        StringBuilder out = new StringBuilder(sql.length() + values.size() * 8);
        int n = sql.length();
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = closingQuote(sql, i, c);
                out.append(sql, i, end);
                i = end;
            } else if (c == '$' && i + 1 < n && Character.isDigit(sql.charAt(i + 1))) {
                int j = i + 1;
                while (j < n && Character.isDigit(sql.charAt(j))) j++;
                int index = Integer.parseInt(sql.substring(i + 1, j)) - 1;
                if (index >= 0 && index < values.size()) {
                    out.append(literal(values.get(index)));
                } else {
                    out.append(sql, i, j);
                }
                i = j;
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    /** Number of distinct {@code $n} placeholders, taken as the highest n. */
    static int count(String sql) {
        int max = 0;
        int n = sql == null ? 0 : sql.length();
        for (int i = 0; i < n; i++) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                i = closingQuote(sql, i, c) - 1;
            } else if (c == '$' && i + 1 < n && Character.isDigit(sql.charAt(i + 1))) {
                int j = i + 1;
                while (j < n && Character.isDigit(sql.charAt(j))) j++;
                max = Math.max(max, Integer.parseInt(sql.substring(i + 1, j)));
                i = j - 1;
            }
        }
        return max;
    }

    private static String literal(String value) {
        return value == null ? "NULL" : "'" + value.replace("'", "''") + "'";
    }

    /** Index just past the quote that closes the one at {@code start}; doubled quotes are escapes. */
    private static int closingQuote(String sql, int start, char quote) {
        int i = start + 1;
        while (i < sql.length()) {
            if (sql.charAt(i) == quote) {
                if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
                    i += 2;
                    continue;
                }
                return i + 1;
            }
            i++;
        }
        return sql.length();
    }
}
