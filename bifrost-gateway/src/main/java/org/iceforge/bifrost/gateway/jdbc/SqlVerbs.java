package org.iceforge.bifrost.gateway.jdbc;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Extracts the SQL keyword that operation allow-lists are written against.
 *
 * <p>Statement boundaries are found twice, once with MySQL lexing (backslash escapes,
 * {@code #} comments, executable {@code /*! ... *}{@code /} comments) and once with
 * PostgreSQL lexing (standard strings, {@code E''} escapes, dollar quotes, nested comments).
 * A query only passes when both agree it holds a single, fully terminated statement.
 */
public final class SqlVerbs {
    private SqlVerbs() {}

    private static final Set<String> READ_ONLY = Set.of("SELECT", "SHOW", "DESCRIBE", "EXPLAIN", "WITH", "VALUES");

    // Keywords that make a WITH or EXPLAIN statement change data.
    private static final Set<String> DATA_CHANGING = Set.of(
            "INSERT", "UPDATE", "DELETE", "MERGE", "CREATE", "DROP", "ALTER", "TRUNCATE");

    private static final int UNTERMINATED = -1;

    /**
     * The operation to authorize {@code sql} as: its leading verb, or for {@code WITH} and
     * {@code EXPLAIN} the first data-changing keyword inside it.
     *
     * @throws GatewayException {@code INVALID_ARGUMENT} when the query holds more than one
     *         statement or leaves a quote or comment open
     */
    public static String operation(String sql) {
        if (sql == null) return "";
        List<String> words = new ArrayList<>();
        int mysql = scan(sql, true, words);
        int postgres = scan(sql, false, words);
        if (mysql == UNTERMINATED || postgres == UNTERMINATED) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "unterminated quote or comment");
        }
        if (Math.max(mysql, postgres) > 1) {
            throw new GatewayException(ErrorCode.INVALID_ARGUMENT, "only one statement per query is accepted");
        }
        String verb = verb(sql);
        if (verb.equals("WITH") || verb.equals("EXPLAIN")) {
            for (String w : words) {
                if (DATA_CHANGING.contains(w)) return w;
            }
        }
        return verb;
    }

    /** Non-empty statements in {@code sql} under the stricter lexing, or -1 if something is left open. */
    static int statementCount(String sql) {
        int mysql = scan(sql, true, null);
        int postgres = scan(sql, false, null);
        return mysql == UNTERMINATED || postgres == UNTERMINATED ? UNTERMINATED : Math.max(mysql, postgres);
    }

    /**
     * First keyword after whitespace, comments and opening parentheses, upper-cased.
     * {@code DESC} is reported as {@code DESCRIBE}. Empty for blank input.
     */
    public static String verb(String sql) {
        if (sql == null) return "";
        int n = sql.length();
        int i = skipPreamble(sql, 0, true);
        int start = i;
        while (i < n && Character.isLetter(sql.charAt(i))) i++;
        String word = sql.substring(start, i).toUpperCase(Locale.ROOT);
        return word.equals("DESC") ? "DESCRIBE" : word;
    }

    /** The statement without leading whitespace and comments, such as a driver's tag comment. */
    public static String stripLeadingComments(String sql) {
        if (sql == null) return "";
        return sql.substring(skipPreamble(sql, 0, false));
    }

    private static int skipPreamble(String sql, int from, boolean parens) {
        int i = from;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (Character.isWhitespace(c) || (parens && c == '(')) {
                i++;
            } else if ((c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') || c == '#') {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? n : eol + 1;
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
            } else {
                break;
            }
        }
        return i;
    }

    public static boolean isReadOnly(String verb) {
        return verb != null && READ_ONLY.contains(verb.toUpperCase(Locale.ROOT));
    }

    private static int scan(String sql, boolean mysql, List<String> words) {
        int n = sql.length();
        int statements = 0;
        boolean content = false;
        int i = 0;
        while (i < n) {
            char c = sql.charAt(i);
            char next = i + 1 < n ? sql.charAt(i + 1) : 0;
            if (c == ';') {
                if (content) statements++;
                content = false;
                i++;
            } else if (Character.isWhitespace(c)) {
                i++;
            } else if ((c == '-' && next == '-' && (!mysql || i + 2 >= n || Character.isWhitespace(sql.charAt(i + 2))))
                    || (mysql && c == '#')) {
                int eol = sql.indexOf('\n', i);
                i = eol < 0 ? n : eol + 1;
            } else if (c == '/' && next == '*') {
                if (mysql && i + 2 < n && sql.charAt(i + 2) == '!') {
                    // MySQL runs the body of an executable comment.
                    i += 3;
                    while (i < n && Character.isDigit(sql.charAt(i))) i++;
                } else {
                    i = mysql ? closeComment(sql, i) : closeNestedComment(sql, i);
                    if (i < 0) return UNTERMINATED;
                }
            } else if (mysql && c == '*' && next == '/') {
                i += 2;
            } else if (c == '\'' || c == '"' || (mysql && c == '`')) {
                boolean escapes = mysql ? c != '`' : c == '\'' && isEscapeStringPrefix(sql, i);
                i = closeQuote(sql, i, c, escapes);
                if (i < 0) return UNTERMINATED;
                content = true;
            } else if (!mysql && c == '$' && (i == 0 || !isWordChar(sql.charAt(i - 1))) && dollarTagEnd(sql, i) > 0) {
                String tag = sql.substring(i, dollarTagEnd(sql, i) + 1);
                int close = sql.indexOf(tag, i + tag.length());
                if (close < 0) return UNTERMINATED;
                i = close + tag.length();
                content = true;
            } else if (Character.isLetter(c) || c == '_') {
                int start = i;
                while (i < n && isWordChar(sql.charAt(i))) i++;
                if (words != null) words.add(sql.substring(start, i).toUpperCase(Locale.ROOT));
                content = true;
            } else {
                content = true;
                i++;
            }
        }
        return content ? statements + 1 : statements;
    }

    private static int closeQuote(String sql, int open, char quote, boolean escapes) {
        int n = sql.length();
        int j = open + 1;
        while (j < n) {
            char ch = sql.charAt(j);
            if (escapes && ch == '\\') {
                j += 2;
            } else if (ch == quote) {
                if (j + 1 < n && sql.charAt(j + 1) == quote) {
                    j += 2;
                } else {
                    return j + 1;
                }
            } else {
                j++;
            }
        }
        return UNTERMINATED;
    }

    private static int closeComment(String sql, int open) {
        int end = sql.indexOf("*/", open + 2);
        return end < 0 ? UNTERMINATED : end + 2;
    }

    private static int closeNestedComment(String sql, int open) {
        int depth = 1;
        int j = open + 2;
        while (j < sql.length()) {
            if (sql.startsWith("/*", j)) {
                depth++;
                j += 2;
            } else if (sql.startsWith("*/", j)) {
                j += 2;
                if (--depth == 0) return j;
            } else {
                j++;
            }
        }
        return UNTERMINATED;
    }

    /** {@code E'...'} strings honour backslash escapes in PostgreSQL. */
    private static boolean isEscapeStringPrefix(String sql, int quote) {
        if (quote == 0) return false;
        char p = sql.charAt(quote - 1);
        return (p == 'E' || p == 'e') && (quote == 1 || !isWordChar(sql.charAt(quote - 2)));
    }

    /** Index of the closing {@code $} of a dollar-quote tag opening at {@code i}, or -1. */
    private static int dollarTagEnd(String sql, int i) {
        int n = sql.length();
        int j = i + 1;
        if (j < n && sql.charAt(j) == '$') return j;
        if (j >= n || !(Character.isLetter(sql.charAt(j)) || sql.charAt(j) == '_')) return -1;
        while (j < n && (Character.isLetterOrDigit(sql.charAt(j)) || sql.charAt(j) == '_')) j++;
        return j < n && sql.charAt(j) == '$' ? j : -1;
    }

    private static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }
}
