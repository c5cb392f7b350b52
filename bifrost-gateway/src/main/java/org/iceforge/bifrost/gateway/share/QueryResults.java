package org.iceforge.bifrost.gateway.share;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;
import org.iceforge.bifrost.gateway.http.HttpPayload;
import org.iceforge.bifrost.gateway.jdbc.JdbcResult;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Renders a relational result as {@code {status, columns, data, row_count}} JSON. */
final class QueryResults {
    private QueryResults() {}

    static HttpPayload toJson(JdbcResult result, ObjectMapper json, long maxBytes) {
        Map<String, Object> body = new LinkedHashMap<>();
        int status = 200;
        if (result.isError()) {
            SQLException e = result.error();
            body.put("status", "error");
            body.put("error", e.getMessage());
            body.put("sql_state", e.getSQLState());
            status = 400;
        } else if (!result.hasRows()) {
            body.put("status", "success");
            body.put("update_count", result.updateCount());
        } else {
            try {
                readRows(result, body, maxBytes);
            } catch (SQLException e) {
                throw new GatewayException(ErrorCode.BACKEND_UNREACHABLE, "reading rows failed: " + e.getMessage(), e);
            }
        }
        return payload(status, body, json, maxBytes);
    }

    private static void readRows(JdbcResult result, Map<String, Object> body, long maxBytes) throws SQLException {
        ResultSet rs = result.resultSet();
        ResultSetMetaData md = rs.getMetaData();
        int n = md.getColumnCount();
        List<String> columns = new ArrayList<>(n);
        for (int i = 1; i <= n; i++) {
            columns.add(md.getColumnLabel(i));
        }
        List<List<Object>> rows = new ArrayList<>();
        long estimate = 0;
        while (rs.next()) {
            List<Object> row = new ArrayList<>(n);
            for (int i = 1; i <= n; i++) {
                Object v = value(rs.getObject(i));
                estimate += v == null ? 4 : String.valueOf(v).length() + 3;
                row.add(v);
            }
            if (estimate > maxBytes) {
                throw new GatewayException(ErrorCode.RESPONSE_TOO_LARGE, "result exceeds " + maxBytes + " bytes");
            }
            rows.add(row);
        }
        result.markConsumed();
        body.put("status", "success");
        body.put("columns", columns);
        body.put("data", rows);
        body.put("row_count", rows.size());
    }

    /** Numbers, booleans, strings and bytes pass through; anything else is rendered as text. */
    static Object value(Object v) {
        if (v == null || v instanceof Number || v instanceof Boolean || v instanceof String || v instanceof byte[]) {
            return v;
        }
        return String.valueOf(v);
    }

    static HttpPayload payload(int status, Object body, ObjectMapper json, long maxBytes) {
        byte[] bytes;
        try {
            bytes = json.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize response", e);
        }
        if (bytes.length > maxBytes) {
            throw new GatewayException(ErrorCode.RESPONSE_TOO_LARGE, "result exceeds " + maxBytes + " bytes");
        }
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        return new HttpPayload(status, h, bytes);
    }
}
