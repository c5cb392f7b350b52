package org.iceforge.bifrost.gateway.http;

import org.iceforge.bifrost.vault.ConnectorSecrets;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;

/**
 * Backend credential injection for generic API connectors.
 *
 * <p>{@code api_key} goes into {@code auth_header} (default {@code Authorization}) with
 * {@code auth_prefix} (default {@code Bearer}); an empty prefix sends the bare key. Without an
 * API key, {@code username}/{@code password} become HTTP Basic.
 */
public final class ApiCredentials {
    private ApiCredentials() {
    }

    public static HttpEndpoint endpoint(ConnectorSecrets secrets) {
        Map<String, String> headers = new HashMap<>();
        String apiKey = secrets.get("api_key").orElse(null);
        if (apiKey != null && !apiKey.isBlank()) {
            String header = secrets.getOrDefault("auth_header", "Authorization");
            String prefix = secrets.getOrDefault("auth_prefix", "Bearer");
            headers.put(header, prefix.isBlank() ? apiKey : prefix + " " + apiKey);
        } else if (secrets.get("username").isPresent()) {
            headers.put("Authorization", basic(secrets.require("username"), secrets.getOrDefault("password", "")));
        }
        return new HttpEndpoint(secrets.require("base_url"), headers);
    }

    public static String basic(String user, String password) {
        String raw = user + ":" + (password == null ? "" : password);
        return "Basic " + Base64.getEncoder().encodeToString(raw.getBytes(StandardCharsets.UTF_8));
    }
}
