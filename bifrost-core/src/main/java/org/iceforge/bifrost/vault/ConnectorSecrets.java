package org.iceforge.bifrost.vault;

import org.iceforge.bifrost.error.ErrorCode;
import org.iceforge.bifrost.error.GatewayException;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decrypted connection configuration and credentials of one connector.
 *
 * <p>Plain key/value strings (host, port, username, password, api_key, bucket...). Only
 * reachable through {@link CredentialHandle#withSecrets}; {@link #toString()} lists keys only.
 */
public final class ConnectorSecrets {
    private final Map<String, String> values;

    private ConnectorSecrets(Map<String, String> values) {
        this.values = values;
    }

    public static ConnectorSecrets of(Map<String, String> values) {
        Map<String, String> copy = new LinkedHashMap<>();
        if (values != null) {
            values.forEach((k, v) -> {
                if (k != null && v != null) copy.put(k, v);
            });
        }
        return new ConnectorSecrets(Map.copyOf(copy));
    }

    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key)).filter(v -> !v.isBlank());
    }

    public String getOrDefault(String key, String fallback) {
        return get(key).orElse(fallback);
    }

    /** A key the backend cannot work without; its absence means the connector is misconfigured. */
    public String require(String key) {
        return get(key).orElseThrow(() -> new GatewayException(ErrorCode.CONNECTOR_UNAVAILABLE,
                "connector configuration is missing '" + key + "'"));
    }

    public int getInt(String key, int fallback) {
        Optional<String> v = get(key);
        if (v.isEmpty()) return fallback;
        try {
            return Integer.parseInt(v.get().trim());
        } catch (NumberFormatException e) {
            throw new GatewayException(ErrorCode.CONNECTOR_UNAVAILABLE,
                    "connector configuration '" + key + "' is not a number", e);
        }
    }

    public boolean getBoolean(String key, boolean fallback) {
        return get(key).map(v -> v.equalsIgnoreCase("true") || v.equals("1")).orElse(fallback);
    }

    public Set<String> keys() {
        return values.keySet();
    }

    Map<String, String> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "ConnectorSecrets[keys=" + values.keySet() + "]";
    }
}
