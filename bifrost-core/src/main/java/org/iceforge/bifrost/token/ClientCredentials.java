package org.iceforge.bifrost.token;

/**
 * What a client presented: the bearer token (connector access token or share id), an
 * optional link password and an optional identity token.
 */
public record ClientCredentials(String token, String password, String identityToken) {

    public static ClientCredentials ofToken(String token) {
        return new ClientCredentials(token, null, null);
    }

    public ClientCredentials withPassword(String newPassword) {
        return new ClientCredentials(token, newPassword, identityToken);
    }

    public boolean hasToken() {
        return token != null && !token.isBlank();
    }

    @Override
    public String toString() {
        return "ClientCredentials[token=" + mask(token) + ", password=" + (password == null ? "none" : "***")
                + ", identity=" + (identityToken == null ? "none" : "***") + "]";
    }

    /** First four characters only; enough to correlate log lines. */
    public static String mask(String token) {
        if (token == null || token.isEmpty()) return "<none>";
        return token.length() <= 4 ? "****" : token.substring(0, 4) + "****";
    }
}
