package org.iceforge.bifrost.gateway.http;

import org.iceforge.bifrost.error.MalformedRequestException;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;

/**
 * Where an HTTP connector's requests go, and the headers that carry its real credentials.
 *
 * @param baseUrl backend root, without a trailing slash
 * @param headers set on every forwarded request, replacing anything the client sent
 */
public record HttpEndpoint(String baseUrl, Map<String, String> headers) {

    public HttpEndpoint {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new IllegalArgumentException("baseUrl is required");
        }
        baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    /** Appends an already encoded path and query to the base URL. */
    public URI resolve(String rawPath, String encodedQuery) {
        StringBuilder sb = new StringBuilder(baseUrl);
        sb.append(checkedPath(rawPath));
        if (encodedQuery != null && !encodedQuery.isEmpty()) {
            sb.append('?').append(encodedQuery);
        }
        return URI.create(sb.toString());
    }

    /**
     * A client path as it may be appended to a base URL. It must be rooted (a '/' is prepended
     * otherwise), parse as nothing but a URI path, and hold no {@code .} or {@code ..} segment,
     * plain or percent-encoded. Empty stays empty.
     *
     * @throws MalformedRequestException for anything else
     */
    public static String checkedPath(String rawPath) {
        if (rawPath == null || rawPath.isEmpty()) {
            return "";
        }
        String path = rawPath.startsWith("/") ? rawPath : "/" + rawPath;
        for (String segment : path.split("/", -1)) {
            String s = segment.toLowerCase(Locale.ROOT).replace("%2e", ".");
            if (s.equals(".") || s.equals("..")) {
                throw new MalformedRequestException("dot segments are not allowed in the path");
            }
        }
        try {
            if (!path.equals(new URI(path).getRawPath())) {
                throw new MalformedRequestException("path is not a plain URI path");
            }
        } catch (URISyntaxException e) {
            throw new MalformedRequestException("path is not a valid URI path", e);
        }
        return path;
    }
}
