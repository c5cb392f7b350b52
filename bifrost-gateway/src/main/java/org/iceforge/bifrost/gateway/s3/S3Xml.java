package org.iceforge.bifrost.gateway.s3;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;

/** The few S3 XML documents the listener produces. */
final class S3Xml {
    static final String CONTENT_TYPE = "application/xml";

    record Entry(String key, long size, Instant lastModified, String etag) {
    }

    private S3Xml() {
    }

    static byte[] error(String code, String message, String resource) {
        StringBuilder sb = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n<Error>");
        element(sb, "Code", code);
        element(sb, "Message", message);
        if (resource != null) element(sb, "Resource", resource);
        sb.append("</Error>");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    static byte[] listBucket(String prefix, List<Entry> entries, List<String> commonPrefixes, boolean truncated,
                             String nextToken, int maxKeys) {
        StringBuilder sb = new StringBuilder("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<ListBucketResult xmlns=\"http://s3.amazonaws.com/doc/2006-03-01/\">");
        element(sb, "Prefix", prefix == null ? "" : prefix);
        element(sb, "KeyCount", String.valueOf(entries.size() + commonPrefixes.size()));
        element(sb, "MaxKeys", String.valueOf(maxKeys));
        element(sb, "IsTruncated", String.valueOf(truncated));
        if (nextToken != null) element(sb, "NextContinuationToken", nextToken);
        for (Entry e : entries) {
            sb.append("<Contents>");
            element(sb, "Key", e.key());
            if (e.lastModified() != null) element(sb, "LastModified", e.lastModified().toString());
            if (e.etag() != null) element(sb, "ETag", e.etag());
            element(sb, "Size", String.valueOf(e.size()));
            sb.append("</Contents>");
        }
        for (String p : commonPrefixes) {
            sb.append("<CommonPrefixes>");
            element(sb, "Prefix", p);
            sb.append("</CommonPrefixes>");
        }
        sb.append("</ListBucketResult>");
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static void element(StringBuilder sb, String name, String value) {
        sb.append('<').append(name).append('>').append(escape(value)).append("</").append(name).append('>');
    }

    static String escape(String s) {
        StringBuilder out = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '<' -> out.append("&lt;");
                case '>' -> out.append("&gt;");
                case '&' -> out.append("&amp;");
                case '"' -> out.append("&quot;");
                case '\'' -> out.append("&apos;");
                default -> out.append(c);
            }
        }
        return out.toString();
    }
}
