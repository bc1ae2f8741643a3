package com.vcfops.service.core.api;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/** Ordered query parameters. Null values are skipped; repeated names are kept. */
public final class QueryParams {
    private final List<Map.Entry<String, String>> entries = new ArrayList<>();

    public static QueryParams create() {
        return new QueryParams();
    }

    public QueryParams add(String name, Object value) {
        if (value != null) {
            entries.add(Map.entry(name, String.valueOf(value)));
        }
        return this;
    }

    public QueryParams addAll(String name, Collection<?> values) {
        if (values != null) {
            values.forEach(v -> add(name, v));
        }
        return this;
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /** Encoded form without the leading {@code ?}. */
    public String toQueryString() {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : entries) {
            if (sb.length() > 0) sb.append('&');
            sb.append(encode(e.getKey())).append('=').append(encode(e.getValue()));
        }
        return sb.toString();
    }

    /** Percent-encodes a single path segment or query component. */
    public static String encode(String raw) {
        return URLEncoder.encode(raw, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
