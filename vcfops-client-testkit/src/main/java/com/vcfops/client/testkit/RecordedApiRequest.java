package com.vcfops.client.testkit;

import com.vcfops.client.transport.ApiMethod;
import com.vcfops.client.transport.ApiRequest;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/** A request seen by {@link InMemoryApiTransport}, with decoded URL accessors. */
public final class RecordedApiRequest {
    private final ApiRequest request;
    private final URI uri;

    RecordedApiRequest(ApiRequest request) {
        this.request = request;
        this.uri = URI.create(request.url());
    }

    public ApiMethod method() {
        return request.method();
    }

    public String url() {
        return request.url();
    }

    /** Scheme, host, port and path; no query string. */
    public String endpoint() {
        return uri.getScheme() + "://" + uri.getRawAuthority() + uri.getPath();
    }

    public String path() {
        return uri.getPath();
    }

    public String header(String name) {
        return request.header(name);
    }

    public String body() {
        return request.bodyAsString();
    }

    public String queryParameter(String name) {
        List<String> values = queryParameters(name);
        return values.isEmpty() ? null : values.get(0);
    }

    public List<String> queryParameters(String name) {
        List<String> out = new ArrayList<>();
        String raw = uri.getRawQuery();
        if (raw == null || raw.isEmpty()) return out;
        for (String pair : raw.split("&")) {
            int eq = pair.indexOf('=');
            String key = decode(eq < 0 ? pair : pair.substring(0, eq));
            if (key.equals(name)) {
                out.add(eq < 0 ? "" : decode(pair.substring(eq + 1)));
            }
        }
        return out;
    }

    public ApiRequest request() {
        return request;
    }

    private static String decode(String s) {
        return URLDecoder.decode(s, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return method() + " " + url();
    }
}
