package com.vcfops.client.transport;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** One outbound request. {@code url} is absolute and already encoded; {@code body} is null for GET. */
public record ApiRequest(ApiMethod method, String url, Map<String, String> headers, byte[] body) {

    public static final String CONTENT_TYPE = "Content-Type";
    public static final String ACCEPT = "Accept";
    public static final String AUTHORIZATION = "Authorization";
    public static final String APPLICATION_JSON = "application/json";

    public ApiRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(url, "url");
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static ApiRequest get(String url) {
        return new ApiRequest(ApiMethod.GET, url, Map.of(ACCEPT, APPLICATION_JSON), null);
    }

    public static ApiRequest postJson(String url, byte[] body) {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put(ACCEPT, APPLICATION_JSON);
        headers.put(CONTENT_TYPE, APPLICATION_JSON);
        return new ApiRequest(ApiMethod.POST, url, headers, Objects.requireNonNull(body, "body"));
    }

    public ApiRequest withHeader(String name, String value) {
        Map<String, String> next = new LinkedHashMap<>(headers);
        next.put(name, value);
        return new ApiRequest(method, url, next, body);
    }

    public String header(String name) {
        for (var e : headers.entrySet()) {
            if (e.getKey().equalsIgnoreCase(name)) return e.getValue();
        }
        return null;
    }

    public String bodyAsString() {
        return body == null ? "" : new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        // headers carry the session token
        return "ApiRequest[" + method + " " + url + "]";
    }
}
