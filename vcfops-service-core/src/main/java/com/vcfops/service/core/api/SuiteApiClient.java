package com.vcfops.service.core.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcfops.client.transport.ApiMethod;
import com.vcfops.client.transport.ApiRequest;
import com.vcfops.client.transport.ApiResponse;
import com.vcfops.client.transport.ApiTransport;
import com.vcfops.core.error.UpstreamException;
import com.vcfops.core.model.OpsInstance;
import com.vcfops.service.core.auth.OpsToken;
import com.vcfops.service.core.auth.TokenAuthenticator;
import java.io.IOException;
import lombok.extern.slf4j.Slf4j;

/**
 * Authenticated JSON calls against one instance's {@code /suite-api/api} surface.
 *
 * <p>A 401 answer drops the token that was used, re-authenticates and repeats the call once. Any other non-2xx
 * answer, transport failure or unreadable body surfaces as {@link UpstreamException}.
 */
@Slf4j
public class SuiteApiClient {
    private final ApiTransport transport;
    private final TokenAuthenticator authenticator;
    private final ObjectMapper json;
    private final String authScheme;

    public SuiteApiClient(ApiTransport transport, TokenAuthenticator authenticator, ObjectMapper json, String authScheme) {
        this.transport = transport;
        this.authenticator = authenticator;
        this.json = json;
        this.authScheme = authScheme == null || authScheme.isBlank() ? "Bearer" : authScheme.trim();
    }

    public <T> T get(OpsInstance instance, String path, QueryParams query, Class<T> type) {
        String url = instance.apiRoot() + path;
        if (query != null && !query.isEmpty()) {
            url = url + "?" + query.toQueryString();
        }
        ApiResponse response = exchange(instance, ApiRequest.get(url), path);
        return read(instance, ApiMethod.GET, path, response, type);
    }

    public <T> T post(OpsInstance instance, String path, Object body, Class<T> type) {
        byte[] payload;
        try {
            payload = json.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Request body for " + path + " is not serializable", e);
        }
        ApiResponse response = exchange(instance, ApiRequest.postJson(instance.apiRoot() + path, payload), path);
        return read(instance, ApiMethod.POST, path, response, type);
    }

    private ApiResponse exchange(OpsInstance instance, ApiRequest request, String path) {
        OpsToken token = authenticator.getToken(instance);
        ApiResponse response = send(instance, request, token, path);
        if (response.statusCode() == 401) {
            log.warn(
                    "VCF Operations instance {} rejected token on {} {}, re-authenticating",
                    instance.name(),
                    request.method(),
                    path);
            authenticator.invalidate(instance, token);
            response = send(instance, request, authenticator.getToken(instance), path);
        }
        if (!response.isSuccessful()) {
            log.warn(
                    "VCF Operations request {} {} on {} failed with HTTP {}",
                    request.method(),
                    path,
                    instance.name(),
                    response.statusCode());
            throw new UpstreamException(
                    instance.name(), request.method().name(), path, response.statusCode(), response.bodyAsString());
        }
        return response;
    }

    private ApiResponse send(OpsInstance instance, ApiRequest request, OpsToken token, String path) {
        try {
            return transport.execute(request.withHeader(ApiRequest.AUTHORIZATION, authScheme + " " + token.value()));
        } catch (IOException e) {
            log.warn(
                    "VCF Operations request {} {} on {} could not be sent: {}",
                    request.method(),
                    path,
                    instance.name(),
                    e.toString());
            throw new UpstreamException(instance.name(), request.method().name(), path, "instance unreachable", e);
        }
    }

    private <T> T read(OpsInstance instance, ApiMethod method, String path, ApiResponse response, Class<T> type) {
        try {
            return json.readValue(response.body(), type);
        } catch (IOException e) {
            throw new UpstreamException(instance.name(), method.name(), path, "unreadable response body", e);
        }
    }
}
