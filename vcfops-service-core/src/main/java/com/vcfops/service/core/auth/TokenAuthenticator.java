package com.vcfops.service.core.auth;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcfops.client.transport.ApiRequest;
import com.vcfops.client.transport.ApiResponse;
import com.vcfops.client.transport.ApiTransport;
import com.vcfops.core.error.AuthenticationException;
import com.vcfops.core.error.VcfOperationsException;
import com.vcfops.core.model.OpsInstance;
import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Exchanges instance credentials for session tokens and caches one token per instance.
 *
 * <p>Concurrent first requests for the same instance share a single exchange. A failed exchange caches nothing,
 * so the next request tries again.
 */
@Slf4j
@Service
public class TokenAuthenticator {
    static final String ACQUIRE_PATH = "/auth/token/acquire";

    private final ApiTransport transport;
    private final ObjectMapper json;
    private final Clock clock;
    private final Map<String, CompletableFuture<OpsToken>> tokens = new ConcurrentHashMap<>();

    public TokenAuthenticator(ApiTransport transport, ObjectMapper json, Clock clock) {
        this.transport = transport;
        this.json = json;
        this.clock = clock;
    }

    public OpsToken getToken(OpsInstance instance) {
        while (true) {
            CompletableFuture<OpsToken> pending = new CompletableFuture<>();
            CompletableFuture<OpsToken> existing = tokens.putIfAbsent(instance.name(), pending);
            if (existing == null) {
                return acquireInto(instance, pending);
            }
            OpsToken token = await(existing);
            if (!token.isStale(clock.instant())) {
                return token;
            }
            log.debug("Token for VCF Operations instance {} is past its validity", instance.name());
            tokens.remove(instance.name(), existing);
        }
    }

    /**
     * Drops {@code stale} from the cache. A token that already replaced it is left alone.
     */
    public void invalidate(OpsInstance instance, OpsToken stale) {
        tokens.computeIfPresent(instance.name(), (name, current) -> {
            if (current.isDone() && !current.isCompletedExceptionally() && current.join().equals(stale)) {
                return null;
            }
            return current;
        });
    }

    private OpsToken acquireInto(OpsInstance instance, CompletableFuture<OpsToken> pending) {
        try {
            OpsToken token = acquire(instance);
            pending.complete(token);
            return token;
        } catch (Throwable t) {
            tokens.remove(instance.name(), pending);
            pending.completeExceptionally(t);
            throw t;
        }
    }

    private OpsToken await(CompletableFuture<OpsToken> future) {
        try {
            return future.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            if (e.getCause() instanceof Error err) {
                throw err;
            }
            throw e;
        }
    }

    private OpsToken acquire(OpsInstance instance) {
        String name = instance.name();
        ApiResponse response;
        try {
            ApiRequest request = ApiRequest.postJson(instance.apiRoot() + ACQUIRE_PATH, credentialsBody(instance));
            response = transport.execute(request);
        } catch (IOException e) {
            log.warn("VCF Operations instance {} unreachable during token acquisition: {}", name, e.toString());
            throw new AuthenticationException(name, "instance unreachable", e);
        }
        if (!response.isSuccessful()) {
            log.warn("Token acquisition for VCF Operations instance {} returned HTTP {}", name, response.statusCode());
            throw new AuthenticationException(name, response.statusCode());
        }
        TokenGrant grant;
        try {
            grant = json.readValue(response.body(), TokenGrant.class);
        } catch (IOException e) {
            throw new AuthenticationException(name, "unreadable token response", e);
        }
        if (grant == null || grant.token() == null || grant.token().isBlank()) {
            throw new AuthenticationException(name, "response carried no token", null);
        }
        Instant expiresAt =
                grant.validity() != null && grant.validity() > 0 ? Instant.ofEpochMilli(grant.validity()) : null;
        log.info("Acquired token for VCF Operations instance {} (expires {})", name, expiresAt);
        return new OpsToken(name, grant.token(), expiresAt);
    }

    private byte[] credentialsBody(OpsInstance instance) {
        Map<String, String> body = new LinkedHashMap<>();
        body.put("username", instance.credentials().username());
        body.put("password", instance.credentials().password());
        try {
            return json.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new VcfOperationsException("Could not encode credentials for '" + instance.name() + "'", e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TokenGrant(String token, Long validity) {}
}
