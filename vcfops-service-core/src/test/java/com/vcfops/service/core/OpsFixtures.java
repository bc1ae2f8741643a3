package com.vcfops.service.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcfops.client.testkit.InMemoryApiTransport;
import com.vcfops.client.transport.ApiMethod;
import com.vcfops.core.model.OpsCredentials;
import com.vcfops.core.model.OpsInstance;
import com.vcfops.service.core.api.SuiteApiClient;
import com.vcfops.service.core.auth.TokenAuthenticator;
import com.vcfops.service.core.config.JacksonConfig;
import java.time.Clock;
import java.util.List;

/** Shared instances and wiring for tests driven through {@link InMemoryApiTransport}. */
public final class OpsFixtures {
    public static final OpsInstance VCFO_1 = instance("vcfo-1", "https://vcfo-1.example.com");
    public static final OpsInstance VCFO_2 = instance("vcfo-2", "https://vcfo-2.example.com");

    private OpsFixtures() {}

    public static OpsInstance instance(String name, String baseUrl) {
        return new OpsInstance(name, baseUrl, 9, new OpsCredentials("admin", "secret"), List.of());
    }

    public static ObjectMapper json() {
        return JacksonConfig.customize(new ObjectMapper());
    }

    public static String api(OpsInstance instance, String path) {
        return instance.apiRoot() + path;
    }

    /** Answers token acquisition for {@code instance} with {@code token}. */
    public static InMemoryApiTransport withToken(InMemoryApiTransport transport, OpsInstance instance, String token) {
        return transport.onJson(
                ApiMethod.POST, api(instance, "/auth/token/acquire"), 200, "{\"token\":\"" + token + "\"}");
    }

    public static SuiteApiClient client(InMemoryApiTransport transport) {
        ObjectMapper json = json();
        return new SuiteApiClient(transport, new TokenAuthenticator(transport, json, Clock.systemUTC()), json, "Bearer");
    }
}
