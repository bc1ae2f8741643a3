package com.vcfops.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One configured VCF Operations instance. Immutable once loaded.
 *
 * @param name unique instance name used for lookups
 * @param baseUrl instance root, without the {@code /suite-api/api} suffix and without a trailing slash
 * @param majorVersion optional product major version (8 or 9)
 * @param credentials credentials for the token exchange
 * @param relatedInstanceNames names of related automation instances, never null
 */
public record OpsInstance(
        String name,
        String baseUrl,
        Integer majorVersion,
        OpsCredentials credentials,
        List<String> relatedInstanceNames) {

    public static final String API_ROOT = "/suite-api/api";

    public OpsInstance {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(credentials, "credentials");
        baseUrl = stripTrailingSlashes(baseUrl.trim());
        relatedInstanceNames = relatedInstanceNames == null ? List.of() : List.copyOf(relatedInstanceNames);
    }

    /** Root of the REST surface, e.g. {@code https://vcfo.example.com/suite-api/api}. */
    public String apiRoot() {
        return baseUrl + API_ROOT;
    }

    public InstanceSummary summary() {
        return new InstanceSummary(name, relatedInstanceNames);
    }

    private static String stripTrailingSlashes(String url) {
        String out = url;
        while (out.endsWith("/")) {
            out = out.substring(0, out.length() - 1);
        }
        return out;
    }
}
