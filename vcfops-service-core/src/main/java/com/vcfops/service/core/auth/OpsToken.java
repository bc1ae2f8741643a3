package com.vcfops.service.core.auth;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Session token for one instance.
 *
 * @param expiresAt absolute expiry reported by the instance, or null when it reported none
 */
public record OpsToken(String instanceName, String value, Instant expiresAt) {

    /** Tokens are dropped this long before their reported expiry. */
    public static final Duration EXPIRY_SKEW = Duration.ofSeconds(30);

    public OpsToken {
        Objects.requireNonNull(instanceName, "instanceName");
        Objects.requireNonNull(value, "value");
    }

    public boolean isStale(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt.minus(EXPIRY_SKEW));
    }

    @Override
    public String toString() {
        return "OpsToken[" + instanceName + ", expiresAt=" + expiresAt + "]";
    }
}
