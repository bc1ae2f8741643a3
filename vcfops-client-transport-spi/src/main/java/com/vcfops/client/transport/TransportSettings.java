package com.vcfops.client.transport;

import java.time.Duration;
import java.util.Objects;

/**
 * Timeouts applied to every exchange. Zero-config construction reads system properties first, then environment
 * variables, then falls back to the defaults.
 */
public record TransportSettings(Duration connectTimeout, Duration readTimeout, Duration callTimeout) {

    public static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(10);
    public static final Duration DEFAULT_READ_TIMEOUT = Duration.ofSeconds(30);
    public static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(60);

    public static final String PROP_CONNECT_TIMEOUT = "vcfops.http.connect-timeout";
    public static final String ENV_CONNECT_TIMEOUT = "VCFOPS_HTTP_CONNECT_TIMEOUT";
    public static final String PROP_READ_TIMEOUT = "vcfops.http.read-timeout";
    public static final String ENV_READ_TIMEOUT = "VCFOPS_HTTP_READ_TIMEOUT";
    public static final String PROP_CALL_TIMEOUT = "vcfops.http.call-timeout";
    public static final String ENV_CALL_TIMEOUT = "VCFOPS_HTTP_CALL_TIMEOUT";

    public TransportSettings {
        Objects.requireNonNull(connectTimeout, "connectTimeout");
        Objects.requireNonNull(readTimeout, "readTimeout");
        Objects.requireNonNull(callTimeout, "callTimeout");
    }

    public static TransportSettings defaults() {
        return new TransportSettings(DEFAULT_CONNECT_TIMEOUT, DEFAULT_READ_TIMEOUT, DEFAULT_CALL_TIMEOUT);
    }

    public static TransportSettings fromSystem() {
        return new TransportSettings(
                resolve(PROP_CONNECT_TIMEOUT, ENV_CONNECT_TIMEOUT, DEFAULT_CONNECT_TIMEOUT),
                resolve(PROP_READ_TIMEOUT, ENV_READ_TIMEOUT, DEFAULT_READ_TIMEOUT),
                resolve(PROP_CALL_TIMEOUT, ENV_CALL_TIMEOUT, DEFAULT_CALL_TIMEOUT));
    }

    private static Duration resolve(String property, String env, Duration fallback) {
        String sys = System.getProperty(property);
        if (sys != null && !sys.isBlank()) return parse(property, sys.trim());
        String envValue = System.getenv(env);
        if (envValue != null && !envValue.isBlank()) return parse(env, envValue.trim());
        return fallback;
    }

    /** Accepts ISO-8601 ({@code PT30S}) or plain milliseconds. */
    static Duration parse(String source, String value) {
        try {
            if (value.chars().allMatch(Character::isDigit)) {
                return Duration.ofMillis(Long.parseLong(value));
            }
            return Duration.parse(value);
        } catch (RuntimeException e) {
            throw new IllegalArgumentException("Invalid duration for " + source + ": " + value, e);
        }
    }
}
