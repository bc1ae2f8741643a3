package com.vcfops.core.error;

/** The credential exchange did not yield a token. Nothing is cached when this is thrown. */
public class AuthenticationException extends OpsApiException {

    public AuthenticationException(String instanceName, int statusCode) {
        super(
                "Authentication against VCF Operations instance '" + instanceName + "' failed with HTTP " + statusCode,
                instanceName,
                statusCode,
                null);
    }

    public AuthenticationException(String instanceName, String reason, Throwable cause) {
        super(
                "Authentication against VCF Operations instance '" + instanceName + "' failed: " + reason,
                instanceName,
                NO_STATUS,
                cause);
    }
}
