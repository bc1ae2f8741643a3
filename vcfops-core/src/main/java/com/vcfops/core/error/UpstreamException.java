package com.vcfops.core.error;

/** An authenticated call returned a non-2xx status, could not be sent, or answered with an unreadable body. */
public class UpstreamException extends OpsApiException {
    private final String method;
    private final String path;

    public UpstreamException(String instanceName, String method, String path, int statusCode, String responseBody) {
        super(
                "VCF Operations request " + method + " " + path + " on '" + instanceName + "' failed with HTTP "
                        + statusCode + bodySuffix(responseBody),
                instanceName,
                statusCode,
                null);
        this.method = method;
        this.path = path;
    }

    public UpstreamException(String instanceName, String method, String path, String reason, Throwable cause) {
        super(
                "VCF Operations request " + method + " " + path + " on '" + instanceName + "' failed: " + reason,
                instanceName,
                NO_STATUS,
                cause);
        this.method = method;
        this.path = path;
    }

    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    private static String bodySuffix(String body) {
        if (body == null || body.isBlank()) return "";
        String trimmed = body.strip();
        return " - " + (trimmed.length() > 512 ? trimmed.substring(0, 512) + "..." : trimmed);
    }
}
