package com.vcfops.client.transport;

import java.nio.charset.StandardCharsets;

public record ApiResponse(int statusCode, byte[] body) {

    public ApiResponse {
        body = body == null ? new byte[0] : body;
    }

    public static ApiResponse of(int statusCode, String body) {
        return new ApiResponse(statusCode, body == null ? null : body.getBytes(StandardCharsets.UTF_8));
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300;
    }

    public String bodyAsString() {
        return new String(body, StandardCharsets.UTF_8);
    }

    @Override
    public String toString() {
        return "ApiResponse[" + statusCode + ", " + body.length + " bytes]";
    }
}
