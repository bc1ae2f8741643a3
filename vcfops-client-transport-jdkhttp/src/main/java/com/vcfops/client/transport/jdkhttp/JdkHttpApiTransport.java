package com.vcfops.client.transport.jdkhttp;

import com.vcfops.client.transport.ApiMethod;
import com.vcfops.client.transport.ApiRequest;
import com.vcfops.client.transport.ApiResponse;
import com.vcfops.client.transport.ApiTransport;
import com.vcfops.client.transport.TransportSettings;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Map;

/** JDK11+ HttpClient transport (zero external deps). */
public class JdkHttpApiTransport implements ApiTransport {
    private final HttpClient client;
    private final Duration requestTimeout;

    public JdkHttpApiTransport() {
        this(TransportSettings.fromSystem());
    }

    public JdkHttpApiTransport(TransportSettings settings) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(settings.connectTimeout())
                .build();
        // HttpClient has no separate read timeout; the per-request timeout bounds the whole exchange
        this.requestTimeout = settings.callTimeout();
    }

    @Override
    public ApiResponse execute(ApiRequest request) throws IOException {
        HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(request.url())).timeout(requestTimeout);
        for (Map.Entry<String, String> h : request.headers().entrySet()) {
            builder.header(h.getKey(), h.getValue());
        }
        if (request.method() == ApiMethod.POST) {
            byte[] body = request.body() == null ? new byte[0] : request.body();
            builder.POST(HttpRequest.BodyPublishers.ofByteArray(body));
        } else {
            builder.GET();
        }
        try {
            HttpResponse<byte[]> resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
            return new ApiResponse(resp.statusCode(), resp.body());
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IOException("interrupted", ie);
        }
    }
}
