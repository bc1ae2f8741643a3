package com.vcfops.client.transport.okhttp;

import com.vcfops.client.transport.ApiMethod;
import com.vcfops.client.transport.ApiRequest;
import com.vcfops.client.transport.ApiResponse;
import com.vcfops.client.transport.ApiTransport;
import com.vcfops.client.transport.TransportSettings;
import java.io.IOException;
import java.net.Inet4Address;
import java.util.ArrayList;
import java.util.Map;
import okhttp3.Dns;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** OkHttp-based transport with bounded connect, read and whole-call timeouts. */
public class OkHttpApiTransport implements ApiTransport {
    private static final Logger log = LoggerFactory.getLogger(OkHttpApiTransport.class);
    private static final MediaType JSON = MediaType.parse(ApiRequest.APPLICATION_JSON);
    private static final Dns PREFER_IPV4_DNS = hostname -> {
        var addresses = new ArrayList<>(Dns.SYSTEM.lookup(hostname));
        addresses.sort((a, b) -> {
            boolean aV4 = a instanceof Inet4Address;
            boolean bV4 = b instanceof Inet4Address;
            if (aV4 == bV4) return 0;
            return aV4 ? -1 : 1;
        });
        return addresses;
    };

    private final OkHttpClient client;

    public OkHttpApiTransport() {
        this(TransportSettings.fromSystem());
    }

    public OkHttpApiTransport(TransportSettings settings) {
        this(new OkHttpClient.Builder()
                .dns(PREFER_IPV4_DNS)
                .connectTimeout(settings.connectTimeout())
                .readTimeout(settings.readTimeout())
                .callTimeout(settings.callTimeout())
                .build());
    }

    OkHttpApiTransport(OkHttpClient client) {
        this.client = client;
    }

    @Override
    public ApiResponse execute(ApiRequest request) throws IOException {
        Request.Builder builder = new Request.Builder().url(request.url());
        for (Map.Entry<String, String> h : request.headers().entrySet()) {
            builder.header(h.getKey(), h.getValue());
        }
        if (request.method() == ApiMethod.POST) {
            byte[] body = request.body() == null ? new byte[0] : request.body();
            builder.post(RequestBody.create(body, JSON));
        } else {
            builder.get();
        }
        Request req = builder.build();
        log.debug("VCF Operations request {} {}", req.method(), req.url());
        try (Response r = client.newCall(req).execute()) {
            ResponseBody responseBody = r.body();
            byte[] bytes = responseBody != null ? responseBody.bytes() : new byte[0];
            if (!r.isSuccessful()) {
                log.warn("VCF Operations request {} {} failed with status {}", req.method(), req.url(), r.code());
            } else if (log.isDebugEnabled()) {
                log.debug(
                        "VCF Operations request {} {} succeeded with status {} ({} bytes)",
                        req.method(),
                        req.url(),
                        r.code(),
                        bytes.length);
            }
            return new ApiResponse(r.code(), bytes);
        }
    }

    @Override
    public void close() {
        client.dispatcher().executorService().shutdown();
        client.connectionPool().evictAll();
    }
}
