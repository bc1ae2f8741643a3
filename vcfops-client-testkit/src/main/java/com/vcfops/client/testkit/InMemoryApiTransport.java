package com.vcfops.client.testkit;

import com.vcfops.client.transport.ApiMethod;
import com.vcfops.client.transport.ApiRequest;
import com.vcfops.client.transport.ApiResponse;
import com.vcfops.client.transport.ApiTransport;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Test double that answers from scripted routes and records every request.
 *
 * <p>Routes are keyed by method and endpoint (absolute URL without query string). A request with no route fails
 * with an {@link IOException}, which callers see as an unreachable instance.
 */
public class InMemoryApiTransport implements ApiTransport {
    private final Map<String, ApiHandler> routes = new ConcurrentHashMap<>();
    private final List<RecordedApiRequest> requests = new CopyOnWriteArrayList<>();

    public InMemoryApiTransport on(ApiMethod method, String endpoint, ApiHandler handler) {
        routes.put(key(method, endpoint), handler);
        return this;
    }

    public InMemoryApiTransport onJson(ApiMethod method, String endpoint, int status, String json) {
        return on(method, endpoint, request -> ApiResponse.of(status, json));
    }

    @Override
    public ApiResponse execute(ApiRequest request) throws IOException {
        RecordedApiRequest recorded = new RecordedApiRequest(request);
        requests.add(recorded);
        ApiHandler handler = routes.get(key(request.method(), recorded.endpoint()));
        if (handler == null) {
            throw new IOException("No route for " + recorded.method() + " " + recorded.endpoint());
        }
        return handler.handle(recorded);
    }

    public List<RecordedApiRequest> requests() {
        return Collections.unmodifiableList(requests);
    }

    public List<RecordedApiRequest> requests(ApiMethod method, String endpoint) {
        return requests.stream()
                .filter(r -> r.method() == method && r.endpoint().equals(endpoint))
                .collect(Collectors.toList());
    }

    public int count(ApiMethod method, String endpoint) {
        return requests(method, endpoint).size();
    }

    private static String key(ApiMethod method, String endpoint) {
        return method + " " + endpoint;
    }
}
