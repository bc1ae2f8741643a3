package com.vcfops.client.testkit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vcfops.client.transport.ApiMethod;
import com.vcfops.client.transport.ApiRequest;
import com.vcfops.client.transport.ApiResponse;
import java.io.IOException;
import org.junit.jupiter.api.Test;

class InMemoryApiTransportTest {

    @Test
    void routesByEndpointAndDecodesRepeatedQueryParameters() throws Exception {
        InMemoryApiTransport transport = new InMemoryApiTransport()
                .onJson(ApiMethod.GET, "http://vcfo.example.com/suite-api/api/resources/stats", 200, "{\"values\":[]}");

        ApiResponse response = transport.execute(ApiRequest.get(
                "http://vcfo.example.com/suite-api/api/resources/stats?statKey=cpu%7Cusage&statKey=mem&begin=10"));

        assertThat(response.bodyAsString()).isEqualTo("{\"values\":[]}");
        RecordedApiRequest recorded = transport.requests().get(0);
        assertThat(recorded.queryParameters("statKey")).containsExactly("cpu|usage", "mem");
        assertThat(recorded.queryParameter("begin")).isEqualTo("10");
        assertThat(recorded.queryParameter("end")).isNull();
    }

    @Test
    void unroutedRequestFailsLikeAnUnreachableHost() {
        InMemoryApiTransport transport = new InMemoryApiTransport();

        assertThatThrownBy(() -> transport.execute(ApiRequest.get("http://other.example.com/suite-api/api/resources")))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("other.example.com");
        assertThat(transport.requests()).hasSize(1);
    }
}
