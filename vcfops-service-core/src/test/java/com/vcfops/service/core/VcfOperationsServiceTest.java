package com.vcfops.service.core;

import static com.vcfops.service.core.OpsFixtures.VCFO_1;
import static com.vcfops.service.core.OpsFixtures.VCFO_2;
import static com.vcfops.service.core.OpsFixtures.api;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vcfops.client.testkit.InMemoryApiTransport;
import com.vcfops.client.transport.ApiMethod;
import com.vcfops.core.error.InstanceNotFoundException;
import com.vcfops.core.model.InstanceSummary;
import com.vcfops.core.model.MetricsResponse;
import com.vcfops.core.model.OpsCredentials;
import com.vcfops.core.model.OpsInstance;
import com.vcfops.service.core.api.SuiteApiClient;
import com.vcfops.service.core.instance.InstanceRegistry;
import com.vcfops.service.core.metrics.IntervalSelector;
import com.vcfops.service.core.metrics.MetricsQueryEngine;
import com.vcfops.service.core.metrics.MetricsResponseNormalizer;
import com.vcfops.service.core.resource.KindProfiles;
import com.vcfops.service.core.resource.ResourceResolver;
import com.vcfops.service.core.resource.ResourceType;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class VcfOperationsServiceTest {
    private static final OpsInstance LINKED = new OpsInstance(
            "vcfo-1", "https://vcfo-1.example.com", 9, new OpsCredentials("admin", "secret"), List.of("vcfa-1"));

    private final InMemoryApiTransport transport = new InMemoryApiTransport();
    private VcfOperationsService service;

    @BeforeEach
    void setUp() {
        OpsFixtures.withToken(transport, VCFO_1, "tok-1");
        OpsFixtures.withToken(transport, VCFO_2, "tok-2");
        SuiteApiClient client = OpsFixtures.client(transport);
        service = new VcfOperationsService(
                new InstanceRegistry(List.of(LINKED, VCFO_2)),
                new MetricsQueryEngine(
                        client, IntervalSelector.defaults(), new MetricsResponseNormalizer(OpsFixtures.json())),
                new ResourceResolver(client, KindProfiles.defaults()));
    }

    @Test
    void listsInstancesWithoutCredentials() {
        assertThat(service.getInstances())
                .containsExactly(
                        new InstanceSummary("vcfo-1", List.of("vcfa-1")), new InstanceSummary("vcfo-2", List.of()));
    }

    @Test
    void namedInstanceReceivesTheCall() {
        transport.onJson(ApiMethod.GET, api(VCFO_2, "/resources/stats"), 200, "{\"values\":[]}");

        MetricsResponse response = service.getResourceMetrics("r-1", List.of("cpu"), null, null, null, "vcfo-2");

        assertThat(response.values()).isEmpty();
        assertThat(transport.requests(ApiMethod.GET, api(VCFO_2, "/resources/stats")))
                .singleElement()
                .satisfies(r -> assertThat(r.header("Authorization")).isEqualTo("Bearer tok-2"));
        assertThat(transport.count(ApiMethod.POST, api(VCFO_1, "/auth/token/acquire"))).isZero();
    }

    @Test
    void omittedInstanceUsesDefault() {
        transport.onJson(ApiMethod.GET, api(VCFO_1, "/resources/stats"), 200, "{\"values\":[]}");

        service.getResourceMetrics("r-1", List.of("cpu"));

        assertThat(transport.count(ApiMethod.GET, api(VCFO_1, "/resources/stats"))).isEqualTo(1);
    }

    @Test
    void unknownInstanceFailsBeforeAnyCall() {
        assertThatThrownBy(() -> service.findResourceByName("web-01", "vcfo-9", ResourceType.VM))
                .isInstanceOf(InstanceNotFoundException.class)
                .hasMessage("VCF Operations instance 'vcfo-9' not found");
        assertThat(transport.requests()).isEmpty();
    }

    @Test
    void findByNameReturnsFirstMatchOrEmpty() {
        transport.onJson(
                ApiMethod.POST,
                api(VCFO_1, "/resources/query"),
                200,
                "{\"resourceList\":[{\"identifier\":\"p-1\"},{\"identifier\":\"p-2\"}]}");

        assertThat(service.findResourceByName("my-project", null, ResourceType.PROJECT))
                .hasValueSatisfying(r -> assertThat(r.getIdentifier()).isEqualTo("p-1"));

        transport.onJson(ApiMethod.POST, api(VCFO_1, "/resources/query"), 200, "{\"resourceList\":[]}");
        assertThat(service.findResourceByName("missing", null, ResourceType.PROJECT)).isEmpty();
    }
}
