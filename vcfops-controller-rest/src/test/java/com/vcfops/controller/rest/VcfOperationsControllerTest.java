package com.vcfops.controller.rest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.vcfops.core.error.InstanceNotFoundException;
import com.vcfops.core.error.UpstreamException;
import com.vcfops.core.model.InstanceSummary;
import com.vcfops.core.model.MetricQuery;
import com.vcfops.core.model.MetricsResponse;
import com.vcfops.core.model.OpsResource;
import com.vcfops.core.model.ResourceKindQuery;
import com.vcfops.core.model.ResourceList;
import com.vcfops.service.core.VcfOperationsService;
import com.vcfops.service.core.resource.ResourceType;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

class VcfOperationsControllerTest {

    @Mock
    private VcfOperationsService service;

    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mvc = MockMvcBuilders.standaloneSetup(new VcfOperationsController(service))
                .setControllerAdvice(new RestErrorHandler())
                .build();
    }

    @Test
    void healthAndInstances() throws Exception {
        when(service.getInstances()).thenReturn(List.of(new InstanceSummary("vcfo-1", List.of("vcfa-1"))));

        mvc.perform(get("/api/vcf-operations/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ok"));
        mvc.perform(get("/api/vcf-operations/instances"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("vcfo-1"))
                .andExpect(jsonPath("$[0].relatedInstanceNames[0]").value("vcfa-1"));
    }

    @Test
    void resourceMetricsSplitsStatKeys() throws Exception {
        when(service.getResourceMetrics(any(), any(), any(), any(), any(), any())).thenReturn(MetricsResponse.empty());

        mvc.perform(get("/api/vcf-operations/resources/r-1/metrics")
                        .param("statKeys", "cpu,mem")
                        .param("begin", "1000")
                        .param("end", "2000")
                        .param("instance", "vcfo-2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.values").isArray());

        verify(service).getResourceMetrics("r-1", List.of("cpu", "mem"), 1000L, 2000L, null, "vcfo-2");
    }

    @Test
    void resourceMetricsWithoutStatKeysIsBadRequest() throws Exception {
        mvc.perform(get("/api/vcf-operations/resources/r-1/metrics"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.status").value(400))
                .andExpect(jsonPath("$.message").value("statKeys is required"))
                .andExpect(jsonPath("$.path").value("/api/vcf-operations/resources/r-1/metrics"));
        verifyNoInteractions(service);
    }

    @Test
    void latestMetricsRequiresResourceIds() throws Exception {
        mvc.perform(get("/api/vcf-operations/metrics/latest").param("statKeys", "cpu"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("resourceIds is required"));
    }

    @Test
    void bulkQueryIsPassedThrough() throws Exception {
        when(service.queryResourceMetrics(any(), any())).thenReturn(MetricsResponse.empty());

        mvc.perform(post("/api/vcf-operations/metrics/query")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"resourceIds\":[\"r-1\"],\"statKeys\":[\"cpu\"],\"begin\":1,\"end\":2}"))
                .andExpect(status().isOk());

        ArgumentCaptor<MetricQuery> captor = ArgumentCaptor.forClass(MetricQuery.class);
        verify(service).queryResourceMetrics(captor.capture(), isNull());
        assertThat(captor.getValue().hasRange()).isTrue();
    }

    @Test
    void findByNameParsesResourceTypeAndReturnsNullOnMiss() throws Exception {
        when(service.findResourceByName("my-project", null, ResourceType.PROJECT)).thenReturn(Optional.empty());

        mvc.perform(get("/api/vcf-operations/resources/find-by-name")
                        .param("resourceName", "my-project")
                        .param("resourceType", "project"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resource").value(nullValue()));
    }

    @Test
    void findByPropertyReturnsMatch() throws Exception {
        when(service.findResourceByProperty("summary|projectId", "p-1", null))
                .thenReturn(Optional.of(new OpsResource("r-1")));

        mvc.perform(get("/api/vcf-operations/resources/find-by-property")
                        .param("propertyKey", "summary|projectId")
                        .param("propertyValue", "p-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resource.identifier").value("r-1"));
    }

    @Test
    void projectQueryBodyIsBound() throws Exception {
        when(service.queryProjectResources(any(), eq("vcfo-1"))).thenReturn(ResourceList.empty());

        mvc.perform(post("/api/vcf-operations/resources/query-projects")
                        .param("instance", "vcfo-1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":[\"my-project\"]}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.resourceList").isArray());

        verify(service)
                .queryProjectResources(new ResourceKindQuery(List.of("my-project"), List.of(), List.of()), "vcfo-1");
    }

    @Test
    void unknownInstanceIsNotFound() throws Exception {
        when(service.getResourceDetails("r-1", "vcfo-9")).thenThrow(new InstanceNotFoundException("vcfo-9"));

        mvc.perform(get("/api/vcf-operations/resources/r-1").param("instance", "vcfo-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.message").value("VCF Operations instance 'vcfo-9' not found"));
    }

    @Test
    void upstreamFailureIsBadGateway() throws Exception {
        when(service.searchResources("web", null, null, null))
                .thenThrow(new UpstreamException("vcfo-1", "GET", "/resources", 503, "maintenance"));

        mvc.perform(get("/api/vcf-operations/resources").param("name", "web"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.message").value(containsString("HTTP 503")));
    }
}
