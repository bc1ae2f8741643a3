package com.vcfops.controller.rest;

import com.vcfops.core.model.AvailableMetrics;
import com.vcfops.core.model.InstanceSummary;
import com.vcfops.core.model.MetricQuery;
import com.vcfops.core.model.MetricsResponse;
import com.vcfops.core.model.OpsResource;
import com.vcfops.core.model.ResourceKindQuery;
import com.vcfops.core.model.ResourceList;
import com.vcfops.core.model.ResourceQuery;
import com.vcfops.service.core.VcfOperationsService;
import com.vcfops.service.core.resource.ResourceType;
import java.util.List;
import java.util.Map;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** Thin HTTP surface over {@link VcfOperationsService}. {@code instance} selects a configured instance. */
@RestController
@RequestMapping(path = "/api/vcf-operations", produces = MediaType.APPLICATION_JSON_VALUE)
@ConditionalOnProperty(prefix = "vcf-operations", name = "enabled", matchIfMissing = true)
public class VcfOperationsController {

    private final VcfOperationsService service;

    public VcfOperationsController(VcfOperationsService service) {
        this.service = service;
    }

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/instances")
    public List<InstanceSummary> instances() {
        return service.getInstances();
    }

    @GetMapping("/resources/{resourceId}/metrics")
    public MetricsResponse resourceMetrics(
            @PathVariable String resourceId,
            @RequestParam(required = false) List<String> statKeys,
            @RequestParam(required = false) Long begin,
            @RequestParam(required = false) Long end,
            @RequestParam(required = false) String rollUpType,
            @RequestParam(required = false) String instance) {
        requireNonEmpty(statKeys, "statKeys");
        return service.getResourceMetrics(resourceId, statKeys, begin, end, rollUpType, instance);
    }

    @PostMapping(path = "/metrics/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public MetricsResponse queryMetrics(
            @RequestBody MetricQuery query, @RequestParam(required = false) String instance) {
        requireNonEmpty(query.resourceIds(), "resourceIds");
        requireNonEmpty(query.statKeys(), "statKeys");
        return service.queryResourceMetrics(query, instance);
    }

    @GetMapping("/metrics/latest")
    public MetricsResponse latestMetrics(
            @RequestParam(required = false) List<String> resourceIds,
            @RequestParam(required = false) List<String> statKeys,
            @RequestParam(required = false) String instance) {
        requireNonEmpty(resourceIds, "resourceIds");
        requireNonEmpty(statKeys, "statKeys");
        return service.getLatestResourceMetrics(resourceIds, statKeys, instance);
    }

    @GetMapping("/resources/find-by-property")
    public ResourceLookupResponse findByProperty(
            @RequestParam String propertyKey,
            @RequestParam(required = false) String propertyValue,
            @RequestParam(required = false) String instance) {
        return ResourceLookupResponse.of(service.findResourceByProperty(propertyKey, propertyValue, instance));
    }

    @GetMapping("/resources/find-by-name")
    public ResourceLookupResponse findByName(
            @RequestParam String resourceName,
            @RequestParam(required = false) String instance,
            @RequestParam(required = false) String resourceType) {
        return ResourceLookupResponse.of(
                service.findResourceByName(resourceName, instance, ResourceType.fromValue(resourceType)));
    }

    @PostMapping(path = "/resources/query", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResourceList queryResources(
            @RequestBody ResourceQuery query, @RequestParam(required = false) String instance) {
        return service.queryResources(query, instance);
    }

    @PostMapping(path = "/resources/query-projects", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResourceList queryProjects(
            @RequestBody(required = false) ResourceKindQuery query, @RequestParam(required = false) String instance) {
        return service.queryProjectResources(query, instance);
    }

    @PostMapping(path = "/resources/query-clusters", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResourceList queryClusters(
            @RequestBody(required = false) ResourceKindQuery query, @RequestParam(required = false) String instance) {
        return service.queryClusterResources(query, instance);
    }

    @GetMapping("/resources/{resourceId}/available-metrics")
    public AvailableMetrics availableMetrics(
            @PathVariable String resourceId, @RequestParam(required = false) String instance) {
        return service.getAvailableMetrics(resourceId, instance);
    }

    @GetMapping("/resources/{resourceId}")
    public OpsResource resourceDetails(
            @PathVariable String resourceId, @RequestParam(required = false) String instance) {
        return service.getResourceDetails(resourceId, instance);
    }

    @GetMapping("/resources")
    public ResourceList searchResources(
            @RequestParam(required = false) String name,
            @RequestParam(required = false) String adapterKind,
            @RequestParam(required = false) String resourceKind,
            @RequestParam(required = false) String instance) {
        return service.searchResources(name, adapterKind, resourceKind, instance);
    }

    private static void requireNonEmpty(List<String> values, String name) {
        if (values == null || values.isEmpty()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }
}
