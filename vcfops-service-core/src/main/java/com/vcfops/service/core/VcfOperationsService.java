package com.vcfops.service.core;

import com.vcfops.core.model.AvailableMetrics;
import com.vcfops.core.model.InstanceSummary;
import com.vcfops.core.model.MetricQuery;
import com.vcfops.core.model.MetricsResponse;
import com.vcfops.core.model.OpsResource;
import com.vcfops.core.model.ResourceKindQuery;
import com.vcfops.core.model.ResourceList;
import com.vcfops.core.model.ResourceQuery;
import com.vcfops.service.core.instance.InstanceRegistry;
import com.vcfops.service.core.metrics.MetricsQueryEngine;
import com.vcfops.service.core.resource.ResourceResolver;
import com.vcfops.service.core.resource.ResourceType;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Entry point for metric and resource operations. Every call resolves its target instance first; a null
 * {@code instanceName} selects the default instance.
 */
@Service
@RequiredArgsConstructor
public class VcfOperationsService {
    private final InstanceRegistry registry;
    private final MetricsQueryEngine metrics;
    private final ResourceResolver resources;

    public List<InstanceSummary> getInstances() {
        return registry.summaries();
    }

    public MetricsResponse getResourceMetrics(String resourceId, List<String> statKeys) {
        return getResourceMetrics(resourceId, statKeys, null, null, null, null);
    }

    public MetricsResponse getResourceMetrics(
            String resourceId, List<String> statKeys, Long begin, Long end, String rollUpType, String instanceName) {
        return metrics.getResourceMetrics(registry.resolve(instanceName), resourceId, statKeys, begin, end, rollUpType);
    }

    public MetricsResponse getLatestResourceMetrics(
            List<String> resourceIds, List<String> statKeys, String instanceName) {
        return metrics.getLatestResourceMetrics(registry.resolve(instanceName), resourceIds, statKeys);
    }

    public MetricsResponse queryResourceMetrics(MetricQuery query) {
        return queryResourceMetrics(query, null);
    }

    public MetricsResponse queryResourceMetrics(MetricQuery query, String instanceName) {
        return metrics.queryResourceMetrics(registry.resolve(instanceName), query);
    }

    public AvailableMetrics getAvailableMetrics(String resourceId, String instanceName) {
        return metrics.getAvailableMetrics(registry.resolve(instanceName), resourceId);
    }

    public ResourceList searchResources(String name, String adapterKind, String resourceKind, String instanceName) {
        return resources.searchResources(registry.resolve(instanceName), name, adapterKind, resourceKind);
    }

    public ResourceList queryResources(ResourceQuery query, String instanceName) {
        return resources.queryResources(registry.resolve(instanceName), query);
    }

    public ResourceList queryProjectResources(ResourceKindQuery query, String instanceName) {
        return resources.queryProjectResources(registry.resolve(instanceName), query);
    }

    public ResourceList queryClusterResources(ResourceKindQuery query, String instanceName) {
        return resources.queryClusterResources(registry.resolve(instanceName), query);
    }

    public Optional<OpsResource> findResourceByName(String name) {
        return findResourceByName(name, null, ResourceType.GENERAL);
    }

    public Optional<OpsResource> findResourceByName(String name, String instanceName, ResourceType type) {
        return resources.findResourceByName(registry.resolve(instanceName), name, type);
    }

    public Optional<OpsResource> findResourceByProperty(String key, String value, String instanceName) {
        return resources.findResourceByProperty(registry.resolve(instanceName), key, value);
    }

    public OpsResource getResourceDetails(String resourceId, String instanceName) {
        return resources.getResourceDetails(registry.resolve(instanceName), resourceId);
    }
}
