package com.vcfops.service.core.resource;

import com.vcfops.core.error.OpsApiException;
import com.vcfops.core.model.OpsInstance;
import com.vcfops.core.model.OpsResource;
import com.vcfops.core.model.PropertyCondition;
import com.vcfops.core.model.PropertyConditions;
import com.vcfops.core.model.ResourceKindQuery;
import com.vcfops.core.model.ResourceList;
import com.vcfops.core.model.ResourceQuery;
import com.vcfops.service.core.api.QueryParams;
import com.vcfops.service.core.api.SuiteApiClient;
import com.vcfops.service.core.resource.ResourceType.LookupStyle;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;

/**
 * Resource search, structured queries and single-resource lookups.
 *
 * <p>{@code find*} operations are best-effort: an upstream failure is logged and reported as no match.
 */
@Slf4j
public class ResourceResolver {
    static final String RESOURCES_PATH = "/resources";
    static final String QUERY_PATH = "/resources/query";

    @FunctionalInterface
    interface NameLookup {
        ResourceList lookup(OpsInstance instance, String name, ResourceType type);
    }

    private final SuiteApiClient client;
    private final KindProfiles profiles;
    private final Map<LookupStyle, NameLookup> lookups = new EnumMap<>(LookupStyle.class);

    public ResourceResolver(SuiteApiClient client, KindProfiles profiles) {
        this.client = client;
        this.profiles = profiles;
        lookups.put(LookupStyle.SEARCH_THEN_QUERY, this::searchThenQuery);
        lookups.put(LookupStyle.KIND_SEARCH, (instance, name, type) -> {
            KindProfile profile = profiles.profile(type);
            return search(instance, name, profile.adapterKinds(), profile.resourceKinds());
        });
        lookups.put(
                LookupStyle.STRUCTURED_QUERY,
                (instance, name, type) -> queryByKind(instance, type, ResourceKindQuery.named(name)));
    }

    /** Free-text search; every argument is optional. */
    public ResourceList searchResources(OpsInstance instance, String name, String adapterKind, String resourceKind) {
        return search(instance, name, listOf(adapterKind), listOf(resourceKind));
    }

    public ResourceList queryResources(OpsInstance instance, ResourceQuery query) {
        if (query == null) {
            throw new IllegalArgumentException("query must not be null");
        }
        return client.post(instance, QUERY_PATH, query, ResourceList.class);
    }

    public ResourceList queryProjectResources(OpsInstance instance, ResourceKindQuery query) {
        return queryByKind(instance, ResourceType.PROJECT, query);
    }

    public ResourceList queryClusterResources(OpsInstance instance, ResourceKindQuery query) {
        return queryByKind(instance, ResourceType.CLUSTER, query);
    }

    /** Structured query; empty kind lists in {@code query} are filled from the profile of {@code type}. */
    public ResourceList queryByKind(OpsInstance instance, ResourceType type, ResourceKindQuery query) {
        ResourceKindQuery q = query == null ? new ResourceKindQuery(null, null, null) : query;
        KindProfile profile = profiles.profile(type);
        ResourceQuery body = new ResourceQuery(
                nullIfEmpty(q.name()),
                nullIfEmpty(q.adapterKind().isEmpty() ? profile.adapterKinds() : q.adapterKind()),
                nullIfEmpty(q.resourceKind().isEmpty() ? profile.resourceKinds() : q.resourceKind()),
                null);
        return queryResources(instance, body);
    }

    public Optional<OpsResource> findResourceByName(OpsInstance instance, String name, ResourceType type) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        ResourceType kind = type == null ? ResourceType.GENERAL : type;
        try {
            return lookups.get(kind.lookupStyle()).lookup(instance, name, kind).first();
        } catch (OpsApiException e) {
            log.warn(
                    "Lookup of {} '{}' on {} failed (status {}), treating as not found",
                    kind,
                    name,
                    instance.name(),
                    e.statusCode());
            return Optional.empty();
        }
    }

    public Optional<OpsResource> findResourceByProperty(OpsInstance instance, String key, String value) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("propertyKey must not be blank");
        }
        ResourceQuery query = ResourceQuery.byProperties(PropertyConditions.allOf(PropertyCondition.eq(key, value)));
        try {
            return queryResources(instance, query).first();
        } catch (OpsApiException e) {
            log.warn(
                    "Lookup by property {} on {} failed (status {}), treating as not found",
                    key,
                    instance.name(),
                    e.statusCode());
            return Optional.empty();
        }
    }

    public OpsResource getResourceDetails(OpsInstance instance, String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId must not be blank");
        }
        return client.get(
                instance, RESOURCES_PATH + "/" + QueryParams.encode(resourceId), null, OpsResource.class);
    }

    private ResourceList searchThenQuery(OpsInstance instance, String name, ResourceType type) {
        ResourceList found = search(instance, name, List.of(), List.of());
        if (!found.resourceList().isEmpty()) {
            return found;
        }
        log.debug("Search for '{}' on {} found nothing, trying structured query", name, instance.name());
        return queryResources(instance, ResourceQuery.byName(name));
    }

    private ResourceList search(
            OpsInstance instance, String name, List<String> adapterKinds, List<String> resourceKinds) {
        QueryParams query = QueryParams.create()
                .add("name", blankToNull(name))
                .addAll("adapterKind", adapterKinds)
                .addAll("resourceKind", resourceKinds);
        return client.get(instance, RESOURCES_PATH, query, ResourceList.class);
    }

    private static List<String> listOf(String value) {
        return value == null || value.isBlank() ? List.of() : List.of(value);
    }

    private static List<String> nullIfEmpty(List<String> values) {
        return values == null || values.isEmpty() ? null : values;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
