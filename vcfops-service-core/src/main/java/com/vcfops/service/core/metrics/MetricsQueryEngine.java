package com.vcfops.service.core.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.vcfops.core.error.OpsApiException;
import com.vcfops.core.error.UpstreamException;
import com.vcfops.core.model.AvailableMetrics;
import com.vcfops.core.model.IntervalType;
import com.vcfops.core.model.MetricQuery;
import com.vcfops.core.model.MetricsResponse;
import com.vcfops.core.model.OpsInstance;
import com.vcfops.service.core.api.QueryParams;
import com.vcfops.service.core.api.SuiteApiClient;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RequiredArgsConstructor
public class MetricsQueryEngine {
    static final String STATS_PATH = "/resources/stats";
    static final String LATEST_STATS_PATH = "/resources/stats/latest";
    static final String STATS_QUERY_PATH = "/resources/stats/query";

    private final SuiteApiClient client;
    private final IntervalSelector intervals;
    private final MetricsResponseNormalizer normalizer;

    public MetricsResponse getResourceMetrics(
            OpsInstance instance, String resourceId, List<String> statKeys, Long begin, Long end, String rollUpType) {
        requireText(resourceId, "resourceId");
        QueryParams query = QueryParams.create()
                .add("resourceId", resourceId)
                .addAll("statKey", statKeys)
                .add("begin", begin)
                .add("end", end)
                .add("rollUpType", blankToNull(rollUpType));
        if (begin != null && end != null) {
            QueryInterval interval = intervals.select(begin, end);
            query.add("intervalQuantifier", interval.quantifier()).add("intervalType", interval.type());
        }
        log.debug("Fetching {} stat key(s) of {} from {}", sizeOf(statKeys), resourceId, instance.name());
        return normalize(instance, "GET", STATS_PATH, client.get(instance, STATS_PATH, query, JsonNode.class));
    }

    public MetricsResponse getLatestResourceMetrics(
            OpsInstance instance, List<String> resourceIds, List<String> statKeys) {
        if (resourceIds == null || resourceIds.isEmpty()) {
            throw new IllegalArgumentException("resourceIds must not be empty");
        }
        QueryParams query = QueryParams.create().addAll("resourceId", resourceIds).addAll("statKey", statKeys);
        return normalize(
                instance, "GET", LATEST_STATS_PATH, client.get(instance, LATEST_STATS_PATH, query, JsonNode.class));
    }

    public MetricsResponse queryResourceMetrics(OpsInstance instance, MetricQuery query) {
        if (query == null || query.resourceIds().isEmpty()) {
            throw new IllegalArgumentException("resourceIds must not be empty");
        }
        Integer quantifier = query.intervalQuantifier();
        IntervalType type = query.intervalType();
        if (type == null && query.hasRange()) {
            QueryInterval interval = intervals.select(query.begin(), query.end());
            quantifier = interval.quantifier();
            type = interval.type();
        }
        StatsQueryBody body = new StatsQueryBody(
                query.resourceIds(),
                query.statKeys(),
                query.begin(),
                query.end(),
                blankToNull(query.rollUpType()),
                type,
                quantifier);
        return normalize(
                instance, "POST", STATS_QUERY_PATH, client.post(instance, STATS_QUERY_PATH, body, JsonNode.class));
    }

    /** Best-effort: upstream failures yield an empty key list. */
    public AvailableMetrics getAvailableMetrics(OpsInstance instance, String resourceId) {
        requireText(resourceId, "resourceId");
        String path = "/resources/" + QueryParams.encode(resourceId) + "/statkeys";
        try {
            return client.get(instance, path, null, AvailableMetrics.class);
        } catch (OpsApiException e) {
            log.warn(
                    "Stat key discovery for {} on {} failed (status {}), returning none",
                    resourceId,
                    instance.name(),
                    e.statusCode());
            return AvailableMetrics.empty();
        }
    }

    private MetricsResponse normalize(OpsInstance instance, String method, String path, JsonNode payload) {
        try {
            return normalizer.normalize(payload);
        } catch (IllegalArgumentException e) {
            throw new UpstreamException(instance.name(), method, path, "malformed stats payload", e);
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " must not be blank");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    private static int sizeOf(List<?> list) {
        return list == null ? 0 : list.size();
    }
}
