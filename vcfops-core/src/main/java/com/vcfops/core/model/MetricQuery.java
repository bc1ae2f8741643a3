package com.vcfops.core.model;

import java.util.List;

/**
 * Multi-resource, multi-key metric request.
 *
 * <p>{@code begin}/{@code end} are epoch millis. When both are present and no interval is given, one is selected
 * from the span. Absent bounds mean no time filter.
 */
public record MetricQuery(
        List<String> resourceIds,
        List<String> statKeys,
        Long begin,
        Long end,
        String rollUpType,
        Integer intervalQuantifier,
        IntervalType intervalType) {

    public MetricQuery {
        resourceIds = resourceIds == null ? List.of() : List.copyOf(resourceIds);
        statKeys = statKeys == null ? List.of() : List.copyOf(statKeys);
    }

    public static MetricQuery of(List<String> resourceIds, List<String> statKeys) {
        return new MetricQuery(resourceIds, statKeys, null, null, null, null, null);
    }

    public MetricQuery withRange(Long begin, Long end) {
        return new MetricQuery(resourceIds, statKeys, begin, end, rollUpType, intervalQuantifier, intervalType);
    }

    public MetricQuery withInterval(Integer intervalQuantifier, IntervalType intervalType) {
        return new MetricQuery(resourceIds, statKeys, begin, end, rollUpType, intervalQuantifier, intervalType);
    }

    public boolean hasRange() {
        return begin != null && end != null;
    }
}
