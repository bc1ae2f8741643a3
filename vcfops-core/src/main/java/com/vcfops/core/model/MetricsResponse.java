package com.vcfops.core.model;

import java.util.List;

public record MetricsResponse(List<MetricSeries> values) {

    public MetricsResponse {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public static MetricsResponse empty() {
        return new MetricsResponse(List.of());
    }
}
