package com.vcfops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Result of metric-key discovery. Never null; empty when the instance could not be asked. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AvailableMetrics(@JsonProperty("stat-key") List<StatKeyDescriptor> statKeys) {

    public AvailableMetrics {
        statKeys = statKeys == null ? List.of() : List.copyOf(statKeys);
    }

    public static AvailableMetrics empty() {
        return new AvailableMetrics(List.of());
    }
}
