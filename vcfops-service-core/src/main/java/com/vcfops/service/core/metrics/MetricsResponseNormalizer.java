package com.vcfops.service.core.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcfops.core.model.MetricSeries;
import com.vcfops.core.model.MetricStat;
import com.vcfops.core.model.MetricsResponse;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Flattens stats payloads into one series per (resource, stat key).
 *
 * <p>Entries come either as {@code {resourceId, stat}} or as {@code {resourceId, stat-list: {stat: [...]}}}
 * depending on endpoint and product version. Entries matching neither shape are dropped.
 */
@Slf4j
public class MetricsResponseNormalizer {

    enum EntryShape {
        CANONICAL,
        STAT_LIST,
        UNRECOGNIZED;

        static EntryShape of(JsonNode entry) {
            if (entry.path("stat").isObject()) return CANONICAL;
            if (entry.path("stat-list").path("stat").isArray()) return STAT_LIST;
            return UNRECOGNIZED;
        }
    }

    private final ObjectMapper json;

    public MetricsResponseNormalizer(ObjectMapper json) {
        this.json = json;
    }

    /** @throws IllegalArgumentException when a recognized entry holds a malformed stat */
    public MetricsResponse normalize(JsonNode payload) {
        JsonNode values = payload == null ? null : payload.path("values");
        if (values == null || !values.isArray()) {
            return MetricsResponse.empty();
        }
        List<MetricSeries> out = new ArrayList<>();
        int dropped = 0;
        for (JsonNode entry : values) {
            String resourceId = entry.path("resourceId").asText(null);
            switch (EntryShape.of(entry)) {
                case CANONICAL -> out.add(new MetricSeries(resourceId, toStat(entry.get("stat"))));
                case STAT_LIST -> {
                    for (JsonNode stat : entry.path("stat-list").path("stat")) {
                        out.add(new MetricSeries(resourceId, toStat(stat)));
                    }
                }
                case UNRECOGNIZED -> dropped++;
            }
        }
        if (dropped > 0) {
            log.debug("Dropped {} stats entr(ies) of unrecognized shape", dropped);
        }
        return new MetricsResponse(out);
    }

    private MetricStat toStat(JsonNode stat) {
        return json.convertValue(stat, MetricStat.class);
    }
}
