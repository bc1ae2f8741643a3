package com.vcfops.service.core.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.vcfops.core.model.MetricSeries;
import com.vcfops.core.model.MetricsResponse;
import com.vcfops.service.core.OpsFixtures;
import java.util.List;
import org.junit.jupiter.api.Test;

class MetricsResponseNormalizerTest {
    private final ObjectMapper json = OpsFixtures.json();
    private final MetricsResponseNormalizer normalizer = new MetricsResponseNormalizer(json);

    @Test
    void canonicalEntriesPassThrough() throws Exception {
        MetricsResponse response = normalizer.normalize(json.readTree(
                """
                {"values":[{"resourceId":"r-1","stat":{"statKey":{"key":"cpu|usage_average"},
                  "timestamps":[1000,2000],"data":[1.5,2.5]}}]}
                """));

        assertThat(response.values()).hasSize(1);
        MetricSeries series = response.values().get(0);
        assertThat(series.resourceId()).isEqualTo("r-1");
        assertThat(series.stat().key()).isEqualTo("cpu|usage_average");
        assertThat(series.stat().getTimestamps()).containsExactly(1000L, 2000L);
        assertThat(series.stat().getData()).containsExactly(1.5, 2.5);
    }

    @Test
    void statListEntriesAreExplodedInOrder() throws Exception {
        MetricsResponse response = normalizer.normalize(json.readTree(
                """
                {"values":[
                  {"resourceId":"r-1","stat-list":{"stat":[
                    {"statKey":{"key":"cpu"},"timestamps":[1],"data":[10]},
                    {"statKey":{"key":"mem"},"timestamps":[1],"data":[20]}]}},
                  {"resourceId":"r-2","stat":{"statKey":{"key":"disk"},"timestamps":[1],"data":[30]}}]}
                """));

        assertThat(response.values())
                .extracting(MetricSeries::resourceId, s -> s.stat().key())
                .containsExactly(
                        tuple("r-1", "cpu"),
                        tuple("r-1", "mem"),
                        tuple("r-2", "disk"));
    }

    @Test
    void entriesOfUnknownShapeContributeNothing() throws Exception {
        MetricsResponse response = normalizer.normalize(json.readTree(
                """
                {"values":[
                  {"resourceId":"r-1"},
                  {"resourceId":"r-2","stat-list":{}},
                  {"resourceId":"r-3","stat":{"statKey":{"key":"cpu"},"timestamps":[],"data":[]}}]}
                """));

        assertThat(response.values()).extracting(MetricSeries::resourceId).containsExactly("r-3");
    }

    @Test
    void gapsInSamplesAreKept() throws Exception {
        MetricsResponse response = normalizer.normalize(json.readTree(
                """
                {"values":[{"resourceId":"r-1","stat":{"statKey":{"key":"cpu"},
                  "timestamps":[1,2,3],"data":[1.0,null,3.0]}}]}
                """));

        assertThat(response.values()).hasSize(1);
        assertThat(response.values().get(0).stat().getData()).containsExactly(1.0, null, 3.0);
        assertThat(response.values().get(0).stat().getTimestamps()).containsExactly(1L, 2L, 3L);
    }

    @Test
    void canonicalStatSerializesBackUnchanged() throws Exception {
        String stat = """
                {"statKey":{"key":"cpu","unit":"%"},"timestamps":[1,2],"data":[10,2.5],
                 "intervalUnit":{"quantifier":5,"intervalType":"MINUTES"},"rollUpTypes":["AVG"]}
                """;
        MetricsResponse response =
                normalizer.normalize(json.readTree("{\"values\":[{\"resourceId\":\"r-1\",\"stat\":" + stat + "}]}"));

        JsonNode echoed = json.readTree(json.writeValueAsString(response.values().get(0).stat()));

        assertThat(echoed).isEqualTo(json.readTree(stat));
        assertThat(echoed.path("data").get(0).isIntegralNumber()).isTrue();
    }

    @Test
    void statListEntriesKeepExtraFieldsAndGaps() throws Exception {
        MetricsResponse response = normalizer.normalize(json.readTree(
                """
                {"values":[{"resourceId":"r-1","stat-list":{"stat":[
                  {"statKey":{"key":"cpu"},"timestamps":[1,2],"data":[null,4],"rollUpTypes":["MAX"]}]}}]}
                """));

        MetricSeries series = response.values().get(0);
        assertThat(series.stat().getData()).containsExactly(null, 4);
        assertThat(series.stat().properties()).containsKey("rollUpTypes");
    }

    @Test
    void missingValuesYieldsEmptyResponse() throws Exception {
        assertThat(normalizer.normalize(json.readTree("{}")).values()).isEmpty();
        assertThat(normalizer.normalize(null).values()).isEqualTo(List.of());
    }
}
