package com.vcfops.service.core.metrics;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.vcfops.core.model.IntervalType;
import java.util.List;

/** Wire body of the bulk stats query. */
@JsonInclude(Include.NON_NULL)
record StatsQueryBody(
        @JsonProperty("resourceId") List<String> resourceIds,
        @JsonProperty("statKey") List<String> statKeys,
        Long begin,
        Long end,
        String rollUpType,
        IntervalType intervalType,
        Integer intervalQuantifier) {}
