package com.vcfops.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * One time series. {@code timestamps} (epoch millis) and {@code data} are parallel lists as sent upstream: gaps stay
 * {@code null} and samples keep their numeric type. Other stat fields ({@code intervalUnit}, {@code rollUpTypes}, ...)
 * are carried through untouched.
 */
@JsonInclude(Include.NON_NULL)
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
public final class MetricStat {
    private StatKey statKey;
    private List<Long> timestamps;
    private List<Number> data;
    @Getter(AccessLevel.NONE)
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public String key() {
        return statKey == null ? null : statKey.getKey();
    }

    @JsonAnyGetter
    public Map<String, Object> properties() {
        return properties;
    }

    @JsonAnySetter
    public void put(String name, Object value) {
        if (name != null) properties.put(name, value);
    }
}
