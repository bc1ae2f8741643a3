package com.vcfops.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/** Stat key of a series; fields other than {@code key} are carried through untouched. */
@JsonInclude(Include.NON_NULL)
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
public final class StatKey {
    private String key;
    @Getter(AccessLevel.NONE)
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public StatKey(String key) {
        this.key = key;
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
