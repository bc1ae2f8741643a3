package com.vcfops.core.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.databind.JsonNode;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;

/**
 * Upstream resource. Only {@code identifier} and {@code resourceKey} are typed; everything else is kept as-is so the
 * object serializes back out unchanged.
 */
@JsonInclude(Include.NON_NULL)
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode
@ToString
public final class OpsResource {
    private String identifier;
    private JsonNode resourceKey;
    @Getter(AccessLevel.NONE)
    private final Map<String, Object> properties = new LinkedHashMap<>();

    public OpsResource(String identifier) {
        this.identifier = identifier;
    }

    /** Display name from {@code resourceKey.name}, or null. */
    public String name() {
        if (resourceKey == null || !resourceKey.hasNonNull("name")) return null;
        return resourceKey.get("name").asText();
    }

    @JsonAnyGetter
    public Map<String, Object> properties() {
        return properties;
    }

    @JsonAnySetter
    public void put(String key, Object value) {
        if (key != null) properties.put(key, value);
    }
}
