package com.vcfops.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

/** Credential-free projection of an {@link OpsInstance} for discovery listings. */
public record InstanceSummary(String name, @JsonInclude(Include.NON_EMPTY) List<String> relatedInstanceNames) {

    public InstanceSummary {
        relatedInstanceNames = relatedInstanceNames == null ? List.of() : List.copyOf(relatedInstanceNames);
    }
}
