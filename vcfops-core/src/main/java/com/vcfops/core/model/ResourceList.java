package com.vcfops.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Optional;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ResourceList(List<OpsResource> resourceList) {

    public ResourceList {
        resourceList = resourceList == null ? List.of() : List.copyOf(resourceList);
    }

    public static ResourceList empty() {
        return new ResourceList(List.of());
    }

    public Optional<OpsResource> first() {
        return resourceList.stream().findFirst();
    }
}
