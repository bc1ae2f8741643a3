package com.vcfops.core.model;

import java.util.List;

/**
 * Name/kind filter for the project and cluster queries. Empty kind lists are filled from the configured
 * kind profile.
 */
public record ResourceKindQuery(List<String> name, List<String> adapterKind, List<String> resourceKind) {

    public ResourceKindQuery {
        name = name == null ? List.of() : List.copyOf(name);
        adapterKind = adapterKind == null ? List.of() : List.copyOf(adapterKind);
        resourceKind = resourceKind == null ? List.of() : List.copyOf(resourceKind);
    }

    public static ResourceKindQuery named(String name) {
        return new ResourceKindQuery(List.of(name), List.of(), List.of());
    }
}
