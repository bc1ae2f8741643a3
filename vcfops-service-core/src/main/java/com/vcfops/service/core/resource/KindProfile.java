package com.vcfops.service.core.resource;

import java.util.List;

/** Adapter and resource kinds that identify one {@link ResourceType} upstream. */
public record KindProfile(List<String> adapterKinds, List<String> resourceKinds) {

    public static final KindProfile NONE = new KindProfile(List.of(), List.of());

    public KindProfile {
        adapterKinds = adapterKinds == null ? List.of() : List.copyOf(adapterKinds);
        resourceKinds = resourceKinds == null ? List.of() : List.copyOf(resourceKinds);
    }
}
