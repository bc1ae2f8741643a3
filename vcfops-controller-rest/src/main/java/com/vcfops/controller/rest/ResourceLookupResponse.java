package com.vcfops.controller.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.vcfops.core.model.OpsResource;
import java.util.Optional;

/** Single-resource lookup result; {@code resource} is serialized as null on a miss. */
public record ResourceLookupResponse(@JsonInclude(Include.ALWAYS) OpsResource resource) {

    static ResourceLookupResponse of(Optional<OpsResource> found) {
        return new ResourceLookupResponse(found.orElse(null));
    }
}
