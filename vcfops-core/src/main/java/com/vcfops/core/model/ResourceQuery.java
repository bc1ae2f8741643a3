package com.vcfops.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import java.util.List;

/**
 * Body of the structured resource query. Null members are left out of the request.
 */
@JsonInclude(Include.NON_NULL)
public record ResourceQuery(
        List<String> name,
        List<String> adapterKind,
        List<String> resourceKind,
        PropertyConditions propertyConditions) {

    public static ResourceQuery byProperties(PropertyConditions conditions) {
        return new ResourceQuery(null, null, null, conditions);
    }

    public static ResourceQuery byName(String name) {
        return new ResourceQuery(List.of(name), null, null, null);
    }
}
