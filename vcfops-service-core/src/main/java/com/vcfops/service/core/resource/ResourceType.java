package com.vcfops.service.core.resource;

import java.util.Locale;

/** Kind hint for name lookups, with the lookup style each kind uses. */
public enum ResourceType {
    GENERAL(null, LookupStyle.SEARCH_THEN_QUERY),
    PROJECT("project", LookupStyle.STRUCTURED_QUERY),
    VM("vm", LookupStyle.KIND_SEARCH),
    CLUSTER("cluster", LookupStyle.STRUCTURED_QUERY),
    SUPERVISOR_NAMESPACE("supervisor-namespace", LookupStyle.STRUCTURED_QUERY);

    enum LookupStyle {
        /** Free-text search, then a name-only structured query when the search finds nothing. */
        SEARCH_THEN_QUERY,
        /** Free-text search narrowed by the kind profile. */
        KIND_SEARCH,
        /** Structured query carrying the kind profile. */
        STRUCTURED_QUERY
    }

    private final String wireValue;
    private final LookupStyle lookupStyle;

    ResourceType(String wireValue, LookupStyle lookupStyle) {
        this.wireValue = wireValue;
        this.lookupStyle = lookupStyle;
    }

    LookupStyle lookupStyle() {
        return lookupStyle;
    }

    /** Null, blank and unknown values map to {@link #GENERAL}. */
    public static ResourceType fromValue(String value) {
        if (value == null || value.isBlank()) return GENERAL;
        String v = value.trim().toLowerCase(Locale.ROOT);
        for (ResourceType type : values()) {
            if (v.equals(type.wireValue) || v.equals(type.name().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        return GENERAL;
    }
}
