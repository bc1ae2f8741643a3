package com.vcfops.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonInclude.Include;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

/** Single property predicate; the value travels as {@code stringValue} on the wire. */
@JsonInclude(Include.NON_NULL)
public record PropertyCondition(String key, ConditionOperator operator, @JsonProperty("stringValue") String value) {

    public PropertyCondition {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(operator, "operator");
    }

    public static PropertyCondition eq(String key, String value) {
        return new PropertyCondition(key, ConditionOperator.EQ, value);
    }
}
