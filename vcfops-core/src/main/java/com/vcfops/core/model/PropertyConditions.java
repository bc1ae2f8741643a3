package com.vcfops.core.model;

import java.util.List;

/** Conditions combined under one conjunction operator. */
public record PropertyConditions(ConjunctionOperator conjunctionOperator, List<PropertyCondition> conditions) {

    public PropertyConditions {
        conjunctionOperator = conjunctionOperator == null ? ConjunctionOperator.AND : conjunctionOperator;
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static PropertyConditions allOf(PropertyCondition... conditions) {
        return new PropertyConditions(ConjunctionOperator.AND, List.of(conditions));
    }
}
