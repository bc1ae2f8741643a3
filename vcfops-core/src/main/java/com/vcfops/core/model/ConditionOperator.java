package com.vcfops.core.model;

public enum ConditionOperator {
    EQ,
    NE,
    LT,
    LT_EQ,
    GT,
    GT_EQ,
    CONTAINS,
    NOT_CONTAINS,
    STARTS_WITH,
    NOT_STARTS_WITH,
    ENDS_WITH,
    NOT_ENDS_WITH,
    REGEX,
    NOT_REGEX,
    EXISTS,
    NOT_EXISTS
}
