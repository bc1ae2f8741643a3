package com.vcfops.core.model;

public enum ConjunctionOperator {
    AND,
    OR
}
