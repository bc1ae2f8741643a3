package com.vcfops.core.model;

/** Roll-up interval units understood by the stats endpoints. */
public enum IntervalType {
    SECONDS,
    MINUTES,
    HOURS,
    DAYS,
    WEEKS,
    MONTHS,
    YEARS
}
