package com.vcfops.core.model;

/** Canonical flat series shape: one resource, one stat key. */
public record MetricSeries(String resourceId, MetricStat stat) {}
