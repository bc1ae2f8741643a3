package com.vcfops.service.core.metrics;

import com.vcfops.core.model.IntervalType;

/** Sampling granularity sent with a ranged query; {@code quantifier} is null for unit-sized intervals. */
public record QueryInterval(Integer quantifier, IntervalType type) {}
