package com.vcfops.service.core.metrics;

import com.vcfops.core.model.IntervalType;
import com.vcfops.service.core.config.VcfOperationsProperties;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Picks the sampling granularity for a time range: the first rule whose {@code maxSpan} is at least the span,
 * otherwise the fallback type. Boundaries are inclusive.
 */
public final class IntervalSelector {

    public record Rule(Duration maxSpan, Integer quantifier, IntervalType type) {
        public Rule {
            Objects.requireNonNull(maxSpan, "maxSpan");
            Objects.requireNonNull(type, "type");
            if (maxSpan.isNegative() || maxSpan.isZero()) {
                throw new IllegalArgumentException("Interval max-span must be positive: " + maxSpan);
            }
            if (quantifier != null && quantifier <= 0) {
                throw new IllegalArgumentException("Interval quantifier must be positive: " + quantifier);
            }
        }
    }

    private final List<Rule> rules;
    private final QueryInterval fallback;

    public IntervalSelector(List<Rule> rules, IntervalType fallbackType) {
        this.rules = rules == null
                ? List.of()
                : rules.stream().sorted(Comparator.comparing(Rule::maxSpan)).toList();
        this.fallback = new QueryInterval(null, Objects.requireNonNull(fallbackType, "fallbackType"));
    }

    public static IntervalSelector defaults() {
        return fromProperties(new VcfOperationsProperties());
    }

    public static IntervalSelector fromProperties(VcfOperationsProperties properties) {
        List<Rule> rules = properties.getIntervals() == null
                ? List.of()
                : properties.getIntervals().stream()
                        .map(i -> new Rule(i.getMaxSpan(), i.getQuantifier(), i.getType()))
                        .toList();
        IntervalType fallbackType =
                properties.getFallbackIntervalType() == null ? IntervalType.DAYS : properties.getFallbackIntervalType();
        return new IntervalSelector(rules, fallbackType);
    }

    public QueryInterval select(long beginMs, long endMs) {
        long spanMs = Math.max(0L, endMs - beginMs);
        for (Rule rule : rules) {
            if (spanMs <= rule.maxSpan().toMillis()) {
                return new QueryInterval(rule.quantifier(), rule.type());
            }
        }
        return fallback;
    }
}
