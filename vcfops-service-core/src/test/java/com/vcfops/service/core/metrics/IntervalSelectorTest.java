package com.vcfops.service.core.metrics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.vcfops.core.model.IntervalType;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.Test;

class IntervalSelectorTest {
    private static final long T0 = 1_714_557_600_000L;

    private final IntervalSelector selector = IntervalSelector.defaults();

    @Test
    void oneHourUsesFiveMinuteSamples() {
        assertThat(select(Duration.ofHours(1))).isEqualTo(new QueryInterval(5, IntervalType.MINUTES));
    }

    @Test
    void twelveHoursUsesFifteenMinuteSamples() {
        assertThat(select(Duration.ofHours(12))).isEqualTo(new QueryInterval(15, IntervalType.MINUTES));
    }

    @Test
    void threeDaysUsesHourlySamplesWithoutQuantifier() {
        assertThat(select(Duration.ofHours(72))).isEqualTo(new QueryInterval(null, IntervalType.HOURS));
    }

    @Test
    void longRangesFallBackToDays() {
        assertThat(select(Duration.ofDays(200))).isEqualTo(new QueryInterval(null, IntervalType.DAYS));
    }

    @Test
    void boundariesAreInclusive() {
        assertThat(select(Duration.ofHours(6)).quantifier()).isEqualTo(5);
        assertThat(select(Duration.ofHours(6).plusMillis(1)).quantifier()).isEqualTo(15);
        assertThat(select(Duration.ofHours(24)).quantifier()).isEqualTo(15);
        assertThat(select(Duration.ofDays(7)).type()).isEqualTo(IntervalType.HOURS);
        assertThat(select(Duration.ofDays(7).plusMillis(1)).type()).isEqualTo(IntervalType.DAYS);
    }

    @Test
    void invertedRangeIsTreatedAsEmpty() {
        assertThat(selector.select(T0, T0 - 1_000)).isEqualTo(new QueryInterval(5, IntervalType.MINUTES));
    }

    @Test
    void customRulesAreSortedBySpan() {
        IntervalSelector custom = new IntervalSelector(
                List.of(
                        new IntervalSelector.Rule(Duration.ofDays(1), null, IntervalType.HOURS),
                        new IntervalSelector.Rule(Duration.ofMinutes(30), 1, IntervalType.MINUTES)),
                IntervalType.WEEKS);

        assertThat(custom.select(T0, T0 + Duration.ofMinutes(10).toMillis()))
                .isEqualTo(new QueryInterval(1, IntervalType.MINUTES));
        assertThat(custom.select(T0, T0 + Duration.ofDays(2).toMillis()))
                .isEqualTo(new QueryInterval(null, IntervalType.WEEKS));
    }

    @Test
    void rejectsNonPositiveRules() {
        assertThatThrownBy(() -> new IntervalSelector.Rule(Duration.ZERO, 5, IntervalType.MINUTES))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new IntervalSelector.Rule(Duration.ofHours(1), 0, IntervalType.MINUTES))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private QueryInterval select(Duration span) {
        return selector.select(T0, T0 + span.toMillis());
    }
}
