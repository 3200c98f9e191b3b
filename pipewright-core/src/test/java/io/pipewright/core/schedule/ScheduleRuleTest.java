package io.pipewright.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ScheduleRuleTest {

    @Test
    void shouldCreateIntervalFromIsoDuration() {
        var rule = ScheduleRule.interval("PT15M");

        assertThat(rule.period()).isEqualTo(Duration.ofMinutes(15));
        assertThat(rule.fireImmediately()).isFalse();
        assertThat(rule.firingImmediately().fireImmediately()).isTrue();
    }

    @Test
    void shouldRejectNonPositiveInterval() {
        assertThatThrownBy(() -> ScheduleRule.interval(Duration.ZERO))
                .isInstanceOf(ScheduleConfigException.class);
        assertThatThrownBy(() -> ScheduleRule.interval(Duration.ofSeconds(-5)))
                .isInstanceOf(ScheduleConfigException.class);
    }

    @Test
    void shouldRejectIntervalBeyondTimerRange() {
        assertThatThrownBy(() -> ScheduleRule.interval("P300Y"))
                .isInstanceOf(ScheduleConfigException.class)
                .hasMessageContaining("must not exceed");
        assertThatThrownBy(() -> ScheduleRule.interval(Duration.ofDays(365L * 300)))
                .isInstanceOf(ScheduleConfigException.class);
        assertThat(ScheduleRule.interval(ScheduleRule.Interval.MAX_PERIOD).period())
                .isEqualTo(ScheduleRule.Interval.MAX_PERIOD);
    }

    @Test
    void shouldRejectMissingPeriodOrExpression() {
        assertThatThrownBy(() -> ScheduleRule.interval((Duration) null))
                .isInstanceOf(ScheduleConfigException.class)
                .hasMessageContaining("period");
        assertThatThrownBy(() -> new ScheduleRule.Cron(null))
                .isInstanceOf(ScheduleConfigException.class)
                .hasMessageContaining("Cron expression");
    }

    @Test
    void shouldRequireExactlyOneRepresentation() {
        assertThatThrownBy(() -> ScheduleRule.of(Duration.ofMinutes(5), "@daily"))
                .isInstanceOf(ScheduleConfigException.class)
                .hasMessageContaining("not both");
        assertThatThrownBy(() -> ScheduleRule.of(null, null))
                .isInstanceOf(ScheduleConfigException.class);
        assertThatThrownBy(() -> ScheduleRule.of(null, "  "))
                .isInstanceOf(ScheduleConfigException.class);
    }

    @Test
    void shouldTreatBlankCronAsAbsent() {
        assertThat(ScheduleRule.of(Duration.ofMinutes(5), " "))
                .isEqualTo(ScheduleRule.interval(Duration.ofMinutes(5)));
    }

    @Test
    void shouldCreateCronRule() {
        var rule = ScheduleRule.of(null, "0 3 * * *");

        assertThat(rule).isInstanceOfSatisfying(
                ScheduleRule.Cron.class,
                cron -> assertThat(cron.expression().getExpression()).isEqualTo("0 3 * * *"));
    }
}
