package io.pipewright.core.schedule;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

class IsoDurationsTest {

    @ParameterizedTest
    @CsvSource({
        "PT15M, 900",
        "PT1H, 3600",
        "PT90S, 90",
        "P1D, 86400",
        "P1W2D, 777600",
        "P1Y, 31536000",
        "P1M, 2592000",
        "P1DT12H, 129600",
        "pt30m, 1800"
    })
    void shouldParseWholeSeconds(String text, long seconds) {
        assertThat(IsoDurations.parse(text)).isEqualTo(Duration.ofSeconds(seconds));
    }

    @ParameterizedTest
    @CsvSource({"PT1.5H, 5400000", "PT0.25S, 250", "P0.5D, 43200000"})
    void shouldParseFractions(String text, long millis) {
        assertThat(IsoDurations.parse(text)).isEqualTo(Duration.ofMillis(millis));
    }

    @ParameterizedTest
    @ValueSource(strings = {"P1M", "PT1M"})
    void shouldDistinguishMonthFromMinute(String text) {
        Duration expected = text.contains("T") ? Duration.ofMinutes(1) : Duration.ofDays(30);
        assertThat(IsoDurations.parse(text)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(
            strings = {
                "", " ", "15M", "P", "PT", "P1H", "PT1D", "P1D1D", "PT0S", "P1X", "PT5", "PTT1H",
                "P1.2.3D"
            })
    void shouldRejectMalformedDurations(String text) {
        assertThatThrownBy(() -> IsoDurations.parse(text))
                .isInstanceOf(ScheduleConfigException.class);
    }

    @Test
    void shouldNameTheProblem() {
        assertThatThrownBy(() -> IsoDurations.parse("P1D1D"))
                .hasMessageContaining("Duplicate unit 'D'");
        assertThatThrownBy(() -> IsoDurations.parse("PT0S")).hasMessageContaining("positive");
        assertThatThrownBy(() -> IsoDurations.parse("PT"))
                .hasMessageContaining("No time component");
    }

    @Test
    void shouldRejectDurationBeyondRange() {
        assertThatThrownBy(() -> IsoDurations.parse("P999999999999999999999Y"))
                .isInstanceOf(ScheduleConfigException.class)
                .hasMessageContaining("out of range");
    }
}
