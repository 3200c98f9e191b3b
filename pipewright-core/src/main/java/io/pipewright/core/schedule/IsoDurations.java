package io.pipewright.core.schedule;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/// Parser for ISO-8601 duration strings used by interval rules.
///
/// Accepts `PnYnMnWnDTnHnMnS` with any subset of components, case-insensitive.
/// Calendar units are converted to fixed lengths: a year is 365 days and a
/// month is 30 days. Components may carry a decimal fraction (`PT1.5H`).
///
/// {@snippet :
/// IsoDurations.parse("PT15M");   // 15 minutes
/// IsoDurations.parse("P1W2D");   // 9 days
/// IsoDurations.parse("P1M");     // 30 days
/// }
public final class IsoDurations {

    private static final long SECONDS_PER_DAY = 86_400L;

    private IsoDurations() {}

    /// Parses an ISO-8601 duration.
    ///
    /// @param text duration string, not null
    /// @return the positive duration, never null
    /// @throws ScheduleConfigException if the string is empty, malformed, repeats
    ///         a unit, describes a zero duration or exceeds the range of {@link Duration}
    public static Duration parse(String text) {
        if (text == null || text.isBlank()) {
            throw new ScheduleConfigException("Duration string is empty");
        }
        String value = text.trim().toUpperCase(Locale.ROOT);
        if (value.charAt(0) != 'P') {
            throw new ScheduleConfigException("Duration must start with 'P': " + text);
        }

        BigDecimal seconds = BigDecimal.ZERO;
        Set<String> seen = new HashSet<>();
        boolean timeSection = false;
        boolean timeComponent = false;
        int index = 1;
        while (index < value.length()) {
            char c = value.charAt(index);
            if (c == 'T') {
                if (timeSection) {
                    throw new ScheduleConfigException("Duplicate 'T' in duration: " + text);
                }
                timeSection = true;
                index++;
                continue;
            }

            int start = index;
            while (index < value.length()
                    && (Character.isDigit(value.charAt(index)) || value.charAt(index) == '.')) {
                index++;
            }
            if (start == index) {
                throw new ScheduleConfigException(
                        "Expected number at position " + start + " in '" + text + "'");
            }
            if (index >= value.length()) {
                throw new ScheduleConfigException(
                        "Missing unit after '" + value.substring(start) + "' in '" + text + "'");
            }
            BigDecimal amount;
            try {
                amount = new BigDecimal(value.substring(start, index));
            } catch (NumberFormatException e) {
                throw new ScheduleConfigException(
                        "Invalid number '" + value.substring(start, index) + "' in '" + text + "'",
                        e);
            }

            char unit = value.charAt(index++);
            String key = (timeSection ? "T" : "") + unit;
            if (!seen.add(key)) {
                throw new ScheduleConfigException(
                        "Duplicate unit '" + unit + "' in duration: " + text);
            }
            long unitSeconds = unitSeconds(unit, timeSection, text);
            seconds = seconds.add(amount.multiply(BigDecimal.valueOf(unitSeconds)));
            timeComponent |= timeSection;
        }

        if (timeSection && !timeComponent) {
            throw new ScheduleConfigException("No time component after 'T' in duration: " + text);
        }
        if (seen.isEmpty()) {
            throw new ScheduleConfigException(
                    "Duration must include at least one component: " + text);
        }
        if (seconds.signum() == 0) {
            throw new ScheduleConfigException("Duration must be positive: " + text);
        }

        BigDecimal whole = seconds.setScale(0, RoundingMode.DOWN);
        long nanos = seconds.subtract(whole).movePointRight(9).longValue();
        try {
            return Duration.ofSeconds(whole.longValueExact(), nanos);
        } catch (ArithmeticException e) {
            throw new ScheduleConfigException("Duration is out of range: " + text, e);
        }
    }

    private static long unitSeconds(char unit, boolean timeSection, String text) {
        long seconds =
                timeSection
                        ? switch (unit) {
                            case 'H' -> 3_600L;
                            case 'M' -> 60L;
                            case 'S' -> 1L;
                            default -> -1L;
                        }
                        : switch (unit) {
                            case 'Y' -> 365 * SECONDS_PER_DAY;
                            case 'M' -> 30 * SECONDS_PER_DAY;
                            case 'W' -> 7 * SECONDS_PER_DAY;
                            case 'D' -> SECONDS_PER_DAY;
                            default -> -1L;
                        };
        if (seconds < 0) {
            throw new ScheduleConfigException(
                    "Invalid unit '"
                            + unit
                            + "' in "
                            + (timeSection ? "time" : "date")
                            + " part of duration: "
                            + text);
        }
        return seconds;
    }
}
