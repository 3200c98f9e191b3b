package io.pipewright.core.schedule;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Parsed five-field cron expression.
///
/// Fields are `minute hour day-of-month month day-of-week`, each a comma
/// separated list of `*`, `n`, `a-b`, `*/n`, `a-b/n` or `a/n` elements.
/// Months accept `JAN`..`DEC`, days of week accept `SUN`..`SAT`; Sunday is
/// both `0` and `7`.
///
/// When both day fields are restricted (neither starts with `*`), a day
/// matches if it satisfies either of them, as in classic cron.
///
/// Supported shorthands: `@yearly`, `@annually`, `@monthly`, `@weekly`,
/// `@daily`, `@midnight`, `@hourly`.
///
/// ### Usage
/// {@snippet :
/// CronExpression cron = CronExpression.parse("*/15 9-17 * * MON-FRI");
/// Optional<ZonedDateTime> next = cron.next(ZonedDateTime.now());
/// }
///
/// @implNote Immutable and thread-safe. Local times skipped by a daylight
/// saving transition never match.
public final class CronExpression {

    private static final Map<String, String> SHORTHANDS =
            Map.of(
                    "@yearly", "0 0 1 1 *",
                    "@annually", "0 0 1 1 *",
                    "@monthly", "0 0 1 * *",
                    "@weekly", "0 0 * * 0",
                    "@daily", "0 0 * * *",
                    "@midnight", "0 0 * * *",
                    "@hourly", "0 * * * *");

    private static final List<String> MONTH_NAMES =
            List.of("JAN", "FEB", "MAR", "APR", "MAY", "JUN", "JUL", "AUG", "SEP", "OCT", "NOV",
                    "DEC");

    private static final List<String> DAY_NAMES =
            List.of("SUN", "MON", "TUE", "WED", "THU", "FRI", "SAT");

    /// Upper bound of the search: leap days may be eight years apart.
    private static final int SEARCH_YEARS = 9;

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;
    private final boolean dayOfMonthRestricted;
    private final boolean dayOfWeekRestricted;

    private CronExpression(String expression, String[] fields) {
        this.expression = expression;
        this.minutes = parseField(fields[0], "minute", 0, 59, List.of(), 0);
        this.hours = parseField(fields[1], "hour", 0, 23, List.of(), 0);
        this.daysOfMonth = parseField(fields[2], "day-of-month", 1, 31, List.of(), 0);
        this.months = parseField(fields[3], "month", 1, 12, MONTH_NAMES, 1);
        BitSet dow = parseField(fields[4], "day-of-week", 0, 7, DAY_NAMES, 0);
        if (dow.get(7)) {
            dow.set(0);
            dow.clear(7);
        }
        this.daysOfWeek = dow;
        this.dayOfMonthRestricted = !fields[2].startsWith("*");
        this.dayOfWeekRestricted = !fields[4].startsWith("*");
    }

    /// Parses a cron expression or shorthand.
    ///
    /// @param expression five-field expression or `@` shorthand, not null
    /// @return parsed expression, never null
    /// @throws ScheduleConfigException if the expression is malformed
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ScheduleConfigException("Cron expression is empty");
        }
        String trimmed = expression.trim();
        String resolved = trimmed;
        if (trimmed.startsWith("@")) {
            resolved = SHORTHANDS.get(trimmed.toLowerCase(Locale.ROOT));
            if (resolved == null) {
                throw new ScheduleConfigException("Unknown cron shorthand: " + trimmed);
            }
        }
        String[] fields = resolved.split("\\s+");
        if (fields.length != 5) {
            throw new ScheduleConfigException(
                    "Cron expression must have 5 fields but has "
                            + fields.length
                            + ": '"
                            + expression
                            + "'");
        }
        return new CronExpression(trimmed, fields);
    }

    /// Returns the first matching time strictly after the given time.
    ///
    /// Seconds and fractions are dropped; matches fall on whole minutes in
    /// the zone of `after`.
    ///
    /// @param after reference time, not null
    /// @return next matching time, empty if none exists within nine years
    ///         (for example `0 0 30 2 *`)
    public Optional<ZonedDateTime> next(ZonedDateTime after) {
        Objects.requireNonNull(after, "after must not be null");
        ZonedDateTime t = after.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        int lastYear = t.getYear() + SEARCH_YEARS;

        while (t.getYear() <= lastYear) {
            if (!months.get(t.getMonthValue())) {
                t = t.withDayOfMonth(1).truncatedTo(ChronoUnit.DAYS).plusMonths(1);
                continue;
            }
            if (!dayMatches(t)) {
                t = t.truncatedTo(ChronoUnit.DAYS).plusDays(1);
                continue;
            }
            if (!hours.get(t.getHour())) {
                t = t.truncatedTo(ChronoUnit.HOURS).plusHours(1);
                continue;
            }
            if (!minutes.get(t.getMinute())) {
                t = t.plusMinutes(1);
                continue;
            }
            return Optional.of(t);
        }
        return Optional.empty();
    }

    private boolean dayMatches(ZonedDateTime t) {
        boolean dom = daysOfMonth.get(t.getDayOfMonth());
        boolean dow = daysOfWeek.get(t.getDayOfWeek().getValue() % 7);
        if (dayOfMonthRestricted && dayOfWeekRestricted) {
            return dom || dow;
        }
        return dom && dow;
    }

    private static BitSet parseField(
            String field, String name, int min, int max, List<String> names, int nameOffset) {
        BitSet bits = new BitSet(max + 1);
        for (String element : field.split(",", -1)) {
            if (element.isEmpty()) {
                throw invalid(name, field, "empty list element");
            }

            int step = 1;
            String range = element;
            int slash = element.indexOf('/');
            if (slash >= 0) {
                range = element.substring(0, slash);
                step = parseNumber(element.substring(slash + 1), name, field);
                if (step < 1) {
                    throw invalid(name, field, "step must be positive");
                }
            }

            int from;
            int to;
            if (range.equals("*")) {
                from = min;
                to = max;
            } else {
                int dash = range.indexOf('-');
                if (dash >= 0) {
                    from = parseValue(range.substring(0, dash), name, field, names, nameOffset);
                    to = parseValue(range.substring(dash + 1), name, field, names, nameOffset);
                } else {
                    from = parseValue(range, name, field, names, nameOffset);
                    to = slash >= 0 ? max : from;
                }
            }

            if (from < min || to > max) {
                throw invalid(name, field, "values must be within " + min + "-" + max);
            }
            if (from > to) {
                throw invalid(name, field, "range start " + from + " is after end " + to);
            }
            for (int v = from; v <= to; v += step) {
                bits.set(v);
            }
        }
        return bits;
    }

    private static int parseValue(
            String token, String name, String field, List<String> names, int nameOffset) {
        int index = names.indexOf(token.toUpperCase(Locale.ROOT));
        if (index >= 0) {
            return index + nameOffset;
        }
        return parseNumber(token, name, field);
    }

    private static int parseNumber(String token, String name, String field) {
        if (token.isEmpty() || !token.chars().allMatch(Character::isDigit)) {
            throw invalid(name, field, "'" + token + "' is not a number");
        }
        try {
            return Integer.parseInt(token);
        } catch (NumberFormatException e) {
            throw new ScheduleConfigException(
                    "Invalid " + name + " field '" + field + "': '" + token + "' is too large", e);
        }
    }

    private static ScheduleConfigException invalid(String name, String field, String detail) {
        return new ScheduleConfigException(
                "Invalid " + name + " field '" + field + "': " + detail);
    }

    /// Returns the expression as written, shorthands unexpanded.
    ///
    /// @return expression text, never null
    public String getExpression() {
        return expression;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CronExpression that)) return false;
        return expression.equals(that.expression);
    }

    @Override
    public int hashCode() {
        return expression.hashCode();
    }

    @Override
    public String toString() {
        return expression;
    }
}
