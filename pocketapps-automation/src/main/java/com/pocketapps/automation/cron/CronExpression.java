package com.pocketapps.automation.cron;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.BitSet;
import java.util.Optional;

/**
 * A parsed 5-field cron expression ({@code minute hour day-of-month month
 * day-of-week}), evaluated in UTC.
 * <p>
 * Only the subset needed for user automations is supported: {@code *},
 * numbers, {@code lo-hi} ranges, comma lists and {@code /step} strides. No
 * names, no {@code L}/{@code W}/{@code #}, no seconds field. All five fields
 * must match for a minute to fire (day-of-month and day-of-week are combined
 * with AND).
 * <p>
 * Expressions firing more often than every {@value #MIN_INTERVAL_MINUTES}
 * minutes are rejected.
 */
public final class CronExpression {

    public static final int MIN_INTERVAL_MINUTES = 5;

    /**
     * How far {@link #nextRunAfter(Instant)} searches. An expression with no
     * match inside this window yields no next run.
     */
    public static final Duration SEARCH_HORIZON = Duration.ofDays(60);

    private final String expression;
    private final BitSet minutes;
    private final BitSet hours;
    private final BitSet daysOfMonth;
    private final BitSet months;
    private final BitSet daysOfWeek;

    private CronExpression(String expression, BitSet minutes, BitSet hours, BitSet daysOfMonth,
            BitSet months, BitSet daysOfWeek) {
        this.expression = expression;
        this.minutes = minutes;
        this.hours = hours;
        this.daysOfMonth = daysOfMonth;
        this.months = months;
        this.daysOfWeek = daysOfWeek;
    }

    /**
     * Parse and validate an expression, including the frequency floor.
     *
     * @throws InvalidCronExpressionException if the expression is rejected
     */
    public static CronExpression parse(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new InvalidCronExpressionException(String.valueOf(expression), "expression is empty");
        }
        String trimmed = expression.trim();
        String[] fields = trimmed.split("\\s+");
        if (fields.length != 5) {
            throw new InvalidCronExpressionException(trimmed,
                    "expected 5 fields but found " + fields.length);
        }

        BitSet[] parsed = new BitSet[5];
        CronField[] kinds = CronField.values();
        for (int i = 0; i < 5; i++) {
            try {
                parsed[i] = kinds[i].parse(fields[i]);
            } catch (IllegalArgumentException e) {
                throw new InvalidCronExpressionException(trimmed, e.getMessage());
            }
        }

        checkFrequencyFloor(trimmed, fields[0], parsed[0]);
        return new CronExpression(trimmed, parsed[0], parsed[1], parsed[2], parsed[3], parsed[4]);
    }

    /**
     * @return {@code true} if {@link #parse(String)} would accept the expression
     */
    public static boolean isValid(String expression) {
        try {
            parse(expression);
            return true;
        } catch (InvalidCronExpressionException e) {
            return false;
        }
    }

    private static void checkFrequencyFloor(String expression, String minuteField, BitSet minuteValues) {
        if (minuteField.equals("*")) {
            throw new InvalidCronExpressionException(expression, "minute field '*' fires every minute");
        }
        if (minuteField.matches("\\*/\\d+")) {
            int step = Integer.parseInt(minuteField.substring(2));
            if (step < MIN_INTERVAL_MINUTES) {
                throw new InvalidCronExpressionException(expression,
                        "minute step must be at least " + MIN_INTERVAL_MINUTES);
            }
        }
        int previous = -1;
        for (int m = minuteValues.nextSetBit(0); m >= 0; m = minuteValues.nextSetBit(m + 1)) {
            if (previous >= 0 && m - previous < MIN_INTERVAL_MINUTES) {
                throw new InvalidCronExpressionException(expression,
                        "minutes " + previous + " and " + m + " are less than "
                                + MIN_INTERVAL_MINUTES + " minutes apart");
            }
            previous = m;
        }
    }

    public String getExpression() {
        return expression;
    }

    /**
     * Check whether the minute containing {@code instant} matches.
     */
    public boolean matches(Instant instant) {
        ZonedDateTime t = instant.atZone(ZoneOffset.UTC);
        return months.get(t.getMonthValue())
                && dayMatches(t)
                && hours.get(t.getHour())
                && minutes.get(t.getMinute());
    }

    private boolean dayMatches(ZonedDateTime t) {
        return daysOfMonth.get(t.getDayOfMonth())
                && daysOfWeek.get(t.getDayOfWeek().getValue() % 7);
    }

    /**
     * Find the first matching minute strictly after {@code after}.
     * <p>
     * Steps forward from the next whole UTC minute. Months, days and hours
     * that cannot match are skipped whole, which gives the same answer as a
     * minute-by-minute scan.
     *
     * @return the next run, or empty if nothing matches within
     *         {@link #SEARCH_HORIZON}
     */
    public Optional<Instant> nextRunAfter(Instant after) {
        ZonedDateTime start = after.atZone(ZoneOffset.UTC).truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        ZonedDateTime limit = after.atZone(ZoneOffset.UTC).plus(SEARCH_HORIZON);

        ZonedDateTime t = start;
        while (!t.isAfter(limit)) {
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
            return Optional.of(t.toInstant());
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return expression;
    }
}
