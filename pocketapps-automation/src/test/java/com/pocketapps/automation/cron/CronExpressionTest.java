package com.pocketapps.automation.cron;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class CronExpressionTest {

    @Nested
    class Validation {

        @ParameterizedTest
        @ValueSource(strings = {
                "0 9 * * *",
                "*/5 * * * *",
                "*/15 9-17 * * 1-5",
                "0,30 * * * *",
                "5 4 1 1 *",
                "0-55/5 * * * *",
                "10/20 * * * *",
                "  0   12  *  *  0  ",
                // 56 -> 0 of the next hour is 4 minutes; only gaps inside the hour count
                "*/7 * * * *",
                "0 0 31 2 *"
        })
        void accepts(String expression) {
            assertTrue(CronExpression.isValid(expression), expression);
            assertDoesNotThrow(() -> CronExpression.parse(expression));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "* * * * *",
                "*/1 * * * *",
                "*/4 * * * *",
                "0-3 * * * *",
                "0,2 * * * *",
                "0 9 * *",
                "0 9 * * * *",
                "60 * * * *",
                "0 24 * * *",
                "0 0 0 * *",
                "0 0 * 13 *",
                "0 0 * * 7",
                "a b c d e",
                "5-1 * * * *",
                "0 1,,2 * * *",
                "*/0 * * * *",
                "0 9 JAN * *"
        })
        void rejects(String expression) {
            assertFalse(CronExpression.isValid(expression), expression);
            assertThrows(InvalidCronExpressionException.class, () -> CronExpression.parse(expression));
        }

        @ParameterizedTest
        @NullAndEmptySource
        @ValueSource(strings = {"   "})
        void rejectsBlank(String expression) {
            assertFalse(CronExpression.isValid(expression));
        }

        @Test
        void everyMinuteReasonIsReported() {
            InvalidCronExpressionException e = assertThrows(InvalidCronExpressionException.class,
                    () -> CronExpression.parse("* * * * *"));
            assertTrue(e.getMessage().contains("every minute"), e.getMessage());
        }

        @Test
        void keepsTrimmedExpression() {
            assertEquals("0 12 * * 0", CronExpression.parse(" 0 12 * * 0 ").getExpression().replaceAll("\\s+", " "));
        }
    }

    @Nested
    class Matching {

        @Test
        void matchesWholeMinute() {
            CronExpression cron = CronExpression.parse("0 0 * * 0");
            // 2024-01-07 is a Sunday
            assertTrue(cron.matches(Instant.parse("2024-01-07T00:00:00Z")));
            assertTrue(cron.matches(Instant.parse("2024-01-07T00:00:59Z")));
            assertFalse(cron.matches(Instant.parse("2024-01-07T00:01:00Z")));
            assertFalse(cron.matches(Instant.parse("2024-01-08T00:00:00Z")));
        }

        @Test
        void dayOfMonthAndDayOfWeekMustBothMatch() {
            CronExpression cron = CronExpression.parse("30 12 15 * 1");
            // 2024-01-15 is a Monday, 2024-02-15 a Thursday
            assertTrue(cron.matches(Instant.parse("2024-01-15T12:30:00Z")));
            assertFalse(cron.matches(Instant.parse("2024-02-15T12:30:00Z")));
            assertFalse(cron.matches(Instant.parse("2024-01-22T12:30:00Z")));
        }
    }

    @Nested
    class NextRun {

        @ParameterizedTest
        @CsvSource({
                "0 9 * * *,          2024-01-01T08:30:00Z, 2024-01-01T09:00:00Z",
                "0 9 * * *,          2024-01-01T09:00:00Z, 2024-01-02T09:00:00Z",
                "0 9 * * *,          2024-01-01T09:00:30Z, 2024-01-02T09:00:00Z",
                "*/15 * * * *,       2024-01-01T10:07:00Z, 2024-01-01T10:15:00Z",
                "*/15 * * * *,       2024-01-01T23:59:00Z, 2024-01-02T00:00:00Z",
                "0 0 * * 0,          2024-01-01T00:00:00Z, 2024-01-07T00:00:00Z",
                "30 12 15 * 1,       2024-01-01T00:00:00Z, 2024-01-15T12:30:00Z",
                "0 0 1 1 *,          2023-12-15T00:00:00Z, 2024-01-01T00:00:00Z",
                "0 0 29 2 *,         2024-01-15T00:00:00Z, 2024-02-29T00:00:00Z",
                "*/5 9-17 * * 1-5,   2024-01-05T17:56:00Z, 2024-01-08T09:00:00Z"
        })
        void findsNextMatchingMinute(String expression, String after, String expected) {
            Optional<Instant> next = CronExpression.parse(expression).nextRunAfter(Instant.parse(after));
            assertEquals(Optional.of(Instant.parse(expected)), next);
        }

        @ParameterizedTest
        @CsvSource({
                "0 9 * * *,          2024-03-10T14:23:17Z",
                "*/7 * * * *,        2024-06-30T23:58:00Z",
                "'5,35 */6 * * *', 2024-02-28T19:00:00Z",
                "0 0 * * 0,          2024-12-30T11:11:11Z",
                "15 3 1-7 * 2,       2024-04-09T00:00:00Z",
                "0 0 1 * *,          2024-01-31T23:59:59Z",
                "45 23 * * 6,        2023-12-31T23:45:00Z"
        })
        void resultIsTheFirstMatchStrictlyAfterStart(String expression, String after) {
            CronExpression cron = CronExpression.parse(expression);
            Instant start = Instant.parse(after);
            Instant next = cron.nextRunAfter(start).orElseThrow();

            assertTrue(next.isAfter(start));
            assertEquals(0, next.getEpochSecond() % 60);
            assertTrue(cron.matches(next));
            for (Instant t = start.plusSeconds(60 - start.getEpochSecond() % 60);
                 t.isBefore(next); t = t.plusSeconds(60)) {
                assertFalse(cron.matches(t), "earlier match at " + t);
            }
        }

        @Test
        void noMatchInsideHorizonIsEmpty() {
            assertTrue(CronExpression.parse("0 0 31 2 *").nextRunAfter(Instant.parse("2024-01-01T00:00:00Z")).isEmpty());
            // 2024-02-29 is more than 60 days after 2023-03-01
            assertTrue(CronExpression.parse("0 0 29 2 *").nextRunAfter(Instant.parse("2023-03-01T00:00:00Z")).isEmpty());
        }

        @Test
        void resultNeverExceedsHorizon() {
            Instant start = Instant.parse("2024-01-01T00:00:00Z");
            Instant next = CronExpression.parse("0 0 1 3 *").nextRunAfter(start).orElseThrow();
            assertFalse(next.isAfter(start.plus(CronExpression.SEARCH_HORIZON)));
            assertEquals(Duration.ofDays(60), CronExpression.SEARCH_HORIZON);
        }
    }
}
