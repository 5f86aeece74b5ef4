package com.pocketapps.automation.action;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pocketapps.automation.job.JobValidationException;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ActionConfigsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Nested
    class FetchUrl {

        @Test
        void acceptsHttpsUrlWithPath() throws Exception {
            ActionConfig config = ActionConfigs.parse(ActionKind.FETCH_URL,
                    json("{\"url\":\"https://api.example.com/rates\",\"outputKey\":\"rates\",\"dataPath\":\"$.usd\"}"));
            FetchUrlConfig fetch = assertInstanceOf(FetchUrlConfig.class, config);
            assertEquals("https://api.example.com/rates", fetch.url());
            assertEquals("rates", fetch.outputKey());
            assertEquals("$.usd", fetch.dataPath());
            assertNull(fetch.triggerOnKey());
        }

        @Test
        void acceptsTemplateVariables() throws Exception {
            assertDoesNotThrow(() -> ActionConfigs.parse(ActionKind.FETCH_URL,
                    json("{\"url\":\"https://api.example.com/{city}/weather?key={api_key}\",\"outputKey\":\"weather\"}")));
        }

        @Test
        void outputKeyLeavesRoomForTimestampKey() throws Exception {
            String longest = "k".repeat(89);
            String url = "{\"url\":\"https://api.example.com\",\"outputKey\":\"";

            assertDoesNotThrow(() -> ActionConfigs.parse(ActionKind.FETCH_URL, json(url + longest + "\"}")));
            assertThrows(JobValidationException.class,
                    () -> ActionConfigs.parse(ActionKind.FETCH_URL, json(url + longest + "k\"}")));
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"outputKey\":\"x\"}",
                "{\"url\":\"https://api.example.com\"}",
                "{\"url\":\"http://api.example.com\",\"outputKey\":\"x\"}",
                "{\"url\":\"ftp://api.example.com\",\"outputKey\":\"x\"}",
                "{\"url\":\"not a url\",\"outputKey\":\"x\"}",
                "{\"url\":\"https://localhost/admin\",\"outputKey\":\"x\"}",
                "{\"url\":\"https://10.0.0.5/api\",\"outputKey\":\"x\"}",
                "{\"url\":\"https://169.254.169.254/latest/meta-data\",\"outputKey\":\"x\"}",
                "{\"url\":\"https://metadata.google.internal/\",\"outputKey\":\"x\"}",
                "{\"url\":\"https://api.example.com\",\"outputKey\":\"x\",\"triggerOnKey\":\"bad key\"}"
        })
        void rejects(String config) {
            assertThrows(JobValidationException.class, () -> ActionConfigs.parse(ActionKind.FETCH_URL, json(config)));
        }
    }

    @Nested
    class AggregateData {

        @Test
        void defaultsWindowToSevenDays() throws Exception {
            AggregateDataConfig config = (AggregateDataConfig) ActionConfigs.parse(ActionKind.AGGREGATE_DATA,
                    json("{\"dataKey\":\"weight\",\"operation\":\"avg\",\"outputKey\":\"weight_avg_7d\"}"));
            assertEquals(7, config.windowDays());
        }

        @ParameterizedTest
        @ValueSource(strings = {
                "{\"operation\":\"avg\",\"outputKey\":\"o\"}",
                "{\"dataKey\":\"bad-key\",\"operation\":\"avg\",\"outputKey\":\"o\"}",
                "{\"dataKey\":\"weight\",\"outputKey\":\"o\"}",
                "{\"dataKey\":\"weight\",\"operation\":\"avg\"}",
                "{\"dataKey\":\"weight\",\"operation\":\"avg\",\"outputKey\":\"o\",\"windowDays\":\"soon\"}"
        })
        void rejects(String config) {
            assertThrows(JobValidationException.class,
                    () -> ActionConfigs.parse(ActionKind.AGGREGATE_DATA, json(config)));
        }
    }

    @Test
    void reminderTextDefaults() throws Exception {
        SendReminderConfig config = (SendReminderConfig) ActionConfigs.parse(ActionKind.SEND_REMINDER, json("{}"));
        assertEquals(SendReminderConfig.DEFAULT_TEXT, config.text());
        assertNull(config.outputKey());
    }

    @Test
    void logEntryNeedsNoConfig() {
        LogEntryConfig config = (LogEntryConfig) ActionConfigs.parse(ActionKind.LOG_ENTRY, (JsonNode) null);
        assertTrue(config.fields().isEmpty());
    }

    @Test
    void logEntryRejectsBadFieldName() {
        assertThrows(JobValidationException.class, () -> ActionConfigs.parse(ActionKind.LOG_ENTRY,
                json("{\"fields\":{\"weight kg\":\"number\"}}")));
    }

    @Test
    void nonObjectConfigIsRejected() {
        assertThrows(JobValidationException.class, () -> ActionConfigs.parse(ActionKind.SEND_REMINDER, json("[1,2]")));
    }

    @Test
    void unknownFieldsAreIgnored() throws Exception {
        SendReminderConfig config = (SendReminderConfig) ActionConfigs.parse(ActionKind.SEND_REMINDER,
                json("{\"text\":\"Drink water\",\"channel\":\"push\"}"));
        assertEquals("Drink water", config.text());
    }

    @Test
    void storedJsonParsesBackToSameConfig() {
        LogEntryConfig original = new LogEntryConfig(Map.of("weight", "number", "note", "text"), "daily_log", "weight");
        String stored = ActionConfigs.toJson(original);
        assertEquals(original, ActionConfigs.parse(ActionKind.LOG_ENTRY, stored));
    }

    @Test
    void wireNamesResolve() {
        assertEquals(ActionKind.AGGREGATE_DATA, ActionKind.fromWireName("aggregate_data").orElseThrow());
        assertEquals(ActionKind.FETCH_URL, ActionKind.fromWireName(" fetch_url ").orElseThrow());
        assertTrue(ActionKind.fromWireName("delete_everything").isEmpty());
        assertTrue(ActionKind.fromWireName(null).isEmpty());
    }
}
