package com.pocketapps.automation.aggregate;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.IntNode;
import com.pocketapps.automation.MutableClock;
import com.pocketapps.automation.store.SqliteDataPointStore;
import com.pocketapps.automation.store.SqliteDatabase;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class AggregatorTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final long APP = 42;

    @TempDir
    Path tempDir;

    private MutableClock clock;
    private SqliteDataPointStore store;
    private Aggregator aggregator;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2024-03-01T00:00:00Z"));
        store = new SqliteDataPointStore(new SqliteDatabase(tempDir.resolve("agg.db")), clock);
        aggregator = new Aggregator(store, clock);
    }

    private void append(String key, String json) throws Exception {
        store.append(APP, key, MAPPER.readTree(json));
    }

    @ParameterizedTest
    @CsvSource({"avg, 20", "sum, 60", "count, 3", "max, 30", "min, 10", "AVG, 20"})
    void computesOperations(String operation, double expected) {
        store.append(APP, "score", IntNode.valueOf(10));
        store.append(APP, "score", IntNode.valueOf(20));
        store.append(APP, "score", IntNode.valueOf(30));

        assertEquals(OptionalDouble.of(expected), aggregator.aggregate(APP, "score", operation, 7));
    }

    @Test
    void unknownOperationIsEmpty() {
        store.append(APP, "score", IntNode.valueOf(10));
        assertTrue(aggregator.aggregate(APP, "score", "median", 7).isEmpty());
        assertTrue(aggregator.aggregate(APP, "score", null, 7).isEmpty());
    }

    @Test
    void noSamplesIsEmpty() {
        assertTrue(aggregator.aggregate(APP, "score", "count", 7).isEmpty());
    }

    @Test
    void extractsNumbersFromObjects() throws Exception {
        append("weight", "{\"weight\":70}");
        append("weight", "{\"value\":72}");
        append("weight", "{\"result\":74}");
        append("weight", "{\"weight\":null,\"value\":10}");
        append("weight", "{\"weight\":\"heavy\",\"value\":1000}");
        append("weight", "{\"other\":5}");
        append("weight", "\"80\"");
        append("weight", "[90]");

        assertEquals(OptionalDouble.of(4), aggregator.aggregate(APP, "weight", "count", 7));
        assertEquals(OptionalDouble.of(226), aggregator.aggregate(APP, "weight", "sum", 7));
    }

    @Test
    void onlyCountsSamplesInsideWindow() {
        store.append(APP, "steps", IntNode.valueOf(100));
        clock.advance(Duration.ofDays(10));
        store.append(APP, "steps", IntNode.valueOf(5));

        assertEquals(OptionalDouble.of(5), aggregator.aggregate(APP, "steps", "sum", 7));
        assertEquals(OptionalDouble.of(105), aggregator.aggregate(APP, "steps", "sum", 30));
    }

    @Test
    void windowIsClamped() {
        store.append(APP, "steps", IntNode.valueOf(1));
        clock.advance(Duration.ofHours(12));
        store.append(APP, "steps", IntNode.valueOf(2));
        clock.advance(Duration.ofHours(18));

        // zero days behaves as one day
        assertEquals(OptionalDouble.of(2), aggregator.aggregate(APP, "steps", "sum", 0));

        clock.advance(Duration.ofDays(400));
        store.append(APP, "steps", IntNode.valueOf(4));
        assertEquals(OptionalDouble.of(4), aggregator.aggregate(APP, "steps", "sum", 10_000));
    }

    @Test
    void otherAppsAreIgnored() {
        store.append(APP, "steps", IntNode.valueOf(1));
        store.append(APP + 1, "steps", IntNode.valueOf(50));
        assertEquals(OptionalDouble.of(1), aggregator.aggregate(APP, "steps", "max", 7));
    }
}
