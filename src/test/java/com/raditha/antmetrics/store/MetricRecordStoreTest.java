package com.raditha.antmetrics.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.antmetrics.flagging.IterativeFlaggingEngine;
import com.raditha.antmetrics.model.AntennaMetric;
import com.raditha.antmetrics.model.FlaggingResult;
import com.raditha.antmetrics.model.IterationRecord;
import com.raditha.antmetrics.support.SyntheticArray;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

class MetricRecordStoreTest {

    private static final ObjectMapper mapper = new ObjectMapper();

    private static FlaggingResult crossed;
    private static FlaggingResult dead;

    @TempDir
    Path tempDir;

    @BeforeAll
    static void runEngines() {
        crossed = new IterativeFlaggingEngine(SyntheticArray.fourAntennas().swapFeeds(2).build(),
                SyntheticArray.fourAntennaReds()).run();
        dead = new IterativeFlaggingEngine(SyntheticArray.brightAntenna().build(),
                SyntheticArray.brightAntennaReds()).run();
    }

    private static void assertSameResult(FlaggingResult expected, FlaggingResult actual) {
        assertEquals(expected.excluded(), actual.excluded());
        assertEquals(expected.crossedRemoved(), actual.crossedRemoved());
        assertEquals(expected.deadRemoved(), actual.deadRemoved());
        assertEquals(expected.removalRound(), actual.removalRound());
        assertEquals(expected.finalMetrics(), actual.finalMetrics());
        assertEquals(expected.finalZScores(), actual.finalZScores());
        assertEquals(expected.crossCut(), actual.crossCut());
        assertEquals(expected.deadCut(), actual.deadCut());
        assertEquals(expected.roundCount(), actual.roundCount());
        for (int round = 0; round < expected.roundCount(); round++) {
            IterationRecord want = expected.iterations().get(round);
            IterationRecord got = actual.iterations().get(round);
            assertEquals(want.removed(), got.removed());
            assertEquals(want.reason(), got.reason());
            assertEquals(want.rawMetrics(), got.rawMetrics());
            assertEquals(want.zScores(), got.zScores());
        }
    }

    @Test
    void testSaveAndLoadCrossedRun() throws IOException {
        Path file = tempDir.resolve("records/crossed.json");

        MetricRecordStore.save(crossed, file);

        assertTrue(Files.exists(file));
        assertSameResult(crossed, MetricRecordStore.load(file));
    }

    @Test
    void testNonFiniteValuesSurvive() throws IOException {
        String json = MetricRecordStore.toJson(dead);

        // no redundant pair survives the terminal round, so every correlation is zero
        assertTrue(json.contains("\"NaN\""));
        FlaggingResult loaded = MetricRecordStore.fromJson(json);
        assertSameResult(dead, loaded);
        assertTrue(loaded.allZScores().get(2).get(AntennaMetric.RED_CORR).values().stream()
                .allMatch(value -> value.isNaN()));
    }

    @Test
    void testDocumentLayout() throws IOException {
        ObjectNode root = (ObjectNode) mapper.readTree(MetricRecordStore.toJson(crossed));

        assertEquals(MetricRecordStore.FORMAT_VERSION, root.get("version").intValue());
        assertEquals(2, root.get("excluded_antennas").get(0).get(0).intValue());
        assertEquals("x", root.get("excluded_antennas").get(0).get(1).textValue());
        assertEquals(2, root.get("all_metrics").size());
        assertEquals(5.0, root.get("dead_ant_z_cut").doubleValue());
        assertTrue(root.get("final_metrics").has("redCorrXPol"));
        assertEquals(0, root.get("removal_round_index").get(1).get("round").intValue());
    }

    private String corrupt(Consumer<ObjectNode> edit) throws IOException {
        ObjectNode root = (ObjectNode) mapper.readTree(MetricRecordStore.toJson(crossed));
        edit.accept(root);
        return mapper.writeValueAsString(root);
    }

    private MalformedMetricRecordException assertMalformed(String json) {
        return assertThrows(MalformedMetricRecordException.class, () -> MetricRecordStore.fromJson(json));
    }

    @Test
    void testMissingFieldReported() throws IOException {
        String json = corrupt(root -> root.remove("dead_ant_z_cut"));

        assertEquals("dead_ant_z_cut", assertMalformed(json).field());
    }

    @Test
    void testBadKeyReported() throws IOException {
        String json = corrupt(root -> {
            ArrayNode key = (ArrayNode) root.get("final_metrics").get("meanVij").get(0).get("key");
            key.set(0, mapper.getNodeFactory().textNode("zero"));
        });

        assertEquals("final_metrics.meanVij[0].key", assertMalformed(json).field());
    }

    @Test
    void testBadValueReported() throws IOException {
        String json = corrupt(root -> ((ObjectNode) root.get("all_metrics").get(1).get("redCorr").get(3))
                .put("value", "__import__('os')"));

        assertEquals("all_metrics[1].redCorr[3].value", assertMalformed(json).field());
    }

    @Test
    void testUnknownMetricReported() throws IOException {
        String json = corrupt(root -> ((ObjectNode) root.get("final_metrics")).putArray("ampRMS"));

        assertEquals("final_metrics.ampRMS", assertMalformed(json).field());
    }

    @Test
    void testInconsistentRemovalRoundsReported() throws IOException {
        String json = corrupt(root -> ((ArrayNode) root.get("removal_round_index")).remove(0));

        assertEquals("removal_round_index", assertMalformed(json).field());
    }

    private static ArrayNode keys(Object... antennaPolPairs) {
        ArrayNode keys = mapper.createArrayNode();
        for (int i = 0; i < antennaPolPairs.length; i += 2) {
            ArrayNode key = keys.addArray();
            key.add((Integer) antennaPolPairs[i]);
            key.add((String) antennaPolPairs[i + 1]);
        }
        return keys;
    }

    @Test
    void testReasonListsContradictingExclusionsReported() throws IOException {
        String json = corrupt(root -> {
            root.set("antennas_removed_as_dead", keys(2, "x", 2, "y"));
            root.set("antennas_removed_as_crossed", keys(99, "q"));
        });

        assertEquals("antennas_removed_as_crossed", assertMalformed(json).field());
    }

    @Test
    void testKeyRemovedForBothReasonsReported() throws IOException {
        String json = corrupt(root -> root.set("antennas_removed_as_dead", keys(2, "x", 2, "y")));

        assertEquals("antennas_removed_as_dead", assertMalformed(json).field());
    }

    @Test
    void testExcludedKeyWithoutReasonReported() throws IOException {
        String json = corrupt(root -> root.set("antennas_removed_as_crossed", keys(2, "x")));

        MalformedMetricRecordException e = assertMalformed(json);
        assertEquals("antennas_removed_as_crossed", e.field());
        assertTrue(e.getMessage().contains("(2, y)"));
    }

    @Test
    void testRoundWithMixedReasonsReported() throws IOException {
        String json = corrupt(root -> {
            root.set("antennas_removed_as_crossed", keys(2, "x"));
            root.set("antennas_removed_as_dead", keys(2, "y"));
        });

        MalformedMetricRecordException e = assertMalformed(json);
        assertEquals("antennas_removed_as_crossed", e.field());
        assertTrue(e.getMessage().contains("round 0"));
    }

    @Test
    void testDuplicateExcludedKeyReported() throws IOException {
        String json = corrupt(root -> root.set("excluded_antennas", keys(2, "x", 2, "x")));

        assertEquals("excluded_antennas[1]", assertMalformed(json).field());
    }

    @Test
    void testUnsupportedVersionReported() throws IOException {
        String json = corrupt(root -> root.put("version", 99));

        assertEquals("version", assertMalformed(json).field());
    }

    @Test
    void testNotJson() {
        assertEquals("$", assertMalformed("{'excluded_antennas': [(0, 'x')]}").field());
        assertEquals("$", assertMalformed("[]").field());
    }
}
