package com.raditha.antmetrics.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.model.AntennaMetric;
import com.raditha.antmetrics.model.FlaggingResult;
import com.raditha.antmetrics.model.IterationRecord;
import com.raditha.antmetrics.model.MetricSet;
import com.raditha.antmetrics.model.RemovalReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Saves and loads flagging results as JSON.
 * <p>
 * Antenna polarizations are written as {@code [antenna, "pol"]} pairs and
 * per-key values as arrays of {@code {"key": [..], "value": ..}} objects, so
 * that key order survives a round trip. Non-finite values are written as the
 * strings {@code "NaN"}, {@code "Infinity"} and {@code "-Infinity"}.
 * Loading validates every field; nothing in the file is ever evaluated.
 */
public class MetricRecordStore {

    private static final Logger logger = LoggerFactory.getLogger(MetricRecordStore.class);

    public static final int FORMAT_VERSION = 1;

    static final String VERSION = "version";
    static final String EXCLUDED = "excluded_antennas";
    static final String CROSSED = "antennas_removed_as_crossed";
    static final String DEAD = "antennas_removed_as_dead";
    static final String FINAL_METRICS = "final_metrics";
    static final String ALL_METRICS = "all_metrics";
    static final String FINAL_Z_SCORES = "final_modified_z_scores";
    static final String ALL_Z_SCORES = "all_modified_z_scores";
    static final String REMOVAL_ROUND = "removal_round_index";
    static final String CROSS_CUT = "cross_pol_z_cut";
    static final String DEAD_CUT = "dead_ant_z_cut";

    private static final ObjectMapper mapper = new ObjectMapper();

    private MetricRecordStore() {
    }

    /**
     * Write the result to a file, creating parent directories as needed.
     */
    public static void save(FlaggingResult result, Path filePath) throws IOException {
        Path parent = filePath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(filePath, toJson(result));
        logger.info("Saved antenna metrics for {} rounds to {}", result.roundCount(), filePath);
    }

    /**
     * Read a result previously written by {@link #save}.
     *
     * @throws MalformedMetricRecordException if the file is not a valid record
     */
    public static FlaggingResult load(Path filePath) throws IOException {
        FlaggingResult result = fromJson(Files.readString(filePath));
        logger.info("Loaded antenna metrics for {} rounds from {}", result.roundCount(), filePath);
        return result;
    }

    public static String toJson(FlaggingResult result) throws JsonProcessingException {
        ObjectNode root = mapper.createObjectNode();
        root.put(VERSION, FORMAT_VERSION);
        root.set(EXCLUDED, writeKeys(result.excluded()));
        root.set(CROSSED, writeKeys(result.crossedRemoved()));
        root.set(DEAD, writeKeys(result.deadRemoved()));
        root.set(FINAL_METRICS, writeMetricSet(result.finalMetrics()));
        root.set(FINAL_Z_SCORES, writeMetricSet(result.finalZScores()));

        ArrayNode allMetrics = root.putArray(ALL_METRICS);
        ArrayNode allZScores = root.putArray(ALL_Z_SCORES);
        for (IterationRecord iteration : result.iterations()) {
            allMetrics.add(writeMetricSet(iteration.rawMetrics()));
            allZScores.add(writeMetricSet(iteration.zScores()));
        }

        ArrayNode rounds = root.putArray(REMOVAL_ROUND);
        result.removalRound().forEach((key, round) -> {
            ObjectNode entry = rounds.addObject();
            entry.set("key", writeKey(key));
            entry.put("round", round);
        });

        root.set(CROSS_CUT, writeDouble(result.crossCut()));
        root.set(DEAD_CUT, writeDouble(result.deadCut()));
        return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
    }

    public static FlaggingResult fromJson(String json) throws MalformedMetricRecordException {
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new MalformedMetricRecordException("$", "not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMetricRecordException("$", "expected a JSON object");
        }

        JsonNode version = require(root, VERSION);
        if (!version.isInt() || version.intValue() != FORMAT_VERSION) {
            throw new MalformedMetricRecordException(VERSION, "unsupported version " + version);
        }

        List<AntPol> excluded = readKeys(require(root, EXCLUDED), EXCLUDED);
        List<AntPol> crossed = readKeys(require(root, CROSSED), CROSSED);
        List<AntPol> dead = readKeys(require(root, DEAD), DEAD);
        MetricSet finalMetrics = readMetricSet(require(root, FINAL_METRICS), FINAL_METRICS);
        MetricSet finalZScores = readMetricSet(require(root, FINAL_Z_SCORES), FINAL_Z_SCORES);
        List<MetricSet> allMetrics = readMetricSets(require(root, ALL_METRICS), ALL_METRICS);
        List<MetricSet> allZScores = readMetricSets(require(root, ALL_Z_SCORES), ALL_Z_SCORES);
        Map<AntPol, Integer> removalRound = readRemovalRounds(require(root, REMOVAL_ROUND));
        double crossCut = readDouble(require(root, CROSS_CUT), CROSS_CUT);
        double deadCut = readDouble(require(root, DEAD_CUT), DEAD_CUT);

        if (allMetrics.size() != allZScores.size()) {
            throw new MalformedMetricRecordException(ALL_Z_SCORES,
                    "has " + allZScores.size() + " rounds but " + ALL_METRICS + " has " + allMetrics.size());
        }
        if (!removalRound.keySet().equals(new HashSet<>(excluded))) {
            throw new MalformedMetricRecordException(REMOVAL_ROUND, "keys differ from " + EXCLUDED);
        }
        for (Map.Entry<AntPol, Integer> entry : removalRound.entrySet()) {
            if (entry.getValue() >= allMetrics.size()) {
                throw new MalformedMetricRecordException(REMOVAL_ROUND,
                        entry.getKey() + " removed in round " + entry.getValue() + " but only "
                                + allMetrics.size() + " rounds were recorded");
            }
        }

        Set<AntPol> crossedSet = new HashSet<>(crossed);
        Set<AntPol> excludedSet = new HashSet<>(excluded);
        checkRemovalLists(crossedSet, new HashSet<>(dead), excludedSet);

        List<IterationRecord> iterations = new ArrayList<>();
        for (int round = 0; round < allMetrics.size(); round++) {
            List<AntPol> removed = new ArrayList<>();
            for (AntPol key : excluded) {
                if (removalRound.get(key) == round) {
                    removed.add(key);
                }
            }
            RemovalReason reason = null;
            if (!removed.isEmpty()) {
                reason = crossedSet.contains(removed.get(0)) ? RemovalReason.CROSSED : RemovalReason.DEAD;
                for (AntPol key : removed) {
                    if (crossedSet.contains(key) != (reason == RemovalReason.CROSSED)) {
                        throw new MalformedMetricRecordException(CROSSED,
                                "round " + round + " removes both crossed and dead keys " + removed);
                    }
                }
            }
            iterations.add(new IterationRecord(round, allMetrics.get(round), allZScores.get(round), removed, reason));
        }

        return new FlaggingResult(excluded, crossed, dead, removalRound, finalMetrics, finalZScores,
                iterations, crossCut, deadCut);
    }

    /**
     * The crossed and dead lists must split the excluded keys between them.
     */
    private static void checkRemovalLists(Set<AntPol> crossed, Set<AntPol> dead, Set<AntPol> excluded)
            throws MalformedMetricRecordException {
        for (AntPol key : crossed) {
            if (dead.contains(key)) {
                throw new MalformedMetricRecordException(DEAD, key + " is also listed in " + CROSSED);
            }
            if (!excluded.contains(key)) {
                throw new MalformedMetricRecordException(CROSSED, key + " is not in " + EXCLUDED);
            }
        }
        for (AntPol key : dead) {
            if (!excluded.contains(key)) {
                throw new MalformedMetricRecordException(DEAD, key + " is not in " + EXCLUDED);
            }
        }
        for (AntPol key : excluded) {
            if (!crossed.contains(key) && !dead.contains(key)) {
                throw new MalformedMetricRecordException(CROSSED,
                        key + " is excluded but listed in neither " + CROSSED + " nor " + DEAD);
            }
        }
    }

    private static ArrayNode writeKey(AntPol key) {
        ArrayNode node = mapper.createArrayNode();
        node.add(key.antenna());
        node.add(key.pol());
        return node;
    }

    private static ArrayNode writeKeys(List<AntPol> keys) {
        ArrayNode node = mapper.createArrayNode();
        keys.forEach(key -> node.add(writeKey(key)));
        return node;
    }

    private static ObjectNode writeMetricSet(MetricSet metrics) {
        ObjectNode node = mapper.createObjectNode();
        for (AntennaMetric metric : AntennaMetric.values()) {
            ArrayNode values = node.putArray(metric.key());
            metrics.get(metric).forEach((key, value) -> {
                ObjectNode entry = values.addObject();
                entry.set("key", writeKey(key));
                entry.set("value", writeDouble(value));
            });
        }
        return node;
    }

    private static JsonNode writeDouble(double value) {
        if (Double.isFinite(value)) {
            return mapper.getNodeFactory().numberNode(value);
        }
        return mapper.getNodeFactory().textNode(Double.toString(value));
    }

    private static JsonNode require(JsonNode parent, String field) throws MalformedMetricRecordException {
        JsonNode node = parent.get(field);
        if (node == null || node.isNull()) {
            throw new MalformedMetricRecordException(field, "missing");
        }
        return node;
    }

    private static AntPol readKey(JsonNode node, String field) throws MalformedMetricRecordException {
        if (!node.isArray() || node.size() != 2 || !node.get(0).isInt() || !node.get(1).isTextual()
                || node.get(1).textValue().isBlank()) {
            throw new MalformedMetricRecordException(field, "expected [antenna, \"pol\"] but found " + node);
        }
        return new AntPol(node.get(0).intValue(), node.get(1).textValue());
    }

    private static List<AntPol> readKeys(JsonNode node, String field) throws MalformedMetricRecordException {
        if (!node.isArray()) {
            throw new MalformedMetricRecordException(field, "expected an array");
        }
        List<AntPol> keys = new ArrayList<>();
        Set<AntPol> seen = new HashSet<>();
        for (int i = 0; i < node.size(); i++) {
            AntPol key = readKey(node.get(i), field + "[" + i + "]");
            if (!seen.add(key)) {
                throw new MalformedMetricRecordException(field + "[" + i + "]", "duplicate key " + key);
            }
            keys.add(key);
        }
        return keys;
    }

    private static double readDouble(JsonNode node, String field) throws MalformedMetricRecordException {
        if (node.isNumber()) {
            return node.doubleValue();
        }
        if (node.isTextual()) {
            switch (node.textValue()) {
                case "NaN":
                    return Double.NaN;
                case "Infinity":
                    return Double.POSITIVE_INFINITY;
                case "-Infinity":
                    return Double.NEGATIVE_INFINITY;
                default:
                    break;
            }
        }
        throw new MalformedMetricRecordException(field, "expected a number but found " + node);
    }

    private static MetricSet readMetricSet(JsonNode node, String field) throws MalformedMetricRecordException {
        if (!node.isObject()) {
            throw new MalformedMetricRecordException(field, "expected an object");
        }
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            try {
                AntennaMetric.fromKey(name);
            } catch (IllegalArgumentException e) {
                throw new MalformedMetricRecordException(field + "." + name, "unknown metric", e);
            }
        }

        Map<AntennaMetric, Map<AntPol, Double>> values = new EnumMap<>(AntennaMetric.class);
        for (AntennaMetric metric : AntennaMetric.values()) {
            String metricField = field + "." + metric.key();
            JsonNode entries = require(node, metric.key(), metricField);
            if (!entries.isArray()) {
                throw new MalformedMetricRecordException(metricField, "expected an array");
            }
            Map<AntPol, Double> metricValues = new LinkedHashMap<>();
            for (int i = 0; i < entries.size(); i++) {
                String entryField = metricField + "[" + i + "]";
                JsonNode entry = entries.get(i);
                if (!entry.isObject()) {
                    throw new MalformedMetricRecordException(entryField, "expected an object");
                }
                AntPol key = readKey(require(entry, "key", entryField + ".key"), entryField + ".key");
                double value = readDouble(require(entry, "value", entryField + ".value"), entryField + ".value");
                if (metricValues.put(key, value) != null) {
                    throw new MalformedMetricRecordException(entryField + ".key", "duplicate key " + key);
                }
            }
            values.put(metric, metricValues);
        }
        return MetricSet.of(values);
    }

    private static List<MetricSet> readMetricSets(JsonNode node, String field) throws MalformedMetricRecordException {
        if (!node.isArray()) {
            throw new MalformedMetricRecordException(field, "expected an array");
        }
        List<MetricSet> sets = new ArrayList<>();
        for (int i = 0; i < node.size(); i++) {
            sets.add(readMetricSet(node.get(i), field + "[" + i + "]"));
        }
        return sets;
    }

    private static Map<AntPol, Integer> readRemovalRounds(JsonNode node) throws MalformedMetricRecordException {
        if (!node.isArray()) {
            throw new MalformedMetricRecordException(REMOVAL_ROUND, "expected an array");
        }
        Map<AntPol, Integer> rounds = new LinkedHashMap<>();
        for (int i = 0; i < node.size(); i++) {
            String entryField = REMOVAL_ROUND + "[" + i + "]";
            JsonNode entry = node.get(i);
            if (!entry.isObject()) {
                throw new MalformedMetricRecordException(entryField, "expected an object");
            }
            AntPol key = readKey(require(entry, "key", entryField + ".key"), entryField + ".key");
            JsonNode round = require(entry, "round", entryField + ".round");
            if (!round.isInt() || round.intValue() < 0) {
                throw new MalformedMetricRecordException(entryField + ".round",
                        "expected a non-negative integer but found " + round);
            }
            rounds.put(key, round.intValue());
        }
        return rounds;
    }

    private static JsonNode require(JsonNode parent, String name, String field) throws MalformedMetricRecordException {
        JsonNode node = parent.get(name);
        if (node == null || node.isNull()) {
            throw new MalformedMetricRecordException(field, "missing");
        }
        return node;
    }
}
