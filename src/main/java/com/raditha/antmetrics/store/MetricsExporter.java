package com.raditha.antmetrics.store;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.model.AntennaMetric;
import com.raditha.antmetrics.model.FlaggingResult;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Exports a per antenna polarization summary of a flagging run to CSV.
 */
public class MetricsExporter {

    /**
     * Final state of one antenna polarization.
     *
     * @param key          the antenna polarization
     * @param status       {@code ok}, {@code dead} or {@code crossed}
     * @param removalRound round the key was removed in, null if it was kept
     * @param finalMetrics last raw value of each metric, missing if never computed
     * @param finalZScores last modified z-score of each metric
     */
    public record AntennaRow(
            AntPol key,
            String status,
            Integer removalRound,
            Map<AntennaMetric, Double> finalMetrics,
            Map<AntennaMetric, Double> finalZScores) {
    }

    /**
     * One row per antenna polarization seen in any metric, ordered by antenna then polarization.
     */
    public List<AntennaRow> buildRows(FlaggingResult result) {
        TreeSet<AntPol> keys = new TreeSet<>(Comparator.comparingInt(AntPol::antenna).thenComparing(AntPol::pol));
        for (AntennaMetric metric : AntennaMetric.values()) {
            keys.addAll(result.finalMetrics().get(metric).keySet());
        }
        keys.addAll(result.excluded());

        List<AntennaRow> rows = new ArrayList<>();
        for (AntPol key : keys) {
            Map<AntennaMetric, Double> metrics = new EnumMap<>(AntennaMetric.class);
            Map<AntennaMetric, Double> zScores = new EnumMap<>(AntennaMetric.class);
            for (AntennaMetric metric : AntennaMetric.values()) {
                Double raw = result.finalMetrics().get(metric).get(key);
                if (raw != null) {
                    metrics.put(metric, raw);
                }
                Double z = result.finalZScores().get(metric).get(key);
                if (z != null) {
                    zScores.put(metric, z);
                }
            }
            rows.add(new AntennaRow(key, status(result, key), result.removalRound().get(key), metrics, zScores));
        }
        return rows;
    }

    private String status(FlaggingResult result, AntPol key) {
        if (result.crossedRemoved().contains(key)) {
            return "crossed";
        } else if (result.deadRemoved().contains(key)) {
            return "dead";
        }
        return "ok";
    }

    /**
     * Export the run summary and per-key rows to CSV format.
     */
    public void exportToCsv(FlaggingResult result, Path outputPath) throws IOException {
        StringBuilder csv = new StringBuilder();

        // Header - Summary
        csv.append("# Run Summary\n");
        csv.append("rounds,excluded,dead,crossed,dead_cut,cross_cut\n");
        csv.append(String.format(Locale.ROOT, "%d,%d,%d,%d,%.2f,%.2f\n",
                result.roundCount(),
                result.excluded().size(),
                result.deadRemoved().size(),
                result.crossedRemoved().size(),
                result.deadCut(),
                result.crossCut()));

        csv.append("\n");

        // Header - Per-key metrics
        csv.append("# Per-Antenna Metrics\n");
        csv.append("antenna,pol,status,removal_round");
        for (AntennaMetric metric : AntennaMetric.values()) {
            csv.append(',').append(metric.key());
        }
        for (AntennaMetric metric : AntennaMetric.values()) {
            csv.append(',').append(metric.key()).append("_z");
        }
        csv.append('\n');

        for (AntennaRow row : buildRows(result)) {
            csv.append(row.key().antenna()).append(',')
                    .append(row.key().pol()).append(',')
                    .append(row.status()).append(',')
                    .append(row.removalRound() == null ? "" : row.removalRound().toString());
            for (AntennaMetric metric : AntennaMetric.values()) {
                csv.append(',').append(format(row.finalMetrics().get(metric)));
            }
            for (AntennaMetric metric : AntennaMetric.values()) {
                csv.append(',').append(format(row.finalZScores().get(metric)));
            }
            csv.append('\n');
        }

        Files.writeString(outputPath, csv.toString());
    }

    private static String format(Double value) {
        if (value == null) {
            return "";
        }
        return String.format(Locale.ROOT, "%.6f", value);
    }
}
