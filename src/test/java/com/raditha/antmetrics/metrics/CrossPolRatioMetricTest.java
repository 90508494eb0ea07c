package com.raditha.antmetrics.metrics;

import com.raditha.antmetrics.model.AntPol;
import com.raditha.antmetrics.source.ArrayLayout;
import com.raditha.antmetrics.source.VisibilitySource;
import com.raditha.antmetrics.support.SyntheticArray;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class CrossPolRatioMetricTest {

    private static final double TOLERANCE = 1e-9;
    private static final List<String> FEEDS = List.of("x", "y");

    private ArrayLayout layout;
    private MeanAmplitudeCrossPolRatio meanAmplitudeRatio;
    private RedundantCorrelationCrossPolRatio correlationRatio;

    @BeforeEach
    void setUp() {
        VisibilitySource source = SyntheticArray.brightAntenna().build();
        layout = ArrayLayout.from(source, SyntheticArray.brightAntennaReds());
        meanAmplitudeRatio = new MeanAmplitudeCrossPolRatio(new MeanAmplitudeMetric(source, layout), layout);
        correlationRatio = new RedundantCorrelationCrossPolRatio(new RedundantCorrelationMetric(source, layout), layout);
    }

    @Test
    void testExpandPartialExclusions() {
        Set<AntPol> expanded = CrossPolRatioMetric.expandPartialExclusions(FEEDS, Set.of(new AntPol(3, "y")));

        assertEquals(Set.of(new AntPol(3, "x"), new AntPol(3, "y")), expanded);
        assertTrue(CrossPolRatioMetric.expandPartialExclusions(FEEDS, Set.of()).isEmpty());
    }

    @Test
    void testSumRatioStoresOneValuePerAntenna() {
        Map<AntPol, Double> cross = Map.of(
                new AntPol(0, "x"), 1.0, new AntPol(0, "y"), 3.0,
                new AntPol(1, "x"), 2.0, new AntPol(1, "y"), 2.0);
        Map<AntPol, Double> same = Map.of(
                new AntPol(0, "x"), 4.0, new AntPol(0, "y"), 4.0,
                new AntPol(1, "x"), 1.0, new AntPol(1, "y"), 1.0);

        Map<AntPol, Double> ratio = CrossPolRatioMetric.sumRatio(List.of(0, 1), FEEDS, cross, same, Set.of());

        assertEquals(0.5, ratio.get(new AntPol(0, "x")));
        assertEquals(0.5, ratio.get(new AntPol(0, "y")));
        assertEquals(2.0, ratio.get(new AntPol(1, "y")));
    }

    @Test
    void testSumRatioSkipsExcludedAntennas() {
        Map<AntPol, Double> values = Map.of(new AntPol(1, "x"), 1.0, new AntPol(1, "y"), 1.0);

        Map<AntPol, Double> ratio = CrossPolRatioMetric.sumRatio(List.of(0, 1), FEEDS, values, values,
                Set.of(new AntPol(0, "x"), new AntPol(0, "y")));

        assertEquals(Set.of(new AntPol(1, "x"), new AntPol(1, "y")), ratio.keySet());
    }

    @Test
    void testMeanAmplitudeRatio() {
        Map<AntPol, Double> raw = meanAmplitudeRatio.raw(Set.of());

        // cross / co amplitudes summed over both feeds
        double antenna0 = (2 * (10.0 + 11.11) / 2) / (2 * (100.0 + 101.0) / 2);
        assertEquals(antenna0, raw.get(new AntPol(0, "x")), TOLERANCE);
        assertEquals(raw.get(new AntPol(0, "x")), raw.get(new AntPol(0, "y")));
    }

    @Test
    void testPartialExclusionRemovesWholeAntenna() {
        Map<AntPol, Double> raw = meanAmplitudeRatio.raw(Set.of(new AntPol(0, "x")));

        assertEquals(Set.of(new AntPol(1, "x"), new AntPol(1, "y"), new AntPol(2, "x"), new AntPol(2, "y")),
                raw.keySet());
        assertEquals((10.0 + 0.1515) / (100.0 + 1.01), raw.get(new AntPol(1, "x")), TOLERANCE);
        assertEquals((11.11 + 0.1515) / (101.0 + 1.01), raw.get(new AntPol(2, "y")), TOLERANCE);
    }

    @Test
    void testRedundantCorrelationRatio() {
        Map<AntPol, Double> raw = correlationRatio.raw(Set.of());

        assertEquals(0.5, raw.get(new AntPol(0, "x")), TOLERANCE);
        assertEquals(0.5 / 1.1, raw.get(new AntPol(1, "y")), TOLERANCE);
        assertEquals(0.375, raw.get(new AntPol(2, "x")), TOLERANCE);
    }

    @Test
    void testZScoresHaveSameKeysAsRaw() {
        assertEquals(correlationRatio.raw(Set.of()).keySet(), correlationRatio.zScores(Set.of()).keySet());
    }
}
