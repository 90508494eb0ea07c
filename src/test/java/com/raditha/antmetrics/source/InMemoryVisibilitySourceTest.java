package com.raditha.antmetrics.source;

import com.raditha.antmetrics.model.Baseline;
import com.raditha.antmetrics.model.VisibilityPol;
import com.raditha.antmetrics.support.SyntheticArray;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryVisibilitySourceTest {

    private static Complex[][] constant(int times, int freqs, double value) {
        Complex[][] data = new Complex[times][freqs];
        for (int t = 0; t < times; t++) {
            for (int f = 0; f < freqs; f++) {
                data[t][f] = new Complex(value, 0.0);
            }
        }
        return data;
    }

    @Test
    void testMetadataFromWaterfalls() {
        InMemoryVisibilitySource source = SyntheticArray.fourAntennas().build();

        assertEquals(List.of(0, 1, 2, 3), source.antennas());
        assertEquals(List.of("x", "y"), source.feedPolarizations());
        assertEquals(VisibilityPol.crossProduct(List.of("x", "y")), source.polarizations());
        assertEquals(6, source.baselines().size());
        assertEquals(new Baseline(0, 1), source.baselines().get(0));
    }

    @Test
    void testDataLookup() {
        InMemoryVisibilitySource source = InMemoryVisibilitySource.builder()
                .add(0, 1, "xx", constant(2, 3, 4.0))
                .build();

        assertEquals(4.0, source.data(0, 1, VisibilityPol.of("xx"))[1][2].getReal());
        assertEquals(4.0, source.data(new Baseline(0, 1), VisibilityPol.of("xx"))[0][0].getReal());
        assertThrows(IllegalArgumentException.class, () -> source.data(2, 3, VisibilityPol.of("xx")));
        assertThrows(IllegalArgumentException.class, () -> source.data(0, 1, VisibilityPol.of("yy")));
    }

    @Test
    void testReversedBaselineIsConjugateUnderReversedPolarization() {
        Complex[][] waterfall = constant(2, 2, 0.0);
        waterfall[1][0] = new Complex(1.0, 2.0);
        InMemoryVisibilitySource source = InMemoryVisibilitySource.builder()
                .add(0, 1, "xy", waterfall)
                .build();

        Complex[][] reversed = source.data(1, 0, VisibilityPol.of("yx"));

        assertEquals(new Complex(1.0, -2.0), reversed[1][0]);
        assertEquals(2, reversed.length);
        assertThrows(IllegalArgumentException.class, () -> source.data(1, 0, VisibilityPol.of("xy")));
    }

    @Test
    void testReturnedDataCannotChangeSource() {
        InMemoryVisibilitySource source = InMemoryVisibilitySource.builder()
                .add(0, 1, "xx", constant(2, 2, 1.0))
                .build();

        source.data(0, 1, VisibilityPol.of("xx"))[0][0] = new Complex(9.0, 0.0);

        assertEquals(1.0, source.data(0, 1, VisibilityPol.of("xx"))[0][0].getReal());
    }

    @Test
    void testWaterfallsAreCopied() {
        Complex[][] waterfall = constant(2, 2, 1.0);
        InMemoryVisibilitySource source = InMemoryVisibilitySource.builder()
                .add(0, 1, "xx", waterfall)
                .build();
        waterfall[0][0] = new Complex(9.0, 0.0);

        assertEquals(1.0, source.data(0, 1, VisibilityPol.of("xx"))[0][0].getReal());
    }

    @Test
    void testMismatchedShapeRejected() {
        InMemoryVisibilitySource.Builder builder = InMemoryVisibilitySource.builder()
                .add(0, 1, "xx", constant(2, 3, 1.0));

        assertThrows(IllegalArgumentException.class, () -> builder.add(0, 2, "xx", constant(3, 3, 1.0)));
        assertThrows(IllegalArgumentException.class, () -> builder.add(0, 2, "xx", new Complex[0][0]));
    }

    @Test
    void testMissingPolarizationForBaselineRejected() {
        InMemoryVisibilitySource.Builder builder = InMemoryVisibilitySource.builder()
                .add(0, 1, "xx", constant(2, 2, 1.0))
                .add(0, 1, "yy", constant(2, 2, 1.0))
                .add(0, 2, "xx", constant(2, 2, 1.0));

        assertThrows(IllegalArgumentException.class, builder::build);
    }
}
