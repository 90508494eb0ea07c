package com.raditha.antmetrics.source;

import com.raditha.antmetrics.model.VisibilityPol;
import com.raditha.antmetrics.support.SyntheticArray;
import org.apache.commons.math3.complex.Complex;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArrayLayoutTest {

    private static Complex[][] ones() {
        return new Complex[][]{{Complex.ONE}};
    }

    @Test
    void testDualPolarizationLayout() {
        ArrayLayout layout = ArrayLayout.from(SyntheticArray.fourAntennas().build(), SyntheticArray.fourAntennaReds());

        assertEquals(List.of(VisibilityPol.of("xx"), VisibilityPol.of("yy")), layout.coPolarizations());
        assertEquals(List.of(VisibilityPol.of("xy"), VisibilityPol.of("yx")), layout.crossPolarizations());
        assertEquals(8, layout.maxRounds());
        assertEquals(2, layout.reds().size());
    }

    @Test
    void testOnlyCoPolarizationsRejected() {
        VisibilitySource source = InMemoryVisibilitySource.builder()
                .add(0, 1, "xx", ones())
                .add(0, 1, "yy", ones())
                .build();

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ArrayLayout.from(source, List.of()));
        assertTrue(e.getMessage().startsWith("Missing polarization information"));
    }

    @Test
    void testIncompleteCrossProductRejected() {
        VisibilitySource source = InMemoryVisibilitySource.builder()
                .add(0, 1, "xx", ones())
                .add(0, 1, "xy", ones())
                .add(0, 1, "yy", ones())
                .build();

        assertThrows(IllegalArgumentException.class, () -> ArrayLayout.from(source, List.of()));
    }

    @Test
    void testNullRedsTreatedAsEmpty() {
        ArrayLayout layout = ArrayLayout.from(SyntheticArray.fourAntennas().build(), null);

        assertTrue(layout.reds().isEmpty());
    }
}
