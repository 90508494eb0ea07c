package com.raditha.antmetrics.source;

import com.raditha.antmetrics.model.Baseline;
import com.raditha.antmetrics.model.VisibilityPol;
import org.apache.commons.math3.complex.Complex;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Visibility source backed by arrays already held in memory.
 * All waterfalls must share the same time and frequency dimensions.
 */
public class InMemoryVisibilitySource implements VisibilitySource {

    private record Key(Baseline baseline, VisibilityPol pol) {
    }

    private final Map<Key, Complex[][]> waterfalls;
    private final List<Integer> antennas;
    private final List<VisibilityPol> polarizations;
    private final List<String> feedPolarizations;
    private final List<Baseline> baselines;

    private InMemoryVisibilitySource(Map<Key, Complex[][]> waterfalls,
                                     List<Baseline> baselines,
                                     List<VisibilityPol> polarizations) {
        this.waterfalls = waterfalls;
        this.baselines = List.copyOf(baselines);
        this.polarizations = List.copyOf(polarizations);

        Set<Integer> ants = new TreeSet<>();
        for (Baseline baseline : baselines) {
            ants.add(baseline.i());
            ants.add(baseline.j());
        }
        this.antennas = List.copyOf(ants);

        Set<String> feeds = new LinkedHashSet<>();
        for (VisibilityPol pol : polarizations) {
            feeds.add(pol.firstFeed());
        }
        for (VisibilityPol pol : polarizations) {
            feeds.add(pol.secondFeed());
        }
        this.feedPolarizations = List.copyOf(feeds);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public List<Integer> antennas() {
        return antennas;
    }

    @Override
    public List<VisibilityPol> polarizations() {
        return polarizations;
    }

    @Override
    public List<String> feedPolarizations() {
        return feedPolarizations;
    }

    @Override
    public List<Baseline> baselines() {
        return baselines;
    }

    /**
     * Returns a copy of the stored waterfall. A baseline stored as (j, i) is
     * served as the conjugate of its data under the reversed polarization.
     */
    @Override
    public Complex[][] data(int i, int j, VisibilityPol pol) {
        Complex[][] waterfall = waterfalls.get(new Key(new Baseline(i, j), pol));
        if (waterfall != null) {
            return copyOf(waterfall);
        }
        Complex[][] reversed = waterfalls.get(new Key(new Baseline(j, i), pol.reversed()));
        if (reversed != null) {
            return conjugateOf(reversed);
        }
        throw new IllegalArgumentException("No visibilities for baseline (" + i + ", " + j + ") pol " + pol);
    }

    private static Complex[][] copyOf(Complex[][] waterfall) {
        Complex[][] copy = new Complex[waterfall.length][];
        for (int t = 0; t < waterfall.length; t++) {
            copy[t] = waterfall[t].clone();
        }
        return copy;
    }

    private static Complex[][] conjugateOf(Complex[][] waterfall) {
        Complex[][] conjugate = new Complex[waterfall.length][];
        for (int t = 0; t < waterfall.length; t++) {
            conjugate[t] = new Complex[waterfall[t].length];
            for (int f = 0; f < waterfall[t].length; f++) {
                conjugate[t][f] = waterfall[t][f].conjugate();
            }
        }
        return conjugate;
    }

    /**
     * Collects waterfalls one baseline and polarization at a time.
     */
    public static class Builder {
        private final Map<Key, Complex[][]> waterfalls = new HashMap<>();
        private final Set<Baseline> baselines = new LinkedHashSet<>();
        private final Set<VisibilityPol> polarizations = new LinkedHashSet<>();
        private int nTimes = -1;
        private int nFreqs = -1;

        public Builder add(int i, int j, String pol, Complex[][] waterfall) {
            return add(new Baseline(i, j), VisibilityPol.of(pol), waterfall);
        }

        public Builder add(Baseline baseline, VisibilityPol pol, Complex[][] waterfall) {
            checkShape(baseline, pol, waterfall);
            waterfalls.put(new Key(baseline, pol), copyOf(waterfall));
            baselines.add(baseline);
            polarizations.add(pol);
            return this;
        }

        public InMemoryVisibilitySource build() {
            List<Baseline> bls = new ArrayList<>(baselines);
            List<VisibilityPol> pols = new ArrayList<>(polarizations);
            for (Baseline baseline : bls) {
                for (VisibilityPol pol : pols) {
                    if (!waterfalls.containsKey(new Key(baseline, pol))) {
                        throw new IllegalArgumentException(
                                "Missing visibilities for baseline " + baseline + " pol " + pol);
                    }
                }
            }
            return new InMemoryVisibilitySource(new HashMap<>(waterfalls), bls, pols);
        }

        private void checkShape(Baseline baseline, VisibilityPol pol, Complex[][] waterfall) {
            if (waterfall == null || waterfall.length == 0 || waterfall[0].length == 0) {
                throw new IllegalArgumentException("Empty waterfall for baseline " + baseline + " pol " + pol);
            }
            int freqs = waterfall[0].length;
            for (Complex[] row : waterfall) {
                if (row.length != freqs) {
                    throw new IllegalArgumentException("Ragged waterfall for baseline " + baseline + " pol " + pol);
                }
            }
            if (nTimes < 0) {
                nTimes = waterfall.length;
                nFreqs = freqs;
            } else if (nTimes != waterfall.length || nFreqs != freqs) {
                throw new IllegalArgumentException(String.format(
                        "Waterfall for baseline %s pol %s is %dx%d, expected %dx%d",
                        baseline, pol, waterfall.length, freqs, nTimes, nFreqs));
            }
        }
    }
}
