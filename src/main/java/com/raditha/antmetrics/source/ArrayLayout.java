package com.raditha.antmetrics.source;

import com.raditha.antmetrics.model.Baseline;
import com.raditha.antmetrics.model.RedundantGroup;
import com.raditha.antmetrics.model.VisibilityPol;

import java.util.HashSet;
import java.util.List;

/**
 * Antenna, polarization and baseline metadata shared by all metric calculators.
 * Only dual-polarization arrays are supported: two feed polarizations and the
 * four visibility polarizations formed from them.
 *
 * @param antennas      all antenna indices
 * @param feeds         the two feed polarizations
 * @param polarizations the four visibility polarizations
 * @param baselines     all antenna pairs, self-baselines included
 * @param reds          redundant baseline groups supplied by the caller
 */
public record ArrayLayout(
        List<Integer> antennas,
        List<String> feeds,
        List<VisibilityPol> polarizations,
        List<Baseline> baselines,
        List<RedundantGroup> reds) {

    public ArrayLayout {
        antennas = List.copyOf(antennas);
        feeds = List.copyOf(feeds);
        polarizations = List.copyOf(polarizations);
        baselines = List.copyOf(baselines);
        reds = reds == null ? List.of() : List.copyOf(reds);
        validatePolarizations(feeds, polarizations);
    }

    /**
     * Read the layout from a visibility source.
     *
     * @throws IllegalArgumentException if the source is not dual-polarization
     */
    public static ArrayLayout from(VisibilitySource source, List<RedundantGroup> reds) {
        return new ArrayLayout(
                source.antennas(),
                source.feedPolarizations(),
                source.polarizations(),
                source.baselines(),
                reds);
    }

    public List<VisibilityPol> coPolarizations() {
        return polarizations.stream().filter(VisibilityPol::isCoPol).toList();
    }

    public List<VisibilityPol> crossPolarizations() {
        return polarizations.stream().filter(VisibilityPol::isCrossPol).toList();
    }

    /**
     * Upper bound on flagging rounds: every antenna polarization removed once.
     */
    public int maxRounds() {
        return antennas.size() * feeds.size();
    }

    private static void validatePolarizations(List<String> feeds, List<VisibilityPol> polarizations) {
        if (feeds.size() != 2 || polarizations.size() != 4
                || !new HashSet<>(polarizations).equals(new HashSet<>(VisibilityPol.crossProduct(feeds)))) {
            throw new IllegalArgumentException(
                    "Missing polarization information. pols = " + polarizations + " and feed pols = " + feeds);
        }
    }
}
