package com.raditha.antmetrics.source;

import com.raditha.antmetrics.model.Baseline;
import com.raditha.antmetrics.model.VisibilityPol;
import org.apache.commons.math3.complex.Complex;

import java.util.List;

/**
 * Read-only access to a fully loaded set of visibilities.
 * Implementations must be safe for concurrent reads.
 */
public interface VisibilitySource {

    /**
     * Antenna indices present in the data.
     */
    List<Integer> antennas();

    /**
     * Visibility polarizations present in the data.
     */
    List<VisibilityPol> polarizations();

    /**
     * Feed polarizations that make up the visibility polarizations.
     */
    List<String> feedPolarizations();

    /**
     * Antenna pairs present in the data.
     */
    List<Baseline> baselines();

    /**
     * Complex visibilities for one baseline and polarization, indexed [time][frequency].
     * The caller owns the returned array. A baseline present only as (j, i) is
     * read as the conjugate of its data under the reversed polarization.
     *
     * @throws IllegalArgumentException if the baseline or polarization is not present
     */
    Complex[][] data(int i, int j, VisibilityPol pol);

    default Complex[][] data(Baseline baseline, VisibilityPol pol) {
        return data(baseline.i(), baseline.j(), pol);
    }
}
