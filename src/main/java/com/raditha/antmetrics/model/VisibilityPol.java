package com.raditha.antmetrics.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Two-character visibility polarization label such as "xx" or "xy".
 * The first character is the feed polarization of antenna i, the second the
 * feed polarization of antenna j.
 *
 * @param label lower-case two character label
 */
public record VisibilityPol(String label) {

    public VisibilityPol {
        if (label == null || label.length() != 2) {
            throw new IllegalArgumentException("Visibility polarization must have exactly two characters, got: " + label);
        }
        label = label.toLowerCase(Locale.ROOT);
    }

    public static VisibilityPol of(String label) {
        return new VisibilityPol(label);
    }

    /**
     * Feed polarization of the given side of the baseline (0 for antenna i, 1 for antenna j).
     */
    public String feed(int side) {
        if (side != 0 && side != 1) {
            throw new IllegalArgumentException("side must be 0 or 1, got: " + side);
        }
        return String.valueOf(label.charAt(side));
    }

    public String firstFeed() {
        return feed(0);
    }

    public String secondFeed() {
        return feed(1);
    }

    /**
     * The same polarization seen from the reversed baseline (j, i): "xy" becomes "yx".
     */
    public VisibilityPol reversed() {
        return new VisibilityPol(secondFeed() + firstFeed());
    }

    public boolean isCoPol() {
        return label.charAt(0) == label.charAt(1);
    }

    public boolean isCrossPol() {
        return !isCoPol();
    }

    /**
     * All visibility polarizations formed from the given feed polarizations,
     * in row-major order (for ["x", "y"]: xx, xy, yx, yy).
     */
    public static List<VisibilityPol> crossProduct(List<String> feeds) {
        List<VisibilityPol> pols = new ArrayList<>();
        for (String first : feeds) {
            for (String second : feeds) {
                pols.add(new VisibilityPol(first + second));
            }
        }
        return pols;
    }

    @Override
    public String toString() {
        return label;
    }
}
