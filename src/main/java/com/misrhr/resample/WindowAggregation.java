package com.misrhr.resample;

/**
 * Per-window aggregation rules of the downsampler. Each rule reduces the 16 values
 * of one 4x4 window to a single value and is total: degenerate windows still yield a value.
 */
public class WindowAggregation {
    public static final int LAND = 1;
    public static final int WATER = 2;
    public static final int CLOUD = 3;
    public static final int OBSCURED = 253;
    public static final int EDGE = 254;

    public static final double MAX_RADIANCE = 800.0;
    public static final double MAX_REFLECTANCE_FACTOR = 2.0;

    private WindowAggregation() {
    }

    public static double aggregate(GridKind kind, double[] window) {
        switch (kind) {
            case RDQI:
                return maximum(window);
            case MASK:
                return majorityMask(window);
            case SCALED_RADIANCE_WITH_FLAG:
                return scaledRadianceWithFlag(window);
            case RADIANCE:
                return meanOfUsable(window, MAX_RADIANCE);
            case REFLECTANCE_FACTOR:
                return meanOfUsable(window, MAX_REFLECTANCE_FACTOR);
            default:
                throw new IllegalStateException("no aggregation rule for " + kind);
        }
    }

    // RDQI: every value in [0, 3] is usable, the worst quality wins
    public static double maximum(double[] window) {
        double max = window[0];
        for (int k = 1; k < window.length; k++) {
            if (window[k] > max) max = window[k];
        }
        return max;
    }

    /**
     * Majority vote among land, water and cloud; a tie goes to the higher code.
     * When obscured and edge cells are at least as many as the classified ones, the more
     * frequent of the two sentinels is returned instead, edge on a tie.
     */
    public static double majorityMask(double[] window) {
        int[] counts = new int[256];
        for (double v : window) {
            int code = (int) v;
            if (code >= 0 && code < counts.length) counts[code]++;
        }

        int usable = counts[LAND] + counts[WATER] + counts[CLOUD];
        int sentinels = counts[OBSCURED] + counts[EDGE];
        if (sentinels >= usable) {
            return counts[OBSCURED] > counts[EDGE] ? OBSCURED : EDGE;
        }

        int best = LAND;
        for (int code = LAND; code <= CLOUD; code++) {
            if (counts[code] >= counts[best]) best = code;
        }
        return best;
    }

    /**
     * Averages the radiance part of the usable values and re-attaches the worst flag among them.
     * A window without usable values keeps its largest raw value, which preserves the sentinel.
     */
    public static double scaledRadianceWithFlag(double[] window) {
        long radianceSum = 0;
        int usable = 0;
        int worstFlag = 0;
        int rawMax = 0;
        for (double v : window) {
            int value = (int) v;
            if (value > rawMax) rawMax = value;
            if (!ScaledRadiance.isUsable(value)) continue;

            radianceSum += ScaledRadiance.radianceOf(value);
            worstFlag = Math.max(worstFlag, ScaledRadiance.flagOf(value));
            usable++;
        }
        if (usable == 0) return rawMax;

        int radiance = (int) Math.round((double) radianceSum / usable);
        return ScaledRadiance.pack(radiance, worstFlag);
    }

    // Radiance and BRF: mean of the values in ]0, upper], 0.0 when none qualifies
    public static double meanOfUsable(double[] window, double upper) {
        double sum = 0.0;
        int usable = 0;
        for (double v : window) {
            if (v > 0.0 && v <= upper) {
                sum += v;
                usable++;
            }
        }
        return usable == 0 ? 0.0 : sum / usable;
    }
}
