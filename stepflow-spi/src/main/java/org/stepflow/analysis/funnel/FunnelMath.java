package org.stepflow.analysis.funnel;

import java.util.List;

/**
 * Rounding rules shared by every funnel figure.
 */
public final class FunnelMath {
    private FunnelMath() {
    }

    /**
     * {@code part / whole} as a percentage with two decimals, 0 when {@code whole} is not positive.
     */
    public static double percentage(long part, long whole) {
        if (whole <= 0) {
            return 0;
        }
        return Math.round(part * 10000.0 / whole) / 100.0;
    }

    public static long roundedMean(List<Double> samples) {
        if (samples.isEmpty()) {
            return 0;
        }
        double sum = 0;
        for (Double sample : samples) {
            sum += sample;
        }
        return roundedMean(sum / samples.size());
    }

    public static long roundedMean(double mean) {
        if (Double.isNaN(mean) || Double.isInfinite(mean)) {
            return 0;
        }
        return Math.round(mean);
    }
}
