package com.campus.insight.analytics;

import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Correlations {
    private static final Logger log = LoggerFactory.getLogger(Correlations.class);

    private Correlations() {}

    /**
     * Pearson's r, or 0.0 when it is undefined (fewer than two points or a constant series).
     */
    public static double pearson(double[] x, double[] y) {
        if (x.length < 2 || x.length != y.length) {
            log.debug("Correlation undefined for {} and {} points", x.length, y.length);
            return 0.0;
        }
        double r = new PearsonsCorrelation().correlation(x, y);
        if (Double.isNaN(r)) {
            log.debug("Correlation undefined for a constant series of {} points", x.length);
            return 0.0;
        }
        return r;
    }

    public static String describe(double r) {
        if (r >= 0.7) return "Strong positive correlation";
        if (r >= 0.4) return "Moderate positive correlation";
        if (r >= 0.2) return "Weak positive correlation";
        if (r > -0.2) return "No significant correlation";
        if (r > -0.4) return "Weak negative correlation";
        if (r > -0.7) return "Moderate negative correlation";
        return "Strong negative correlation";
    }

    static double round3(double v) {
        return Math.round(v * 1000.0) / 1000.0;
    }
}
