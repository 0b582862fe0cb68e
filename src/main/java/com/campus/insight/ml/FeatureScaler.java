package com.campus.insight.ml;

import com.campus.insight.exception.InvalidInputException;
import org.apache.commons.math3.stat.descriptive.moment.Mean;
import org.apache.commons.math3.stat.descriptive.moment.StandardDeviation;

import java.io.Serializable;

/**
 * Zero-mean, unit-variance standardization. Columns with zero variance are only centered.
 */
public final class FeatureScaler implements Serializable {
    private static final long serialVersionUID = 1L;

    private final double[] means;
    private final double[] scales;

    private FeatureScaler(double[] means, double[] scales) {
        this.means = means;
        this.scales = scales;
    }

    public static FeatureScaler fit(double[][] rows) {
        if (rows.length == 0) {
            throw new InvalidInputException("cannot fit a scaler on zero rows");
        }
        int width = rows[0].length;
        double[] means = new double[width];
        double[] scales = new double[width];
        Mean mean = new Mean();
        StandardDeviation std = new StandardDeviation(false);
        for (int c = 0; c < width; c++) {
            double[] column = column(rows, c);
            means[c] = mean.evaluate(column);
            double s = std.evaluate(column);
            scales[c] = s == 0.0 ? 1.0 : s;
        }
        return new FeatureScaler(means, scales);
    }

    public double[] transform(double[] row) {
        if (row.length != means.length) {
            throw new InvalidInputException("expected " + means.length + " features but got " + row.length);
        }
        double[] out = new double[row.length];
        for (int c = 0; c < row.length; c++) {
            out[c] = (row[c] - means[c]) / scales[c];
        }
        return out;
    }

    private static double[] column(double[][] rows, int c) {
        double[] out = new double[rows.length];
        for (int r = 0; r < rows.length; r++) {
            out[r] = rows[r][c];
        }
        return out;
    }
}
