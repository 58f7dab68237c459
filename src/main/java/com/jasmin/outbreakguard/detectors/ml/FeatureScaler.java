package com.jasmin.outbreakguard.detectors.ml;

import org.apache.commons.math3.stat.descriptive.SummaryStatistics;

/**
 * Zero-mean / unit-variance scaling fitted on training rows only.
 * A constant column keeps unit scale, so it is centered but not stretched.
 */
public final class FeatureScaler {

    private final double[] means;
    private final double[] stds;
    private final boolean degenerate;

    private FeatureScaler(double[] means, double[] stds, boolean degenerate) {
        this.means = means;
        this.stds = stds;
        this.degenerate = degenerate;
    }

    public static FeatureScaler fit(double[][] rows) {
        int dims = rows[0].length;
        double[] means = new double[dims];
        double[] stds = new double[dims];
        boolean allConstant = true;
        for (int d = 0; d < dims; d++) {
            SummaryStatistics s = new SummaryStatistics();
            for (double[] row : rows) {
                s.addValue(row[d]);
            }
            means[d] = s.getMean();
            double sd = s.getStandardDeviation();
            if (sd > 0.0 && Double.isFinite(sd)) {
                stds[d] = sd;
                allConstant = false;
            } else {
                stds[d] = 1.0;
            }
        }
        return new FeatureScaler(means, stds, allConstant);
    }

    /** True when every column had zero variance in the training rows. */
    public boolean isDegenerate() {
        return degenerate;
    }

    public double[] transform(double[] row) {
        double[] out = new double[row.length];
        for (int d = 0; d < row.length; d++) {
            out[d] = (row[d] - means[d]) / stds[d];
        }
        return out;
    }

    public double[][] transform(double[][] rows) {
        double[][] out = new double[rows.length][];
        for (int i = 0; i < rows.length; i++) {
            out[i] = transform(rows[i]);
        }
        return out;
    }
}
