package com.jasmin.outbreakguard.baseline;

import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.MetricPoint;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;

import java.time.Instant;
import java.util.List;

/** Pure baseline statistics over a list of points. */
public final class BaselineCalculator {

    private BaselineCalculator() {
    }

    public static Baseline compute(List<MetricPoint> points, int minSamples) {
        Instant start = points.isEmpty() ? null : points.get(0).getTimestamp();
        Instant end = points.isEmpty() ? null : points.get(points.size() - 1).getTimestamp();
        if (points.size() < minSamples) {
            return Baseline.insufficient(points.size(), start, end);
        }

        double[] values = points.stream().mapToDouble(MetricPoint::getValue).toArray();
        DescriptiveStatistics stats = new DescriptiveStatistics(values);
        double median = percentile(values, 50);

        double[] absDev = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            absDev[i] = Math.abs(values[i] - median);
        }

        return Baseline.builder()
                .mean(stats.getMean())
                .stdDev(values.length > 1 ? stats.getStandardDeviation() : 0.0)
                .median(median)
                .mad(percentile(absDev, 50))
                .q1(percentile(values, 25))
                .q3(percentile(values, 75))
                .sampleCount(values.length)
                .windowStart(start)
                .windowEnd(end)
                .insufficientData(false)
                .build();
    }

    /** Linear-interpolation percentile (R-7, same as numpy/pandas defaults). */
    public static double percentile(double[] values, double p) {
        if (values.length == 0) {
            return 0.0;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_7)
                .evaluate(values, p);
    }
}
