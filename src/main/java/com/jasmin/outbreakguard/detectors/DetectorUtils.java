package com.jasmin.outbreakguard.detectors;

public class DetectorUtils {

    /** Clamps into [0, 1]; NaN maps to 0. */
    public static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.max(0.0, Math.min(1.0, v));
    }

    /** Returns {@code v} if its magnitude is at least {@code eps}, otherwise {@code eps}. */
    public static double floor(double v, double eps) {
        return Math.abs(v) < eps ? eps : Math.abs(v);
    }

    /**
     * Percentage deviation of {@code current} from {@code reference}.
     * Returns 0 when the reference is within {@code eps} of zero.
     */
    public static double deviationPercent(double current, double reference, double eps) {
        if (Math.abs(reference) < eps) {
            return 0.0;
        }
        return (current - reference) / reference * 100.0;
    }

    /**
     * Bucket-over-bucket change in percent, or NaN when the previous value is zero
     * (the change is undefined and must not count toward a trend).
     */
    public static double rateOfChange(double previous, double current) {
        if (previous == 0.0) {
            return Double.NaN;
        }
        return (current - previous) / Math.abs(previous) * 100.0;
    }
}
