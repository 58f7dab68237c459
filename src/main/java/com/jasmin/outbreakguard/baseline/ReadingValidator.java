package com.jasmin.outbreakguard.baseline;

import com.jasmin.outbreakguard.exceptions.InvalidReadingException;
import com.jasmin.outbreakguard.models.ReadingVector;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public final class ReadingValidator {

    private ReadingValidator() {
    }

    /**
     * Checks required fields and finiteness of a reading.
     *
     * @throws InvalidReadingException listing every problem found
     */
    public static void validate(ReadingVector r) {
        if (r == null) {
            throw new InvalidReadingException(List.of("reading is null"));
        }
        List<String> problems = new ArrayList<>();
        if (r.getRegion() == null || r.getRegion().isBlank()) problems.add("region is required");
        if (r.getDataSource() == null) problems.add("data_source is required");
        if (r.getMetric() == null || r.getMetric().isBlank()) problems.add("metric is required");
        if (r.getTimestamp() == null) problems.add("timestamp is required");
        if (r.getValue() == null) {
            problems.add("value is required");
        } else if (!Double.isFinite(r.getValue())) {
            problems.add("value must be finite");
        }
        if (r.getCompanionMetrics() != null) {
            for (Map.Entry<String, Double> e : r.getCompanionMetrics().entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank()) {
                    problems.add("companion metric name is blank");
                } else if (e.getValue() == null || !Double.isFinite(e.getValue())) {
                    problems.add("companion metric " + e.getKey() + " must be finite");
                }
            }
        }
        if (!problems.isEmpty()) {
            throw new InvalidReadingException(problems);
        }
    }
}
