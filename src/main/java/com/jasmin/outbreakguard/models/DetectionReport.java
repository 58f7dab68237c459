package com.jasmin.outbreakguard.models;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@AllArgsConstructor
@NoArgsConstructor
public class DetectionReport {
    private String region;
    private EvaluationWindow window;
    private List<Anomaly> anomalies;
    private List<KeyOutcome> outcomes;
}
