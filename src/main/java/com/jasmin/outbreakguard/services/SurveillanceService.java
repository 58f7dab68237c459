package com.jasmin.outbreakguard.services;

import com.jasmin.outbreakguard.baseline.BaselineStore;
import com.jasmin.outbreakguard.engine.AnomalyDetectionEngine;
import com.jasmin.outbreakguard.exceptions.InvalidReadingException;
import com.jasmin.outbreakguard.models.Anomaly;
import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.DataSource;
import com.jasmin.outbreakguard.models.DetectionReport;
import com.jasmin.outbreakguard.models.EvaluationWindow;
import com.jasmin.outbreakguard.models.IngestionResult;
import com.jasmin.outbreakguard.models.ReadingVector;
import com.jasmin.outbreakguard.models.SeriesKey;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SurveillanceService {
    private final BaselineStore baselineStore;
    private final AnomalyDetectionEngine detectionEngine;
    private final AnomalyPublisher anomalyPublisher;

    /**
     * @return false when the reading was older than its series' retention floor
     * @throws InvalidReadingException when the reading is malformed
     */
    public boolean ingest(ReadingVector reading) {
        return baselineStore.recordReading(reading);
    }

    public IngestionResult ingestBatch(List<ReadingVector> readings) {
        IngestionResult result = new IngestionResult();
        for (int i = 0; i < readings.size(); i++) {
            try {
                if (baselineStore.recordReading(readings.get(i))) {
                    result.setAccepted(result.getAccepted() + 1);
                } else {
                    result.setDropped(result.getDropped() + 1);
                }
            } catch (InvalidReadingException e) {
                log.warn("Batch reading #{} rejected: {}", i, e.getMessage());
                result.getRejected().add(new IngestionResult.Rejection(i, e.getProblems()));
            }
        }
        return result;
    }

    public List<Anomaly> detect(String region, EvaluationWindow window) {
        return report(region, window).getAnomalies();
    }

    public DetectionReport report(String region, EvaluationWindow window) {
        DetectionReport report = detectionEngine.evaluate(region, window);
        anomalyPublisher.publish(report.getAnomalies());
        return report;
    }

    /** @throws com.jasmin.outbreakguard.exceptions.InsufficientDataException below the minimum sample count */
    public Baseline baseline(String region, DataSource source, String metric, Instant asOf) {
        return baselineStore.requireBaseline(SeriesKey.of(region, source, metric), asOf);
    }
}
