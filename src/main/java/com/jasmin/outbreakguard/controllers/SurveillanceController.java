package com.jasmin.outbreakguard.controllers;

import com.jasmin.outbreakguard.exceptions.InsufficientDataException;
import com.jasmin.outbreakguard.exceptions.InvalidReadingException;
import com.jasmin.outbreakguard.models.Anomaly;
import com.jasmin.outbreakguard.models.Baseline;
import com.jasmin.outbreakguard.models.DataSource;
import com.jasmin.outbreakguard.models.DetectionReport;
import com.jasmin.outbreakguard.models.EvaluationWindow;
import com.jasmin.outbreakguard.models.IngestionResult;
import com.jasmin.outbreakguard.models.ReadingVector;
import com.jasmin.outbreakguard.services.SurveillanceService;
import lombok.RequiredArgsConstructor;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RequiredArgsConstructor
@RestController
public class SurveillanceController {

    private final SurveillanceService surveillanceService;

    @PostMapping("/readings")
    public ResponseEntity<Map<String, Object>> ingest(@RequestBody ReadingVector reading) {
        boolean stored = surveillanceService.ingest(reading);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("series", reading.key().toString());
        body.put("stored", stored);
        return ResponseEntity.status(stored ? HttpStatus.CREATED : HttpStatus.OK).body(body);
    }

    @PostMapping("/readings/batch")
    public IngestionResult ingestBatch(@RequestBody List<ReadingVector> readings) {
        return surveillanceService.ingestBatch(readings);
    }

    @GetMapping("/regions/{region}/anomalies")
    public List<Anomaly> anomalies(@PathVariable String region,
                                   @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                   @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return surveillanceService.detect(region, EvaluationWindow.between(from, to));
    }

    @GetMapping("/regions/{region}/detection-report")
    public DetectionReport report(@PathVariable String region,
                                  @RequestParam("from") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant from,
                                  @RequestParam("to") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant to) {
        return surveillanceService.report(region, EvaluationWindow.between(from, to));
    }

    @GetMapping("/baselines")
    public Baseline baseline(@RequestParam String region,
                             @RequestParam("source") String source,
                             @RequestParam String metric,
                             @RequestParam("as_of") @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) Instant asOf) {
        DataSource ds = DataSource.fromCode(source);
        if (ds == null) {
            throw new IllegalArgumentException("Unknown data source: " + source);
        }
        return surveillanceService.baseline(region, ds, metric, asOf);
    }

    @ExceptionHandler(InvalidReadingException.class)
    public ResponseEntity<Map<String, Object>> invalidReading(InvalidReadingException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), Map.of("problems", e.getProblems()));
    }

    @ExceptionHandler(InsufficientDataException.class)
    public ResponseEntity<Map<String, Object>> insufficientData(InsufficientDataException e) {
        return error(HttpStatus.UNPROCESSABLE_ENTITY, e.getMessage(),
                Map.of("sample_count", e.getSampleCount(), "required", e.getRequired()));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> badRequest(IllegalArgumentException e) {
        return error(HttpStatus.BAD_REQUEST, e.getMessage(), Map.of());
    }

    private static ResponseEntity<Map<String, Object>> error(HttpStatus status, String message, Map<String, Object> extra) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", status.value());
        body.put("error", message);
        body.putAll(extra);
        return ResponseEntity.status(status).body(body);
    }
}
