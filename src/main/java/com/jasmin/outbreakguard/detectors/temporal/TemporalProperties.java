package com.jasmin.outbreakguard.detectors.temporal;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Data
@Validated
@ConfigurationProperties(prefix = "detectors.temporal")
public class TemporalProperties {

    private boolean enabled = true;

    /** Number of most recent buckets examined, current reading included. */
    @Min(3) private int windowBuckets = 3;

    /** Absolute bucket-over-bucket change (percent) that qualifies a bucket. */
    @DecimalMin("0.0") private double rateThresholdPercent = 50.0;

    /** Qualifying changes in one direction, ending at the current bucket, needed to fire. */
    @Min(2) private int minConsecutive = 2;
}
