package com.jasmin.outbreakguard.baseline;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@ConfigurationProperties(prefix = "outbreak-guard.baseline")
public class BaselineProperties {

    /** How many days of history to keep per series, measured back from its newest reading. */
    @Min(1) private int retentionDays = 90;

    /** Below this many observations a baseline is reported as insufficient_data. */
    @Min(2) private int minSamples = 7;

    /** Storage backend for metric series: memory | redis. */
    @Pattern(regexp = "memory|redis") private String backend = "memory";

    /** Key prefix used by the redis backend. */
    private String keyPrefix = "og:series";

    public Duration retention() {
        return Duration.ofDays(retentionDays);
    }
}
